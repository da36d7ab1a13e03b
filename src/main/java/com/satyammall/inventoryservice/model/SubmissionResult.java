package com.satyammall.inventoryservice.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SubmissionResult {
    SubmissionOutcome outcome;
    int successCount;
    @Singular
    List<String> failedItems;
    String message;
    /** Set when the attachment could not be uploaded; the batch still went through. */
    String uploadWarning;
    String fileUrl;

    public boolean anySucceeded() {
        return successCount > 0;
    }
}
