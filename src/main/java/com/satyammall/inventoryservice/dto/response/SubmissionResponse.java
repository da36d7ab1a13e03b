package com.satyammall.inventoryservice.dto.response;

import com.satyammall.inventoryservice.model.CommonFields;
import com.satyammall.inventoryservice.model.LineItem;
import com.satyammall.inventoryservice.model.ProgressSignal;
import com.satyammall.inventoryservice.model.SubmissionForm;
import com.satyammall.inventoryservice.model.SubmissionOutcome;
import com.satyammall.inventoryservice.model.SubmissionResult;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a batch plus the form as it should look afterwards: blank on success, only the
 * failed rows on a partial result, untouched when nothing was saved.
 */
@Data
@Builder
public class SubmissionResponse {
    private SubmissionOutcome outcome;
    private String message;
    private int successCount;
    private List<String> failedItems;
    private String uploadWarning;
    private List<ProgressSignal> progress;
    private List<LineItem> items;
    private CommonFields commonFields;

    public static SubmissionResponse from(SubmissionResult result, SubmissionForm form, List<ProgressSignal> progress) {
        return SubmissionResponse.builder()
                .outcome(result.getOutcome())
                .message(result.getMessage())
                .successCount(result.getSuccessCount())
                .failedItems(result.getFailedItems())
                .uploadWarning(result.getUploadWarning())
                .progress(new ArrayList<>(progress))
                .items(new ArrayList<>(form.getItems()))
                .commonFields(form.getCommonFields())
                .build();
    }
}
