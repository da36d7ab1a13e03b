package com.satyammall.inventoryservice.service;

import com.satyammall.inventoryservice.dto.response.SubmissionResponse;
import com.satyammall.inventoryservice.model.ProgressSignal;
import com.satyammall.inventoryservice.model.SubmissionForm;
import com.satyammall.inventoryservice.model.SubmissionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a batch through the pipeline and refreshes the inventory snapshot afterwards when
 * anything was recorded.
 */
@Service
@RequiredArgsConstructor
public class TransactionService {

    private final SubmissionPipeline submissionPipeline;
    private final InventoryService inventoryService;

    public SubmissionResponse record(SubmissionForm form) {
        List<ProgressSignal> progress = new ArrayList<>();
        SubmissionResult result = submissionPipeline.submit(form, new SubmissionListener() {
            @Override
            public void onProgress(ProgressSignal signal) {
                progress.add(signal);
            }

            @Override
            public void onRecorded(SubmissionResult recorded) {
                inventoryService.invalidate();
            }
        });
        return SubmissionResponse.from(result, form, progress);
    }
}
