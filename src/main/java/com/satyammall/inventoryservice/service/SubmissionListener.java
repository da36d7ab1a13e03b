package com.satyammall.inventoryservice.service;

import com.satyammall.inventoryservice.model.ProgressSignal;
import com.satyammall.inventoryservice.model.SubmissionResult;

/**
 * Observer for a running batch.
 */
public interface SubmissionListener {

    SubmissionListener NONE = new SubmissionListener() {
    };

    default void onProgress(ProgressSignal progress) {
    }

    /**
     * Called once a batch has recorded at least one line. Never called when every line failed.
     */
    default void onRecorded(SubmissionResult result) {
    }
}
