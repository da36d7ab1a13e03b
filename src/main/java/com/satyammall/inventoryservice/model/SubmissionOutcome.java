package com.satyammall.inventoryservice.model;

public enum SubmissionOutcome {
    SUCCESS,
    PARTIAL,
    FAILURE
}
