package com.satyammall.inventoryservice.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class UploadResult {
    boolean success;
    String fileUrl;
    String error;

    public static UploadResult uploaded(String fileUrl) {
        return new UploadResult(true, fileUrl, null);
    }

    public static UploadResult failed(String error) {
        return new UploadResult(false, null, error);
    }
}
