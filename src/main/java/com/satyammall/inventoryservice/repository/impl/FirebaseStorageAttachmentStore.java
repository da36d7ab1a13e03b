package com.satyammall.inventoryservice.repository.impl;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.Bucket;
import com.google.cloud.storage.StorageException;
import com.satyammall.inventoryservice.model.Attachment;
import com.satyammall.inventoryservice.model.UploadResult;
import com.satyammall.inventoryservice.repository.AttachmentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Keeps receive invoices and photos in the Firebase Storage bucket.
 */
@Slf4j
@RequiredArgsConstructor
public class FirebaseStorageAttachmentStore implements AttachmentStore {

    private final Bucket bucket;
    private final String folder;
    private final Clock clock;

    @Override
    public UploadResult upload(Attachment attachment, String nameHint) {
        String objectName = folder + "/" + sanitize(nameHint) + "_" + clock.millis() + "_" + sanitize(attachment.getFileName());
        try {
            Blob blob = bucket.create(objectName, attachment.getContent(), attachment.getContentType());
            log.info("Uploaded attachment {} ({} bytes)", objectName, attachment.getSize());
            return UploadResult.uploaded(blob.getMediaLink());
        } catch (StorageException e) {
            log.warn("Attachment upload failed for {}", objectName, e);
            return UploadResult.failed("File upload failed: " + e.getMessage());
        }
    }

    private static String sanitize(String value) {
        if (value == null || value.isBlank()) {
            return "file";
        }
        return value.trim().replaceAll("[^A-Za-z0-9._-]+", "_");
    }
}
