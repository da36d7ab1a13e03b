package com.satyammall.inventoryservice.repository;

import com.satyammall.inventoryservice.model.Attachment;
import com.satyammall.inventoryservice.model.UploadResult;

public interface AttachmentStore {

    /**
     * Stores the file and returns where it can be viewed.
     *
     * @param nameHint used to build a readable object name, usually the batch's item names.
     */
    UploadResult upload(Attachment attachment, String nameHint);
}
