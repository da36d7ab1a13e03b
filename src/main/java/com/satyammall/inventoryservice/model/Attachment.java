package com.satyammall.inventoryservice.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * An invoice or photo attached to a receive batch.
 */
@Getter
@AllArgsConstructor
public class Attachment {
    private final String fileName;
    private final String contentType;
    private final byte[] content;

    public long getSize() {
        return content == null ? 0 : content.length;
    }
}
