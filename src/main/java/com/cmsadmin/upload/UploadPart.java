package com.cmsadmin.upload;

import java.util.Objects;

/**
 * One part of a multi-part upload: its tag, its bytes and the description stored with it.
 */
public final class UploadPart {

    private final String tag;
    private final byte[] data;
    private final String description;

    public UploadPart(String tag, byte[] data, String description) {
        this.tag = Objects.requireNonNull(tag, "tag cannot be null");
        this.data = Objects.requireNonNull(data, "data cannot be null");
        this.description = description;
    }

    public String getTag() {
        return tag;
    }

    public byte[] getData() {
        return data;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return String.format("UploadPart[%s, %d bytes]", tag, data.length);
    }
}
