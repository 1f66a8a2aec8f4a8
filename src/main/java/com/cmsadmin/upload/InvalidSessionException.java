package com.cmsadmin.upload;

/**
 * Protocol error on an upload session: empty tag set, unexpected tag or a tag reported twice.
 * Always a bug in the caller, never a runtime condition to recover from.
 */
public class InvalidSessionException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public InvalidSessionException(String message) {
        super(message);
    }
}
