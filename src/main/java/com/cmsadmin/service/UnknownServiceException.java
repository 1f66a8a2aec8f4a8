package com.cmsadmin.service;

/**
 * Thrown when a service name has no configured shards,
 * or when a shard index is outside the configured range.
 */
public class UnknownServiceException extends Exception {
    private static final long serialVersionUID = 1L;

    public UnknownServiceException(String message) {
        super(message);
    }
}
