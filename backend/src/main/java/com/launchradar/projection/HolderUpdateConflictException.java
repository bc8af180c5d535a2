package com.launchradar.projection;

/**
 * A holder balance kept changing underneath every compare-and-set attempt.
 */
public class HolderUpdateConflictException extends RuntimeException {

    public HolderUpdateConflictException(String message) {
        super(message);
    }
}
