package com.example.memocache.core;

/**
 * The remote tier could not be reached in time. Checked on purpose: every caller of the remote
 * client has to turn it into a miss or a dropped write.
 */
public class BackendUnavailableException extends Exception {

    private final String operation;
    private final String key;

    public BackendUnavailableException(String operation, String key, String reason, Throwable cause) {
        super(operation + " " + key + " failed: " + reason, cause);
        this.operation = operation;
        this.key = key;
    }

    public String getOperation() {
        return operation;
    }

    public String getKey() {
        return key;
    }
}
