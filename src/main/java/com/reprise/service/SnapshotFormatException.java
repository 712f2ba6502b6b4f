package com.reprise.service;

/**
 * Thrown when a snapshot document cannot be read at all.
 * Individual bad entries inside a readable document are skipped instead.
 */
public class SnapshotFormatException extends RuntimeException {

    public SnapshotFormatException(String message) {
        super(message);
    }

    public SnapshotFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
