package com.reprise.service;

/**
 * Thrown when a settings update carries an out-of-range value.
 */
public class InvalidSettingsException extends IllegalArgumentException {

    public InvalidSettingsException(String message) {
        super(message);
    }
}
