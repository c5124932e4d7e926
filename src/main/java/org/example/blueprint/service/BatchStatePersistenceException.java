package org.example.blueprint.service;

/**
 * A state file could not be written or removed. Reading problems never raise this; they load as
 * "no state".
 */
public class BatchStatePersistenceException extends RuntimeException {

    public BatchStatePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
