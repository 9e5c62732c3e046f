package com.ogt.crm.exception;

/**
 * Se intentó iniciar una migración con otra en curso.
 */
public class MigrationConflictException extends RuntimeException {
    public MigrationConflictException(String message) {
        super(message);
    }
}
