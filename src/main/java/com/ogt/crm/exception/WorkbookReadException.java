package com.ogt.crm.exception;

public class WorkbookReadException extends RuntimeException {
    public WorkbookReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
