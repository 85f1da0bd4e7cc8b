package com.taskledger.core.exception;

/**
 * Thrown when the underlying storage is unreachable or a write failed.
 * Never retried automatically.
 */
public class StorageException extends TaskLedgerException {
    
    public static final String ERROR_CODE = "STORAGE_FAILURE";
    
    public StorageException(String message) {
        super(ERROR_CODE, message);
    }
    
    public StorageException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
