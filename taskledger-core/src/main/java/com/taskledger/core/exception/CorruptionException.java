package com.taskledger.core.exception;

/**
 * Thrown when a persisted event line cannot be decoded.
 * Read paths convert it into a {@link com.taskledger.core.model.CorruptionReport}
 * instead of letting it escape.
 */
public class CorruptionException extends TaskLedgerException {
    
    public static final String ERROR_CODE = "CORRUPT_EVENT";
    
    public CorruptionException(String message) {
        super(ERROR_CODE, message);
    }
    
    public CorruptionException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
