package com.eainde.breakdown.exception;

/**
 * Root of the breakdown error taxonomy. All subtypes are unchecked; callers
 * decide per type whether the failure is run-fatal or scene-local.
 */
public class BreakdownException extends RuntimeException {

    public BreakdownException(String message) {
        super(message);
    }

    public BreakdownException(String message, Throwable cause) {
        super(message, cause);
    }
}
