package com.eainde.breakdown.exception;

/**
 * Raised when a document contains no recognisable scene marker. Fatal for the run.
 */
public class NoScenesFoundException extends BreakdownException {

    public NoScenesFoundException(int documentLength) {
        super("No scene markers found in document of " + documentLength + " characters");
    }
}
