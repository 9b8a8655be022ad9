package com.eainde.breakdown.exception;

/**
 * The knowledge-base resource could not be read or parsed. Raised at startup.
 */
public class KnowledgeBaseException extends BreakdownException {

    public KnowledgeBaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
