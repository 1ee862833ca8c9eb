/* (C)2026 */
package com.ammann.imputation.exception;

/**
 * Base unchecked exception for all errors raised by the imputation engine.
 *
 * <p>Subclasses separate transient store failures, numerical training failures and
 * invalid requests. Expected outcomes (insufficient history, missing model, missing
 * context, rejected model) are result statuses and never thrown.
 */
public class ImputationException extends RuntimeException
{
    public ImputationException(String message, Throwable cause) {
        super(message, cause);
    }
    public ImputationException(String message) {
        super(message);
    }

    public ImputationException(Throwable cause) {
        super(cause);
    }
}
