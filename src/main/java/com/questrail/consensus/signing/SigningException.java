package com.questrail.consensus.signing;

/**
 * Failure to sign, verify, serialize or load key material.
 */
public final class SigningException extends RuntimeException
{
    public SigningException(String message) {
        super(message);
    }

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
