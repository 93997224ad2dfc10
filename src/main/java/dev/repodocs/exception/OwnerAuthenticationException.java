package dev.repodocs.exception;

public class OwnerAuthenticationException extends RuntimeException {
    public OwnerAuthenticationException(String message) {
        super(message);
    }
}
