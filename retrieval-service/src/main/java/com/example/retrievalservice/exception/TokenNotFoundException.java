package com.example.retrievalservice.exception;

/**
 * Token string does not exist.
 */
public class TokenNotFoundException extends ResourceNotFoundException {

    public TokenNotFoundException() {
        super("TOKEN_NOT_FOUND", "Download token not found");
    }
}
