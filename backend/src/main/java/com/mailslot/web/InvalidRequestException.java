package com.mailslot.web;

/**
 * Client input rejected before it reaches the mailbox. Rendered as HTTP 400 with
 * {@code error} as the short label and the exception message as the detail.
 */
public class InvalidRequestException extends RuntimeException {

    private final String error;

    public InvalidRequestException(String error, String message) {
        super(message);
        this.error = error;
    }

    public String getError() {
        return error;
    }
}
