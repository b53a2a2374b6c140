package com.mailslot.web;

public record ErrorResponse(
        String error,
        String message
) {}
