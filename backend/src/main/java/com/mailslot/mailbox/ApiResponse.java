package com.mailslot.mailbox;

/**
 * Success envelope shared by {@code /send} and {@code /recv}.
 */
public record ApiResponse<T>(
        boolean success,
        String message,
        T data
) {

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, message, data);
    }
}
