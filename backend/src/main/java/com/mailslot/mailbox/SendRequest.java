package com.mailslot.mailbox;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of {@code POST /send}.
 *
 * Both fields hold raw JSON values rather than Strings so that a number
 * or object is rejected by validation instead of being silently coerced.
 */
public record SendRequest(
        Object recipient,
        Object message
) {

    /**
     * Reads the two fields out of whatever body arrived. An absent body, or one that is not a JSON
     * object, yields a request with neither field so validation reports the missing recipient.
     */
    public static SendRequest from(JsonNode body) {
        if (body == null || !body.isObject()) {
            return new SendRequest(null, null);
        }
        return new SendRequest(field(body, "recipient"), field(body, "message"));
    }

    private static Object field(JsonNode body, String name) {
        JsonNode value = body.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isTextual() ? value.asText() : value;
    }
}
