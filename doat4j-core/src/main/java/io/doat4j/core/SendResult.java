package io.doat4j.core;

/**
 * Outcome of a single {@code Messenger.send}.
 */
public record SendResult(
        boolean ok,
        int statusCode,
        String body
) {

    public static SendResult success(int statusCode) {
        return new SendResult(true, statusCode, null);
    }

    public static SendResult failure(int statusCode, String body) {
        return new SendResult(false, statusCode, body);
    }
}
