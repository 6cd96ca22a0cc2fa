package io.doat4j.core;

/**
 * Output of a {@link JobKind}: the short target text, the allowed mentions and the full content
 * that is actually sent.
 */
public record RenderedMessage(
        String innerText,
        MentionScope mentions,
        String content
) {
}
