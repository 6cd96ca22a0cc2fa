package io.doat4j;

import io.doat4j.core.MentionScope;
import io.doat4j.core.SendResult;

/**
 * Outbound channel used to deliver a rendered job.
 *
 * <p>Anything other than {@link SendResult#ok()} is treated as a transient delivery failure and
 * the wake is retried later.
 */
public interface Messenger {

    SendResult send(String channelId, String content, MentionScope mentions);
}
