package io.doat4j.core;

import java.util.List;

/**
 * Which mentions the outbound message is allowed to trigger.
 *
 * <p>{@code parse} lists mention types resolved from the content itself; {@code roles} and
 * {@code users} whitelist explicit ids. {@link #none()} suppresses every mention.
 */
public record MentionScope(
        List<String> parse,
        List<String> roles,
        List<String> users
) {

    public MentionScope {
        parse = parse == null ? null : List.copyOf(parse);
        roles = roles == null ? null : List.copyOf(roles);
        users = users == null ? null : List.copyOf(users);
    }

    public static MentionScope none() {
        return new MentionScope(List.of(), null, null);
    }

    public static MentionScope roles(String roleId) {
        return new MentionScope(null, List.of(roleId), null);
    }

    public static MentionScope users(String userId) {
        return new MentionScope(null, null, List.of(userId));
    }
}
