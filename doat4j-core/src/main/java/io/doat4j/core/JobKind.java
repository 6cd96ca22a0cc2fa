package io.doat4j.core;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Closed set of actions a job can perform. Each constant knows how to render and validate itself.
 */
public enum JobKind {
    PING_ROLE("ping-role") {
        @Override
        public String innerText(Job job) {
            return "<@&" + job.subject() + ">";
        }

        @Override
        public MentionScope mentions(Job job) {
            return MentionScope.roles(job.subject());
        }

        @Override
        public String outerText(Job job, String innerText) {
            return innerText + " (scheduled role ping for <t:" + job.dueUnix() + ":F>)";
        }

        @Override
        public Optional<String> validateSubject(String subject) {
            return SNOWFLAKE.matcher(subject).matches() ? Optional.empty() : Optional.of("Invalid role.");
        }
    },
    PING_USER("ping-user") {
        @Override
        public String innerText(Job job) {
            return "<@" + job.subject() + ">";
        }

        @Override
        public MentionScope mentions(Job job) {
            return MentionScope.users(job.subject());
        }

        @Override
        public String outerText(Job job, String innerText) {
            return innerText + " (scheduled user ping for <t:" + job.dueUnix() + ":F>)";
        }

        @Override
        public Optional<String> validateSubject(String subject) {
            return SNOWFLAKE.matcher(subject).matches() ? Optional.empty() : Optional.of("Invalid user.");
        }
    },
    CHANNEL_MESSAGE("channel-message") {
        @Override
        public String innerText(Job job) {
            return job.subject();
        }

        @Override
        public MentionScope mentions(Job job) {
            return MentionScope.none();
        }

        @Override
        public String outerText(Job job, String innerText) {
            return innerText;
        }

        @Override
        public Optional<String> validateSubject(String subject) {
            if (subject.isEmpty()) {
                return Optional.of("Message cannot be empty.");
            }
            if (subject.length() > MAX_MESSAGE_LENGTH) {
                return Optional.of("Message too long (max " + MAX_MESSAGE_LENGTH + " chars).");
            }
            return Optional.empty();
        }
    };

    public static final int MAX_MESSAGE_LENGTH = 2000;

    private static final Pattern SNOWFLAKE = Pattern.compile("^\\d{5,30}$");

    private final String key;

    JobKind(String key) {
        this.key = key;
    }

    /**
     * Persisted dispatch key (e.g. "ping-role").
     */
    public String key() {
        return key;
    }

    public abstract String innerText(Job job);

    public abstract MentionScope mentions(Job job);

    public abstract String outerText(Job job, String innerText);

    /**
     * @return the user-facing rejection message, or empty when the subject is acceptable
     */
    public abstract Optional<String> validateSubject(String subject);

    public RenderedMessage render(Job job) {
        String inner = innerText(job);
        return new RenderedMessage(inner, mentions(job), outerText(job, inner));
    }

    public static Optional<JobKind> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (JobKind kind : values()) {
            if (kind.key.equals(key)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
