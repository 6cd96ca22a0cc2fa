package io.doat4j.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobKindTest {

    @Test
    void rolePingMentionsOnlyThatRole() {
        Job job = Job.of("id", "g", "c", JobKind.PING_ROLE, "55555", 1_800_000_000L, false, null);

        RenderedMessage message = JobKind.PING_ROLE.render(job);

        assertEquals("<@&55555>", message.innerText());
        assertEquals("<@&55555> (scheduled role ping for <t:1800000000:F>)", message.content());
        assertEquals(List.of("55555"), message.mentions().roles());
    }

    @Test
    void userPingMentionsOnlyThatUser() {
        Job job = Job.of("id", "g", "c", JobKind.PING_USER, "66666", 1_800_000_000L, false, null);

        RenderedMessage message = job.resolveKind().orElseThrow().render(job);

        assertEquals("<@66666> (scheduled user ping for <t:1800000000:F>)", message.content());
        assertEquals(MentionScope.users("66666"), message.mentions());
    }

    @Test
    void channelMessageSuppressesMentions() {
        Job job = Job.of("id", "g", "c", JobKind.CHANNEL_MESSAGE, "hello @everyone", 1L, false, null);

        RenderedMessage message = JobKind.CHANNEL_MESSAGE.render(job);

        assertEquals("hello @everyone", message.content());
        assertEquals(List.of(), message.mentions().parse());
    }

    @Test
    void keysResolveBothWays() {
        for (JobKind kind : JobKind.values()) {
            assertEquals(Optional.of(kind), JobKind.fromKey(kind.key()));
        }
        assertTrue(JobKind.fromKey("PING_ROLE").isEmpty());
        assertTrue(JobKind.fromKey(null).isEmpty());
    }

    @Test
    void messageLengthLimitIsInclusive() {
        assertTrue(JobKind.CHANNEL_MESSAGE.validateSubject("x".repeat(JobKind.MAX_MESSAGE_LENGTH)).isEmpty());
        assertTrue(JobKind.CHANNEL_MESSAGE.validateSubject("x".repeat(JobKind.MAX_MESSAGE_LENGTH + 1)).isPresent());
        assertTrue(JobKind.PING_ROLE.validateSubject("1".repeat(30)).isEmpty());
        assertTrue(JobKind.PING_ROLE.validateSubject("1".repeat(31)).isPresent());
    }
}
