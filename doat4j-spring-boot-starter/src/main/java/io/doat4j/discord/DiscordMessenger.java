package io.doat4j.discord;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.doat4j.Messenger;
import io.doat4j.core.MentionScope;
import io.doat4j.core.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link Messenger} that creates a message in a Discord channel through the REST API.
 *
 * <p>Any non-2xx answer is returned as a failed {@link SendResult} carrying the status and body.
 * Transport errors propagate as {@link org.springframework.web.client.RestClientException}.
 */
public class DiscordMessenger implements Messenger {
    private static final Logger log = LoggerFactory.getLogger(DiscordMessenger.class);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String botToken;

    /**
     * @param restClient client whose base url points at the Discord API (e.g. {@code https://discord.com/api/v10})
     */
    public DiscordMessenger(RestClient restClient, ObjectMapper objectMapper, String botToken) {
        this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        if (botToken == null || botToken.isBlank()) {
            throw new IllegalArgumentException("botToken must not be blank");
        }
        this.botToken = botToken;
    }

    @Override
    public SendResult send(String channelId, String content, MentionScope mentions) {
        Objects.requireNonNull(channelId, "channelId must not be null");
        String body = toJson(content, mentions == null ? MentionScope.none() : mentions);

        return restClient.post()
                .uri("/channels/{channelId}/messages", channelId)
                .header(HttpHeaders.AUTHORIZATION, "Bot " + botToken)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .exchange((request, response) -> {
                    int status = response.getStatusCode().value();
                    if (response.getStatusCode().is2xxSuccessful()) {
                        return SendResult.success(status);
                    }
                    String text = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.debug("discord message rejected channelId={} status={} body={}", channelId, status, text);
                    return SendResult.failure(status, text);
                });
    }

    String toJson(String content, MentionScope mentions) {
        Map<String, Object> allowed = new LinkedHashMap<>();
        if (mentions.parse() != null) {
            allowed.put("parse", mentions.parse());
        }
        if (mentions.roles() != null) {
            allowed.put("roles", mentions.roles());
        }
        if (mentions.users() != null) {
            allowed.put("users", mentions.users());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("content", content);
        payload.put("allowed_mentions", allowed);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize discord message", e);
        }
    }
}
