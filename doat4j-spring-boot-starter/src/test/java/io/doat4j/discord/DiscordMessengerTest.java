package io.doat4j.discord;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.doat4j.core.MentionScope;
import io.doat4j.core.SendResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DiscordMessengerTest {

    private static final String BASE = "https://discord.test/api/v10";

    private MockRestServiceServer server;
    private DiscordMessenger messenger;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();
        messenger = new DiscordMessenger(builder.build(), new ObjectMapper(), "token-1");
    }

    @Test
    void shouldPostContentWithRoleWhitelist() {
        server.expect(requestTo(BASE + "/channels/100/messages"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bot token-1"))
                .andExpect(content().json("{\"content\":\"<@&12345> hi\",\"allowed_mentions\":{\"roles\":[\"12345\"]}}", true))
                .andRespond(withSuccess("{\"id\":\"1\"}", MediaType.APPLICATION_JSON));

        SendResult result = messenger.send("100", "<@&12345> hi", MentionScope.roles("12345"));

        assertThat(result.ok()).isTrue();
        assertThat(result.statusCode()).isEqualTo(200);
        server.verify();
    }

    @Test
    void shouldSuppressAllMentionsForPlainMessages() {
        server.expect(requestTo(BASE + "/channels/100/messages"))
                .andExpect(content().json("{\"content\":\"@everyone hello\",\"allowed_mentions\":{\"parse\":[]}}", true))
                .andRespond(withSuccess());

        assertThat(messenger.send("100", "@everyone hello", MentionScope.none()).ok()).isTrue();
        server.verify();
    }

    @Test
    void nonSuccessStatusShouldBeFailureWithBody() {
        server.expect(requestTo(BASE + "/channels/100/messages"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"retry_after\":1.5}"));

        SendResult result = messenger.send("100", "hi", MentionScope.users("777777"));

        assertThat(result.ok()).isFalse();
        assertThat(result.statusCode()).isEqualTo(429);
        assertThat(result.body()).contains("retry_after");
    }

    @Test
    void blankTokenShouldBeRejected() {
        assertThatThrownBy(() -> new DiscordMessenger(RestClient.create(), new ObjectMapper(), " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
