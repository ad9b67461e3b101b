package io.herald.core.delivery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebhookNotificationChannelTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldPostNotificationAsJson() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        WebhookNotificationChannel channel = new WebhookNotificationChannel(
            "webhook",
            server.url("/hooks/herald").toString(),
            Map.of("Authorization", "Bearer token")
        );

        channel.deliver(new Notification("webhook", "team", "disk is full", "job1", "s1"));

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/hooks/herald");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer token");
        assertThat(request.getBody().readUtf8())
            .contains("\"content\":\"disk is full\"")
            .contains("\"job_id\":\"job1\"")
            .contains("\"session_id\":\"s1\"")
            .contains("\"to\":\"team\"");
    }

    @Test
    void shouldFailOnErrorStatus() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
        WebhookNotificationChannel channel = new WebhookNotificationChannel(
            "webhook",
            server.url("/hooks/herald").toString(),
            Map.of()
        );

        assertThatThrownBy(() -> channel.deliver(new Notification("webhook", "team", "hi", "job1", "s1")))
            .isInstanceOf(ChannelException.class)
            .hasMessageContaining("500");
    }
}
