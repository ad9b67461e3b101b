package io.herald.core.delivery;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public final class WebhookNotificationChannel implements NotificationChannel {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String name;
    private final HttpUrl url;
    private final Map<String, String> headers;
    private final OkHttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();

    public WebhookNotificationChannel(String name, String url, Map<String, String> headers) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.url = HttpUrl.get(Objects.requireNonNull(url, "url must not be null"));
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ofSeconds(30))
            .writeTimeout(Duration.ofSeconds(10))
            .build();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void deliver(Notification notification) throws ChannelException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", notification.channel());
        payload.put("to", notification.to());
        payload.put("content", notification.content());
        payload.put("job_id", notification.jobId());
        payload.put("session_id", notification.sessionId());

        try {
            Request.Builder builder = new Request.Builder()
                .url(url)
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
                .header("Content-Type", "application/json");
            for (Map.Entry<String, String> header : headers.entrySet()) {
                builder.header(header.getKey(), header.getValue());
            }
            try (Response response = client.newCall(builder.build()).execute()) {
                if (!response.isSuccessful()) {
                    String body = response.body() == null ? "" : response.body().string();
                    throw new ChannelException("Webhook " + name + " returned HTTP " + response.code() + " " + body);
                }
            }
        } catch (ChannelException e) {
            throw e;
        } catch (IOException e) {
            throw new ChannelException("Webhook " + name + " failed: " + e.getMessage(), e);
        }
    }
}
