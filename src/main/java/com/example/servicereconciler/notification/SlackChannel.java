package com.example.servicereconciler.notification;

import com.example.servicereconciler.config.ReconcilerProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * Slack incoming-webhook channel.
 */
@Component
@RequiredArgsConstructor
public class SlackChannel implements NotificationChannel {

    private static final MediaType JSON = MediaType.get("application/json");

    private final ReconcilerProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return "slack";
    }

    @Override
    public boolean isEnabled() {
        var slack = properties.getNotifications().getSlack();
        return slack.isEnabled() && slack.getWebhookUrl() != null && !slack.getWebhookUrl().isBlank();
    }

    @Override
    public void send(String message) throws IOException {
        Map<String, Object> payload = Map.of(
                "text", message,
                "username", "Service Reconciler",
                "icon_emoji", ":robot_face:"
        );
        Request request = new Request.Builder()
                .url(properties.getNotifications().getSlack().getWebhookUrl())
                .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                .build();
        try (Response response = client().newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Slack webhook returned HTTP " + response.code());
            }
        }
    }

    private OkHttpClient client() {
        return httpClient.newBuilder()
                .callTimeout(properties.getNotifications().getTimeout())
                .build();
    }
}
