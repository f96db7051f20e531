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
 * Telegram bot channel ({@code sendMessage} to one chat).
 */
@Component
@RequiredArgsConstructor
public class TelegramChannel implements NotificationChannel {

    private static final MediaType JSON = MediaType.get("application/json");

    private final ReconcilerProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return "telegram";
    }

    @Override
    public boolean isEnabled() {
        var telegram = properties.getNotifications().getTelegram();
        return telegram.isEnabled()
                && telegram.getBotToken() != null && !telegram.getBotToken().isBlank()
                && telegram.getChatId() != null && !telegram.getChatId().isBlank();
    }

    @Override
    public void send(String message) throws IOException {
        var telegram = properties.getNotifications().getTelegram();
        String base = telegram.getApiBaseUrl().endsWith("/")
                ? telegram.getApiBaseUrl().substring(0, telegram.getApiBaseUrl().length() - 1)
                : telegram.getApiBaseUrl();
        Map<String, Object> payload = Map.of(
                "chat_id", telegram.getChatId(),
                "text", message,
                "disable_web_page_preview", true
        );
        Request request = new Request.Builder()
                .url(base + "/bot" + telegram.getBotToken() + "/sendMessage")
                .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                .build();
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(properties.getNotifications().getTimeout())
                .build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Telegram API returned HTTP " + response.code());
            }
        }
    }
}
