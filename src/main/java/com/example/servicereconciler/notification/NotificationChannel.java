package com.example.servicereconciler.notification;

import java.io.IOException;

/**
 * One outbound alert channel.
 */
public interface NotificationChannel {

    String name();

    boolean isEnabled();

    void send(String message) throws IOException;
}
