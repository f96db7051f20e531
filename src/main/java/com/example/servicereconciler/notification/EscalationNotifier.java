package com.example.servicereconciler.notification;

import com.example.servicereconciler.domain.HealthStatus;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Best-effort outbound alerts. Calls return immediately: messages go to a small bounded queue
 * drained by one sender thread, a full queue drops the message with a warning, and send
 * failures are logged and never retried.
 * <p>
 * De-duplication is not done here; the reconciler calls {@link #escalate} once per failure streak.
 */
@Slf4j
@Service
public class EscalationNotifier {

    private final List<NotificationChannel> channels;
    private final TaskExecutor notificationExecutor;
    private final MeterRegistry meterRegistry;

    public EscalationNotifier(List<NotificationChannel> channels,
                              @Qualifier("notificationExecutor") TaskExecutor notificationExecutor,
                              MeterRegistry meterRegistry) {
        this.channels = channels;
        this.notificationExecutor = notificationExecutor;
        this.meterRegistry = meterRegistry;
    }

    public void escalate(String serviceId, HealthStatus status, String detail) {
        meterRegistry.counter("reconciler.escalation.total", "service", serviceId).increment();
        String message = String.format(":rotating_light: *ESCALATION* service `%s` is %s and automatic repair "
                + "is not fixing it.\n%s", serviceId, status, detail);
        log.warn("Escalating {} ({}): {}", serviceId, status, detail);
        dispatch(serviceId, message);
    }

    public void recovered(String serviceId, String detail) {
        String message = String.format(":white_check_mark: service `%s` recovered.\n%s", serviceId, detail);
        log.info("Service {} recovered after escalation: {}", serviceId, detail);
        dispatch(serviceId, message);
    }

    private void dispatch(String serviceId, String message) {
        List<NotificationChannel> enabled = channels.stream().filter(NotificationChannel::isEnabled).toList();
        if (enabled.isEmpty()) {
            log.info("No notification channel enabled; message for {} logged only", serviceId);
            return;
        }
        try {
            notificationExecutor.execute(() -> sendAll(enabled, serviceId, message));
        } catch (TaskRejectedException e) {
            log.warn("Notification queue full, dropping message for {}", serviceId);
        }
    }

    private void sendAll(List<NotificationChannel> enabled, String serviceId, String message) {
        for (NotificationChannel channel : enabled) {
            try {
                channel.send(message);
                log.info("{} notification sent for {}", channel.name(), serviceId);
            } catch (IOException | RuntimeException e) {
                log.error("Failed to send {} notification for {}: {}", channel.name(), serviceId, e.getMessage());
            }
        }
    }
}
