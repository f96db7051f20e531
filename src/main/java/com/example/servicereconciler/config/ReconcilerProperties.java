package com.example.servicereconciler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Central configuration for the reconciler.
 * Maps to the 'reconciler' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "reconciler")
public class ReconcilerProperties {

    /** Spring resource location of the service registry YAML. */
    private String registryFile = "classpath:services.yml";

    private SchedulingConfig scheduling = new SchedulingConfig();
    private TickConfig tick = new TickConfig();
    private ProbeConfig probe = new ProbeConfig();
    private ActionConfig action = new ActionConfig();
    private BudgetConfig budget = new BudgetConfig();
    private EscalationConfig escalation = new EscalationConfig();
    private AuditConfig audit = new AuditConfig();
    private NotificationConfig notifications = new NotificationConfig();
    private SshConfig ssh = new SshConfig();

    @Data
    public static class SchedulingConfig {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(120);
        /** Delay of the first tick after startup; zero runs it at boot. */
        private Duration initialDelay = Duration.ZERO;
    }

    @Data
    public static class TickConfig {
        /** Wall-clock budget of one tick; remaining waves are abandoned past it. */
        private Duration budget = Duration.ofMinutes(2);
        private int probeConcurrency = 4;
    }

    @Data
    public static class ProbeConfig {
        private Duration defaultTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class ActionConfig {
        private Duration maxWait = Duration.ofSeconds(30);
        private Duration pollInterval = Duration.ofSeconds(2);
    }

    @Data
    public static class BudgetConfig {
        private int maxActions = 5;
        private Duration window = Duration.ofMinutes(60);
    }

    @Data
    public static class EscalationConfig {
        private int escalateAfter = 3;
        private boolean notifyOnRecovery = true;
    }

    @Data
    public static class AuditConfig {
        private String file = "logs/reconciler-audit.jsonl";
    }

    @Data
    public static class NotificationConfig {
        private int queueCapacity = 16;
        private Duration timeout = Duration.ofSeconds(10);
        private SlackConfig slack = new SlackConfig();
        private TelegramConfig telegram = new TelegramConfig();

        @Data
        public static class SlackConfig {
            private boolean enabled = false;
            private String webhookUrl = "";
        }

        @Data
        public static class TelegramConfig {
            private boolean enabled = false;
            private String botToken = "";
            private String chatId = "";
            private String apiBaseUrl = "https://api.telegram.org";
        }
    }

    @Data
    public static class SshConfig {
        private String strictHostKeyChecking = "no";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private String defaultIdentityFile = System.getProperty("user.home") + "/.ssh/id_rsa";
    }
}
