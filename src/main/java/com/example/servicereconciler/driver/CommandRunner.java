package com.example.servicereconciler.driver;

import java.time.Duration;
import java.util.List;

/**
 * Runs an external command with a hard timeout. Implementations never throw for a command
 * that fails or cannot be launched; that is reported through {@link CommandResult}.
 */
public interface CommandRunner {

    CommandResult run(List<String> argv, Duration timeout);
}
