package com.example.servicereconciler.driver;

/**
 * Exit status and merged stdout/stderr of an external command.
 */
public record CommandResult(int exitCode, String output, boolean timedOut) {

    public static final int TIMEOUT_EXIT = -1;
    public static final int LAUNCH_FAILURE_EXIT = -2;

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    public String describe() {
        if (timedOut) return "timed out";
        String trimmed = output == null ? "" : output.trim();
        if (trimmed.length() > 200) {
            trimmed = trimmed.substring(0, 200) + "...";
        }
        return trimmed.isEmpty() ? "exit " + exitCode : "exit " + exitCode + ": " + trimmed;
    }
}
