package com.example.servicereconciler.driver;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link CommandRunner} that answers from a script keyed by the full command line. A key with
 * several queued results hands them out in order and repeats the last one. Unscripted commands
 * succeed with no output.
 */
public class ScriptedCommandRunner implements CommandRunner {

    private final Map<String, Deque<CommandResult>> script = new HashMap<>();
    private final List<String> executed = new CopyOnWriteArrayList<>();

    public synchronized ScriptedCommandRunner on(String commandLine, CommandResult... results) {
        script.put(commandLine, new ArrayDeque<>(List.of(results)));
        return this;
    }

    public static CommandResult ok(String output) {
        return new CommandResult(0, output, false);
    }

    public static CommandResult exit(int code) {
        return new CommandResult(code, "", false);
    }

    @Override
    public synchronized CommandResult run(List<String> argv, Duration timeout) {
        String line = String.join(" ", argv);
        executed.add(line);
        Deque<CommandResult> queued = script.get(line);
        if (queued == null || queued.isEmpty()) {
            return ok("");
        }
        return queued.size() > 1 ? queued.removeFirst() : queued.peekFirst();
    }

    public List<String> executed() {
        return new ArrayList<>(executed);
    }

    public long count(String commandLine) {
        return executed.stream().filter(commandLine::equals).count();
    }
}
