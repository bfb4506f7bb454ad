package io.treeshell.exec.builtin;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.treeshell.exec.CallableContext;
import io.treeshell.exec.CallableResult;
import io.treeshell.exec.ShellCallable;
import io.treeshell.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command with the arguments as JSON on stdin. Output that parses as JSON is
 * returned as JSON, anything else as text.
 */
public final class ScriptCallable implements ShellCallable {
    private static final int MAX_ERROR_CHARS = 512;
    private static final long OUTPUT_DRAIN_SECONDS = 5L;

    private final String name;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptCallable(String name, List<String> command, long timeoutMs) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("script callable name cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script callable command cannot be empty: " + name);
        }
        this.name = name;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CallableResult call(CallableContext context) throws InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return CallableResult.fail("script spawn failed: " + e.getMessage());
        }

        // drained concurrently so a full pipe cannot stall the script
        FutureTask<byte[]> output = new FutureTask<>(() -> process.getInputStream().readAllBytes());
        Thread reader = new Thread(output, "treeshell-script-" + name);
        reader.setDaemon(true);
        reader.start();

        try {
            process.getOutputStream().write(Jsons.toCompactJson(context.args()).getBytes(StandardCharsets.UTF_8));
            process.getOutputStream().flush();
            process.getOutputStream().close();

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return CallableResult.fail("script timeout after " + Duration.ofMillis(timeoutMs));
            }

            String combined = new String(output.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS), StandardCharsets.UTF_8).strip();
            if (process.exitValue() != 0) {
                return CallableResult.fail("script exit=" + process.exitValue() + " output=" + truncate(combined));
            }
            if (combined.isEmpty()) {
                return CallableResult.ok(combined);
            }
            try {
                return CallableResult.ok(Jsons.mapper().readTree(combined));
            } catch (JsonProcessingException e) {
                return CallableResult.ok(combined);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } catch (IOException e) {
            process.destroyForcibly();
            return CallableResult.fail("script execution failed: " + e.getMessage());
        } catch (ExecutionException e) {
            return CallableResult.fail("script output could not be read: " + e.getCause().getMessage());
        } catch (TimeoutException e) {
            process.destroyForcibly();
            return CallableResult.fail("script output still open " + OUTPUT_DRAIN_SECONDS + "s after exit");
        } finally {
            output.cancel(true);
        }
    }

    private String truncate(String raw) {
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
