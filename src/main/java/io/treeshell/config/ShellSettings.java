package io.treeshell.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.treeshell.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public record ShellSettings(
        long callableTimeoutMs,
        int goldenFailureThreshold,
        int maxChainSteps,
        int maxAliasDepth,
        List<ScriptCallableSpec> scriptCallables
) {
    public static final long DEFAULT_CALLABLE_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_GOLDEN_FAILURE_THRESHOLD = 3;
    public static final int DEFAULT_MAX_CHAIN_STEPS = 32;
    public static final int DEFAULT_MAX_ALIAS_DEPTH = 8;

    public static ShellSettings defaults() {
        return new ShellSettings(
                DEFAULT_CALLABLE_TIMEOUT_MS,
                DEFAULT_GOLDEN_FAILURE_THRESHOLD,
                DEFAULT_MAX_CHAIN_STEPS,
                DEFAULT_MAX_ALIAS_DEPTH,
                List.of()
        );
    }

    public static ShellSettings load(Path file) {
        ShellSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load shell settings: " + file, e);
        }
    }

    static ShellSettings fromFile(SettingsFile file, ShellSettings defaults) {
        if (file == null) {
            return defaults;
        }
        List<ScriptCallableSpec> scripts = new ArrayList<>();
        if (file.scriptCallables() != null) {
            for (ScriptCallableSpec spec : file.scriptCallables()) {
                if (spec == null || spec.name() == null || spec.name().isBlank()
                        || spec.command() == null || spec.command().isEmpty()) {
                    continue;
                }
                scripts.add(spec);
            }
        }
        return new ShellSettings(
                positiveOr(file.callableTimeoutMs(), defaults.callableTimeoutMs()),
                (int) positiveOr(file.goldenFailureThreshold(), defaults.goldenFailureThreshold()),
                (int) positiveOr(file.maxChainSteps(), defaults.maxChainSteps()),
                (int) positiveOr(file.maxAliasDepth(), defaults.maxAliasDepth()),
                List.copyOf(scripts)
        );
    }

    private static long positiveOr(Number value, long fallback) {
        if (value == null || value.longValue() <= 0L) {
            return fallback;
        }
        return value.longValue();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SettingsFile(
            Long callableTimeoutMs,
            Integer goldenFailureThreshold,
            Integer maxChainSteps,
            Integer maxAliasDepth,
            List<ScriptCallableSpec> scriptCallables
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScriptCallableSpec(
            String name,
            List<String> command,
            Long timeoutMs
    ) {
    }
}
