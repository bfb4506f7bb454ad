package io.treeshell.exec;

import io.treeshell.config.ShellSettings;
import io.treeshell.exec.builtin.ArithmeticCallable;
import io.treeshell.exec.builtin.EchoCallable;
import io.treeshell.exec.builtin.FailCallable;
import io.treeshell.exec.builtin.ScriptCallable;
import io.treeshell.exec.builtin.SleepCallable;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public final class CallableRegistry {
    private final Map<String, ShellCallable> callables = new ConcurrentHashMap<>();

    /**
     * Registry holding the built-in callables and the script callables named in settings.
     */
    public static CallableRegistry withDefaults(ShellSettings settings) {
        CallableRegistry registry = new CallableRegistry();
        registry.register(new EchoCallable());
        registry.register(new FailCallable());
        registry.register(new ArithmeticCallable("add", ArithmeticCallable.Op.ADD));
        registry.register(new ArithmeticCallable("multiply", ArithmeticCallable.Op.MULTIPLY));
        registry.register(new SleepCallable());
        for (ShellSettings.ScriptCallableSpec spec : settings.scriptCallables()) {
            long timeoutMs = spec.timeoutMs() == null ? settings.callableTimeoutMs() : spec.timeoutMs();
            registry.register(new ScriptCallable(spec.name(), spec.command(), timeoutMs));
        }
        return registry;
    }

    public void register(ShellCallable callable) {
        callables.put(callable.name(), callable);
    }

    public Optional<ShellCallable> findByName(String name) {
        return Optional.ofNullable(name == null ? null : callables.get(name));
    }

    public Collection<String> listNames() {
        return List.copyOf(new TreeSet<>(callables.keySet()));
    }
}
