package io.treeshell.exec;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * External function bound to callable nodes by {@code function_name}.
 */
public interface ShellCallable {
    String name();

    CallableResult call(CallableContext context) throws Exception;

    /**
     * Used for nodes bound with {@code is_async}; the dispatcher awaits the returned future.
     */
    default CompletableFuture<CallableResult> callAsync(CallableContext context, Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call(context);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }
}
