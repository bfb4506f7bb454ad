package io.treeshell.exec.builtin;

import io.treeshell.exec.CallableContext;
import io.treeshell.exec.CallableResult;
import io.treeshell.exec.ShellCallable;

public final class FailCallable implements ShellCallable {
    @Override
    public String name() {
        return "fail";
    }

    @Override
    public CallableResult call(CallableContext context) {
        String message = context.args().path("message").asText("");
        return CallableResult.fail(message.isBlank() ? "intentional failure from fail callable" : message);
    }
}
