package io.treeshell.exec.builtin;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.exec.CallableContext;
import io.treeshell.exec.CallableResult;
import io.treeshell.exec.ShellCallable;
import io.treeshell.util.Jsons;

public final class SleepCallable implements ShellCallable {
    @Override
    public String name() {
        return "sleep";
    }

    @Override
    public CallableResult call(CallableContext context) throws InterruptedException {
        long ms = Math.max(0L, context.args().path("ms").asLong(0L));
        Thread.sleep(ms);
        ObjectNode output = Jsons.mapper().createObjectNode();
        output.put("slept_ms", ms);
        return CallableResult.ok(output);
    }
}
