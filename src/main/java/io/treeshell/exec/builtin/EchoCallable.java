package io.treeshell.exec.builtin;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.exec.CallableContext;
import io.treeshell.exec.CallableResult;
import io.treeshell.exec.ShellCallable;
import io.treeshell.util.Jsons;

import java.time.Instant;

public final class EchoCallable implements ShellCallable {
    @Override
    public String name() {
        return "echo";
    }

    @Override
    public CallableResult call(CallableContext context) {
        ObjectNode output = Jsons.mapper().createObjectNode();
        output.put("callable", "echo");
        output.put("node", context.nodeId());
        output.put("timestamp", Instant.now().toString());
        output.set("received", context.args().deepCopy());
        return CallableResult.ok(output);
    }
}
