package io.treeshell.exec.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.LongNode;
import io.treeshell.exec.CallableContext;
import io.treeshell.exec.CallableResult;
import io.treeshell.exec.ShellCallable;

import java.math.BigDecimal;

/**
 * Two-operand arithmetic over arguments {@code a} and {@code b}. Integral inputs give an
 * integral result.
 */
public final class ArithmeticCallable implements ShellCallable {
    public enum Op { ADD, MULTIPLY }

    private final String name;
    private final Op op;

    public ArithmeticCallable(String name, Op op) {
        this.name = name;
        this.op = op;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CallableResult call(CallableContext context) {
        JsonNode a = context.args().get("a");
        JsonNode b = context.args().get("b");
        if (a == null || b == null || !a.isNumber() || !b.isNumber()) {
            return CallableResult.fail(name + " requires numeric arguments 'a' and 'b'");
        }
        if (a.isIntegralNumber() && b.isIntegralNumber()) {
            long x = a.asLong();
            long y = b.asLong();
            try {
                long value = op == Op.ADD ? Math.addExact(x, y) : Math.multiplyExact(x, y);
                return CallableResult.ok(LongNode.valueOf(value));
            } catch (ArithmeticException e) {
                return CallableResult.fail(name + " overflow: " + e.getMessage());
            }
        }
        BigDecimal x = a.decimalValue();
        BigDecimal y = b.decimalValue();
        BigDecimal value = op == Op.ADD ? x.add(y) : x.multiply(y);
        return CallableResult.ok(DecimalNode.valueOf(value));
    }
}
