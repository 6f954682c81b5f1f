package domain.emit;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@code SELECT schema.fn(...);} with one argument per line.
 */
final class ProcedureCall {

    private final String function;
    private final List<String> args = new ArrayList<>();

    private ProcedureCall(String function) {
        this.function = function;
    }

    static ProcedureCall of(String function) {
        return new ProcedureCall(function);
    }

    ProcedureCall named(String parameter, String sqlValue) {
        args.add(parameter + " => " + sqlValue);
        return this;
    }

    ProcedureCall positional(String sqlValue) {
        args.add(sqlValue);
        return this;
    }

    String render() {
        StringBuilder sb = new StringBuilder(64 + args.size() * 32);
        sb.append("SELECT ").append(function).append("(\n");
        for (int i = 0; i < args.size(); i++) {
            sb.append("    ").append(args.get(i));
            if (i + 1 < args.size()) sb.append(',');
            sb.append('\n');
        }
        sb.append(");");
        return sb.toString();
    }
}
