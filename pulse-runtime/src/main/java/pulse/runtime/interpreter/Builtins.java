package pulse.runtime.interpreter;

import com.pulselang.compiler.ast.SourceLocation;
import pulse.runtime.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 内置函数：{@code System.out}、{@code Math} 和字符串方法
 */
final class Builtins {

    private static final Set<String> FUNCTIONS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "System.out.println", "System.out.print",
            "Math.random", "Math.floor", "Math.abs", "Math.max", "Math.min", "Math.sqrt", "Math.pow")));

    private final RuntimeState state;

    Builtins(RuntimeState state) {
        this.state = state;
    }

    static boolean isBuiltin(String path) {
        return path != null && FUNCTIONS.contains(path);
    }

    PulseValue call(String path, List<PulseValue> args, SourceLocation loc) {
        switch (path) {
            case "System.out.println":
                if (args.size() > 1) throw arity(path, "0 or 1", args.size(), loc);
                state.println(args.isEmpty() ? "" : args.get(0).toString());
                return PulseNull.VOID;
            case "System.out.print":
                expectArity(path, args, 1, loc);
                state.print(args.get(0).toString());
                return PulseNull.VOID;
            case "Math.random":
                expectArity(path, args, 0, loc);
                return PulseDouble.of(state.random.nextDouble());
            case "Math.floor":
                expectArity(path, args, 1, loc);
                return PulseInt.of((int) Math.floor(number(path, args.get(0), loc)));
            case "Math.abs": {
                expectArity(path, args, 1, loc);
                PulseValue value = args.get(0);
                if (value instanceof PulseInt) {
                    return PulseInt.of(Math.abs(((PulseInt) value).getValue()));
                }
                return PulseDouble.of(Math.abs(number(path, value, loc)));
            }
            case "Math.max":
            case "Math.min": {
                expectArity(path, args, 2, loc);
                PulseValue a = args.get(0);
                PulseValue b = args.get(1);
                boolean max = path.equals("Math.max");
                if (a instanceof PulseInt && b instanceof PulseInt) {
                    int x = ((PulseInt) a).getValue();
                    int y = ((PulseInt) b).getValue();
                    return PulseInt.of(max ? Math.max(x, y) : Math.min(x, y));
                }
                double x = number(path, a, loc);
                double y = number(path, b, loc);
                return PulseDouble.of(max ? Math.max(x, y) : Math.min(x, y));
            }
            case "Math.sqrt":
                expectArity(path, args, 1, loc);
                return PulseDouble.of(Math.sqrt(number(path, args.get(0), loc)));
            case "Math.pow":
                expectArity(path, args, 2, loc);
                return PulseDouble.of(Math.pow(number(path, args.get(0), loc), number(path, args.get(1), loc)));
            default:
                throw new PulseRuntimeException("Unknown builtin '" + path + "'", loc);
        }
    }

    PulseValue callStringMethod(PulseString target, String name, List<PulseValue> args, SourceLocation loc) {
        String path = "String." + name;
        String value = target.getValue();
        switch (name) {
            case "length":
                expectArity(path, args, 0, loc);
                return PulseInt.of(value.length());
            case "equals":
                expectArity(path, args, 1, loc);
                return PulseBoolean.of(target.valueEquals(args.get(0)));
            case "toUpperCase":
                expectArity(path, args, 0, loc);
                return PulseString.of(value.toUpperCase(Locale.ROOT));
            case "toLowerCase":
                expectArity(path, args, 0, loc);
                return PulseString.of(value.toLowerCase(Locale.ROOT));
            case "contains": {
                expectArity(path, args, 1, loc);
                PulseValue arg = args.get(0);
                if (!(arg instanceof PulseString)) {
                    throw new PulseRuntimeException(path + " expects a String, got " + arg.getTypeName(), loc);
                }
                return PulseBoolean.of(value.contains(((PulseString) arg).getValue()));
            }
            default:
                throw new PulseRuntimeException("Unknown method '" + name + "' on String", loc);
        }
    }

    private static void expectArity(String path, List<PulseValue> args, int expected, SourceLocation loc) {
        if (args.size() != expected) {
            throw arity(path, String.valueOf(expected), args.size(), loc);
        }
    }

    private static PulseRuntimeException arity(String path, String expected, int actual, SourceLocation loc) {
        return new PulseRuntimeException(path + " expects " + expected + " argument(s), got " + actual, loc);
    }

    private static double number(String path, PulseValue value, SourceLocation loc) {
        if (!(value instanceof PulseNumber)) {
            throw new PulseRuntimeException(path + " expects a number, got " + value.getTypeName(), loc);
        }
        return ((PulseNumber) value).asDouble();
    }
}
