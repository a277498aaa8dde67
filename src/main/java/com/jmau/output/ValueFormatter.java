package com.jmau.output;

import com.jmau.value.Value;
import com.jmau.value.Values;
import org.eclipse.collections.api.list.MutableList;

import java.util.Locale;

/**
 * Text forms of values: the string a {@code {{ }}} span writes into the output, the quoted
 * "inspect" form used inside collections and error messages, and JSON for the command line.
 */
public class ValueFormatter {
    private final boolean prettyPrint;
    private final boolean sortKeys;

    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public ValueFormatter(boolean prettyPrint) {
        this(prettyPrint, false);
    }

    public ValueFormatter(boolean prettyPrint, boolean sortKeys) {
        this.prettyPrint = prettyPrint;
        this.sortKeys = sortKeys;
    }

    /** Output form: strings unquoted, null empty, collections in inspect form. */
    public static String stringify(Value value) {
        if (value instanceof Value.StringValue s) {
            return s.value();
        }
        if (value instanceof Value.NullValue) {
            return "";
        }
        return inspect(value);
    }

    /** Debug form: strings quoted, null as {@code null}, atoms as {@code :name}. */
    public static String inspect(Value value) {
        StringBuilder sb = new StringBuilder();
        inspect(value, sb);
        return sb.toString();
    }

    private static void inspect(Value value, StringBuilder sb) {
        if (value instanceof Value.NullValue) {
            sb.append("null");
        } else if (value instanceof Value.BoolValue b) {
            sb.append(b.value());
        } else if (value instanceof Value.IntValue i) {
            sb.append(i.value());
        } else if (value instanceof Value.FloatValue f) {
            sb.append(formatFloat(f.value()));
        } else if (value instanceof Value.StringValue s) {
            sb.append('"').append(escapeString(s.value())).append('"');
        } else if (value instanceof Value.AtomValue a) {
            sb.append(':').append(a.name());
        } else if (value instanceof Value.ListValue list) {
            sb.append('[');
            boolean first = true;
            for (Value element : list.elements()) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                inspect(element, sb);
            }
            sb.append(']');
        } else {
            Value.MapValue map = (Value.MapValue) value;
            sb.append('{');
            boolean first = true;
            for (Value.Key key : map.entries().keysView().toSortedList(Values.KEY_ORDER)) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                if (key instanceof Value.AtomValue atom) {
                    sb.append(atom.name()).append(": ");
                } else {
                    inspect(key, sb);
                    sb.append(": ");
                }
                inspect(map.entries().get(key), sb);
            }
            sb.append('}');
        }
    }

    /** Shortest round-trip digits, exponent written {@code 1.0e20}. */
    static String formatFloat(double value) {
        return Double.toString(value).replace('E', 'e');
    }

    /** JSON form, pretty or compact. */
    public String format(Value value) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        if (prettyPrint) {
            formatPretty(value, 0, sb);
        } else {
            formatCompact(value, sb);
        }

        return sb.toString();
    }

    private void formatPretty(Value value, int indent, StringBuilder sb) {
        String indentStr = " ".repeat(indent);

        if (value instanceof Value.MapValue map) {
            if (map.isEmpty()) {
                sb.append("{}");
                return;
            }

            sb.append("{\n");

            boolean first = true;
            for (Value.Key key : keys(map)) {
                if (!first) {
                    sb.append(",\n");
                }
                first = false;

                sb.append(indentStr)
                  .append("  \"")
                  .append(escapeString(key.name()))
                  .append("\": ");
                formatPretty(map.entries().get(key), indent + 2, sb);
            }

            sb.append("\n").append(indentStr).append("}");
        } else if (value instanceof Value.ListValue list) {
            if (list.isEmpty()) {
                sb.append("[]");
                return;
            }

            sb.append("[\n");

            boolean first = true;
            for (Value element : list.elements()) {
                if (!first) {
                    sb.append(",\n");
                }
                first = false;

                sb.append(indentStr).append("  ");
                formatPretty(element, indent + 2, sb);
            }

            sb.append("\n").append(indentStr).append("]");
        } else {
            formatScalar(value, sb);
        }
    }

    private void formatCompact(Value value, StringBuilder sb) {
        if (value instanceof Value.MapValue map) {
            sb.append("{");

            boolean first = true;
            for (Value.Key key : keys(map)) {
                if (!first) {
                    sb.append(",");
                }
                first = false;

                sb.append("\"")
                  .append(escapeString(key.name()))
                  .append("\":");
                formatCompact(map.entries().get(key), sb);
            }

            sb.append("}");
        } else if (value instanceof Value.ListValue list) {
            sb.append("[");

            boolean first = true;
            for (Value element : list.elements()) {
                if (!first) {
                    sb.append(",");
                }
                first = false;

                formatCompact(element, sb);
            }

            sb.append("]");
        } else {
            formatScalar(value, sb);
        }
    }

    private MutableList<Value.Key> keys(Value.MapValue map) {
        return sortKeys
            ? map.entries().keysView().toSortedList(Values.KEY_ORDER)
            : map.entries().keysView().toList();
    }

    private static void formatScalar(Value value, StringBuilder sb) {
        if (value instanceof Value.StringValue s) {
            sb.append("\"").append(escapeString(s.value())).append("\"");
        } else if (value instanceof Value.AtomValue a) {
            sb.append("\":").append(escapeString(a.name())).append("\"");
        } else if (value instanceof Value.FloatValue f && (Double.isNaN(f.value()) || Double.isInfinite(f.value()))) {
            sb.append("null");
        } else {
            inspect(value, sb);
        }
    }

    private static String escapeString(String s) {
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == '"' || c < 0x20) {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"'  -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                case '\b' -> result.append("\\b");
                case '\f' -> result.append("\\f");
                default   -> {
                    if (c < 0x20) {
                        result.append(String.format(Locale.ROOT, "\\u%04x", (int) c));
                    } else {
                        result.append(c);
                    }
                }
            }
        }
        return result.toString();
    }
}
