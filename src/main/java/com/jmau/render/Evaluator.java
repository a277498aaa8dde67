package com.jmau.render;

import com.jmau.TemplateException;
import com.jmau.filter.FilterRegistry;
import com.jmau.output.ValueFormatter;
import com.jmau.template.Expression;
import com.jmau.template.PathSegment;
import com.jmau.value.Value;
import com.jmau.value.Values;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Evaluates expressions against a {@link Context}. Stateless apart from the filter registry, so one
 * evaluator can be shared between renders.
 */
public class Evaluator {

    private final FilterRegistry filters;

    public Evaluator(FilterRegistry filters) {
        this.filters = filters;
    }

    public Value evaluate(Expression expression, Context context) {
        if (expression instanceof Expression.Literal literal) {
            return literal.value();
        }
        if (expression instanceof Expression.Variable variable) {
            return resolve(variable.path(), context);
        }
        if (expression instanceof Expression.ArrayLiteral array) {
            return new Value.ListValue(array.elements().collect(element -> evaluate(element, context)));
        }
        if (expression instanceof Expression.BinaryOp op) {
            Value left = evaluate(op.left(), context);
            Value right = evaluate(op.right(), context);
            return binary(op.operator(), left, right);
        }
        if (expression instanceof Expression.LogicalOp op) {
            return logical(op, context);
        }
        if (expression instanceof Expression.Not not) {
            return Value.of(!strictTruthy(evaluate(not.operand(), context)));
        }
        Expression.Call call = (Expression.Call) expression;
        ImmutableList<Value> arguments = call.arguments().collect(argument -> evaluate(argument, context));
        Value subject = arguments.isEmpty() ? Value.NULL : arguments.getFirst();
        ImmutableList<Value> rest = arguments.isEmpty() ? Lists.immutable.empty() : arguments.drop(1);
        return filters.apply(call.name(), subject, rest);
    }

    /** Walks a variable path. Never fails: anything that cannot be followed resolves to null. */
    public Value resolve(ImmutableList<PathSegment> path, Context context) {
        Value current = Value.NULL;
        for (PathSegment segment : path) {
            if (segment instanceof PathSegment.Root root) {
                current = context.get(root.name());
            } else if (segment instanceof PathSegment.Property property) {
                current = current instanceof Value.MapValue map ? map.property(property.name()) : Value.NULL;
            } else {
                Value key = evaluate(((PathSegment.Index) segment).key(), context);
                current = index(current, key);
            }
            if (current instanceof Value.NullValue) {
                return Value.NULL;
            }
        }
        return current;
    }

    private static Value index(Value receiver, Value key) {
        if (receiver instanceof Value.ListValue list && key instanceof Value.IntValue i) {
            long position = i.value();
            return position >= 0 && position < list.size() ? list.elements().get((int) position) : Value.NULL;
        }
        if (receiver instanceof Value.MapValue map && key instanceof Value.Key k) {
            return map.lookup(k);
        }
        return Value.NULL;
    }

    private Value logical(Expression.LogicalOp op, Context context) {
        Value left = evaluate(op.left(), context);
        switch (op.operator()) {
            case "and":
                return strictTruthy(left) ? Value.of(strictTruthy(evaluate(op.right(), context))) : Value.FALSE;
            case "or":
                return strictTruthy(left) ? Value.TRUE : Value.of(strictTruthy(evaluate(op.right(), context)));
            case "&&":
                return looseTruthy(left) ? evaluate(op.right(), context) : left;
            case "||":
                return looseTruthy(left) ? left : evaluate(op.right(), context);
            default:
                throw TemplateException.runtime("Unsupported logical operator: " + op.operator());
        }
    }

    /** Truthiness of {@code and}, {@code or}, {@code not} and conditions: zero and empty values are false. */
    public static boolean strictTruthy(Value value) {
        if (value instanceof Value.NullValue) {
            return false;
        }
        if (value instanceof Value.BoolValue b) {
            return b.value();
        }
        if (value instanceof Value.NumberValue n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof Value.StringValue s) {
            return !s.value().isEmpty();
        }
        if (value instanceof Value.ListValue list) {
            return !list.isEmpty();
        }
        if (value instanceof Value.MapValue map) {
            return !map.isEmpty();
        }
        return true;
    }

    /** Truthiness of {@code &&} and {@code ||}: only false and null are false. */
    public static boolean looseTruthy(Value value) {
        return !(value instanceof Value.NullValue || Value.FALSE.equals(value));
    }

    static Value binary(String operator, Value left, Value right) {
        try {
            return applyBinary(operator, left, right);
        } catch (ArithmeticException e) {
            throw new TemplateException(TemplateException.Kind.RUNTIME, "Integer overflow", e);
        }
    }

    private static Value applyBinary(String operator, Value left, Value right) {
        switch (operator) {
            case "==":
                return Value.of(Values.valueEquals(left, right));
            case "!=":
                return Value.of(!Values.valueEquals(left, right));
            case "+":
                if (left instanceof Value.StringValue || right instanceof Value.StringValue
                        || left instanceof Value.NullValue || right instanceof Value.NullValue) {
                    return Value.of(ValueFormatter.stringify(left) + ValueFormatter.stringify(right));
                }
                break;
            default:
                break;
        }
        if (left instanceof Value.NumberValue l && right instanceof Value.NumberValue r) {
            return numeric(operator, l, r);
        }
        if (left instanceof Value.StringValue l && right instanceof Value.StringValue r) {
            Boolean holds = comparison(operator, l.value().compareTo(r.value()));
            if (holds != null) {
                return Value.of(holds.booleanValue());
            }
        }
        throw unsupported(operator, left, right);
    }

    private static Value numeric(String operator, Value.NumberValue left, Value.NumberValue right) {
        boolean integral = left instanceof Value.IntValue && right instanceof Value.IntValue;
        switch (operator) {
            case "+":
                return integral ? Value.of(Math.addExact(longOf(left), longOf(right)))
                        : Value.of(left.doubleValue() + right.doubleValue());
            case "-":
                return integral ? Value.of(Math.subtractExact(longOf(left), longOf(right)))
                        : Value.of(left.doubleValue() - right.doubleValue());
            case "*":
                return integral ? Value.of(Math.multiplyExact(longOf(left), longOf(right)))
                        : Value.of(left.doubleValue() * right.doubleValue());
            case "/":
                if (right.doubleValue() == 0) {
                    throw TemplateException.runtime("Division by zero");
                }
                return Value.of(left.doubleValue() / right.doubleValue());
            case "%":
                if (!integral) {
                    throw unsupported(operator, left, right);
                }
                if (longOf(right) == 0) {
                    throw TemplateException.runtime("Modulo by zero");
                }
                return Value.of(longOf(left) % longOf(right));
            default:
                int order = integral
                        ? Long.compare(longOf(left), longOf(right))
                        : Double.compare(left.doubleValue() + 0.0, right.doubleValue() + 0.0);
                Boolean holds = comparison(operator, order);
                if (holds == null) {
                    throw unsupported(operator, left, right);
                }
                return Value.of(holds.booleanValue());
        }
    }

    /** Whether an ordering operator holds for a compareTo result; null for any other operator. */
    private static Boolean comparison(String operator, int order) {
        switch (operator) {
            case "<":
                return order < 0;
            case "<=":
                return order <= 0;
            case ">":
                return order > 0;
            case ">=":
                return order >= 0;
            default:
                return null;
        }
    }

    private static long longOf(Value.NumberValue value) {
        return ((Value.IntValue) value).value();
    }

    private static TemplateException unsupported(String operator, Value left, Value right) {
        return TemplateException.runtime("Unsupported binary operation: "
                + ValueFormatter.inspect(left) + " " + operator + " " + ValueFormatter.inspect(right));
    }
}
