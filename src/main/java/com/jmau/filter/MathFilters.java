package com.jmau.filter;

import com.jmau.value.Value;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Mathematical operation filters. Integer results stay integers wherever the operation allows it. */
public final class MathFilters implements FilterModule {

    @Override
    public String category() {
        return "math";
    }

    @Override
    public ImmutableList<FilterSpec> filters() {
        return Lists.immutable.of(
                new FilterSpec("abs", "Returns absolute value", MathFilters::abs),
                new FilterSpec("ceil", "Rounds up to nearest integer", MathFilters::ceil),
                new FilterSpec("floor", "Rounds down to nearest integer", MathFilters::floor),
                new FilterSpec("round", "Rounds to nearest integer or specified decimals", MathFilters::round),
                new FilterSpec("max", "Returns maximum value from list or compares two values", MathFilters::max),
                new FilterSpec("min", "Returns minimum value from list or compares two values", MathFilters::min),
                new FilterSpec("power", "Raises number to a power", MathFilters::power),
                new FilterSpec("sqrt", "Returns square root", MathFilters::sqrt),
                new FilterSpec("mod", "Returns remainder of division", MathFilters::mod),
                new FilterSpec("clamp", "Clamps value between min and max", MathFilters::clamp));
    }

    static Value abs(Value subject, ImmutableList<Value> args) {
        if (subject instanceof Value.IntValue i) {
            return Value.of(Math.absExact(i.value()));
        }
        if (subject instanceof Value.FloatValue f) {
            return Value.of(Math.abs(f.value()));
        }
        throw new FilterException("abs can only be applied to numbers");
    }

    static Value ceil(Value subject, ImmutableList<Value> args) {
        if (subject instanceof Value.IntValue) {
            return subject;
        }
        if (subject instanceof Value.FloatValue f) {
            return Value.of(toLong(Math.ceil(f.value())));
        }
        throw new FilterException("ceil can only be applied to numbers");
    }

    static Value floor(Value subject, ImmutableList<Value> args) {
        if (subject instanceof Value.IntValue) {
            return subject;
        }
        if (subject instanceof Value.FloatValue f) {
            return Value.of(toLong(Math.floor(f.value())));
        }
        throw new FilterException("floor can only be applied to numbers");
    }

    /** Halves round away from zero. With a precision argument the result is a float. */
    static Value round(Value subject, ImmutableList<Value> args) {
        if (!(subject instanceof Value.NumberValue number)) {
            throw new FilterException("round can only be applied to numbers");
        }
        if (args.size() == 1 && args.get(0) instanceof Value.IntValue precision && precision.value() >= 0) {
            BigDecimal rounded = BigDecimal.valueOf(number.doubleValue())
                    .setScale((int) Math.min(precision.value(), 15), RoundingMode.HALF_UP);
            return Value.of(rounded.doubleValue());
        }
        if (subject instanceof Value.IntValue) {
            return subject;
        }
        BigDecimal rounded = BigDecimal.valueOf(number.doubleValue()).setScale(0, RoundingMode.HALF_UP);
        return Value.of(rounded.longValueExact());
    }

    static Value max(Value subject, ImmutableList<Value> args) {
        return extreme("max", subject, args, 1);
    }

    static Value min(Value subject, ImmutableList<Value> args) {
        return extreme("min", subject, args, -1);
    }

    private static Value extreme(String name, Value subject, ImmutableList<Value> args, int direction) {
        if (subject instanceof Value.ListValue list && args.isEmpty()) {
            if (list.isEmpty()) {
                throw new FilterException(name + " cannot be applied to empty list");
            }
            Value best = null;
            for (Value element : list.elements()) {
                if (element instanceof Value.NumberValue
                        && (best == null || direction * compare(element, best) > 0)) {
                    best = element;
                }
            }
            if (best == null) {
                throw new FilterException(name + " requires at least one numeric value");
            }
            return best;
        }
        if (subject instanceof Value.NumberValue && args.size() == 1 && args.get(0) instanceof Value.NumberValue) {
            Value other = args.get(0);
            return direction * compare(other, subject) > 0 ? other : subject;
        }
        throw new FilterException(name + " can only be applied to numbers or lists of numbers");
    }

    static Value power(Value subject, ImmutableList<Value> args) {
        if (subject instanceof Value.NumberValue base && args.size() == 1
                && args.get(0) instanceof Value.NumberValue exponent) {
            return Value.of(Math.pow(base.doubleValue(), exponent.doubleValue()));
        }
        throw new FilterException("power requires a base number and exponent");
    }

    static Value sqrt(Value subject, ImmutableList<Value> args) {
        if (!(subject instanceof Value.NumberValue number)) {
            throw new FilterException("sqrt can only be applied to numbers");
        }
        if (number.doubleValue() < 0) {
            throw new FilterException("sqrt cannot be applied to negative numbers");
        }
        return Value.of(Math.sqrt(number.doubleValue()));
    }

    /** Remainder of truncated division, so the result takes the sign of the dividend. */
    static Value mod(Value subject, ImmutableList<Value> args) {
        if (args.size() == 1 && args.get(0) instanceof Value.IntValue divisor && divisor.value() == 0) {
            throw new FilterException("mod by zero is undefined");
        }
        if (subject instanceof Value.IntValue dividend && args.size() == 1
                && args.get(0) instanceof Value.IntValue divisor) {
            return Value.of(dividend.value() % divisor.value());
        }
        throw new FilterException("mod requires two integers");
    }

    static Value clamp(Value subject, ImmutableList<Value> args) {
        if (!(subject instanceof Value.NumberValue) || args.size() != 2
                || !(args.get(0) instanceof Value.NumberValue) || !(args.get(1) instanceof Value.NumberValue)) {
            throw new FilterException("clamp requires a number and min/max values");
        }
        Value low = args.get(0);
        Value high = args.get(1);
        if (compare(low, high) > 0) {
            throw new FilterException("clamp min value must be less than or equal to max value");
        }
        if (compare(subject, low) < 0) {
            return low;
        }
        return compare(subject, high) > 0 ? high : subject;
    }

    /** Numeric comparison; integers are compared exactly. */
    static int compare(Value left, Value right) {
        if (left instanceof Value.IntValue l && right instanceof Value.IntValue r) {
            return Long.compare(l.value(), r.value());
        }
        return Double.compare(((Value.NumberValue) left).doubleValue(), ((Value.NumberValue) right).doubleValue());
    }

    private static long toLong(double value) {
        if (Double.isNaN(value) || value >= 0x1p63 || value < -0x1p63) {
            throw new FilterException("result out of integer range: " + value);
        }
        return (long) value;
    }
}
