package org.buildlens.analyzer.interpreter.resolve;

import org.buildlens.analyzer.ast.ArithmeticOperator;
import org.buildlens.analyzer.ast.ComparisonOperator;
import org.buildlens.analyzer.common.AnalysisBugException;
import org.buildlens.analyzer.common.InvalidCodeException;
import org.buildlens.analyzer.common.Location;
import org.buildlens.analyzer.interpreter.value.*;

/*
Operator semantics on runtime values. Unknown operands absorb everything except list shape;
a disabler operand disables the result.
 */
public final class Operators {

    private Operators() {
    }

    public static RuntimeValue arithmetic(ArithmeticOperator operator, RuntimeValue left, RuntimeValue right,
                                          Location location) {
        if (operator == ArithmeticOperator.ADD) {
            if (left instanceof ListValue lv && right.isUnknown()) return lv.append(right);
            if (right instanceof ListValue rv && left.isUnknown()) return rv.prepend(left);
        }
        if (left.isUnknown() || right.isUnknown()) return new UnknownValue();
        if (left instanceof Disabler || right instanceof Disabler) return Disabler.INSTANCE;
        switch (operator) {
            case ADD:
                return add(left, right, location);
            case SUB:
                if (left instanceof IntValue l && right instanceof IntValue r) {
                    return new IntValue(l.value() - r.value());
                }
                break;
            case MUL:
                if (left instanceof IntValue l && right instanceof IntValue r) {
                    return new IntValue(l.value() * r.value());
                }
                break;
            case DIV:
                if (left instanceof IntValue l && right instanceof IntValue r) {
                    if (r.value() == 0) throw new InvalidCodeException("Division by zero", location);
                    return new IntValue(Math.floorDiv(l.value(), r.value()));
                }
                if (left instanceof StringValue l && right instanceof StringValue r) {
                    return new StringValue(joinPath(l.value(), r.value()));
                }
                break;
            case MOD:
                if (left instanceof IntValue l && right instanceof IntValue r) {
                    if (r.value() == 0) throw new InvalidCodeException("Modulo by zero", location);
                    return new IntValue(Math.floorMod(l.value(), r.value()));
                }
                break;
            default:
                throw new AnalysisBugException("Unknown operator " + operator);
        }
        throw mismatch(operator.symbol(), left, right, location);
    }

    private static RuntimeValue add(RuntimeValue left, RuntimeValue right, Location location) {
        if (left instanceof IntValue l && right instanceof IntValue r) return new IntValue(l.value() + r.value());
        if (left instanceof StringValue l && right instanceof StringValue r) {
            return new StringValue(l.value() + r.value());
        }
        if (left instanceof ListValue l) {
            return right instanceof ListValue r ? l.concat(r) : l.append(right);
        }
        if (left instanceof DictValue l && right instanceof DictValue r) return l.union(r);
        throw mismatch("+", left, right, location);
    }

    /*
    'a' / 'b' is 'a/b'; an absolute right-hand side replaces the left
     */
    static String joinPath(String left, String right) {
        String l = left.replace('\\', '/');
        String r = right.replace('\\', '/');
        if (r.startsWith("/") || l.isEmpty()) return r;
        if (r.isEmpty()) return l;
        return l.endsWith("/") ? l + r : l + "/" + r;
    }

    public static RuntimeValue comparison(ComparisonOperator operator, RuntimeValue left, RuntimeValue right,
                                          Location location) {
        if (left.isUnknown() || right.isUnknown()) return new UnknownValue();
        if (left instanceof Disabler || right instanceof Disabler) return Disabler.INSTANCE;
        return switch (operator) {
            case EQ -> BoolValue.of(left.equals(right));
            case NE -> BoolValue.of(!left.equals(right));
            case IN -> BoolValue.of(contains(right, left, location));
            case NOT_IN -> BoolValue.of(!contains(right, left, location));
            case LT, LE, GT, GE -> BoolValue.of(ordering(operator, compare(operator, left, right, location)));
        };
    }

    private static boolean ordering(ComparisonOperator operator, int c) {
        return switch (operator) {
            case LT -> c < 0;
            case LE -> c <= 0;
            case GT -> c > 0;
            case GE -> c >= 0;
            default -> throw new AnalysisBugException("Not an ordering: " + operator);
        };
    }

    private static int compare(ComparisonOperator operator, RuntimeValue left, RuntimeValue right,
                               Location location) {
        if (left instanceof IntValue l && right instanceof IntValue r) return Long.compare(l.value(), r.value());
        if (left instanceof StringValue l && right instanceof StringValue r) return l.value().compareTo(r.value());
        throw mismatch(operator.symbol(), left, right, location);
    }

    private static boolean contains(RuntimeValue container, RuntimeValue element, Location location) {
        if (container instanceof ListValue lv) return lv.elements().contains(element);
        if (container instanceof DictValue dv) return dv.containsKey(element);
        if (container instanceof StringValue s && element instanceof StringValue e) {
            return s.value().contains(e.value());
        }
        throw mismatch("in", element, container, location);
    }

    public static RuntimeValue and(RuntimeValue left, RuntimeValue right, Location location) {
        return logical("and", left, right, location);
    }

    public static RuntimeValue or(RuntimeValue left, RuntimeValue right, Location location) {
        return logical("or", left, right, location);
    }

    private static RuntimeValue logical(String symbol, RuntimeValue left, RuntimeValue right, Location location) {
        if (left.isUnknown() || right.isUnknown()) return new UnknownValue();
        if (left instanceof Disabler || right instanceof Disabler) return Disabler.INSTANCE;
        if (left instanceof BoolValue l && right instanceof BoolValue r) {
            return BoolValue.of("and".equals(symbol) ? l.value() && r.value() : l.value() || r.value());
        }
        throw mismatch(symbol, left, right, location);
    }

    public static RuntimeValue not(RuntimeValue value, Location location) {
        if (value.isUnknown()) return new UnknownValue();
        if (value instanceof Disabler) return Disabler.INSTANCE;
        if (value instanceof BoolValue b) return BoolValue.of(!b.value());
        throw new InvalidCodeException("Operator 'not' cannot be applied to " + value.typeName(), location);
    }

    public static RuntimeValue negate(RuntimeValue value, Location location) {
        if (value.isUnknown()) return new UnknownValue();
        if (value instanceof Disabler) return Disabler.INSTANCE;
        if (value instanceof IntValue i) return new IntValue(-i.value());
        throw new InvalidCodeException("Unary minus cannot be applied to " + value.typeName(), location);
    }

    public static RuntimeValue index(RuntimeValue container, RuntimeValue index, Location location) {
        if (container.isUnknown() || index.isUnknown()) return new UnknownValue();
        if (container instanceof Disabler || index instanceof Disabler) return Disabler.INSTANCE;
        if (container instanceof ListValue lv) {
            if (!(index instanceof IntValue iv)) {
                throw new InvalidCodeException("List index must be an int, not " + index.typeName(), location);
            }
            long i = iv.value() < 0 ? lv.size() + iv.value() : iv.value();
            if (i < 0 || i >= lv.size()) {
                throw new AnalysisBugException("Index " + iv.value() + " out of range for list of size "
                                               + lv.size() + " at " + location);
            }
            return lv.get((int) i);
        }
        if (container instanceof DictValue dv) {
            RuntimeValue value = dv.get(index);
            if (value == null) throw new AnalysisBugException("Key " + index + " not in dict at " + location);
            return value;
        }
        if (container instanceof StringValue sv && index instanceof IntValue iv) {
            long i = iv.value() < 0 ? sv.value().length() + iv.value() : iv.value();
            if (i < 0 || i >= sv.value().length()) {
                throw new AnalysisBugException("Index " + iv.value() + " out of range for string at " + location);
            }
            return new StringValue(String.valueOf(sv.value().charAt((int) i)));
        }
        throw new InvalidCodeException("Cannot index a value of type " + container.typeName(), location);
    }

    private static InvalidCodeException mismatch(String symbol, RuntimeValue left, RuntimeValue right,
                                                 Location location) {
        return new InvalidCodeException("Operator '" + symbol + "' cannot be applied to " + left.typeName()
                                        + " and " + right.typeName(), location);
    }
}
