package org.buildlens.analyzer.interpreter.resolve;

import org.buildlens.analyzer.common.InvalidArgumentsException;
import org.buildlens.analyzer.common.Location;
import org.buildlens.analyzer.interpreter.value.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Methods of the primitive types of the build language, on concrete receivers and arguments.
 * Methods that are not modelled produce an unknown value.
 */
public final class BuiltinMethods {
    private static final Logger LOGGER = LoggerFactory.getLogger(BuiltinMethods.class);
    private static final Pattern FORMAT_PLACEHOLDER = Pattern.compile("@(\\d+)@");
    private static final Pattern NON_IDENTIFIER = Pattern.compile("[^a-zA-Z0-9]");

    private BuiltinMethods() {
    }

    public static RuntimeValue call(RuntimeValue receiver, String method, List<RuntimeValue> args,
                                    Location location) {
        RuntimeValue result;
        if (receiver instanceof StringValue s) {
            result = stringMethod(s.value(), method, args, location);
        } else if (receiver instanceof IntValue i) {
            result = intMethod(i.value(), method);
        } else if (receiver instanceof BoolValue b) {
            result = boolMethod(b.value(), method, args, location);
        } else if (receiver instanceof ListValue l) {
            result = listMethod(l, method, args, location);
        } else if (receiver instanceof DictValue d) {
            result = dictMethod(d, method, args, location);
        } else {
            result = null;
        }
        if (result == null) {
            LOGGER.debug("Method {}.{}() not modelled, unknown result", receiver.typeName(), method);
            return new UnknownValue();
        }
        return result;
    }

    private static RuntimeValue stringMethod(String s, String method, List<RuntimeValue> args, Location location) {
        switch (method) {
            case "to_upper":
                return new StringValue(s.toUpperCase());
            case "to_lower":
                return new StringValue(s.toLowerCase());
            case "strip": {
                if (args.isEmpty()) return new StringValue(s.strip());
                String chars = string(args, 0, method, location);
                int start = 0;
                int end = s.length();
                while (start < end && chars.indexOf(s.charAt(start)) >= 0) start++;
                while (end > start && chars.indexOf(s.charAt(end - 1)) >= 0) end--;
                return new StringValue(s.substring(start, end));
            }
            case "split": {
                List<RuntimeValue> parts = new ArrayList<>();
                if (args.isEmpty()) {
                    String stripped = s.strip();
                    if (!stripped.isEmpty()) {
                        Arrays.stream(stripped.split("\\s+")).forEach(p -> parts.add(new StringValue(p)));
                    }
                } else {
                    String separator = string(args, 0, method, location);
                    if (separator.isEmpty()) throw new InvalidArgumentsException("Empty separator", location);
                    int from = 0;
                    int pos;
                    while ((pos = s.indexOf(separator, from)) >= 0) {
                        parts.add(new StringValue(s.substring(from, pos)));
                        from = pos + separator.length();
                    }
                    parts.add(new StringValue(s.substring(from)));
                }
                return new ListValue(parts);
            }
            case "join": {
                List<String> strings = new ArrayList<>();
                for (RuntimeValue v : ListValue.flatten(args)) {
                    if (!(v instanceof StringValue sv)) {
                        throw new InvalidArgumentsException("join() expects strings, got " + v.typeName(), location);
                    }
                    strings.add(sv.value());
                }
                return new StringValue(String.join(s, strings));
            }
            case "startswith":
                return BoolValue.of(s.startsWith(string(args, 0, method, location)));
            case "endswith":
                return BoolValue.of(s.endsWith(string(args, 0, method, location)));
            case "contains":
                return BoolValue.of(s.contains(string(args, 0, method, location)));
            case "replace":
                return new StringValue(s.replace(string(args, 0, method, location),
                        string(args, 1, method, location)));
            case "underscorify":
                return new StringValue(NON_IDENTIFIER.matcher(s).replaceAll("_"));
            case "to_int":
                try {
                    return new IntValue(Long.parseLong(s.strip()));
                } catch (NumberFormatException nfe) {
                    throw new InvalidArgumentsException("String '" + s + "' cannot be converted to int", location);
                }
            case "format":
                return new StringValue(format(s, args, location));
            case "substring":
                return new StringValue(substring(s, args, location));
            default:
                return null;
        }
    }

    private static String format(String template, List<RuntimeValue> args, Location location) {
        Matcher m = FORMAT_PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            int index = Integer.parseInt(m.group(1));
            if (index >= args.size()) {
                throw new InvalidArgumentsException("Format placeholder @" + index + "@ out of range", location);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(stringify(args.get(index), location)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String substring(String s, List<RuntimeValue> args, Location location) {
        int length = s.length();
        long start = args.size() > 0 ? integer(args, 0, "substring", location) : 0;
        long end = args.size() > 1 ? integer(args, 1, "substring", location) : length;
        if (start < 0) start = Math.max(0, length + start);
        if (end < 0) end = Math.max(0, length + end);
        start = Math.min(start, length);
        end = Math.min(end, length);
        return start >= end ? "" : s.substring((int) start, (int) end);
    }

    private static RuntimeValue intMethod(long i, String method) {
        return switch (method) {
            case "to_string" -> new StringValue(Long.toString(i));
            case "is_even" -> BoolValue.of(i % 2 == 0);
            case "is_odd" -> BoolValue.of(i % 2 != 0);
            default -> null;
        };
    }

    private static RuntimeValue boolMethod(boolean b, String method, List<RuntimeValue> args, Location location) {
        return switch (method) {
            case "to_string" -> {
                if (args.isEmpty()) yield new StringValue(Boolean.toString(b));
                yield new StringValue(string(args, b ? 0 : 1, method, location));
            }
            case "to_int" -> new IntValue(b ? 1 : 0);
            default -> null;
        };
    }

    private static RuntimeValue listMethod(ListValue list, String method, List<RuntimeValue> args,
                                           Location location) {
        switch (method) {
            case "length":
                return new IntValue(list.size());
            case "contains":
                checkCount(args, 1, method, location);
                return BoolValue.of(list.elements().contains(args.get(0)));
            case "get": {
                long index = integer(args, 0, method, location);
                long i = index < 0 ? list.size() + index : index;
                if (i >= 0 && i < list.size()) return list.get((int) i);
                if (args.size() > 1) return args.get(1);
                throw new InvalidArgumentsException("Index " + index + " out of range in get()", location);
            }
            default:
                return null;
        }
    }

    private static RuntimeValue dictMethod(DictValue dict, String method, List<RuntimeValue> args,
                                           Location location) {
        switch (method) {
            case "has_key":
                checkCount(args, 1, method, location);
                return BoolValue.of(dict.containsKey(args.get(0)));
            case "get": {
                if (args.isEmpty()) throw new InvalidArgumentsException("get() needs a key", location);
                RuntimeValue value = dict.get(args.get(0));
                if (value != null) return value;
                if (args.size() > 1) return args.get(1);
                throw new InvalidArgumentsException("Key " + args.get(0) + " not in dictionary", location);
            }
            case "keys":
                return new ListValue(dict.entries().keySet().stream()
                        .sorted((a, b) -> a.toString().compareTo(b.toString())).toList());
            default:
                return null;
        }
    }

    private static String stringify(RuntimeValue value, Location location) {
        if (value instanceof StringValue s) return s.value();
        if (value instanceof IntValue i) return Long.toString(i.value());
        if (value instanceof BoolValue b) return Boolean.toString(b.value());
        throw new InvalidArgumentsException("Cannot format a value of type " + value.typeName(), location);
    }

    private static void checkCount(List<RuntimeValue> args, int count, String method, Location location) {
        if (args.size() < count) {
            throw new InvalidArgumentsException(method + "() expects " + count + " argument(s)", location);
        }
    }

    private static String string(List<RuntimeValue> args, int index, String method, Location location) {
        checkCount(args, index + 1, method, location);
        if (args.get(index) instanceof StringValue sv) return sv.value();
        throw new InvalidArgumentsException(method + "() expects a string argument, got "
                                            + args.get(index).typeName(), location);
    }

    private static long integer(List<RuntimeValue> args, int index, String method, Location location) {
        checkCount(args, index + 1, method, location);
        if (args.get(index) instanceof IntValue iv) return iv.value();
        throw new InvalidArgumentsException(method + "() expects an int argument, got "
                                            + args.get(index).typeName(), location);
    }
}
