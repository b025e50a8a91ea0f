package org.buildlens.analyzer.interpreter.resolve;

import org.buildlens.analyzer.common.InvalidArgumentsException;
import org.buildlens.analyzer.common.Location;
import org.buildlens.analyzer.interpreter.value.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TestBuiltinMethods {

    private static RuntimeValue call(RuntimeValue receiver, String method, RuntimeValue... args) {
        return BuiltinMethods.call(receiver, method, List.of(args), Location.UNKNOWN);
    }

    private static StringValue s(String v) {
        return new StringValue(v);
    }

    @Test
    public void testStrings() {
        assertEquals(s("ABC"), call(s("abc"), "to_upper"));
        assertEquals(s("abc"), call(s("  abc\n"), "strip"));
        assertEquals(s("abc"), call(s("xxabcx"), "strip", s("x")));
        assertEquals(ListValue.of(s("a"), s("b")), call(s(" a  b "), "split"));
        assertEquals(ListValue.of(s("a"), s(""), s("b")), call(s("a,,b"), "split", s(",")));
        assertEquals(s("a-b-c"), call(s("-"), "join", s("a"), ListValue.of(s("b"), s("c"))));
        assertEquals(BoolValue.TRUE, call(s("libfoo"), "startswith", s("lib")));
        assertEquals(BoolValue.FALSE, call(s("libfoo"), "endswith", s("lib")));
        assertEquals(s("foo_bar_h"), call(s("foo-bar.h"), "underscorify"));
        assertEquals(new IntValue(42), call(s(" 42"), "to_int"));
        assertEquals(s("x-1-true"), call(s("@0@-@1@-@2@"), "format", s("x"), new IntValue(1), BoolValue.TRUE));
        assertEquals(s("ell"), call(s("hello"), "substring", new IntValue(1), new IntValue(-1)));
        assertEquals(s("a.c"), call(s("a.h"), "replace", s(".h"), s(".c")));
        assertThrows(InvalidArgumentsException.class, () -> call(s("x"), "to_int"));
        assertThrows(InvalidArgumentsException.class, () -> call(s("@1@"), "format", s("only")));
    }

    @Test
    public void testNotModelled() {
        assertTrue(call(s("1.2"), "version_compare", s(">1.0")).isUnknown());
        assertTrue(call(new IntValue(1), "frobnicate").isUnknown());
    }

    @Test
    public void testOtherTypes() {
        assertEquals(s("7"), call(new IntValue(7), "to_string"));
        assertEquals(BoolValue.TRUE, call(new IntValue(7), "is_odd"));
        assertEquals(s("yes"), call(BoolValue.TRUE, "to_string", s("yes"), s("no")));
        assertEquals(new IntValue(0), call(BoolValue.FALSE, "to_int"));

        ListValue list = ListValue.of(s("a"), s("b"));
        assertEquals(new IntValue(2), call(list, "length"));
        assertEquals(BoolValue.TRUE, call(list, "contains", s("a")));
        assertEquals(s("b"), call(list, "get", new IntValue(-1)));
        assertEquals(s("fallback"), call(list, "get", new IntValue(5), s("fallback")));

        DictValue dict = new DictValue(Map.of(s("b"), new IntValue(2), s("a"), new IntValue(1)));
        assertEquals(BoolValue.TRUE, call(dict, "has_key", s("a")));
        assertEquals(new IntValue(2), call(dict, "get", s("b")));
        assertEquals(new IntValue(0), call(dict, "get", s("c"), new IntValue(0)));
        assertEquals(ListValue.of(s("a"), s("b")), call(dict, "keys"));
        assertThrows(InvalidArgumentsException.class, () -> call(dict, "get", s("c")));
    }
}
