package org.buildlens.analyzer.interpreter.resolve;

import org.buildlens.analyzer.ast.ArithmeticOperator;
import org.buildlens.analyzer.ast.ComparisonOperator;
import org.buildlens.analyzer.common.AnalysisBugException;
import org.buildlens.analyzer.common.InvalidCodeException;
import org.buildlens.analyzer.common.Location;
import org.buildlens.analyzer.interpreter.value.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TestOperators {
    private static final Location L = Location.UNKNOWN;

    private static RuntimeValue arithmetic(ArithmeticOperator op, RuntimeValue l, RuntimeValue r) {
        return Operators.arithmetic(op, l, r, L);
    }

    private static IntValue i(long v) {
        return new IntValue(v);
    }

    private static StringValue s(String v) {
        return new StringValue(v);
    }

    @Test
    public void testIntegers() {
        assertEquals(i(3), arithmetic(ArithmeticOperator.DIV, i(7), i(2)));
        assertEquals(i(-4), arithmetic(ArithmeticOperator.DIV, i(-7), i(2)));
        assertEquals(i(1), arithmetic(ArithmeticOperator.MOD, i(-7), i(2)));
        assertEquals(i(-1), arithmetic(ArithmeticOperator.MOD, i(7), i(-2)));
        assertEquals(i(12), arithmetic(ArithmeticOperator.MUL, i(3), i(4)));
        assertEquals(i(-1), arithmetic(ArithmeticOperator.SUB, i(3), i(4)));
        assertThrows(InvalidCodeException.class, () -> arithmetic(ArithmeticOperator.DIV, i(1), i(0)));
        assertThrows(InvalidCodeException.class, () -> arithmetic(ArithmeticOperator.MOD, i(1), i(0)));
    }

    @Test
    public void testStringsListsDicts() {
        assertEquals(s("ab"), arithmetic(ArithmeticOperator.ADD, s("a"), s("b")));
        assertEquals(s("a/b"), arithmetic(ArithmeticOperator.DIV, s("a"), s("b")));
        assertEquals(s("a/b/c"), arithmetic(ArithmeticOperator.DIV, s("a\\b"), s("c")));
        assertEquals(s("/abs"), arithmetic(ArithmeticOperator.DIV, s("a"), s("/abs")));
        assertEquals(ListValue.of(i(1), i(2), i(3)),
                arithmetic(ArithmeticOperator.ADD, ListValue.of(i(1)), ListValue.of(i(2), i(3))));
        assertEquals(ListValue.of(i(1), s("x")), arithmetic(ArithmeticOperator.ADD, ListValue.of(i(1)), s("x")));

        DictValue d1 = new DictValue(Map.of(s("a"), i(1)));
        DictValue d2 = new DictValue(Map.of(s("a"), i(2), s("b"), i(3)));
        assertEquals(new DictValue(Map.of(s("a"), i(2), s("b"), i(3))),
                arithmetic(ArithmeticOperator.ADD, d1, d2));

        assertThrows(InvalidCodeException.class, () -> arithmetic(ArithmeticOperator.SUB, s("a"), i(1)));
        assertThrows(InvalidCodeException.class, () -> arithmetic(ArithmeticOperator.ADD, i(1), s("a")));
    }

    @Test
    public void testUnknownAbsorbs() {
        List<RuntimeValue> concrete = List.of(s("a"), i(1), BoolValue.TRUE, new DictValue(Map.of()));
        for (RuntimeValue v : concrete) {
            for (ArithmeticOperator op : ArithmeticOperator.values()) {
                assertTrue(arithmetic(op, v, new UnknownValue()).isUnknown(), op + " " + v);
                assertTrue(arithmetic(op, new UnknownValue(), v).isUnknown(), op + " " + v);
            }
            for (ComparisonOperator op : ComparisonOperator.values()) {
                assertTrue(Operators.comparison(op, v, new UnknownValue(), L).isUnknown());
                assertTrue(Operators.comparison(op, new UnknownValue(), v, L).isUnknown());
            }
            assertTrue(Operators.and(v, new UnknownValue(), L).isUnknown());
            assertTrue(Operators.or(new UnknownValue(), v, L).isUnknown());
        }
        assertTrue(Operators.and(BoolValue.FALSE, new UnknownValue(), L).isUnknown());
        assertTrue(Operators.not(new UnknownValue(), L).isUnknown());
        assertTrue(Operators.negate(new UnknownValue(), L).isUnknown());
    }

    @Test
    public void testListKeepsShape() {
        UnknownValue u = new UnknownValue();
        ListValue appended = (ListValue) arithmetic(ArithmeticOperator.ADD, ListValue.of(i(1), i(2)), u);
        assertEquals(List.of(i(1), i(2), u), appended.elements());
        ListValue prepended = (ListValue) arithmetic(ArithmeticOperator.ADD, u, ListValue.of(i(1)));
        assertEquals(List.of(u, i(1)), prepended.elements());
        assertTrue(arithmetic(ArithmeticOperator.SUB, ListValue.of(i(1)), u).isUnknown());
    }

    @Test
    public void testDisabler() {
        assertSame(Disabler.INSTANCE, arithmetic(ArithmeticOperator.ADD, Disabler.INSTANCE, i(1)));
        assertSame(Disabler.INSTANCE, Operators.comparison(ComparisonOperator.EQ, s("a"), Disabler.INSTANCE, L));
        assertTrue(arithmetic(ArithmeticOperator.ADD, Disabler.INSTANCE, new UnknownValue()).isUnknown());
    }

    @Test
    public void testComparison() {
        assertEquals(BoolValue.TRUE, Operators.comparison(ComparisonOperator.EQ, s("a"), s("a"), L));
        assertEquals(BoolValue.FALSE, Operators.comparison(ComparisonOperator.EQ, s("1"), i(1), L));
        assertEquals(BoolValue.TRUE, Operators.comparison(ComparisonOperator.NE, s("1"), i(1), L));
        assertEquals(BoolValue.TRUE, Operators.comparison(ComparisonOperator.IN, i(2), ListValue.of(i(1), i(2)), L));
        assertEquals(BoolValue.TRUE, Operators.comparison(ComparisonOperator.NOT_IN, s("z"),
                new DictValue(Map.of(s("a"), i(1))), L));
        assertEquals(BoolValue.TRUE, Operators.comparison(ComparisonOperator.IN, s("ell"), s("hello"), L));
        assertEquals(BoolValue.TRUE, Operators.comparison(ComparisonOperator.LT, i(1), i(2), L));
        assertEquals(BoolValue.FALSE, Operators.comparison(ComparisonOperator.GE, s("a"), s("b"), L));
        assertThrows(InvalidCodeException.class, () -> Operators.comparison(ComparisonOperator.LT, i(1), s("b"), L));
    }

    @Test
    public void testLogicAndUnary() {
        assertEquals(BoolValue.FALSE, Operators.and(BoolValue.TRUE, BoolValue.FALSE, L));
        assertEquals(BoolValue.TRUE, Operators.or(BoolValue.TRUE, BoolValue.FALSE, L));
        assertEquals(BoolValue.FALSE, Operators.not(BoolValue.TRUE, L));
        assertEquals(i(-3), Operators.negate(i(3), L));
        assertThrows(InvalidCodeException.class, () -> Operators.negate(s("a"), L));
        assertThrows(InvalidCodeException.class, () -> Operators.and(i(1), BoolValue.TRUE, L));
    }

    @Test
    public void testIndex() {
        ListValue list = ListValue.of(s("a"), s("b"));
        assertEquals(s("b"), Operators.index(list, i(1), L));
        assertEquals(s("b"), Operators.index(list, i(-1), L));
        assertEquals(i(1), Operators.index(new DictValue(Map.of(s("k"), i(1))), s("k"), L));
        assertTrue(Operators.index(list, new UnknownValue(), L).isUnknown());
        assertThrows(InvalidCodeException.class, () -> Operators.index(i(1), i(0), L));
    }

    /*
    out-of-range indices and missing keys are not degraded to unknown
     */
    @Test
    public void testIndexOutOfRangeIsFatal() {
        assertThrows(AnalysisBugException.class, () -> Operators.index(ListValue.of(s("a")), i(1), L));
        assertThrows(AnalysisBugException.class, () -> Operators.index(ListValue.of(s("a")), i(-2), L));
        assertThrows(AnalysisBugException.class, () -> Operators.index(new DictValue(Map.of()), s("k"), L));
    }
}
