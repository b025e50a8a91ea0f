package org.buildlens.analyzer.interpreter;

import org.buildlens.analyzer.ast.*;
import org.buildlens.analyzer.common.AnalysisBugException;
import org.buildlens.analyzer.common.InvalidArgumentsException;
import org.buildlens.analyzer.interpreter.value.*;
import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TestAstInterpreter extends CommonTest {

    @Language("meson")
    private static final String BRANCH = """
            x = 1
            if cond
              x = 2
            endif
            message(x)
            """;

    @Test
    public void testBranchMerge() {
        AstInterpreter interpreter = interpret(BRANCH);
        FlowVertex merge = interpreter.lookup("x");
        assertInstanceOf(UnknownValue.class, merge);
        assertTrue(valueOf(interpreter, "x").isUnknown());

        Set<FlowVertex> sources = interpreter.graph().sources(merge);
        assertEquals(2, sources.size());
        assertTrue(sources.stream().allMatch(v -> v instanceof NumberNode));

        // the identifier in message(x) reads the merge
        FunctionNode message = (FunctionNode) interpreter.ast().lines().get(2);
        IdNode x = (IdNode) message.arguments().positional().get(0);
        assertEquals(Set.of(merge), interpreter.graph().sources(x));
    }

    @Language("meson")
    private static final String NO_OP_BRANCH = """
            x = 1
            if cond
              message('nothing to see')
            endif
            y = x
            """;

    @Test
    public void testBranchWithoutWrites() {
        AstInterpreter interpreter = interpret(NO_OP_BRANCH);
        assertEquals(new IntValue(1), valueOf(interpreter, "y"));
        assertEquals(1, interpreter.tracker().definitions("x").size());
    }

    @Language("meson")
    private static final String ELIF = """
            x = 'a'
            if c1
              x = 'b'
            elif c2
              y = 'only here'
            elif c3
              x = 'c'
            else
              x = 'd'
            endif
            """;

    @Test
    public void testAllArms() {
        AstInterpreter interpreter = interpret(ELIF);
        assertEquals(4, interpreter.graph().sources(interpreter.lookup("x")).size());
        assertTrue(valueOf(interpreter, "y").isUnknown());
        assertEquals(1, interpreter.graph().sources(interpreter.lookup("y")).size());
    }

    @Language("meson")
    private static final String NESTED = """
            if a
              if b
                x = 1
              endif
              z = x
            endif
            """;

    @Test
    public void testNestedBranches() {
        AstInterpreter interpreter = interpret(NESTED);
        FlowVertex outer = interpreter.lookup("x");
        FlowVertex inner = interpreter.graph().sources(outer).iterator().next();
        assertInstanceOf(UnknownValue.class, inner);
        assertInstanceOf(NumberNode.class, interpreter.graph().sources(inner).iterator().next());
        assertTrue(valueOf(interpreter, "z").isUnknown());
    }

    @Language("meson")
    private static final String LOOP = """
            x = 0
            foreach i : [1, 2, 3]
              x = i
            endforeach
            message(x)
            """;

    @Test
    public void testLoop() {
        AstInterpreter interpreter = interpret(LOOP);
        assertTrue(valueOf(interpreter, "x").isUnknown());
        assertTrue(valueOf(interpreter, "i").isUnknown());
        // seeded before the body, assigned in the body, seeded after it
        assertEquals(4, interpreter.tracker().definitions("x").size());
    }

    @Language("meson")
    private static final String OPAQUE = """
            a = files('f.c')
            b = some_opaque_call(a)
            c = b
            """;

    @Language("meson")
    private static final String PASSTHROUGH = """
            a = files('f.c')
            b = get_variable('a')
            c = b
            """;

    @Test
    public void testReachabilityBoundary() {
        AstInterpreter opaque = interpret(OPAQUE);
        FlowVertex filesCall = opaque.lookup("a");
        Set<FlowVertex> reachable = opaque.graph().reachable(Set.of(filesCall), false);
        assertTrue(reachable.contains(opaque.lookup("b")));
        assertFalse(reachable.contains(opaque.lookup("c")));
        assertEquals(Set.of(opaque.lookup("c")), opaque.graph().reachable(Set.of(opaque.lookup("c")), true));
        assertTrue(opaque.graph().findAllPaths(filesCall, opaque.lookup("c")).isEmpty());
        assertEquals(1, opaque.graph().findAllPaths(filesCall, opaque.lookup("b")).size());

        AstInterpreter passthrough = interpret(PASSTHROUGH);
        FlowVertex filesCall2 = passthrough.lookup("a");
        FlowVertex c = passthrough.lookup("c");
        assertTrue(passthrough.graph().reachable(Set.of(filesCall2), false).contains(c));
        List<List<FlowVertex>> paths = passthrough.graph().findAllPaths(filesCall2, c);
        assertEquals(1, paths.size());
        assertEquals(3, paths.get(0).size());
        assertTrue(passthrough.graph().reachable(Set.of(c), true).contains(filesCall2));

        ListValue files = (ListValue) valueOf(passthrough, "c");
        assertEquals(new FileRef("", "f.c"), files.get(0));
    }

    @Language("meson")
    private static final String EXPRESSIONS = """
            l = [1, 2] + [3]
            d = {'a': 1} + {'a': 2, 'b': 3}
            q = 7 / 2
            r = -7 / 2
            m = -7 % 2
            s = 'Hello World'.to_lower().split(' ')
            n = s.length()
            f = '@0@-@1@'.format('a', n)
            t = n == 2 ? 'two' : 'other'
            u = unknown_thing() ? 'a' : 'b'
            v = 'b' in s and not false
            last = l[-1]
            fs = f'@n@'
            vc = '1.0'.version_compare('>0.5')
            w = 'a'.startswith(unknown_thing())
            """;

    @Test
    public void testExpressions() {
        AstInterpreter interpreter = interpret(EXPRESSIONS);
        assertEquals(ListValue.of(new IntValue(1), new IntValue(2), new IntValue(3)), valueOf(interpreter, "l"));
        assertEquals(new DictValue(Map.of(new StringValue("a"), new IntValue(2),
                new StringValue("b"), new IntValue(3))), valueOf(interpreter, "d"));
        assertEquals(new IntValue(3), valueOf(interpreter, "q"));
        assertEquals(new IntValue(-4), valueOf(interpreter, "r"));
        assertEquals(new IntValue(1), valueOf(interpreter, "m"));
        assertEquals(ListValue.of(new StringValue("hello"), new StringValue("world")), valueOf(interpreter, "s"));
        assertEquals(new IntValue(2), valueOf(interpreter, "n"));
        assertEquals(new StringValue("a-2"), valueOf(interpreter, "f"));
        assertEquals(new StringValue("two"), valueOf(interpreter, "t"));
        assertTrue(valueOf(interpreter, "u").isUnknown());
        assertEquals(BoolValue.FALSE, valueOf(interpreter, "v"));
        assertEquals(new IntValue(3), valueOf(interpreter, "last"));
        assertTrue(valueOf(interpreter, "fs").isUnknown());
        assertTrue(valueOf(interpreter, "vc").isUnknown());
        assertTrue(valueOf(interpreter, "w").isUnknown());
    }

    @Language("meson")
    private static final String PLUS_ASSIGN = """
            x = [1]
            x += 2
            x += unknown_thing()
            y = unknown_thing()
            y += 'a'
            """;

    @Test
    public void testPlusAssignment() {
        AstInterpreter interpreter = interpret(PLUS_ASSIGN);
        ListValue x = (ListValue) valueOf(interpreter, "x");
        assertEquals(3, x.size());
        assertEquals(new IntValue(2), x.get(1));
        assertTrue(x.get(2).isUnknown());

        ArithmeticNode synthesized = (ArithmeticNode) interpreter.lookup("x");
        assertEquals(2, interpreter.graph().sources(synthesized).size());
        assertTrue(interpreter.graph().sources(synthesized).contains(synthesized.left()));
        assertEquals(3, interpreter.allAssignmentNodes().get("x").size());
        assertTrue(valueOf(interpreter, "y").isUnknown());
    }

    @Language("meson")
    private static final String VARIABLES = """
            set_variable('v', 42)
            w = v
            g = get_variable('w')
            fb = get_variable('missing', 'fallback')
            a = 1
            unset_variable('a')
            b = a
            """;

    @Test
    public void testVariableFunctions() {
        AstInterpreter interpreter = interpret(VARIABLES);
        assertEquals(new IntValue(42), valueOf(interpreter, "w"));
        assertEquals(new IntValue(42), valueOf(interpreter, "g"));
        assertEquals(new StringValue("fallback"), valueOf(interpreter, "fb"));
        assertTrue(valueOf(interpreter, "b").isUnknown());
        assertInstanceOf(AssignmentNode.class, interpreter.allAssignmentNodes().get("v").get(0));
        assertFalse(interpreter.tracker().isTainted());
    }

    @Test
    public void testTaint() {
        assertThrows(AnalysisBugException.class, () -> interpret("x = undefined_variable"));

        AstInterpreter interpreter = interpret("""
                name = get_option('name')
                set_variable(name, 1)
                x = undefined_variable
                """);
        assertTrue(interpreter.tracker().isTainted());
        assertTrue(valueOf(interpreter, "x").isUnknown());
    }

    @Test
    public void testSetVariableArguments() {
        assertThrows(InvalidArgumentsException.class, () -> interpret("set_variable('a')"));
        assertThrows(InvalidArgumentsException.class, () -> interpret("set_variable('a', 1, k: 2)"));
    }

    @Language("meson")
    private static final String DISABLER = """
            d = disabler()
            x = files(d)
            y = d.anything()
            z = d + 1
            set_variable('e', d)
            k = is_disabler(d)
            """;

    @Test
    public void testDisabler() {
        AstInterpreter interpreter = interpret(DISABLER);
        assertSame(Disabler.INSTANCE, valueOf(interpreter, "x"));
        assertSame(Disabler.INSTANCE, valueOf(interpreter, "y"));
        assertSame(Disabler.INSTANCE, valueOf(interpreter, "z"));
        assertSame(Disabler.INSTANCE, valueOf(interpreter, "e"));
        assertTrue(valueOf(interpreter, "k").isUnknown());
    }

    /*
    indexing beyond the end of a known list is reported, not turned into an unknown value
     */
    @Test
    public void testIndexOutOfRange() {
        AstInterpreter interpreter = interpret("l = [1, 2]\nx = l[5]");
        assertThrows(AnalysisBugException.class, () -> valueOf(interpreter, "x"));
        assertThrows(AnalysisBugException.class, () -> interpret("l = [1, 2]\nmessage(l[5])"));
    }

    @Test
    public void testMachineVariables() {
        AstInterpreter interpreter = interpret("cpu = host_machine.cpu_family()\nis_linux = build_machine.system() == 'linux'");
        assertTrue(valueOf(interpreter, "cpu").isUnknown());
        assertTrue(valueOf(interpreter, "is_linux").isUnknown());
    }

    @Language("meson")
    private static final String NESTED_UNKNOWN = """
            l = ['a', host_machine.system()]
            j = '-'.join(l)
            k = '-'.join(['a', 'b'], 'c')
            has = ['x'].contains([host_machine.system()])
            """;

    @Test
    public void testMethodArgumentsAreFlattened() {
        AstInterpreter interpreter = interpret(NESTED_UNKNOWN);
        assertTrue(valueOf(interpreter, "j").isUnknown());
        assertEquals(new StringValue("a-b-c"), valueOf(interpreter, "k"));
        assertTrue(valueOf(interpreter, "has").isUnknown());
    }

    @Language("meson")
    private static final String REPEATED = """
            x = [1, f'@a@']
            y = host_machine.system() + 'x'
            z = unknown_thing() ? 1 : 2
            """;

    @Test
    public void testResolvingTwiceGivesEqualValues() {
        AstInterpreter interpreter = interpret(REPEATED);
        for (String variable : List.of("x", "y", "z")) {
            FlowVertex vertex = interpreter.lookup(variable);
            assertEquals(interpreter.resolve(vertex), interpreter.resolve(vertex), variable);
        }
        ListValue x = (ListValue) valueOf(interpreter, "x");
        assertEquals(new IntValue(1), x.get(0));
        assertTrue(x.get(1).isUnknown());
    }
}
