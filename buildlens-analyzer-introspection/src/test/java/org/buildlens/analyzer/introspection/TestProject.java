package org.buildlens.analyzer.introspection;

import org.buildlens.analyzer.common.AnalyzerException;
import org.buildlens.analyzer.common.InvalidArgumentsException;
import org.buildlens.analyzer.common.InvalidCodeException;
import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TestProject extends CommonTest {

    @Test
    public void testProjectData() {
        IntrospectionInterpreter interpreter = analyze("project('demo', 'c', version: '1.2.3')\n");
        ProjectData data = interpreter.projectData();
        assertEquals("demo", data.descriptiveName());
        assertEquals("1.2.3", data.version());
        assertNull(data.name());
        assertTrue(data.subprojects().isEmpty());
        assertEquals(Set.of("c"), interpreter.languages(MachineChoice.HOST));
        assertEquals(Set.of("c"), interpreter.languages(MachineChoice.BUILD));
    }

    @Test
    public void testVersionUndefined() {
        assertEquals("undefined", analyze("project('demo')\n").projectData().version());
        assertEquals("undefined", analyze("project('demo', version: get_option('v'))\n").projectData().version());
    }

    @Test
    public void testSecondProjectCall() {
        AnalyzerException e = assertThrows(AnalyzerException.class,
                () -> analyze("project('a')\nproject('b')\n"));
        InvalidArgumentsException cause = assertInstanceOf(InvalidArgumentsException.class, e.getCause());
        assertTrue(cause.getMessage().contains("Second call to project()"));
        assertTrue(e.getBuildFile().endsWith("meson.build"));
    }

    @Test
    public void testFirstStatement() {
        AnalyzerException e = assertThrows(AnalyzerException.class, () -> analyze("x = 1\n"));
        assertInstanceOf(InvalidCodeException.class, e.getCause());
        AnalyzerException e2 = assertThrows(AnalyzerException.class, () -> analyze("project()\n"));
        assertInstanceOf(InvalidArgumentsException.class, e2.getCause());
    }

    @Test
    public void testLanguages() {
        CompilerDetector noFortran = (language, machine) -> {
            if ("fortran".equals(language)) throw new CompilerDetectionException("no gfortran");
        };
        IntrospectionInterpreter.Options options = new IntrospectionInterpreter.Options.Builder()
                .setCompilerDetector(noFortran).build();

        AnalyzerException e = assertThrows(AnalyzerException.class,
                () -> analyze("project('p', 'c', 'Fortran')\n", options));
        assertInstanceOf(InvalidCodeException.class, e.getCause());

        @Language("meson")
        String code = """
                project('p', 'c')
                add_languages('fortran', required: false)
                add_languages('cpp', native: true)
                add_languages('rust', required: get_option('rust'))
                """;
        IntrospectionInterpreter interpreter = analyze(code, options);
        assertEquals(List.of("c", "rust"), List.copyOf(interpreter.languages(MachineChoice.HOST)));
        assertEquals(List.of("c", "cpp", "rust"), List.copyOf(interpreter.languages(MachineChoice.BUILD)));
    }

    @Test
    public void testExtractSubprojectDir() {
        IntrospectionInterpreter interpreter = analyze("project('p', subproject_dir: 'deps')\n");
        assertEquals("deps", interpreter.extractSubprojectDir());
        assertNull(analyze("project('p')\n").extractSubprojectDir());
    }
}
