package org.buildlens.analyzer.interpreter.value;

import java.nio.file.Path;

/**
 * Result of <code>files('a.c')</code>: a path relative to the subdirectory of the declaring build file.
 */
public record FileRef(String subdir, String relativePath) implements RuntimeValue {

    public Path toAbsolutePath(Path sourceRoot) {
        return sourceRoot.resolve(subdir).resolve(relativePath).toAbsolutePath().normalize();
    }

    @Override
    public String typeName() {
        return "file";
    }

    @Override
    public String toString() {
        return subdir.isEmpty() ? relativePath : subdir + "/" + relativePath;
    }
}
