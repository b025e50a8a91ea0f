package org.buildlens.analyzer.interpreter;

import org.buildlens.analyzer.ast.CodeBlockNode;

import java.io.IOException;
import java.nio.file.Path;

public interface BuildFileLoader {

    /**
     * @throws org.buildlens.analyzer.common.InvalidCodeException when the file does not parse
     */
    CodeBlockNode load(Path buildFile) throws IOException;
}
