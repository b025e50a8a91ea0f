package org.buildlens.analyzer.interpreter;

import org.buildlens.analyzer.ast.CodeBlockNode;
import org.buildlens.analyzer.ast.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class ParsingBuildFileLoader implements BuildFileLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ParsingBuildFileLoader.class);

    @Override
    public CodeBlockNode load(Path buildFile) throws IOException {
        LOGGER.debug("Parsing {}", buildFile);
        String code = Files.readString(buildFile, StandardCharsets.UTF_8);
        return new Parser(code, buildFile.toString()).parse();
    }
}
