package org.buildlens.analyzer.introspection;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

@FunctionalInterface
public interface SubprojectEnumerator {

    /*
    the directories directly below the sub-project directory, sorted by name
     */
    SubprojectEnumerator DIRECTORIES = subprojectDir -> {
        if (!Files.isDirectory(subprojectDir)) return List.of();
        try (Stream<Path> stream = Files.list(subprojectDir)) {
            return stream.filter(Files::isDirectory).map(p -> p.getFileName().toString()).sorted().toList();
        }
    };

    List<String> list(Path subprojectDir) throws IOException;
}
