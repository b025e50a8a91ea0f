package org.buildlens.analyzer.common;

import java.util.Objects;

/*
Position of a node in a build file. Lines and columns are 1-based; synthesized nodes
copy the location of the node they were derived from.
 */
public record Location(String file, int line, int column) {

    public static final Location UNKNOWN = new Location("?", 0, 0);

    public Location {
        Objects.requireNonNull(file);
    }

    public String compact() {
        return line + ":" + column;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
