package org.buildlens.analyzer.introspection;

import org.buildlens.analyzer.common.InvalidArgumentsException;

import java.util.Locale;

/**
 * Which kind of library <code>library()</code> declares.
 */
public enum DefaultLibrary {
    SHARED, STATIC, BOTH;

    public static DefaultLibrary parse(String value) {
        try {
            return valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException iae) {
            throw new InvalidArgumentsException("Invalid value for default_library: '" + value + "'");
        }
    }

    /*
    both shared and static are built; the shared one is the one that is introspected
     */
    public TargetType targetType() {
        return this == STATIC ? TargetType.STATIC_LIBRARY : TargetType.SHARED_LIBRARY;
    }
}
