package org.buildlens.analyzer.introspection;

import java.util.List;

/**
 * The kinds of build target, with the naming of their outputs on a Linux host.
 */
public enum TargetType {
    EXECUTABLE("executable", "exe", "", ""),
    SHARED_LIBRARY("shared library", "sha", "lib", "so"),
    STATIC_LIBRARY("static library", "sta", "lib", "a"),
    SHARED_MODULE("shared module", "sha", "lib", "so"),
    JAR("jar", "jar", "", "jar");

    private final String typename;
    private final String idSuffix;
    private final String defaultPrefix;
    private final String defaultSuffix;

    TargetType(String typename, String idSuffix, String defaultPrefix, String defaultSuffix) {
        this.typename = typename;
        this.idSuffix = idSuffix;
        this.defaultPrefix = defaultPrefix;
        this.defaultSuffix = defaultSuffix;
    }

    public String typename() {
        return typename;
    }

    public String idSuffix() {
        return idSuffix;
    }

    /**
     * @param namePrefix value of the <code>name_prefix</code> keyword, or <code>null</code>
     * @param nameSuffix value of the <code>name_suffix</code> keyword, or <code>null</code>
     */
    public List<String> outputs(String name, String namePrefix, String nameSuffix) {
        String prefix = namePrefix == null ? defaultPrefix : namePrefix;
        String suffix = nameSuffix == null ? defaultSuffix : nameSuffix;
        return List.of(prefix + name + (suffix.isEmpty() ? "" : "." + suffix));
    }
}
