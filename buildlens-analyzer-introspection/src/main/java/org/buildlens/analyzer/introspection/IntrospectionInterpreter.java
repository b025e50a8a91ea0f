package org.buildlens.analyzer.introspection;

import org.buildlens.analyzer.ast.*;
import org.buildlens.analyzer.common.AnalysisBugException;
import org.buildlens.analyzer.common.AnalyzerException;
import org.buildlens.analyzer.common.InvalidArgumentsException;
import org.buildlens.analyzer.common.InvalidCodeException;
import org.buildlens.analyzer.interpreter.AstInterpreter;
import org.buildlens.analyzer.interpreter.BuildFileLoader;
import org.buildlens.analyzer.interpreter.ParsingBuildFileLoader;
import org.buildlens.analyzer.interpreter.value.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;

/**
 * Recognizes the declarations of a project (the project itself, its targets, its dependencies) while walking
 * its build files, and records them. Works on the source tree only: nothing is configured or built.
 */
public class IntrospectionInterpreter extends AstInterpreter {
    private static final Logger LOGGER = LoggerFactory.getLogger(IntrospectionInterpreter.class);

    public static final String DEFAULT_SUBPROJECT_DIR = "subprojects";

    public record Options(DefaultLibrary defaultLibrary,
                          String subprojectDir,
                          CompilerDetector compilerDetector,
                          SubprojectEnumerator subprojectEnumerator,
                          BuildFileLoader buildFileLoader) {
        public static class Builder {
            DefaultLibrary defaultLibrary = DefaultLibrary.SHARED;
            String subprojectDir = DEFAULT_SUBPROJECT_DIR;
            CompilerDetector compilerDetector = CompilerDetector.ACCEPT_ALL;
            SubprojectEnumerator subprojectEnumerator = SubprojectEnumerator.DIRECTORIES;
            BuildFileLoader buildFileLoader = new ParsingBuildFileLoader();

            public Builder setDefaultLibrary(DefaultLibrary defaultLibrary) {
                this.defaultLibrary = defaultLibrary;
                return this;
            }

            public Builder setSubprojectDir(String subprojectDir) {
                this.subprojectDir = subprojectDir;
                return this;
            }

            public Builder setCompilerDetector(CompilerDetector compilerDetector) {
                this.compilerDetector = compilerDetector;
                return this;
            }

            public Builder setSubprojectEnumerator(SubprojectEnumerator subprojectEnumerator) {
                this.subprojectEnumerator = subprojectEnumerator;
                return this;
            }

            public Builder setBuildFileLoader(BuildFileLoader buildFileLoader) {
                this.buildFileLoader = buildFileLoader;
                return this;
            }

            public Options build() {
                return new Options(defaultLibrary, subprojectDir, compilerDetector, subprojectEnumerator,
                        buildFileLoader);
            }
        }
    }

    private final Options options;
    private final List<IntrospectionBuildTarget> targets = new ArrayList<>();
    private final List<IntrospectionDependency> dependencies = new ArrayList<>();
    private final List<AnalyzerException> subprojectFailures = new ArrayList<>();
    private final Map<MachineChoice, Set<String>> languages = new EnumMap<>(MachineChoice.class);

    private DefaultLibrary defaultLibrary;
    private String subprojectDir;
    private FunctionNode projectNode;
    private ProjectData projectData;

    public IntrospectionInterpreter(Path sourceRoot) {
        this(sourceRoot, "", "", new Options.Builder().build());
    }

    public IntrospectionInterpreter(Path sourceRoot, String subdir, String subproject, Options options) {
        super(sourceRoot, subdir, subproject, options.buildFileLoader());
        this.options = options;
        this.defaultLibrary = options.defaultLibrary();
        this.subprojectDir = options.subprojectDir();
        for (MachineChoice machine : MachineChoice.values()) {
            languages.put(machine, new LinkedHashSet<>());
        }
        registerFunction("project", this::project);
        registerFunction("add_languages", this::addLanguagesCall);
        registerFunction("dependency", this::dependency);
        registerFunction("executable", (node, args, kwargs) -> buildTarget(node, args, kwargs, TargetType.EXECUTABLE));
        registerFunction("static_library",
                (node, args, kwargs) -> buildTarget(node, args, kwargs, TargetType.STATIC_LIBRARY));
        registerFunction("shared_library",
                (node, args, kwargs) -> buildTarget(node, args, kwargs, TargetType.SHARED_LIBRARY));
        registerFunction("both_libraries",
                (node, args, kwargs) -> buildTarget(node, args, kwargs, TargetType.SHARED_LIBRARY));
        registerFunction("shared_module",
                (node, args, kwargs) -> buildTarget(node, args, kwargs, TargetType.SHARED_MODULE));
        registerFunction("jar", (node, args, kwargs) -> buildTarget(node, args, kwargs, TargetType.JAR));
        registerFunction("library",
                (node, args, kwargs) -> buildTarget(node, args, kwargs, defaultLibrary.targetType()));
        registerFunction("build_target", this::buildTargetCall);
    }

    // ---- results

    public List<IntrospectionBuildTarget> targets() {
        return Collections.unmodifiableList(targets);
    }

    public List<IntrospectionDependency> dependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    public ProjectData projectData() {
        return projectData;
    }

    public List<AnalyzerException> subprojectFailures() {
        return Collections.unmodifiableList(subprojectFailures);
    }

    public Set<String> languages(MachineChoice machine) {
        return Collections.unmodifiableSet(languages.get(machine));
    }

    public DefaultLibrary defaultLibrary() {
        return defaultLibrary;
    }

    public boolean isSubproject() {
        return !subproject.isEmpty();
    }

    public void analyze() {
        Path buildFile = sourceRoot.resolve(subdir()).resolve(BUILD_FILE_NAME);
        LOGGER.info("Start analysis of {}", buildFile);
        try {
            loadRootBuildFile();
            sanityCheckAst();
            parseProject();
            run();
        } catch (RuntimeException re) {
            LOGGER.error("Caught exception analyzing {}", buildFile);
            throw new AnalyzerException(buildFile.toString(), re);
        }
        LOGGER.info("End analysis of {}: {} targets, {} dependencies", buildFile, targets.size(),
                dependencies.size());
    }

    /*
    the subproject_dir keyword of the project declaration, without evaluating anything
     */
    public String extractSubprojectDir() {
        if (ast == null || ast.isEmpty() || !(ast.lines().get(0) instanceof FunctionNode project)) return null;
        Node value = project.arguments().keyword("subproject_dir");
        return value instanceof StringNode sn ? sn.value() : null;
    }

    // ---- project

    private RuntimeValue project(FunctionNode node, List<RuntimeValue> args, Map<String, RuntimeValue> kwargs) {
        if (projectNode != null) {
            throw new InvalidArgumentsException("Second call to project()", node.location());
        }
        projectNode = node;
        if (args.isEmpty()) {
            throw new InvalidArgumentsException("Not enough arguments to project(). Needs at least the project name.",
                    node.location());
        }
        String descriptiveName = args.get(0) instanceof StringValue sv ? sv.value() : "unknown";
        String version = kwargs.get("version") instanceof StringValue sv ? sv.value() : "undefined";
        projectData = new ProjectData(descriptiveName, version, null, List.of());

        RuntimeValue defaultOptions = kwargs.get("default_options");
        if (defaultOptions != null) {
            applyDefaultOptions(defaultOptions, node);
        }
        if (!isSubproject()) {
            if (kwargs.get("subproject_dir") instanceof StringValue sv) {
                subprojectDir = sv.value();
            }
            Path directory = sourceRoot.resolve(subprojectDir);
            List<String> names;
            try {
                names = options.subprojectEnumerator().list(directory);
            } catch (IOException ioe) {
                LOGGER.warn("Cannot list sub-projects in {}: {}", directory, ioe.getMessage());
                names = List.of();
            }
            names.forEach(this::doSubproject);
        }
        List<RuntimeValue> declaredLanguages = args.subList(1, args.size());
        addLanguages(declaredLanguages, true, MachineChoice.HOST, node);
        addLanguages(declaredLanguages, true, MachineChoice.BUILD, node);
        return null;
    }

    private void applyDefaultOptions(RuntimeValue defaultOptions, FunctionNode node) {
        for (RuntimeValue option : ListValue.flatten(defaultOptions)) {
            if (option instanceof StringValue sv) {
                int eq = sv.value().indexOf('=');
                if (eq < 0) {
                    throw new InvalidArgumentsException("Default option '" + sv.value() + "' is not key=value",
                            node.location());
                }
                String key = sv.value().substring(0, eq).strip();
                if ("default_library".equals(key)) {
                    defaultLibrary = DefaultLibrary.parse(sv.value().substring(eq + 1).strip());
                    LOGGER.debug("Default library of {} is {}", projectData.descriptiveName(), defaultLibrary);
                }
            }
        }
    }

    private void doSubproject(String dirname) {
        Path root = sourceRoot.resolve(subprojectDir).resolve(dirname);
        IntrospectionInterpreter sub = new IntrospectionInterpreter(root, "", dirname,
                new Options.Builder()
                        .setDefaultLibrary(options.defaultLibrary())
                        .setSubprojectDir(subprojectDir)
                        .setCompilerDetector(options.compilerDetector())
                        .setSubprojectEnumerator(options.subprojectEnumerator())
                        .setBuildFileLoader(options.buildFileLoader())
                        .build());
        try {
            sub.analyze();
            if (sub.projectData == null) {
                // project() was disabled, so nothing is known about the sub-project
                throw new InvalidCodeException("No project data for sub-project " + dirname, sub.ast().location());
            }
            targets.addAll(sub.targets);
            dependencies.addAll(sub.dependencies);
            projectData = projectData.withSubproject(sub.projectData.withName(dirname));
        } catch (AnalyzerException ae) {
            LOGGER.warn("Skipping sub-project {}: {}", dirname, ae.getMessage());
            subprojectFailures.add(ae);
        } catch (RuntimeException re) {
            LOGGER.warn("Skipping sub-project {}: {}", dirname, re.getMessage());
            subprojectFailures.add(new AnalyzerException(root.resolve(BUILD_FILE_NAME).toString(), re));
        }
    }

    // ---- languages

    private RuntimeValue addLanguagesCall(FunctionNode node, List<RuntimeValue> args,
                                          Map<String, RuntimeValue> kwargs) {
        RuntimeValue requiredValue = kwargs.getOrDefault("required", BoolValue.TRUE);
        boolean required;
        if (requiredValue instanceof BoolValue b) {
            required = b.value();
        } else if (requiredValue.isUnknown()) {
            required = false;
        } else {
            throw new InvalidArgumentsException("required: must be a bool, got " + requiredValue.typeName(),
                    node.location());
        }
        RuntimeValue nativeValue = kwargs.get("native");
        if (nativeValue instanceof BoolValue b) {
            addLanguages(args, required, b.value() ? MachineChoice.BUILD : MachineChoice.HOST, node);
        } else {
            addLanguages(args, required, MachineChoice.BUILD, node);
            addLanguages(args, required, MachineChoice.HOST, node);
        }
        return null;
    }

    private void addLanguages(List<RuntimeValue> rawLanguages, boolean required, MachineChoice machine,
                              FunctionNode node) {
        Set<String> detected = languages.get(machine);
        for (RuntimeValue value : ListValue.flatten(rawLanguages)) {
            if (!(value instanceof StringValue sv)) continue;
            String language = sv.value().toLowerCase(Locale.ROOT);
            if (detected.contains(language)) continue;
            try {
                options.compilerDetector().detect(language, machine);
                detected.add(language);
            } catch (CompilerDetectionException cde) {
                if (required) {
                    throw new InvalidCodeException("No compiler for language " + language + " on the "
                                                   + machine.name().toLowerCase(Locale.ROOT) + " machine: "
                                                   + cde.getMessage(), node.location());
                }
                LOGGER.debug("Ignoring optional language {}: {}", language, cde.getMessage());
            }
        }
    }

    // ---- dependencies

    private RuntimeValue dependency(FunctionNode node, List<RuntimeValue> args, Map<String, RuntimeValue> kwargs) {
        if (args.isEmpty()) return null;
        RuntimeValue nameValue = args.get(0);
        if (nameValue.isUnknown()) {
            LOGGER.debug("Dependency with unknown name at {}, not recorded", node.location());
            return null;
        }
        if (!(nameValue instanceof StringValue name)) {
            throw new InvalidArgumentsException("dependency() name must be a string, got " + nameValue.typeName(),
                    node.location());
        }
        RuntimeValue required = kwargs.getOrDefault("required", BoolValue.TRUE);
        if (!(required instanceof BoolValue) && !required.isUnknown()) {
            throw new InvalidArgumentsException("required: must be a bool, got " + required.typeName(),
                    node.location());
        }
        RuntimeValue version = kwargs.get("version");
        List<RuntimeValue> versions = version == null ? List.of()
                : version instanceof ListValue lv ? lv.elements() : List.of(version);
        IntrospectionDependency dependency = new IntrospectionDependency(name.value(), required, versions,
                kwargs.containsKey("fallback"), node.conditionLevel() > 0, node);
        dependencies.add(dependency);
        return dependency;
    }

    // ---- targets

    private RuntimeValue buildTargetCall(FunctionNode node, List<RuntimeValue> args,
                                         Map<String, RuntimeValue> kwargs) {
        if (!(kwargs.get("target_type") instanceof StringValue sv)) return null;
        Map<String, RuntimeValue> remaining = new LinkedHashMap<>(kwargs);
        remaining.remove("target_type");
        TargetType type = switch (sv.value()) {
            case "executable" -> TargetType.EXECUTABLE;
            case "shared_library", "both_libraries" -> TargetType.SHARED_LIBRARY;
            case "static_library" -> TargetType.STATIC_LIBRARY;
            case "shared_module" -> TargetType.SHARED_MODULE;
            case "library" -> defaultLibrary.targetType();
            case "jar" -> TargetType.JAR;
            default -> null;
        };
        if (type == null) {
            LOGGER.debug("Unknown target type {} at {}", sv.value(), node.location());
            return null;
        }
        return buildTarget(node, args, remaining, type);
    }

    private IntrospectionBuildTarget buildTarget(FunctionNode node, List<RuntimeValue> args,
                                                 Map<String, RuntimeValue> kwargs, TargetType type) {
        if (args.isEmpty()) {
            throw new InvalidArgumentsException("Target needs a name", node.location());
        }
        String name;
        if (args.get(0).isUnknown()) {
            name = "unknown";
        } else if (args.get(0) instanceof StringValue sv) {
            name = sv.value();
        } else {
            throw new InvalidArgumentsException("Target name must be a string, got " + args.get(0).typeName(),
                    node.location());
        }
        Arguments arguments = node.arguments();
        List<Node> sourceNodes = new ArrayList<>();
        if (arguments.positional().size() > 1) {
            sourceNodes.addAll(arguments.positional().subList(1, arguments.positional().size()));
        }
        Node sources = arguments.keyword("sources");
        if (sources != null) sourceNodes.add(sources);
        Node extraFiles = arguments.keyword("extra_files");

        String namePrefix = kwargs.get("name_prefix") instanceof StringValue p ? p.value() : null;
        String nameSuffix = kwargs.get("name_suffix") instanceof StringValue s ? s.value() : null;
        boolean buildByDefault = !(kwargs.get("build_by_default") instanceof BoolValue b) || b.value();
        boolean installed = kwargs.get("install") instanceof BoolValue i && i.value();
        String idName = nameSuffix == null ? name : name + "." + nameSuffix;

        IntrospectionBuildTarget target = new IntrospectionBuildTarget(name,
                targetId(subdir(), idName, type),
                type,
                sourceRoot.resolve(subdir()).resolve(BUILD_FILE_NAME).normalize().toString(),
                subdir(),
                buildByDefault,
                installed,
                type.outputs(name, namePrefix, nameSuffix),
                sourceNodes,
                extraFiles,
                kwargs,
                node);
        LOGGER.debug("Target {} in '{}'", target.id(), subdir());
        targets.add(target);
        return target;
    }

    static String targetId(String subdir, String name, TargetType type) {
        String id = name.replace('/', '@').replace('\\', '@') + "@" + type.idSuffix();
        if (subdir.isEmpty()) return id;
        return sha256Hex(subdir).substring(0, 7) + "@@" + id;
    }

    private static String sha256Hex(String s) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new AnalysisBugException("SHA-256 not available", e);
        }
    }

    /**
     * The sources of a target, as absolute paths where they are known.
     *
     * @return strings for plain file names and file references; unknown values where the source is computed
     */
    public List<RuntimeValue> sourceFiles(IntrospectionBuildTarget target) {
        List<RuntimeValue> result = new ArrayList<>();
        for (Node sourceNode : target.sourceNodes()) {
            for (RuntimeValue value : ListValue.flatten(resolve(sourceNode))) {
                if (value instanceof StringValue sv) {
                    result.add(new StringValue(sourceRoot.resolve(target.subdir()).resolve(sv.value())
                            .toAbsolutePath().normalize().toString()));
                } else if (value instanceof FileRef fr) {
                    result.add(new StringValue(fr.toAbsolutePath(sourceRoot).toString()));
                } else if (value.isUnknown()) {
                    result.add(value);
                } else {
                    LOGGER.debug("Ignoring source {} of {}", value, target.name());
                }
            }
        }
        return result;
    }
}
