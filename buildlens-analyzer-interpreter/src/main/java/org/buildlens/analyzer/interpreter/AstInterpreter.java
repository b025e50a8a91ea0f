package org.buildlens.analyzer.interpreter;

import org.buildlens.analyzer.ast.*;
import org.buildlens.analyzer.common.AnalysisBugException;
import org.buildlens.analyzer.common.InvalidArgumentsException;
import org.buildlens.analyzer.common.InvalidCodeException;
import org.buildlens.analyzer.interpreter.graph.DataflowGraph;
import org.buildlens.analyzer.interpreter.graph.impl.DataflowGraphImpl;
import org.buildlens.analyzer.interpreter.resolve.BuiltinMethods;
import org.buildlens.analyzer.interpreter.resolve.CallResults;
import org.buildlens.analyzer.interpreter.resolve.ValueResolver;
import org.buildlens.analyzer.interpreter.scope.AssignmentTracker;
import org.buildlens.analyzer.interpreter.scope.NestingPath;
import org.buildlens.analyzer.interpreter.scope.PotentialWrites;
import org.buildlens.analyzer.interpreter.value.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Walks the statements of a build file once, depth first, without executing them. While walking, it builds the
 * value-flow graph, records every definition of every variable with the conditional nesting at which it was made,
 * and evaluates function calls through a table of handlers. Loop bodies are visited once; both arms of every
 * conditional are visited.
 * <p>
 * Subclasses add handlers for the functions they are interested in.
 */
public class AstInterpreter {
    private static final Logger LOGGER = LoggerFactory.getLogger(AstInterpreter.class);

    public static final String BUILD_FILE_NAME = "meson.build";

    /*
    functions that are known, but whose value is not modelled
     */
    private static final List<String> OPAQUE_FUNCTIONS = List.of("project", "test", "benchmark",
            "install_headers", "install_man", "install_data", "install_subdir", "install_symlink",
            "install_emptydir", "configuration_data", "configure_file", "find_program", "include_directories",
            "add_global_arguments", "add_global_link_arguments", "add_project_arguments",
            "add_project_dependencies", "add_project_link_arguments", "message", "generator", "error",
            "run_command", "assert", "subproject", "dependency", "get_option", "join_paths", "environment",
            "import", "vcs_tag", "add_languages", "declare_dependency", "executable", "static_library",
            "shared_library", "library", "build_target", "custom_target", "run_target", "is_disabler",
            "is_variable", "jar", "warning", "shared_module", "option", "both_libraries", "add_test_setup",
            "subdir_done", "alias_target", "summary", "range", "structured_sources", "debug");

    /*
    these still run when one of their arguments is a disabler
     */
    private static final Set<String> DISABLER_AWARE = Set.of("set_variable", "get_variable", "unset_variable",
            "is_disabler", "disabler");

    protected final Path sourceRoot;
    protected final String subproject;
    protected final BuildFileLoader buildFileLoader;

    private final DataflowGraph graph = new DataflowGraphImpl();
    private final AssignmentTracker tracker = new AssignmentTracker();
    private final CallResults callResults = new CallResults();
    private final ValueResolver resolver = new ValueResolver(graph, callResults);
    private final Map<String, FunctionHandler> functions = new HashMap<>();
    private final Map<String, List<Node>> allAssignmentNodes = new LinkedHashMap<>();
    private final Set<Path> processedBuildFiles = new HashSet<>();
    private final List<String> diagnostics = new ArrayList<>();

    private String subdir;
    private NestingPath nesting = NestingPath.ROOT;
    private int evaluatedLines;
    protected CodeBlockNode ast;

    public AstInterpreter(Path sourceRoot, String subdir, String subproject, BuildFileLoader buildFileLoader) {
        this.sourceRoot = Objects.requireNonNull(sourceRoot);
        this.subdir = Objects.requireNonNull(subdir);
        this.subproject = Objects.requireNonNull(subproject);
        this.buildFileLoader = Objects.requireNonNull(buildFileLoader);
        OPAQUE_FUNCTIONS.forEach(name -> functions.put(name, this::doNothing));
        functions.put("files", this::files);
        functions.put("subdir", this::subdirCall);
        functions.put("set_variable", this::setVariable);
        functions.put("get_variable", this::getVariable);
        functions.put("unset_variable", this::unsetVariable);
        functions.put("disabler", (node, args, kwargs) -> Disabler.INSTANCE);
    }

    protected void registerFunction(String name, FunctionHandler handler) {
        functions.put(name, handler);
    }

    // ---- results

    public DataflowGraph graph() {
        return graph;
    }

    public AssignmentTracker tracker() {
        return tracker;
    }

    public Map<String, List<Node>> allAssignmentNodes() {
        return Collections.unmodifiableMap(allAssignmentNodes);
    }

    public List<String> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public CodeBlockNode ast() {
        return ast;
    }

    public String subdir() {
        return subdir;
    }

    public NestingPath nesting() {
        return nesting;
    }

    public RuntimeValue resolve(FlowVertex vertex) {
        return resolver.resolve(vertex);
    }

    /*
    the current definition of a variable, as a vertex of the graph
     */
    public FlowVertex lookup(String variable) {
        return tracker.lookup(variable, nesting);
    }

    // ---- driving the analysis

    public void loadRootBuildFile() {
        Path buildFile = sourceRoot.resolve(subdir).resolve(BUILD_FILE_NAME);
        if (!Files.isRegularFile(buildFile)) {
            throw new InvalidCodeException("Missing build file " + buildFile);
        }
        try {
            ast = buildFileLoader.load(buildFile);
        } catch (IOException ioe) {
            throw new UncheckedIOException("Cannot read " + buildFile, ioe);
        }
        processedBuildFiles.add(canonical(buildFile));
    }

    /*
    use an already parsed root build file
     */
    public void loadAst(CodeBlockNode ast) {
        this.ast = Objects.requireNonNull(ast);
        this.evaluatedLines = 0;
    }

    /*
    the root build file of a project must start with its declaration
     */
    public void sanityCheckAst() {
        if (ast == null) throw new AnalysisBugException("No build file loaded");
        if (ast.isEmpty() || !(ast.lines().get(0) instanceof FunctionNode fn) || !"project".equals(fn.name())) {
            throw new InvalidCodeException("First statement must be a call to project()", ast.location());
        }
    }

    public void parseProject() {
        if (ast == null) throw new AnalysisBugException("No build file loaded");
        if (evaluatedLines == 0 && !ast.isEmpty()) {
            evaluateStatement(ast.lines().get(0));
            evaluatedLines = 1;
        }
    }

    /*
    evaluate the statements of the root build file not yet evaluated by parseProject()
     */
    public void run() {
        if (ast == null) throw new AnalysisBugException("No build file loaded");
        evaluateCodeBlock(ast, evaluatedLines);
        evaluatedLines = ast.lines().size();
    }

    protected void diagnostic(String message) {
        LOGGER.warn(message);
        diagnostics.add(message);
    }

    public void evaluateCodeBlock(CodeBlockNode block) {
        evaluateCodeBlock(block, 0);
    }

    protected void evaluateCodeBlock(CodeBlockNode block, int start) {
        List<Node> lines = block.lines();
        for (int i = start; i < lines.size(); i++) {
            Node line = lines.get(i);
            try {
                evaluateStatement(line);
            } catch (RuntimeException re) {
                LOGGER.error("Caught exception in statement {}", line);
                throw re;
            }
        }
    }

    public void evaluateStatement(Node node) {
        addStructuralEdges(node);
        if (node instanceof IdNode id) {
            graph.addEdge(lookup(id.name()), id);
        } else if (node instanceof CodeBlockNode block) {
            evaluateCodeBlock(block);
        } else if (node instanceof FunctionNode fn) {
            functionCall(fn);
        } else if (node instanceof MethodNode mn) {
            methodCall(mn);
        } else if (node instanceof AssignmentNode an) {
            assignment(an);
        } else if (node instanceof PlusAssignmentNode pan) {
            plusAssignment(pan);
        } else if (node instanceof IfClauseNode icn) {
            evaluateIf(icn);
        } else if (node instanceof ForeachClauseNode fcn) {
            evaluateForeach(fcn);
        } else if (node instanceof ArrayNode an) {
            evaluateArguments(an.arguments());
        } else if (node instanceof DictNode dn) {
            for (Arguments.KeywordArgument ka : dn.arguments().keywords()) {
                evaluateStatement(ka.key());
                evaluateStatement(ka.value());
            }
        } else if (node instanceof ArithmeticNode an) {
            evaluateStatement(an.left());
            evaluateStatement(an.right());
        } else if (node instanceof ComparisonNode cn) {
            evaluateStatement(cn.left());
            evaluateStatement(cn.right());
        } else if (node instanceof AndNode an) {
            evaluateStatement(an.left());
            evaluateStatement(an.right());
        } else if (node instanceof OrNode on) {
            evaluateStatement(on.left());
            evaluateStatement(on.right());
        } else if (node instanceof NotNode nn) {
            evaluateStatement(nn.value());
        } else if (node instanceof UMinusNode un) {
            evaluateStatement(un.value());
        } else if (node instanceof ParenthesizedNode pn) {
            evaluateStatement(pn.inner());
        } else if (node instanceof TernaryNode tn) {
            evaluateStatement(tn.condition());
            evaluateStatement(tn.trueBlock());
            evaluateStatement(tn.falseBlock());
        } else if (node instanceof IndexNode in) {
            evaluateStatement(in.iobject());
            evaluateStatement(in.index());
        } else if (!(node instanceof StringNode || node instanceof NumberNode || node instanceof BooleanNode
                     || node instanceof FormatStringNode || node instanceof BreakNode
                     || node instanceof ContinueNode)) {
            throw new AnalysisBugException("Unhandled node type " + node.getClass().getSimpleName()
                                           + " at " + node.location());
        }
    }

    /*
    edges from operands and arguments into the node, before the node is evaluated
     */
    private void addStructuralEdges(Node node) {
        if (node instanceof FunctionNode fn) {
            addArgumentEdges(fn.arguments(), node);
        } else if (node instanceof MethodNode mn) {
            addArgumentEdges(mn.arguments(), node);
            graph.addEdge(mn.sourceObject(), node);
        } else if (node instanceof ArrayNode an) {
            addArgumentEdges(an.arguments(), node);
        } else if (node instanceof DictNode dn) {
            addArgumentEdges(dn.arguments(), node);
        } else if (node instanceof ArithmeticNode an) {
            graph.addEdge(an.left(), node);
            graph.addEdge(an.right(), node);
        } else if (node instanceof ComparisonNode cn) {
            graph.addEdge(cn.left(), node);
            graph.addEdge(cn.right(), node);
        } else if (node instanceof AndNode an) {
            graph.addEdge(an.left(), node);
            graph.addEdge(an.right(), node);
        } else if (node instanceof OrNode on) {
            graph.addEdge(on.left(), node);
            graph.addEdge(on.right(), node);
        } else if (node instanceof IndexNode in) {
            graph.addEdge(in.iobject(), node);
            graph.addEdge(in.index(), node);
        } else if (node instanceof TernaryNode tn) {
            graph.addEdge(tn.condition(), node);
            graph.addEdge(tn.trueBlock(), node);
            graph.addEdge(tn.falseBlock(), node);
        } else if (node instanceof ForeachClauseNode fcn) {
            graph.addEdge(fcn.items(), node);
        } else if (node instanceof NotNode nn) {
            graph.addEdge(nn.value(), node);
        } else if (node instanceof UMinusNode un) {
            graph.addEdge(un.value(), node);
        } else if (node instanceof ParenthesizedNode pn) {
            graph.addEdge(pn.inner(), node);
        }
    }

    private void addArgumentEdges(Arguments arguments, Node node) {
        arguments.valueStream().forEach(v -> graph.addEdge(v, node));
    }

    private void evaluateArguments(Arguments arguments) {
        arguments.valueStream().forEach(this::evaluateStatement);
    }

    // ---- assignments

    private void assignment(AssignmentNode node) {
        evaluateStatement(node.value());
        tracker.record(node.variableName(), nesting, node.value());
        addAssignmentNode(node.variableName(), node);
    }

    private void plusAssignment(PlusAssignmentNode node) {
        evaluateStatement(node.value());
        FlowVertex lhs = lookup(node.variableName());
        FlowVertex newValue;
        if (lhs instanceof Node lhsNode) {
            newValue = new ArithmeticNode(node.location(), ArithmeticOperator.ADD, lhsNode, node.value());
        } else {
            newValue = new UnknownValue();
        }
        tracker.record(node.variableName(), nesting, newValue);
        addAssignmentNode(node.variableName(), node);
        graph.addEdge(lhs, newValue);
        graph.addEdge(node.value(), newValue);
    }

    private void addAssignmentNode(String variable, Node node) {
        allAssignmentNodes.computeIfAbsent(variable, v -> new ArrayList<>()).add(node);
    }

    // ---- control flow

    /*
    the condition is not evaluated; all arms are, each at its own nesting path
     */
    private void evaluateIf(IfClauseNode node) {
        nesting = nesting.push(0);
        for (IfNode arm : node.ifs()) {
            evaluateCodeBlock(arm.block());
            nesting = nesting.incrementLast();
        }
        if (node.elseBlock() != null) {
            evaluateCodeBlock(node.elseBlock());
        }
        nesting = nesting.pop();
        tracker.mergeBranches(nesting, graph);
    }

    /*
    the body is visited once; anything it may write is unknown inside and after the loop
     */
    private void evaluateForeach(ForeachClauseNode node) {
        Set<String> writes = PotentialWrites.of(node);
        tracker.seedUnknown(writes, nesting);
        evaluateCodeBlock(node.block());
        tracker.seedUnknown(writes, nesting);
    }

    // ---- calls

    protected record ReducedArguments(List<RuntimeValue> args, Map<String, RuntimeValue> kwargs) {
        boolean isDisabled() {
            return args.stream().anyMatch(AstInterpreter::containsDisabler)
                   || kwargs.values().stream().anyMatch(AstInterpreter::containsDisabler);
        }

        boolean containsUnknown() {
            return args.stream().anyMatch(RuntimeValue::isUnknown)
                   || kwargs.values().stream().anyMatch(RuntimeValue::isUnknown);
        }
    }

    private static boolean containsDisabler(RuntimeValue value) {
        if (value instanceof Disabler) return true;
        if (value instanceof ListValue lv) return lv.elements().stream().anyMatch(AstInterpreter::containsDisabler);
        return false;
    }

    /*
    positional arguments are flattened, for functions and methods alike
     */
    private ReducedArguments reduceArguments(Arguments arguments) {
        evaluateArguments(arguments);
        List<RuntimeValue> args = arguments.positional().stream().map(resolver::resolve).toList();
        Map<String, RuntimeValue> kwargs = new LinkedHashMap<>();
        for (Arguments.KeywordArgument ka : arguments.keywords()) {
            String key = Arguments.keyName(ka);
            if (key == null) throw new InvalidArgumentsException("Keyword must be an identifier", ka.key().location());
            if (kwargs.put(key, resolver.resolve(ka.value())) != null) {
                throw new InvalidArgumentsException("Duplicate keyword argument " + key, ka.key().location());
            }
        }
        return new ReducedArguments(ListValue.flatten(args), kwargs);
    }

    private void functionCall(FunctionNode node) {
        ReducedArguments reduced = reduceArguments(node.arguments());
        String name = node.name();
        RuntimeValue result;
        if (!DISABLER_AWARE.contains(name) && reduced.isDisabled()) {
            result = Disabler.INSTANCE;
        } else {
            FunctionHandler handler = functions.get(name);
            if (handler == null) {
                LOGGER.debug("Unknown function {}, unknown result", name);
                result = null;
            } else {
                result = handler.call(node, reduced.args(), reduced.kwargs());
            }
        }
        callResults.put(node, result == null ? new UnknownValue() : result);
    }

    private void methodCall(MethodNode node) {
        evaluateStatement(node.sourceObject());
        RuntimeValue receiver = resolver.resolve(node.sourceObject());
        ReducedArguments reduced = reduceArguments(node.arguments());
        RuntimeValue result;
        if (receiver instanceof Disabler || reduced.isDisabled()) {
            result = Disabler.INSTANCE;
        } else if (reduced.containsUnknown() || !receiver.isPrimitive()) {
            result = new UnknownValue();
        } else {
            result = BuiltinMethods.call(receiver, node.name(), reduced.args(), node.location());
        }
        callResults.put(node, result);
    }

    protected RuntimeValue doNothing(FunctionNode node, List<RuntimeValue> args, Map<String, RuntimeValue> kwargs) {
        return new UnknownValue();
    }

    private RuntimeValue files(FunctionNode node, List<RuntimeValue> args, Map<String, RuntimeValue> kwargs) {
        List<RuntimeValue> result = new ArrayList<>(args.size());
        for (RuntimeValue arg : args) {
            if (arg instanceof StringValue sv) {
                result.add(new FileRef(subdir, sv.value()));
            } else if (arg.isUnknown() || arg instanceof FileRef) {
                result.add(arg);
            } else {
                throw new InvalidArgumentsException("files() expects strings, got " + arg.typeName(),
                        node.location());
            }
        }
        return new ListValue(result);
    }

    private RuntimeValue subdirCall(FunctionNode node, List<RuntimeValue> args, Map<String, RuntimeValue> kwargs) {
        if (args.size() != 1 || !(args.get(0) instanceof StringValue sv)) {
            diagnostic("Unable to evaluate subdir(" + args + ") at " + node.location() + " --> Skipping");
            return null;
        }
        String previousSubdir = subdir;
        String newSubdir = previousSubdir.isEmpty() ? sv.value() : previousSubdir + "/" + sv.value();
        Path buildFile = sourceRoot.resolve(newSubdir).resolve(BUILD_FILE_NAME);
        if (!processedBuildFiles.add(canonical(buildFile))) {
            diagnostic("Trying to enter " + sv.value() + " which has already been visited --> Skipping");
            return null;
        }
        if (!Files.isRegularFile(buildFile)) {
            diagnostic("Unable to find build file " + newSubdir + "/" + BUILD_FILE_NAME + " --> Skipping");
            return null;
        }
        CodeBlockNode block;
        try {
            block = buildFileLoader.load(buildFile);
        } catch (IOException | InvalidCodeException e) {
            diagnostic("Unable to load " + buildFile + ": " + e.getMessage() + " --> Skipping");
            return null;
        }
        LOGGER.debug("Entering subdir {}", newSubdir);
        subdir = newSubdir;
        try {
            evaluateCodeBlock(block);
        } finally {
            subdir = previousSubdir;
        }
        return null;
    }

    private static Path canonical(Path path) {
        Path directory = path.getParent();
        try {
            if (Files.isDirectory(directory)) {
                return directory.toRealPath().resolve(path.getFileName());
            }
        } catch (IOException ioe) {
            LOGGER.debug("Cannot resolve {}: {}", directory, ioe.getMessage());
        }
        return path.toAbsolutePath().normalize();
    }

    private RuntimeValue setVariable(FunctionNode node, List<RuntimeValue> args, Map<String, RuntimeValue> kwargs) {
        Arguments arguments = node.arguments();
        if (arguments.hasKeywords()) {
            throw new InvalidArgumentsException("set_variable accepts no keyword arguments", node.location());
        }
        if (arguments.positional().size() != 2) {
            throw new InvalidArgumentsException("set_variable requires exactly two positional arguments",
                    node.location());
        }
        RuntimeValue name = resolver.resolve(arguments.positional().get(0));
        Node value = arguments.positional().get(1);
        if (name.isUnknown()) {
            LOGGER.debug("set_variable with unknown name at {}, tainting", node.location());
            tracker.taint();
        } else if (name instanceof StringValue sv) {
            tracker.record(sv.value(), nesting, value);
            addAssignmentNode(sv.value(), new AssignmentNode(node.location(), sv.value(), value));
        } else {
            throw new InvalidArgumentsException("set_variable expects a string name, got " + name.typeName(),
                    node.location());
        }
        return null;
    }

    private RuntimeValue getVariable(FunctionNode node, List<RuntimeValue> args, Map<String, RuntimeValue> kwargs) {
        List<Node> positional = node.arguments().positional();
        if (positional.isEmpty() || positional.size() > 2) {
            throw new InvalidArgumentsException("get_variable takes one or two positional arguments",
                    node.location());
        }
        RuntimeValue name = resolver.resolve(positional.get(0));
        if (name.isUnknown()) return null;
        if (!(name instanceof StringValue sv)) {
            throw new InvalidArgumentsException("get_variable expects a string name, got " + name.typeName(),
                    node.location());
        }
        boolean hasFallback = positional.size() == 2;
        FlowVertex definition = tracker.lookup(sv.value(), nesting, hasFallback);
        if (definition == null) definition = positional.get(1);
        graph.addEdge(definition, node);
        callResults.forward(node, definition);
        return null;
    }

    private RuntimeValue unsetVariable(FunctionNode node, List<RuntimeValue> args, Map<String, RuntimeValue> kwargs) {
        Arguments arguments = node.arguments();
        if (arguments.hasKeywords()) {
            throw new InvalidArgumentsException("unset_variable accepts no keyword arguments", node.location());
        }
        if (arguments.positional().size() != 1) {
            throw new InvalidArgumentsException("unset_variable requires exactly one positional argument",
                    node.location());
        }
        if (resolver.resolve(arguments.positional().get(0)) instanceof StringValue sv) {
            tracker.record(sv.value(), nesting, node);
        } else {
            tracker.taint();
        }
        return null;
    }
}
