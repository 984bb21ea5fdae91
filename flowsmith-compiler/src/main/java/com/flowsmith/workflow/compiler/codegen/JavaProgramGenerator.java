/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.codegen;

import com.flowsmith.workflow.api.exceptions.ConditionException;
import com.flowsmith.workflow.api.exceptions.GenerationException;
import com.flowsmith.workflow.api.model.Branch;
import com.flowsmith.workflow.api.model.CompiledWorkflow;
import com.flowsmith.workflow.api.model.Dispatcher;
import com.flowsmith.workflow.api.model.Fanout;
import com.flowsmith.workflow.api.model.InputParam;
import com.flowsmith.workflow.api.model.JoinPolicy;
import com.flowsmith.workflow.api.model.NodeVisitor;
import com.flowsmith.workflow.api.model.OutputParam;
import com.flowsmith.workflow.api.model.RoutingRule;
import com.flowsmith.workflow.api.model.Sequence;
import com.flowsmith.workflow.api.model.ToolInvocation;
import com.flowsmith.workflow.api.model.WorkflowNode;
import com.flowsmith.workflow.api.model.WorkflowSpec;
import com.flowsmith.workflow.compiler.analysis.ScopeAnalyzer;
import com.flowsmith.workflow.compiler.security.CredentialClassifier;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Emits an accepted workflow as one self-contained Java class.
 *
 * <p>The class exposes {@code executeWorkflow(Map)} as its entry operation,
 * a {@code main} showing example usage, and one public method per distinct
 * tool. Node translation:
 * <ul>
 *   <li>tool invocation: argument map, tool call, optional context write;</li>
 *   <li>sequence: statements in order;</li>
 *   <li>branch: {@code if}/{@code else} on the translated condition;</li>
 *   <li>fan-out: one concurrent unit per branch, joined by its policy;</li>
 *   <li>dispatcher: {@code if}/{@code else if} chain in rule order, default last.</li>
 * </ul>
 * Nested composite nodes are emitted as private {@code runStepN(Scope)}
 * methods called from their parent, so no single method grows with the
 * size of the whole workflow.
 *
 * <p>Output depends only on the workflow, the tool library and the target
 * package: there is no timestamp, and every iteration over names is sorted
 * or follows document order.
 */
public class JavaProgramGenerator {
    private static final Logger logger = Logger.getLogger(JavaProgramGenerator.class.getName());

    private static final String ROOT_SCOPE = "scope";

    private final String packageName;
    private final ScopeAnalyzer scopeAnalyzer = new ScopeAnalyzer();

    public JavaProgramGenerator() {
        this(GeneratorOptions.DEFAULT);
    }

    public JavaProgramGenerator(GeneratorOptions options) {
        this.packageName = options.targetPackage();
    }

    public String getPackageName() {
        return packageName;
    }

    /**
     * Generates the program for an accepted workflow.
     *
     * @param workflow a workflow that passed validation
     * @param library known library implementations of tools
     * @return the generated program
     * @throws com.flowsmith.workflow.api.exceptions.ScopeException if a reference is not guaranteed available
     * @throws GenerationException if translation fails
     */
    public CompiledWorkflow generate(WorkflowSpec workflow, ToolLibraryIndex library) {
        scopeAnalyzer.analyze(workflow).requireSound();

        ToolUsage usage = ToolUsage.of(workflow.workflow());
        Map<String, String> methodNames = JavaNames.methodNames(usage.toolNames());
        String className = JavaNames.className(workflow.name());

        SourceBuilder out = new SourceBuilder();
        try {
            writeHeader(out, workflow);
            writeClassDoc(out, workflow, usage, library);
            out.open("public final class " + className);
            writeConstants(out, workflow);
            out.blank();
            writeEntryOperation(out, workflow);
            out.blank();
            writeWorkflowBody(out, workflow, methodNames);
            for (String tool : usage.toolNames()) {
                out.blank();
                writeToolOperation(out, tool, methodNames.get(tool), usage.parametersOf(tool), library.find(tool));
            }
            out.blank();
            writeMain(out, workflow, className);
            out.blank();
            out.lines(RuntimeSupport.MEMBERS);
            out.close();
        } catch (ConditionException | IllegalArgumentException e) {
            throw new GenerationException("Failed to generate workflow '" + workflow.name() + "': " + e.getMessage(), e);
        }

        logger.fine(() -> "Generated " + className + " with " + usage.toolNames().size() + " tool operation(s)");
        return new CompiledWorkflow(workflow, packageName, className, out.toString(),
                workflow.secretInputNames().stream().collect(Collectors.toCollection(TreeSet::new)),
                usage.toolNames());
    }

    private void writeHeader(SourceBuilder out, WorkflowSpec workflow) {
        out.line("/*");
        out.line(" * Generated by Flowsmith from workflow '" + workflow.name() + "' version "
                + JavaLiterals.commentText(workflow.version()) + ".");
        out.line(" * Do not edit: regenerate from the workflow document instead.");
        out.line(" */");
        if (!packageName.isEmpty()) {
            out.line("package " + packageName + ";");
        }
        out.blank();
        for (String imported : RuntimeSupport.IMPORTS) {
            out.line("import " + imported + ";");
        }
        out.blank();
    }

    private void writeClassDoc(SourceBuilder out, WorkflowSpec workflow, ToolUsage usage, ToolLibraryIndex library) {
        out.line("/**");
        out.line(" * Workflow " + workflow.name() + ".");
        if (workflow.description() != null && !workflow.description().isBlank()) {
            out.line(" *");
            workflow.description().lines()
                    .map(JavaLiterals::commentText)
                    .forEach(line -> out.line(line.isEmpty() ? " *" : " * " + line));
        }
        if (!workflow.inputs().isEmpty()) {
            out.line(" *");
            out.line(" * <p>Inputs:");
            for (InputParam input : workflow.inputs()) {
                out.line(" *   " + input.name() + " (" + input.type().jsonName() + (input.secret() ? ", secret" : "")
                        + ")" + describe(input.description()));
            }
        }
        if (!workflow.outputs().isEmpty()) {
            out.line(" *");
            out.line(" * <p>Outputs:");
            for (OutputParam output : workflow.outputs()) {
                out.line(" *   " + output.name() + " (" + output.type().jsonName() + ")" + describe(output.description()));
            }
        }
        SortedSet<String> variables = requiredEnvironment(workflow, usage, library);
        if (!variables.isEmpty()) {
            out.line(" *");
            out.line(" * <p>Environment variables:");
            for (String variable : variables) {
                out.line(" *   export " + variable + "=&lt;your-value-here&gt;");
            }
        }
        out.line(" */");
    }

    private static String describe(String description) {
        return description == null || description.isBlank() ? "" : ": " + JavaLiterals.commentText(description);
    }

    /**
     * Secret inputs plus credential-like parameters of stubbed tools, sorted.
     */
    private static SortedSet<String> requiredEnvironment(WorkflowSpec workflow, ToolUsage usage,
                                                         ToolLibraryIndex library) {
        SortedSet<String> variables = new TreeSet<>();
        for (InputParam input : workflow.inputs()) {
            if (input.secret()) {
                variables.add(input.environmentVariable());
            }
        }
        for (String tool : usage.toolNames()) {
            if (!library.contains(tool)) {
                usage.parametersOf(tool).stream()
                        .filter(CredentialClassifier::isCredentialName)
                        .map(CredentialClassifier::environmentVariable)
                        .forEach(variables::add);
            }
        }
        return variables;
    }

    private void writeConstants(SourceBuilder out, WorkflowSpec workflow) {
        List<String> required = workflow.inputs().stream().map(InputParam::name).toList();
        List<String> outputs = workflow.outputs().stream().map(OutputParam::name).toList();
        out.line("private static final List<String> REQUIRED_INPUTS = " + listConstant(required) + ";");
        out.line("private static final List<String> SECRET_INPUTS = "
                + listConstant(new ArrayList<>(workflow.secretInputNames())) + ";");
        out.line("private static final List<String> OUTPUTS = " + listConstant(outputs) + ";");
    }

    private static String listConstant(List<String> names) {
        return names.stream().map(JavaLiterals::quote).collect(Collectors.joining(", ", "List.of(", ")"));
    }

    private void writeEntryOperation(SourceBuilder out, WorkflowSpec workflow) {
        out.line("/**");
        out.line(" * Runs the workflow.");
        out.line(" *");
        out.line(" * <p>Secret inputs that are not supplied are read from the environment");
        out.line(" * variable named after the upper-cased input name.");
        out.line(" *");
        out.line(" * @param inputs input values by name");
        out.line(" * @return the declared outputs, or the whole context when none are declared");
        out.line(" * @throws IllegalArgumentException if a declared input is missing");
        out.line(" * @throws WorkflowExecutionException if any step fails");
        out.line(" */");
        out.open("public Map<String, Object> executeWorkflow(Map<String, Object> inputs)");
        out.line("Map<String, Object> resolved = new LinkedHashMap<>(Objects.requireNonNull(inputs, \"inputs\"));");
        out.open("for (String name : SECRET_INPUTS)");
        out.line("resolveSecret(resolved, name);");
        out.close();
        out.open("for (String name : REQUIRED_INPUTS)");
        out.open("if (!resolved.containsKey(name))");
        out.line("throw new IllegalArgumentException(\"Missing required input: \" + name);");
        out.close();
        out.close();
        out.blank();
        out.line("Scope " + ROOT_SCOPE + " = new Scope(null);");
        out.line("resolved.forEach(" + ROOT_SCOPE + "::put);");
        out.open("try");
        out.line("runWorkflow(" + ROOT_SCOPE + ");");
        out.reopen("catch (RuntimeException e)");
        out.line("throw new WorkflowExecutionException(" + JavaLiterals.quote("Workflow '" + workflow.name() + "' failed: ")
                + " + e.getMessage(), e,");
        out.line("        maskSecrets(" + ROOT_SCOPE + ".snapshot()), maskSecrets(resolved));");
        out.close();
        out.blank();
        out.open("if (OUTPUTS.isEmpty())");
        out.line("return " + ROOT_SCOPE + ".snapshot();");
        out.close();
        out.line("Map<String, Object> outputs = new LinkedHashMap<>();");
        out.open("for (String name : OUTPUTS)");
        out.line("outputs.put(name, " + ROOT_SCOPE + ".get(name));");
        out.close();
        out.line("return outputs;");
        out.close();
    }

    private void writeWorkflowBody(SourceBuilder out, WorkflowSpec workflow, Map<String, String> methodNames) {
        StatementWriter writer = new StatementWriter(out, methodNames);
        out.open("private void runWorkflow(Scope " + ROOT_SCOPE + ")");
        workflow.workflow().accept(writer, ROOT_SCOPE);
        out.close();
        writer.writeStepMethods();
    }

    private void writeToolOperation(SourceBuilder out, String tool, String method, SortedSet<String> parameters,
                                    Optional<ToolBinding> binding) {
        if (binding.isPresent()) {
            out.line("/**");
            out.line(" * Tool " + tool + ", implemented by " + binding.get() + ".");
            out.line(" */");
            out.open("public Object " + method + "(Map<String, Object> kwargs)");
            out.line("return " + binding.get().invocationTarget() + "(kwargs);");
            out.close();
            return;
        }
        List<String> guarded = parameters.stream().filter(CredentialClassifier::isCredentialName).toList();
        out.line("/**");
        out.line(" * Tool " + tool + ". No implementation is registered, so a placeholder result is returned.");
        if (!guarded.isEmpty()) {
            out.line(" *");
            out.line(" * @throws MissingConfigurationException if a required credential is not configured");
        }
        out.line(" */");
        out.open("public Object " + method + "(Map<String, Object> kwargs)");
        for (String parameter : guarded) {
            out.line("requireEnv(" + JavaLiterals.quote(CredentialClassifier.environmentVariable(parameter)) + ");");
        }
        out.line("return placeholderResult(" + JavaLiterals.quote(tool) + ", kwargs);");
        out.close();
    }

    private void writeMain(SourceBuilder out, WorkflowSpec workflow, String className) {
        out.open("public static void main(String[] args)");
        out.line("Map<String, Object> inputs = new LinkedHashMap<>();");
        for (InputParam input : workflow.inputs()) {
            String value = input.secret()
                    ? "System.getenv(" + JavaLiterals.quote(input.environmentVariable()) + ")"
                    : exampleValue(input);
            out.line("inputs.put(" + JavaLiterals.quote(input.name()) + ", " + value + ");");
        }
        out.open("try");
        out.line("Map<String, Object> result = new " + className + "().executeWorkflow(inputs);");
        out.line("System.out.println(\"Workflow completed: \" + result);");
        out.reopen("catch (RuntimeException e)");
        out.line("System.err.println(\"Workflow failed: \" + e.getMessage());");
        out.line("System.exit(1);");
        out.close();
        out.close();
    }

    private static String exampleValue(InputParam input) {
        return switch (input.type()) {
            case INT -> "0";
            case FLOAT, NUMBER -> "0.0d";
            case BOOLEAN -> "Boolean.FALSE";
            case DICT, OBJECT -> "new LinkedHashMap<String, Object>()";
            case LIST, ARRAY -> "new ArrayList<Object>()";
            case STRING, ANY -> JavaLiterals.quote("example_" + input.name());
        };
    }

    /**
     * Writes statements for one node. The argument is the name of the scope
     * variable the node reads and writes. Local names come from a single
     * counter, so nested blocks and lambdas never redeclare a variable.
     *
     * <p>Every composite child (a sequence, branch, fan-out or dispatcher
     * nested in another node) is written as its own {@code runStepN} method,
     * and long runs of tool invocations are split into chunks. This keeps each
     * emitted method far below the class file limit of 64KB of bytecode.
     */
    private static final class StatementWriter implements NodeVisitor<Void, String> {
        /** Roughly one unit per emitted statement or argument entry. */
        static final int INLINE_BUDGET = 400;

        private final SourceBuilder out;
        private final Map<String, String> methodNames;
        private final Deque<PendingStep> pending = new ArrayDeque<>();
        private int counter;
        private int steps;

        StatementWriter(SourceBuilder out, Map<String, String> methodNames) {
            this.out = out;
            this.methodNames = methodNames;
        }

        /**
         * Writes the step methods queued while writing the body, including the ones they queue in turn.
         */
        void writeStepMethods() {
            while (!pending.isEmpty()) {
                PendingStep step = pending.removeFirst();
                out.blank();
                out.open("private void " + step.method() + "(Scope " + ROOT_SCOPE + ")");
                step.node().accept(this, ROOT_SCOPE);
                out.close();
            }
        }

        private String fresh(String prefix) {
            return prefix + (++counter);
        }

        private void comment(WorkflowNode node) {
            if (node.description() != null && !node.description().isBlank()) {
                out.line("// " + JavaLiterals.commentText(node.description()));
            }
        }

        /**
         * Writes a tool invocation in place and moves anything else into a step method.
         */
        private void child(WorkflowNode node, String scope) {
            if (node instanceof ToolInvocation) {
                node.accept(this, scope);
            } else {
                extract(node, scope);
            }
        }

        private void extract(WorkflowNode node, String scope) {
            String method = "runStep" + (++steps);
            pending.addLast(new PendingStep(method, node));
            out.line(method + "(" + scope + ");");
        }

        private static int weight(WorkflowNode node) {
            if (node instanceof ToolInvocation invocation) {
                int weight = 3;
                for (Object value : invocation.parameters().values()) {
                    weight += valueWeight(value);
                }
                return weight;
            }
            return 1;
        }

        private static int valueWeight(Object value) {
            int weight = 1;
            if (value instanceof Map<?, ?> map) {
                for (Object nested : map.values()) {
                    weight += valueWeight(nested);
                }
            } else if (value instanceof List<?> list) {
                for (Object nested : list) {
                    weight += valueWeight(nested);
                }
            }
            return weight;
        }

        @Override
        public Void visitToolInvocation(ToolInvocation node, String scope) {
            comment(node);
            String args = fresh("args");
            out.line("Map<String, Object> " + args + " = new LinkedHashMap<>();");
            for (Map.Entry<String, Object> parameter : node.parameters().entrySet()) {
                out.line(args + ".put(" + JavaLiterals.quote(parameter.getKey()) + ", "
                        + JavaLiterals.parameterValue(parameter.getValue(), scope) + ");");
            }
            String call = methodNames.get(node.toolName()) + "(" + args + ")";
            if (node.bindsTo() != null) {
                out.line(scope + ".put(" + JavaLiterals.quote(node.bindsTo()) + ", " + call + ");");
            } else {
                out.line(call + ";");
            }
            return null;
        }

        @Override
        public Void visitSequence(Sequence node, String scope) {
            comment(node);
            List<WorkflowNode> body = node.steps();
            int total = body.stream().mapToInt(StatementWriter::weight).sum();
            if (body.size() == 1 || total <= INLINE_BUDGET) {
                body.forEach(step -> child(step, scope));
                return null;
            }
            List<WorkflowNode> chunk = new ArrayList<>();
            int chunkWeight = 0;
            for (WorkflowNode step : body) {
                int weight = weight(step);
                if (!chunk.isEmpty() && chunkWeight + weight > INLINE_BUDGET) {
                    extract(new Sequence(chunk), scope);
                    chunk = new ArrayList<>();
                    chunkWeight = 0;
                }
                chunk.add(step);
                chunkWeight += weight;
            }
            extract(new Sequence(chunk), scope);
            return null;
        }

        @Override
        public Void visitBranch(Branch node, String scope) {
            comment(node);
            out.open("if (" + new ConditionTranslator(scope).translate(node.condition()) + ")");
            child(node.ifBranch(), scope);
            if (node.elseBranch() != null) {
                out.reopen("else");
                child(node.elseBranch(), scope);
            }
            out.close();
            return null;
        }

        @Override
        public Void visitFanout(Fanout node, String scope) {
            comment(node);
            String units = fresh("units");
            if (node.joinPolicy() == JoinPolicy.WAIT_FOR_ALL) {
                out.line("List<Runnable> " + units + " = new ArrayList<>();");
                for (WorkflowNode branch : node.branches()) {
                    out.open(units + ".add(() ->");
                    child(branch, scope);
                    out.close("});");
                }
                out.line("joinAll(" + units + ");");
            } else {
                out.line("List<Callable<Scope>> " + units + " = new ArrayList<>();");
                for (WorkflowNode branch : node.branches()) {
                    String branchScope = fresh("scope");
                    out.open(units + ".add(() ->");
                    out.line("Scope " + branchScope + " = new Scope(" + scope + ");");
                    child(branch, branchScope);
                    out.line("return " + branchScope + ";");
                    out.close("});");
                }
                List<String> raced = new ArrayList<>(ToolUsage.of(node).bindings());
                out.line("joinFirst(" + units + ").commitTo(" + scope + ", " + listConstant(raced) + ");");
            }
            return null;
        }

        @Override
        public Void visitDispatcher(Dispatcher node, String scope) {
            comment(node);
            ConditionTranslator translator = new ConditionTranslator(scope);
            List<RoutingRule> rules = node.routingRules();
            if (rules.isEmpty()) {
                node.fallback().ifPresent(fallback -> {
                    out.line("// default route: " + fallback);
                    child(node.subWorkflows().get(fallback), scope);
                });
                return null;
            }
            for (int i = 0; i < rules.size(); i++) {
                RoutingRule rule = rules.get(i);
                String test = "if (" + translator.translate(rule.condition()) + ")";
                if (i == 0) {
                    out.open(test);
                } else {
                    out.reopen("else " + test);
                }
                out.line("// route: " + rule.target());
                child(node.subWorkflows().get(rule.target()), scope);
            }
            if (node.defaultWorkflow() != null) {
                out.reopen("else");
                out.line("// default route: " + node.defaultWorkflow());
                child(node.subWorkflows().get(node.defaultWorkflow()), scope);
            }
            out.close();
            return null;
        }
    }

    private record PendingStep(String method, WorkflowNode node) {
    }
}
