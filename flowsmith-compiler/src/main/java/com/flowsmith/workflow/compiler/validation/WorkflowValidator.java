/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.validation;

import com.flowsmith.workflow.api.exceptions.ConditionException;
import com.flowsmith.workflow.api.exceptions.ErrorKind;
import com.flowsmith.workflow.api.exceptions.ValidationIssue;
import com.flowsmith.workflow.api.exceptions.WorkflowValidationException;
import com.flowsmith.workflow.api.model.Branch;
import com.flowsmith.workflow.api.model.Dispatcher;
import com.flowsmith.workflow.api.model.Fanout;
import com.flowsmith.workflow.api.model.InputParam;
import com.flowsmith.workflow.api.model.NodeVisitor;
import com.flowsmith.workflow.api.model.OutputParam;
import com.flowsmith.workflow.api.model.RoutingRule;
import com.flowsmith.workflow.api.model.Sequence;
import com.flowsmith.workflow.api.model.ToolInvocation;
import com.flowsmith.workflow.api.model.WorkflowNode;
import com.flowsmith.workflow.api.model.WorkflowSpec;
import com.flowsmith.workflow.compiler.analysis.References;
import com.flowsmith.workflow.compiler.analysis.ScopeAnalyzer;
import com.flowsmith.workflow.compiler.condition.ConditionGrammar;
import com.flowsmith.workflow.compiler.condition.ConditionParser;
import com.flowsmith.workflow.compiler.parse.ParsedDocument;
import com.flowsmith.workflow.compiler.security.CredentialClassifier;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import static com.flowsmith.workflow.compiler.validation.IssueCollector.child;
import static com.flowsmith.workflow.compiler.validation.IssueCollector.index;

/**
 * Checks a read document against every workflow rule and reports all issues
 * of one pass: structural issues from the reader, then naming, condition,
 * reference, complexity and credential issues, then scope issues.
 *
 * <p>Scope analysis only runs over a structurally complete tree. When the
 * reader dropped a node, the bindings that node would have made are unknown,
 * and scope issues reported over the hole would be misleading.
 */
public class WorkflowValidator {
    private static final Logger logger = Logger.getLogger(WorkflowValidator.class.getName());

    private final ValidationLimits limits;
    private final ScopeAnalyzer scopeAnalyzer;

    public WorkflowValidator() {
        this(ValidationLimits.DEFAULT);
    }

    public WorkflowValidator(ValidationLimits limits) {
        this(limits, new ScopeAnalyzer());
    }

    public WorkflowValidator(ValidationLimits limits, ScopeAnalyzer scopeAnalyzer) {
        this.limits = limits;
        this.scopeAnalyzer = scopeAnalyzer;
    }

    public List<ValidationIssue> validate(WorkflowSpec workflow) {
        return validate(ParsedDocument.of(workflow));
    }

    public List<ValidationIssue> validate(ParsedDocument document) {
        List<ValidationIssue> issues = new ArrayList<>(validateStructure(document));
        issues.addAll(validateScope(document));
        return List.copyOf(issues);
    }

    /**
     * Reader issues plus every check except scope analysis.
     */
    public List<ValidationIssue> validateStructure(ParsedDocument document) {
        IssueCollector issues = new IssueCollector();
        issues.addAll(document.issues());

        checkHeader(document, issues);
        checkInputs(document.inputs(), issues);
        checkOutputs(document.outputs(), issues);
        if (document.workflow() != null) {
            document.workflow().accept(new NodeRules(issues, document), new Frame("workflow", 1));
        }
        return issues.toList();
    }

    /**
     * Scope issues, or none when the document is incomplete.
     */
    public List<ValidationIssue> validateScope(ParsedDocument document) {
        if (!document.complete()) {
            logger.fine("Skipping scope analysis: the document has unreadable nodes");
            return List.of();
        }
        return document.toSpec()
                .map(spec -> scopeAnalyzer.analyze(spec).toIssues())
                .orElse(List.of());
    }

    /**
     * Validates and returns the workflow, or throws with every issue found.
     *
     * @throws WorkflowValidationException if any issue was found
     */
    public WorkflowSpec requireValid(ParsedDocument document) {
        List<ValidationIssue> issues = validate(document);
        if (!issues.isEmpty()) {
            throw new WorkflowValidationException(issues);
        }
        return document.toSpec().orElseThrow(() -> new IllegalStateException(
                "Document without issues must have a name and a workflow"));
    }

    private void checkHeader(ParsedDocument document, IssueCollector issues) {
        if (document.name() != null) {
            Identifiers.problem(document.name(), "Workflow name")
                    .ifPresent(problem -> issues.add(ErrorKind.NAMING, "name", problem));
        }
        if (document.description() != null && document.description().isBlank()) {
            issues.add(ErrorKind.STRUCTURAL, "description", "description cannot be empty");
        }
        if (document.version() != null && !Identifiers.isVersion(document.version())) {
            issues.add(ErrorKind.NAMING, "version",
                    "Version '" + document.version() + "' must have the form X.Y.Z, e.g. 1.0.0");
        }
    }

    private void checkInputs(List<InputParam> inputs, IssueCollector issues) {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < inputs.size(); i++) {
            String path = child(index("inputs", i), "name");
            String name = inputs.get(i).name();
            Identifiers.problem(name, "Input name").ifPresent(problem -> issues.add(ErrorKind.NAMING, path, problem));
            if (!seen.add(name)) {
                issues.add(ErrorKind.NAMING, path, "Duplicate input name '" + name + "'");
            }
        }
    }

    private void checkOutputs(List<OutputParam> outputs, IssueCollector issues) {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < outputs.size(); i++) {
            String path = child(index("outputs", i), "name");
            String name = outputs.get(i).name();
            Identifiers.problem(name, "Output name").ifPresent(problem -> issues.add(ErrorKind.NAMING, path, problem));
            if (!seen.add(name)) {
                issues.add(ErrorKind.NAMING, path, "Duplicate output name '" + name + "'");
            }
        }
    }

    private record Frame(String path, int depth) {
        Frame child(String childPath) {
            return new Frame(childPath, depth + 1);
        }
    }

    private final class NodeRules implements NodeVisitor<Void, Frame> {
        private final IssueCollector issues;
        private final ParsedDocument document;

        NodeRules(IssueCollector issues, ParsedDocument document) {
            this.issues = issues;
            this.document = document;
        }

        private void visit(WorkflowNode node, Frame frame) {
            node.accept(this, frame);
        }

        private boolean tooDeep(Frame frame) {
            if (frame.depth() > limits.maxNestingDepth()) {
                issues.add(ErrorKind.COMPLEXITY, frame.path(),
                        "Workflow is nested more than " + limits.maxNestingDepth() + " levels deep");
                return true;
            }
            return false;
        }

        @Override
        public Void visitToolInvocation(ToolInvocation node, Frame frame) {
            if (tooDeep(frame)) {
                return null;
            }
            String path = frame.path();
            Identifiers.problem(node.toolName(), "Tool name")
                    .ifPresent(problem -> issues.add(ErrorKind.NAMING, child(path, "tool_name"), problem));
            if (node.bindsTo() != null) {
                Identifiers.problem(node.bindsTo(), "Binding target")
                        .ifPresent(problem -> issues.add(ErrorKind.NAMING, child(path, "assigns_to"), problem));
            }
            for (Map.Entry<String, Object> parameter : node.parameters().entrySet()) {
                String key = parameter.getKey();
                String parameterPath = child(child(path, "parameters"), key);
                Identifiers.problem(key, "Parameter name")
                        .ifPresent(problem -> issues.add(ErrorKind.NAMING, parameterPath, problem));
                if (hasMalformedTemplate(parameter.getValue())) {
                    issues.add(ErrorKind.STRUCTURAL, parameterPath, "Parameter '" + key
                            + "' has an invalid variable reference; use {{name}} or {{name.field}}");
                }
                if (CredentialClassifier.isCredentialName(key) && parameter.getValue() != null
                        && References.collect(parameter.getValue()).isEmpty()) {
                    issues.add(ErrorKind.CREDENTIAL, parameterPath, "Parameter '" + key + "' of tool '"
                            + node.toolName() + "' looks like a credential; reference a secret input such as {{"
                            + key + "}} instead of a literal value");
                }
            }
            return null;
        }

        @Override
        public Void visitSequence(Sequence node, Frame frame) {
            if (tooDeep(frame)) {
                return null;
            }
            List<WorkflowNode> steps = node.steps();
            if (steps.isEmpty()) {
                issues.add(ErrorKind.STRUCTURAL, child(frame.path(), "steps"),
                        "A sequential node needs at least one step");
            } else if (steps.size() > limits.maxSequenceSteps()) {
                issues.add(ErrorKind.COMPLEXITY, child(frame.path(), "steps"), "A sequential node has " + steps.size()
                        + " steps; at most " + limits.maxSequenceSteps() + " are allowed");
            }
            for (int i = 0; i < steps.size(); i++) {
                visit(steps.get(i), frame.child(index(child(frame.path(), "steps"), i)));
            }
            return null;
        }

        @Override
        public Void visitBranch(Branch node, Frame frame) {
            if (tooDeep(frame)) {
                return null;
            }
            checkCondition(node.condition(), child(frame.path(), "condition"), "Condition");
            visit(node.ifBranch(), frame.child(child(frame.path(), "if_branch")));
            node.elseArm().ifPresent(elseBranch -> visit(elseBranch, frame.child(child(frame.path(), "else_branch"))));
            return null;
        }

        @Override
        public Void visitFanout(Fanout node, Frame frame) {
            if (tooDeep(frame)) {
                return null;
            }
            List<WorkflowNode> branches = node.branches();
            String branchesPath = child(frame.path(), "branches");
            if (branches.size() < 2) {
                issues.add(ErrorKind.STRUCTURAL, branchesPath,
                        "A parallel node needs at least 2 branches; use a sequential node for a single step");
            } else if (branches.size() > limits.maxFanoutBranches()) {
                issues.add(ErrorKind.COMPLEXITY, branchesPath, "A parallel node has " + branches.size()
                        + " branches; at most " + limits.maxFanoutBranches() + " are allowed");
            }
            for (int i = 0; i < branches.size(); i++) {
                visit(branches.get(i), frame.child(index(branchesPath, i)));
            }
            return null;
        }

        @Override
        public Void visitDispatcher(Dispatcher node, Frame frame) {
            if (tooDeep(frame)) {
                return null;
            }
            String subPath = child(frame.path(), "sub_workflows");
            Map<String, WorkflowNode> subWorkflows = node.subWorkflows();
            if (subWorkflows.isEmpty()) {
                issues.add(ErrorKind.STRUCTURAL, subPath, "An orchestrator needs at least one sub-workflow");
            }
            String available = subWorkflows.isEmpty() ? "(none)" : String.join(", ", subWorkflows.keySet());

            List<RoutingRule> rules = node.routingRules();
            String rulesPath = child(frame.path(), "routing_rules");
            if (rules.isEmpty()) {
                issues.add(ErrorKind.STRUCTURAL, rulesPath, "An orchestrator needs at least one routing rule");
            }
            for (int i = 0; i < rules.size(); i++) {
                RoutingRule rule = rules.get(i);
                String rulePath = index(rulesPath, i);
                checkCondition(rule.condition(), child(rulePath, "condition"), "Routing rule condition");
                if (!subWorkflows.containsKey(rule.target())) {
                    issues.add(ErrorKind.REFERENCE, document.sourcePath(child(rulePath, "workflow_name")),
                            "Routing rule references undefined workflow '" + rule.target() + "'. Available: " + available);
                }
            }
            node.fallback().filter(fallback -> !subWorkflows.containsKey(fallback)).ifPresent(fallback ->
                    issues.add(ErrorKind.REFERENCE, child(frame.path(), "default_workflow"),
                            "Default workflow '" + fallback + "' is not defined. Available: " + available));

            for (Map.Entry<String, WorkflowNode> entry : subWorkflows.entrySet()) {
                String entryPath = child(subPath, entry.getKey());
                Identifiers.problem(entry.getKey(), "Sub-workflow name")
                        .ifPresent(problem -> issues.add(ErrorKind.NAMING, entryPath, problem));
                visit(entry.getValue(), frame.child(entryPath));
            }
            return null;
        }

        private void checkCondition(String condition, String path, String label) {
            try {
                ConditionGrammar.validate(condition, label);
                ConditionParser.parse(condition, label);
            } catch (ConditionException e) {
                issues.add(ErrorKind.CONDITION, path, e.getMessage());
            }
        }

        private boolean hasMalformedTemplate(Object value) {
            if (value instanceof String text) {
                return References.hasMalformedTemplate(text);
            }
            if (value instanceof Map<?, ?> map) {
                return map.values().stream().anyMatch(this::hasMalformedTemplate);
            }
            if (value instanceof List<?> list) {
                return list.stream().anyMatch(this::hasMalformedTemplate);
            }
            return false;
        }
    }
}
