/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.analysis;

import com.flowsmith.workflow.api.model.Branch;
import com.flowsmith.workflow.api.model.Dispatcher;
import com.flowsmith.workflow.api.model.Fanout;
import com.flowsmith.workflow.api.model.InputParam;
import com.flowsmith.workflow.api.model.NodeVisitor;
import com.flowsmith.workflow.api.model.RoutingRule;
import com.flowsmith.workflow.api.model.Sequence;
import com.flowsmith.workflow.api.model.ToolInvocation;
import com.flowsmith.workflow.api.model.WorkflowNode;
import com.flowsmith.workflow.api.model.WorkflowSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import static com.flowsmith.workflow.compiler.validation.IssueCollector.child;
import static com.flowsmith.workflow.compiler.validation.IssueCollector.index;

/**
 * Flow-sensitive availability analysis.
 *
 * <p>Each node is analysed with the set of names guaranteed available on
 * entry and yields the set guaranteed on exit:
 * <ul>
 *   <li>a tool invocation adds its binding target;</li>
 *   <li>a sequence folds its steps in order;</li>
 *   <li>a branch adds only what both arms bind (nothing without an else-arm);</li>
 *   <li>a fan-out adds what any of its branches binds, for both join policies;</li>
 *   <li>a dispatcher adds nothing, since which sub-workflow runs is unknown.</li>
 * </ul>
 * Every reference is checked against the entry set of the node using it.
 * All violations are collected; analysis never stops at the first.
 */
public class ScopeAnalyzer {

    public ScopeAnalysis analyze(WorkflowSpec workflow) {
        Set<String> inputs = new TreeSet<>();
        for (InputParam input : workflow.inputs()) {
            inputs.add(input.name());
        }
        return analyze(workflow.workflow(), inputs, "workflow");
    }

    public ScopeAnalysis analyze(WorkflowNode root, Set<String> incoming, String rootPath) {
        List<ScopeViolation> violations = new ArrayList<>();
        SortedSet<String> outgoing = root.accept(new Visitor(violations), new Frame(rootPath, new TreeSet<>(incoming)));
        return new ScopeAnalysis(outgoing, violations);
    }

    private record Frame(String path, SortedSet<String> available) {
        Frame at(String childPath) {
            return new Frame(childPath, available);
        }
    }

    private static final class Visitor implements NodeVisitor<SortedSet<String>, Frame> {
        private final List<ScopeViolation> violations;

        Visitor(List<ScopeViolation> violations) {
            this.violations = violations;
        }

        @Override
        public SortedSet<String> visitToolInvocation(ToolInvocation node, Frame frame) {
            for (Map.Entry<String, Object> parameter : node.parameters().entrySet()) {
                String path = child(child(frame.path(), "parameters"), parameter.getKey());
                for (Reference reference : References.collect(parameter.getValue())) {
                    check(reference, frame.available(), path, "Tool '" + node.toolName() + "'");
                }
            }
            SortedSet<String> outgoing = new TreeSet<>(frame.available());
            node.binding().ifPresent(outgoing::add);
            return outgoing;
        }

        @Override
        public SortedSet<String> visitSequence(Sequence node, Frame frame) {
            SortedSet<String> available = frame.available();
            List<WorkflowNode> steps = node.steps();
            for (int i = 0; i < steps.size(); i++) {
                available = steps.get(i).accept(this, new Frame(index(child(frame.path(), "steps"), i), available));
            }
            return available;
        }

        @Override
        public SortedSet<String> visitBranch(Branch node, Frame frame) {
            checkCondition(node.condition(), frame.available(), child(frame.path(), "condition"), "Condition");
            SortedSet<String> afterIf = node.ifBranch().accept(this, frame.at(child(frame.path(), "if_branch")));
            if (node.elseBranch() == null) {
                return frame.available();
            }
            SortedSet<String> afterElse = node.elseBranch().accept(this, frame.at(child(frame.path(), "else_branch")));
            SortedSet<String> outgoing = new TreeSet<>(afterIf);
            outgoing.retainAll(afterElse);
            outgoing.addAll(frame.available());
            return outgoing;
        }

        @Override
        public SortedSet<String> visitFanout(Fanout node, Frame frame) {
            SortedSet<String> outgoing = new TreeSet<>(frame.available());
            List<WorkflowNode> branches = node.branches();
            for (int i = 0; i < branches.size(); i++) {
                outgoing.addAll(branches.get(i).accept(this, frame.at(index(child(frame.path(), "branches"), i))));
            }
            return outgoing;
        }

        @Override
        public SortedSet<String> visitDispatcher(Dispatcher node, Frame frame) {
            List<RoutingRule> rules = node.routingRules();
            for (int i = 0; i < rules.size(); i++) {
                String path = child(index(child(frame.path(), "routing_rules"), i), "condition");
                checkCondition(rules.get(i).condition(), frame.available(), path, "Routing rule condition");
            }
            for (Map.Entry<String, WorkflowNode> entry : node.subWorkflows().entrySet()) {
                entry.getValue().accept(this, frame.at(child(child(frame.path(), "sub_workflows"), entry.getKey())));
            }
            return frame.available();
        }

        private void checkCondition(String condition, SortedSet<String> available, String path, String subject) {
            for (Reference reference : References.findInCondition(condition)) {
                check(reference, available, path, subject);
            }
        }

        private void check(Reference reference, SortedSet<String> available, String path, String subject) {
            if (available.contains(reference.root())) {
                return;
            }
            String availableText = available.isEmpty() ? "(none)" : String.join(", ", available);
            String message = subject + " references undefined variable '" + reference.text() + "': '"
                    + reference.root() + "' is not guaranteed to be available here. Available: " + availableText;
            violations.add(new ScopeViolation(path, reference.text(), reference.root(),
                    new TreeSet<>(available), message));
        }
    }
}
