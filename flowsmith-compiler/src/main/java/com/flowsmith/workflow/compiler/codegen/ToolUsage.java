/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.codegen;

import com.flowsmith.workflow.api.model.Branch;
import com.flowsmith.workflow.api.model.Dispatcher;
import com.flowsmith.workflow.api.model.Fanout;
import com.flowsmith.workflow.api.model.NodeVisitor;
import com.flowsmith.workflow.api.model.Sequence;
import com.flowsmith.workflow.api.model.ToolInvocation;
import com.flowsmith.workflow.api.model.WorkflowNode;

import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Distinct tools used by a workflow or subtree, each with the parameter names
 * observed across all of its invocations, plus every name the subtree may
 * bind. All of it is sorted.
 */
public final class ToolUsage {

    private final SortedMap<String, SortedSet<String>> parametersByTool;
    private final SortedSet<String> bindings;

    private ToolUsage(SortedMap<String, SortedSet<String>> parametersByTool, SortedSet<String> bindings) {
        this.parametersByTool = parametersByTool;
        this.bindings = bindings;
    }

    public static ToolUsage of(WorkflowNode root) {
        Collector collector = new Collector();
        root.accept(collector, null);
        return new ToolUsage(collector.usage, collector.bindings);
    }

    /**
     * Names written by some tool invocation in the subtree, on any path.
     */
    public SortedSet<String> bindings() {
        return Collections.unmodifiableSortedSet(bindings);
    }

    public SortedSet<String> toolNames() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(parametersByTool.keySet()));
    }

    public SortedSet<String> parametersOf(String toolName) {
        return Collections.unmodifiableSortedSet(parametersByTool.getOrDefault(toolName, new TreeSet<>()));
    }

    private static final class Collector implements NodeVisitor<Void, Void> {
        private final SortedMap<String, SortedSet<String>> usage = new TreeMap<>();
        private final SortedSet<String> bindings = new TreeSet<>();

        @Override
        public Void visitToolInvocation(ToolInvocation node, Void ignored) {
            usage.computeIfAbsent(node.toolName(), name -> new TreeSet<>()).addAll(node.parameters().keySet());
            if (node.bindsTo() != null) {
                bindings.add(node.bindsTo());
            }
            return null;
        }

        @Override
        public Void visitSequence(Sequence node, Void ignored) {
            node.steps().forEach(step -> step.accept(this, null));
            return null;
        }

        @Override
        public Void visitBranch(Branch node, Void ignored) {
            node.ifBranch().accept(this, null);
            node.elseArm().ifPresent(elseBranch -> elseBranch.accept(this, null));
            return null;
        }

        @Override
        public Void visitFanout(Fanout node, Void ignored) {
            node.branches().forEach(branch -> branch.accept(this, null));
            return null;
        }

        @Override
        public Void visitDispatcher(Dispatcher node, Void ignored) {
            node.subWorkflows().values().forEach(child -> child.accept(this, null));
            return null;
        }
    }
}
