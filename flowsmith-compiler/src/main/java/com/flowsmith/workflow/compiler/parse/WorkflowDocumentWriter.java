/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowsmith.workflow.api.exceptions.GenerationException;
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

import java.util.List;
import java.util.Map;

/**
 * Writes workflow trees as canonical JSON documents.
 *
 * <p>Field order is fixed, absent optional fields are omitted, and the join
 * policy of every fan-out is written explicitly, so writing, reading back and
 * writing again yields identical text.
 */
public class WorkflowDocumentWriter {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ObjectWriter prettyWriter;

    public WorkflowDocumentWriter() {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withObjectIndenter(indenter)
                .withArrayIndenter(indenter);
        this.prettyWriter = objectMapper.writer(printer);
    }

    public String write(WorkflowSpec workflow) {
        try {
            return prettyWriter.writeValueAsString(toTree(workflow));
        } catch (JsonProcessingException e) {
            throw new GenerationException("Failed to write workflow '" + workflow.name() + "'", e);
        }
    }

    public ObjectNode toTree(WorkflowSpec workflow) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("name", workflow.name());
        putIfPresent(root, "description", workflow.description());
        root.put("version", workflow.version());
        ArrayNode inputs = root.putArray("inputs");
        for (InputParam input : workflow.inputs()) {
            ObjectNode item = inputs.addObject();
            item.put("name", input.name());
            item.put("type", input.type().jsonName());
            putIfPresent(item, "description", input.description());
            if (input.secret()) {
                item.put("is_secret", true);
            }
        }
        ArrayNode outputs = root.putArray("outputs");
        for (OutputParam output : workflow.outputs()) {
            ObjectNode item = outputs.addObject();
            item.put("name", output.name());
            item.put("type", output.type().jsonName());
            putIfPresent(item, "description", output.description());
        }
        root.set("workflow", nodeToTree(workflow.workflow()));
        root.set("metadata", objectMapper.valueToTree(workflow.metadata()));
        return root;
    }

    public ObjectNode nodeToTree(WorkflowNode node) {
        return node.accept(new TreeBuilder(), null);
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private final class TreeBuilder implements NodeVisitor<ObjectNode, Void> {

        private ObjectNode start(WorkflowNode node) {
            ObjectNode tree = objectMapper.createObjectNode();
            tree.put("type", node.type().tag());
            putIfPresent(tree, "description", node.description());
            return tree;
        }

        private ArrayNode children(List<WorkflowNode> nodes) {
            ArrayNode array = objectMapper.createArrayNode();
            nodes.forEach(child -> array.add(child.accept(this, null)));
            return array;
        }

        @Override
        public ObjectNode visitToolInvocation(ToolInvocation node, Void ignored) {
            ObjectNode tree = start(node);
            tree.put("tool_name", node.toolName());
            tree.set("parameters", objectMapper.valueToTree(node.parameters()));
            putIfPresent(tree, "assigns_to", node.bindsTo());
            return tree;
        }

        @Override
        public ObjectNode visitSequence(Sequence node, Void ignored) {
            ObjectNode tree = start(node);
            tree.set("steps", children(node.steps()));
            return tree;
        }

        @Override
        public ObjectNode visitBranch(Branch node, Void ignored) {
            ObjectNode tree = start(node);
            tree.put("condition", node.condition());
            tree.set("if_branch", node.ifBranch().accept(this, null));
            node.elseArm().ifPresent(elseBranch -> tree.set("else_branch", elseBranch.accept(this, null)));
            return tree;
        }

        @Override
        public ObjectNode visitFanout(Fanout node, Void ignored) {
            ObjectNode tree = start(node);
            tree.set("branches", children(node.branches()));
            tree.put("join_policy", node.joinPolicy().tag());
            return tree;
        }

        @Override
        public ObjectNode visitDispatcher(Dispatcher node, Void ignored) {
            ObjectNode tree = start(node);
            ObjectNode subWorkflows = tree.putObject("sub_workflows");
            for (Map.Entry<String, WorkflowNode> entry : node.subWorkflows().entrySet()) {
                subWorkflows.set(entry.getKey(), entry.getValue().accept(this, null));
            }
            ArrayNode rules = tree.putArray("routing_rules");
            for (RoutingRule rule : node.routingRules()) {
                ObjectNode item = rules.addObject();
                item.put("condition", rule.condition());
                item.put("workflow_name", rule.target());
            }
            putIfPresent(tree, "default_workflow", node.defaultWorkflow());
            return tree;
        }
    }
}
