/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.parse;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowsmith.workflow.api.exceptions.ErrorKind;
import com.flowsmith.workflow.api.model.Branch;
import com.flowsmith.workflow.api.model.Dispatcher;
import com.flowsmith.workflow.api.model.Fanout;
import com.flowsmith.workflow.api.model.InputParam;
import com.flowsmith.workflow.api.model.JoinPolicy;
import com.flowsmith.workflow.api.model.NodeType;
import com.flowsmith.workflow.api.model.OutputParam;
import com.flowsmith.workflow.api.model.ParamType;
import com.flowsmith.workflow.api.model.RoutingRule;
import com.flowsmith.workflow.api.model.Sequence;
import com.flowsmith.workflow.api.model.ToolInvocation;
import com.flowsmith.workflow.api.model.WorkflowNode;
import com.flowsmith.workflow.api.model.WorkflowSpec;
import com.flowsmith.workflow.compiler.security.CredentialClassifier;
import com.flowsmith.workflow.compiler.validation.IssueCollector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static com.flowsmith.workflow.compiler.validation.IssueCollector.child;
import static com.flowsmith.workflow.compiler.validation.IssueCollector.index;

/**
 * Reads workflow JSON documents into the workflow tree.
 *
 * <p>Reading never stops at the first problem: every shape defect (missing
 * field, wrong JSON type, unknown node type) is recorded with its document
 * path, malformed nodes are dropped, and reading continues with their
 * siblings. Semantic rules are left to
 * {@link com.flowsmith.workflow.compiler.validation.WorkflowValidator}.
 */
public class WorkflowDocumentReader {
    private static final Logger logger = Logger.getLogger(WorkflowDocumentReader.class.getName());

    static final Set<String> TOP_LEVEL_FIELDS =
            Set.of("name", "description", "version", "inputs", "outputs", "workflow", "metadata");

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public WorkflowDocumentReader() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    public ParsedDocument read(String document) {
        JsonNode root;
        try {
            root = objectMapper.readTree(document);
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            String where = location == null ? "" : " at line " + location.getLineNr() + ", column " + location.getColumnNr();
            IssueCollector issues = new IssueCollector();
            issues.add(ErrorKind.STRUCTURAL, "$", "Document is not valid JSON" + where + ": " + e.getOriginalMessage());
            return new ParsedDocument(null, null, null, List.of(), List.of(), null, null, issues.toList(), false);
        }
        return read(root);
    }

    public ParsedDocument read(JsonNode root) {
        Session session = new Session();
        IssueCollector issues = session.issues;
        if (root == null || !root.isObject()) {
            issues.add(ErrorKind.STRUCTURAL, "$", "Document must be a JSON object");
            return new ParsedDocument(null, null, null, List.of(), List.of(), null, null, issues.toList(), false);
        }

        Iterator<String> fieldNames = root.fieldNames();
        while (fieldNames.hasNext()) {
            String field = fieldNames.next();
            if (!TOP_LEVEL_FIELDS.contains(field)) {
                issues.add(ErrorKind.STRUCTURAL, field, "Unknown top-level field '" + field + "'. Allowed fields: "
                        + TOP_LEVEL_FIELDS.stream().sorted().collect(Collectors.joining(", ")));
            }
        }

        String name = session.requiredText(root, "name", "");
        String description = session.requiredText(root, "description", "");
        String version = session.optionalText(root, "version", "");
        List<InputParam> inputs = session.readInputs(root.get("inputs"));
        List<OutputParam> outputs = session.readOutputs(root.get("outputs"));
        Map<String, Object> metadata = session.readMetadata(root.get("metadata"));

        WorkflowNode workflow = null;
        JsonNode workflowNode = root.get("workflow");
        if (workflowNode == null || workflowNode.isNull()) {
            issues.add(ErrorKind.STRUCTURAL, "workflow", "workflow is required");
            session.complete = false;
        } else {
            workflow = session.readNode(workflowNode, "workflow");
        }

        logger.fine(() -> "Read workflow document '" + name + "' with " + issues.size() + " structural issue(s)");
        return new ParsedDocument(name, description, version == null ? WorkflowSpec.DEFAULT_VERSION : version,
                inputs, outputs, workflow, metadata, issues.toList(), session.complete, session.aliasedPaths);
    }

    /**
     * State of one read: the issues found so far and whether any node was dropped.
     */
    private final class Session {
        private final IssueCollector issues = new IssueCollector();
        private final Map<String, String> aliasedPaths = new LinkedHashMap<>();
        private boolean complete = true;

        List<InputParam> readInputs(JsonNode node) {
            List<InputParam> inputs = new ArrayList<>();
            if (!isArray(node, "inputs")) {
                return inputs;
            }
            for (int i = 0; i < node.size(); i++) {
                String path = index("inputs", i);
                JsonNode item = node.get(i);
                if (!item.isObject()) {
                    issues.add(ErrorKind.STRUCTURAL, path, "Input must be an object with name and type");
                    continue;
                }
                String name = requiredText(item, "name", path);
                ParamType type = readType(item, path);
                String description = optionalText(item, "description", path);
                boolean tagged = optionalBoolean(item, "is_secret", path) || optionalBoolean(item, "is_credential", path);
                if (name != null && type != null) {
                    inputs.add(new InputParam(name, type, description, CredentialClassifier.isSecretInput(name, tagged)));
                } else {
                    // references to this input can no longer be checked
                    complete = false;
                }
            }
            return inputs;
        }

        List<OutputParam> readOutputs(JsonNode node) {
            List<OutputParam> outputs = new ArrayList<>();
            if (!isArray(node, "outputs")) {
                return outputs;
            }
            for (int i = 0; i < node.size(); i++) {
                String path = index("outputs", i);
                JsonNode item = node.get(i);
                if (!item.isObject()) {
                    issues.add(ErrorKind.STRUCTURAL, path, "Output must be an object with name and type");
                    continue;
                }
                String name = requiredText(item, "name", path);
                ParamType type = readType(item, path);
                String description = optionalText(item, "description", path);
                if (name != null && type != null) {
                    outputs.add(new OutputParam(name, type, description));
                }
            }
            return outputs;
        }

        Map<String, Object> readMetadata(JsonNode node) {
            if (node == null || node.isNull()) {
                return Map.of();
            }
            if (!node.isObject()) {
                issues.add(ErrorKind.STRUCTURAL, "metadata", "metadata must be an object");
                return Map.of();
            }
            return objectMapper.convertValue(node, OBJECT_MAP);
        }

        private ParamType readType(JsonNode item, String path) {
            String typeName = requiredText(item, "type", path);
            if (typeName == null) {
                return null;
            }
            return ParamType.fromJson(typeName).orElseGet(() -> {
                issues.add(ErrorKind.STRUCTURAL, child(path, "type"), "Unknown type '" + typeName
                        + "'. Valid types: " + String.join(", ", ParamType.acceptedNames()));
                return null;
            });
        }

        WorkflowNode readNode(JsonNode node, String path) {
            if (!node.isObject()) {
                return drop(path, "Node must be an object with a 'type' field");
            }
            String tag = requiredText(node, "type", path);
            if (tag == null) {
                complete = false;
                return null;
            }
            NodeType type = NodeType.fromTag(tag).orElse(null);
            if (type == null) {
                return drop(child(path, "type"), "Unknown node type '" + tag + "'. Expected one of: "
                        + Arrays.stream(NodeType.values()).map(NodeType::tag).collect(Collectors.joining(", ")));
            }
            String description = optionalText(node, "description", path);
            return switch (type) {
                case TOOL_CALL -> readToolInvocation(node, path, description);
                case SEQUENTIAL -> readSequence(node, path, description);
                case CONDITIONAL -> readBranch(node, path, description);
                case PARALLEL -> readFanout(node, path, description);
                case ORCHESTRATOR -> readDispatcher(node, path, description);
            };
        }

        private WorkflowNode readToolInvocation(JsonNode node, String path, String description) {
            String toolName = requiredText(node, "tool_name", path);
            String bindsTo = optionalText(node, "assigns_to", path);
            Map<String, Object> parameters = Map.of();
            JsonNode parametersNode = node.get("parameters");
            if (parametersNode != null && !parametersNode.isNull()) {
                if (parametersNode.isObject()) {
                    parameters = objectMapper.convertValue(parametersNode, OBJECT_MAP);
                } else {
                    issues.add(ErrorKind.STRUCTURAL, child(path, "parameters"), "parameters must be an object");
                }
            }
            if (toolName == null) {
                complete = false;
                return null;
            }
            return new ToolInvocation(toolName, parameters, bindsTo, description);
        }

        private WorkflowNode readSequence(JsonNode node, String path, String description) {
            List<WorkflowNode> steps = readNodeList(node, "steps", path);
            return steps == null ? null : new Sequence(steps, description);
        }

        private WorkflowNode readBranch(JsonNode node, String path, String description) {
            String condition = requiredText(node, "condition", path);
            WorkflowNode ifBranch = readChild(node, "if_branch", path, true);
            WorkflowNode elseBranch = readChild(node, "else_branch", path, false);
            if (condition == null || ifBranch == null) {
                complete = false;
                return null;
            }
            return new Branch(condition, ifBranch, elseBranch, description);
        }

        private WorkflowNode readFanout(JsonNode node, String path, String description) {
            List<WorkflowNode> branches = readNodeList(node, "branches", path);
            JoinPolicy policy = readJoinPolicy(node, path);
            if (branches == null || policy == null) {
                complete = false;
                return null;
            }
            return new Fanout(branches, policy, description);
        }

        private JoinPolicy readJoinPolicy(JsonNode node, String path) {
            String tag = optionalText(node, "join_policy", path);
            JsonNode waitForAll = node.get("wait_for_all");
            JoinPolicy fromTag = null;
            if (tag != null) {
                fromTag = JoinPolicy.fromTag(tag).orElse(null);
                if (fromTag == null) {
                    issues.add(ErrorKind.STRUCTURAL, child(path, "join_policy"), "Unknown join policy '" + tag
                            + "'. Expected one of: wait-for-all, first-to-finish");
                    return null;
                }
            }
            JoinPolicy fromFlag = null;
            if (waitForAll != null && !waitForAll.isNull()) {
                if (!waitForAll.isBoolean()) {
                    issues.add(ErrorKind.STRUCTURAL, child(path, "wait_for_all"), "wait_for_all must be a boolean");
                    return null;
                }
                fromFlag = JoinPolicy.fromWaitForAll(waitForAll.booleanValue());
            }
            if (fromTag != null && fromFlag != null && fromTag != fromFlag) {
                issues.add(ErrorKind.STRUCTURAL, child(path, "join_policy"), "join_policy '" + fromTag.tag()
                        + "' contradicts wait_for_all=" + waitForAll.booleanValue());
                return null;
            }
            if (fromTag != null) {
                return fromTag;
            }
            if (fromFlag != null) {
                return fromFlag;
            }
            logger.fine(() -> path + ": no join policy given, using " + JoinPolicy.WAIT_FOR_ALL.tag());
            return JoinPolicy.WAIT_FOR_ALL;
        }

        private WorkflowNode readDispatcher(JsonNode node, String path, String description) {
            Map<String, WorkflowNode> subWorkflows = new LinkedHashMap<>();
            String subPath = child(path, "sub_workflows");
            JsonNode subNode = node.get("sub_workflows");
            boolean readable = true;
            if (subNode == null || subNode.isNull()) {
                issues.add(ErrorKind.STRUCTURAL, subPath, "sub_workflows is required");
                readable = false;
            } else if (!subNode.isObject()) {
                issues.add(ErrorKind.STRUCTURAL, subPath, "sub_workflows must be an object mapping names to nodes");
                readable = false;
            } else {
                Iterator<Map.Entry<String, JsonNode>> entries = subNode.fields();
                while (entries.hasNext()) {
                    Map.Entry<String, JsonNode> entry = entries.next();
                    WorkflowNode child = readNode(entry.getValue(), child(subPath, entry.getKey()));
                    if (child != null) {
                        subWorkflows.put(entry.getKey(), child);
                    }
                }
            }

            List<RoutingRule> rules = new ArrayList<>();
            String rulesPath = child(path, "routing_rules");
            JsonNode rulesNode = node.get("routing_rules");
            if (rulesNode == null || rulesNode.isNull()) {
                issues.add(ErrorKind.STRUCTURAL, rulesPath, "routing_rules is required");
                readable = false;
            } else if (!rulesNode.isArray()) {
                issues.add(ErrorKind.STRUCTURAL, rulesPath, "routing_rules must be an array");
                readable = false;
            } else {
                for (int i = 0; i < rulesNode.size(); i++) {
                    RoutingRule rule = readRoutingRule(rulesNode.get(i), index(rulesPath, i));
                    if (rule == null) {
                        readable = false;
                    } else {
                        rules.add(rule);
                    }
                }
            }

            String defaultWorkflow = optionalText(node, "default_workflow", path);
            if (!readable) {
                complete = false;
                return null;
            }
            return new Dispatcher(subWorkflows, rules, defaultWorkflow, description);
        }

        private RoutingRule readRoutingRule(JsonNode node, String path) {
            if (!node.isObject()) {
                issues.add(ErrorKind.STRUCTURAL, path, "Routing rule must be an object with condition and workflow_name");
                return null;
            }
            String condition = requiredText(node, "condition", path);
            String target;
            if (node.has("workflow_name") || !node.has("workflow")) {
                target = requiredText(node, "workflow_name", path);
            } else {
                aliasedPaths.put(child(path, "workflow_name"), child(path, "workflow"));
                target = requiredText(node, "workflow", path);
            }
            if (condition == null || target == null) {
                return null;
            }
            return new RoutingRule(condition, target);
        }

        private List<WorkflowNode> readNodeList(JsonNode node, String field, String path) {
            String listPath = child(path, field);
            JsonNode list = node.get(field);
            if (list == null || list.isNull()) {
                issues.add(ErrorKind.STRUCTURAL, listPath, field + " is required");
                complete = false;
                return null;
            }
            if (!list.isArray()) {
                issues.add(ErrorKind.STRUCTURAL, listPath, field + " must be an array of nodes");
                complete = false;
                return null;
            }
            List<WorkflowNode> nodes = new ArrayList<>();
            for (int i = 0; i < list.size(); i++) {
                WorkflowNode child = readNode(list.get(i), index(listPath, i));
                if (child != null) {
                    nodes.add(child);
                }
            }
            return nodes;
        }

        private WorkflowNode readChild(JsonNode node, String field, String path, boolean required) {
            JsonNode child = node.get(field);
            if (child == null || child.isNull()) {
                if (required) {
                    issues.add(ErrorKind.STRUCTURAL, child(path, field), field + " is required");
                }
                return null;
            }
            return readNode(child, child(path, field));
        }

        private WorkflowNode drop(String path, String message) {
            issues.add(ErrorKind.STRUCTURAL, path, message);
            complete = false;
            return null;
        }

        private boolean isArray(JsonNode node, String path) {
            if (node == null || node.isNull()) {
                return false;
            }
            if (!node.isArray()) {
                issues.add(ErrorKind.STRUCTURAL, path, path + " must be an array");
                return false;
            }
            return true;
        }

        String requiredText(JsonNode node, String field, String path) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                issues.add(ErrorKind.STRUCTURAL, child(path, field), field + " is required");
                return null;
            }
            if (!value.isTextual()) {
                issues.add(ErrorKind.STRUCTURAL, child(path, field), field + " must be a string");
                return null;
            }
            return value.textValue();
        }

        String optionalText(JsonNode node, String field, String path) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                return null;
            }
            if (!value.isTextual()) {
                issues.add(ErrorKind.STRUCTURAL, child(path, field), field + " must be a string");
                return null;
            }
            return value.textValue();
        }

        private boolean optionalBoolean(JsonNode node, String field, String path) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                return false;
            }
            if (!value.isBoolean()) {
                issues.add(ErrorKind.STRUCTURAL, child(path, field), field + " must be a boolean");
                return false;
            }
            return value.booleanValue();
        }
    }
}
