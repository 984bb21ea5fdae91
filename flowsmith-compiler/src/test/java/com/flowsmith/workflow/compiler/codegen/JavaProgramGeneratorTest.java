/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.codegen;

import com.flowsmith.workflow.api.exceptions.GenerationException;
import com.flowsmith.workflow.api.exceptions.ScopeException;
import com.flowsmith.workflow.api.model.Branch;
import com.flowsmith.workflow.api.model.CompiledWorkflow;
import com.flowsmith.workflow.api.model.InputParam;
import com.flowsmith.workflow.api.model.ParamType;
import com.flowsmith.workflow.api.model.Sequence;
import com.flowsmith.workflow.api.model.ToolInvocation;
import com.flowsmith.workflow.api.model.WorkflowNode;
import com.flowsmith.workflow.api.model.WorkflowSpec;
import com.flowsmith.workflow.compiler.parse.WorkflowDocumentReader;
import com.flowsmith.workflow.compiler.parse.WorkflowDocumentWriter;
import com.flowsmith.workflow.compiler.validation.WorkflowValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.flowsmith.workflow.compiler.codegen.InMemoryJavaCompiler.execute;
import static com.flowsmith.workflow.compiler.codegen.InMemoryJavaCompiler.property;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class JavaProgramGeneratorTest {

    private final JavaProgramGenerator generator = new JavaProgramGenerator();

    private static WorkflowSpec workflow(String json) {
        return new WorkflowValidator().requireValid(new WorkflowDocumentReader().read(json));
    }

    private static Map<String, Object> inputs(Object... keysAndValues) {
        Map<String, Object> inputs = new HashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            inputs.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return inputs;
    }

    private static final String ROUTER = """
            {
              "name": "ticket_router",
              "description": "Route a ticket by score",
              "inputs": [{"name": "score", "type": "int"}],
              "outputs": [{"name": "outcome", "type": "dict"}],
              "workflow": {
                "type": "orchestrator",
                "description": "Pick a handler",
                "sub_workflows": {
                  "high": {"type": "tool_call", "tool_name": "handle_high",
                           "parameters": {"score": "{{score}}"}, "assigns_to": "outcome"},
                  "low": {"type": "tool_call", "tool_name": "handle_low",
                          "parameters": {"score": "{{score}}"}, "assigns_to": "outcome"},
                  "none": {"type": "tool_call", "tool_name": "handle_none", "assigns_to": "outcome"}
                },
                "routing_rules": [
                  {"condition": "{{score}} > 5", "workflow_name": "high"},
                  {"condition": "{{score}} > 0", "workflow_name": "low"}
                ],
                "default_workflow": "none"
              }
            }
            """;

    @Nested
    @DisplayName("Source text")
    class SourceText {

        @Test
        @DisplayName("Should generate byte-identical source for the same workflow")
        void shouldBeDeterministic() {
            WorkflowSpec spec = workflow(ROUTER);

            String first = generator.generate(spec, ToolLibraryIndex.empty()).source();
            String second = new JavaProgramGenerator().generate(workflow(ROUTER), ToolLibraryIndex.empty()).source();

            assertThat(first).isEqualTo(second);
        }

        @Test
        @DisplayName("Should describe the generated class and its tools")
        void shouldDescribeProgram() {
            CompiledWorkflow program = generator.generate(workflow(ROUTER), ToolLibraryIndex.empty());

            assertThat(program.className()).isEqualTo("TicketRouterWorkflow");
            assertThat(program.packageName()).isEqualTo(GeneratorOptions.DEFAULT_PACKAGE);
            assertThat(program.sourceFileName()).isEqualTo("com/flowsmith/generated/TicketRouterWorkflow.java");
            assertThat(program.toolNames()).containsExactly("handle_high", "handle_low", "handle_none");
            assertThat(program.source())
                    .startsWith("/*\n * Generated by Flowsmith from workflow 'ticket_router' version 1.0.0.")
                    .contains("package com.flowsmith.generated;")
                    .contains("public Map<String, Object> executeWorkflow(Map<String, Object> inputs)")
                    .contains("// Pick a handler")
                    .contains("// route: high")
                    .contains("// default route: none");
        }

        @Test
        @DisplayName("Should never embed a secret value and read it from the environment")
        void shouldReadSecretsFromEnvironment() {
            CompiledWorkflow program = generator.generate(workflow("""
                    {
                      "name": "secure_fetch",
                      "description": "Fetch with a key",
                      "inputs": [{"name": "service_api_key", "type": "string"}, {"name": "url", "type": "string"}],
                      "workflow": {"type": "tool_call", "tool_name": "fetch",
                                   "parameters": {"url": "{{url}}", "api_key": "{{service_api_key}}"}}
                    }
                    """), ToolLibraryIndex.empty());

            assertThat(program.secretParameters()).containsExactly("service_api_key");
            assertThat(program.source())
                    .contains("inputs.put(\"service_api_key\", System.getenv(\"SERVICE_API_KEY\"));")
                    .contains("inputs.put(\"url\", \"example_url\");")
                    .contains("requireEnv(\"API_KEY\");")
                    .contains(" *   export API_KEY=&lt;your-value-here&gt;")
                    .contains(" *   export SERVICE_API_KEY=&lt;your-value-here&gt;");
        }

        @Test
        @DisplayName("Should omit the package declaration for the default package")
        void shouldSupportDefaultPackage() throws Throwable {
            JavaProgramGenerator unpackaged = new JavaProgramGenerator(new GeneratorOptions(""));

            CompiledWorkflow program = unpackaged.generate(workflow(ROUTER), ToolLibraryIndex.empty());

            assertThat(program.source()).doesNotContain("package ");
            assertThat(program.qualifiedClassName()).isEqualTo("TicketRouterWorkflow");
            assertThat(execute(InMemoryJavaCompiler.compile(program), inputs("score", 1))).containsKey("outcome");
        }

        @Test
        @DisplayName("Should reject an invalid target package")
        void shouldRejectInvalidPackage() {
            assertThatThrownBy(() -> new GeneratorOptions("com.acme-tools"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Invalid target package name: 'com.acme-tools'");
        }
    }

    @Nested
    @DisplayName("Refusals")
    class Refusals {

        @Test
        @DisplayName("Should refuse a workflow whose references are not guaranteed")
        void shouldRefuseUnsoundWorkflow() {
            WorkflowSpec spec = new WorkflowSpec("unsound", "Unsound", null, List.of(), List.of(),
                    new Sequence(List.of(
                            new Branch("{{flag}}", new ToolInvocation("make", Map.of(), "y"), null),
                            new ToolInvocation("use", Map.of("v", "{{y}}"), null))),
                    Map.of());

            assertThatThrownBy(() -> generator.generate(spec, ToolLibraryIndex.empty()))
                    .isInstanceOf(ScopeException.class);
        }

        @Test
        @DisplayName("Should report an untranslatable condition as a generation failure")
        void shouldWrapConditionFailures() {
            WorkflowSpec spec = new WorkflowSpec("broken", "Broken", null,
                    List.of(new InputParam("flag", ParamType.BOOLEAN, null, false)), List.of(),
                    new Branch("{{flag}} >", new ToolInvocation("a", Map.of(), null), null),
                    Map.of());

            assertThatThrownBy(() -> generator.generate(spec, ToolLibraryIndex.empty()))
                    .isInstanceOf(GenerationException.class)
                    .hasMessageStartingWith("Failed to generate workflow 'broken': ");
        }
    }

    @Nested
    @DisplayName("Generated program behavior")
    class ProgramBehavior {

        @Test
        @DisplayName("Should take the first matching route")
        void shouldTakeFirstMatchingRoute() throws Throwable {
            Class<?> program = InMemoryJavaCompiler.compile(generator.generate(workflow(ROUTER), ToolLibraryIndex.empty()));

            assertThat(execute(program, inputs("score", 10)).get("outcome"))
                    .isInstanceOfSatisfying(Map.class, outcome -> assertThat(outcome.get("tool")).isEqualTo("handle_high"));
            assertThat(execute(program, inputs("score", 3)).get("outcome"))
                    .isInstanceOfSatisfying(Map.class, outcome -> assertThat(outcome.get("tool")).isEqualTo("handle_low"));
            assertThat(execute(program, inputs("score", -1)).get("outcome"))
                    .isInstanceOfSatisfying(Map.class, outcome -> assertThat(outcome.get("tool")).isEqualTo("handle_none"));
        }

        @Test
        @DisplayName("Should return a placeholder result from a tool stub")
        void shouldReturnPlaceholder() throws Throwable {
            Class<?> program = InMemoryJavaCompiler.compile(generator.generate(workflow(ROUTER), ToolLibraryIndex.empty()));

            Object outcome = execute(program, inputs("score", 7.5d)).get("outcome");

            assertThat(outcome).isEqualTo(Map.of("status", "not_implemented", "tool", "handle_high",
                    "data", Map.of("score", 7.5d)));
        }

        @Test
        @DisplayName("Should reject a missing required input before running")
        void shouldRejectMissingInput() {
            Class<?> program = InMemoryJavaCompiler.compile(generator.generate(workflow(ROUTER), ToolLibraryIndex.empty()));

            assertThatThrownBy(() -> execute(program, inputs()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Missing required input: score");
        }

        @Test
        @DisplayName("Should run every branch of a wait-for-all fan-out")
        void shouldJoinAllBranches() throws Throwable {
            Class<?> program = InMemoryJavaCompiler.compile(generator.generate(workflow("""
                    {
                      "name": "gather",
                      "description": "Gather from two sources",
                      "inputs": [{"name": "topic", "type": "string"}],
                      "outputs": [{"name": "news", "type": "any"}, {"name": "papers", "type": "any"}],
                      "workflow": {"type": "parallel", "join_policy": "wait-for-all", "branches": [
                        {"type": "tool_call", "tool_name": "search_news",
                         "parameters": {"q": "{{topic}}"}, "assigns_to": "news"},
                        {"type": "tool_call", "tool_name": "search_papers",
                         "parameters": {"q": "{{topic}}"}, "assigns_to": "papers"}
                      ]}
                    }
                    """), ToolLibraryIndex.empty()));

            Map<String, Object> result = execute(program, inputs("topic", "rust"));

            assertThat(result).containsOnlyKeys("news", "papers");
            assertThat(result.values()).doesNotContainNull();
        }

        @Test
        @DisplayName("Should keep only the winning branch of a first-to-finish fan-out")
        void shouldKeepOnlyWinner() throws Throwable {
            Class<?> program = InMemoryJavaCompiler.compile(generator.generate(workflow("""
                    {
                      "name": "race",
                      "description": "Race two mirrors",
                      "workflow": {"type": "parallel", "join_policy": "first-to-finish", "branches": [
                        {"type": "tool_call", "tool_name": "mirror_a", "assigns_to": "from_a"},
                        {"type": "tool_call", "tool_name": "mirror_b", "assigns_to": "from_b"}
                      ]}
                    }
                    """), ToolLibraryIndex.empty()));

            Map<String, Object> context = execute(program, inputs());

            assertThat(context.keySet()).hasSize(1).isSubsetOf("from_a", "from_b");
        }

        @Test
        @DisplayName("Should name a binding that only the losing first-to-finish branch would have made")
        void shouldExplainBindingLostInRace() throws Throwable {
            Class<?> program = InMemoryJavaCompiler.compile(generator.generate(workflow("""
                    {
                      "name": "race_then_merge",
                      "description": "Race two mirrors, then merge both answers",
                      "workflow": {"type": "sequential", "steps": [
                        {"type": "parallel", "join_policy": "first-to-finish", "branches": [
                          {"type": "tool_call", "tool_name": "mirror_a", "assigns_to": "from_a"},
                          {"type": "tool_call", "tool_name": "mirror_b", "assigns_to": "from_b"}
                        ]},
                        {"type": "tool_call", "tool_name": "merge",
                         "parameters": {"a": "{{from_a}}", "b": "{{from_b}}"}, "assigns_to": "merged"}
                      ]}
                    }
                    """), ToolLibraryIndex.empty()));

            Throwable thrown = catchThrowable(() -> execute(program, inputs()));

            assertThat(thrown.getClass().getSimpleName()).isEqualTo("WorkflowExecutionException");
            assertThat(thrown.getMessage()).matches("Workflow 'race_then_merge' failed: Context value 'from_[ab]' is not "
                    + "available: it is bound only by a first-to-finish branch that did not finish first");
        }

        @Test
        @DisplayName("Should delegate to library tools and interpolate text")
        void shouldDelegateToLibrary() throws Throwable {
            ToolLibraryIndex library = ToolLibraryIndex.of(Map.of(
                    "echo", "java.util.Objects#requireNonNull",
                    "describe", "java.util.Objects#toString"));
            Class<?> program = InMemoryJavaCompiler.compile(generator.generate(workflow("""
                    {
                      "name": "greeter",
                      "description": "Greet someone",
                      "inputs": [{"name": "person", "type": "dict"}],
                      "outputs": [{"name": "echoed", "type": "dict"}, {"name": "text", "type": "string"}],
                      "workflow": {"type": "sequential", "steps": [
                        {"type": "tool_call", "tool_name": "echo",
                         "parameters": {"greeting": "Hello {{person.name}}!", "tags": ["a", {"n": 1}]},
                         "assigns_to": "echoed"},
                        {"type": "tool_call", "tool_name": "describe",
                         "parameters": {"value": "{{echoed.greeting}}"}, "assigns_to": "text"}
                      ]}
                    }
                    """), library));

            Map<String, Object> result = execute(program, inputs("person", Map.of("name", "Ada")));

            assertThat(result.get("echoed")).isEqualTo(Map.of("greeting", "Hello Ada!", "tags", List.of("a", Map.of("n", 1))));
            assertThat(result.get("text")).isEqualTo("{value=Hello Ada!}");
        }

        @Test
        @DisplayName("Should compare numbers by value across integer and decimal types")
        void shouldCompareNumbersByValue() throws Throwable {
            Class<?> program = InMemoryJavaCompiler.compile(generator.generate(workflow("""
                    {
                      "name": "numeric",
                      "description": "Numeric equality",
                      "inputs": [{"name": "count", "type": "number"}],
                      "workflow": {"type": "conditional", "condition": "{{count}} == 2 and {{count}} in [1, 2, 3]",
                        "if_branch": {"type": "tool_call", "tool_name": "matched", "assigns_to": "hit"},
                        "else_branch": {"type": "tool_call", "tool_name": "missed", "assigns_to": "miss"}}
                    }
                    """), ToolLibraryIndex.empty()));

            assertThat(execute(program, inputs("count", 2.0d))).containsKey("hit").doesNotContainKey("miss");
            assertThat(execute(program, inputs("count", 2.5d))).containsKey("miss").doesNotContainKey("hit");
        }

        @Test
        @DisplayName("Should compare against quoted braces as plain text")
        void shouldKeepQuotedBracesLiteral() throws Throwable {
            Class<?> program = InMemoryJavaCompiler.compile(generator.generate(workflow("""
                    {
                      "name": "template_check",
                      "description": "Detect an unrendered template",
                      "inputs": [{"name": "subject", "type": "string"}],
                      "workflow": {"type": "conditional", "condition": "{{subject}} == '{{draft}}'",
                        "if_branch": {"type": "tool_call", "tool_name": "flag_unrendered", "assigns_to": "flagged"}}
                    }
                    """), ToolLibraryIndex.empty()));

            assertThat(execute(program, inputs("subject", "{{draft}}"))).containsKey("flagged");
            assertThat(execute(program, inputs("subject", "Welcome"))).doesNotContainKey("flagged");
        }

        @Test
        @DisplayName("Should wrap runtime failures with the masked context")
        void shouldWrapRuntimeFailures() throws Throwable {
            Class<?> program = InMemoryJavaCompiler.compile(generator.generate(workflow("""
                    {
                      "name": "lookup",
                      "description": "Read a nested field",
                      "inputs": [{"name": "user", "type": "any"}, {"name": "auth_token", "type": "string"}],
                      "workflow": {"type": "tool_call", "tool_name": "lookup_user",
                        "parameters": {"name": "{{user.name}}", "auth": "{{auth_token}}"}}
                    }
                    """), ToolLibraryIndex.empty()));

            Throwable thrown = catchThrowable(() -> execute(program, inputs("user", "not-a-map", "auth_token", "t0k3n")));

            assertThat(thrown.getClass().getSimpleName()).isEqualTo("WorkflowExecutionException");
            assertThat(thrown).hasMessage("Workflow 'lookup' failed: Cannot read field 'name' of 'user': value is a String");
            assertThat(thrown.getCause()).isInstanceOf(IllegalStateException.class);
            assertThat(property(thrown, "getInputs")).isEqualTo(Map.of("user", "not-a-map", "auth_token", "***"));
            assertThat(property(thrown, "getContextAtFailure")).asString().doesNotContain("t0k3n");
        }
    }

    @Nested
    @DisplayName("Large workflows")
    class LargeWorkflows {

        private WorkflowSpec accepted(WorkflowNode root) {
            WorkflowSpec spec = new WorkflowSpec("bulk_import", "Bulk import", null,
                    List.of(new InputParam("topic", ParamType.STRING, null, false)), List.of(), root, Map.of());
            return workflow(new WorkflowDocumentWriter().write(spec));
        }

        private List<WorkflowNode> calls(String prefix, int count, int parameters) {
            List<WorkflowNode> steps = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                Map<String, Object> arguments = new LinkedHashMap<>();
                arguments.put("topic", "{{topic}}");
                for (int p = 1; p < parameters; p++) {
                    arguments.put("field_" + p, "value " + p);
                }
                steps.add(new ToolInvocation("load_" + (i % 4), arguments, prefix + "_" + i));
            }
            return steps;
        }

        @Test
        @DisplayName("Should compile eight sequences of one hundred tool calls")
        void shouldCompileWideWorkflow() throws Throwable {
            List<WorkflowNode> sequences = new ArrayList<>();
            for (int s = 0; s < 8; s++) {
                sequences.add(new Sequence(calls("batch_" + s, 100, 3)));
            }

            CompiledWorkflow program = generator.generate(accepted(new Sequence(sequences)), ToolLibraryIndex.empty());
            Map<String, Object> context = execute(InMemoryJavaCompiler.compile(program), inputs("topic", "orders"));

            assertThat(program.source()).contains("private void runStep8(Scope scope)");
            assertThat(context).containsKeys("batch_0_0", "batch_7_99");
        }

        @Test
        @DisplayName("Should split one long sequence of wide tool calls across methods")
        void shouldSplitLongSequence() throws Throwable {
            CompiledWorkflow program = generator.generate(accepted(new Sequence(calls("row", 100, 40))),
                    ToolLibraryIndex.empty());
            Map<String, Object> context = execute(InMemoryJavaCompiler.compile(program), inputs("topic", "orders"));

            assertThat(program.source()).contains("runStep1(scope);").contains("runStep2(scope);");
            assertThat(context).containsKeys("row_0", "row_99");
            assertThat(new EmittedSourceVerifier().verify(program)).isTrue();
        }

        @Test
        @DisplayName("Should compile deeply nested branches that each carry about one hundred calls")
        void shouldCompileDeepWorkflow() throws Throwable {
            WorkflowNode node = new Sequence(calls("level_15", 100, 3));
            for (int level = 14; level >= 1; level--) {
                List<WorkflowNode> steps = calls("level_" + level, 99, 3);
                steps.add(new Branch("{{topic}} != 'skip'", node, null));
                node = new Sequence(steps);
            }

            CompiledWorkflow program = generator.generate(accepted(node), ToolLibraryIndex.empty());
            Map<String, Object> context = execute(InMemoryJavaCompiler.compile(program), inputs("topic", "orders"));

            assertThat(context).containsKeys("level_1_0", "level_15_99");
        }
    }
}
