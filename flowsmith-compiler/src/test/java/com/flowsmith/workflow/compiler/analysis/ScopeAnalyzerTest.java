/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.analysis;

import com.flowsmith.workflow.api.exceptions.ScopeException;
import com.flowsmith.workflow.api.model.Branch;
import com.flowsmith.workflow.api.model.Dispatcher;
import com.flowsmith.workflow.api.model.Fanout;
import com.flowsmith.workflow.api.model.InputParam;
import com.flowsmith.workflow.api.model.JoinPolicy;
import com.flowsmith.workflow.api.model.ParamType;
import com.flowsmith.workflow.api.model.RoutingRule;
import com.flowsmith.workflow.api.model.Sequence;
import com.flowsmith.workflow.api.model.ToolInvocation;
import com.flowsmith.workflow.api.model.WorkflowNode;
import com.flowsmith.workflow.api.model.WorkflowSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScopeAnalyzerTest {

    private final ScopeAnalyzer analyzer = new ScopeAnalyzer();

    private static ToolInvocation call(String tool, String bindsTo) {
        return new ToolInvocation(tool, Map.of(), bindsTo);
    }

    private static ToolInvocation use(String tool, String reference) {
        return new ToolInvocation(tool, Map.of("value", reference), null);
    }

    private static WorkflowSpec spec(WorkflowNode root, String... inputs) {
        List<InputParam> params = Arrays.stream(inputs)
                .map(name -> new InputParam(name, ParamType.STRING, null, false))
                .toList();
        return new WorkflowSpec("scope_test", "Scope test", "1.0.0", params, List.of(), root, Map.of());
    }

    @Nested
    @DisplayName("Concrete scenario")
    class ConcreteScenario {

        @Test
        @DisplayName("Should accept a binding made on both arms of a branch")
        void shouldAcceptBindingOnBothArms() {
            WorkflowNode root = new Sequence(List.of(
                    call("a", "x"),
                    new Branch("{{x}} > 5", call("b", "y"), call("c", "y")),
                    use("d", "{{y}}")));

            ScopeAnalysis analysis = analyzer.analyze(spec(root));

            assertThat(analysis.isSound()).isTrue();
            assertThat(analysis.outgoing()).containsExactly("x", "y");
        }

        @Test
        @DisplayName("Should reject the later reference once the else-branch is removed")
        void shouldRejectWithoutElse() {
            WorkflowNode root = new Sequence(List.of(
                    call("a", "x"),
                    new Branch("{{x}} > 5", call("b", "y"), null),
                    use("d", "{{y}}")));

            assertThatThrownBy(() -> analyzer.analyze(spec(root)).requireSound())
                    .isInstanceOfSatisfying(ScopeException.class, e -> {
                        assertThat(e.getMissingName()).isEqualTo("y");
                        assertThat(e.getAvailableNames()).containsExactly("x");
                        assertThat(e.getMessage()).startsWith("workflow.steps[2].parameters.value: Tool 'd' "
                                + "references undefined variable '{{y}}'");
                    });
        }
    }

    @Nested
    @DisplayName("Guarantee laws")
    class GuaranteeLaws {

        @Test
        @DisplayName("Branch guarantees the intersection while fan-out guarantees the union")
        void shouldContrastBranchAndFanout() {
            WorkflowNode left = new Sequence(List.of(call("a", "shared"), call("b", "only_left")));
            WorkflowNode right = new Sequence(List.of(call("c", "shared"), call("d", "only_right")));

            ScopeAnalysis branch = analyzer.analyze(new Branch("{{flag}} == 1", left, right), Set.of("flag"), "workflow");
            ScopeAnalysis fanout = analyzer.analyze(new Fanout(List.of(left, right), JoinPolicy.WAIT_FOR_ALL),
                    Set.of("flag"), "workflow");

            assertThat(branch.outgoing()).containsExactly("flag", "shared");
            assertThat(fanout.outgoing()).containsExactly("flag", "only_left", "only_right", "shared");
        }

        @ParameterizedTest
        @EnumSource(JoinPolicy.class)
        @DisplayName("Fan-out branches start from the same incoming set regardless of join policy")
        void shouldIsolateFanoutBranches(JoinPolicy policy) {
            WorkflowNode fanout = new Fanout(List.of(call("a", "first"), use("b", "{{first}}")), policy);

            ScopeAnalysis analysis = analyzer.analyze(fanout, Set.of(), "workflow");

            assertThat(analysis.violations()).singleElement()
                    .satisfies(v -> {
                        assertThat(v.missingName()).isEqualTo("first");
                        assertThat(v.path()).isEqualTo("workflow.branches[1].parameters.value");
                    });
        }

        @Test
        @DisplayName("Should apply the union to a first-to-finish fan-out as well")
        void shouldUnionFirstToFinishBranches() {
            WorkflowNode fanout = new Fanout(List.of(call("a", "fast"), call("b", "slow")), JoinPolicy.FIRST_TO_FINISH);

            ScopeAnalysis analysis = analyzer.analyze(fanout, Set.of(), "workflow");

            assertThat(analysis.outgoing()).containsExactly("fast", "slow");
        }

        @Test
        @DisplayName("Dispatcher guarantees nothing beyond its incoming set")
        void shouldNotPropagateDispatcherBindings() {
            Map<String, WorkflowNode> subs = new LinkedHashMap<>();
            subs.put("fast", call("a", "result"));
            subs.put("slow", call("b", "result"));
            WorkflowNode root = new Sequence(List.of(
                    new Dispatcher(subs, List.of(new RoutingRule("{{mode}} == 'fast'", "fast")), "slow"),
                    use("c", "{{result}}")));

            ScopeAnalysis analysis = analyzer.analyze(spec(root, "mode"));

            assertThat(analysis.violations()).extracting(ScopeViolation::missingName).containsExactly("result");
        }
    }

    @Test
    @DisplayName("Should check conditions and routing rules against the incoming set")
    void shouldCheckConditions() {
        Map<String, WorkflowNode> subs = Map.of("only", call("a", null));
        WorkflowNode root = new Sequence(List.of(
                new Branch("{{missing}} > 1", call("b", null), null),
                new Dispatcher(subs, List.of(new RoutingRule("{{other}} == 2", "only")), null)));

        ScopeAnalysis analysis = analyzer.analyze(spec(root));

        assertThat(analysis.violations()).extracting(ScopeViolation::path)
                .containsExactly("workflow.steps[0].condition", "workflow.steps[1].routing_rules[0].condition");
        assertThat(analysis.violations().get(0).message()).startsWith("Condition references undefined variable");
        assertThat(analysis.violations().get(1).message()).startsWith("Routing rule condition references");
    }

    @Test
    @DisplayName("Should treat a reference inside a quoted condition literal as text")
    void shouldIgnoreQuotedConditionText() {
        WorkflowNode root = new Branch("{{mode}} == '{{draft}}'", call("a", null), null);

        ScopeAnalysis analysis = analyzer.analyze(spec(root, "mode"));

        assertThat(analysis.violations()).isEmpty();
    }

    @Test
    @DisplayName("Should collect every violation, including nested parameter values")
    void shouldCollectAllViolations() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("body", Map.of("items", List.of("{{a}}", "{{b.c}}")));
        parameters.put("note", "hello {{d}}");
        ToolInvocation tool = new ToolInvocation("send", parameters, null);

        ScopeAnalysis analysis = analyzer.analyze(spec(tool, "a"));

        assertThat(analysis.violations()).extracting(ScopeViolation::missingName).containsExactly("b", "d");
        assertThat(analysis.toIssues()).hasSize(2);
        assertThatThrownBy(analysis::requireSound).hasMessageEndingWith("(and 1 more scope error(s))");
    }

    @Test
    @DisplayName("Should list available names, or (none), in the message")
    void shouldListAvailableNames() {
        ScopeAnalysis analysis = analyzer.analyze(spec(use("a", "{{nope}}")));

        assertThat(analysis.violations().get(0).message()).endsWith("Available: (none)");
    }
}
