/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.codegen;

import com.flowsmith.workflow.api.exceptions.GenerationException;
import com.flowsmith.workflow.api.model.CompiledWorkflow;
import com.flowsmith.workflow.api.model.ToolInvocation;
import com.flowsmith.workflow.api.model.WorkflowSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmittedSourceVerifierTest {

    private static final WorkflowSpec PING = new WorkflowSpec("ping", "Ping", null, List.of(), List.of(),
            new ToolInvocation("ping", Map.of(), null), Map.of());

    @Test
    @DisplayName("Should accept generated source")
    void shouldAcceptGeneratedSource() {
        CompiledWorkflow program = new JavaProgramGenerator().generate(PING, ToolLibraryIndex.empty());

        assertThat(new EmittedSourceVerifier().verify(program)).isTrue();
    }

    @Test
    @DisplayName("Should report syntax errors with their line")
    void shouldReportSyntaxErrors() {
        CompiledWorkflow broken = new CompiledWorkflow(PING, "com.acme", "PingWorkflow",
                "package com.acme;\n\npublic final class PingWorkflow {\n    void run( {\n}\n", new TreeSet<>(), new TreeSet<>(Set.of("ping")));

        assertThatThrownBy(() -> new EmittedSourceVerifier().verify(broken))
                .isInstanceOf(GenerationException.class)
                .hasMessageStartingWith("Generated source for com.acme.PingWorkflow is not valid Java: line 4: ");
    }

    @Test
    @DisplayName("Should reject a method that exceeds the class file size limit")
    void shouldRejectOversizedMethod() {
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < 12_000; i++) {
            body.append("        total += values.get(").append(i % 7).append(");\n");
        }
        String source = "package com.acme;\n\nimport java.util.List;\n\npublic final class PingWorkflow {\n"
                + "    long sum(List<Integer> values) {\n        long total = 0;\n" + body
                + "        return total;\n    }\n}\n";
        CompiledWorkflow oversized = new CompiledWorkflow(PING, "com.acme", "PingWorkflow", source,
                new TreeSet<>(), new TreeSet<>(Set.of("ping")));

        assertThatThrownBy(() -> new EmittedSourceVerifier().verify(oversized))
                .isInstanceOf(GenerationException.class)
                .hasMessageStartingWith("Generated source for com.acme.PingWorkflow does not compile: ")
                .hasMessageContaining("code too large");
    }

    @Test
    @DisplayName("Should tolerate library classes that are not on the classpath")
    void shouldTolerateMissingLibraryClasses() {
        CompiledWorkflow program = new CompiledWorkflow(PING, "com.acme", "PingWorkflow", """
                package com.acme;

                public final class PingWorkflow {
                    Object ping(Object kwargs) {
                        return com.acme.tools.Pinger.ping(kwargs);
                    }
                }
                """, new TreeSet<>(), new TreeSet<>(Set.of("ping")));

        assertThat(new EmittedSourceVerifier().verify(program)).isTrue();
    }

    @Test
    @DisplayName("Should skip verification without a system compiler")
    void shouldSkipWithoutCompiler() {
        EmittedSourceVerifier verifier = new EmittedSourceVerifier(null);
        CompiledWorkflow program = new JavaProgramGenerator().generate(PING, ToolLibraryIndex.empty());

        assertThat(verifier.isAvailable()).isFalse();
        assertThat(verifier.verify(program)).isFalse();
    }
}
