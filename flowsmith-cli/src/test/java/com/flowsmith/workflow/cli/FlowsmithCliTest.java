/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.cli;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FlowsmithCliTest {

    private static final String VALID = """
            {
              "name": "order_intake",
              "description": "Check an order and notify the warehouse",
              "inputs": [
                {"name": "order", "type": "dict"},
                {"name": "warehouse_token", "type": "string"}
              ],
              "workflow": {
                "type": "sequential",
                "steps": [
                  {"type": "tool_call", "tool_name": "check_stock",
                   "parameters": {"sku": "{{order.sku}}"}, "assigns_to": "stock"},
                  {"type": "conditional", "condition": "{{stock.available}} == True",
                   "if_branch": {"type": "tool_call", "tool_name": "notify_warehouse",
                                 "parameters": {"order": "{{order}}", "token": "{{warehouse_token}}"}}}
                ]
              }
            }
            """;

    private static final String INVALID = """
            {
              "name": "order_intake",
              "description": "Uses a result that may not exist",
              "workflow": {
                "type": "sequential",
                "steps": [
                  {"type": "tool_call", "tool_name": "notify", "parameters": {"stock": "{{stock}}"}}
                ]
              }
            }
            """;

    @TempDir
    Path dir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine cli;

    @BeforeAll
    static void disableTracing() {
        System.setProperty("OTEL_DISABLED", "true");
    }

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cli = FlowsmithCli.commandLineInstance();
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("Should exit 0 for a valid document")
        void shouldAcceptValidDocument() throws IOException {
            int exit = cli.execute("validate", write("valid.json", VALID).toString());

            assertThat(exit).isEqualTo(FlowsmithCli.EXIT_OK);
            assertThat(err.toString()).isBlank();
        }

        @Test
        @DisplayName("Should exit 1 and list the issues for an invalid document")
        void shouldListIssues() throws IOException {
            int exit = cli.execute("validate", write("invalid.json", INVALID).toString());

            assertThat(exit).isEqualTo(FlowsmithCli.EXIT_INVALID);
            assertThat(out.toString()).contains("workflow.steps[0].parameters.stock").contains("{{stock}}");
        }

        @Test
        @DisplayName("Should print the report as JSON on request")
        void shouldPrintJson() throws IOException {
            int exit = cli.execute("validate", "--json", write("invalid.json", INVALID).toString());

            assertThat(exit).isEqualTo(FlowsmithCli.EXIT_INVALID);
            assertThat(out.toString()).contains("\"kind\" : \"SCOPE\"").contains("\"path\" : ");
        }

        @Test
        @DisplayName("Should exit 3 when the document cannot be read")
        void shouldReportUnreadableFile() {
            int exit = cli.execute("validate", dir.resolve("missing.json").toString());

            assertThat(exit).isEqualTo(FlowsmithCli.EXIT_IO_ERROR);
            assertThat(err.toString()).startsWith("Could not read ");
        }
    }

    @Nested
    @DisplayName("compile")
    class Compile {

        @Test
        @DisplayName("Should write the generated class below its package directory")
        void shouldWriteSource() throws IOException {
            Path output = dir.resolve("generated");

            int exit = cli.execute("compile", write("valid.json", VALID).toString(),
                    "--output-dir", output.toString(), "--package", "com.acme.orders");

            assertThat(exit).isEqualTo(FlowsmithCli.EXIT_OK);
            Path source = output.resolve("com/acme/orders/OrderIntakeWorkflow.java");
            assertThat(source).exists();
            assertThat(Files.readString(source)).contains("package com.acme.orders;")
                    .contains("public final class OrderIntakeWorkflow");
            assertThat(out.toString())
                    .contains("Class: com.acme.orders.OrderIntakeWorkflow")
                    .contains("Secret parameters: warehouse_token")
                    .contains("Tools: check_stock, notify_warehouse");
        }

        @Test
        @DisplayName("Should print the compilation summary as JSON on request")
        void shouldPrintJsonSummary() throws IOException {
            int exit = cli.execute("compile", "--json", write("valid.json", VALID).toString(),
                    "-o", dir.resolve("generated").toString());

            assertThat(exit).isEqualTo(FlowsmithCli.EXIT_OK);
            assertThat(out.toString())
                    .contains("\"className\" : \"OrderIntakeWorkflow\"")
                    .contains("\"secretParameters\" : [ \"warehouse_token\" ]")
                    .contains("\"toolNames\" : [ \"check_stock\", \"notify_warehouse\" ]")
                    .doesNotContain("\"source\"")
                    .doesNotContain("\"workflow\"");
        }

        @Test
        @DisplayName("Should exit 1 and write nothing for an invalid document")
        void shouldRejectInvalidDocument() throws IOException {
            Path output = dir.resolve("generated");

            int exit = cli.execute("compile", write("invalid.json", INVALID).toString(), "-o", output.toString());

            assertThat(exit).isEqualTo(FlowsmithCli.EXIT_INVALID);
            assertThat(err.toString()).contains("{{stock}}");
            assertThat(output).doesNotExist();
        }

        @Test
        @DisplayName("Should exit 3 when the tool library cannot be read")
        void shouldReportMissingToolLibrary() throws IOException {
            int exit = cli.execute("compile", write("valid.json", VALID).toString(),
                    "-o", dir.toString(), "--tool-library", dir.resolve("nope.json").toString());

            assertThat(exit).isEqualTo(FlowsmithCli.EXIT_IO_ERROR);
            assertThat(err.toString()).startsWith("I/O error: ");
        }

        @Test
        @DisplayName("Should reject an invalid package name as a usage error")
        void shouldRejectInvalidPackage() throws IOException {
            int exit = cli.execute("compile", write("valid.json", VALID).toString(), "-p", "com.acme-orders");

            assertThat(exit).isEqualTo(CommandLine.ExitCode.USAGE);
            assertThat(err.toString()).contains("Invalid target package name: 'com.acme-orders'");
        }
    }

    @Test
    @DisplayName("Should print the version")
    void shouldPrintVersion() {
        int exit = cli.execute("--version");

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("flowsmith 1.0.0");
    }
}
