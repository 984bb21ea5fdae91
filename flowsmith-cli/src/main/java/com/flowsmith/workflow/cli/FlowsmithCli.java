/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/** Root command of the {@code flowsmith} command line. */
@Command(name = "flowsmith", description = "Validates workflow documents and compiles them into Java programs.",
        mixinStandardHelpOptions = true, version = "flowsmith 1.0.0",
        subcommands = {ValidateCommand.class, CompileCommand.class})
public final class FlowsmithCli {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_INTERNAL_ERROR = 2;
    static final int EXIT_IO_ERROR = 3;

    public FlowsmithCli() {
        // for picocli
    }

    public static void main(String[] args) {
        configureLogging();
        int exitCode = commandLineInstance().execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static CommandLine commandLineInstance() {
        return new CommandLine(new FlowsmithCli());
    }

    private static void configureLogging() {
        try (InputStream in = FlowsmithCli.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            Logger.getLogger(FlowsmithCli.class.getName()).warning("Could not read logging.properties: " + e.getMessage());
        }
    }
}
