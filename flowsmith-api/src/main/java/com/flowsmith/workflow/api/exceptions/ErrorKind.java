/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.exceptions;

/**
 * Categories of document defects reported back to the author of a workflow.
 */
public enum ErrorKind {
    /** Missing or mistyped field, unknown node type, cardinality violation. */
    STRUCTURAL,
    /** Identifier or version grammar violation. */
    NAMING,
    /** Condition rejected by the grammar validator or not a well-formed expression. */
    CONDITION,
    /** Reference to a name that is not guaranteed to be available. */
    SCOPE,
    /** Dispatcher routing target or default that does not exist. */
    REFERENCE,
    /** Sequence, fan-out or nesting cap exceeded. */
    COMPLEXITY,
    /** Credential-like tool parameter given a literal value. */
    CREDENTIAL
}
