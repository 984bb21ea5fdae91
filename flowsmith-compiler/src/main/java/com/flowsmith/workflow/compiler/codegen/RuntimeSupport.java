/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.codegen;

import java.util.List;

/**
 * Fixed members appended to every generated class: context lookups, value
 * comparison with numeric equality across integer and decimal types,
 * fan-out joins, stub helpers and the nested runtime types.
 *
 * <p>{@code Scope} is the shared context. A first-to-finish branch runs
 * against a child scope that reads through to its parent but keeps its own
 * writes; only the winning child is committed, so writes from cancelled
 * branches are discarded. The names a losing branch could have bound are
 * remembered, and a later lookup of one of them reports why it is missing.
 */
final class RuntimeSupport {

    static final List<String> IMPORTS = List.of(
            "java.math.BigDecimal",
            "java.math.BigInteger",
            "java.util.ArrayList",
            "java.util.Arrays",
            "java.util.Collection",
            "java.util.Collections",
            "java.util.HashSet",
            "java.util.LinkedHashMap",
            "java.util.List",
            "java.util.Locale",
            "java.util.Map",
            "java.util.Objects",
            "java.util.Set",
            "java.util.concurrent.Callable",
            "java.util.concurrent.CompletionService",
            "java.util.concurrent.ExecutionException",
            "java.util.concurrent.ExecutorCompletionService",
            "java.util.concurrent.ExecutorService",
            "java.util.concurrent.Executors",
            "java.util.concurrent.Future");

    static final String MEMBERS = """
            private static void resolveSecret(Map<String, Object> values, String name) {
                if (values.get(name) != null) {
                    return;
                }
                String fromEnvironment = System.getenv(name.toUpperCase(Locale.ROOT));
                if (fromEnvironment != null) {
                    values.put(name, fromEnvironment);
                } else {
                    values.remove(name);
                }
            }

            private static Map<String, Object> maskSecrets(Map<String, Object> values) {
                Map<String, Object> masked = new LinkedHashMap<>(values);
                for (String name : SECRET_INPUTS) {
                    if (masked.containsKey(name)) {
                        masked.put(name, "***");
                    }
                }
                return Collections.unmodifiableMap(masked);
            }

            private static String requireEnv(String variable) {
                String value = System.getenv(variable);
                if (value == null || value.isEmpty()) {
                    throw new MissingConfigurationException("Missing " + variable + " environment variable. Setup: export "
                            + variable + "=<your-value-here>");
                }
                return value;
            }

            private static Map<String, Object> placeholderResult(String tool, Map<String, Object> kwargs) {
                Map<String, Object> data = new LinkedHashMap<>();
                if (kwargs != null) {
                    data.putAll(kwargs);
                }
                Map<String, Object> result = new LinkedHashMap<>();
                result.put("status", "not_implemented");
                result.put("tool", tool);
                result.put("data", data);
                return result;
            }

            private static Object resolveRef(Scope scope, String root, String... fields) {
                if (!scope.contains(root)) {
                    if (scope.wasDiscarded(root)) {
                        throw new IllegalStateException("Context value '" + root + "' is not available: it is bound "
                                + "only by a first-to-finish branch that did not finish first");
                    }
                    throw new IllegalStateException("Context value '" + root + "' is not available");
                }
                Object value = scope.get(root);
                String path = root;
                for (String field : fields) {
                    if (!(value instanceof Map)) {
                        throw new IllegalStateException("Cannot read field '" + field + "' of '" + path + "': value is "
                                + describeValue(value));
                    }
                    value = ((Map<?, ?>) value).get(field);
                    path = path + "." + field;
                }
                return value;
            }

            private static List<Object> listOf(Object[] items) {
                return new ArrayList<>(Arrays.asList(items));
            }

            private static Map<String, Object> mapOf(Object[] keysAndValues) {
                Map<String, Object> map = new LinkedHashMap<>();
                for (int i = 0; i < keysAndValues.length; i += 2) {
                    map.put((String) keysAndValues[i], keysAndValues[i + 1]);
                }
                return map;
            }

            private static boolean isTruthy(Object value) {
                if (value == null) {
                    return false;
                }
                if (value instanceof Boolean) {
                    return (Boolean) value;
                }
                if (value instanceof Number) {
                    return ((Number) value).doubleValue() != 0.0;
                }
                if (value instanceof CharSequence) {
                    return ((CharSequence) value).length() > 0;
                }
                if (value instanceof Collection) {
                    return !((Collection<?>) value).isEmpty();
                }
                if (value instanceof Map) {
                    return !((Map<?, ?>) value).isEmpty();
                }
                return true;
            }

            private static boolean sameValue(Object left, Object right) {
                if (left instanceof Number && right instanceof Number) {
                    return compareNumbers((Number) left, (Number) right) == 0;
                }
                return Objects.equals(left, right);
            }

            private static int compareValues(Object left, Object right) {
                if (left instanceof Number && right instanceof Number) {
                    return compareNumbers((Number) left, (Number) right);
                }
                if (left instanceof CharSequence && right instanceof CharSequence) {
                    return left.toString().compareTo(right.toString());
                }
                if (left instanceof Boolean && right instanceof Boolean) {
                    return Boolean.compare((Boolean) left, (Boolean) right);
                }
                throw new IllegalArgumentException("Cannot compare " + describeValue(left) + " with " + describeValue(right));
            }

            private static int compareNumbers(Number left, Number right) {
                try {
                    return new BigDecimal(left.toString()).compareTo(new BigDecimal(right.toString()));
                } catch (NumberFormatException e) {
                    return Double.compare(left.doubleValue(), right.doubleValue());
                }
            }

            private static boolean containsValue(Object container, Object item) {
                if (container instanceof Map) {
                    return ((Map<?, ?>) container).containsKey(item);
                }
                if (container instanceof Collection) {
                    for (Object element : (Collection<?>) container) {
                        if (sameValue(element, item)) {
                            return true;
                        }
                    }
                    return false;
                }
                if (container instanceof CharSequence && item instanceof CharSequence) {
                    return container.toString().contains(item.toString());
                }
                throw new IllegalArgumentException("Cannot test membership of " + describeValue(item) + " in "
                        + describeValue(container));
            }

            private static boolean isIdentical(Object left, Object right) {
                if (left == null || right == null) {
                    return left == right;
                }
                if (left instanceof Boolean || left instanceof Number || left instanceof CharSequence) {
                    return left.getClass() == right.getClass() && sameValue(left, right);
                }
                return left == right;
            }

            private static String describeValue(Object value) {
                return value == null ? "null" : "a " + value.getClass().getSimpleName();
            }

            private static void joinAll(List<Runnable> units) {
                ExecutorService executor = Executors.newFixedThreadPool(units.size());
                try {
                    List<Future<?>> futures = new ArrayList<>();
                    for (Runnable unit : units) {
                        futures.add(executor.submit(unit));
                    }
                    for (Future<?> future : futures) {
                        awaitUnit(future);
                    }
                } finally {
                    executor.shutdownNow();
                }
            }

            private static Scope joinFirst(List<Callable<Scope>> units) {
                ExecutorService executor = Executors.newFixedThreadPool(units.size());
                CompletionService<Scope> completion = new ExecutorCompletionService<>(executor);
                List<Future<Scope>> futures = new ArrayList<>();
                try {
                    for (Callable<Scope> unit : units) {
                        futures.add(completion.submit(unit));
                    }
                    return awaitUnit(completion.take());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for a parallel branch", e);
                } finally {
                    for (Future<Scope> future : futures) {
                        future.cancel(true);
                    }
                    executor.shutdownNow();
                }
            }

            private static <T> T awaitUnit(Future<T> future) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for a parallel branch", e);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    }
                    if (cause instanceof Error) {
                        throw (Error) cause;
                    }
                    throw new IllegalStateException("Parallel branch failed", cause);
                }
            }

            /**
             * Shared execution context keyed by binding name. A child scope reads
             * through to its parent and keeps its own writes until committed.
             */
            static final class Scope {
                private final Scope parent;
                private final Map<String, Object> values = new LinkedHashMap<>();
                private final Set<String> discarded = new HashSet<>();

                Scope(Scope parent) {
                    this.parent = parent;
                }

                boolean contains(String key) {
                    synchronized (this) {
                        if (values.containsKey(key)) {
                            return true;
                        }
                    }
                    return parent != null && parent.contains(key);
                }

                Object get(String key) {
                    synchronized (this) {
                        if (values.containsKey(key)) {
                            return values.get(key);
                        }
                    }
                    return parent == null ? null : parent.get(key);
                }

                boolean wasDiscarded(String key) {
                    synchronized (this) {
                        if (discarded.contains(key)) {
                            return true;
                        }
                    }
                    return parent != null && parent.wasDiscarded(key);
                }

                synchronized void put(String key, Object value) {
                    values.put(key, value);
                    discarded.remove(key);
                }

                synchronized void discard(String key) {
                    if (!values.containsKey(key)) {
                        discarded.add(key);
                    }
                }

                /**
                 * Copies this scope's writes into the target and marks every raced name
                 * this scope did not write as discarded there.
                 */
                void commitTo(Scope target, List<String> raced) {
                    Map<String, Object> written;
                    synchronized (this) {
                        written = new LinkedHashMap<>(values);
                    }
                    written.forEach(target::put);
                    for (String name : raced) {
                        if (!written.containsKey(name)) {
                            target.discard(name);
                        }
                    }
                }

                Map<String, Object> snapshot() {
                    Map<String, Object> view = parent == null ? new LinkedHashMap<>() : parent.snapshot();
                    synchronized (this) {
                        view.putAll(values);
                    }
                    return view;
                }
            }

            /**
             * Raised when a workflow fails at runtime. The cause is the original
             * failure; secret inputs are masked in both snapshots.
             */
            public static final class WorkflowExecutionException extends RuntimeException {
                private final Map<String, Object> contextAtFailure;
                private final Map<String, Object> inputs;

                WorkflowExecutionException(String message, Throwable cause, Map<String, Object> contextAtFailure,
                        Map<String, Object> inputs) {
                    super(message, cause);
                    this.contextAtFailure = contextAtFailure;
                    this.inputs = inputs;
                }

                public Map<String, Object> getContextAtFailure() {
                    return contextAtFailure;
                }

                public Map<String, Object> getInputs() {
                    return inputs;
                }
            }

            /**
             * Raised by a tool stub when a credential it needs is not configured.
             */
            public static final class MissingConfigurationException extends IllegalStateException {
                MissingConfigurationException(String message) {
                    super(message);
                }
            }
            """;

    private RuntimeSupport() {
    }
}
