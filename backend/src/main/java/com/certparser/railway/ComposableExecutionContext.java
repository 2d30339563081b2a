package com.certparser.railway;

import java.util.List;
import java.util.function.Supplier;

/**
 * Nests several contexts: the first one listed is the outermost, the last one wraps the
 * computation directly.
 */
public class ComposableExecutionContext implements ExecutionContext {
    private final List<ExecutionContext> contexts;

    public ComposableExecutionContext(List<ExecutionContext> contexts) {
        if (contexts == null || contexts.isEmpty()) {
            throw new IllegalArgumentException("at least one execution context is required");
        }
        this.contexts = List.copyOf(contexts);
    }

    public static ComposableExecutionContext of(ExecutionContext... contexts) {
        return new ComposableExecutionContext(List.of(contexts));
    }

    @Override
    public <T> Result<T> execute(Supplier<Result<T>> computation) {
        Supplier<Result<T>> wrapped = computation;
        for (int i = contexts.size() - 1; i >= 0; i--) {
            ExecutionContext context = contexts.get(i);
            Supplier<Result<T>> next = wrapped;
            wrapped = () -> context.execute(next);
        }
        return wrapped.get();
    }
}
