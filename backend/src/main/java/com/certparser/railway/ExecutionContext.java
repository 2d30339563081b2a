package com.certparser.railway;

import java.util.function.Supplier;

/**
 * Wraps a Result-producing computation with side effects such as logging or a database
 * transaction. Implementations never let an exception escape; they return a failure instead.
 */
public interface ExecutionContext {

    <T> Result<T> execute(Supplier<Result<T>> computation);
}
