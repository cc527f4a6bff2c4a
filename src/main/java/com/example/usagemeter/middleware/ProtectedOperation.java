package com.example.usagemeter.middleware;

/**
 * The business operation guarded by {@link UsageMiddleware}. Runs only after every check admitted it.
 *
 * @param <T> result type
 * @param <E> checked exception the operation may throw; rethrown unchanged by the middleware
 */
@FunctionalInterface
public interface ProtectedOperation<T, E extends Exception> {

    T run() throws E;
}
