package org.javai.resilience;

/**
 * A zero-argument operation that produces a value or fails.
 * No shape is required of the value.
 *
 * @param <T> The type of value produced
 */
@FunctionalInterface
public interface ResilientOperation<T> {

    T call() throws Exception;
}
