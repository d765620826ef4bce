package com.questrail.courier.io;

/**
 * Something that can be driven to completion one step at a time.
 *
 * @param <R> the terminal result type
 */
@FunctionalInterface
public interface Executable<R>
{
    /**
     * Start or continue the execution by exactly one step.
     */
    Step<R> execute();
}
