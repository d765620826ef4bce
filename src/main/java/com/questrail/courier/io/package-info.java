/**
 * Request Execution
 * =============================================================================
 *
 * The request state machine and the strategies that drive it.
 *
 * <h2>Moving parts</h2>
 * <ul>
 *   <li>{@link com.questrail.courier.io.RequestState}: the six lifecycle
 *       states and the transitions each one allows.</li>
 *   <li>{@link com.questrail.courier.io.ExecutionContext}: owns the live state
 *       of one request and takes one step at a time.</li>
 *   <li>{@link com.questrail.courier.io.RequestTemplate}: caller hooks that can
 *       redirect the lifecycle with a {@link com.questrail.courier.io.Transition}.</li>
 *   <li>{@link com.questrail.courier.io.ExecutionStrategy}: the concurrency
 *       model (blocking, thread offload, cooperative event loop).</li>
 * </ul>
 *
 * <h2>Binding constraints</h2>
 * The state machine is transport-agnostic and concurrency-agnostic: it never
 * inspects requests or responses, never blocks, and never chooses a thread.
 * Those decisions belong to the client adapter and the strategy.
 */
package com.questrail.courier.io;
