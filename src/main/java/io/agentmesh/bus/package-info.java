/**
 * Event bus package.
 *
 * <p>{@link io.agentmesh.bus.EventBus} accepts events from any thread, queues them by
 * priority and delivers them on a single dispatcher thread. Handler failures are kept
 * in a bounded {@link io.agentmesh.bus.DeadLetterStore} for inspection and retry.
 */
package io.agentmesh.bus;
