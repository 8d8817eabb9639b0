/**
 * Runtime assembly package.
 *
 * <p>{@link io.agentmesh.runtime.AgentMeshRuntime} wires settings, the event bus, the
 * shared tick scheduler and the agent registry together and owns their shutdown order:
 * agents stop first, then the bus drains, then the scheduler and bus are closed.
 */
package io.agentmesh.runtime;
