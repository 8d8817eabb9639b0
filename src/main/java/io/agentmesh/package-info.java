/**
 * AgentMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentmesh.bus.EventBus} is the prioritized in-process publish/subscribe core.</li>
 *   <li>{@code io.agentmesh.agent.AgentRegistry} orders agent start and stop by declared dependencies.</li>
 *   <li>{@code io.agentmesh.runtime.AgentMeshRuntime} wires both together for the CLI and embedding code.</li>
 * </ul>
 */
package io.agentmesh;
