/**
 * Protocol-level model shared by the router, the transports and the protocol server.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.mcpcompat.core.Protocol} (header names, paths, method names)</li>
 *   <li>{@link io.mcpcompat.core.JsonRpcMessage} and {@link io.mcpcompat.core.JsonRpcCodec}</li>
 *   <li>{@link io.mcpcompat.core.EventId} (resumable event identifiers)</li>
 *   <li>{@link io.mcpcompat.core.ErrorKind} and {@link io.mcpcompat.core.McpCompatException}</li>
 * </ul>
 */
package io.mcpcompat.core;
