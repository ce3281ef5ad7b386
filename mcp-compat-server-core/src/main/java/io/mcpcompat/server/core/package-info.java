/**
 * Framework-neutral server core: the request router, session registry and lifecycle, both transport
 * generations, and the per-session protocol server.
 *
 * <p>HTTP frameworks adapt their requests to {@link io.mcpcompat.server.core.ServerRequest} and write back
 * the {@link io.mcpcompat.server.core.ServerResponse}, subscribing to SSE bodies.
 */
package io.mcpcompat.server.core;
