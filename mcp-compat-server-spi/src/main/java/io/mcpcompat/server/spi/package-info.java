/**
 * Server-side SPI: the resumable event store contract and the tool declarations bound to every session.
 *
 * <p>The SPI is minimal and framework-neutral; the router and transports in the server core consume it
 * without knowing which store or tools are plugged in.
 */
package io.mcpcompat.server.spi;
