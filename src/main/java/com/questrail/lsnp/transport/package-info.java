/**
 * LSNP Transport Ports
 * =============================================================================
 *
 * <p>Framework-agnostic boundary between a concrete networking implementation
 * (Netty UDP in production, an in-memory fake in tests) and the rest of the
 * node.</p>
 *
 * <p>Everything above this boundary sees only:</p>
 * <ul>
 *   <li>raw datagram payloads as {@code byte[]}</li>
 *   <li>remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <p>Implementations perform I/O only. They do not decode messages, keep peer
 * state, or schedule announcements.</p>
 */
package com.questrail.lsnp.transport;
