/**
 * OOB Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>transport boundary</em> between a concrete
 * point-to-point carrier (a TCP server socket, a platform RFCOMM socket, or a
 * test double) and the out-of-band channel state machine.
 *
 * <p>Everything above this boundary sees only:</p>
 * <ul>
 *   <li>a listening endpoint that accepts one connection</li>
 *   <li>a connection exposing a blocking {@link java.io.InputStream}</li>
 *   <li>the set of bonded peers</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no framing or token interpretation)</li>
 *   <li>Unblock a pending accept or read with an {@link java.io.IOException}
 *       when closed from another thread</li>
 *   <li>Tolerate {@code close()} being called more than once</li>
 *   <li>Not schedule retries or timeouts beyond those they are handed</li>
 * </ul>
 */
package com.questrail.oob.transport;
