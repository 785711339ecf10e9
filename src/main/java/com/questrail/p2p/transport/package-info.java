/**
 * Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between the networking bindings (Netty UDP,
 * Netty TCP, test doubles) and the rest of the messaging engine.
 *
 * <h2>Why these ports exist</h2>
 * Netty does the I/O in production (event loop model, mature UDP and TCP
 * support, robust lifecycle handling) <strong>without</strong> Netty types
 * leaking into codecs, sessions or dispatch.
 *
 * <p>Everything above a binding sees only:</p>
 * <ul>
 *   <li>Whole {@link com.questrail.p2p.model.Package}s</li>
 *   <li>Logical peers as {@link com.questrail.p2p.api.Address}</li>
 *   <li>Lifecycle and traffic events through the observability sink</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Bindings MUST:
 * <ul>
 *   <li>Perform frame I/O only and leave decoding to {@link com.questrail.p2p.transport.AbstractTransport}</li>
 *   <li>Never run handlers on an event loop</li>
 *   <li>Never let one bad frame or connection stop the receive loop</li>
 * </ul>
 */
package com.questrail.p2p.transport;
