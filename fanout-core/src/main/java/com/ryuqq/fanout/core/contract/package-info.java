/**
 * Message envelope contract package.
 *
 * <p>This package defines the unit of transport and the acknowledgment protocol
 * the delivery engine reacts to:</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fanout.core.contract.Message} - uuid, payload, metadata, ack/nack signals</li>
 *   <li>{@link com.ryuqq.fanout.core.contract.AckState} - once-only acknowledgment outcome</li>
 *   <li>{@link com.ryuqq.fanout.core.contract.MessageContext} - cancellable execution context of a delivered copy</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Copy per delivery:</strong> each subscriber and each redelivery gets its own copy</li>
 *   <li><strong>Once-only outcome:</strong> the first of ack/nack wins, later signals are ignored</li>
 *   <li><strong>Validation:</strong> constructors reject null and blank identifiers</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fanout Team
 */
package com.ryuqq.fanout.core.contract;
