/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the publish/subscribe contract consumed by producers, consumers
 * and any routing layer built on top of the engine.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fanout.core.spi.Publisher} - blocking publish with per-subscriber acknowledgment</li>
 *   <li>{@link com.ryuqq.fanout.core.spi.Subscriber} - subscription returning a {@link com.ryuqq.fanout.core.spi.MessageStream}</li>
 *   <li>{@link com.ryuqq.fanout.core.spi.PubSub} - both sides plus idempotent close</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., fanout-adapter-inmemory) provide concrete implementations and
 * prove them against the contract tests in fanout-testkit.</p>
 *
 * @since 1.0.0
 * @author Fanout Team
 */
package com.ryuqq.fanout.core.spi;
