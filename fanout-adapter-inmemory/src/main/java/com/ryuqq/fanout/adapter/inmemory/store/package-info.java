/**
 * In-memory retention of published messages for replay to late subscribers.
 *
 * @see com.ryuqq.fanout.adapter.inmemory.store.RetentionStore
 * @author Fanout Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.adapter.inmemory.store;
