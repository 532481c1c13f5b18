package com.ryuqq.fanout.adapter.inmemory.pubsub;

import com.ryuqq.fanout.core.spi.PubSub;
import com.ryuqq.fanout.testkit.contract.AbstractPubSubContractTest;

/**
 * Contract Test for InMemoryPubSub in persistent mode.
 *
 * <p>Retention must not change live delivery semantics: the same contract scenarios apply,
 * here with hand-off channels.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
class PersistentInMemoryPubSubContractTest extends AbstractPubSubContractTest {

    @Override
    protected PubSub createPubSub() {
        return new InMemoryPubSub(InMemoryPubSubConfig.persistent(0, InMemoryPubSubConfig.NO_TIMEOUT));
    }

    @Override
    protected void awaitSubscribers(PubSub pubSub, String topic, int expected) throws InterruptedException {
        PubSubTestSupport.awaitSubscribers((InMemoryPubSub) pubSub, topic, expected);
    }
}
