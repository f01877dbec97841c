package io.graphqlsse.server.spi;

import java.io.Closeable;
import java.util.function.Consumer;

/**
 * Channel-based publish/subscribe broker backing the push delivery model.
 *
 * <p>{@link #publish(EventDraft)} fans the event out on every channel of the draft. Listeners are
 * invoked on broker-owned threads and must not block.
 */
public interface EventBroker extends EventSink, Closeable {

    /**
     * Start receiving events published on {@code channel}.
     */
    BrokerSubscription subscribe(String channel, Consumer<ChangeEvent> listener);

    /**
     * Handle to one listener registration.
     */
    interface BrokerSubscription {

        String channel();

        /**
         * Stop delivery to the listener. Idempotent.
         */
        void cancel();
    }
}
