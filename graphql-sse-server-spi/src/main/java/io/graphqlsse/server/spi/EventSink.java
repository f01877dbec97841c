package io.graphqlsse.server.spi;

/**
 * Destination for emitted events. Both delivery models accept events through this contract.
 */
public interface EventSink {

    /**
     * Assign an id and creation timestamp to the draft, then persist or publish it.
     *
     * @return the stored event
     */
    ChangeEvent publish(EventDraft draft);
}
