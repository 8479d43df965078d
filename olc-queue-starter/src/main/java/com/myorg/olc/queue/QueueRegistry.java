package com.myorg.olc.queue;

import java.util.Collection;
import java.util.Optional;

public interface QueueRegistry {

    /** Returns the queue, creating it from configured defaults on first use. */
    DurableQueue queue(String name);

    Optional<DurableQueue> find(String name);

    Collection<DurableQueue> all();
}
