package net.spookly.stateprox.balancer;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.stateprox.session.BackendAddress;

/**
 * One in-flight request counted against an endpoint. Releasing twice is harmless.
 */
public final class EndpointLease implements AutoCloseable {
    @Getter
    @Accessors(fluent = true)
    private final Endpoint endpoint;
    private final EndpointLoadTracker tracker;
    private final BackendAddress key;
    private final AtomicBoolean released = new AtomicBoolean(false);

    EndpointLease(Endpoint endpoint, EndpointLoadTracker tracker, BackendAddress key) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.tracker = tracker;
        this.key = key;
    }

    public void release() {
        if (tracker == null) {
            return;
        }
        if (released.compareAndSet(false, true)) {
            tracker.release(key);
        }
    }

    @Override
    public void close() {
        release();
    }
}
