package net.spookly.stateprox.balancer;

import java.util.Objects;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import net.spookly.stateprox.session.BackendAddress;

/**
 * Preferred backend for one request, published by the session filter and read by the balancer.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public final class OverrideHint {
    private final BackendAddress address;

    public OverrideHint(BackendAddress address) {
        this.address = Objects.requireNonNull(address, "address");
    }
}
