package net.spookly.stateprox.balancer;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import net.spookly.stateprox.session.BackendAddress;

/**
 * Immutable cluster member.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class Endpoint {
    private final String id;
    private final String cluster;
    private final BackendAddress address;
    private final int weight;
}
