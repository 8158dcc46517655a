package net.spookly.stateprox.balancer;

import java.util.Optional;

/**
 * Honours a hint when its address is a member of the snapshot whose health status is one the
 * cluster accepts for overrides.
 */
public final class AddressOverrideSelector implements HostOverrideSelector {
    public static final AddressOverrideSelector INSTANCE = new AddressOverrideSelector();

    private AddressOverrideSelector() {
    }

    @Override
    public Optional<Endpoint> select(OverrideHint hint, ClusterSnapshot snapshot) {
        if (hint == null || snapshot == null) {
            return Optional.empty();
        }
        Endpoint member = snapshot.find(hint.address());
        if (member == null) {
            return Optional.empty();
        }
        if (!snapshot.overrideStatuses().contains(snapshot.status(member))) {
            return Optional.empty();
        }
        return Optional.of(member);
    }
}
