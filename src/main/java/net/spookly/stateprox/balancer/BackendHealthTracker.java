package net.spookly.stateprox.balancer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

import net.spookly.stateprox.session.BackendAddress;

/**
 * Tracks backend health scores from passive failures and optional active probes.
 * Reads are lock-free; a reader may observe a score a moment out of date.
 *
 * <p>A backend known only through passive reports regains {@value #RECOVERY_STEP} points per
 * second since its last report, so an ejected backend is retried without a probe. Once an
 * active probe reports on a backend, only probes move its score back up.</p>
 */
public final class BackendHealthTracker {
    private static final int MAX_SCORE = 100;
    private static final int MIN_SCORE = 0;
    private static final int HEALTHY_THRESHOLD = 70;
    private static final int UNHEALTHY_THRESHOLD = 40;
    private static final int PASSIVE_FAILURE_PENALTY = 25;
    private static final int ACTIVE_FAILURE_PENALTY = 20;
    private static final int PASSIVE_SUCCESS_REWARD = 25;
    private static final int ACTIVE_SUCCESS_REWARD = 20;
    static final int RECOVERY_STEP = 5;
    private static final long RECOVERY_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final Map<BackendAddress, HealthState> states = new ConcurrentHashMap<>();
    private final LongSupplier nanoClock;

    public BackendHealthTracker() {
        this(System::nanoTime);
    }

    BackendHealthTracker(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    /**
     * Record a passive failure (connect refused, connect timeout).
     */
    public void recordPassiveFailure(Endpoint endpoint) {
        updateScore(endpoint, -PASSIVE_FAILURE_PENALTY, false);
    }

    /**
     * Record a passive success (upstream connection established).
     */
    public void recordPassiveSuccess(Endpoint endpoint) {
        updateScore(endpoint, PASSIVE_SUCCESS_REWARD, false);
    }

    /**
     * Record an active probe failure.
     */
    public void recordActiveFailure(Endpoint endpoint) {
        updateScore(endpoint, -ACTIVE_FAILURE_PENALTY, true);
    }

    /**
     * Record an active probe success.
     */
    public void recordActiveSuccess(Endpoint endpoint) {
        updateScore(endpoint, ACTIVE_SUCCESS_REWARD, true);
    }

    /**
     * Current health score for a backend (0-100). Unknown backends score 100.
     */
    public int score(Endpoint endpoint) {
        if (endpoint == null || endpoint.address() == null) {
            return MAX_SCORE;
        }
        HealthState state = states.get(endpoint.address());
        return state == null ? MAX_SCORE : state.scoreAt(nanoClock.getAsLong());
    }

    public HealthStatus status(Endpoint endpoint) {
        int score = score(endpoint);
        if (score >= HEALTHY_THRESHOLD) {
            return HealthStatus.HEALTHY;
        }
        if (score >= UNHEALTHY_THRESHOLD) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.UNHEALTHY;
    }

    private void updateScore(Endpoint endpoint, int delta, boolean active) {
        if (endpoint == null || endpoint.address() == null) {
            return;
        }
        long now = nanoClock.getAsLong();
        states.compute(endpoint.address(), (key, state) -> {
            HealthState current = state == null ? new HealthState(now) : state;
            current.apply(delta, active, now);
            return current;
        });
    }

    private static final class HealthState {
        private volatile int score = MAX_SCORE;
        private volatile long updatedAtNanos;
        private volatile boolean probed;

        private HealthState(long now) {
            this.updatedAtNanos = now;
        }

        private int scoreAt(long now) {
            int base = score;
            if (probed || base >= MAX_SCORE) {
                return base;
            }
            long intervals = Math.max(0L, now - updatedAtNanos) / RECOVERY_INTERVAL_NANOS;
            return (int) Math.min(MAX_SCORE, base + intervals * RECOVERY_STEP);
        }

        private void apply(int delta, boolean active, long now) {
            probed |= active;
            int base = scoreAt(now);
            score = Math.max(MIN_SCORE, Math.min(MAX_SCORE, base + delta));
            updatedAtNanos = now;
        }
    }
}
