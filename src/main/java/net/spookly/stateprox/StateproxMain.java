package net.spookly.stateprox;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import net.spookly.stateprox.balancer.BackendHealthProbeService;
import net.spookly.stateprox.balancer.BackendHealthTracker;
import net.spookly.stateprox.balancer.Cluster;
import net.spookly.stateprox.balancer.ClusterManager;
import net.spookly.stateprox.balancer.LoadBalancer;
import net.spookly.stateprox.config.ConfigLoader;
import net.spookly.stateprox.config.ConfigPrinter;
import net.spookly.stateprox.config.ConfigWarnings;
import net.spookly.stateprox.config.StateproxConfig;
import net.spookly.stateprox.filter.SessionAuditLogger;
import net.spookly.stateprox.filter.SessionEventListener;
import net.spookly.stateprox.filter.StatefulSessionFilter;
import net.spookly.stateprox.proxy.ProxyRouting;
import net.spookly.stateprox.proxy.ProxyServer;
import net.spookly.stateprox.proxy.TcpBackendHealthProbe;
import net.spookly.stateprox.route.RouteSessionResolver;
import net.spookly.stateprox.route.RouteTable;
import net.spookly.stateprox.session.SessionStateCodec;
import net.spookly.stateprox.session.SessionStateCodecs;

/**
 * Standalone entry point for the Stateprox proxy process.
 */
public final class StateproxMain {
    private static final String DEFAULT_CONFIG = "config/stateprox.yaml";

    private StateproxMain() {
    }

    /**
     * Boot the proxy and its health probes.
     */
    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        StateproxConfig config = ConfigLoader.load(options.configPath);
        emitWarnings(config);
        if (options.printEffectiveConfig) {
            System.out.println(ConfigPrinter.toYaml(config));
            return;
        }
        if (options.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return;
        }
        System.out.println("Stateprox config loaded: listen=" + config.proxy.listen
                + " routes=" + config.routes.size() + " clusters=" + config.clusters.size());

        ClusterManager clusterManager = ClusterManager.fromConfig(config);
        BackendHealthTracker healthTracker = new BackendHealthTracker();
        ProxyServer proxyServer = new ProxyServer(config, buildRouting(config, clusterManager, healthTracker));
        proxyServer.start();

        BackendHealthProbeService healthProbeService = null;
        if (hasHealthChecks(clusterManager)) {
            healthProbeService = new BackendHealthProbeService(
                    clusterManager,
                    healthTracker,
                    new TcpBackendHealthProbe()
            );
            healthProbeService.start();
        }

        CountDownLatch latch = new CountDownLatch(1);
        BackendHealthProbeService finalHealthProbeService = healthProbeService;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (finalHealthProbeService != null) {
                finalHealthProbeService.stop();
            }
            proxyServer.stop();
            latch.countDown();
        }));

        try {
            latch.await();
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Wire routes, balancer and the session filter from validated config.
     */
    public static ProxyRouting buildRouting(StateproxConfig config,
                                            ClusterManager clusterManager,
                                            BackendHealthTracker healthTracker) {
        SessionStateCodec globalCodec = null;
        if (config.statefulSession != null) {
            globalCodec = SessionStateCodecs.create(
                    config.statefulSession.sessionState,
                    "stateful_session.session_state"
            );
        }
        StatefulSessionFilter sessionFilter = new StatefulSessionFilter(
                new RouteSessionResolver(globalCodec),
                sessionEventListener(config)
        );
        return new ProxyRouting(
                RouteTable.fromConfig(config),
                clusterManager,
                new LoadBalancer(healthTracker),
                healthTracker,
                List.of(sessionFilter)
        );
    }

    private static SessionEventListener sessionEventListener(StateproxConfig config) {
        StateproxConfig.LoggingConfig logging = config.observability == null ? null : config.observability.logging;
        if (logging == null || !Boolean.TRUE.equals(logging.sessionEvents)) {
            return SessionEventListener.NOOP;
        }
        return SessionAuditLogger.INSTANCE;
    }

    private static boolean hasHealthChecks(ClusterManager clusterManager) {
        for (Cluster cluster : clusterManager.clusters()) {
            if (cluster.hasHealthCheck()) {
                return true;
            }
        }
        return false;
    }

    private static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig);
    }

    private static void emitWarnings(StateproxConfig config) {
        for (String warning : ConfigWarnings.collect(config)) {
            System.err.println("Config warning: " + warning);
        }
    }

    private record CliOptions(Path configPath, boolean dryRun, boolean printEffectiveConfig) {
    }
}
