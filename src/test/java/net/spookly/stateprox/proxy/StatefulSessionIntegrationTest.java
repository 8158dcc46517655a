package net.spookly.stateprox.proxy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.CharsetUtil;
import net.spookly.stateprox.StateproxMain;
import net.spookly.stateprox.balancer.BackendHealthTracker;
import net.spookly.stateprox.balancer.ClusterManager;
import net.spookly.stateprox.config.StateproxConfig;
import net.spookly.stateprox.session.BackendAddress;
import net.spookly.stateprox.session.SessionTokenCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StatefulSessionIntegrationTest {
    private static final String GLOBAL_COOKIE = "global-session-cookie";
    private static final String ROUTE_COOKIE = "route-session-cookie";
    private static final Pattern COOKIE_TOKEN = Pattern.compile("^([^=]+)=\"([^\"]+)\"");

    private final List<Channel> upstreams = new ArrayList<>();
    private final List<Integer> upstreamPorts = new ArrayList<>();
    private EventLoopGroup upstreamGroup;
    private ProxyServer proxyServer;
    private BackendHealthTracker healthTracker;
    private HttpClient client;
    private int proxyPort;
    private int deadPort;

    @BeforeEach
    void setUp() throws Exception {
        upstreamGroup = new NioEventLoopGroup(2);
        for (int i = 0; i < 4; i++) {
            Channel channel = startUpstream();
            upstreams.add(channel);
            upstreamPorts.add(((InetSocketAddress) channel.localAddress()).getPort());
        }
        deadPort = unusedPort();

        StateproxConfig config = config();
        healthTracker = new BackendHealthTracker();
        proxyServer = new ProxyServer(config,
                StateproxMain.buildRouting(config, ClusterManager.fromConfig(config), healthTracker));
        proxyPort = proxyServer.start().getPort();
        client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        if (proxyServer != null) {
            proxyServer.stop();
        }
        for (Channel upstream : upstreams) {
            upstream.close().syncUninterruptibly();
        }
        if (upstreamGroup != null) {
            upstreamGroup.shutdownGracefully();
        }
    }

    @Test
    void freshRequestGetsCookieNamingTheServingBackend() throws Exception {
        HttpResponse<String> response = get("/test");

        assertEquals(200, response.statusCode());
        String setCookie = response.headers().firstValue("set-cookie").orElseThrow();
        assertTrue(setCookie.endsWith("; Path=/path; Max-Age=120; HttpOnly; Secure"), setCookie);
        assertEquals(GLOBAL_COOKIE, cookieName(setCookie));
        assertEquals(servedBy(response), decodePort(setCookie));
    }

    @Test
    void validCookiePinsEveryRequestToOneBackend() throws Exception {
        int pinned = upstreamPorts.get(2);

        for (int i = 0; i < 10; i++) {
            HttpResponse<String> response = get("/test", GLOBAL_COOKIE + "=" + token(pinned));
            assertEquals(pinned, servedBy(response));
            assertTrue(response.headers().firstValue("set-cookie").isEmpty());
        }
    }

    @Test
    void staleCookieFallsBackAndIsReplaced() throws Exception {
        HttpResponse<String> response = get("/test", GLOBAL_COOKIE + "=" + token(deadPort));

        assertEquals(200, response.statusCode());
        String setCookie = response.headers().firstValue("set-cookie").orElseThrow();
        assertEquals(servedBy(response), decodePort(setCookie));
        assertTrue(upstreamPorts.contains(servedBy(response)));
    }

    @Test
    void disabledRouteIgnoresCookieAndNeverSetsOne() throws Exception {
        Set<Integer> served = new HashSet<>();

        for (int i = 0; i < 8; i++) {
            HttpResponse<String> response = get("/disabled/item", GLOBAL_COOKIE + "=" + token(upstreamPorts.get(0)));
            served.add(servedBy(response));
            assertTrue(response.headers().firstValue("set-cookie").isEmpty());
        }

        assertTrue(served.size() > 1, "round robin should spread requests: " + served);
    }

    @Test
    void overrideRouteUsesItsOwnCookie() throws Exception {
        int pinned = upstreamPorts.get(1);

        HttpResponse<String> honoured = get("/override",
                GLOBAL_COOKIE + "=" + token(upstreamPorts.get(3)) + "; " + ROUTE_COOKIE + "=" + token(pinned));
        assertEquals(pinned, servedBy(honoured));
        assertTrue(honoured.headers().firstValue("set-cookie").isEmpty());

        HttpResponse<String> fresh = get("/override", GLOBAL_COOKIE + "=" + token(pinned));
        String setCookie = fresh.headers().firstValue("set-cookie").orElseThrow();
        assertEquals(ROUTE_COOKIE, cookieName(setCookie));
        assertEquals(servedBy(fresh), decodePort(setCookie));
    }

    @Test
    void unreachableBackendAnswers503AndCountsPassiveFailure() throws Exception {
        HttpResponse<String> response = get("/down");

        assertEquals(503, response.statusCode());
        assertEquals("upstream connect error", response.body());
        assertTrue(response.headers().firstValue("set-cookie").isEmpty());
        assertEquals(75, healthTracker.score(
                new net.spookly.stateprox.balancer.Endpoint("dead", "dead", BackendAddress.of("127.0.0.1", deadPort), 1)));
    }

    private HttpResponse<String> get(String path, String... cookies) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + proxyPort + path))
                .timeout(Duration.ofSeconds(10))
                .GET();
        for (String cookie : cookies) {
            builder.header("Cookie", cookie);
        }
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static int servedBy(HttpResponse<String> response) {
        Optional<String> backend = response.headers().firstValue("x-backend-port");
        assertTrue(backend.isPresent(), "missing x-backend-port, status " + response.statusCode());
        return Integer.parseInt(backend.get());
    }

    private static String cookieName(String setCookie) {
        Matcher matcher = COOKIE_TOKEN.matcher(setCookie);
        assertTrue(matcher.find(), setCookie);
        return matcher.group(1);
    }

    private static int decodePort(String setCookie) {
        Matcher matcher = COOKIE_TOKEN.matcher(setCookie);
        assertTrue(matcher.find(), setCookie);
        BackendAddress address = SessionTokenCodec.decode(matcher.group(2)).orElse(null);
        assertNotNull(address, setCookie);
        assertEquals("127.0.0.1", address.host());
        return address.port();
    }

    private static String token(int port) {
        return SessionTokenCodec.encode(BackendAddress.of("127.0.0.1", port));
    }

    private StateproxConfig config() {
        StateproxConfig config = new StateproxConfig();
        config.proxy = new StateproxConfig.ProxyConfig();
        config.proxy.listen = "127.0.0.1:0";
        config.proxy.timeouts = new StateproxConfig.TimeoutsConfig();
        config.proxy.timeouts.connectMs = 2000;
        config.proxy.timeouts.requestMs = 5000;
        config.statefulSession = new StateproxConfig.StatefulSessionConfig();
        config.statefulSession.sessionState = cookieState(GLOBAL_COOKIE);

        StateproxConfig.PerRouteSessionConfig disabled = new StateproxConfig.PerRouteSessionConfig();
        disabled.disabled = true;
        StateproxConfig.PerRouteSessionConfig override = new StateproxConfig.PerRouteSessionConfig();
        override.statefulSession = new StateproxConfig.StatefulSessionConfig();
        override.statefulSession.sessionState = cookieState(ROUTE_COOKIE);

        config.routes = List.of(
                route("disabled", "/disabled", "cluster_0", disabled),
                route("override", "/override", "cluster_0", override),
                route("down", "/down", "dead", null),
                route("default", "/", "cluster_0", null)
        );

        config.clusters = new LinkedHashMap<>();
        StateproxConfig.ClusterConfig cluster = new StateproxConfig.ClusterConfig();
        cluster.policy = "round_robin";
        cluster.endpoints = new ArrayList<>();
        for (int port : upstreamPorts) {
            cluster.endpoints.add(endpoint(port));
        }
        config.clusters.put("cluster_0", cluster);
        StateproxConfig.ClusterConfig dead = new StateproxConfig.ClusterConfig();
        dead.endpoints = List.of(endpoint(deadPort));
        config.clusters.put("dead", dead);
        return config;
    }

    private static StateproxConfig.SessionStateConfig cookieState(String name) {
        StateproxConfig.SessionStateConfig state = new StateproxConfig.SessionStateConfig();
        state.codec = "cookie";
        state.cookie = new StateproxConfig.CookieConfig();
        state.cookie.name = name;
        state.cookie.path = "/path";
        state.cookie.ttl = "120s";
        return state;
    }

    private static StateproxConfig.RouteConfig route(String name,
                                                     String prefix,
                                                     String cluster,
                                                     StateproxConfig.PerRouteSessionConfig session) {
        StateproxConfig.RouteConfig route = new StateproxConfig.RouteConfig();
        route.name = name;
        route.match = new StateproxConfig.MatchConfig();
        route.match.pathPrefix = prefix;
        route.cluster = cluster;
        route.statefulSession = session;
        return route;
    }

    private static StateproxConfig.EndpointConfig endpoint(int port) {
        StateproxConfig.EndpointConfig endpoint = new StateproxConfig.EndpointConfig();
        endpoint.host = "127.0.0.1";
        endpoint.port = port;
        return endpoint;
    }

    private static int unusedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private Channel startUpstream() throws InterruptedException {
        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(upstreamGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new HttpServerCodec())
                                .addLast(new HttpObjectAggregator(65536))
                                .addLast(new IdentityHandler());
                    }
                });
        return bootstrap.bind("127.0.0.1", 0).sync().channel();
    }

    private static final class IdentityHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
            int port = ((InetSocketAddress) ctx.channel().localAddress()).getPort();
            FullHttpResponse response = new DefaultFullHttpResponse(
                    HttpVersion.HTTP_1_1,
                    HttpResponseStatus.OK,
                    Unpooled.copiedBuffer("backend " + port, CharsetUtil.UTF_8)
            );
            response.headers().set("x-backend-port", port);
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
            ctx.writeAndFlush(response);
        }
    }
}
