package net.spookly.stateprox.proxy;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayDeque;
import java.util.Queue;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import net.spookly.stateprox.balancer.Cluster;
import net.spookly.stateprox.balancer.Endpoint;
import net.spookly.stateprox.balancer.EndpointLease;
import net.spookly.stateprox.balancer.SelectionResult;
import net.spookly.stateprox.filter.ExchangeContext;
import net.spookly.stateprox.filter.HttpFilter;
import net.spookly.stateprox.route.Route;

/**
 * Routes one downstream request to a backend and relays the response.
 *
 * <p>Order per exchange: route match, filter request hooks, backend selection, upstream
 * exchange, filter response hooks, downstream write. Everything runs on the downstream
 * channel's event loop.</p>
 *
 * <p>Pipelined requests on one connection are queued and handled one at a time, so responses
 * leave in request order. The next request starts once the previous response is flushed.</p>
 */
final class ProxyRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private final ProxyRouting routing;
    private final UpstreamClient upstreamClient;
    private final Queue<FullHttpRequest> pending = new ArrayDeque<>();
    private boolean busy;

    ProxyRequestHandler(ProxyRouting routing, UpstreamClient upstreamClient) {
        this.routing = routing;
        this.upstreamClient = upstreamClient;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        pending.add(request.retain());
        if (!busy) {
            dispatchNext(ctx);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        releasePending();
        super.channelInactive(ctx);
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        releasePending();
    }

    private void dispatchNext(ChannelHandlerContext ctx) {
        FullHttpRequest next = pending.poll();
        if (next == null) {
            busy = false;
            return;
        }
        busy = true;
        try {
            handle(ctx, next);
        } finally {
            next.release();
        }
    }

    private void releasePending() {
        FullHttpRequest queued;
        while ((queued = pending.poll()) != null) {
            queued.release();
        }
    }

    private void handle(ChannelHandlerContext ctx, FullHttpRequest request) {
        boolean keepAlive = HttpUtil.isKeepAlive(request);
        if (!request.decoderResult().isSuccess()) {
            writeLocal(ctx, null, HttpResponseStatus.BAD_REQUEST, "bad request", false);
            return;
        }
        Route route = routing.routes().match(request.headers().get(HttpHeaderNames.HOST), request.uri());
        if (route == null) {
            writeLocal(ctx, null, HttpResponseStatus.NOT_FOUND, "no route", keepAlive);
            return;
        }

        ExchangeContext exchange = new ExchangeContext(route);
        for (HttpFilter filter : routing.filters()) {
            filter.onRequestHeaders(exchange, request);
        }

        Cluster cluster = routing.clusters().get(route.cluster());
        SelectionResult selection = routing.loadBalancer().choose(cluster, exchange);
        Endpoint endpoint = selection.endpoint();
        if (endpoint == null) {
            writeLocal(ctx, exchange, HttpResponseStatus.SERVICE_UNAVAILABLE, "no healthy upstream", keepAlive);
            return;
        }
        exchange.selectBackend(endpoint);

        EndpointLease lease = routing.loadBalancer().loadTracker().acquire(endpoint);
        FullHttpRequest upstreamRequest = ProxyResponses.toUpstream(request, clientAddress(ctx));
        upstreamClient.send(ctx.channel().eventLoop(), endpoint.address(), upstreamRequest)
                .addListener(future -> {
                    lease.release();
                    if (future.isSuccess()) {
                        routing.healthTracker().recordPassiveSuccess(endpoint);
                        relay(ctx, exchange, (FullHttpResponse) future.getNow(), keepAlive);
                        return;
                    }
                    onUpstreamFailure(ctx, exchange, endpoint, future.cause(), keepAlive);
                });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        System.err.println("Downstream connection error: " + cause.getMessage());
        ctx.close();
    }

    private void relay(ChannelHandlerContext ctx, ExchangeContext exchange, FullHttpResponse response, boolean keepAlive) {
        if (!ctx.channel().isActive()) {
            response.release();
            return;
        }
        ProxyResponses.stripHopByHop(response.headers());
        if (!response.headers().contains(HttpHeaderNames.CONTENT_LENGTH)) {
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        }
        response.setProtocolVersion(HttpVersion.HTTP_1_1);
        write(ctx, exchange, response, keepAlive);
    }

    private void onUpstreamFailure(ChannelHandlerContext ctx,
                                   ExchangeContext exchange,
                                   Endpoint endpoint,
                                   Throwable cause,
                                   boolean keepAlive) {
        routing.healthTracker().recordPassiveFailure(endpoint);
        exchange.markUpstreamFailed();
        UpstreamException.Failure failure = cause instanceof UpstreamException
                ? ((UpstreamException) cause).failure()
                : UpstreamException.Failure.PROTOCOL;
        System.err.println("Upstream " + endpoint.address() + " failed (" + failure + "): " + cause.getMessage());
        switch (failure) {
            case CONNECT:
                writeLocal(ctx, exchange, HttpResponseStatus.SERVICE_UNAVAILABLE, "upstream connect error", keepAlive);
                break;
            case TIMEOUT:
                writeLocal(ctx, exchange, HttpResponseStatus.GATEWAY_TIMEOUT, "upstream request timeout", keepAlive);
                break;
            case PROTOCOL:
            default:
                writeLocal(ctx, exchange, HttpResponseStatus.BAD_GATEWAY, "upstream protocol error", keepAlive);
                break;
        }
    }

    private void writeLocal(ChannelHandlerContext ctx,
                            ExchangeContext exchange,
                            HttpResponseStatus status,
                            String body,
                            boolean keepAlive) {
        write(ctx, exchange, ProxyResponses.local(status, body), keepAlive);
    }

    private void write(ChannelHandlerContext ctx, ExchangeContext exchange, FullHttpResponse response, boolean keepAlive) {
        if (exchange != null) {
            for (HttpFilter filter : routing.filters()) {
                filter.onResponseHeaders(exchange, response);
            }
        }
        if (keepAlive) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(response).addListener((ChannelFutureListener) future -> {
                if (future.isSuccess()) {
                    dispatchNext(ctx);
                } else {
                    ctx.close();
                }
            });
        } else {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

    private static String clientAddress(ChannelHandlerContext ctx) {
        SocketAddress remote = ctx.channel().remoteAddress();
        if (remote instanceof InetSocketAddress) {
            return ((InetSocketAddress) remote).getAddress().getHostAddress();
        }
        return null;
    }
}
