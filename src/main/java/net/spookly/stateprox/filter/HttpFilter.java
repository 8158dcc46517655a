package net.spookly.stateprox.filter;

import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponse;

/**
 * Hook invoked around backend selection for every proxied exchange.
 */
public interface HttpFilter {
    /**
     * Called once the route is known and before a backend is chosen.
     */
    void onRequestHeaders(ExchangeContext exchange, HttpRequest request);

    /**
     * Called with the response headers before they are written downstream.
     */
    void onResponseHeaders(ExchangeContext exchange, HttpResponse response);
}
