package com.mailslot.web;

import java.net.InetSocketAddress;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;

import com.mailslot.MailslotProperties;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Records every inbound request, including ones later rejected by the API-key gate.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLogWebFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestLogWebFilter.class);

    private final RequestLogSink sink;
    private final boolean enabled;

    public RequestLogWebFilter(RequestLogSink sink, MailslotProperties properties) {
        this.sink = sink;
        this.enabled = properties.requestLog().enabled();
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!enabled) {
            return chain.filter(exchange);
        }
        ServerHttpRequest request = exchange.getRequest();
        String line = RequestLogSink.format(
                Instant.now(), request.getMethod().name(), target(request), clientAddress(request));
        log.info("{}", line);

        // only the file write hops to bounded-elastic; the chain stays on the calling thread
        Mono<Void> write = Mono.<Void>fromRunnable(() -> sink.append(line))
                .subscribeOn(Schedulers.boundedElastic());
        return Mono.when(write, chain.filter(exchange));
    }

    private static String target(ServerHttpRequest request) {
        String path = request.getURI().getRawPath();
        String query = request.getURI().getRawQuery();
        return query == null ? path : path + "?" + query;
    }

    private static String clientAddress(ServerHttpRequest request) {
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote == null || remote.getAddress() == null) {
            return "unknown";
        }
        return remote.getAddress().getHostAddress();
    }
}
