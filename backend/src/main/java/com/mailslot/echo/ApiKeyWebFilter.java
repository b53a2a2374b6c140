package com.mailslot.echo;

import java.util.Set;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailslot.MailslotProperties;
import com.mailslot.web.ErrorResponse;

import reactor.core.publisher.Mono;

/**
 * Static API-key gate in front of the echo endpoints.
 *
 * The key travels in the {@code x-api-key} header and is compared case-sensitively.
 * Mailbox routes are not in the protected set and pass straight through.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class ApiKeyWebFilter implements WebFilter {

    public static final String API_KEY_HEADER = "x-api-key";

    private final String apiKey;
    private final Set<String> protectedPaths;
    private final ObjectMapper objectMapper;

    public ApiKeyWebFilter(MailslotProperties properties, ObjectMapper objectMapper) {
        this.apiKey = properties.echo().apiKey();
        this.protectedPaths = Set.copyOf(properties.echo().protectedPaths());
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        if (!protectedPaths.contains(path)) {
            return chain.filter(exchange);
        }

        String provided = exchange.getRequest().getHeaders().getFirst(API_KEY_HEADER);
        if (provided == null || provided.isBlank()) {
            return reject(exchange, new ErrorResponse(
                    "API key is required", "Please provide a valid API key in the x-api-key header"));
        }
        if (!provided.equals(apiKey)) {
            return reject(exchange, new ErrorResponse(
                    "Invalid API key", "The provided API key is not valid"));
        }
        return chain.filter(exchange);
    }

    private Mono<Void> reject(ServerWebExchange exchange, ErrorResponse body) {
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.UNAUTHORIZED);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        try {
            DataBuffer buffer = response.bufferFactory().wrap(objectMapper.writeValueAsBytes(body));
            return response.writeWith(Mono.just(buffer));
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
    }
}
