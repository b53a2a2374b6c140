package com.mailslot.echo;

import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebInputException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import reactor.core.publisher.Mono;

/**
 * Reflects JSON bodies back to the caller. Guarded by {@link ApiKeyWebFilter}.
 *
 * <p>Any content type is accepted. Only JSON bodies are parsed and echoed; anything else gets a
 * 200 with an empty body.
 */
@RestController
public class EchoController {

    private final ObjectMapper objectMapper;

    public EchoController(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @GetMapping("/")
    public Mono<EchoStatus> index() {
        return Mono.just(new EchoStatus("Echo server is running!", List.of("POST /echo")));
    }

    @PostMapping("/echo")
    public Mono<ResponseEntity<JsonNode>> echo(ServerHttpRequest request,
                                               @RequestBody(required = false) String body) {
        if (!isJson(request.getHeaders().getContentType())) {
            return Mono.just(ResponseEntity.ok().build());
        }
        if (body == null || body.isBlank()) {
            return Mono.just(ResponseEntity.ok(JsonNodeFactory.instance.objectNode()));
        }
        try {
            return Mono.just(ResponseEntity.ok(objectMapper.readTree(body)));
        } catch (JsonProcessingException e) {
            return Mono.error(new ServerWebInputException("Failed to read HTTP message"));
        }
    }

    private static boolean isJson(MediaType contentType) {
        return contentType != null
                && (MediaType.APPLICATION_JSON.isCompatibleWith(contentType)
                        || "json".equals(contentType.getSubtypeSuffix()));
    }
}
