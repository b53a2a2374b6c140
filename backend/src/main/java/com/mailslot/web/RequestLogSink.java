package com.mailslot.web;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.mailslot.MailslotProperties;

/**
 * Append-only request log: one line per inbound request.
 *
 * Line format: {@code [2025-08-06T12:00:00.123Z] POST /echo - 127.0.0.1}
 */
@Component
public class RequestLogSink {

    private static final Logger log = LoggerFactory.getLogger(RequestLogSink.class);

    private final Path file;

    public RequestLogSink(MailslotProperties properties) {
        this.file = Path.of(properties.requestLog().file());
    }

    public static String format(Instant at, String method, String target, String clientAddress) {
        return "[" + at + "] " + method + " " + target + " - " + clientAddress;
    }

    public Path file() {
        return file;
    }

    /**
     * Blocking. A failed write is logged and dropped; request handling carries on.
     */
    public synchronized void append(String line) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, line + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Could not append to request log {}: {}", file, e.getMessage());
        }
    }
}
