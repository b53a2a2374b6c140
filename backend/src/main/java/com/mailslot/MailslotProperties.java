package com.mailslot;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings under {@code mailslot.*}. The mailbox itself has none; these cover the
 * request log and the echo gate.
 */
@ConfigurationProperties(prefix = "mailslot")
public record MailslotProperties(
        @DefaultValue RequestLog requestLog,
        @DefaultValue Echo echo
) {

    public record RequestLog(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("logs/requests.log") String file
    ) {}

    public record Echo(
            @DefaultValue("your-secret-api-key-here") String apiKey,
            @DefaultValue({"/", "/echo"}) List<String> protectedPaths
    ) {}
}
