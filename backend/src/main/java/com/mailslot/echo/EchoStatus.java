package com.mailslot.echo;

import java.util.List;

public record EchoStatus(
        String message,
        List<String> endpoints
) {}
