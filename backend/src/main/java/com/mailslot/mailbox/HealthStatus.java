package com.mailslot.mailbox;

import java.util.List;

public record HealthStatus(
        String status,
        String message,
        List<String> endpoints,
        int totalRecipients
) {}
