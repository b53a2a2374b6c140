package com.mailslot.mailbox;

public record MailboxStats(int totalRecipients) {}
