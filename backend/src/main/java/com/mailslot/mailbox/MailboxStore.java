package com.mailslot.mailbox;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory owner of every mailbox.
 *
 * <p><strong>Drain contract:</strong> {@link #receive} removes the whole mailbox entry in the same
 * critical section that {@link #send} appends under, so a message is handed to exactly one
 * receiver and can never be both returned and left behind. Mailboxes are created on the first send
 * to a key and removed when drained; the map never holds an empty list.
 *
 * <p>Callers validate input. The store assumes non-blank recipient and content.
 */
@Component
public class MailboxStore {

    private static final Logger log = LoggerFactory.getLogger(MailboxStore.class);

    private final MessageIdGenerator idGenerator;

    // guarded by lock
    private final Map<String, List<Message>> mailboxes = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public MailboxStore(MessageIdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    /**
     * Case-folds and trims a recipient name into the key its mailbox is filed under.
     */
    public static String normalize(String recipient) {
        return recipient.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Appends a new message to the end of the recipient's mailbox, creating the mailbox if needed.
     */
    public Message send(String recipient, String content) {
        String key = normalize(recipient);
        UUID id = idGenerator.next();
        Message message = new Message(id.toString(), content, key, idGenerator.timestampOf(id));

        lock.writeLock().lock();
        try {
            mailboxes.computeIfAbsent(key, k -> new ArrayList<>()).add(message);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Queued message {} for '{}'", message.id(), key);
        return message;
    }

    /**
     * Atomically takes every message queued for the recipient, in arrival order, and empties the
     * mailbox. A never-used or already-drained key yields an empty delivery.
     */
    public Delivery receive(String recipient) {
        String key = normalize(recipient);
        List<Message> drained;

        lock.writeLock().lock();
        try {
            drained = mailboxes.remove(key);
        } finally {
            lock.writeLock().unlock();
        }

        if (drained == null) {
            return new Delivery(key, List.of());
        }
        log.debug("Drained {} message(s) for '{}'", drained.size(), key);
        return new Delivery(key, drained);
    }

    /** Number of recipients that currently have at least one queued message. */
    public MailboxStats stats() {
        lock.readLock().lock();
        try {
            return new MailboxStats(mailboxes.size());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Discards every mailbox. */
    public void clear() {
        lock.writeLock().lock();
        try {
            mailboxes.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
