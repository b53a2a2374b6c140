package com.mailslot.mailbox;

import java.time.Instant;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.datastax.oss.driver.api.core.uuid.Uuids;

/**
 * Issues message ids as version-1 (time-based) UUIDs.
 *
 * <p>{@link Uuids#timeBased()} keeps a JVM-wide timestamp that strictly increases on every call
 * (100-ns ticks, bumped when two calls land on the same tick) and pairs it with a per-process node
 * id and clock sequence. Two ids issued by this process are therefore never equal, whatever the
 * send rate or number of threads.
 */
@Component
public class MessageIdGenerator {

    public UUID next() {
        return Uuids.timeBased();
    }

    /** Millisecond-precision instant embedded in an id produced by {@link #next()}. */
    public Instant timestampOf(UUID id) {
        return Instant.ofEpochMilli(Uuids.unixTimestamp(id));
    }
}
