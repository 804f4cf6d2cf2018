package com.queueserve.queue;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Issues the creation key that fixes an order's place in the FIFO queue.
 *
 * <p>Key layout: {@code (epochMillis << 12) | sequence}. The low 12 bits are a tie-break
 * counter that resets whenever the clock moves past the last issued millisecond, so up to
 * 4096 orders created in the same millisecond still get distinct, ordered keys. If the
 * counter overflows, the key borrows the next millisecond instead of wrapping.
 *
 * <p>{@link #next()} is synchronized: the first caller always gets the smaller key, and
 * no two callers ever get the same one. A clock that steps backwards is treated as
 * "still the same millisecond", so keys keep increasing.
 *
 * <p>The sequencer is process-local. On startup it is advanced past the highest stored key
 * (see {@link #advancePast(long)}) so that a restart with a lagging clock cannot issue a
 * key that sorts before existing orders.
 */
@Component
public class CreationKeySequencer {

    private static final Logger log = LoggerFactory.getLogger(CreationKeySequencer.class);

    static final int SEQUENCE_BITS = 12;
    static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 1;

    private final Clock clock;

    private long lastMillis = -1L;
    private long sequence;

    public CreationKeySequencer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns the next creation key. Strictly greater than every key returned before.
     */
    public synchronized long next() {
        long now = clock.millis();
        if (now > lastMillis) {
            lastMillis = now;
            sequence = 0;
        } else {
            sequence++;
            if (sequence > MAX_SEQUENCE) {
                lastMillis++;
                sequence = 0;
                log.debug("Creation key sequence exhausted, borrowing millisecond {}", lastMillis);
            }
        }
        return (lastMillis << SEQUENCE_BITS) | sequence;
    }

    /**
     * Guarantees that subsequent keys sort after {@code issuedKey}.
     * No-op if the sequencer is already past it.
     */
    public synchronized void advancePast(long issuedKey) {
        long issuedMillis = timestampOf(issuedKey);
        long issuedSequence = issuedKey & MAX_SEQUENCE;
        if (issuedMillis > lastMillis || (issuedMillis == lastMillis && issuedSequence > sequence)) {
            lastMillis = issuedMillis;
            sequence = issuedSequence;
            log.info("Creation key sequencer advanced to {}:{}", lastMillis, sequence);
        }
    }

    /** Extracts the wall-clock millisecond a key was issued in. */
    public static long timestampOf(long creationKey) {
        return creationKey >>> SEQUENCE_BITS;
    }
}
