package dev.mtrx.newsroom.util;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 64-bit time-ordered ID generator used for every pipeline entity.
 *
 * <pre>
 * | 1 bit (unused) | 41 bits (ms since 2025-01-01) | 10 bits (node) | 12 bits (sequence) |
 * </pre>
 *
 * Lock-free: the last (timestamp, sequence) pair is kept in a single {@link AtomicLong} and advanced by CAS.
 */
public final class SnowflakeId {

    // 2025-01-01T00:00:00Z
    private static final long EPOCH = 1735689600000L;

    private static final int NODE_BITS = 10;
    private static final int SEQUENCE_BITS = 12;
    private static final long MAX_NODE = (1L << NODE_BITS) - 1;
    private static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 1;
    private static final int NODE_SHIFT = SEQUENCE_BITS;
    private static final int TIMESTAMP_SHIFT = SEQUENCE_BITS + NODE_BITS;
    private static final long MAX_BACKWARD_DRIFT_MS = 5;

    private final long nodeId;
    private final AtomicLong lastState = new AtomicLong(0);

    public SnowflakeId(long nodeId) {
        if (nodeId < 0 || nodeId > MAX_NODE) {
            throw new IllegalArgumentException("Node ID must be between 0 and " + MAX_NODE + ", got: " + nodeId);
        }
        this.nodeId = nodeId;
    }

    public long nextId() {
        while (true) {
            long now = System.currentTimeMillis() - EPOCH;
            long previous = lastState.get();
            long previousTimestamp = previous >>> SEQUENCE_BITS;
            long previousSequence = previous & MAX_SEQUENCE;

            long timestamp;
            long sequence;
            if (now > previousTimestamp) {
                timestamp = now;
                sequence = 0;
            } else if (previousTimestamp - now <= MAX_BACKWARD_DRIFT_MS) {
                // same millisecond, or a small clock step back: keep counting on the last timestamp
                timestamp = previousTimestamp;
                sequence = (previousSequence + 1) & MAX_SEQUENCE;
                if (sequence == 0) {
                    timestamp = previousTimestamp + 1;
                }
            } else {
                throw new IllegalStateException(
                        "Clock moved backwards by " + (previousTimestamp - now) + "ms. Refusing to generate ID.");
            }

            if (lastState.compareAndSet(previous, (timestamp << SEQUENCE_BITS) | sequence)) {
                return (timestamp << TIMESTAMP_SHIFT) | (nodeId << NODE_SHIFT) | sequence;
            }
        }
    }

    public static Instant extractInstant(long id) {
        return Instant.ofEpochMilli((id >>> TIMESTAMP_SHIFT) + EPOCH);
    }

    public static int extractNodeId(long id) {
        return (int) ((id >>> NODE_SHIFT) & MAX_NODE);
    }

    @Override
    public String toString() {
        return "SnowflakeId{nodeId=" + nodeId + "}";
    }
}
