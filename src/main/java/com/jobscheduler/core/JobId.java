package com.jobscheduler.core;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Locale;

/**
 * Opaque, sortable job identifier in ULID layout.
 *
 * <p>128 bits: a 48-bit Unix timestamp in milliseconds followed by 80 random bits,
 * rendered as 26 Crockford base-32 characters. Ids produced by {@link #generate()}
 * are strictly increasing within a process: two ids minted in the same
 * millisecond differ by incrementing the random part.</p>
 *
 * <p><b>Thread Safety:</b> instances are immutable. Generation is synchronized on
 * the class so concurrent submitters never receive duplicate or out-of-order ids.</p>
 *
 * @author Job Scheduler Team
 */
public final class JobId implements Comparable<JobId> {
    private static final char[] ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int LENGTH = 26;
    private static final long TIMESTAMP_MAX = (1L << 48) - 1;

    private static final SecureRandom random = new SecureRandom();
    // Last id handed out, for monotonic generation
    private static long lastMsb;
    private static long lastLsb;

    private final long msb;
    private final long lsb;

    private JobId(long msb, long lsb) {
        this.msb = msb;
        this.lsb = lsb;
    }

    /**
     * Mint a new id that sorts after every id previously minted in this process.
     *
     * @return a fresh job id
     */
    public static synchronized JobId generate() {
        long now = System.currentTimeMillis() & TIMESTAMP_MAX;
        long lastTimestamp = lastMsb >>> 16;

        long msb;
        long lsb;
        if (now > lastTimestamp) {
            msb = (now << 16) | (random.nextInt() & 0xFFFFL);
            lsb = random.nextLong();
        } else {
            // Same millisecond or clock stepped back: increment the 80-bit random part
            lsb = lastLsb + 1;
            msb = lastMsb;
            if (lsb == 0) {
                msb = msb + 1; // carry into the high 16 random bits (and timestamp on overflow)
            }
        }

        lastMsb = msb;
        lastLsb = lsb;
        return new JobId(msb, lsb);
    }

    /**
     * Parse the 26-character textual form. Lower case and the Crockford aliases
     * I/L (for 1) and O (for 0) are accepted.
     *
     * @param text the id text
     * @return the parsed id
     * @throws IllegalArgumentException if the text is not a valid id
     */
    public static JobId parse(String text) {
        if (text == null || text.length() != LENGTH) {
            throw new IllegalArgumentException("Invalid job id: " + text);
        }

        String normalized = text.toUpperCase(Locale.ROOT);
        long msb = 0;
        long lsb = 0;
        for (int i = 0; i < LENGTH; i++) {
            int value = decodeChar(normalized.charAt(i));
            if (value < 0 || (i == 0 && value > 7)) {
                throw new IllegalArgumentException("Invalid job id: " + text);
            }
            msb = (msb << 5) | (lsb >>> 59);
            lsb = (lsb << 5) | value;
        }
        return new JobId(msb, lsb);
    }

    private static int decodeChar(char c) {
        switch (c) {
            case 'I':
            case 'L':
                return 1;
            case 'O':
                return 0;
            default:
                for (int i = 0; i < ALPHABET.length; i++) {
                    if (ALPHABET[i] == c) {
                        return i;
                    }
                }
                return -1;
        }
    }

    /**
     * @return the instant encoded in the timestamp part of this id
     */
    public Instant getTimestamp() {
        return Instant.ofEpochMilli(msb >>> 16);
    }

    @Override
    public int compareTo(JobId other) {
        int cmp = Long.compareUnsigned(msb, other.msb);
        return cmp != 0 ? cmp : Long.compareUnsigned(lsb, other.lsb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JobId)) {
            return false;
        }
        JobId other = (JobId) o;
        return msb == other.msb && lsb == other.lsb;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(msb) * 31 + Long.hashCode(lsb);
    }

    @Override
    public String toString() {
        char[] out = new char[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            out[i] = ALPHABET[fiveBitsAt(5 * (LENGTH - 1 - i))];
        }
        return new String(out);
    }

    // 5 bits starting at bit position p, counted from the least significant bit
    private int fiveBitsAt(int p) {
        long bits;
        if (p >= 64) {
            bits = msb >>> (p - 64);
        } else if (p + 5 <= 64) {
            bits = lsb >>> p;
        } else {
            bits = (lsb >>> p) | (msb << (64 - p));
        }
        return (int) (bits & 31);
    }
}
