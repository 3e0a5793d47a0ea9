package br.edu.ifba.shared;

import java.nio.ByteBuffer;
import java.security.SecureRandom;
import java.util.UUID;

/**
 * Time-ordered identifiers for indexing jobs.
 */
public final class UuidUtils {

    private static final SecureRandom random = new SecureRandom();

    private UuidUtils() {
    }

    /**
     * UUID version 7: 48-bit millisecond timestamp followed by random bits, so ids sort by creation time.
     */
    public static UUID randomV7() {
        final byte[] value = new byte[16];
        random.nextBytes(value);

        final ByteBuffer timestamp = ByteBuffer.allocate(Long.BYTES);
        timestamp.putLong(System.currentTimeMillis());
        System.arraycopy(timestamp.array(), 2, value, 0, 6);
        value[6] = (byte) ((value[6] & 0x0F) | 0x70);
        value[8] = (byte) ((value[8] & 0x3F) | 0x80);

        final ByteBuffer buf = ByteBuffer.wrap(value);
        return new UUID(buf.getLong(), buf.getLong());
    }

    /**
     * Job ids are {@code job-} followed by a v7 UUID.
     */
    public static String newJobId() {
        return "job-" + randomV7();
    }
}
