package de.caluga.dataapi.driver;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 12 byte object id as used by the Data API (<code>{"$objectId": "..."}</code>):
 * 4 bytes seconds since epoch, 5 random bytes, 3 bytes counter
 **/
public class ObjectId implements Comparable<ObjectId> {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final byte[] PROCESS_UNIQUE = new byte[5];
    private static final AtomicInteger COUNT = new AtomicInteger(RANDOM.nextInt());

    static {
        RANDOM.nextBytes(PROCESS_UNIQUE);
    }

    private final byte[] bytes;

    public ObjectId() {
        this(Instant.now());
    }

    public ObjectId(Instant time) {
        bytes = new byte[12];
        int ts = (int) time.getEpochSecond();
        int counter = COUNT.getAndIncrement() & 0x00ffffff;
        bytes[0] = (byte) (ts >> 24);
        bytes[1] = (byte) (ts >> 16);
        bytes[2] = (byte) (ts >> 8);
        bytes[3] = (byte) ts;
        System.arraycopy(PROCESS_UNIQUE, 0, bytes, 4, 5);
        bytes[9] = (byte) (counter >> 16);
        bytes[10] = (byte) (counter >> 8);
        bytes[11] = (byte) counter;
    }

    public ObjectId(String hexString) {
        this.bytes = hexToByte(hexString);
    }

    public static boolean isValid(String s) {
        return s != null && s.matches("[0-9a-fA-F]{24}");
    }

    private static byte[] hexToByte(String s) {
        if (!isValid(s)) {
            throw new IllegalArgumentException("no hex string: " + s);
        }

        byte[] b = new byte[12];

        for (int i = 0; i < b.length; ++i) {
            b[i] = (byte) Integer.parseInt(s.substring(i * 2, i * 2 + 2), 16);
        }

        return b;
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public Instant getTimestamp() {
        long ts = (bytes[0] & 0xFFL) << 24 | (bytes[1] & 0xFF) << 16 | (bytes[2] & 0xFF) << 8 | (bytes[3] & 0xFF);
        return Instant.ofEpochSecond(ts);
    }

    public String toHexString() {
        StringBuilder bld = new StringBuilder(24);

        for (byte by : bytes) {
            bld.append(Character.forDigit((by >>> 4) & 0x0f, 16));
            bld.append(Character.forDigit(by & 0x0f, 16));
        }

        return bld.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != this.getClass()) return false;
        return Arrays.equals(bytes, ((ObjectId) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHexString();
    }

    @Override
    public int compareTo(ObjectId o) {
        if (o == null) {
            return -1;
        }

        return toHexString().compareTo(o.toHexString());
    }
}
