package io.github.genie.snowflake.core.codec;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

/**
 * Text and binary renderings of an id. Every value is treated as an unsigned 64-bit integer and
 * every {@code encode} has a matching {@code decode}.
 */
public final class IdCodec {

    public static final String BASE32_ALPHABET = "ybndrfg8ejkmcpqxot1uwisza345h769";
    public static final String BASE58_ALPHABET = "123456789abcdefghijkmnopqrstuvwxyzABCDEFGHJKLMNPQRSTUVWXYZ";

    private static final int[] BASE32_INDEX = index(BASE32_ALPHABET);
    private static final int[] BASE58_INDEX = index(BASE58_ALPHABET);

    private IdCodec() {
    }

    public static String toDecimal(long id) {
        return Long.toUnsignedString(id);
    }

    public static long fromDecimal(String text) {
        return Long.parseUnsignedLong(text);
    }

    public static String toBase2(long id) {
        return Long.toBinaryString(id);
    }

    public static long fromBase2(String text) {
        return Long.parseUnsignedLong(text, 2);
    }

    public static String toBase32(long id) {
        return encode(id, BASE32_ALPHABET);
    }

    public static long fromBase32(String text) {
        return decode(text, BASE32_ALPHABET, BASE32_INDEX);
    }

    public static String toBase36(long id) {
        return Long.toUnsignedString(id, 36);
    }

    public static long fromBase36(String text) {
        return Long.parseUnsignedLong(text, 36);
    }

    public static String toBase58(long id) {
        return encode(id, BASE58_ALPHABET);
    }

    public static long fromBase58(String text) {
        return decode(text, BASE58_ALPHABET, BASE58_INDEX);
    }

    /**
     * Standard, padded Base64 of the 8 big-endian bytes of the id.
     */
    public static String toBase64(long id) {
        return Base64.getEncoder().encodeToString(toByteArray(id));
    }

    public static long fromBase64(String text) {
        return fromByteArray(Base64.getDecoder().decode(text));
    }

    /**
     * ASCII bytes of the decimal rendering.
     */
    public static byte[] toBytes(long id) {
        return toDecimal(id).getBytes(StandardCharsets.US_ASCII);
    }

    public static long fromBytes(byte[] bytes) {
        return fromDecimal(new String(bytes, StandardCharsets.US_ASCII));
    }

    public static byte[] toByteArray(long id) {
        return ByteBuffer.allocate(Long.BYTES).putLong(id).array();
    }

    public static long fromByteArray(byte[] bytes) {
        if (bytes.length != Long.BYTES) {
            throw new IllegalArgumentException("expected " + Long.BYTES + " bytes, got " + bytes.length);
        }
        return ByteBuffer.wrap(bytes).getLong();
    }

    private static String encode(long id, String alphabet) {
        long radix = alphabet.length();
        char[] buf = new char[64];
        int pos = buf.length;
        do {
            buf[--pos] = alphabet.charAt((int) Long.remainderUnsigned(id, radix));
            id = Long.divideUnsigned(id, radix);
        } while (id != 0);
        return new String(buf, pos, buf.length - pos);
    }

    private static long decode(String text, String alphabet, int[] index) {
        if (text.isEmpty()) {
            throw new NumberFormatException("empty string");
        }
        long radix = alphabet.length();
        long limit = Long.divideUnsigned(-1L, radix);
        long value = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            int digit = c < index.length ? index[c] : -1;
            if (digit < 0) {
                throw new NumberFormatException("illegal character '" + c + "' in \"" + text + '"');
            }
            if (Long.compareUnsigned(value, limit) > 0) {
                throw new NumberFormatException("value out of range: \"" + text + '"');
            }
            long next = value * radix + digit;
            if (Long.compareUnsigned(next, value * radix) < 0) {
                throw new NumberFormatException("value out of range: \"" + text + '"');
            }
            value = next;
        }
        return value;
    }

    private static int[] index(String alphabet) {
        int[] index = new int[128];
        Arrays.fill(index, -1);
        for (int i = 0; i < alphabet.length(); i++) {
            index[alphabet.charAt(i)] = i;
        }
        return index;
    }

}
