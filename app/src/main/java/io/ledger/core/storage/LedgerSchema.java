package io.ledger.core.storage;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Key layouts for the ledger tables.
 *
 * <ul>
 *   <li>{@code meta}: key "height" → current height (8 bytes, big-endian)</li>
 *   <li>{@code blocks}: key height (8 bytes, big-endian) → BlockRecord JSON</li>
 *   <li>{@code transactions}: key tx id (UTF-8) → TransactionRecord JSON</li>
 *   <li>{@code outputs}: key outpoint → OutputRecord JSON</li>
 *   <li>{@code unspent_by_address}: key str(address) || outpoint → value as decimal text</li>
 *   <li>{@code spenders}: key str(spender tx id) || inputIndex(4) → outpoint</li>
 * </ul>
 *
 * str(x) is a 4-byte length followed by the UTF-8 bytes, so variable-length strings never
 * collide as prefixes. outpoint = str(txId) || index(4).
 */
public final class LedgerSchema {
    public static final byte[] HEIGHT_KEY = "height".getBytes(StandardCharsets.UTF_8);

    private LedgerSchema() {}

    public static byte[] heightKey(long height) {
        return longToBytes(height);
    }

    public static byte[] transactionKey(String txId) {
        return txId.getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] outPointKey(String txId, int index) {
        byte[] id = txId.getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(4 + id.length + 4)
                .putInt(id.length)
                .put(id)
                .putInt(index)
                .array();
    }

    public static byte[] addressPrefix(String address) {
        return lengthPrefixed(address);
    }

    public static byte[] unspentKey(String address, String txId, int index) {
        return concat(addressPrefix(address), outPointKey(txId, index));
    }

    public static byte[] spenderKey(String spenderTxId, int inputIndex) {
        byte[] prefix = lengthPrefixed(spenderTxId);
        return ByteBuffer.allocate(prefix.length + 4)
                .put(prefix)
                .putInt(inputIndex)
                .array();
    }

    public static byte[] longToBytes(long v) {
        return ByteBuffer.allocate(8).putLong(v).array();
    }

    public static long bytesToLong(byte[] a) {
        return ByteBuffer.wrap(a).getLong();
    }

    public static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        return Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
    }

    private static byte[] lengthPrefixed(String s) {
        byte[] raw = s.getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(4 + raw.length).putInt(raw.length).put(raw).array();
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
