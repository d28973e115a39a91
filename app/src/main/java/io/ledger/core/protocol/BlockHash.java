package io.ledger.core.protocol;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Content-addressed block identity.
 *
 * id = lowercase hex SHA-256 over UTF-8 of: decimal height || txId[0] || txId[1] || ...
 * The parts are concatenated without separators.
 */
public final class BlockHash {
    public static final int HEX_LENGTH = 64;

    private BlockHash() {}

    public static String compute(long height, List<String> transactionIds) {
        StringBuilder data = new StringBuilder(Long.toString(height));
        for (String txId : transactionIds) {
            data.append(txId);
        }
        return toHex(sha256(data.toString().getBytes(StandardCharsets.UTF_8)));
    }

    public static String of(Block block) {
        return compute(block.height(), block.transactionIds());
    }

    static byte[] sha256(byte[] in) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(in);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String toHex(byte[] b) {
        final char[] HEX = "0123456789abcdef".toCharArray();
        char[] out = new char[b.length * 2];
        for (int i = 0, j = 0; i < b.length; i++) {
            int v = b[i] & 0xff;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0f];
        }
        return new String(out);
    }
}
