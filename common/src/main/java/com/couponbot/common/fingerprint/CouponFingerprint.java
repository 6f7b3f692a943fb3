package com.couponbot.common.fingerprint;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Derives the deduplication key of a coupon from its (name, code, url) triple.
 * Each field is length-prefixed before hashing so field boundaries are part of the input.
 * Output: 64-char lower-case hex SHA-256 digest.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CouponFingerprint {

    public static final int LENGTH = 64;

    private static final String ALGORITHM = "SHA-256";

    public static String of(String name, String code, String url) {
        var digest = newDigest();
        update(digest, name);
        update(digest, code);
        update(digest, url);
        return HexFormat.of().formatHex(digest.digest());
    }

    private static void update(MessageDigest digest, String field) {
        if (field == null) {
            digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(-1).array());
            return;
        }
        byte[] bytes = field.getBytes(StandardCharsets.UTF_8);
        digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
        digest.update(bytes);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
