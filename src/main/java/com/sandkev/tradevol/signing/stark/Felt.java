package com.sandkev.tradevol.signing.stark;

import org.bouncycastle.crypto.digests.KeccakDigest;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/** Conversions into Starknet field elements. */
public final class Felt {

    private static final BigInteger MASK_250 = BigInteger.ONE.shiftLeft(250).subtract(BigInteger.ONE);
    private static final int MAX_SHORT_STRING = 31;

    private Felt() {}

    /**
     * Encodes a typed-data value: numbers as-is, {@code 0x} strings as hex, decimal strings as
     * numbers, anything else as a Cairo short string.
     */
    public static BigInteger encode(Object value) {
        if (value == null) throw new IllegalArgumentException("null felt value");
        if (value instanceof BigInteger b) return checked(b);
        if (value instanceof Number n) return checked(new BigInteger(n.toString()));
        String s = value.toString();
        if (s.startsWith("0x") || s.startsWith("0X")) return fromHex(s);
        if (!s.isEmpty() && s.chars().allMatch(Character::isDigit)) return checked(new BigInteger(s));
        return fromShortString(s);
    }

    public static BigInteger fromHex(String hex) {
        String h = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (h.isEmpty()) return BigInteger.ZERO;
        return checked(new BigInteger(h, 16));
    }

    /** ASCII bytes read as a big-endian integer; the empty string is zero. */
    public static BigInteger fromShortString(String s) {
        if (s.length() > MAX_SHORT_STRING) {
            throw new IllegalArgumentException("short string longer than 31 characters: " + s);
        }
        byte[] bytes = s.getBytes(StandardCharsets.US_ASCII);
        return new BigInteger(1, bytes);
    }

    /** Keccak-256 truncated to 250 bits, as used for selectors and type hashes. */
    public static BigInteger starknetKeccak(String s) {
        byte[] in = s.getBytes(StandardCharsets.US_ASCII);
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(in, 0, in.length);
        byte[] out = new byte[32];
        digest.doFinal(out, 0);
        return new BigInteger(1, out).and(MASK_250);
    }

    public static String toHex(BigInteger felt) {
        return "0x" + felt.toString(16);
    }

    private static BigInteger checked(BigInteger v) {
        if (v.signum() < 0 || v.compareTo(StarkCurve.PRIME) >= 0) {
            throw new IllegalArgumentException("value out of field range: " + v);
        }
        return v;
    }
}
