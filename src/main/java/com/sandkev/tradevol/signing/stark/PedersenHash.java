package com.sandkev.tradevol.signing.stark;

import org.bouncycastle.math.ec.ECPoint;

import java.math.BigInteger;
import java.util.List;

/**
 * Starknet Pedersen hash: {@code [P0 + a_low*P1 + a_high*P2 + b_low*P3 + b_high*P4].x},
 * where {@code low} is the bottom 248 bits of a field element and {@code high} the rest.
 */
public final class PedersenHash {

    private static final BigInteger LOW_MASK = BigInteger.ONE.shiftLeft(248).subtract(BigInteger.ONE);

    private PedersenHash() {}

    public static BigInteger hash(BigInteger a, BigInteger b) {
        ECPoint acc = StarkCurve.SHIFT_POINT;
        acc = acc.add(term(a, StarkCurve.P1, StarkCurve.P2));
        acc = acc.add(term(b, StarkCurve.P3, StarkCurve.P4));
        return acc.normalize().getAffineXCoord().toBigInteger();
    }

    /** {@code compute_hash_on_elements}: fold from zero, then hash in the element count. */
    public static BigInteger hashOnElements(List<BigInteger> elements) {
        BigInteger h = BigInteger.ZERO;
        for (BigInteger e : elements) {
            h = hash(h, e);
        }
        return hash(h, BigInteger.valueOf(elements.size()));
    }

    private static ECPoint term(BigInteger x, ECPoint lowPoint, ECPoint highPoint) {
        if (x.signum() < 0 || x.compareTo(StarkCurve.PRIME) >= 0) {
            throw new IllegalArgumentException("not a field element: 0x" + x.toString(16));
        }
        ECPoint low = lowPoint.multiply(x.and(LOW_MASK));
        ECPoint high = highPoint.multiply(x.shiftRight(248));
        return low.add(high);
    }
}
