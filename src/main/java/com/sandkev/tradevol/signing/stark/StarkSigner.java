package com.sandkev.tradevol.signing.stark;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;

/**
 * ECDSA over the Stark curve with RFC 6979 (HMAC-SHA256) nonces. Stateless: the caller
 * supplies the message hash and the private key on every call.
 */
public final class StarkSigner {

    private static final BigInteger N = StarkCurve.ORDER;
    private static final BigInteger BOUND = StarkCurve.MAX_ECDSA_VALUE;

    private StarkSigner() {}

    public record StarkSignature(BigInteger r, BigInteger s) {

        public String[] toDecimalStrings() {
            return new String[]{r.toString(), s.toString()};
        }
    }

    public static BigInteger publicKey(BigInteger privateKey) {
        return publicKeyPoint(privateKey).getAffineXCoord().toBigInteger();
    }

    public static ECPoint publicKeyPoint(BigInteger privateKey) {
        checkPrivateKey(privateKey);
        return StarkCurve.GENERATOR.multiply(privateKey).normalize();
    }

    public static StarkSignature sign(BigInteger msgHash, BigInteger privateKey) {
        if (msgHash.signum() < 0 || msgHash.compareTo(BOUND) >= 0) {
            throw new IllegalArgumentException("message hash out of range");
        }
        checkPrivateKey(privateKey);

        HMacDSAKCalculator kCalc = new HMacDSAKCalculator(new SHA256Digest());
        kCalc.init(N, privateKey, nonceInput(msgHash));

        // candidates outside [1, 2^251) are skipped by drawing the next nonce
        while (true) {
            BigInteger k = kCalc.nextK();
            BigInteger r = StarkCurve.GENERATOR.multiply(k).normalize().getAffineXCoord().toBigInteger();
            if (r.signum() == 0 || r.compareTo(BOUND) >= 0) continue;

            BigInteger zrd = msgHash.add(r.multiply(privateKey)).mod(N);
            if (zrd.signum() == 0) continue;

            BigInteger w = k.multiply(zrd.modInverse(N)).mod(N);
            if (w.signum() == 0 || w.compareTo(BOUND) >= 0) continue;

            return new StarkSignature(r, w.modInverse(N));
        }
    }

    public static boolean verify(BigInteger msgHash, StarkSignature sig, ECPoint publicKey) {
        BigInteger r = sig.r();
        BigInteger s = sig.s();
        if (r.signum() <= 0 || r.compareTo(BOUND) >= 0) return false;
        if (s.signum() <= 0 || s.compareTo(N) >= 0) return false;
        if (msgHash.signum() < 0 || msgHash.compareTo(BOUND) >= 0) return false;

        BigInteger w = s.modInverse(N);
        ECPoint q = StarkCurve.GENERATOR.multiply(msgHash.multiply(w).mod(N))
                .add(publicKey.multiply(r.multiply(w).mod(N)))
                .normalize();
        return !q.isInfinity() && q.getAffineXCoord().toBigInteger().equals(r);
    }

    /** Hashes one nibble short of 32 bytes are shifted so RFC 6979 truncation keeps all their bits. */
    private static byte[] nonceInput(BigInteger msgHash) {
        int bits = msgHash.bitLength();
        BigInteger m = msgHash;
        if (bits >= 248 && bits % 8 >= 1 && bits % 8 <= 4) {
            m = m.shiftLeft(4);
        }
        return BigIntegers.asUnsignedByteArray(m);
    }

    private static void checkPrivateKey(BigInteger privateKey) {
        if (privateKey.signum() <= 0 || privateKey.compareTo(N) >= 0) {
            throw new IllegalArgumentException("private key out of range");
        }
    }
}
