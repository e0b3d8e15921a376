package com.titiplex.frost.core.crypto;

import com.titiplex.frost.core.model.FinalSignature;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Schnorr verification over secp256k1: {@code s·G == R + e·P} with
 * {@code e = SHA-256(R ‖ P ‖ m) mod n}, R and P in compressed SEC1 form.
 */
public final class SchnorrVerifier {

    private SchnorrVerifier() {
    }

    public static BigInteger challenge(ECPoint r, ECPoint groupKey, byte[] messageHash) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            sha.update(r.normalize().getEncoded(true));
            sha.update(groupKey.normalize().getEncoded(true));
            sha.update(messageHash);
            return new BigInteger(1, sha.digest()).mod(Secp256k1.N);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * @return false for any signature that is malformed or does not verify
     * @throws IllegalArgumentException if the group key or the message hash cannot be decoded
     */
    public static boolean verify(FinalSignature sig, String groupPublicKeyHex, String messageHashHex) {
        ECPoint p = Secp256k1.decodePublicKey(groupPublicKeyHex);
        if (!Secp256k1.isHex(messageHashHex) || messageHashHex.length() != 64)
            throw new IllegalArgumentException("message hash must be 64 hex chars");
        byte[] m = Hex.decode(messageHashHex);

        if (sig == null || !Secp256k1.isHex(sig.s()) || sig.s().length() != 64) return false;
        ECPoint r;
        try {
            r = Secp256k1.decodePoint(sig.r());
        } catch (IllegalArgumentException e) {
            return false;
        }
        BigInteger s = new BigInteger(sig.s(), 16);
        if (s.signum() <= 0 || s.compareTo(Secp256k1.N) >= 0) return false;

        BigInteger e = challenge(r, p, m);
        ECPoint lhs = Secp256k1.G.multiply(s).normalize();
        ECPoint rhs = r.add(p.multiply(e)).normalize();
        return lhs.equals(rhs);
    }
}
