package com.titiplex.frost.core.crypto;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * secp256k1 encodings used on the wire: points as SEC1 hex (33 bytes compressed or
 * 65 bytes uncompressed), scalars as 32-byte big-endian hex.
 */
public final class Secp256k1 {
    private static final X9ECParameters PARAMS = CustomNamedCurves.getByName("secp256k1");
    private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]+$");

    public static final ECCurve CURVE = PARAMS.getCurve();
    public static final ECPoint G = PARAMS.getG();
    public static final BigInteger N = PARAMS.getN();

    private Secp256k1() {
    }

    public static boolean isHex(String s) {
        return s != null && HEX.matcher(s).matches();
    }

    /**
     * @throws IllegalArgumentException on bad hex, bad length, a point off the curve or infinity
     */
    public static ECPoint decodePoint(String hex) {
        if (!isHex(hex)) throw new IllegalArgumentException("not a hex string");
        if (hex.length() != 66 && hex.length() != 130)
            throw new IllegalArgumentException("expected 66 or 130 hex chars, got " + hex.length());
        ECPoint p = CURVE.decodePoint(Hex.decode(hex)).normalize();
        if (p.isInfinity() || !p.isValid()) throw new IllegalArgumentException("point not on curve");
        return p;
    }

    /**
     * Decodes a group public key. A 64-char x-only key (Nostr style) is lifted to its even-y point.
     */
    public static ECPoint decodePublicKey(String hex) {
        if (hex != null && hex.length() == 64) return decodePoint("02" + hex);
        return decodePoint(hex);
    }

    public static String encode(ECPoint p) {
        return Hex.toHexString(p.normalize().getEncoded(true));
    }

    /**
     * Canonical compressed form of an encoded point, so two encodings of one point compare equal.
     */
    public static String canonical(String pointHex) {
        return encode(decodePoint(pointHex));
    }

    public static String encodeScalar(BigInteger s) {
        return String.format("%064x", s);
    }

    public static byte[] scalarBytes(BigInteger s) {
        return Hex.decode(encodeScalar(s));
    }
}
