package com.titiplex.frost.core.crypto;

import com.titiplex.frost.core.error.ErrorKind;
import com.titiplex.frost.core.error.FrostException;
import com.titiplex.frost.core.model.FinalSignature;
import org.bouncycastle.math.ec.ECPoint;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Combines signature shares and nonce commitments: {@code s = Σ sᵢ mod n}, {@code R = Σ Rᵢ}.
 */
@Component
public class SignatureAggregator {

    /**
     * @param signers     participants whose share is used, in session order
     * @param shares      participant → share scalar hex
     * @param commitments participant → nonce commitment point hex
     * @throws FrostException AGGREGATION on any malformed share or commitment
     */
    public FinalSignature aggregate(List<String> signers, Map<String, String> shares, Map<String, String> commitments) {
        if (signers.isEmpty()) throw new FrostException(ErrorKind.AGGREGATION, "No signature shares to aggregate");

        BigInteger s = BigInteger.ZERO;
        ECPoint r = Secp256k1.CURVE.getInfinity();
        for (String p : signers) {
            s = s.add(parseShare(p, shares.get(p))).mod(Secp256k1.N);
            r = r.add(parseCommitment(p, commitments.get(p)));
        }
        r = r.normalize();
        if (r.isInfinity()) throw new FrostException(ErrorKind.AGGREGATION, "Aggregated nonce point is infinity");
        if (s.signum() == 0) throw new FrostException(ErrorKind.AGGREGATION, "Aggregated scalar is zero");
        return new FinalSignature(Secp256k1.encode(r), Secp256k1.encodeScalar(s));
    }

    private BigInteger parseShare(String participant, String share) {
        if (!Secp256k1.isHex(share) || share.length() > 64)
            throw new FrostException(ErrorKind.AGGREGATION, "Invalid signature share format for participant " + participant);
        BigInteger v = new BigInteger(share, 16);
        if (v.signum() <= 0 || v.compareTo(Secp256k1.N) >= 0)
            throw new FrostException(ErrorKind.AGGREGATION, "Signature share out of valid range for participant " + participant);
        return v;
    }

    private ECPoint parseCommitment(String participant, String commitment) {
        if (commitment == null)
            throw new FrostException(ErrorKind.AGGREGATION, "Missing nonce commitment for participant " + participant);
        try {
            return Secp256k1.decodePoint(commitment);
        } catch (IllegalArgumentException e) {
            throw new FrostException(ErrorKind.AGGREGATION,
                    "Failed to parse nonce commitment for participant " + participant + ": " + e.getMessage(), e);
        }
    }
}
