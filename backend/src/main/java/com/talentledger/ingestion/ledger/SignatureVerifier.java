package com.talentledger.ingestion.ledger;

import com.talentledger.common.AddressFormat;
import com.talentledger.common.KeccakHash;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.asn1.x9.X9IntegerConverter;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECAlgorithms;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * EIP-191 personal_sign verification: recovers the secp256k1 public key from a 65-byte (r, s, v) signature over
 * keccak256("\x19Ethereum Signed Message:\n" + len + message) and compares the derived address.
 */
public final class SignatureVerifier {

    static final ECDomainParameters CURVE;

    static {
        X9ECParameters params = CustomNamedCurves.getByName("secp256k1");
        CURVE = new ECDomainParameters(params.getCurve(), params.getG(), params.getN(), params.getH());
    }

    private static final String PREFIX = "\u0019Ethereum Signed Message:\n";

    private SignatureVerifier() {
    }

    public static boolean verify(String message, String signature, String claimedAddress) {
        if (message == null || !AddressFormat.isValid(claimedAddress)) {
            return false;
        }
        try {
            return recoverAddress(message, signature)
                    .map(a -> a.equals(claimedAddress.toLowerCase()))
                    .orElse(false);
        } catch (RuntimeException e) {
            return false;
        }
    }

    /** Lowercase signer address, or empty when the signature is malformed or does not recover. */
    public static Optional<String> recoverAddress(String message, String signature) {
        byte[] sig = decodeSignature(signature);
        if (sig == null) {
            return Optional.empty();
        }
        int v = sig[64] & 0xFF;
        int recId = v >= 27 ? v - 27 : v;
        if (recId < 0 || recId > 1) {
            return Optional.empty();
        }
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(sig, 0, 32));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(sig, 32, 64));
        return recoverPublicKey(recId, r, s, personalMessageHash(message))
                .map(SignatureVerifier::addressOf);
    }

    public static byte[] personalMessageHash(String message) {
        byte[] body = message.getBytes(StandardCharsets.UTF_8);
        byte[] prefix = (PREFIX + body.length).getBytes(StandardCharsets.UTF_8);
        byte[] full = new byte[prefix.length + body.length];
        System.arraycopy(prefix, 0, full, 0, prefix.length);
        System.arraycopy(body, 0, full, prefix.length, body.length);
        return KeccakHash.digest(full);
    }

    /** Address of an uncompressed public key point: last 20 bytes of keccak256(X || Y). */
    static String addressOf(ECPoint publicKey) {
        byte[] encoded = publicKey.normalize().getEncoded(false);
        byte[] hash = KeccakHash.digest(Arrays.copyOfRange(encoded, 1, encoded.length));
        return "0x" + Hex.toHexString(Arrays.copyOfRange(hash, 12, 32));
    }

    private static byte[] decodeSignature(String signature) {
        if (signature == null) {
            return null;
        }
        String hex = signature.startsWith("0x") || signature.startsWith("0X") ? signature.substring(2) : signature;
        if (hex.length() != 130 || !hex.matches("[0-9a-fA-F]+")) {
            return null;
        }
        return Hex.decode(hex);
    }

    private static Optional<ECPoint> recoverPublicKey(int recId, BigInteger r, BigInteger s, byte[] hash) {
        BigInteger n = CURVE.getN();
        if (r.signum() <= 0 || r.compareTo(n) >= 0 || s.signum() <= 0 || s.compareTo(n) >= 0) {
            return Optional.empty();
        }
        BigInteger prime = CURVE.getCurve().getField().getCharacteristic();
        if (r.compareTo(prime) >= 0) {
            return Optional.empty();
        }
        ECPoint rPoint = decompressKey(r, (recId & 1) == 1);
        if (!rPoint.multiply(n).isInfinity()) {
            return Optional.empty();
        }
        BigInteger e = new BigInteger(1, hash);
        BigInteger eInv = BigInteger.ZERO.subtract(e).mod(n);
        BigInteger rInv = r.modInverse(n);
        BigInteger srInv = rInv.multiply(s).mod(n);
        BigInteger eInvrInv = rInv.multiply(eInv).mod(n);
        ECPoint q = ECAlgorithms.sumOfTwoMultiplies(CURVE.getG(), eInvrInv, rPoint, srInv);
        return q.isInfinity() ? Optional.empty() : Optional.of(q);
    }

    private static ECPoint decompressKey(BigInteger x, boolean yBit) {
        X9IntegerConverter converter = new X9IntegerConverter();
        byte[] compressed = converter.integerToBytes(x, 1 + converter.getByteLength(CURVE.getCurve()));
        compressed[0] = (byte) (yBit ? 0x03 : 0x02);
        return CURVE.getCurve().decodePoint(compressed);
    }
}
