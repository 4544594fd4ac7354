package com.talentledger.ingestion.ledger;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SignatureVerifierTest {

    private static final BigInteger PRIVATE_KEY =
            new BigInteger("4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318", 16);
    private static final String SIGNER = "0x2c7536e3605d9c16a7a3d7b1898e529396a65c23";
    private static final String MESSAGE = "Sign in to TalentLedger\nNonce: 42";

    private String signature;

    @BeforeEach
    void sign() {
        signature = personalSign(MESSAGE);
    }

    @Test
    void publicKeyDerivesKnownAddress() {
        assertThat(SignatureVerifier.addressOf(SignatureVerifier.CURVE.getG().multiply(PRIVATE_KEY))).isEqualTo(SIGNER);
    }

    @Test
    @DisplayName("signature over the message recovers the signer")
    void recoversSigner() {
        assertThat(SignatureVerifier.recoverAddress(MESSAGE, signature)).contains(SIGNER);
        assertThat(SignatureVerifier.verify(MESSAGE, signature, SIGNER.toUpperCase().replace("0X", "0x"))).isTrue();
    }

    @Test
    void otherMessageDoesNotVerify() {
        assertThat(SignatureVerifier.verify(MESSAGE + "!", signature, SIGNER)).isFalse();
    }

    @Test
    void otherAddressDoesNotVerify() {
        assertThat(SignatureVerifier.verify(MESSAGE, signature, "0x742d35cc6634c0532925a3b844bc454e4438f44e")).isFalse();
    }

    @Test
    void malformedInputNeverThrows() {
        assertThat(SignatureVerifier.verify(MESSAGE, "0x1234", SIGNER)).isFalse();
        assertThat(SignatureVerifier.verify(MESSAGE, null, SIGNER)).isFalse();
        assertThat(SignatureVerifier.verify(MESSAGE, signature, "not-an-address")).isFalse();
        assertThat(SignatureVerifier.verify(null, signature, SIGNER)).isFalse();
        String badV = signature.substring(0, signature.length() - 2) + "05";
        assertThat(SignatureVerifier.verify(MESSAGE, badV, SIGNER)).isFalse();
    }

    /** personal_sign as a wallet does it: deterministic k, low-s, v in {27, 28}. */
    private static String personalSign(String message) {
        byte[] hash = SignatureVerifier.personalMessageHash(message);
        ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
        signer.init(true, new ECPrivateKeyParameters(PRIVATE_KEY, SignatureVerifier.CURVE));
        BigInteger[] rs = signer.generateSignature(hash);
        BigInteger r = rs[0];
        BigInteger s = rs[1];
        BigInteger n = SignatureVerifier.CURVE.getN();
        if (s.compareTo(n.shiftRight(1)) > 0) {
            s = n.subtract(s);
        }
        for (int v = 27; v <= 28; v++) {
            String candidate = "0x" + toHex32(r) + toHex32(s) + Integer.toHexString(v);
            if (SignatureVerifier.recoverAddress(message, candidate).filter(SIGNER::equals).isPresent()) {
                return candidate;
            }
        }
        throw new IllegalStateException("No recovery id matched");
    }

    private static String toHex32(BigInteger value) {
        byte[] raw = value.toByteArray();
        byte[] out = new byte[32];
        int copy = Math.min(raw.length, 32);
        System.arraycopy(raw, raw.length - copy, out, 32 - copy, copy);
        return Hex.toHexString(out);
    }
}
