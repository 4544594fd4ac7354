package com.talentledger.common;

import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;

/**
 * Keccak-256 as used by the EVM (not NIST SHA3-256).
 */
public final class KeccakHash {

    private KeccakHash() {
    }

    public static byte[] digest(byte[] input) {
        return new Keccak.Digest256().digest(input);
    }

    /** 0x-prefixed lowercase hex digest of the UTF-8 bytes, e.g. an event topic from its signature. */
    public static String hexDigest(String utf8) {
        return "0x" + Hex.toHexString(digest(utf8.getBytes(StandardCharsets.UTF_8)));
    }
}
