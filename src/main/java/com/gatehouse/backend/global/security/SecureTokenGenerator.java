package com.gatehouse.backend.global.security;

import java.security.SecureRandom;
import java.util.HexFormat;

import org.springframework.stereotype.Component;

/**
 * Opaque random tokens encoded as lower-case hex.
 */
@Component
public class SecureTokenGenerator {

    public static final int DEFAULT_BYTES = 32;

    private final SecureRandom secureRandom;

    public SecureTokenGenerator(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    public String generate() {
        return generate(DEFAULT_BYTES);
    }

    public String generate(int byteCount) {
        byte[] bytes = new byte[byteCount];
        secureRandom.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
