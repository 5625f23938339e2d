package com.example.mnm.security;

import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Base64;

@Service
public class PasswordVerifier {

    private final PasswordEncoder encoder;

    // compared against when the identity or its hash is unknown, so every failure costs the same
    private final String placeholderHash;

    public PasswordVerifier() {
        this(Argon2PasswordEncoder.defaultsForSpringSecurity_v5_8());
    }

    PasswordVerifier(PasswordEncoder encoder) {
        this.encoder = encoder;
        this.placeholderHash = encoder.encode(randomSecret());
    }

    /**
     * Always runs one full hash comparison, whatever the inputs, so a missing secret or a
     * missing hash costs as much as a real mismatch.
     */
    public boolean verify(String rawPassword, String encodedPassword) {
        boolean usable = rawPassword != null && !rawPassword.isEmpty()
                && encodedPassword != null && !encodedPassword.isBlank();
        String hash = encodedPassword != null && !encodedPassword.isBlank() ? encodedPassword : placeholderHash;
        boolean matches = encoder.matches(rawPassword != null ? rawPassword : "", hash);
        return usable && matches;
    }

    public String encode(String rawPassword) {
        return encoder.encode(rawPassword);
    }

    /**
     * Burns one hash comparison and always returns {@code false}.
     */
    public boolean verifyAgainstPlaceholder(String rawPassword) {
        encoder.matches(rawPassword != null ? rawPassword : "", placeholderHash);
        return false;
    }

    private static String randomSecret() {
        byte[] bytes = new byte[24];
        new SecureRandom().nextBytes(bytes);
        return Base64.getEncoder().encodeToString(bytes);
    }
}
