package com.williamcallahan.flowindex.service;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import org.springframework.stereotype.Component;

@Component
public class ContentHasher {

    /**
     * Generates a SHA-256 hash of raw bytes.
     *
     * @param content bytes to hash
     * @return lowercase hexadecimal digest
     */
    public String sha256(byte[] content) {
        Objects.requireNonNull(content, "content");
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
