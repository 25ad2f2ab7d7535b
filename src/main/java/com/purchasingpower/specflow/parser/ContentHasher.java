package com.purchasingpower.specflow.parser;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes the content-addressed task id: the first 8 hex characters of the MD5
 * digest of {@code "{groupTitle}::{taskTitle}"}.
 *
 * <p>Two tasks with the same title in groups with the same title get the same hash.
 */
@Component
public class ContentHasher {

    public static final int HASH_LENGTH = 8;

    public String hash(String groupTitle, String taskTitle) {
        String content = groupTitle + "::" + taskTitle;
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] bytes = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 digest not available", e);
        }
    }
}
