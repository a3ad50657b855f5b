package com.pagesmith.orchestrator.hosting;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes git blob object IDs locally, so file content can be compared with
 * what a branch already holds without downloading it.
 */
public final class GitBlobs {

    private GitBlobs() {}

    /** {@code sha1("blob <byte length>\0" + content)}, as git does. */
    public static String sha(String content) {
        byte[] body   = content.getBytes(StandardCharsets.UTF_8);
        byte[] header = ("blob " + body.length + "\0").getBytes(StandardCharsets.UTF_8);
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            sha1.update(header);
            sha1.update(body);
            return HexFormat.of().formatHex(sha1.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
