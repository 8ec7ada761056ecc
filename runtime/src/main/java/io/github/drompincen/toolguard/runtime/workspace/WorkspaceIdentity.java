package io.github.drompincen.toolguard.runtime.workspace;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable, one-way identity of a workspace: the first 16 hex characters of the SHA-256 of its
 * absolute normalized path. Shadow mirrors and session records are keyed by it.
 */
public final class WorkspaceIdentity {

    private static final int LENGTH = 16;

    private WorkspaceIdentity() {}

    public static String of(Path workspace) {
        String path = workspace.toAbsolutePath().normalize().toString();
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(path.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
