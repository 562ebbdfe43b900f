package io.mnemo.core.memory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class ProjectIds {

    private ProjectIds() {
    }

    /**
     * {@code project_} followed by the first 16 hex characters of the SHA-256 of
     * the normalized absolute path.
     */
    public static String fromWorkingDirectory(Path workingDirectory) {
        Path resolved = workingDirectory == null
            ? Path.of(System.getProperty("user.home"))
            : workingDirectory;
        String normalized = resolved.toAbsolutePath().normalize().toString();
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(normalized.getBytes(StandardCharsets.UTF_8));
            return "project_" + HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
