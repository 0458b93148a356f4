package io.slwhitelist.manager;

import com.google.common.flogger.FluentLogger;
import io.slwhitelist.data.ProgressRecord;
import io.slwhitelist.data.ProgressStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;

/**
 * Writes the admin list consumed by the game server: one reserve group and one admin line per
 * player at or above the threshold. The file is always rewritten whole, through a temp file
 * and a rename, so readers never see a partial list and dropped players never linger.
 */
public class WhitelistFileManager {

    private static final FluentLogger LOGGER = FluentLogger.forEnclosingClass();
    private static final Set<PosixFilePermission> DEFAULT_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private final ProgressStore progressStore;
    private final Path whitelistFile;
    private final String groupName;
    private final int threshold;
    private final Level detailLevel;
    private final Object writeLock = new Object();

    public WhitelistFileManager(ProgressStore progressStore, Path whitelistFile, String groupName,
                                int threshold, boolean debugLogs) {
        this.progressStore = progressStore;
        this.whitelistFile = whitelistFile;
        this.groupName = groupName;
        this.threshold = threshold;
        this.detailLevel = debugLogs ? Level.INFO : Level.FINE;
    }

    /** Absolute paths are used as-is; relative ones are resolved against the host's base directory. */
    public static Path resolve(Path baseDir, String configuredPath) {
        Path configured = Path.of(configuredPath);
        if (configured.isAbsolute() || baseDir == null) {
            return configured;
        }
        return baseDir.resolve(configured);
    }

    /**
     * Creates parent directories and an empty file if nothing is there yet, so the server's
     * admin list loader finds the file at startup. Existing content is left untouched.
     */
    public boolean ensureFileExists() {
        try {
            Path parent = whitelistFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(whitelistFile)) {
                Files.createFile(whitelistFile);
                LOGGER.atInfo().log("Created empty whitelist file at " + whitelistFile);
            }
            return true;
        } catch (IOException e) {
            LOGGER.atSevere().withCause(e).log("Failed to ensure whitelist file exists at " + whitelistFile);
            return false;
        }
    }

    /**
     * Rebuilds the file from the store.
     *
     * @return true if a new version of the file was put in place
     */
    public boolean regenerate() {
        List<ProgressRecord> qualified;
        try {
            qualified = progressStore.findQualified(threshold);
        } catch (SQLException e) {
            LOGGER.atWarning().withCause(e).log("Failed to read whitelisted players, keeping previous file");
            return false;
        }

        List<String> playerIds = new ArrayList<>(qualified.size());
        for (ProgressRecord record : qualified) {
            playerIds.add(record.getPlayerId());
        }
        String content = render(groupName, playerIds);

        synchronized (writeLock) {
            try {
                writeAtomically(content);
            } catch (IOException e) {
                LOGGER.atSevere().withCause(e).log("Failed to write whitelist file " + whitelistFile
                        + ", previous version left in place");
                return false;
            }
        }
        LOGGER.at(detailLevel).log("Wrote " + playerIds.size() + " players to the whitelist file at " + whitelistFile);
        return true;
    }

    /**
     * Group line, a blank line, then the admin lines, newline-terminated.
     */
    public static String render(String groupName, List<String> playerIds) {
        StringBuilder builder = new StringBuilder();
        builder.append("Group=").append(groupName).append(":reserve\n\n");
        builder.append(String.join("\n", adminLines(groupName, playerIds)));
        builder.append('\n');
        return builder.toString();
    }

    private static List<String> adminLines(String groupName, List<String> playerIds) {
        List<String> lines = new ArrayList<>(playerIds.size());
        for (String playerId : playerIds) {
            lines.add("Admin=" + playerId + ":" + groupName);
        }
        return lines;
    }

    private void writeAtomically(String content) throws IOException {
        Path target = whitelistFile.toAbsolutePath();
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            copyPermissions(target, temp);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Temp files are created owner-only; the server may read the list as another user, so the
     * replacement takes the current file's mode, or {@code rw-r--r--} for a new file.
     */
    private static void copyPermissions(Path target, Path temp) throws IOException {
        if (Files.getFileAttributeView(temp, PosixFileAttributeView.class) == null) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.exists(target)
                ? Files.getPosixFilePermissions(target)
                : DEFAULT_PERMISSIONS;
        Files.setPosixFilePermissions(temp, permissions);
    }

    public Path getWhitelistFile() {
        return whitelistFile;
    }
}
