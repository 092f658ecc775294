package com.libragraph.squash.util;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Objects;
import java.util.Set;

/**
 * Output stream that stages bytes in a temporary file next to its target and
 * makes them visible at the target path in one rename.
 *
 * <p>The temp file lives in the target's directory so the final rename never
 * crosses a filesystem. Exactly one of {@link #commit()} or {@link #discard()}
 * ends the handle; {@link #close()} on a still-active handle discards, so a
 * commit must always be explicit and the target never holds partial data.
 *
 * <p>Not thread-safe. Two handles on the same target race at rename time and
 * the last rename wins.
 */
public class AtomicWriteFile extends OutputStream {

    private static final Logger log = Logger.getLogger(AtomicWriteFile.class);

    public enum State {
        ACTIVE,
        COMMITTED,
        DISCARDED
    }

    private final Path target;
    private final Path temp;
    private final Set<PosixFilePermission> permissions;
    private final FileChannel channel;
    private State state = State.ACTIVE;

    private AtomicWriteFile(Path target, Set<PosixFilePermission> permissions) throws IOException {
        this.target = target.toAbsolutePath();
        this.permissions = permissions;
        Path dir = this.target.getParent();
        this.temp = Files.createTempFile(dir, "." + this.target.getFileName() + ".", ".tmp");
        this.channel = FileChannel.open(temp, StandardOpenOption.WRITE);
    }

    /**
     * Opens a handle for {@code target}. The parent directory must exist.
     */
    public static AtomicWriteFile open(Path target) throws IOException {
        return open(target, null);
    }

    /**
     * Opens a handle whose committed file gets the given POSIX permissions.
     *
     * @param permissions applied to the temp file just before the rename; null keeps the defaults
     */
    public static AtomicWriteFile open(Path target, Set<PosixFilePermission> permissions) throws IOException {
        Objects.requireNonNull(target, "target cannot be null");
        return new AtomicWriteFile(target, permissions);
    }

    public Path targetPath() {
        return target;
    }

    /**
     * Path of the staging file. Another writer (e.g. a child process) may fill it
     * directly, as long as it is done before {@link #commit()}.
     */
    public Path tempPath() {
        return temp;
    }

    public State state() {
        return state;
    }

    @Override
    public void write(int b) throws IOException {
        write(new byte[]{(byte) b}, 0, 1);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        requireActive("write");
        ByteBuffer buf = ByteBuffer.wrap(b, off, len);
        while (buf.hasRemaining()) {
            channel.write(buf);
        }
    }

    /**
     * Syncs the staged bytes and renames them over the target.
     * If the rename fails the temp file is removed and the handle ends DISCARDED.
     */
    public void commit() throws IOException {
        requireActive("commit");
        try {
            channel.force(true);
            channel.close();
            if (permissions != null) {
                Files.setPosixFilePermissions(temp, permissions);
            }
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debugf("Atomic move unsupported for %s, using replacing move", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            state = State.DISCARDED;
            Files.deleteIfExists(temp);
            throw e;
        }
        state = State.COMMITTED;
        syncDirectory(target.getParent());
        log.debugf("Committed %s", target);
    }

    /**
     * Drops everything written so far. The target is left untouched.
     */
    public void discard() throws IOException {
        requireActive("discard");
        state = State.DISCARDED;
        try {
            channel.close();
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debugf("Discarded pending write to %s", target);
    }

    /**
     * Discards if still active; no-op after commit or discard.
     */
    @Override
    public void close() throws IOException {
        if (state == State.ACTIVE) {
            discard();
        }
    }

    private void requireActive(String op) {
        if (state != State.ACTIVE) {
            throw new InvalidStateException(
                    "Cannot " + op + " " + target + ": handle is already " + state);
        }
    }

    // Directory fsync is not supported everywhere (e.g. Windows); the rename itself has happened.
    private static void syncDirectory(Path dir) {
        try (FileChannel ch = FileChannel.open(dir, StandardOpenOption.READ)) {
            ch.force(true);
        } catch (IOException e) {
            log.debugf("Directory sync skipped for %s: %s", dir, e.getMessage());
        }
    }
}
