package com.streamfirst.scenario.sensors.adapters.storage.local;

import com.streamfirst.scenario.sensors.domain.BlobKey;
import com.streamfirst.scenario.sensors.domain.exception.BlobStoreException;
import com.streamfirst.scenario.sensors.ports.LocalBlobStorePort;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Directory-backed local tier. A blob key maps to the relative file path under the sensor
 * root, so an existing dataset layout ({@code sensor_blobs/<log>/<channel>/<file>}) is
 * served directly.
 *
 * <p>Writes go to a hidden temporary file next to the target and are published with an
 * atomic rename. Readers therefore see either no file or the complete payload; a write that
 * is interrupted or crashes leaves at most a temporary file, which
 * {@link #purgeStaleTemporaries()} removes.
 *
 * <p>Nothing is ever evicted: the directory grows with every distinct key fetched.
 */
@Slf4j
public class FileSystemLocalBlobStore implements LocalBlobStorePort {

    static final String TEMP_PREFIX = ".";
    static final String TEMP_SUFFIX = ".partial";

    @Getter
    private final Path root;

    public FileSystemLocalBlobStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            log.error("Failed to create sensor root {}", this.root, e);
            throw new UncheckedIOException("Cannot create sensor root " + this.root, e);
        }
        log.info("Local blob store rooted at {}", this.root);
    }

    @Override
    public Optional<byte[]> get(BlobKey key) {
        Path path = resolve(key);
        try {
            byte[] content = Files.readAllBytes(path);
            log.debug("Read {} from {} ({} bytes)", key, root, content.length);
            return Optional.of(content);
        } catch (NoSuchFileException e) {
            log.debug("Blob {} not present under {}", key, root);
            return Optional.empty();
        } catch (IOException e) {
            log.error("Failed to read blob {} from {}", key, path, e);
            throw new BlobStoreException(key, "Failed to read " + path, e);
        }
    }

    @Override
    public void put(BlobKey key, byte[] data) {
        Path target = resolve(key);
        if (Files.isRegularFile(target)) {
            log.debug("Blob {} already cached at {}, keeping existing entry", key, target);
            return;
        }

        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), TEMP_PREFIX + target.getFileName() + ".", TEMP_SUFFIX);
            Files.write(temp, data);
            publish(temp, target);
            temp = null;
            log.debug("Cached {} at {} ({} bytes)", key, target, data.length);
        } catch (IOException e) {
            log.error("Failed to cache blob {} at {}", key, target, e);
            throw new BlobStoreException(key, "Failed to write " + target, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    @Override
    public boolean contains(BlobKey key) {
        return Files.isRegularFile(resolve(key));
    }

    /**
     * Deletes temporary files left behind by writes that never published, e.g. after the
     * process was killed mid-download.
     *
     * @return number of files removed
     */
    public int purgeStaleTemporaries() {
        List<Path> stale;
        try (Stream<Path> files = Files.walk(root)) {
            stale = files.filter(Files::isRegularFile)
                    .filter(FileSystemLocalBlobStore::isTemporary)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Failed to scan {} for stale temporary files", root, e);
            throw new UncheckedIOException("Cannot scan " + root, e);
        }

        int removed = 0;
        for (Path path : stale) {
            if (deleteQuietly(path)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} stale temporary files under {}", removed, root);
        }
        return removed;
    }

    private void publish(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported under {}, publishing {} without replace", root, target);
            try {
                Files.move(temp, target);
            } catch (FileAlreadyExistsException concurrent) {
                log.debug("Blob at {} was published concurrently", target);
            }
        }
    }

    private Path resolve(BlobKey key) {
        Path path = root.resolve(key.value()).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("Blob key " + key + " resolves outside " + root);
        }
        return path;
    }

    private static boolean isTemporary(Path path) {
        String name = path.getFileName().toString();
        return name.startsWith(TEMP_PREFIX) && name.endsWith(TEMP_SUFFIX);
    }

    private boolean deleteQuietly(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}", path, e);
            return false;
        }
    }
}
