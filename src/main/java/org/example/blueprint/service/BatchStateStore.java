package org.example.blueprint.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.example.blueprint.model.BatchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable storage for {@link BatchState}: one JSON file per batch in a dedicated directory.
 *
 * <p>Writes go to a temporary file in the same directory, are forced to disk and then moved over
 * the target, so a reader sees either the previous or the new document. Each write or delete holds
 * an in-process lock for the target path plus an OS lock on a {@code .lock} sidecar file.
 */
@Service
public class BatchStateStore {

    private static final Logger log = LoggerFactory.getLogger(BatchStateStore.class);

    static final String FILE_PREFIX = "batch_";
    static final String FILE_SUFFIX = ".json";
    static final String LOCK_SUFFIX = ".lock";
    private static final int MAX_ID_CHARS_IN_NAME = 64;

    @FunctionalInterface
    private interface LockedAction<T> {
        T run() throws IOException;
    }

    private final Path stateDirectory;
    private final Clock clock;
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();
    private final ConcurrentHashMap<Path, ReentrantLock> pathLocks = new ConcurrentHashMap<>();

    @Autowired
    public BatchStateStore(@Value("${batch.state.dir:.bpui-batch-state}") String stateDirectory) {
        this(Path.of(stateDirectory), Clock.systemUTC());
    }

    public BatchStateStore(Path stateDirectory, Clock clock) {
        this.stateDirectory = stateDirectory.toAbsolutePath().normalize();
        this.clock = clock;
    }

    public Path getStateDirectory() {
        return stateDirectory;
    }

    /**
     * Deterministic location of a batch's state file. The readable part of the name is only a hint;
     * the hash suffix keeps ids that sanitize to the same text apart.
     */
    public Path stateFileFor(String batchId) {
        String readable = batchId.replaceAll("[^A-Za-z0-9_-]", "_");
        if (readable.length() > MAX_ID_CHARS_IN_NAME) {
            readable = readable.substring(0, MAX_ID_CHARS_IN_NAME);
        }
        return stateDirectory.resolve(FILE_PREFIX + readable + "_" + shortHash(batchId) + FILE_SUFFIX);
    }

    public Path save(BatchState state) {
        Path target = stateFileFor(state.getBatchId());
        try {
            Files.createDirectories(stateDirectory);
            return withPathLock(target, () -> {
                byte[] payload;
                synchronized (state) {
                    payload = objectMapper.writeValueAsBytes(state);
                }
                writeAtomically(target, payload);
                return target;
            });
        } catch (IOException e) {
            log.error("Failed to save batch state {} to {}", state.getBatchId(), target, e);
            throw new BatchStatePersistenceException("Failed to save batch state " + state.getBatchId(), e);
        }
    }

    /**
     * @return the parsed state, or empty when the file is missing, empty, truncated or otherwise
     *         unreadable. Empty means "state unknown", not "no progress".
     */
    public Optional<BatchState> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            byte[] content = Files.readAllBytes(path);
            if (content.length == 0) {
                log.warn("Batch state file {} is empty", path);
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(content, BatchState.class));
        } catch (IOException | RuntimeException e) {
            log.warn("Unreadable batch state file {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<BatchState> findById(String batchId) {
        return load(stateFileFor(batchId))
                .filter(state -> batchId.equals(state.getBatchId()));
    }

    /**
     * All readable states, most recently started first. Unreadable files are logged and left alone.
     */
    public List<BatchState> listStates() {
        List<BatchState> states = new ArrayList<>();
        for (Path file : listStateFiles()) {
            load(file).ifPresentOrElse(states::add,
                    () -> log.warn("Skipping unreadable batch state file {}", file));
        }
        states.sort(Comparator.comparing(BatchState::getStartTime).reversed());
        return states;
    }

    /**
     * Removes the state file whose recorded {@code batch_id} equals {@code batchId} exactly.
     */
    public boolean delete(String batchId) {
        if (batchId == null || batchId.isBlank()) {
            return false;
        }
        for (Path file : listStateFiles()) {
            Optional<BatchState> candidate = load(file);
            if (candidate.isPresent() && batchId.equals(candidate.get().getBatchId())) {
                deleteFile(file);
                log.info("Deleted batch state {} ({})", batchId, file.getFileName());
                return true;
            }
        }
        log.debug("No batch state found to delete for {}", batchId);
        return false;
    }

    /**
     * Removes state files last modified before {@code now - olderThan}.
     *
     * @return number of files removed
     */
    public int cleanup(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        int deleted = 0;
        for (Path file : listStateFiles()) {
            try {
                if (load(file).isEmpty()) {
                    log.warn("Cleanup skipped unreadable batch state file {}", file);
                    continue;
                }
                Instant modified = Files.getLastModifiedTime(file).toInstant();
                if (modified.isBefore(cutoff)) {
                    deleteFile(file);
                    deleted++;
                }
            } catch (IOException | BatchStatePersistenceException e) {
                log.warn("Cleanup could not process batch state file {}: {}", file, e.getMessage());
            }
        }
        if (deleted > 0) {
            log.info("Cleaned up {} batch state file(s) older than {} days", deleted, olderThan.toDays());
        }
        return deleted;
    }

    List<Path> listStateFiles() {
        if (!Files.isDirectory(stateDirectory)) {
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(stateDirectory, FILE_PREFIX + "*" + FILE_SUFFIX)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            log.warn("Unable to list batch state directory {}: {}", stateDirectory, e.getMessage());
        }
        files.sort(Comparator.naturalOrder());
        return files;
    }

    /**
     * Removes the state file under its lock. The {@code .lock} sidecar stays: removing it would let a
     * process still waiting on the old inode and one locking a fresh file both hold the lock.
     */
    private void deleteFile(Path file) {
        try {
            withPathLock(file, () -> {
                Files.deleteIfExists(file);
                return null;
            });
        } catch (IOException e) {
            throw new BatchStatePersistenceException("Failed to delete batch state file " + file, e);
        }
    }

    private void writeAtomically(Path target, byte[] payload) throws IOException {
        Path temp = Files.createTempFile(stateDirectory, target.getFileName().toString() + ".", ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(payload);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, falling back to replace", stateDirectory);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private <T> T withPathLock(Path target, LockedAction<T> action) throws IOException {
        ReentrantLock localLock = pathLocks.computeIfAbsent(target, ignored -> new ReentrantLock());
        localLock.lock();
        try (FileChannel lockChannel = FileChannel.open(lockFileFor(target),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE);
             FileLock fileLock = lockChannel.lock()) {
            return action.run();
        } finally {
            localLock.unlock();
        }
    }

    private Path lockFileFor(Path target) {
        return target.resolveSibling(target.getFileName().toString() + LOCK_SUFFIX);
    }

    private static String shortHash(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 4);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
