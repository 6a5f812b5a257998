package com.nevis.xray.repository;

import com.nevis.xray.config.CacheProperties;
import com.nevis.xray.exception.CacheStorageException;
import com.nevis.xray.model.PartialCacheEntry;
import com.nevis.xray.model.Snapshot;
import com.nevis.xray.service.SnapshotCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stores each document under {@code <root>/<md5(documentId)>/}: the main snapshot in
 * {@value #MAIN_FILE_NAME} and partials as {@code xray_analysis/<N>%.json}.
 */
@Repository
@Slf4j
public class FileSystemPartialCacheStore implements PartialCacheStore {

    public static final String MAIN_FILE_NAME = "xray_cache.json";
    public static final String ANALYSIS_DIR = "xray_analysis";
    static final Pattern PARTIAL_FILE = Pattern.compile("^(\\d+)%\\.json$");

    private final Path root;
    private final SnapshotCodec codec;

    @Autowired
    public FileSystemPartialCacheStore(CacheProperties properties, SnapshotCodec codec) {
        this(properties.root(), codec);
    }

    public FileSystemPartialCacheStore(Path root, SnapshotCodec codec) {
        this.root = root;
        this.codec = codec;
    }

    public static String partialFileName(int percent) {
        return percent + "%.json";
    }

    @Override
    public void save(String documentId, int percent, String content) {
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("Percent must be within 0..100, got " + percent);
        }
        Path target = partialDirectory(documentId).resolve(partialFileName(percent));
        writeAtomically(target, content);
        log.debug("Saved partial {}% for document {}", percent, documentId);
    }

    @Override
    public Optional<String> get(String documentId, int percent) {
        Path file = partialDirectory(documentId).resolve(partialFileName(percent));
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(readString(file));
    }

    @Override
    public List<Integer> list(String documentId) {
        Path directory = partialDirectory(documentId);
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<Integer> percents = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*%.json")) {
            for (Path file : files) {
                Matcher matcher = PARTIAL_FILE.matcher(file.getFileName().toString());
                if (matcher.matches()) {
                    percents.add(Integer.parseInt(matcher.group(1)));
                }
            }
        } catch (IOException e) {
            throw new CacheStorageException("Failed to list " + directory, e);
        }
        Collections.sort(percents);
        return percents;
    }

    @Override
    public Optional<PartialCacheEntry> nearestAtOrBelow(String documentId, int targetPercent) {
        List<Integer> percents = list(documentId);
        for (int i = percents.size() - 1; i >= 0; i--) {
            int percent = percents.get(i);
            if (percent > targetPercent) {
                continue;
            }
            Path file = partialDirectory(documentId).resolve(partialFileName(percent));
            String content;
            try {
                content = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.warn("Skipping unreadable partial {}", file, e);
                continue;
            }
            try {
                if (!codec.read(content).hasContent()) {
                    log.debug("Skipping partial {}% for document {}: no usable content", percent, documentId);
                    continue;
                }
            } catch (CacheStorageException e) {
                log.warn("Skipping undecodable partial {}% for document {}: {}", percent, documentId, e.getMessage());
                continue;
            }
            return Optional.of(new PartialCacheEntry(percent, content, lastModified(file)));
        }
        return Optional.empty();
    }

    @Override
    public boolean clear(String documentId) {
        int removed = 0;
        if (deleteQuietly(mainFile(documentId))) {
            removed++;
        }
        Path directory = partialDirectory(documentId);
        for (Integer percent : list(documentId)) {
            if (deleteQuietly(directory.resolve(partialFileName(percent)))) {
                removed++;
            }
        }
        deleteIfEmpty(directory);
        deleteIfEmpty(documentDirectory(documentId));
        log.info("Cleared {} cache files for document {}", removed, documentId);
        return removed > 0;
    }

    @Override
    public void saveMain(String documentId, Snapshot snapshot) {
        Snapshot stamped = snapshot.withCacheMetadata(Snapshot.FORMAT_VERSION, Instant.now().getEpochSecond());
        writeAtomically(mainFile(documentId), codec.write(stamped));
        log.debug("Saved main snapshot at {}% for document {}", snapshot.analysisProgress(), documentId);
    }

    @Override
    public Optional<Snapshot> loadMain(String documentId) {
        Path file = mainFile(documentId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        Snapshot snapshot;
        try {
            snapshot = codec.read(readString(file));
        } catch (CacheStorageException e) {
            log.warn("Ignoring unreadable main cache for document {}", documentId, e);
            return Optional.empty();
        }
        if (!Snapshot.FORMAT_VERSION.equals(snapshot.cacheVersion())) {
            log.info("Main cache for document {} has version {}, expected {}; treating as miss",
                documentId, snapshot.cacheVersion(), Snapshot.FORMAT_VERSION);
            return Optional.empty();
        }
        return Optional.of(snapshot);
    }

    @Override
    public Path mainFile(String documentId) {
        return documentDirectory(documentId).resolve(MAIN_FILE_NAME);
    }

    @Override
    public Path partialDirectory(String documentId) {
        return documentDirectory(documentId).resolve(ANALYSIS_DIR);
    }

    Path documentDirectory(String documentId) {
        String key = DigestUtils.md5DigestAsHex(documentId.getBytes(StandardCharsets.UTF_8));
        return root.resolve(key);
    }

    private void writeAtomically(Path target, String content) {
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            try {
                Files.writeString(temp, content, StandardCharsets.UTF_8);
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new CacheStorageException("Failed to write " + target, e);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static String readString(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CacheStorageException("Failed to read " + file, e);
        }
    }

    private static Instant lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            return Instant.EPOCH;
        }
    }

    private static boolean deleteQuietly(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete {}", file, e);
            return false;
        }
    }

    private static void deleteIfEmpty(Path directory) {
        if (!Files.isDirectory(directory)) {
            return;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            if (entries.iterator().hasNext()) {
                return;
            }
        } catch (IOException e) {
            log.warn("Could not inspect {}", directory, e);
            return;
        }
        deleteQuietly(directory);
    }
}
