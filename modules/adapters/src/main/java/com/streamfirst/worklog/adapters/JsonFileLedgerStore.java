package com.streamfirst.worklog.adapters;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.streamfirst.worklog.domain.LedgerPersistenceException;
import com.streamfirst.worklog.domain.LedgerSnapshot;
import com.streamfirst.worklog.ports.LedgerStorePort;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Ledger store backed by a single JSON document:
 *
 * <pre>{@code
 * {
 *   "seen_commits" : [ "sha1", "sha2" ],
 *   "clockify_entries" : { "2024-03-04_alice_acme/api" : "te-1" }
 * }
 * }</pre>
 *
 * Writes go to a sibling {@code .tmp} file that is then moved over the target, so a crash
 * mid-write leaves the previous document intact. A missing file is an empty ledger; an
 * unreadable one is logged and treated as empty.
 */
@Slf4j
public class JsonFileLedgerStore implements LedgerStorePort {

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileLedgerStore(Path file) {
        this.file = file;
        this.objectMapper =
                new ObjectMapper()
                        .enable(SerializationFeature.INDENT_OUTPUT)
                        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"seen_commits", "clockify_entries"})
    static final class LedgerDocument {
        @JsonProperty("seen_commits")
        Set<String> seenCommits = new TreeSet<>();

        @JsonProperty("clockify_entries")
        Map<String, String> clockifyEntries = new TreeMap<>();
    }

    public Path getFile() {
        return file;
    }

    @Override
    public LedgerSnapshot load() {
        if (!Files.exists(file)) {
            log.info("No ledger at {}, starting empty", file);
            return LedgerSnapshot.empty();
        }

        try {
            LedgerDocument document = objectMapper.readValue(file.toFile(), LedgerDocument.class);
            Set<String> seen = new TreeSet<>();
            if (document.seenCommits != null) {
                document.seenCommits.stream().filter(Objects::nonNull).forEach(seen::add);
            }
            Map<String, String> index = new TreeMap<>();
            if (document.clockifyEntries != null) {
                document.clockifyEntries.forEach(
                        (key, id) -> {
                            if (key != null && id != null) {
                                index.put(key, id);
                            } else {
                                log.warn("Skipping ledger entry {} without a time entry id", key);
                            }
                        });
            }
            log.info("Loaded ledger from {}: {} events, {} sessions", file, seen.size(), index.size());
            return new LedgerSnapshot(seen, index);
        } catch (IOException e) {
            log.error("Ledger at {} is unreadable, starting empty", file, e);
            return LedgerSnapshot.empty();
        }
    }

    @Override
    public void save(LedgerSnapshot snapshot) {
        LedgerDocument document = new LedgerDocument();
        document.seenCommits = new TreeSet<>(snapshot.seenEventIds());
        document.clockifyEntries = new TreeMap<>(snapshot.sessionIndex());

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(tmp.toFile(), document);
            move(tmp);
            log.debug("Saved ledger to {}: {} events", file, document.seenCommits.size());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new LedgerPersistenceException("Failed to write ledger to " + file, e);
        }
    }

    private void move(Path tmp) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, replacing in place", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temporary ledger file {}", tmp, e);
        }
    }
}
