package fun.fengwk.afe.core.service.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.UUID;

/**
 * Saves learning state snapshots as json, replacing the file atomically.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class LearningStateFileStore {

    private final ObjectMapper objectMapper;
    private final Path snapshotPath;

    @Autowired
    public LearningStateFileStore(ObjectMapper objectMapper, StateProperties stateProperties) {
        this(objectMapper, resolvePath(stateProperties.getSnapshotPath()));
    }

    LearningStateFileStore(ObjectMapper objectMapper, Path snapshotPath) {
        this.objectMapper = objectMapper;
        this.snapshotPath = snapshotPath;
    }

    public Path getSnapshotPath() {
        return snapshotPath;
    }

    public void save(LearningStateSnapshot snapshot) {
        try {
            writeAtomically(snapshotPath, objectMapper.writeValueAsString(snapshot));
            log.debug("learning state saved, path={}", snapshotPath);
        } catch (Exception ex) {
            throw new IllegalStateException("failed to save learning state: " + ex.getMessage(), ex);
        }
    }

    /**
     * Load the snapshot, empty when no file has been saved yet.
     */
    public Optional<LearningStateSnapshot> load() {
        if (!Files.exists(snapshotPath)) {
            return Optional.empty();
        }
        try {
            String json = Files.readString(snapshotPath, StandardCharsets.UTF_8);
            return Optional.of(objectMapper.readValue(json, LearningStateSnapshot.class));
        } catch (Exception ex) {
            throw new IllegalStateException("failed to load learning state: " + ex.getMessage(), ex);
        }
    }

    private void writeAtomically(Path targetPath, String content) throws Exception {
        Path parent = targetPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmpPath = parent.resolve(targetPath.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.writeString(tmpPath, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        try {
            Files.move(tmpPath, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(tmpPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static Path resolvePath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("snapshot path is blank");
        }
        String trimmed = path.trim();
        if (trimmed.equals("~") || trimmed.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home") + trimmed.substring(1));
        }
        return Paths.get(trimmed);
    }

}
