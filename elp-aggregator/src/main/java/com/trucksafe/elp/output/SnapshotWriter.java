package com.trucksafe.elp.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trucksafe.elp.model.AggregateSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes the dashboard snapshot as pretty-printed JSON.
 *
 * The file is written next to its destination first and moved into place, so
 * the dashboard never fetches a half-written elp_data.json.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SnapshotWriter {

    private final ObjectMapper objectMapper;

    public Path write(AggregateSnapshot snapshot, Path target) {
        Path dir = target.toAbsolutePath().getParent();
        ensureDirectory(dir);

        Path temp = null;
        try {
            temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

            log.info("Written snapshot to {}: {} OOS of {} ELP violations, {} months, {} states",
                    target, snapshot.getTotalOos(), snapshot.getTotalAll(),
                    snapshot.getMonthly().labels().size(), snapshot.getStateCount());
            return target;

        } catch (IOException e) {
            log.error("Failed to write snapshot {}: {}", target, e.getMessage(), e);
            deleteQuietly(temp);
            throw new UncheckedIOException("Snapshot write failed: " + target, e);
        }
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
