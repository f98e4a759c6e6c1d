package de.bsommerfeld.layerkit.auth.data;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps the session in a JSON file, {@code session.json} in the app-data
 * directory by default.
 *
 * <p>
 * Writes go to a sibling temp file first and are then moved over the target,
 * so a crash never leaves half a session behind. A missing or unreadable
 * file reads as "no session". Storage errors are logged and not rethrown:
 * losing the cached session only means logging in again.
 */
public class FileAuthLocalDataSource implements AuthLocalDataSource {

    private static final Logger LOG = LoggerFactory.getLogger(FileAuthLocalDataSource.class);

    private final Path sessionFile;
    private final ObjectMapper mapper = new ObjectMapper();

    public FileAuthLocalDataSource(Path sessionFile) {
        this.sessionFile = sessionFile;
    }

    @Override
    public synchronized Optional<UserModel> readSession() {
        if (!Files.exists(sessionFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(sessionFile.toFile(), UserModel.class));
        } catch (IOException e) {
            LOG.warn("Ignoring unreadable session file {}: {}", sessionFile, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized void saveSession(UserModel session) {
        try {
            Path parent = sessionFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = sessionFile.resolveSibling(sessionFile.getFileName() + ".tmp");
            mapper.writeValue(temp.toFile(), session);
            move(temp);
            LOG.debug("Session of {} saved to {}", session.email(), sessionFile);
        } catch (IOException e) {
            LOG.error("Failed to save session to {}", sessionFile, e);
        }
    }

    @Override
    public synchronized void clearSession() {
        try {
            Files.deleteIfExists(sessionFile);
        } catch (IOException e) {
            LOG.error("Failed to delete session file {}", sessionFile, e);
        }
    }

    private void move(Path temp) throws IOException {
        try {
            Files.move(temp, sessionFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, sessionFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
