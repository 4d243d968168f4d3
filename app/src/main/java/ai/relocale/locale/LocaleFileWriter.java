package ai.relocale.locale;

import ai.relocale.lock.FileMutex;
import ai.relocale.lock.OperationLockManager;
import ai.relocale.lock.OperationType;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Applies batched updates to a locale file. Every call holds the file mutex and the file lock, reads the current
 * content fresh, applies all changes in one pass and writes once, so concurrent batches cannot lose each other's keys.
 * A file that exists but does not parse is left untouched and reported as an {@link IOException}.
 */
public class LocaleFileWriter {
    private static final Logger logger = LogManager.getLogger(LocaleFileWriter.class);

    private final OperationLockManager locks;
    private final FileMutex mutex;

    public LocaleFileWriter(OperationLockManager locks, FileMutex mutex) {
        this.locks = locks;
        this.mutex = mutex;
    }

    /** Sets every {@code key -> value} in {@code file}, creating the file and intermediate objects as needed. */
    public void setMultiple(Path file, OperationType holder, Map<String, String> updates) throws IOException {
        if (updates.isEmpty()) {
            return;
        }
        update(file, holder, root -> {
            updates.forEach((key, value) -> LocaleTree.setNestedValue(root, key, value));
            return true;
        });
        logger.debug("Wrote {} keys to {}", updates.size(), file);
    }

    /** Deletes {@code keys} from {@code file}. Returns how many were present; the file is left untouched if none. */
    public int deleteKeys(Path file, OperationType holder, Collection<String> keys) throws IOException {
        var removed = new int[1];
        update(file, holder, root -> {
            for (var key : keys) {
                if (LocaleTree.deleteKeyPath(root, key)) {
                    removed[0]++;
                }
            }
            return removed[0] > 0;
        });
        return removed[0];
    }

    private void update(Path file, OperationType holder, Function<ObjectNode, Boolean> change) throws IOException {
        try {
            mutex.withFileMutex(file, () -> locks.withFileLock(file, holder, () -> {
                try {
                    var root = LocaleJson.readForUpdate(file);
                    if (change.apply(root)) {
                        LocaleJson.write(file, root);
                    }
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                return null;
            }));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
