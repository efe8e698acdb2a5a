package era.rank.building;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class SyncReport {
    private static final Logger logger = LogManager.getLogger(SyncReport.class);

    private final Set<String> updated = new TreeSet<>();
    private final Set<String> removed = new TreeSet<>();
    private final Set<String> failed = new TreeSet<>();
    private int reused;

    void markUpdated(String filename) {
        updated.add(filename);
    }

    void markRemoved(String filename) {
        removed.add(filename);
    }

    void markFailed(String filename) {
        failed.add(filename);
    }

    void markReused() {
        reused++;
    }

    public Set<String> getUpdated() {
        return Collections.unmodifiableSet(updated);
    }

    public Set<String> getRemoved() {
        return Collections.unmodifiableSet(removed);
    }

    public Set<String> getFailed() {
        return Collections.unmodifiableSet(failed);
    }

    public int getReused() {
        return reused;
    }

    public boolean hasChanges() {
        return !updated.isEmpty() || !removed.isEmpty();
    }

    public void print() {
        logger.info("Sync report:");
        logger.info("  - Updated: {}", updated.size());
        logger.info("  - Reused: {}", reused);
        logger.info("  - Removed: {}", removed.size());
        logger.info("  - Failed: {}", failed.size());
    }
}
