package com.uptimefleet.master.storage;

import com.uptimefleet.common.exception.ErrorCode;
import com.uptimefleet.common.exception.FleetException;
import com.uptimefleet.common.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import javax.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * JSON file persistence for the master's state.
 *
 * save() writes immediately. requestSave() is debounced: each request pushes
 * the pending write back by the debounce window, and the write that finally
 * happens serializes whatever the supplier returns at that moment. Writes go
 * to a temp file that is then moved over the real one, so a crash mid-write
 * leaves the previous snapshot intact.
 *
 * The debounce deadline is taken from the injected clock; the scheduler is
 * expected to run on the same clock. A write in progress holds only the write
 * lock, so requestSave() never waits for disk I/O.
 */
@Slf4j
public class DurableStore {

    private final Path file;
    private final long debounceMs;
    private final TaskScheduler scheduler;
    private final Clock clock;

    // guards pending and pendingSupplier
    private final Object lock = new Object();
    // serializes file writes
    private final Object writeLock = new Object();
    private ScheduledFuture<?> pending;
    private Supplier<StorageSnapshot> pendingSupplier;

    private final AtomicLong writeCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private volatile long lastWriteAt = 0L;

    public DurableStore(Path file, long debounceMs, TaskScheduler scheduler, Clock clock) {
        this.file = file;
        this.debounceMs = debounceMs;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Read the snapshot. A missing file gives an empty snapshot; an unreadable
     * one is kept aside as .corrupt and also gives an empty snapshot.
     */
    public StorageSnapshot load() {
        if (!Files.exists(file)) {
            log.info("No state file at {}, starting with empty state", file);
            return StorageSnapshot.empty();
        }

        try {
            StorageSnapshot snapshot = JsonUtils.getObjectMapper().readValue(file.toFile(), StorageSnapshot.class);
            if (snapshot == null) {
                log.warn("State file {} is empty, starting with empty state", file);
                return StorageSnapshot.empty();
            }
            snapshot.normalize();
            log.info("Loaded state from {}: {} services, {} slaves (last updated {})", file,
                    snapshot.getServiceConfigs().size(), snapshot.getSlaveStatuses().size(),
                    snapshot.getLastUpdated());
            return snapshot;
        } catch (IOException e) {
            log.warn("========================================");
            log.warn("State file {} is corrupt, starting with empty state: {}", file, e.getMessage());
            preserveCorrupt();
            log.warn("========================================");
            return StorageSnapshot.empty();
        }
    }

    private void preserveCorrupt() {
        Path corrupt = file.resolveSibling(file.getFileName() + ".corrupt");
        try {
            Files.copy(file, corrupt, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Kept a copy of the corrupt state file at {}", corrupt);
        } catch (IOException e) {
            log.error("Could not keep a copy of the corrupt state file {}: {}", file, e.getMessage());
        }
    }

    /**
     * Write the snapshot now, stamping lastUpdated
     *
     * @throws FleetException SNAPSHOT_WRITE_FAILED when the file cannot be written
     */
    public void save(StorageSnapshot snapshot) {
        synchronized (writeLock) {
            snapshot.setLastUpdated(clock.millis());
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            try {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                JsonUtils.getObjectMapper().writeValue(temp.toFile(), snapshot);
                move(temp);
                writeCount.incrementAndGet();
                lastWriteAt = snapshot.getLastUpdated();
                log.debug("Saved state to {} ({} services)", file, snapshot.getServiceStatuses().size());
            } catch (IOException e) {
                failureCount.incrementAndGet();
                throw new FleetException(ErrorCode.SNAPSHOT_WRITE_FAILED,
                        "Failed to write state file " + file + ": " + e.getMessage(), e);
            }
        }
    }

    private void move(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Schedule a write of the latest state after the debounce window,
     * replacing any write already pending
     */
    public void requestSave(Supplier<StorageSnapshot> supplier) {
        synchronized (lock) {
            pendingSupplier = supplier;
            if (pending != null) {
                pending.cancel(false);
            }
            pending = scheduler.schedule(this::flush, clock.instant().plusMillis(debounceMs));
        }
    }

    /**
     * Write the pending state now, if there is any. A failed write is logged and
     * left to the next request.
     */
    public void flush() {
        Supplier<StorageSnapshot> supplier;
        synchronized (lock) {
            supplier = pendingSupplier;
            pendingSupplier = null;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
        if (supplier == null) {
            return;
        }
        // the supplier is read under the write lock so the last write carries the newest state
        synchronized (writeLock) {
            try {
                save(supplier.get());
            } catch (FleetException e) {
                log.error("Persisting state failed, in-memory state stays authoritative: {}", e.getMessage());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Flushing pending state to {}", file);
        flush();
    }

    public boolean hasPendingSave() {
        synchronized (lock) {
            return pendingSupplier != null;
        }
    }

    public Path getFile() {
        return file;
    }

    public long getWriteCount() {
        return writeCount.get();
    }

    public long getFailureCount() {
        return failureCount.get();
    }

    public long getLastWriteAt() {
        return lastWriteAt;
    }
}
