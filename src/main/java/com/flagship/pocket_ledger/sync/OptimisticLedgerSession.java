package com.flagship.pocket_ledger.sync;

import com.flagship.pocket_ledger.error.LedgerException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Client-local view of the ledger with optimistic updates.
 *
 * A commit shows the local change immediately, then runs the authoritative write. After
 * the write, successful or not, the snapshot is replaced by a fresh load from the stores,
 * so a failed write never leaves the optimistic state behind. The failure is rethrown.
 */
@Slf4j
public class OptimisticLedgerSession {

    private final LedgerSnapshotLoader loader;
    private volatile LedgerSnapshot snapshot;

    public OptimisticLedgerSession(LedgerSnapshotLoader loader) {
        this.loader = loader;
        this.snapshot = loader.load();
    }

    public LedgerSnapshot snapshot() {
        return snapshot;
    }

    /**
     * @param localChange  optimistic edit of the current snapshot
     * @param remoteCommit the authoritative write
     * @return the result of the authoritative write
     * @throws LedgerException the write's failure, after the snapshot has been reloaded
     */
    public synchronized <T> T commit(UnaryOperator<LedgerSnapshot> localChange, Supplier<T> remoteCommit) {
        LedgerSnapshot before = snapshot;
        snapshot = localChange.apply(before);
        T result;
        try {
            result = remoteCommit.get();
        } catch (LedgerException e) {
            log.warn("Ledger write failed ({}), discarding optimistic state: {}", e.getCode(), e.getMessage());
            reloadAfterFailure(before, e);
            throw e;
        }
        snapshot = loader.load();
        return result;
    }

    /**
     * Replaces the snapshot with authoritative state.
     */
    public LedgerSnapshot reload() {
        snapshot = loader.load();
        return snapshot;
    }

    private void reloadAfterFailure(LedgerSnapshot before, LedgerException failure) {
        try {
            snapshot = loader.load();
        } catch (LedgerException reloadFailure) {
            log.error("Reload after failed write also failed: {}", reloadFailure.getMessage());
            snapshot = before;
            failure.addSuppressed(reloadFailure);
        }
    }
}
