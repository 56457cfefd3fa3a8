package com.kamisolver.generator;

import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * Monotonically updated best record, the only state generator workers share.
 */
@Slf4j
public class BestRecordTracker {

    @Nullable
    private HardestPuzzleRecord best;

    /**
     * Offer a record; it is kept if it {@link HardestPuzzleRecord#beats beats} the current one.
     *
     * @return true if the record became the new best
     */
    public synchronized boolean offer(HardestPuzzleRecord record) {
        if (!record.beats(best)) {
            return false;
        }
        if (best == null || record.getMoveCount() > best.getMoveCount()) {
            log.info("New hardest puzzle: {} moves ({} regions, topology mask {})",
                    record.getMoveCount(), record.getPuzzle().size(), record.getCandidate().getTopology().getMask());
        }
        best = record;
        return true;
    }

    public synchronized Optional<HardestPuzzleRecord> getBest() {
        return Optional.ofNullable(best);
    }

    /**
     * Move count of the best record, or -1 before any record was offered.
     */
    public synchronized int getBestMoveCount() {
        return best == null ? -1 : best.getMoveCount();
    }
}
