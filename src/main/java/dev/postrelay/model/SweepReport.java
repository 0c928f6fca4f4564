package dev.postrelay.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one retention sweep.
 *
 * @param examined       items past the retention window
 * @param cleared        items whose media reference was cleared
 * @param filesDeleted   artifacts actually removed from storage
 * @param filesMissing   artifacts that were already gone
 * @param bytesFreed     total size of the removed artifacts
 * @param failedItemIds  items whose artifact could not be removed or whose row could not be updated
 * @param sessionsPurged old ingestion sessions deleted
 */
public record SweepReport(int examined,
                          int cleared,
                          int filesDeleted,
                          int filesMissing,
                          long bytesFreed,
                          List<Long> failedItemIds,
                          long sessionsPurged,
                          Instant sweptAt) {

    public static SweepReport skipped(Instant now) {
        return new SweepReport(0, 0, 0, 0, 0, List.of(), 0, now);
    }
}
