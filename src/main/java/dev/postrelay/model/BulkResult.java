package dev.postrelay.model;

import java.util.List;
import java.util.Map;

/**
 * Per-item outcome of a bulk operation. Items are processed independently.
 *
 * @param succeeded ids the operation was applied to
 * @param failed    reason per id that was rejected
 */
public record BulkResult(List<Long> succeeded, Map<Long, String> failed) {

    public BulkResult {
        succeeded = List.copyOf(succeeded);
        failed = Map.copyOf(failed);
    }
}
