package io.tierkeeper.lifecycle;

import io.tierkeeper.model.FileRecord;

import java.util.List;

/**
 * Outcome of matching one rule's candidates against the metadata store.
 *
 * <p>{@code trackedInStore}, {@code meetingViewThreshold} and {@code withCrops} are reported for
 * visibility only and do not influence {@code matched}.
 */
public record FilterResult(
        List<FileRecord> matched,
        int candidates,
        int trackedInStore,
        int meetingViewThreshold,
        int withCrops,
        boolean storeAvailable,
        String error
) {
    public FilterResult {
        matched = matched == null ? List.of() : List.copyOf(matched);
    }

    static FilterResult empty() {
        return new FilterResult(List.of(), 0, 0, 0, 0, true, null);
    }

    static FilterResult storeUnavailable(int candidates, String error) {
        return new FilterResult(List.of(), candidates, 0, 0, 0, false, error);
    }
}
