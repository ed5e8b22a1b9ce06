package com.codesniff.corpus;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.codesniff.ingest.SymbolKind;

/**
 * Outcome of one indexing run. {@code processed} counts symbols committed by this run,
 * {@code skipped} unchanged or duplicate ones, {@code cancelled} those never attempted because the
 * run was cancelled, and {@code removed} symbols pruned by a file sync. Kind counts, line totals and
 * files cover committed symbols only.
 */
public record RunStats(
        int submitted,
        int processed,
        int skipped,
        int failed,
        int cancelled,
        int removed,
        Map<SymbolKind, Integer> countsByKind,
        long totalLines,
        int files,
        Duration elapsed,
        List<SymbolFailure> failures) {

    public boolean wasCancelled() {
        return cancelled > 0;
    }

    /**
     * Adds failures found before the run started, such as files that could not be parsed. They
     * are listed ahead of the run's own failures.
     */
    public RunStats withFailuresBefore(List<SymbolFailure> earlier) {
        if (earlier.isEmpty()) {
            return this;
        }
        List<SymbolFailure> all = new ArrayList<>(earlier);
        all.addAll(failures);
        return new RunStats(submitted, processed, skipped, failed + earlier.size(), cancelled, removed,
                countsByKind, totalLines, files, elapsed, List.copyOf(all));
    }
}
