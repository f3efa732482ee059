package com.trucksafe.elp.source;

import com.trucksafe.elp.model.InspectionRow;
import com.trucksafe.elp.model.ViolationRow;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Where raw rows come from: local CSV exports or the remote API.
 *
 * Both datasets are handed out in batches, so callers hold one batch of raw
 * rows at a time and keep only what they need from it.
 *
 * Implementations own retrieval failures. A source that cannot reach its data
 * returns fewer rows (possibly none) and logs why; it only throws for
 * configuration errors such as a missing local file.
 */
public interface RecordSource {

    /** Short tag used in logs and the run log, e.g. "csv" or "api". */
    String name();

    /**
     * Feed every violation row to {@code consumer}, one batch at a time.
     *
     * @return number of violation rows handed to the consumer
     */
    int forEachViolationBatch(Consumer<List<ViolationRow>> consumer);

    /**
     * Feed inspection rows to {@code consumer} one batch at a time. The
     * consumer returns {@code false} to stop early; the source also stops
     * when it runs out of rows.
     *
     * @return number of inspection rows handed to the consumer
     */
    int forEachInspectionBatch(Predicate<List<InspectionRow>> consumer);
}
