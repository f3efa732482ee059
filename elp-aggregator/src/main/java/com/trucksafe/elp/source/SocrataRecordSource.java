package com.trucksafe.elp.source;

import com.trucksafe.elp.config.ElpAggregatorProperties;
import com.trucksafe.elp.model.InspectionRow;
import com.trucksafe.elp.model.ViolationRow;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Pages through the violations and inspections datasets on Socrata.
 *
 * A page that still fails after the client's retries ends that dataset's
 * fetch: the rows already retrieved are kept and the run carries on with
 * them. A short page (fewer rows than the page size) means the dataset is
 * exhausted.
 */
@Slf4j
public class SocrataRecordSource implements RecordSource {

    /** Socrata's row id, the only order that keeps offset paging stable. */
    private static final String STABLE_ORDER = ":id";

    private final SocrataApiClient client;
    private final ElpAggregatorProperties.Source.Api api;
    private final SchemaRegistry schemas;

    public SocrataRecordSource(SocrataApiClient client, ElpAggregatorProperties.Source.Api api, SchemaRegistry schemas) {
        this.client = client;
        this.api = api;
        this.schemas = schemas;
    }

    @Override
    public String name() {
        return "api";
    }

    @Override
    public int forEachViolationBatch(Consumer<List<ViolationRow>> consumer) {
        SchemaAdapter<ViolationRow> schema = null;
        int delivered = 0;
        int offset = 0;

        for (int page = 0; page < api.getMaxViolationPages(); page++) {
            log.info("Fetching violations page {} (offset {})", page + 1, offset);
            List<Map<String, Object>> raw = fetch(api.getViolationsDataset(), api.getViolationsWhere(), offset);
            if (raw == null || raw.isEmpty()) break;

            if (schema == null) {
                schema = schemas.violationSchema(columnsOf(raw));
                log.info("Violations dataset uses schema '{}'", schema.name());
            }
            List<ViolationRow> batch = new ArrayList<>(raw.size());
            for (Map<String, Object> r : raw) {
                batch.add(schema.adapt(asText(r)));
            }
            delivered += batch.size();
            consumer.accept(batch);

            if (raw.size() < api.getPageSize()) break;
            offset += api.getPageSize();
        }

        log.info("Fetched {} violation rows from {}", delivered, api.getViolationsDataset());
        return delivered;
    }

    @Override
    public int forEachInspectionBatch(Predicate<List<InspectionRow>> consumer) {
        SchemaAdapter<InspectionRow> schema = null;
        int delivered = 0;
        int offset = 0;

        for (int page = 0; page < api.getMaxInspectionPages(); page++) {
            log.info("Fetching inspections page {} (offset {})", page + 1, offset);
            List<Map<String, Object>> raw = fetch(api.getInspectionsDataset(), api.getInspectionsWhere(), offset);
            if (raw == null || raw.isEmpty()) break;

            if (schema == null) {
                schema = schemas.inspectionSchema(columnsOf(raw));
                log.info("Inspections dataset uses schema '{}'", schema.name());
            }
            List<InspectionRow> batch = new ArrayList<>(raw.size());
            for (Map<String, Object> r : raw) {
                batch.add(schema.adapt(asText(r)));
            }
            delivered += batch.size();

            if (!consumer.test(batch)) {
                log.info("Join satisfied after {} inspections, not fetching further pages", delivered);
                break;
            }
            if (raw.size() < api.getPageSize()) break;
            offset += api.getPageSize();
        }

        return delivered;
    }

    /** @return the page, or null when the source gave up after retries */
    private List<Map<String, Object>> fetch(String dataset, String where, int offset) {
        try {
            return client.fetchPage(dataset, where, STABLE_ORDER, offset, api.getPageSize());
        } catch (RuntimeException e) {
            log.warn("Giving up on {} at offset {} after retries, continuing with rows fetched so far: {}",
                    dataset, offset, e.getMessage());
            return null;
        }
    }

    private static Set<String> columnsOf(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, Object> r : rows) {
            columns.addAll(r.keySet());
        }
        return columns;
    }

    private static Map<String, String> asText(Map<String, Object> row) {
        Map<String, String> text = new LinkedHashMap<>(row.size() * 2);
        row.forEach((k, v) -> text.put(k, v == null ? null : String.valueOf(v)));
        return text;
    }
}
