package com.trucksafe.elp.source;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Base for schemas whose logical fields appear under several column names
 * across dataset versions (PART_NO vs part_no, INSP_DATE vs inspection_date).
 */
abstract class AliasedSchema<T> implements SchemaAdapter<T> {

    /** Columns that must all be present (under any alias) for {@link #supports}. */
    protected abstract String[][] requiredFields();

    @Override
    public boolean supports(Collection<String> columns) {
        Set<String> present = columns.stream()
                .filter(c -> c != null)
                .map(AliasedSchema::key)
                .collect(Collectors.toSet());
        for (String[] aliases : requiredFields()) {
            boolean found = false;
            for (String alias : aliases) {
                if (present.contains(key(alias))) {
                    found = true;
                    break;
                }
            }
            if (!found) return false;
        }
        return true;
    }

    /**
     * First non-blank value among the aliases, trimmed; null if none.
     * Keys are matched ignoring case.
     */
    protected static String value(Map<String, String> row, String... aliases) {
        for (String alias : aliases) {
            String v = row.get(alias);
            if (v == null) {
                v = lookupIgnoringCase(row, alias);
            }
            if (v != null && !v.isBlank()) {
                return v.trim();
            }
        }
        return null;
    }

    private static String lookupIgnoringCase(Map<String, String> row, String alias) {
        String wanted = key(alias);
        for (Map.Entry<String, String> e : row.entrySet()) {
            if (e.getKey() != null && key(e.getKey()).equals(wanted)) {
                return e.getValue();
            }
        }
        return null;
    }

    private static String key(String column) {
        // Excel exports prefix the first header with a byte order mark
        return column.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
    }
}
