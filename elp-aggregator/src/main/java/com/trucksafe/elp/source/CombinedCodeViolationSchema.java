package com.trucksafe.elp.source;

import com.trucksafe.elp.model.ViolationRow;

import java.util.Map;

/**
 * Older inspection feed where the violation is a single code such as
 * "391.11(B)(2)" or "391.11B2". The part is everything before the first dot.
 */
class CombinedCodeViolationSchema extends AliasedSchema<ViolationRow> {

    private static final String[] ID = {"inspection_id", "unique_id"};
    private static final String[] CODE = {"violation_code", "viol_code"};
    private static final String[] DESCRIPTION = {"violation_desc", "viol_desc"};
    private static final String[] DATE = {"inspection_date", "insp_date"};
    private static final String[] OOS = {"oos_indicator", "out_of_service_indicator"};

    @Override
    public String name() {
        return "combined-code";
    }

    @Override
    protected String[][] requiredFields() {
        return new String[][]{ID, CODE};
    }

    @Override
    public ViolationRow adapt(Map<String, String> row) {
        String code = value(row, CODE);
        String part = null;
        String section = null;
        if (code != null) {
            int dot = code.indexOf('.');
            if (dot > 0) {
                part = code.substring(0, dot).trim();
                section = code.substring(dot + 1).trim();
            } else {
                section = code;
            }
        }

        return ViolationRow.builder()
                .inspectionId(value(row, ID))
                .partNumber(part)
                .section(section)
                .description(value(row, DESCRIPTION))
                .rawDate(value(row, DATE))
                .rawOosIndicator(value(row, OOS))
                .build();
    }
}
