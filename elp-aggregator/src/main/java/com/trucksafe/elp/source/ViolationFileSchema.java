package com.trucksafe.elp.source;

import com.trucksafe.elp.model.ViolationRow;

import java.util.Map;

/**
 * "Vehicle Inspections and Violations" extract (dataset 876r-jsdb), as a CSV
 * download or as Socrata JSON. Part and section arrive in separate columns.
 *
 * The extract dates rows by CHANGE_DATE; older versions carried INSP_DATE.
 */
class ViolationFileSchema extends AliasedSchema<ViolationRow> {

    private static final String[] ID = {"INSPECTION_ID", "inspection_id"};
    private static final String[] PART = {"PART_NO", "part_no"};
    private static final String[] SECTION = {"PART_NO_SECTION", "part_no_section"};
    private static final String[] DESCRIPTION = {"SECTION_DESC", "VIOLATION_DESC", "viol_desc"};
    private static final String[] DATE = {"CHANGE_DATE", "INSP_DATE", "change_date", "insp_date"};
    private static final String[] OOS = {"OUT_OF_SERVICE_INDICATOR", "OOS_INDICATOR", "out_of_service_indicator"};

    @Override
    public String name() {
        return "violation-file";
    }

    @Override
    protected String[][] requiredFields() {
        return new String[][]{ID, PART, SECTION};
    }

    @Override
    public ViolationRow adapt(Map<String, String> row) {
        return ViolationRow.builder()
                .inspectionId(value(row, ID))
                .partNumber(value(row, PART))
                .section(value(row, SECTION))
                .description(value(row, DESCRIPTION))
                .rawDate(value(row, DATE))
                .rawOosIndicator(value(row, OOS))
                .build();
    }
}
