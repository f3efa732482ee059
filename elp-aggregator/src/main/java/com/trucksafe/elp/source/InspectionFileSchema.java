package com.trucksafe.elp.source;

import com.trucksafe.elp.model.InspectionRow;

import java.util.Map;

/**
 * "Vehicle Inspection File" extract (dataset fx4q-ay7w). Carries the report
 * state directly, which is why the join goes through it.
 */
class InspectionFileSchema extends AliasedSchema<InspectionRow> {

    private static final String[] ID = {"INSPECTION_ID", "inspection_id"};
    private static final String[] REGION = {"REPORT_STATE", "report_state", "STATE", "state"};
    private static final String[] DATE = {"INSP_DATE", "insp_date", "INSPECTION_DATE", "inspection_date"};

    @Override
    public String name() {
        return "inspection-file";
    }

    @Override
    protected String[][] requiredFields() {
        return new String[][]{ID, REGION};
    }

    @Override
    public InspectionRow adapt(Map<String, String> row) {
        return InspectionRow.builder()
                .inspectionId(value(row, ID))
                .region(value(row, REGION))
                .rawDate(value(row, DATE))
                .build();
    }
}
