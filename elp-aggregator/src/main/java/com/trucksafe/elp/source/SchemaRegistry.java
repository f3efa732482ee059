package com.trucksafe.elp.source;

import com.trucksafe.elp.model.InspectionRow;
import com.trucksafe.elp.model.ViolationRow;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * Known upstream schemas, tried in registration order. The first adapter
 * whose required columns are all present wins.
 */
@Component
public class SchemaRegistry {

    private final List<SchemaAdapter<ViolationRow>> violationSchemas = List.of(
            new ViolationFileSchema(),
            new CombinedCodeViolationSchema());

    private final List<SchemaAdapter<InspectionRow>> inspectionSchemas = List.of(
            new InspectionFileSchema());

    public SchemaAdapter<ViolationRow> violationSchema(Collection<String> columns) {
        return pick(violationSchemas, columns, "violation");
    }

    public SchemaAdapter<InspectionRow> inspectionSchema(Collection<String> columns) {
        return pick(inspectionSchemas, columns, "inspection");
    }

    private static <T> SchemaAdapter<T> pick(List<SchemaAdapter<T>> schemas,
                                             Collection<String> columns,
                                             String kind) {
        for (SchemaAdapter<T> schema : schemas) {
            if (schema.supports(columns)) {
                return schema;
            }
        }
        throw new UnknownSchemaException("No " + kind + " schema matches columns " + columns);
    }

    public static class UnknownSchemaException extends RuntimeException {
        public UnknownSchemaException(String message) {
            super(message);
        }
    }
}
