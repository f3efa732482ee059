package com.trucksafe.elp.source;

import java.util.Collection;
import java.util.Map;

/**
 * Translates one known upstream row shape into a canonical row type.
 *
 * @param <T> canonical row type
 */
public interface SchemaAdapter<T> {

    String name();

    /** True when the column names identify this schema. Case-insensitive. */
    boolean supports(Collection<String> columns);

    T adapt(Map<String, String> row);
}
