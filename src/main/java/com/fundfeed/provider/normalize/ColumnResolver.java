package com.fundfeed.provider.normalize;

import com.fundfeed.exception.SchemaException;
import java.util.List;
import java.util.Optional;

/**
 * Locates logical columns in vendor tables whose headers drift between releases
 * (renamed, prefixed with the period, reordered).
 */
public final class ColumnResolver {

    private ColumnResolver() {}

    /** First alias, in declaration order, that is contained in an acceptable header wins. */
    public static Optional<String> resolve(List<String> columns, ColumnSpec spec) {
        for (String alias : spec.getAliases()) {
            for (String column : columns) {
                if (column.contains(alias) && spec.accepts(column)) {
                    return Optional.of(column);
                }
            }
        }
        return Optional.empty();
    }

    /** Like {@link #resolve} but a missing column is a schema failure. */
    public static String require(List<String> columns, ColumnSpec spec) {
        return resolve(columns, spec)
                .orElseThrow(() -> new SchemaException("No column for '" + spec.getField() + "' (aliases "
                        + spec.getAliases() + ") among " + columns));
    }
}
