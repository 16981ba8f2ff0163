package com.fundfeed.provider.normalize;

import java.util.List;

/**
 * How to find one logical column among vendor headers.
 *
 * <p>{@code aliases} are tried in order, most specific first; a header matches an alias when
 * it contains it. A matching header must also contain every {@code requireAll} token and none
 * of the {@code exclude} tokens.
 */
public final class ColumnSpec {

    private final String field;
    private final List<String> aliases;
    private final List<String> requireAll;
    private final List<String> exclude;

    private ColumnSpec(String field, List<String> aliases, List<String> requireAll, List<String> exclude) {
        this.field = field;
        this.aliases = List.copyOf(aliases);
        this.requireAll = List.copyOf(requireAll);
        this.exclude = List.copyOf(exclude);
    }

    public static ColumnSpec of(String field, String... aliases) {
        return new ColumnSpec(field, List.of(aliases), List.of(), List.of());
    }

    public ColumnSpec requireAll(String... tokens) {
        return new ColumnSpec(field, aliases, List.of(tokens), exclude);
    }

    public ColumnSpec exclude(String... tokens) {
        return new ColumnSpec(field, aliases, requireAll, List.of(tokens));
    }

    boolean accepts(String column) {
        for (String token : requireAll) {
            if (!column.contains(token)) {
                return false;
            }
        }
        for (String token : exclude) {
            if (column.contains(token)) {
                return false;
            }
        }
        return true;
    }

    public String getField() {
        return field;
    }

    public List<String> getAliases() {
        return aliases;
    }
}
