package com.flagship.reconciliation.safety;

import lombok.EqualsAndHashCode;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Typed scope of a guarded operation: {@code column IN (values)}.
 *
 * The column name is validated against a strict identifier pattern because it is
 * spliced into SQL; values are always bound as parameters.
 */
@EqualsAndHashCode
public final class RowCondition {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z][a-z0-9_]{0,62}");

    private final String column;
    private final List<Object> values;

    private RowCondition(String column, List<Object> values) {
        this.column = column;
        this.values = values;
    }

    public static RowCondition in(String column, Collection<?> values) {
        requireIdentifier(column);
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Row condition on " + column + " needs at least one value");
        }
        return new RowCondition(column, List.copyOf(values));
    }

    public static RowCondition idIn(Collection<?> ids) {
        return in("id", ids);
    }

    static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + name);
        }
        return name;
    }

    public String column() {
        return column;
    }

    public List<Object> values() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public String toSql() {
        return column + " IN (" + values.stream().map(v -> "?").collect(Collectors.joining(", ")) + ")";
    }

    public Object[] parameters() {
        return values.toArray();
    }

    public String describe() {
        return column + " IN (" + values.stream().map(String::valueOf).collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public String toString() {
        return describe();
    }
}
