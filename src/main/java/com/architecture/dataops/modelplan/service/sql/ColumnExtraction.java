package com.architecture.dataops.modelplan.service.sql;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Referenced columns of a statement, or the reason they could not be extracted.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ColumnExtraction {

    private final boolean parsed;
    private final Set<String> columns;
    private final String failureReason;

    public static ColumnExtraction of(Set<String> columns) {
        return new ColumnExtraction(true, Collections.unmodifiableSet(new TreeSet<>(columns)), null);
    }

    public static ColumnExtraction failed(String reason) {
        return new ColumnExtraction(false, Collections.emptySet(), reason);
    }
}
