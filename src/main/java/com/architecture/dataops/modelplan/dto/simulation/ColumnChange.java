package com.architecture.dataops.modelplan.dto.simulation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A hypothetical change to one output column of the source model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnChange {

    private ChangeAction action;
    private String columnName;

    // RENAME only
    private String newName;

    // TYPE_CHANGE only
    private String oldType;
    private String newType;

    public static ColumnChange remove(String columnName) {
        return ColumnChange.builder().action(ChangeAction.REMOVE).columnName(columnName).build();
    }

    public static ColumnChange rename(String columnName, String newName) {
        return ColumnChange.builder().action(ChangeAction.RENAME).columnName(columnName).newName(newName).build();
    }

    public static ColumnChange typeChange(String columnName, String oldType, String newType) {
        return ColumnChange.builder()
                .action(ChangeAction.TYPE_CHANGE)
                .columnName(columnName)
                .oldType(oldType)
                .newType(newType)
                .build();
    }
}
