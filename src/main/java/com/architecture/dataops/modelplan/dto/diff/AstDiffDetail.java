package com.architecture.dataops.modelplan.dto.diff;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Column-level diff detail for a single directly changed model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AstDiffDetail {

    private ChangeType changeType;

    @Builder.Default
    private List<String> changedColumns = new ArrayList<>();

    @Builder.Default
    private List<String> addedColumns = new ArrayList<>();

    @Builder.Default
    private List<String> removedColumns = new ArrayList<>();
}
