package com.architecture.dataops.modelplan.dto.state;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Last successfully materialized date range (inclusive) of an incremental model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Watermark {

    private LocalDate rangeStart;
    private LocalDate rangeEnd;

    public static Watermark of(LocalDate rangeStart, LocalDate rangeEnd) {
        return new Watermark(rangeStart, rangeEnd);
    }

    /**
     * Reject watermarks that cannot describe a materialized range.
     */
    public void validate(String modelName) {
        if (rangeStart == null || rangeEnd == null) {
            throw new IllegalArgumentException("Watermark for model '" + modelName + "' is missing a bound");
        }
        if (rangeStart.isAfter(rangeEnd)) {
            throw new IllegalArgumentException("Watermark for model '" + modelName + "' starts ("
                    + rangeStart + ") after it ends (" + rangeEnd + ")");
        }
    }
}
