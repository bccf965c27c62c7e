package com.architecture.dataops.modelplan.dto.plan;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Inclusive date range scoping an incremental run.
 */
@Data
@NoArgsConstructor
public class DateRange {

    private LocalDate start;
    private LocalDate end;

    private DateRange(LocalDate start, LocalDate end) {
        this.start = start;
        this.end = end;
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("DateRange bounds must not be null");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("DateRange start (" + start + ") must be <= end (" + end + ")");
        }
        return new DateRange(start, end);
    }
}
