package com.rollbook.attendance.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a bulk roster upsert. Each element is counted exactly once.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentBatchResultDTO {

    /**
     * Existing students whose stored values changed.
     */
    private int modifiedCount;

    /**
     * Students created by this batch.
     */
    private int upsertedCount;

    /**
     * Elements that could not be written.
     */
    private int failedCount;
}
