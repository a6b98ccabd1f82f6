package com.rollbook.attendance.model.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for the bulk roster upsert.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentBatchRequestDTO {

    @NotNull(message = "students must be an array")
    private List<@Valid @NotNull StudentInputDTO> students;
}
