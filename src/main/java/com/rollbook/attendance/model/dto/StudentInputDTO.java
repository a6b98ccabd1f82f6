package com.rollbook.attendance.model.dto;

import com.rollbook.attendance.model.domain.Student;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One element of a roster upsert batch. Optional fields left null keep their
 * stored value when the student already exists.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentInputDTO {

    @NotNull(message = "roll is required")
    private Integer roll;

    @NotBlank(message = "name is required")
    @Size(max = 120)
    private String name;

    @NotBlank(message = "className is required")
    @Size(max = 64)
    private String className;

    @Size(max = 40)
    private String parentPhone;

    public Student toEntity() {
        return Student.builder()
                .roll(roll)
                .name(name.trim())
                .className(className.trim())
                .parentPhone(parentPhone)
                .build();
    }
}
