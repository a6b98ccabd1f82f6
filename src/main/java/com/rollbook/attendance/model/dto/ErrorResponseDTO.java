package com.rollbook.attendance.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of every error response.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponseDTO {

    /**
     * Human readable summary.
     */
    private String message;

    /**
     * Underlying error detail, when there is one.
     */
    private String error;

    public static ErrorResponseDTO of(String message) {
        return new ErrorResponseDTO(message, null);
    }

    public static ErrorResponseDTO of(String message, String error) {
        return new ErrorResponseDTO(message, error);
    }
}
