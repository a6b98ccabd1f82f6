package com.rollbook.attendance.controller.api;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.rollbook.attendance.model.domain.AttendanceRecord;
import com.rollbook.attendance.model.dto.AttendanceRecordDTO;
import com.rollbook.attendance.model.dto.MarkAttendanceRequestDTO;
import com.rollbook.attendance.model.dto.MarkAttendanceResponseDTO;
import com.rollbook.attendance.security.AuthenticatedTeacher;
import com.rollbook.attendance.service.AttendanceLedgerService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * REST API for daily attendance sheets.
 */
@RestController
@RequestMapping("/attendance")
@RequiredArgsConstructor
@Tag(name = "Attendance", description = "Mark and read daily attendance")
public class AttendanceController {

    private final AttendanceLedgerService ledgerService;

    @PostMapping("/mark")
    @Operation(summary = "Mark attendance",
            description = "Store the attendance of a class for a day, replacing any earlier submission")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Attendance stored"),
        @ApiResponse(responseCode = "400", description = "Missing or malformed date, class or entries"),
        @ApiResponse(responseCode = "401", description = "Missing or invalid token")
    })
    public ResponseEntity<MarkAttendanceResponseDTO> mark(
            @Valid @RequestBody MarkAttendanceRequestDTO request,
            @AuthenticationPrincipal AuthenticatedTeacher teacher) {

        AttendanceRecord record = ledgerService.mark(
                request.getDate(),
                request.getClassName(),
                request.getEntries(),
                teacher != null ? teacher.teacherId() : null);

        return ResponseEntity.ok(new MarkAttendanceResponseDTO(record.getId()));
    }

    @GetMapping
    @Operation(summary = "Get attendance", description = "The stored attendance of a class for a day")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Record found"),
        @ApiResponse(responseCode = "400", description = "Missing or malformed parameters"),
        @ApiResponse(responseCode = "404", description = "No attendance marked for that day"),
        @ApiResponse(responseCode = "401", description = "Missing or invalid token")
    })
    public ResponseEntity<AttendanceRecordDTO> get(
            @Parameter(description = "Class name") @RequestParam String className,
            @Parameter(description = "Day, YYYY-MM-DD") @RequestParam String date) {
        return ResponseEntity.ok(AttendanceRecordDTO.fromEntity(ledgerService.find(date, className)));
    }
}
