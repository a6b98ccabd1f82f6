package com.rollbook.attendance.controller.api;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.rollbook.attendance.model.dto.AttendanceSummaryDTO;
import com.rollbook.attendance.model.dto.StudentAttendanceStatsDTO;
import com.rollbook.attendance.service.AttendanceReportService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * Attendance reports over an inclusive date range.
 */
@RestController
@RequestMapping("/reports")
@RequiredArgsConstructor
@Tag(name = "Reports", description = "Attendance statistics")
public class ReportController {

    private final AttendanceReportService reportService;

    @GetMapping("/summary")
    @Operation(summary = "Class summary", description = "Average attendance and threshold counts for a class")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Summary computed"),
        @ApiResponse(responseCode = "400", description = "Missing or malformed parameters"),
        @ApiResponse(responseCode = "401", description = "Missing or invalid token")
    })
    public ResponseEntity<AttendanceSummaryDTO> summary(
            @Parameter(description = "Class name") @RequestParam String className,
            @Parameter(description = "First day, YYYY-MM-DD") @RequestParam String from,
            @Parameter(description = "Last day, YYYY-MM-DD") @RequestParam String to) {
        return ResponseEntity.ok(reportService.summarize(className, from, to));
    }

    @GetMapping("/students")
    @Operation(summary = "Per-student breakdown", description = "Attendance of each student of a class")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Breakdown computed"),
        @ApiResponse(responseCode = "400", description = "Missing or malformed parameters"),
        @ApiResponse(responseCode = "401", description = "Missing or invalid token")
    })
    public ResponseEntity<List<StudentAttendanceStatsDTO>> students(
            @Parameter(description = "Class name") @RequestParam String className,
            @Parameter(description = "First day, YYYY-MM-DD") @RequestParam String from,
            @Parameter(description = "Last day, YYYY-MM-DD") @RequestParam String to) {
        return ResponseEntity.ok(reportService.studentStats(className, from, to));
    }
}
