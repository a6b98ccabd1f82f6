package com.rollbook.attendance.controller.api;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.rollbook.attendance.model.dto.StudentBatchRequestDTO;
import com.rollbook.attendance.model.dto.StudentBatchResultDTO;
import com.rollbook.attendance.model.dto.StudentDTO;
import com.rollbook.attendance.service.RosterService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for class rosters.
 */
@RestController
@RequestMapping("/students")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Students", description = "Class rosters")
public class StudentController {

    private final RosterService rosterService;

    @PostMapping
    @Operation(summary = "Upsert students", description = "Create or update students keyed by class and roll number")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Batch applied"),
        @ApiResponse(responseCode = "400", description = "Missing array or incomplete student"),
        @ApiResponse(responseCode = "401", description = "Missing or invalid token")
    })
    public ResponseEntity<StudentBatchResultDTO> upsert(@Valid @RequestBody StudentBatchRequestDTO request) {
        log.debug("Upserting {} students", request.getStudents().size());
        return ResponseEntity.ok(rosterService.upsertBatch(request.getStudents()));
    }

    @GetMapping
    @Operation(summary = "List students", description = "Students of a class sorted by roll number")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Students returned"),
        @ApiResponse(responseCode = "401", description = "Missing or invalid token")
    })
    public ResponseEntity<List<StudentDTO>> list(
            @Parameter(description = "Class to list; all classes when omitted")
            @RequestParam(required = false) String className) {
        List<StudentDTO> students = rosterService.listByClass(className).stream()
                .map(StudentDTO::fromEntity)
                .toList();
        return ResponseEntity.ok(students);
    }
}
