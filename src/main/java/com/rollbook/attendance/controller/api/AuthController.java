package com.rollbook.attendance.controller.api;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.rollbook.attendance.model.domain.Teacher;
import com.rollbook.attendance.model.dto.LoginRequestDTO;
import com.rollbook.attendance.model.dto.LoginResponseDTO;
import com.rollbook.attendance.model.dto.RegisterTeacherRequestDTO;
import com.rollbook.attendance.model.dto.RegisterTeacherResponseDTO;
import com.rollbook.attendance.model.dto.TeacherDTO;
import com.rollbook.attendance.service.AccessTokenService;
import com.rollbook.attendance.service.TeacherAccountService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Teacher registration and login.
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Authentication", description = "Teacher accounts and access tokens")
public class AuthController {

    private final TeacherAccountService accountService;
    private final AccessTokenService tokenService;

    @PostMapping("/register-teacher")
    @Operation(summary = "Register a teacher", description = "Create a teacher account")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Teacher registered"),
        @ApiResponse(responseCode = "400", description = "Missing fields or email already registered")
    })
    public ResponseEntity<RegisterTeacherResponseDTO> register(@Valid @RequestBody RegisterTeacherRequestDTO request) {
        Teacher teacher = accountService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new RegisterTeacherResponseDTO(TeacherDTO.fromEntity(teacher)));
    }

    @PostMapping("/login")
    @Operation(summary = "Log in", description = "Exchange email and password for a bearer token")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Token issued"),
        @ApiResponse(responseCode = "400", description = "Missing fields or invalid credentials")
    })
    public ResponseEntity<LoginResponseDTO> login(@Valid @RequestBody LoginRequestDTO request) {
        Teacher teacher = accountService.authenticate(request.getEmail(), request.getPassword());
        log.info("Teacher {} logged in", teacher.getId());

        return ResponseEntity.ok(LoginResponseDTO.builder()
                .token(tokenService.issueToken(teacher))
                .teacher(TeacherDTO.fromEntity(teacher))
                .build());
    }
}
