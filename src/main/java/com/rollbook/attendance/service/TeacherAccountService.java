package com.rollbook.attendance.service;

import java.util.Locale;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.rollbook.attendance.exception.DuplicateEmailException;
import com.rollbook.attendance.exception.InvalidCredentialsException;
import com.rollbook.attendance.exception.RequestValidationException;
import com.rollbook.attendance.model.domain.Teacher;
import com.rollbook.attendance.model.dto.RegisterTeacherRequestDTO;
import com.rollbook.attendance.repository.TeacherRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Teacher registration and credential checks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TeacherAccountService {

    private final TeacherRepository teacherRepository;
    private final PasswordEncoder passwordEncoder;

    /**
     * Create a teacher account. Throws DuplicateEmailException if the email is taken,
     * including when a concurrent registration wins the unique constraint.
     */
    @Transactional
    public Teacher register(RegisterTeacherRequestDTO request) {
        if (isBlank(request.getName()) || isBlank(request.getEmail()) || isBlank(request.getPassword())) {
            throw new RequestValidationException("name, email and password are required");
        }

        String email = normalizeEmail(request.getEmail());
        if (teacherRepository.existsByEmail(email)) {
            throw new DuplicateEmailException(email);
        }

        Teacher teacher = Teacher.builder()
                .name(request.getName().trim())
                .email(email)
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .phone(request.getPhone())
                .subject(request.getSubject())
                .build();

        try {
            teacher = teacherRepository.saveAndFlush(teacher);
        } catch (DataIntegrityViolationException ex) {
            throw new DuplicateEmailException(email, ex);
        }

        log.info("Registered teacher id={} email={}", teacher.getId(), teacher.getEmail());
        return teacher;
    }

    /**
     * Check an email/password pair. Unknown email and wrong password fail the same way.
     */
    @Transactional(readOnly = true)
    public Teacher authenticate(String email, String password) {
        if (isBlank(email) || isBlank(password)) {
            throw new RequestValidationException("email and password are required");
        }

        Teacher teacher = teacherRepository.findByEmail(normalizeEmail(email))
                .orElseThrow(() -> {
                    log.info("Login rejected: no teacher with email {}", email);
                    return new InvalidCredentialsException();
                });

        if (!passwordEncoder.matches(password, teacher.getPasswordHash())) {
            log.info("Login rejected: wrong password for teacher {}", teacher.getId());
            throw new InvalidCredentialsException();
        }

        return teacher;
    }

    static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
