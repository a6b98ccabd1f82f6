package com.rollbook.attendance.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import com.rollbook.attendance.repository.StudentRepository;
import com.rollbook.attendance.repository.TeacherRepository;

import lombok.RequiredArgsConstructor;

/**
 * Actuator health indicator for the attendance store.
 *
 * Reports UP with row counts when the store answers queries, DOWN otherwise.
 */
@Component("attendanceStore")
@RequiredArgsConstructor
public class DataStoreHealthIndicator implements HealthIndicator {

    private final TeacherRepository teacherRepository;
    private final StudentRepository studentRepository;

    @Override
    public Health health() {
        try {
            return Health.up()
                    .withDetail("teachers", teacherRepository.count())
                    .withDetail("students", studentRepository.count())
                    .build();
        } catch (DataAccessException e) {
            return Health.down(e)
                    .withDetail("store", "unreachable")
                    .build();
        }
    }
}
