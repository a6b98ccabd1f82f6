package com.rollbook.attendance.service;

import java.util.List;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.rollbook.attendance.config.RollbookProperties;
import com.rollbook.attendance.model.domain.Student;
import com.rollbook.attendance.model.domain.Teacher;
import com.rollbook.attendance.model.dto.SeedResultDTO;
import com.rollbook.attendance.model.dto.TeacherDTO;
import com.rollbook.attendance.repository.AttendanceRecordRepository;
import com.rollbook.attendance.repository.StudentRepository;
import com.rollbook.attendance.repository.TeacherRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resets the store to a small demo data set: one teacher, one class of three students.
 * Destroys all existing data.
 */
@Service
@ConditionalOnProperty(prefix = "rollbook.seed", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DemoSeedService {

    private static final List<String> DEMO_STUDENTS = List.of("Aarav Kumar", "Ishita Sharma", "Vihaan Gupta");

    private final TeacherRepository teacherRepository;
    private final StudentRepository studentRepository;
    private final AttendanceRecordRepository recordRepository;
    private final PasswordEncoder passwordEncoder;
    private final RollbookProperties properties;

    @Transactional
    public SeedResultDTO seed() {
        RollbookProperties.SeedConfig config = properties.getSeed();

        recordRepository.deleteAll();
        studentRepository.deleteAll();
        teacherRepository.deleteAll();
        recordRepository.flush();

        Teacher teacher = teacherRepository.save(Teacher.builder()
                .name(config.getTeacherName())
                .email(TeacherAccountService.normalizeEmail(config.getTeacherEmail()))
                .passwordHash(passwordEncoder.encode(config.getTeacherPassword()))
                .build());

        for (int i = 0; i < DEMO_STUDENTS.size(); i++) {
            studentRepository.save(Student.builder()
                    .roll(i + 1)
                    .name(DEMO_STUDENTS.get(i))
                    .className(config.getClassName())
                    .build());
        }

        log.warn("Demo data seeded: all previous data removed, teacher {} and {} students in {}",
                teacher.getEmail(), DEMO_STUDENTS.size(), config.getClassName());

        return SeedResultDTO.builder()
                .message("Seeded")
                .teacher(TeacherDTO.fromEntity(teacher))
                .studentCount(DEMO_STUDENTS.size())
                .build();
    }
}
