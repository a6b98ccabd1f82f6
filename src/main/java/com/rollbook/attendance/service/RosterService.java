package com.rollbook.attendance.service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import com.rollbook.attendance.exception.RequestValidationException;
import com.rollbook.attendance.model.domain.Student;
import com.rollbook.attendance.model.dto.StudentBatchResultDTO;
import com.rollbook.attendance.model.dto.StudentInputDTO;
import com.rollbook.attendance.repository.StudentRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Class rosters. Students are keyed by (className, roll) and are only ever
 * created or updated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RosterService {

    private final StudentRepository studentRepository;
    private final TransactionTemplate transactionTemplate;

    enum UpsertOutcome {
        INSERTED,
        MODIFIED,
        UNCHANGED
    }

    /**
     * Upsert a batch of students.
     *
     * The batch is checked as a whole first; after that each element is written in
     * its own transaction, so one failing element does not undo the others. For an
     * existing (className, roll) only the provided fields are overwritten.
     */
    public StudentBatchResultDTO upsertBatch(List<StudentInputDTO> students) {
        if (students == null) {
            throw new RequestValidationException("students must be an array");
        }
        for (int i = 0; i < students.size(); i++) {
            StudentInputDTO input = students.get(i);
            if (input == null || input.getRoll() == null || isBlank(input.getName()) || isBlank(input.getClassName())) {
                throw new RequestValidationException("students[" + i + "]: roll, name and className are required");
            }
        }

        int modified = 0;
        int upserted = 0;
        int failed = 0;

        for (StudentInputDTO input : students) {
            try {
                switch (upsertOne(input)) {
                    case INSERTED -> upserted++;
                    case MODIFIED -> modified++;
                    case UNCHANGED -> { }
                }
            } catch (DataAccessException ex) {
                failed++;
                log.error("Failed to upsert student roll={} in {}: {}",
                        input.getRoll(), input.getClassName(), ex.getMessage(), ex);
            }
        }

        log.info("Roster upsert of {} students: {} created, {} modified, {} failed",
                students.size(), upserted, modified, failed);

        return StudentBatchResultDTO.builder()
                .modifiedCount(modified)
                .upsertedCount(upserted)
                .failedCount(failed)
                .build();
    }

    /**
     * List students of one class, or of every class when className is blank,
     * sorted by roll.
     */
    @Transactional(readOnly = true)
    public List<Student> listByClass(String className) {
        if (isBlank(className)) {
            return studentRepository.findAllByOrderByRollAscClassNameAsc();
        }
        return studentRepository.findByClassNameOrderByRollAsc(className.trim());
    }

    /**
     * Resolve student ids to roster entries. Ids without a student are absent from the map.
     */
    @Transactional(readOnly = true)
    public Map<Long, Student> findByIds(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return Map.of();
        }
        return studentRepository.findByIdIn(ids).stream()
                .collect(Collectors.toMap(Student::getId, Function.identity()));
    }

    private UpsertOutcome upsertOne(StudentInputDTO input) {
        try {
            return transactionTemplate.execute(status -> applyUpsert(input.toEntity()));
        } catch (DataIntegrityViolationException ex) {
            String className = input.getClassName().trim();
            if (studentRepository.findByClassNameAndRoll(className, input.getRoll()).isEmpty()) {
                throw ex;
            }
            // another request inserted the same (className, roll) first
            log.debug("Insert race on {} roll {}, retrying as update", className, input.getRoll());
            return transactionTemplate.execute(status -> applyUpsert(input.toEntity()));
        }
    }

    private UpsertOutcome applyUpsert(Student incoming) {
        Optional<Student> existing = studentRepository.findByClassNameAndRoll(incoming.getClassName(), incoming.getRoll());

        if (existing.isPresent()) {
            Student stored = existing.get();
            if (!stored.mergeFrom(incoming)) {
                return UpsertOutcome.UNCHANGED;
            }
            studentRepository.save(stored);
            return UpsertOutcome.MODIFIED;
        }

        studentRepository.saveAndFlush(incoming);
        return UpsertOutcome.INSERTED;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
