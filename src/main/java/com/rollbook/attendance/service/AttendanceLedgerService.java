package com.rollbook.attendance.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import com.rollbook.attendance.exception.AttendanceRecordNotFoundException;
import com.rollbook.attendance.exception.RequestValidationException;
import com.rollbook.attendance.model.domain.AttendanceEntry;
import com.rollbook.attendance.model.domain.AttendanceRecord;
import com.rollbook.attendance.model.dto.AttendanceEntryDTO;
import com.rollbook.attendance.repository.AttendanceRecordRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * The attendance ledger: one record per class per day.
 *
 * Marking is an upsert keyed by (date, className). The store creates the row
 * with insert-or-ignore against its unique constraint, then the row is locked and
 * its entries replaced wholesale, so concurrent marks of the same day converge on
 * one record and the last writer's entries win.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttendanceLedgerService {

    static final int MAX_MARK_ATTEMPTS = 3;
    private static final long RETRY_BACKOFF_MS = 25;

    private final AttendanceRecordRepository recordRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * Record attendance for a class on a day, replacing whatever was recorded before.
     *
     * @param date      day in YYYY-MM-DD form
     * @param className class the sheet belongs to
     * @param entries   one entry per student; must not be empty
     * @param markedBy  id of the teacher submitting, may be null
     * @return the stored record; its id is stable across resubmissions
     * @throws RequestValidationException if any input is malformed; nothing is written then
     */
    public AttendanceRecord mark(String date, String className, List<AttendanceEntryDTO> entries, Long markedBy) {
        String day = IsoDates.requireIsoDate(date, "date");
        if (className == null || className.isBlank()) {
            throw new RequestValidationException("className is required");
        }
        List<AttendanceEntry> newEntries = toEntries(entries);
        String clazz = className.trim();

        for (int attempt = 1; ; attempt++) {
            try {
                AttendanceRecord saved = transactionTemplate.execute(status -> upsert(day, clazz, newEntries, markedBy));
                log.info("Marked attendance for {} on {}: {} entries (record {})",
                        clazz, day, newEntries.size(), saved.getId());
                return saved;
            } catch (TransientDataAccessException | DataIntegrityViolationException ex) {
                // a concurrent first mark of the same day can surface as either
                if (attempt >= MAX_MARK_ATTEMPTS) {
                    log.error("Giving up marking {} on {} after {} attempts", clazz, day, attempt, ex);
                    throw ex;
                }
                log.warn("Concurrent mark of {} on {} (attempt {}/{}): {}",
                        clazz, day, attempt, MAX_MARK_ATTEMPTS, ex.getMessage());
                backOff(attempt);
            }
        }
    }

    /**
     * Load the record of a class for a day.
     */
    @Transactional(readOnly = true)
    public AttendanceRecord find(String date, String className) {
        String day = IsoDates.requireIsoDate(date, "date");
        if (className == null || className.isBlank()) {
            throw new RequestValidationException("className is required");
        }
        return recordRepository.findByDateAndClassName(day, className.trim())
                .orElseThrow(() -> new AttendanceRecordNotFoundException(className.trim(), day));
    }

    private AttendanceRecord upsert(String date, String className, List<AttendanceEntry> entries, Long markedBy) {
        LocalDateTime now = LocalDateTime.now(clock);
        int created = recordRepository.insertIfAbsent(date, className, now);

        AttendanceRecord record = recordRepository.findForUpdate(date, className)
                .orElseThrow(() -> new IllegalStateException(
                        "Attendance record for " + className + " on " + date + " missing after upsert"));

        if (created == 1) {
            log.debug("Created attendance record {} for {} on {}", record.getId(), className, date);
        }

        record.replaceEntries(new ArrayList<>(entries), markedBy, now);
        return recordRepository.save(record);
    }

    private List<AttendanceEntry> toEntries(List<AttendanceEntryDTO> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new RequestValidationException("entries must not be empty");
        }

        List<AttendanceEntry> result = new ArrayList<>(entries.size());
        Set<Long> seen = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            AttendanceEntryDTO entry = entries.get(i);
            if (entry == null || entry.getStudentId() == null) {
                throw new RequestValidationException("entries[" + i + "].studentId is required");
            }
            if (entry.getPresent() == null) {
                throw new RequestValidationException("entries[" + i + "].present must be true or false");
            }
            if (!seen.add(entry.getStudentId())) {
                throw new RequestValidationException(
                        "entries contain student " + entry.getStudentId() + " more than once");
            }
            result.add(entry.toEntity());
        }
        return result;
    }

    private void backOff(int attempt) {
        try {
            Thread.sleep(RETRY_BACKOFF_MS * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while retrying attendance mark", e);
        }
    }
}
