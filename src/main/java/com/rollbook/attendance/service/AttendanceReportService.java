package com.rollbook.attendance.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.rollbook.attendance.config.RollbookProperties;
import com.rollbook.attendance.exception.RequestValidationException;
import com.rollbook.attendance.model.domain.AttendanceEntry;
import com.rollbook.attendance.model.domain.AttendanceRecord;
import com.rollbook.attendance.model.domain.Student;
import com.rollbook.attendance.model.dto.AttendanceSummaryDTO;
import com.rollbook.attendance.model.dto.StudentAttendanceStatsDTO;
import com.rollbook.attendance.repository.AttendanceRecordRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Attendance statistics over an inclusive date range.
 *
 * Only explicit entries count: a student left off a day's sheet is neither
 * present nor absent that day.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttendanceReportService {

    private final AttendanceRecordRepository recordRepository;
    private final RosterService rosterService;
    private final RollbookProperties properties;

    /**
     * Per-student counters.
     */
    static final class Tally {
        int present;
        int total;

        double percentage() {
            return total == 0 ? 0.0 : present * 100.0 / total;
        }

        boolean perfect() {
            return total > 0 && present == total;
        }
    }

    /**
     * Class-wide summary for [from, to].
     */
    @Transactional(readOnly = true)
    public AttendanceSummaryDTO summarize(String className, String from, String to) {
        List<AttendanceRecord> records = loadRecords(className, from, to);
        Map<Long, Tally> tallies = tally(records);

        if (tallies.isEmpty()) {
            log.debug("No attendance entries for {} between {} and {}", className, from, to);
            AttendanceSummaryDTO summary = AttendanceSummaryDTO.empty();
            summary.setDays(records.size());
            return summary;
        }

        RollbookProperties.ReportConfig thresholds = properties.getReport();
        long totalPresent = 0;
        long totalEntries = 0;
        int perfect = 0;
        int below = 0;
        int chronic = 0;
        int tracked = 0;

        for (Tally t : tallies.values()) {
            totalPresent += t.present;
            totalEntries += t.total;
            if (t.total == 0) {
                continue;
            }
            tracked++;
            if (t.perfect()) {
                perfect++;
            }
            double pct = t.percentage();
            if (pct < thresholds.getBelowThresholdPercent()) {
                below++;
            }
            if (pct < thresholds.getChronicAbsenceThresholdPercent()) {
                chronic++;
            }
        }

        double average = totalEntries == 0 ? 0.0 : roundOneDecimal(totalPresent * 100.0 / totalEntries);

        return AttendanceSummaryDTO.builder()
                .average(average)
                .perfectCount(perfect)
                .below75Count(below)
                .chronicAbsenceCount(chronic)
                .days(records.size())
                .totalStudentsTracked(tracked)
                .build();
    }

    /**
     * Per-student breakdown for [from, to], sorted by roll. Entries pointing at a
     * student that is no longer on the roster are reported with resolved=false
     * and sorted last.
     */
    @Transactional(readOnly = true)
    public List<StudentAttendanceStatsDTO> studentStats(String className, String from, String to) {
        Map<Long, Tally> tallies = tally(loadRecords(className, from, to));
        Map<Long, Student> roster = rosterService.findByIds(tallies.keySet());

        RollbookProperties.ReportConfig thresholds = properties.getReport();
        List<StudentAttendanceStatsDTO> result = new ArrayList<>(tallies.size());

        for (Map.Entry<Long, Tally> e : tallies.entrySet()) {
            Long studentId = e.getKey();
            Tally t = e.getValue();
            Student student = roster.get(studentId);
            if (student == null) {
                log.warn("Attendance for {} references unknown student {}", className, studentId);
            }
            double pct = t.percentage();
            result.add(StudentAttendanceStatsDTO.builder()
                    .studentId(studentId)
                    .roll(student != null ? student.getRoll() : null)
                    .name(student != null ? student.getName() : null)
                    .present(t.present)
                    .total(t.total)
                    .percentage(roundOneDecimal(pct))
                    .perfect(t.perfect())
                    .belowThreshold(pct < thresholds.getBelowThresholdPercent())
                    .chronicAbsence(pct < thresholds.getChronicAbsenceThresholdPercent())
                    .resolved(student != null)
                    .build());
        }

        Comparator<StudentAttendanceStatsDTO> byRoll = Comparator.comparing(
                StudentAttendanceStatsDTO::getRoll, Comparator.nullsLast(Comparator.<Integer>naturalOrder()));
        result.sort(byRoll.thenComparing(StudentAttendanceStatsDTO::getStudentId));
        return result;
    }

    private List<AttendanceRecord> loadRecords(String className, String from, String to) {
        if (className == null || className.isBlank()) {
            throw new RequestValidationException("className is required");
        }
        String start = IsoDates.requireIsoDate(from, "from");
        String end = IsoDates.requireIsoDate(to, "to");
        if (start.compareTo(end) > 0) {
            return List.of();
        }
        return recordRepository.findByClassNameAndDateBetweenOrderByDateAsc(className.trim(), start, end);
    }

    static Map<Long, Tally> tally(List<AttendanceRecord> records) {
        Map<Long, Tally> tallies = new LinkedHashMap<>();
        for (AttendanceRecord record : records) {
            for (AttendanceEntry entry : record.getEntries()) {
                if (entry.getStudentId() == null) {
                    continue;
                }
                Tally t = tallies.computeIfAbsent(entry.getStudentId(), id -> new Tally());
                t.total++;
                if (entry.isPresent()) {
                    t.present++;
                }
            }
        }
        return tallies;
    }

    static double roundOneDecimal(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
