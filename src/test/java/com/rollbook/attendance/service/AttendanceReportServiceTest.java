package com.rollbook.attendance.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.rollbook.attendance.config.RollbookProperties;
import com.rollbook.attendance.exception.RequestValidationException;
import com.rollbook.attendance.model.domain.AttendanceEntry;
import com.rollbook.attendance.model.domain.AttendanceRecord;
import com.rollbook.attendance.model.domain.Student;
import com.rollbook.attendance.model.dto.AttendanceSummaryDTO;
import com.rollbook.attendance.model.dto.StudentAttendanceStatsDTO;
import com.rollbook.attendance.repository.AttendanceRecordRepository;

@ExtendWith(MockitoExtension.class)
class AttendanceReportServiceTest {

    private static final String CLASS = "Class 5-A";

    @Mock
    private AttendanceRecordRepository recordRepository;

    @Mock
    private RosterService rosterService;

    private AttendanceReportService reportService;

    @BeforeEach
    void setUp() {
        reportService = new AttendanceReportService(recordRepository, rosterService, new RollbookProperties());
    }

    @Test
    void summarizesPresentAndAbsentEntriesPerStudent() {
        givenRecords(
                record("2024-06-03", entry(1L, true), entry(2L, false)),
                record("2024-06-04", entry(1L, true), entry(2L, true)),
                record("2024-06-05", entry(1L, false)));

        AttendanceSummaryDTO summary = reportService.summarize(CLASS, "2024-06-01", "2024-06-30");

        assertThat(summary.getAverage()).isEqualTo(60.0);
        assertThat(summary.getPerfectCount()).isZero();
        assertThat(summary.getBelow75Count()).isEqualTo(2);
        // student 2 sits at exactly 50%
        assertThat(summary.getChronicAbsenceCount()).isZero();
        assertThat(summary.getDays()).isEqualTo(3);
        assertThat(summary.getTotalStudentsTracked()).isEqualTo(2);
    }

    @Test
    void chronicAbsenceIsAlsoCountedAsBelowThreshold() {
        givenRecords(
                record("2024-06-03", entry(1L, true), entry(2L, false)),
                record("2024-06-04", entry(1L, true), entry(2L, false)),
                record("2024-06-05", entry(1L, true), entry(2L, true)));

        AttendanceSummaryDTO summary = reportService.summarize(CLASS, "2024-06-01", "2024-06-30");

        assertThat(summary.getPerfectCount()).isEqualTo(1);
        assertThat(summary.getBelow75Count()).isEqualTo(1);
        assertThat(summary.getChronicAbsenceCount()).isEqualTo(1);
        assertThat(summary.getAverage()).isEqualTo(66.7);
    }

    @Test
    void noRecordsYieldsZeroSummary() {
        givenRecords();

        AttendanceSummaryDTO summary = reportService.summarize(CLASS, "2024-01-01", "2024-01-31");

        assertThat(summary).isEqualTo(AttendanceSummaryDTO.empty());
    }

    @Test
    void recordsWithoutEntriesCountAsDaysOnly() {
        givenRecords(record("2024-06-03"));

        AttendanceSummaryDTO summary = reportService.summarize(CLASS, "2024-06-01", "2024-06-30");

        assertThat(summary.getDays()).isEqualTo(1);
        assertThat(summary.getAverage()).isZero();
        assertThat(summary.getTotalStudentsTracked()).isZero();
    }

    @Test
    void studentMissingFromADayIsNotAbsentThatDay() {
        givenRecords(
                record("2024-06-03", entry(1L, true), entry(2L, true)),
                record("2024-06-04", entry(1L, true)));

        AttendanceSummaryDTO summary = reportService.summarize(CLASS, "2024-06-01", "2024-06-30");

        assertThat(summary.getPerfectCount()).isEqualTo(2);
        assertThat(summary.getBelow75Count()).isZero();
        assertThat(summary.getAverage()).isEqualTo(100.0);
    }

    @Test
    void reversedRangeMatchesNothing() {
        AttendanceSummaryDTO summary = reportService.summarize(CLASS, "2024-06-30", "2024-06-01");

        assertThat(summary).isEqualTo(AttendanceSummaryDTO.empty());
        verify(recordRepository, never()).findByClassNameAndDateBetweenOrderByDateAsc(anyString(), anyString(), anyString());
    }

    @Test
    void rejectsMalformedRangeBounds() {
        assertThatThrownBy(() -> reportService.summarize(CLASS, "2024-6-1", "2024-06-30"))
                .isInstanceOf(RequestValidationException.class)
                .hasMessageContaining("from");
        assertThatThrownBy(() -> reportService.summarize(CLASS, "2024-06-01", null))
                .isInstanceOf(RequestValidationException.class)
                .hasMessageContaining("to");
        assertThatThrownBy(() -> reportService.summarize(" ", "2024-06-01", "2024-06-30"))
                .isInstanceOf(RequestValidationException.class)
                .hasMessageContaining("className");
    }

    @Test
    void thresholdsComeFromConfiguration() {
        RollbookProperties properties = new RollbookProperties();
        properties.getReport().setBelowThresholdPercent(90.0);
        properties.getReport().setChronicAbsenceThresholdPercent(70.0);
        reportService = new AttendanceReportService(recordRepository, rosterService, properties);
        givenRecords(
                record("2024-06-03", entry(1L, true)),
                record("2024-06-04", entry(1L, true)),
                record("2024-06-05", entry(1L, false)));

        AttendanceSummaryDTO summary = reportService.summarize(CLASS, "2024-06-01", "2024-06-30");

        assertThat(summary.getBelow75Count()).isEqualTo(1);
        assertThat(summary.getChronicAbsenceCount()).isEqualTo(1);
    }

    @Test
    void studentStatsFlagUnknownStudentsAndSortThemLast() {
        givenRecords(
                record("2024-06-03", entry(9L, true), entry(2L, false), entry(1L, true)),
                record("2024-06-04", entry(9L, false), entry(2L, true), entry(1L, true)));
        Student first = Student.builder().id(1L).roll(1).name("Aarav Kumar").className(CLASS).build();
        Student second = Student.builder().id(2L).roll(2).name("Ishita Sharma").className(CLASS).build();
        when(rosterService.findByIds(any())).thenReturn(Map.of(1L, first, 2L, second));

        List<StudentAttendanceStatsDTO> stats = reportService.studentStats(CLASS, "2024-06-01", "2024-06-30");

        assertThat(stats).extracting(StudentAttendanceStatsDTO::getStudentId).containsExactly(1L, 2L, 9L);

        StudentAttendanceStatsDTO aarav = stats.get(0);
        assertThat(aarav.isResolved()).isTrue();
        assertThat(aarav.getName()).isEqualTo("Aarav Kumar");
        assertThat(aarav.isPerfect()).isTrue();
        assertThat(aarav.getPercentage()).isEqualTo(100.0);

        StudentAttendanceStatsDTO ishita = stats.get(1);
        assertThat(ishita.getPresent()).isEqualTo(1);
        assertThat(ishita.getTotal()).isEqualTo(2);
        assertThat(ishita.isBelowThreshold()).isTrue();
        assertThat(ishita.isChronicAbsence()).isFalse();

        StudentAttendanceStatsDTO unknown = stats.get(2);
        assertThat(unknown.isResolved()).isFalse();
        assertThat(unknown.getRoll()).isNull();
        assertThat(unknown.getTotal()).isEqualTo(2);
    }

    private void givenRecords(AttendanceRecord... records) {
        when(recordRepository.findByClassNameAndDateBetweenOrderByDateAsc(anyString(), anyString(), anyString()))
                .thenReturn(List.of(records));
    }

    private static AttendanceRecord record(String date, AttendanceEntry... entries) {
        return AttendanceRecord.builder()
                .date(date)
                .className(CLASS)
                .entries(new ArrayList<>(List.of(entries)))
                .build();
    }

    private static AttendanceEntry entry(Long studentId, boolean present) {
        return AttendanceEntry.builder().studentId(studentId).present(present).build();
    }
}
