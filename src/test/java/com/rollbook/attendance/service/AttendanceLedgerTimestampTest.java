package com.rollbook.attendance.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.rollbook.attendance.model.domain.AttendanceRecord;
import com.rollbook.attendance.model.dto.AttendanceEntryDTO;
import com.rollbook.attendance.repository.AttendanceRecordRepository;

@ExtendWith(MockitoExtension.class)
class AttendanceLedgerTimestampTest {

    private static final Instant NOW = Instant.parse("2024-06-03T08:15:00Z");
    private static final LocalDateTime MARKED_AT = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private AttendanceRecordRepository recordRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private AttendanceLedgerService ledgerService;

    @BeforeEach
    void setUp() {
        ledgerService = new AttendanceLedgerService(recordRepository,
                new TransactionTemplate(transactionManager), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void markStampsTheRecordWithTheInjectedClock() {
        AttendanceRecord existing = AttendanceRecord.builder()
                .id(11L)
                .date("2024-06-03")
                .className("Class 5-A")
                .createdAt(MARKED_AT.minusDays(1))
                .updatedAt(MARKED_AT.minusDays(1))
                .build();
        when(recordRepository.insertIfAbsent("2024-06-03", "Class 5-A", MARKED_AT)).thenReturn(0);
        when(recordRepository.findForUpdate("2024-06-03", "Class 5-A")).thenReturn(Optional.of(existing));
        when(recordRepository.save(any(AttendanceRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        AttendanceRecord saved = ledgerService.mark("2024-06-03", "Class 5-A",
                List.of(AttendanceEntryDTO.builder().studentId(1L).present(true).build()), 7L);

        assertThat(saved.getUpdatedAt()).isEqualTo(MARKED_AT);
        assertThat(saved.getCreatedAt()).isEqualTo(MARKED_AT.minusDays(1));
        assertThat(saved.getMarkedByTeacherId()).isEqualTo(7L);
        verify(recordRepository).insertIfAbsent("2024-06-03", "Class 5-A", MARKED_AT);
    }
}
