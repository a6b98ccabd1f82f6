package com.rollbook.attendance.model.dto;

import java.time.LocalDateTime;
import java.util.List;

import com.rollbook.attendance.model.domain.AttendanceRecord;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A stored attendance sheet.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttendanceRecordDTO {

    private Long id;

    private String date;

    private String className;

    private List<AttendanceEntryDTO> entries;

    private Long markedByTeacherId;

    private LocalDateTime updatedAt;

    public static AttendanceRecordDTO fromEntity(AttendanceRecord record) {
        return AttendanceRecordDTO.builder()
                .id(record.getId())
                .date(record.getDate())
                .className(record.getClassName())
                .entries(record.getEntries().stream().map(AttendanceEntryDTO::fromEntity).toList())
                .markedByTeacherId(record.getMarkedByTeacherId())
                .updatedAt(record.getUpdatedAt())
                .build();
    }
}
