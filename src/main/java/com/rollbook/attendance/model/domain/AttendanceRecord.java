package com.rollbook.attendance.model.domain;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The attendance sheet of one class for one day.
 *
 * The (record_date, class_name) unique constraint is what keeps concurrent
 * submissions for the same day converging on a single row; see
 * {@code AttendanceRecordRepository#insertIfAbsent}.
 */
@Entity
@Table(name = "attendance_records",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_attendance_date_class", columnNames = {"record_date", "class_name"})
    },
    indexes = {
        @Index(name = "idx_attendance_class_date", columnList = "class_name, record_date")
    })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttendanceRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Calendar day as zero-padded ISO "YYYY-MM-DD". Range queries compare it as a
     * string, so every stored value must use exactly this form.
     */
    @Column(name = "record_date", nullable = false, length = 10)
    private String date;

    @Column(name = "class_name", nullable = false, length = 64)
    private String className;

    @ElementCollection
    @CollectionTable(name = "attendance_entries", joinColumns = @JoinColumn(name = "record_id"))
    @OrderColumn(name = "entry_index")
    @Builder.Default
    private List<AttendanceEntry> entries = new ArrayList<>();

    /**
     * Teacher who submitted the current entries.
     */
    @Column(name = "marked_by_teacher_id")
    private Long markedByTeacherId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Replace the whole entry list. Entries of the previous submission that are not
     * in {@code newEntries} are gone afterwards.
     */
    public void replaceEntries(List<AttendanceEntry> newEntries, Long markedBy, LocalDateTime markedAt) {
        this.entries.clear();
        this.entries.addAll(newEntries);
        this.markedByTeacherId = markedBy;
        this.updatedAt = markedAt;
    }
}
