package com.rollbook.attendance.model.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A roster entry. Identity is (className, roll); the generated id stays stable
 * across upserts so attendance entries can keep pointing at it.
 */
@Entity
@Table(name = "students",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_students_class_roll", columnNames = {"class_name", "roll"})
    },
    indexes = {
        @Index(name = "idx_students_class", columnList = "class_name")
    })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Student {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Roll number, unique within the class.
     */
    @Column(name = "roll", nullable = false)
    private Integer roll;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    @Column(name = "class_name", nullable = false, length = 64)
    private String className;

    @Column(name = "parent_phone", length = 40)
    private String parentPhone;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * Copy the non-null mutable fields of {@code other} onto this student.
     * Key fields (className, roll) are left alone.
     *
     * @return true if any stored value changed
     */
    public boolean mergeFrom(Student other) {
        boolean changed = false;
        if (other.getName() != null && !Objects.equals(name, other.getName())) {
            this.name = other.getName();
            changed = true;
        }
        if (other.getParentPhone() != null && !Objects.equals(parentPhone, other.getParentPhone())) {
            this.parentPhone = other.getParentPhone();
            changed = true;
        }
        return changed;
    }
}
