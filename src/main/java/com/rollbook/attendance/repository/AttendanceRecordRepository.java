package com.rollbook.attendance.repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.rollbook.attendance.model.domain.AttendanceRecord;

import jakarta.persistence.LockModeType;

/**
 * Repository for AttendanceRecord entity.
 */
@Repository
public interface AttendanceRecordRepository extends JpaRepository<AttendanceRecord, Long> {

    /**
     * Create the (date, className) header row unless one already exists.
     * The unique constraint decides; a concurrent insert of the same key waits on
     * the index and then does nothing.
     *
     * @return 1 if a row was created, 0 if it already existed
     */
    @Modifying(flushAutomatically = true)
    @Query(value = "INSERT INTO attendance_records (record_date, class_name, created_at, updated_at) " +
                   "VALUES (:date, :className, :now, :now) ON CONFLICT DO NOTHING",
           nativeQuery = true)
    int insertIfAbsent(@Param("date") String date,
                       @Param("className") String className,
                       @Param("now") LocalDateTime now);

    /**
     * Load a record with a row lock held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM AttendanceRecord r WHERE r.date = :date AND r.className = :className")
    Optional<AttendanceRecord> findForUpdate(@Param("date") String date,
                                             @Param("className") String className);

    @EntityGraph(attributePaths = "entries")
    Optional<AttendanceRecord> findByDateAndClassName(String date, String className);

    /**
     * All records of a class whose date lies in [from, to], compared as strings.
     */
    @EntityGraph(attributePaths = "entries")
    List<AttendanceRecord> findByClassNameAndDateBetweenOrderByDateAsc(String className, String from, String to);

    long countByDateAndClassName(String date, String className);
}
