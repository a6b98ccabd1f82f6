package com.rollbook.attendance.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.rollbook.attendance.model.domain.Student;

/**
 * Repository for Student entity.
 */
@Repository
public interface StudentRepository extends JpaRepository<Student, Long> {

    /**
     * Find a student by its roster key.
     */
    Optional<Student> findByClassNameAndRoll(String className, Integer roll);

    List<Student> findByClassNameOrderByRollAsc(String className);

    List<Student> findAllByOrderByRollAscClassNameAsc();

    List<Student> findByIdIn(Collection<Long> ids);
}
