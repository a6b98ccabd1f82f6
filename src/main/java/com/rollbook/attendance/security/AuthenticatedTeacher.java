package com.rollbook.attendance.security;

/**
 * Principal of a request that carried a valid access token.
 */
public record AuthenticatedTeacher(Long teacherId) {
}
