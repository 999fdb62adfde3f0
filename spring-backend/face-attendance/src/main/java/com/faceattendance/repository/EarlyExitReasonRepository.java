package com.faceattendance.repository;

import com.faceattendance.model.EarlyExitReason;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

public interface EarlyExitReasonRepository extends JpaRepository<EarlyExitReason, Long> {

    List<EarlyExitReason> findAllByOrderByCreatedAtDesc();

    List<EarlyExitReason> findByAttendanceIdIn(Collection<Long> attendanceIds);

    @Transactional
    long deleteByAttendanceId(Long attendanceId);
}
