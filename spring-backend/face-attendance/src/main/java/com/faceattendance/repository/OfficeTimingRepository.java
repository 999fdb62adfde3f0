package com.faceattendance.repository;

import com.faceattendance.model.OfficeTiming;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface OfficeTimingRepository extends JpaRepository<OfficeTiming, Long> {

    Optional<OfficeTiming> findFirstByOrderByIdAsc();
}
