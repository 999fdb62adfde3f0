package com.faceattendance.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.Instant;
import java.time.LocalTime;

/**
 * Office hours in the configured zone. A single row; entries after the login
 * time plus the grace period are flagged late, exits before the logout time
 * early.
 */
@Entity
@Table(name = "office_timings")
@Data
public class OfficeTiming {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "login_time")
    private LocalTime loginTime;

    @Column(name = "logout_time")
    private LocalTime logoutTime;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
