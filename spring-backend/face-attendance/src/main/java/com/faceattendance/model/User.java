package com.faceattendance.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.Instant;

/**
 * A registered person. The embedding is kept as a JSON array so the table
 * does not depend on the provider's vector dimension.
 */
@Entity
@Table(name = "users")
@Data
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, unique = true)
    private String userId;

    @Column(nullable = false)
    private String name;

    // JSON array of floats, e.g. [0.013, -0.402, ...]
    @Column(columnDefinition = "LONGTEXT", nullable = false)
    private String embedding;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
