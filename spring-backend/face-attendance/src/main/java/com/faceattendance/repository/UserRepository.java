package com.faceattendance.repository;

import com.faceattendance.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    // Lookup by the externally assigned id (duplicate check during registration)
    Optional<User> findByUserId(String userId);

    boolean existsByUserId(String userId);
}
