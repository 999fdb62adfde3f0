package com.faceattendance.controller;

import com.faceattendance.dto.UserSummary;
import com.faceattendance.model.User;
import com.faceattendance.service.RegistrationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@CrossOrigin(origins = "*") // Allow frontend access
public class UserController {

    private final RegistrationService registrationService;

    public UserController(RegistrationService registrationService) {
        this.registrationService = registrationService;
    }

    // 🔹 Register user + store face embedding
    @PostMapping("/register")
    public ResponseEntity<?> registerUser(
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "name", required = false) String name,
            @RequestParam(value = "image", required = false) MultipartFile image
    ) throws IOException {
        if (userId == null || userId.trim().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("detail", "User ID is required"));
        }
        if (name == null || name.trim().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("detail", "Name is required"));
        }
        if (image == null || image.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("detail", "Face image is required"));
        }

        User user = registrationService.register(userId, name, image.getBytes());
        return ResponseEntity.ok(Map.of(
                "message", "User registered successfully",
                "user_id", user.getUserId()));
    }

    @GetMapping("/users")
    public List<UserSummary> getUsers() {
        return registrationService.listUsers().stream()
                .map(UserSummary::of)
                .collect(Collectors.toList());
    }

    // 🔹 Delete user; attendance history is kept
    @DeleteMapping("/users/{userId}")
    public ResponseEntity<?> deleteUser(@PathVariable String userId) {
        if (!registrationService.deleteUser(userId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("detail", "User not found"));
        }
        return ResponseEntity.ok(Map.of("message", "User deleted successfully"));
    }
}
