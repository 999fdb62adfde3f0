package com.faceattendance.controller;

import com.faceattendance.dto.DiagnosticResponse;
import com.faceattendance.service.AttendancePipeline;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Map;

@RestController
@CrossOrigin(origins = "*")
public class DebugController {

    private final AttendancePipeline pipeline;

    public DebugController(AttendancePipeline pipeline) {
        this.pipeline = pipeline;
    }

    // 🔹 Similarity of an image against every registered user, nothing recorded
    @PostMapping("/debug/face-recognition")
    public ResponseEntity<?> debugFaceRecognition(
            @RequestParam(value = "image", required = false) MultipartFile image,
            @RequestParam(value = "threshold", defaultValue = "0.6") double threshold
    ) throws IOException {
        if (image == null || image.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("detail", "Face image is required"));
        }
        DiagnosticResponse response = pipeline.diagnose(image.getBytes(), threshold);
        return ResponseEntity.ok(response);
    }
}
