package com.wildcam.alerts.controller;

import com.wildcam.alerts.model.Camera;
import com.wildcam.alerts.repository.CameraRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/cameras")
@Tag(name = "Cameras", description = "Register cameras used for activity forecasting")
public class CameraController {

    private final CameraRepository cameraRepository;

    public CameraController(CameraRepository cameraRepository) {
        this.cameraRepository = cameraRepository;
    }

    @Operation(summary = "List active cameras")
    @GetMapping
    public ResponseEntity<List<Camera>> listActive() {
        return ResponseEntity.ok(cameraRepository.findActive());
    }

    @Operation(summary = "Register or update a camera",
            description = "Only cameras with status 'active' are included in the hourly forecast refresh.")
    @PostMapping
    public ResponseEntity<Camera> register(@RequestBody Camera camera) {
        if (camera.getCameraId() == null || camera.getCameraId().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        cameraRepository.save(camera);
        return ResponseEntity.ok(camera);
    }
}
