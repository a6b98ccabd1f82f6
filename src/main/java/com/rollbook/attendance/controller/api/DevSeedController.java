package com.rollbook.attendance.controller.api;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.rollbook.attendance.model.dto.SeedResultDTO;
import com.rollbook.attendance.service.DemoSeedService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * Demo data reset. Only registered when rollbook.seed.enabled=true.
 */
@RestController
@RequestMapping("/dev")
@ConditionalOnProperty(prefix = "rollbook.seed", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Tag(name = "Development", description = "Demo data")
public class DevSeedController {

    private final DemoSeedService seedService;

    @PostMapping("/seed")
    @Operation(summary = "Seed demo data", description = "Delete all data and insert a demo teacher and class")
    public ResponseEntity<SeedResultDTO> seed() {
        return ResponseEntity.ok(seedService.seed());
    }
}
