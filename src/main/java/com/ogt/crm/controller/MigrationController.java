package com.ogt.crm.controller;

import com.ogt.crm.config.OpenApiConfig;
import com.ogt.crm.dto.MigrationActionRequest;
import com.ogt.crm.dto.MigrationActionResponse;
import com.ogt.crm.dto.MigrationStatisticsDTO;
import com.ogt.crm.exception.BusinessException;
import com.ogt.crm.service.MigrationService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;

@RestController
@RequestMapping("/api/migration")
@RequiredArgsConstructor
@Tag(name = OpenApiConfig.TAG_MIGRATION)
public class MigrationController {

    private final MigrationService migrationService;

    // Punto de entrada único: {"action": "start" | "pause" | "abort" | "status"}
    @PostMapping
    public ResponseEntity<MigrationActionResponse> control(@RequestBody @Valid MigrationActionRequest request) {
        switch (request.getAction().trim().toLowerCase(Locale.ROOT)) {
            case "start":
                return ResponseEntity.ok(migrationService.start());
            case "pause":
                return ResponseEntity.ok(migrationService.pause());
            case "abort":
                return ResponseEntity.ok(migrationService.abort());
            case "status":
                return ResponseEntity.ok(migrationService.status());
            default:
                throw new BusinessException("Invalid action");
        }
    }

    @GetMapping
    public ResponseEntity<MigrationStatisticsDTO> getStatistics() {
        return ResponseEntity.ok(migrationService.getStatistics());
    }
}
