package com.ogt.crm.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MigrationActionRequest {

    @NotBlank(message = "Invalid action")
    private String action; // start, pause, abort, status
}
