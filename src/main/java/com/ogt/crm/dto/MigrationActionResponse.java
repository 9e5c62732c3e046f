package com.ogt.crm.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

/**
 * Respuesta de las acciones de control. Solo se serializan los campos que aplican a cada acción.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MigrationActionResponse {
    private String message;
    private UUID id;           // start
    private Boolean active;    // status
    private Boolean supported; // pause
    private MigrationRunDTO run; // status, con corrida activa
}
