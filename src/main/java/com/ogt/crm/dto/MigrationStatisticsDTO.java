package com.ogt.crm.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class MigrationStatisticsDTO {
    private Map<String, Long> counts; // organizations, contacts, opportunities, interactions
    private boolean migrationActive;
}
