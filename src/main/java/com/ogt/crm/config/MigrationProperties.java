package com.ogt.crm.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "crm.migration")
public class MigrationProperties {

    // Planilla origen de la migración
    private String workbookPath = "excel/CRM-WORKBOOK.xlsx";

    private int headerScanRows = 10;
    private int profileSampleRows = 100;
    private int profileExampleValues = 3;

    // Cada cuántas filas procesadas se publica un evento "progress"
    private int progressIntervalRows = 100;

    // Máximo de errores listados en el resumen final
    private int summaryErrorLimit = 50;

    private Progress progress = new Progress();

    @Data
    public static class Progress {
        private Duration pingInterval = Duration.ofSeconds(30);
        private int observerQueueCapacity = 1000;
    }
}
