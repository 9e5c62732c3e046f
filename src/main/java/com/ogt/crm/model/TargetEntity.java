package com.ogt.crm.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Entidades destino, en el orden en que se migran (las organizaciones primero: el resto las referencia).
 */
public enum TargetEntity {
    ORGANIZATIONS("Organizations", "organizations", "organization", "company"),
    CONTACTS("Contacts", "contacts", "contact"),
    OPPORTUNITIES("Opportunities", "opportunities", "opportunit"),
    INTERACTIONS("Interactions", "interactions", "interaction");

    private final String sheetName;
    private final String statsKey;
    private final String[] nameHints;

    TargetEntity(String sheetName, String statsKey, String... nameHints) {
        this.sheetName = sheetName;
        this.statsKey = statsKey;
        this.nameHints = nameHints;
    }

    public String getSheetName() {
        return sheetName;
    }

    public String getStatsKey() {
        return statsKey;
    }

    /**
     * Resuelve la entidad de una hoja: nombre exacto primero, luego contención sin mayúsculas.
     */
    public static Optional<TargetEntity> forSheet(String sheetName) {
        if (sheetName == null) return Optional.empty();
        Optional<TargetEntity> exact = Arrays.stream(values())
                .filter(e -> e.sheetName.equals(sheetName))
                .findFirst();
        if (exact.isPresent()) return exact;

        String lower = sheetName.toLowerCase(Locale.ROOT);
        // "interaction" antes que "contact": una hoja "Contact Interactions" son interacciones
        if (lower.contains("interaction")) return Optional.of(INTERACTIONS);
        return Arrays.stream(values())
                .filter(e -> Arrays.stream(e.nameHints).anyMatch(lower::contains))
                .findFirst();
    }
}
