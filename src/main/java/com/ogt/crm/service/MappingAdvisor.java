package com.ogt.crm.service;

import com.ogt.crm.model.ColumnProfile;
import com.ogt.crm.model.ConfidenceTier;
import com.ogt.crm.model.MappingSuggestion;
import com.ogt.crm.model.SheetAnalysis;
import com.ogt.crm.model.TargetEntity;
import com.ogt.crm.model.TargetField;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Propone a lo sumo una columna por campo destino, comparando encabezados con las palabras clave
 * de {@link TargetFieldCatalog}.
 * <ul>
 *   <li>Igualdad exacta (normalizada) → HIGH.</li>
 *   <li>Contención en cualquier sentido → HIGH si el campo es prioridad 1, si no MEDIUM.</li>
 *   <li>Prefijo / sufijo → MEDIUM.</li>
 * </ul>
 * Por columna y campo gana la primera palabra clave que coincide. Una sugerencia HIGH nueva reemplaza
 * a una existente que no lo sea; en cualquier otro caso se conserva la primera encontrada.
 */
@Service
@RequiredArgsConstructor
public class MappingAdvisor {

    private final TargetFieldCatalog catalog;

    public List<MappingSuggestion> suggest(SheetAnalysis sheet, TargetEntity entity) {
        return suggest(sheet, catalog.fieldsFor(entity));
    }

    public List<MappingSuggestion> suggest(SheetAnalysis sheet, List<TargetField> fields) {
        if (sheet.isSkipped()) return List.of();

        // El orden de inserción importa: el sort final es estable
        Map<String, MappingSuggestion> byField = new LinkedHashMap<>();

        for (ColumnProfile column : sheet.getColumnProfiles()) {
            String columnKey = normalize(column.getHeader());
            if (columnKey.isEmpty()) continue; // "###", "***": "" contendría a cualquier palabra clave

            for (TargetField field : fields) {
                for (String keyword : field.getKeywords()) {
                    MappingSuggestion candidate = match(column, columnKey, field, normalize(keyword));
                    if (candidate == null) continue;

                    MappingSuggestion existing = byField.get(field.getName());
                    if (existing == null) {
                        byField.put(field.getName(), candidate);
                    } else if (candidate.getConfidence() == ConfidenceTier.HIGH
                            && existing.getConfidence() != ConfidenceTier.HIGH) {
                        // Reemplazo: va al final, como una sugerencia nueva
                        byField.remove(field.getName());
                        byField.put(field.getName(), candidate);
                    }
                    break;
                }
            }
        }

        List<MappingSuggestion> suggestions = new ArrayList<>(byField.values());
        suggestions.sort(Comparator.comparing(MappingSuggestion::getConfidence));
        return suggestions;
    }

    private MappingSuggestion match(ColumnProfile column, String columnKey, TargetField field, String keywordKey) {
        if (keywordKey.isEmpty()) return null;

        ConfidenceTier confidence;
        String reason;
        if (columnKey.equals(keywordKey)) {
            confidence = ConfidenceTier.HIGH;
            reason = "Exact match";
        } else if (columnKey.contains(keywordKey) || keywordKey.contains(columnKey)) {
            confidence = field.getPriority() == 1 ? ConfidenceTier.HIGH : ConfidenceTier.MEDIUM;
            reason = "Contains keyword";
        } else if (columnKey.startsWith(keywordKey) || columnKey.endsWith(keywordKey)) {
            confidence = ConfidenceTier.MEDIUM;
            reason = "Partial match";
        } else {
            return null;
        }

        return MappingSuggestion.builder()
                .columnIndex(column.getIndex())
                .sourceColumn(column.getHeader())
                .targetField(field.getName())
                .confidence(confidence)
                .reason(reason)
                .build();
    }

    static String normalize(String value) {
        if (value == null) return "";
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
