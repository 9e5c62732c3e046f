package com.ogt.crm.service;

import com.ogt.crm.exception.RowValidationException;
import com.ogt.crm.model.CellValue;
import com.ogt.crm.model.EntityRecord;
import com.ogt.crm.model.MappingSuggestion;
import com.ogt.crm.model.TargetEntity;
import com.ogt.crm.model.TargetField;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Convierte una fila de datos en un {@link EntityRecord} usando las sugerencias de mapeo de la hoja.
 */
@Component
@RequiredArgsConstructor
public class RowTransformer {

    private final TargetFieldCatalog catalog;
    private final FieldValueConverter converter;

    /**
     * Campo destino → índice de columna, a partir de las sugerencias de una hoja.
     */
    public Map<String, Integer> columnsByField(List<MappingSuggestion> suggestions) {
        Map<String, Integer> columns = new LinkedHashMap<>();
        for (MappingSuggestion suggestion : suggestions) {
            columns.putIfAbsent(suggestion.getTargetField(), suggestion.getColumnIndex());
        }
        return columns;
    }

    /**
     * @return vacío si todas las celdas mapeadas de la fila están vacías (la fila se omite)
     * @throws RowValidationException si falta un campo obligatorio o un valor es inválido
     */
    public Optional<EntityRecord> transform(TargetEntity entity, Map<String, Integer> columnsByField,
                                            List<CellValue> row, int rowIndex) {

        boolean blank = columnsByField.values().stream().allMatch(col -> cellAt(row, col).isEmpty());
        if (blank) return Optional.empty();

        Map<String, Object> values = new LinkedHashMap<>();
        for (TargetField field : catalog.fieldsFor(entity)) {
            Integer col = columnsByField.get(field.getName());
            if (col == null) continue;

            Object value = converter.convert(field, cellAt(row, col));
            if (value != null) {
                values.put(field.getName(), value);
            }
        }

        if (entity == TargetEntity.CONTACTS) {
            splitFullName(values);
        }

        for (TargetField field : catalog.fieldsFor(entity)) {
            if (field.isRequired() && values.get(field.getName()) == null) {
                throw new RowValidationException(field.getName(), "Missing required field: " + field.getName());
            }
        }

        return Optional.of(new EntityRecord(entity, rowIndex, values));
    }

    private void splitFullName(Map<String, Object> values) {
        Object fullName = values.get("fullName");
        if (fullName != null && values.get("firstName") == null && values.get("lastName") == null) {
            String[] parts = fullName.toString().trim().split("[,\\s]+", 2);
            values.put("firstName", parts[0]);
            if (parts.length > 1 && !parts[1].isBlank()) {
                values.put("lastName", parts[1].trim());
            }
        }

        if (values.get("firstName") == null && values.get("lastName") == null) {
            throw new RowValidationException("fullName", "Missing contact name");
        }
    }

    private CellValue cellAt(List<CellValue> row, int col) {
        return col >= 0 && col < row.size() ? row.get(col) : CellValue.empty();
    }
}
