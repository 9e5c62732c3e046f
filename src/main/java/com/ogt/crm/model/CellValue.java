package com.ogt.crm.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Valor de una celda ya resuelto al leer la planilla.
 * <p>
 * Variante cerrada: el {@link CellType} indica cuál de los campos tiene contenido.
 * Las fórmulas guardan el texto de la fórmula y el resultado cacheado como otra {@code CellValue}.
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class CellValue {

    public enum CellType {
        EMPTY,
        TEXT,
        NUMBER,
        BOOLEAN,
        DATE,
        FORMULA_RESULT
    }

    private static final CellValue EMPTY = new CellValue(CellType.EMPTY, null, null, null, null, null, null);

    private final CellType type;
    private final String text;
    private final Double number;
    private final Boolean bool;
    private final LocalDateTime date;
    private final String formula;
    private final CellValue result;

    public static CellValue empty() {
        return EMPTY;
    }

    public static CellValue text(String value) {
        if (value == null) return EMPTY;
        return new CellValue(CellType.TEXT, value, null, null, null, null, null);
    }

    public static CellValue number(double value) {
        return new CellValue(CellType.NUMBER, null, value, null, null, null, null);
    }

    public static CellValue bool(boolean value) {
        return new CellValue(CellType.BOOLEAN, null, null, value, null, null, null);
    }

    public static CellValue date(LocalDateTime value) {
        if (value == null) return EMPTY;
        return new CellValue(CellType.DATE, null, null, null, value, null, null);
    }

    public static CellValue formula(String formula, CellValue result) {
        return new CellValue(CellType.FORMULA_RESULT, null, null, null, null, formula,
                result != null ? result : EMPTY);
    }

    // Fórmulas: el resultado cacheado. Resto: la misma celda.
    public CellValue resolved() {
        return type == CellType.FORMULA_RESULT ? result.resolved() : this;
    }

    public boolean isEmpty() {
        CellValue value = resolved();
        return switch (value.type) {
            case EMPTY -> true;
            case TEXT -> value.text.isBlank();
            default -> false;
        };
    }

    public boolean isText() {
        return resolved().type == CellType.TEXT;
    }

    public boolean isNumber() {
        return resolved().type == CellType.NUMBER;
    }

    public boolean isDate() {
        return resolved().type == CellType.DATE;
    }

    /**
     * Representación textual: enteros sin decimales, fechas ISO, vacío como {@code null}.
     */
    public String asText() {
        CellValue value = resolved();
        switch (value.type) {
            case TEXT:
                return value.text;
            case NUMBER:
                double num = value.number;
                return (num == Math.rint(num) && !Double.isInfinite(num))
                        ? String.valueOf((long) num)
                        : String.valueOf(num);
            case BOOLEAN:
                return String.valueOf(value.bool);
            case DATE:
                return value.date.toString();
            default:
                return null;
        }
    }
}
