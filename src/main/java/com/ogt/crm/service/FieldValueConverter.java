package com.ogt.crm.service;

import com.ogt.crm.exception.RowValidationException;
import com.ogt.crm.model.CellValue;
import com.ogt.crm.model.TargetField;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normaliza el valor de una celda según el {@link com.ogt.crm.model.FieldType} del campo destino.
 * Devuelve {@code String}, {@code BigDecimal} o {@code LocalDate}; una celda vacía devuelve {@code null}.
 * Un valor presente pero inválido lanza {@link RowValidationException}.
 */
@Component
public class FieldValueConverter {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern ZIP = Pattern.compile("^\\d{5}(-\\d{4})?$");
    private static final LocalDate EXCEL_EPOCH = LocalDate.of(1899, 12, 30);

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern US_DATE = Pattern.compile("^\\d{1,2}/\\d{1,2}/\\d{4}$");
    private static final Pattern US_SHORT_DATE = Pattern.compile("^\\d{1,2}/\\d{1,2}/\\d{2}$");
    private static final DateTimeFormatter US_FORMAT = DateTimeFormatter.ofPattern("M/d/yyyy");
    private static final DateTimeFormatter US_SHORT_FORMAT = DateTimeFormatter.ofPattern("M/d/yy");

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public Object convert(TargetField field, CellValue cell) {
        if (cell == null || cell.isEmpty()) return null;

        String text = cell.asText().trim();

        switch (field.getType()) {
            case TEXT:
                return text;
            case UPPER_TEXT:
                return text.toUpperCase(Locale.ROOT);
            case PRIORITY:
                return toPriority(text);
            case PHONE:
                return toPhone(field, text);
            case EMAIL:
                return toEmail(field, text);
            case ZIP:
                if (!ZIP.matcher(text).matches()) {
                    throw new RowValidationException(field.getName(), "Invalid zip code: " + text);
                }
                return text;
            case DATE:
                return toDate(field, cell.resolved(), text);
            case NUMBER:
                return toDecimal(cell.resolved(), text);
            case PERCENT:
                return toPercent(field, cell.resolved(), text);
            case STAGE:
                return toStage(text);
            case OPPORTUNITY_STATUS:
                return toOpportunityStatus(text);
            case INTERACTION_TYPE:
                return toInteractionType(text);
            default:
                return text;
        }
    }

    // =================================================================================
    // 🔧 NORMALIZADORES
    // =================================================================================

    static String toPriority(String text) {
        switch (text.toUpperCase(Locale.ROOT)) {
            case "A":
                return "HIGH";
            case "B":
                return "MEDIUM";
            case "C":
                return "LOW";
            default:
                return "NONE";
        }
    }

    private String toPhone(TargetField field, String text) {
        String digits = text.replaceAll("\\D", "");
        if (digits.length() < 10 || digits.length() > 15) {
            throw new RowValidationException(field.getName(), "Invalid phone number: " + text);
        }
        return digits;
    }

    private String toEmail(TargetField field, String text) {
        String email = text.toLowerCase(Locale.ROOT);
        if (!EMAIL.matcher(email).matches()) {
            throw new RowValidationException(field.getName(), "Invalid email: " + text);
        }
        return email;
    }

    private LocalDate toDate(TargetField field, CellValue value, String text) {
        if (value.isDate()) {
            return value.getDate().toLocalDate();
        }
        if (value.isNumber()) {
            // Fecha serial de Excel
            return EXCEL_EPOCH.plusDays((long) Math.floor(value.getNumber()));
        }
        DateTimeFormatter format;
        if (ISO_DATE.matcher(text).matches()) {
            format = DateTimeFormatter.ISO_LOCAL_DATE;
        } else if (US_DATE.matcher(text).matches()) {
            format = US_FORMAT;
        } else if (US_SHORT_DATE.matcher(text).matches()) {
            format = US_SHORT_FORMAT;
        } else {
            throw new RowValidationException(field.getName(), "Invalid date: " + text);
        }

        try {
            return LocalDate.parse(text, format);
        } catch (DateTimeParseException e) {
            throw new RowValidationException(field.getName(), "Invalid date: " + text);
        }
    }

    private BigDecimal toDecimal(CellValue value, String text) {
        if (value.isNumber()) {
            return BigDecimal.valueOf(value.getNumber());
        }
        try {
            return new BigDecimal(text.replaceAll("[$,\\s]", ""));
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    private BigDecimal toPercent(TargetField field, CellValue value, String text) {
        BigDecimal raw = toDecimal(value, text.replace("%", ""));
        BigDecimal percent = raw.compareTo(BigDecimal.ONE) > 0 ? raw : raw.multiply(HUNDRED);
        if (percent.signum() < 0 || percent.compareTo(HUNDRED) > 0) {
            throw new RowValidationException(field.getName(), "Probability out of range: " + text);
        }
        return percent.setScale(2, RoundingMode.HALF_UP);
    }

    static String toStage(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("lead") || lower.contains("discovery")) return "LEAD";
        if (lower.contains("contact") || lower.contains("qualified")) return "QUALIFIED";
        if (lower.contains("proposal") || lower.contains("demo")) return "PROPOSAL";
        if (lower.contains("negotiation") || lower.contains("follow")) return "NEGOTIATION";
        if (lower.contains("closed") || lower.contains("sold")) return "CLOSED";
        return "LEAD";
    }

    static String toOpportunityStatus(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("open")) return "OPEN";
        if (lower.contains("won") || lower.contains("sold")) return "CLOSED_WON";
        if (lower.contains("lost") || lower.contains("closed")) return "CLOSED_LOST";
        return "OPEN";
    }

    static String toInteractionType(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("call") || lower.contains("phone")) return "CALL";
        if (lower.contains("email")) return "EMAIL";
        if (lower.contains("meeting") || lower.contains("person") || lower.contains("visit")) return "MEETING";
        return "OTHER";
    }
}
