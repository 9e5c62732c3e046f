package com.ogt.crm.exception;

import lombok.Getter;

/**
 * Una fila no se puede escribir (campo obligatorio ausente, valor inválido, referencia inexistente).
 * Se cuenta como error de la fila; nunca detiene la corrida.
 */
@Getter
public class RowValidationException extends RuntimeException {

    private final String fieldName;

    public RowValidationException(String fieldName, String message) {
        super(message);
        this.fieldName = fieldName;
    }
}
