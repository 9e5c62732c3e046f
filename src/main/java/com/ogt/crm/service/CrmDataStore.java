package com.ogt.crm.service;

import com.ogt.crm.model.EntityRecord;
import com.ogt.crm.model.TargetEntity;
import com.ogt.crm.model.WriteOutcome;

/**
 * Almacén destino de la migración.
 * <p>
 * {@link #create} es todo o nada. Errores de la fila se lanzan como
 * {@link com.ogt.crm.exception.RowValidationException}; la falta de conectividad como
 * {@link com.ogt.crm.exception.DataStoreUnavailableException}.
 */
public interface CrmDataStore {

    WriteOutcome create(TargetEntity entity, EntityRecord record);

    long count(TargetEntity entity);
}
