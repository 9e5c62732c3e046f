package com.ogt.crm.worker;

import com.ogt.crm.config.MigrationProperties;
import com.ogt.crm.progress.ProgressBroadcaster;
import com.ogt.crm.reader.WorkbookReader;
import com.ogt.crm.service.CrmDataStore;
import com.ogt.crm.service.MappingAdvisor;
import com.ogt.crm.service.RowTransformer;
import com.ogt.crm.service.WorkbookAnalyzer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Crea un {@link MigrationExecutor} nuevo por corrida, sobre la planilla configurada.
 */
@Component
@RequiredArgsConstructor
public class MigrationExecutorFactory {

    private final WorkbookReader reader;
    private final WorkbookAnalyzer analyzer;
    private final MappingAdvisor advisor;
    private final RowTransformer transformer;
    private final CrmDataStore store;
    private final ProgressBroadcaster broadcaster;
    private final MigrationProperties properties;

    public MigrationExecutor create() {
        return create(Path.of(properties.getWorkbookPath()));
    }

    public MigrationExecutor create(Path workbookPath) {
        return new MigrationExecutor(workbookPath, reader, analyzer, advisor, transformer, store, broadcaster, properties);
    }
}
