package com.ogt.crm.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MigrationRunTest {

    @Test
    void followsRunLifecycle() {
        MigrationRun run = new MigrationRun();
        assertThat(run.getStatus()).isEqualTo(RunStatus.IDLE);

        run.markRunning();
        assertThat(run.getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(run.getStartedAt()).isNotNull();

        run.markAborted();
        assertThat(run.getStatus()).isEqualTo(RunStatus.ABORTED);
        assertThat(run.getStatus().isTerminal()).isTrue();
        assertThat(run.getEndedAt()).isNotNull();
    }

    @Test
    void terminalStatesCannotBeLeft() {
        MigrationRun run = new MigrationRun();
        run.markRunning();
        run.markCompleted();

        assertThatThrownBy(run::markRunning).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> run.markFailed("late")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void idleRunCanFailBeforeStarting() {
        MigrationRun run = new MigrationRun();
        run.markFailed("Migration executor unavailable");

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getFailureMessage()).isEqualTo("Migration executor unavailable");
    }

    @Test
    void idleRunCanBeAbortedBeforeStarting() {
        MigrationRun run = new MigrationRun();
        run.markAborted();

        assertThat(run.getStatus()).isEqualTo(RunStatus.ABORTED);
        assertThat(run.getStartedAt()).isNull();
        assertThat(run.getEndedAt()).isNotNull();
        assertThatThrownBy(run::markRunning).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void countersKeepProcessedInvariant() {
        MigrationRun run = new MigrationRun();
        EntityCounters counters = run.countersFor(TargetEntity.CONTACTS);
        counters.recordCreated();
        counters.recordCreated();
        counters.recordSkipped();
        counters.recordErrored();

        EntityCounters.Snapshot snapshot = run.counterSnapshots().get(TargetEntity.CONTACTS);
        assertThat(snapshot.getProcessed()).isEqualTo(4);
        assertThat(snapshot.getProcessed())
                .isEqualTo(snapshot.getCreated() + snapshot.getSkipped() + snapshot.getErrored());
        assertThat(run.counterSnapshots().get(TargetEntity.ORGANIZATIONS).getProcessed()).isZero();
    }

    @Test
    void sheetNamesResolveToEntities() {
        assertThat(TargetEntity.forSheet("Organizations")).contains(TargetEntity.ORGANIZATIONS);
        assertThat(TargetEntity.forSheet("Company List")).contains(TargetEntity.ORGANIZATIONS);
        assertThat(TargetEntity.forSheet("Contact Interactions")).contains(TargetEntity.INTERACTIONS);
        assertThat(TargetEntity.forSheet("opportunity pipeline")).contains(TargetEntity.OPPORTUNITIES);
        assertThat(TargetEntity.forSheet("Instructions")).isEmpty();
    }
}
