package com.ogt.crm.service;

import com.ogt.crm.worker.MigrationExecutor;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class MigrationRunRegistryTest {

    private final MigrationRunRegistry registry = new MigrationRunRegistry();

    @Test
    void secondRegistrationIsRejectedUntilRemoved() {
        MigrationExecutor first = mock(MigrationExecutor.class);
        MigrationExecutor second = mock(MigrationExecutor.class);

        assertThat(registry.tryRegister(first)).isTrue();
        assertThat(registry.tryRegister(second)).isFalse();
        assertThat(registry.current()).containsSame(first);

        assertThat(registry.remove(first)).isTrue();
        assertThat(registry.isActive()).isFalse();
        assertThat(registry.tryRegister(second)).isTrue();
    }

    @Test
    void removeOnlyClearsTheSameExecutor() {
        MigrationExecutor active = mock(MigrationExecutor.class);
        MigrationExecutor stale = mock(MigrationExecutor.class);
        registry.tryRegister(active);

        assertThat(registry.remove(stale)).isFalse();
        assertThat(registry.current()).containsSame(active);
    }

    @RepeatedTest(20)
    void concurrentRegistrationHasExactlyOneWinner() throws Exception {
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                MigrationExecutor executor = mock(MigrationExecutor.class);
                results.add(pool.submit(() -> {
                    go.await();
                    return registry.tryRegister(executor);
                }));
            }
            go.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) winners++;
            }
            assertThat(winners).isEqualTo(1);
            assertThat(registry.isActive()).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }
}
