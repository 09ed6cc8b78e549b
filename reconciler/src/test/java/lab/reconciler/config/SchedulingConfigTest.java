package lab.reconciler.config;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulingConfigTest {

    @Test
    void schedulerPool_isSizedFromWorkerProperties() {
        ReconcilerProperties properties = new ReconcilerProperties();
        properties.getWorkers().setSchedulerPoolSize(6);

        ThreadPoolTaskScheduler scheduler = new SchedulingConfig().schedulerPool(properties);
        try {
            assertThat(scheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(6);
            assertThat(scheduler.getThreadNamePrefix()).isEqualTo("worker-");
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void schedulerPool_defaultsToMoreThanOneThread() {
        assertThat(new ReconcilerProperties().getWorkers().getSchedulerPoolSize()).isGreaterThan(1);
    }
}
