package lab.reconciler.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Background workers run only when {@code reconciler.workers.enabled} is true; tests turn
 * them off and drive each tick by hand. The @Scheduled jobs (withdrawal dispatch, sweep,
 * webhook retry, order expiry) share a pool of {@code reconciler.workers.scheduler-pool-size}
 * threads so a slow sweep does not hold back webhook delivery.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "reconciler.workers", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {

    public static final String SCHEDULER_POOL = "taskScheduler";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool(ReconcilerProperties properties) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(properties.getWorkers().getSchedulerPoolSize());
        s.setThreadNamePrefix("worker-");
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.setAwaitTerminationSeconds(30);
        s.initialize();
        return s;
    }
}
