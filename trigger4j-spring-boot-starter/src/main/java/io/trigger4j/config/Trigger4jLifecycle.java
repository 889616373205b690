package io.trigger4j.config;

import io.trigger4j.JobScheduler;
import io.trigger4j.lifecycle.EventLifecycleManager;
import io.trigger4j.registry.TriggerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the scheduler and the lifecycle sweep with the Spring container lifecycle.
 *
 * <p>On start the persisted scheduled triggers are re-registered. The phase is lower than the
 * embedded web server's, so this happens before requests are accepted.
 */
public class Trigger4jLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(Trigger4jLifecycle.class);

    private final JobScheduler scheduler;
    private final TriggerRegistry registry;
    private final EventLifecycleManager lifecycleManager;
    private volatile boolean running = false;

    public Trigger4jLifecycle(JobScheduler scheduler, TriggerRegistry registry, EventLifecycleManager lifecycleManager) {
        this.scheduler = scheduler;
        this.registry = registry;
        this.lifecycleManager = lifecycleManager;
    }

    @Override
    public void start() {
        scheduler.start();
        int registered = registry.reconcile();
        lifecycleManager.start();
        running = true;
        log.info("trigger4j started with {} scheduled triggers", registered);
    }

    @Override
    public void stop() {
        lifecycleManager.stop();
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return 0;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
