package com.launchradar.ingestion.config;

import com.launchradar.domain.ChainId;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One single-thread scheduler per (chain, role). A blocking handshake or a long backfill tick only delays timers of
 * its own chain and role.
 */
@Slf4j
@Component
public class ChainSchedulers {

    public static final String LISTENER = "listener";
    public static final String BACKFILL = "backfill";

    private final Map<String, ThreadPoolTaskScheduler> schedulers = new ConcurrentHashMap<>();

    public TaskScheduler forChain(ChainId chain, String role) {
        String name = role + "-" + chain.name().toLowerCase(Locale.ROOT);
        return schedulers.computeIfAbsent(name, ChainSchedulers::create);
    }

    public int size() {
        return schedulers.size();
    }

    @PreDestroy
    public void shutdown() {
        schedulers.values().forEach(ThreadPoolTaskScheduler::shutdown);
        schedulers.clear();
    }

    private static ThreadPoolTaskScheduler create(String name) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix(name + "-");
        s.setWaitForTasksToCompleteOnShutdown(false);
        s.initialize();
        log.debug("Scheduler {} started", name);
        return s;
    }
}
