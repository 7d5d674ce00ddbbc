package com.creatorradar.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        SchedulerConfig.class
})
class CacheAndSchedulerConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Autowired
    Clock clock;

    @Test
    @DisplayName("job status cache is created and usable")
    void jobStatusCacheCreated() {
        assertThat(cacheManager.getCache(CaffeineConfig.JOB_STATUS_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.JOB_STATUS_CACHE).put("job-1", "snapshot");
        assertThat(cacheManager.getCache(CaffeineConfig.JOB_STATUS_CACHE).get("job-1").get()).isEqualTo("snapshot");
    }

    @Test
    @DisplayName("scheduler pool is created and configured")
    void schedulerPoolCreated() {
        assertThat(schedulerPool).isNotNull();
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("scheduler-");
        assertThat(schedulerPool.getPoolSize()).isLessThanOrEqualTo(2);
    }

    @Test
    @DisplayName("clock is UTC")
    void clockIsUtc() {
        assertThat(clock.getZone()).isEqualTo(ZoneOffset.UTC);
    }
}
