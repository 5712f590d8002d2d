package io.github.byzatic.jobs.config;

import io.github.byzatic.jobs.base_exceptions.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class JobsConfigTest {

    @Test
    void loadsClasspathProperties() throws Exception {
        JobsConfig config = JobsConfig.load();
        assertEquals(3, config.getCorePoolSize());
        assertEquals(6, config.getMaxPoolSize());
        assertEquals(4, config.getDefaultMaxConcurrency());
        assertEquals(50, config.getCatalogPageSize());
        assertEquals(Duration.ofSeconds(30), config.getStuckSweepInterval());
        assertEquals(Duration.ofMinutes(10), config.getStuckThreshold());
        assertEquals(Duration.ofSeconds(2), config.getCloseGrace());
        assertFalse(config.isDeleteStopsRunning());
        assertTrue(config.isTaskCanPause());
    }

    @Test
    void missingPropertiesKeepDefaults() throws Exception {
        JobsConfig config = JobsConfig.fromProperties(new Properties());
        assertEquals(JobsConfig.DEFAULT_CATALOG_PAGE_SIZE, config.getCatalogPageSize());
        assertEquals(JobsConfig.DEFAULT_STUCK_THRESHOLD, config.getStuckThreshold());
        assertTrue(config.isDeleteStopsRunning());
    }

    @Test
    void malformedPropertiesAreRejected() {
        Properties notANumber = new Properties();
        notANumber.setProperty("jobs.catalog.page-size", "many");
        assertThrows(ConfigurationException.class, () -> JobsConfig.fromProperties(notANumber));

        Properties notADuration = new Properties();
        notADuration.setProperty("jobs.stuck.threshold", "10 minutes");
        assertThrows(ConfigurationException.class, () -> JobsConfig.fromProperties(notADuration));

        Properties negative = new Properties();
        negative.setProperty("jobs.executor.core-pool-size", "0");
        assertThrows(ConfigurationException.class, () -> JobsConfig.fromProperties(negative));
    }

    @Test
    void outOfRangeValuesAreConfigurationErrors() {
        Properties zeroPage = new Properties();
        zeroPage.setProperty("jobs.catalog.page-size", "0");
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> JobsConfig.fromProperties(zeroPage));
        assertTrue(e.getCause() instanceof IllegalArgumentException);

        Properties zeroThreshold = new Properties();
        zeroThreshold.setProperty("jobs.stuck.threshold", "PT0S");
        assertThrows(ConfigurationException.class, () -> JobsConfig.fromProperties(zeroThreshold));

        Properties negativeInterval = new Properties();
        negativeInterval.setProperty("jobs.stuck.sweep-interval", "-PT1S");
        assertThrows(ConfigurationException.class, () -> JobsConfig.fromProperties(negativeInterval));
    }

    @Test
    void maxPoolNeverBelowCore() {
        JobsConfig config = new JobsConfig.Builder().corePoolSize(8).maxPoolSize(2).build();
        assertEquals(8, config.getMaxPoolSize());
    }
}
