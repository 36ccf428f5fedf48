package com.calypso.core.build;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default {@link UsageMeter} that only logs. A billing integration replaces it with a
 * {@code @Primary} bean.
 */
@Component
public class LoggingUsageMeter implements UsageMeter {

    private static final Logger log = LoggerFactory.getLogger(LoggingUsageMeter.class);

    @Override
    public void recordGeneration(String projectId, String buildId) {
        log.info("Usage: generation for project {} (build {})", projectId, buildId);
    }
}
