package com.calypso.core.build;

/**
 * Receives a usage record for every generation that produced files. Billing lives outside
 * this service; implementations forward to it.
 */
public interface UsageMeter {

    void recordGeneration(String projectId, String buildId);
}
