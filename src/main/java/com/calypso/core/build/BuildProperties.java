package com.calypso.core.build;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Budgets, commands and limits of the build pipeline ({@code calypso.build.*}).
 */
@Component
@ConfigurationProperties(prefix = "calypso.build")
public class BuildProperties {

    private int budgetSeconds = 300;
    private int safetyMarginSeconds = 30;
    private int maxFixIterations = 3;
    private String installCommand = "npm install --legacy-peer-deps --no-audit --no-fund --loglevel=error";
    private String buildCommand = "npm run build";
    private int installTimeoutSeconds = 120;
    private int buildTimeoutSeconds = 120;
    private int diagnosticsLimit = 4000;
    private int eventDiagnosticsLimit = 1500;
    private int executorThreads = 4;
    private String workspaceRoot = System.getProperty("java.io.tmpdir");
    private boolean perProjectLock = true;
    private String generationModel = "";
    private String repairModel = "";
    private int maxTokens = 32000;

    public Duration budget() { return Duration.ofSeconds(budgetSeconds); }
    public Duration safetyMargin() { return Duration.ofSeconds(safetyMarginSeconds); }
    public Duration installTimeout() { return Duration.ofSeconds(installTimeoutSeconds); }
    public Duration buildTimeout() { return Duration.ofSeconds(buildTimeoutSeconds); }

    public int getBudgetSeconds() { return budgetSeconds; }
    public void setBudgetSeconds(int budgetSeconds) { this.budgetSeconds = budgetSeconds; }
    public int getSafetyMarginSeconds() { return safetyMarginSeconds; }
    public void setSafetyMarginSeconds(int safetyMarginSeconds) { this.safetyMarginSeconds = safetyMarginSeconds; }
    public int getMaxFixIterations() { return maxFixIterations; }
    public void setMaxFixIterations(int maxFixIterations) { this.maxFixIterations = maxFixIterations; }
    public String getInstallCommand() { return installCommand; }
    public void setInstallCommand(String installCommand) { this.installCommand = installCommand; }
    public String getBuildCommand() { return buildCommand; }
    public void setBuildCommand(String buildCommand) { this.buildCommand = buildCommand; }
    public int getInstallTimeoutSeconds() { return installTimeoutSeconds; }
    public void setInstallTimeoutSeconds(int installTimeoutSeconds) { this.installTimeoutSeconds = installTimeoutSeconds; }
    public int getBuildTimeoutSeconds() { return buildTimeoutSeconds; }
    public void setBuildTimeoutSeconds(int buildTimeoutSeconds) { this.buildTimeoutSeconds = buildTimeoutSeconds; }
    public int getDiagnosticsLimit() { return diagnosticsLimit; }
    public void setDiagnosticsLimit(int diagnosticsLimit) { this.diagnosticsLimit = diagnosticsLimit; }
    public int getEventDiagnosticsLimit() { return eventDiagnosticsLimit; }
    public void setEventDiagnosticsLimit(int eventDiagnosticsLimit) { this.eventDiagnosticsLimit = eventDiagnosticsLimit; }
    public int getExecutorThreads() { return executorThreads; }
    public void setExecutorThreads(int executorThreads) { this.executorThreads = executorThreads; }
    public String getWorkspaceRoot() { return workspaceRoot; }
    public void setWorkspaceRoot(String workspaceRoot) { this.workspaceRoot = workspaceRoot; }
    public boolean isPerProjectLock() { return perProjectLock; }
    public void setPerProjectLock(boolean perProjectLock) { this.perProjectLock = perProjectLock; }
    public String getGenerationModel() { return generationModel; }
    public void setGenerationModel(String generationModel) { this.generationModel = generationModel; }
    public String getRepairModel() { return repairModel; }
    public void setRepairModel(String repairModel) { this.repairModel = repairModel; }
    public int getMaxTokens() { return maxTokens; }
    public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
}
