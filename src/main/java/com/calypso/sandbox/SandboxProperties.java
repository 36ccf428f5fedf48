package com.calypso.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "calypso.sandbox")
public class SandboxProperties {

    /** {@code local} runs commands as child processes, {@code docker} in throwaway containers. */
    private String provider = "local";
    private String image = "node:22-alpine";
    private int memoryLimitMb = 2048;
    private int cpuCount = 2;

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getImage() { return image; }
    public void setImage(String image) { this.image = image; }
    public int getMemoryLimitMb() { return memoryLimitMb; }
    public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
    public int getCpuCount() { return cpuCount; }
    public void setCpuCount(int cpuCount) { this.cpuCount = cpuCount; }
}
