package dev.nishisan.monitor.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ExecutionPolicyConfig {

    private String retention; // "1h"
    private Integer maxRetained;
    private String staleCeiling; // "24h"
    private String sweepInterval;

    public String getRetention() {
        return retention;
    }

    public void setRetention(String retention) {
        this.retention = retention;
    }

    public Integer getMaxRetained() {
        return maxRetained;
    }

    public void setMaxRetained(Integer maxRetained) {
        this.maxRetained = maxRetained;
    }

    public String getStaleCeiling() {
        return staleCeiling;
    }

    public void setStaleCeiling(String staleCeiling) {
        this.staleCeiling = staleCeiling;
    }

    public String getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(String sweepInterval) {
        this.sweepInterval = sweepInterval;
    }
}
