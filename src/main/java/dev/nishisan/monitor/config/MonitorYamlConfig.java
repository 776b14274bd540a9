package dev.nishisan.monitor.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class MonitorYamlConfig {

    @JsonProperty("shards")
    private Integer shards;

    @JsonProperty("lockTimeout")
    private String lockTimeout;

    @JsonProperty("timerReservoir")
    private Integer timerReservoir;

    @JsonProperty("maintenanceInterval")
    private String maintenanceInterval;

    @JsonProperty("execution")
    private ExecutionPolicyConfig execution;

    @JsonProperty("alerts")
    private AlertPolicyConfig alerts;

    @JsonProperty("dashboard")
    private DashboardConfig dashboard;

    public Integer getShards() {
        return shards;
    }

    public void setShards(Integer shards) {
        this.shards = shards;
    }

    public String getLockTimeout() {
        return lockTimeout;
    }

    public void setLockTimeout(String lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    public Integer getTimerReservoir() {
        return timerReservoir;
    }

    public void setTimerReservoir(Integer timerReservoir) {
        this.timerReservoir = timerReservoir;
    }

    public String getMaintenanceInterval() {
        return maintenanceInterval;
    }

    public void setMaintenanceInterval(String maintenanceInterval) {
        this.maintenanceInterval = maintenanceInterval;
    }

    public ExecutionPolicyConfig getExecution() {
        return execution;
    }

    public void setExecution(ExecutionPolicyConfig execution) {
        this.execution = execution;
    }

    public AlertPolicyConfig getAlerts() {
        return alerts;
    }

    public void setAlerts(AlertPolicyConfig alerts) {
        this.alerts = alerts;
    }

    public DashboardConfig getDashboard() {
        return dashboard;
    }

    public void setDashboard(DashboardConfig dashboard) {
        this.dashboard = dashboard;
    }
}
