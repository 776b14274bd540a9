package dev.nishisan.monitor.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertPolicyConfig {

    private String activeWindow; // "1h"
    private boolean includeDefaultRules = true;
    private List<AlertRuleConfig> rules = Collections.emptyList();

    public String getActiveWindow() {
        return activeWindow;
    }

    public void setActiveWindow(String activeWindow) {
        this.activeWindow = activeWindow;
    }

    public boolean isIncludeDefaultRules() {
        return includeDefaultRules;
    }

    public void setIncludeDefaultRules(boolean includeDefaultRules) {
        this.includeDefaultRules = includeDefaultRules;
    }

    public List<AlertRuleConfig> getRules() {
        return rules;
    }

    public void setRules(List<AlertRuleConfig> rules) {
        this.rules = rules;
    }
}
