package com.dagrun.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "dagrun")
public class DagrunProperties {

    private Summary summary = new Summary();
    private Metrics metrics = new Metrics();
    private Scheduler scheduler = new Scheduler();
    private Map<String, Integer> resources = new LinkedHashMap<>();

    public Summary getSummary() { return summary; }
    public void setSummary(Summary summary) { this.summary = summary; }
    public Metrics getMetrics() { return metrics; }
    public void setMetrics(Metrics metrics) { this.metrics = metrics; }
    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }

    /** Capacity of the shared resource pool, by resource name. */
    public Map<String, Integer> getResources() { return resources; }
    public void setResources(Map<String, Integer> resources) { this.resources = resources; }

    public static class Summary {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class Metrics {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class Scheduler {
        /**
         * Clean up cleanable tasks that have no dependents, i.e. requested roots, right after
         * they finish. Disable to keep root outputs.
         */
        private boolean cleanupRoots = true;

        public boolean isCleanupRoots() { return cleanupRoots; }
        public void setCleanupRoots(boolean cleanupRoots) { this.cleanupRoots = cleanupRoots; }
    }
}
