package com.pawpal.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "pawpal")
public class PawPalProperties {

    private Planner planner = new Planner();

    // -- Planner accessors (delegate to nested) --
    public int getDefaultBudgetMinutes() { return planner.defaultBudgetMinutes; }
    public int getMaxBudgetMinutes() { return planner.maxBudgetMinutes; }

    public Planner getPlanner() { return planner; }
    public void setPlanner(Planner planner) { this.planner = planner; }

    public static class Planner {
        /** Budget applied when an owner document does not state one. */
        private int defaultBudgetMinutes = 120;
        /** Largest budget accepted from input documents. */
        private int maxBudgetMinutes = 480;

        public int getDefaultBudgetMinutes() { return defaultBudgetMinutes; }
        public void setDefaultBudgetMinutes(int defaultBudgetMinutes) { this.defaultBudgetMinutes = defaultBudgetMinutes; }
        public int getMaxBudgetMinutes() { return maxBudgetMinutes; }
        public void setMaxBudgetMinutes(int maxBudgetMinutes) { this.maxBudgetMinutes = maxBudgetMinutes; }
    }
}
