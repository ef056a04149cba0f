package com.pawpal.core.model;

import java.util.List;

/**
 * Pass/fail summary over an itemized list of conflict descriptions.
 */
public record ConflictReport(List<String> conflicts) {

    public ConflictReport {
        conflicts = List.copyOf(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    public int count() {
        return conflicts.size();
    }

    public String render() {
        if (conflicts.isEmpty()) {
            return "No scheduling conflicts detected.";
        }
        var sb = new StringBuilder();
        sb.append("SCHEDULING CONFLICTS DETECTED (").append(conflicts.size()).append(")\n");
        for (String conflict : conflicts) {
            sb.append("  ").append(conflict).append('\n');
        }
        return sb.toString();
    }
}
