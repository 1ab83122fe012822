package com.vidnyan.dokita.domain.check;

import com.vidnyan.dokita.domain.finding.CheckCode;
import com.vidnyan.dokita.domain.finding.Finding;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-check enable/disable switches.
 * A code missing from the map is enabled. Immutable; shared read-only by all concurrent checks.
 */
public record CheckRegistry(Map<String, Boolean> enabled) {

    private static final CheckRegistry DEFAULT = new CheckRegistry(Map.of());

    public CheckRegistry {
        enabled = Map.copyOf(enabled);
    }

    public static CheckRegistry defaults() {
        return DEFAULT;
    }

    public boolean isEnabled(String code) {
        return enabled.getOrDefault(code, true);
    }

    public boolean isEnabled(CheckCode code) {
        return isEnabled(code.code());
    }

    /**
     * Whether a finding survives filtering. Ungated codes always do.
     */
    public boolean permits(Finding finding) {
        return !CheckCode.isGated(finding.code()) || isEnabled(finding.code());
    }

    public List<Finding> filter(List<Finding> findings) {
        return findings.stream()
                .filter(this::permits)
                .toList();
    }

    /**
     * Builder-style method to switch one code.
     */
    public CheckRegistry with(String code, boolean isEnabled) {
        var copy = new HashMap<>(enabled);
        copy.put(code, isEnabled);
        return new CheckRegistry(copy);
    }
}
