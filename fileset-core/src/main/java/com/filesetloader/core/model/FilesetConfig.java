package com.filesetloader.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * User configuration of one fileset.
 *
 * <pre>
 * access:
 *   enabled: true
 *   var:
 *     paths: ["/srv/logs/access.log"]
 *   prospector:
 *     close_eof: true
 * </pre>
 *
 * <p>
 * {@code var} entries replace resolved manifest variables verbatim;
 * {@code prospector} is deep-merged over the materialized prospector
 * configuration.
 * </p>
 *
 * @since 1.0.0
 */
public class FilesetConfig {

    private boolean enabled = true;

    private Map<String, Object> var = new LinkedHashMap<>();

    private Map<String, Object> prospector = new LinkedHashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * @return unmodifiable variable overrides
     */
    public Map<String, Object> getVar() {
        return Collections.unmodifiableMap(var);
    }

    public void setVar(Map<String, Object> var) {
        this.var = var != null ? new LinkedHashMap<>(var) : new LinkedHashMap<>();
    }

    /**
     * @return unmodifiable prospector override document
     */
    public Map<String, Object> getProspector() {
        return Collections.unmodifiableMap(prospector);
    }

    public void setProspector(Map<String, Object> prospector) {
        this.prospector = prospector != null ? new LinkedHashMap<>(prospector) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "FilesetConfig{" +
                "enabled=" + enabled +
                ", var=" + var +
                ", prospector=" + prospector +
                '}';
    }
}
