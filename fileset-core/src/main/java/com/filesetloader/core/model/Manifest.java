package com.filesetloader.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Contents of a fileset's {@code manifest.yml}.
 *
 * <pre>
 * module_version: 1.0
 * var:
 *   - name: paths
 *     default:
 *       - /var/log/nginx/access.log*
 * ingest_pipeline: ingest/default.json
 * prospector: config/nginx-access.yml
 * </pre>
 *
 * <p>
 * The {@code var} entries are kept in their raw form and in manifest order;
 * they are validated when resolved. Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class Manifest {

    public static final String MODULE_VERSION = "module_version";
    public static final String VAR = "var";
    public static final String INGEST_PIPELINE = "ingest_pipeline";
    public static final String PROSPECTOR = "prospector";

    private final String moduleVersion;
    private final List<Map<String, Object>> vars;
    private final String ingestPipeline;
    private final String prospector;

    public Manifest(String moduleVersion, List<Map<String, Object>> vars, String ingestPipeline,
            String prospector) {
        this.moduleVersion = moduleVersion;
        List<Map<String, Object>> copy = new ArrayList<>();
        if (vars != null) {
            for (Map<String, Object> var : vars) {
                copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(var)));
            }
        }
        this.vars = Collections.unmodifiableList(copy);
        this.ingestPipeline = ingestPipeline;
        this.prospector = prospector;
    }

    public String getModuleVersion() {
        return moduleVersion;
    }

    /**
     * @return unmodifiable raw variable declarations, in manifest order
     */
    public List<Map<String, Object>> getVars() {
        return vars;
    }

    public String getIngestPipeline() {
        return ingestPipeline;
    }

    public String getProspector() {
        return prospector;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Manifest that))
            return false;
        return Objects.equals(moduleVersion, that.moduleVersion)
                && vars.equals(that.vars)
                && Objects.equals(ingestPipeline, that.ingestPipeline)
                && Objects.equals(prospector, that.prospector);
    }

    @Override
    public int hashCode() {
        return Objects.hash(moduleVersion, vars, ingestPipeline, prospector);
    }

    @Override
    public String toString() {
        return "Manifest{" +
                "moduleVersion='" + moduleVersion + '\'' +
                ", vars=" + vars.size() +
                ", ingestPipeline='" + ingestPipeline + '\'' +
                ", prospector='" + prospector + '\'' +
                '}';
    }
}
