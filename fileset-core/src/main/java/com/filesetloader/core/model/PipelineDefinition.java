package com.filesetloader.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An ingest pipeline ready for registration: its ID and parsed JSON body.
 *
 * @since 1.0.0
 */
public final class PipelineDefinition {

    private final String id;
    private final Map<String, Object> body;

    public PipelineDefinition(String id, Map<String, Object> body) {
        this.id = Objects.requireNonNull(id, "Pipeline id must not be null");
        this.body = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(body, "Pipeline body must not be null")));
    }

    public String getId() {
        return id;
    }

    /**
     * @return unmodifiable pipeline document
     */
    public Map<String, Object> getBody() {
        return body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PipelineDefinition that))
            return false;
        return id.equals(that.id) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, body);
    }

    @Override
    public String toString() {
        return "PipelineDefinition{id='" + id + "', body=" + body.keySet() + '}';
    }
}
