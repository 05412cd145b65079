package com.filesetloader.core.fileset;

import com.filesetloader.core.template.MissingKeyPolicy;
import com.filesetloader.core.vars.HostFactsProvider;
import com.filesetloader.core.vars.OperatingSystems;

import java.util.Objects;

/**
 * Environment-dependent settings of a fileset load: where the host name
 * comes from, which OS identifier selects variable overrides, and how
 * templates treat missing keys.
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #defaults()} for the running machine, or the {@link Builder}
 * to pin values (tests, cross-platform tooling).
 * </p>
 *
 * @since 1.0.0
 */
public final class FilesetOptions {

    private final HostFactsProvider hostFacts;
    private final String osName;
    private final MissingKeyPolicy missingKeyPolicy;

    private FilesetOptions(Builder b) {
        this.hostFacts = b.hostFacts;
        this.osName = b.osName;
        this.missingKeyPolicy = b.missingKeyPolicy;
    }

    /**
     * @return options for the local host and OS, with strict templates
     */
    public static FilesetOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public HostFactsProvider getHostFacts() {
        return hostFacts;
    }

    public String getOsName() {
        return osName;
    }

    public MissingKeyPolicy getMissingKeyPolicy() {
        return missingKeyPolicy;
    }

    @Override
    public String toString() {
        return "FilesetOptions{" +
                "osName='" + osName + '\'' +
                ", missingKeyPolicy=" + missingKeyPolicy +
                '}';
    }

    /**
     * Fluent builder for {@link FilesetOptions}.
     */
    public static class Builder {
        private HostFactsProvider hostFacts = HostFactsProvider.local();
        private String osName = OperatingSystems.current();
        private MissingKeyPolicy missingKeyPolicy = MissingKeyPolicy.STRICT;

        public Builder hostFacts(HostFactsProvider v) {
            this.hostFacts = v;
            return this;
        }

        /** Shortcut for {@code hostFacts(HostFactsProvider.fixed(hostName))}. */
        public Builder hostName(String hostName) {
            this.hostFacts = HostFactsProvider.fixed(hostName);
            return this;
        }

        public Builder osName(String v) {
            this.osName = v;
            return this;
        }

        public Builder missingKeyPolicy(MissingKeyPolicy v) {
            this.missingKeyPolicy = v;
            return this;
        }

        /**
         * @return validated options
         * @throws NullPointerException     if a value is {@code null}
         * @throws IllegalArgumentException if the OS name is blank
         */
        public FilesetOptions build() {
            Objects.requireNonNull(hostFacts, "hostFacts required");
            Objects.requireNonNull(osName, "osName required");
            Objects.requireNonNull(missingKeyPolicy, "missingKeyPolicy required");
            if (osName.isBlank()) {
                throw new IllegalArgumentException("osName must not be blank");
            }
            return new FilesetOptions(this);
        }
    }
}
