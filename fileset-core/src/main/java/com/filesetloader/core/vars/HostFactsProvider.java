package com.filesetloader.core.vars;

import java.io.IOException;

/**
 * Source of the local host name used for the {@code builtin} variables.
 *
 * <p>
 * Injected into the resolver so that tests and callers with a known host
 * name do not depend on the machine they run on.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface HostFactsProvider {

    /**
     * @return the host name, possibly fully qualified
     * @throws IOException if the host name cannot be determined
     */
    String getHostName() throws IOException;

    /**
     * @param hostName the host name to report, e.g. {@code web01.example.com}
     * @return a provider that always reports {@code hostName}
     */
    static HostFactsProvider fixed(String hostName) {
        return () -> hostName;
    }

    /**
     * @return a provider backed by the local network stack
     */
    static HostFactsProvider local() {
        return new LocalHostFactsProvider();
    }
}
