package com.filesetloader.core.vars;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * {@link HostFactsProvider} asking the local network stack for the host
 * name, falling back to the {@code HOSTNAME} / {@code COMPUTERNAME}
 * environment variables when the lookup fails.
 *
 * @since 1.0.0
 */
public final class LocalHostFactsProvider implements HostFactsProvider {

    private static final Logger LOG = LoggerFactory.getLogger(LocalHostFactsProvider.class);

    @Override
    public String getHostName() throws UnknownHostException {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String fromEnv = fromEnvironment();
            if (fromEnv == null) {
                throw e;
            }
            LOG.warn("Local host lookup failed ({}), using host name from environment: {}",
                    e.getMessage(), fromEnv);
            return fromEnv;
        }
    }

    private static String fromEnvironment() {
        for (String name : new String[] { "HOSTNAME", "COMPUTERNAME" }) {
            String value = System.getenv(name);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
