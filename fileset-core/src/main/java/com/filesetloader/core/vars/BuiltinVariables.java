package com.filesetloader.core.vars;

import com.filesetloader.core.FilesetException;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the host facts exposed to templates under {@code builtin}.
 *
 * <p>
 * The host name is split on its first dot: {@code web01.example.com} gives
 * {@code hostname=web01} and {@code domain=example.com}. Without a dot the
 * domain is empty.
 * </p>
 *
 * @since 1.0.0
 */
public final class BuiltinVariables {

    public static final String HOSTNAME = "hostname";
    public static final String DOMAIN = "domain";

    private BuiltinVariables() {
        // utility class: not instantiable
    }

    /**
     * @param provider source of the host name; must not be {@code null}
     * @return unmodifiable {@code {hostname, domain}} map
     * @throws FilesetException of kind {@code HOST_RESOLUTION} if the host
     *                          name is unavailable or empty
     */
    public static Map<String, Object> compute(HostFactsProvider provider) {
        Objects.requireNonNull(provider, "HostFactsProvider must not be null");

        String host;
        try {
            host = provider.getHostName();
        } catch (IOException | RuntimeException e) {
            throw new FilesetException(FilesetException.Kind.HOST_RESOLUTION,
                    "Error getting the hostname: " + e.getMessage(), e);
        }
        if (host == null || host.isEmpty()) {
            throw new FilesetException(FilesetException.Kind.HOST_RESOLUTION,
                    "Error getting the hostname: host name is empty");
        }

        int dot = host.indexOf('.');
        Map<String, Object> builtin = new LinkedHashMap<>();
        builtin.put(HOSTNAME, dot < 0 ? host : host.substring(0, dot));
        builtin.put(DOMAIN, dot < 0 ? "" : host.substring(dot + 1));
        return Collections.unmodifiableMap(builtin);
    }
}
