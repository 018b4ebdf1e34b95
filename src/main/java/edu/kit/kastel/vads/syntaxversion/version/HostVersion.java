package edu.kit.kastel.vads.syntaxversion.version;

import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.Properties;

/**
 * Resolves the version of the host runtime, used as the default ceiling of a detection.
 * Looks at the {@value #PROPERTY} system property first, then the {@value #ENVIRONMENT_VARIABLE}
 * environment variable.
 */
public final class HostVersion {

    public static final String PROPERTY = "syntaxversion.host";
    public static final String ENVIRONMENT_VARIABLE = "SYNTAXVERSION_HOST";

    private HostVersion() {
    }

    public static Version resolve() {
        return resolve(System.getProperties(), System.getenv());
    }

    static Version resolve(Properties properties, Map<String, String> environment) {
        String configured = nonBlank(properties.getProperty(PROPERTY));
        if (configured == null) {
            configured = nonBlank(environment.get(ENVIRONMENT_VARIABLE));
        }
        if (configured == null) {
            throw new IllegalStateException(
                "host version not configured. Set -D" + PROPERTY + " or " + ENVIRONMENT_VARIABLE + " to major.minor"
            );
        }
        try {
            return Version.parse(configured);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("invalid host version '" + configured + "'", e);
        }
    }

    private static @Nullable String nonBlank(@Nullable String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
