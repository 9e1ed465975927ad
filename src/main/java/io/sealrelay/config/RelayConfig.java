package io.sealrelay.config;

import io.sealrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Data root layout of a relay plus the settings read from {@code <root>/sealrelay-settings.json}.
 */
public final class RelayConfig {
    public static final String SETTINGS_FILE = "sealrelay-settings.json";
    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 8080;
    public static final int DEFAULT_SERVER_THREADS = 0;
    public static final String ENV_HOST = "SEALRELAY_HOST";
    public static final String ENV_PORT = "SEALRELAY_PORT";

    private final Path rootDir;
    private final RelaySettings settings;

    public RelayConfig(Path rootDir, RelaySettings settings) {
        this.rootDir = rootDir;
        this.settings = settings;
    }

    public static RelayConfig fromRoot(String root) {
        return fromRoot(root, System.getenv());
    }

    public static RelayConfig fromRoot(String root, Map<String, String> env) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        RelaySettings settings = RelaySettings.load(base.resolve(SETTINGS_FILE)).withEnv(env);
        return new RelayConfig(base, settings);
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("relay.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditLog() {
        return auditRoot().resolve("audit.log");
    }

    public RelaySettings settings() {
        return settings;
    }

    public record RelaySettings(String host, int port, int serverThreads, String auditSigningSecret) {
        public static RelaySettings defaults() {
            return new RelaySettings(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_SERVER_THREADS, "");
        }

        static RelaySettings load(Path file) {
            RelaySettings defaults = defaults();
            if (!Files.isRegularFile(file)) {
                return defaults;
            }
            try {
                return fromFile(Jsons.compact().readValue(file.toFile(), RelaySettingsFile.class), defaults);
            } catch (IOException e) {
                throw new RuntimeException("Failed to read relay settings: " + file, e);
            }
        }

        static RelaySettings fromFile(RelaySettingsFile file, RelaySettings defaults) {
            if (file == null) {
                return defaults;
            }
            String host = file.host() == null || file.host().isBlank() ? defaults.host() : file.host().trim();
            int port = sanitizePort(file.port(), defaults.port());
            int serverThreads = sanitizeInt(file.serverThreads(), defaults.serverThreads(), 0);
            String secret = file.auditSigningSecret() == null ? defaults.auditSigningSecret() : file.auditSigningSecret();
            return new RelaySettings(host, port, serverThreads, secret);
        }

        RelaySettings withEnv(Map<String, String> env) {
            String envHost = env.get(ENV_HOST);
            String envPort = env.get(ENV_PORT);
            String resolvedHost = envHost == null || envHost.isBlank() ? host : envHost.trim();
            int resolvedPort = port;
            if (envPort != null && !envPort.isBlank()) {
                try {
                    resolvedPort = sanitizePort(Integer.parseInt(envPort.trim()), port);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(ENV_PORT + " must be an integer: " + envPort, e);
                }
            }
            return new RelaySettings(resolvedHost, resolvedPort, serverThreads, auditSigningSecret);
        }

        private static int sanitizePort(Integer raw, int fallback) {
            if (raw == null || raw < 0 || raw > 65_535) {
                return fallback;
            }
            return raw;
        }

        private static int sanitizeInt(Integer raw, int fallback, int min) {
            if (raw == null) {
                return fallback;
            }
            return Math.max(min, raw);
        }
    }

    record RelaySettingsFile(
            String host,
            Integer port,
            Integer serverThreads,
            String auditSigningSecret
    ) {
    }
}
