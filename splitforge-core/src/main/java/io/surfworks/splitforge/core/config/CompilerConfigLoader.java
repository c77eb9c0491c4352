package io.surfworks.splitforge.core.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Loads and saves {@link CompilerConfig}.
 *
 * <p>A missing or unreadable config file yields the defaults; environment
 * overrides are applied on top.
 */
public final class CompilerConfigLoader {

    private static final Logger LOG = Logger.getLogger(CompilerConfigLoader.class.getName());

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private CompilerConfigLoader() {
    }

    /**
     * Loads configuration from the default config file and the process environment.
     */
    public static CompilerConfig load() {
        return load(CompilerConfig.configFile(), System.getenv());
    }

    /**
     * Loads configuration from a specific file and environment.
     *
     * @param configFile path to the config file
     * @param env        environment variables to consult for overrides
     * @return the resolved configuration
     */
    public static CompilerConfig load(Path configFile, Map<String, String> env) {
        CompilerConfig config = CompilerConfig.defaults();

        if (Files.exists(configFile)) {
            config = loadFromFile(configFile, config);
        }

        return applyEnvironment(config, env);
    }

    /**
     * Saves configuration to a specific file.
     *
     * @throws IOException if writing fails
     */
    public static void save(CompilerConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        StoredConfig stored = new StoredConfig();
        stored.target = config.target();
        stored.hostTarget = config.hostTarget();
        stored.emitLaunchDiagnostics = config.emitLaunchDiagnostics();
        stored.outputDir = config.outputDir() == null ? null : config.outputDir().toString();
        Files.writeString(configFile, GSON.toJson(stored));
    }

    private static CompilerConfig loadFromFile(Path configFile, CompilerConfig base) {
        try {
            StoredConfig stored = GSON.fromJson(Files.readString(configFile), StoredConfig.class);
            if (stored == null) {
                return base;
            }
            CompilerConfig config = base;
            if (stored.target != null && !stored.target.isBlank()) {
                config = config.withTarget(stored.target);
            }
            if (stored.hostTarget != null && !stored.hostTarget.isBlank()) {
                config = config.withHostTarget(stored.hostTarget);
            }
            if (stored.emitLaunchDiagnostics != null) {
                config = config.withLaunchDiagnostics(stored.emitLaunchDiagnostics);
            }
            if (stored.outputDir != null) {
                config = config.withOutputDir(Path.of(stored.outputDir));
            }
            return config;
        } catch (IOException | JsonParseException e) {
            LOG.warning("Ignoring unreadable config file " + configFile + ": " + e.getMessage());
            return base;
        }
    }

    private static CompilerConfig applyEnvironment(CompilerConfig config, Map<String, String> env) {
        String target = env.get(CompilerConfig.ENV_TARGET);
        if (target != null && !target.isBlank()) {
            config = config.withTarget(target.trim().toLowerCase(Locale.ROOT));
        }

        String diagnostics = env.get(CompilerConfig.ENV_LAUNCH_DIAGNOSTICS);
        if (diagnostics != null) {
            String value = diagnostics.trim().toLowerCase(Locale.ROOT);
            if (value.equals("true") || value.equals("false")) {
                config = config.withLaunchDiagnostics(Boolean.parseBoolean(value));
            } else {
                LOG.warning("Ignoring " + CompilerConfig.ENV_LAUNCH_DIAGNOSTICS + "=" + diagnostics
                        + " (expected true or false)");
            }
        }
        return config;
    }

    /**
     * JSON shape of the config file. Absent fields keep their defaults.
     */
    private static final class StoredConfig {
        String target;
        String hostTarget;
        Boolean emitLaunchDiagnostics;
        String outputDir;
    }
}
