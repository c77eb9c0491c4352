package io.surfworks.splitforge.core.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings for a SplitForge compilation.
 *
 * <p>Configuration is resolved in order of precedence:
 * <ol>
 *   <li>Explicit {@code with*} calls by the caller (highest priority)</li>
 *   <li>Environment overrides ({@value #ENV_TARGET}, {@value #ENV_LAUNCH_DIAGNOSTICS})</li>
 *   <li>Config file ({@code ~/.config/splitforge/compiler.json})</li>
 *   <li>Defaults (lowest priority)</li>
 * </ol>
 *
 * @param target                backend identifier for device code ("cuda", "hip", ...)
 * @param hostTarget            backend identifier for the host entry function
 * @param emitLaunchDiagnostics whether device code carries launch-extent comments
 * @param outputDir             where generated sources are written (may be null)
 */
public record CompilerConfig(
        String target,
        String hostTarget,
        boolean emitLaunchDiagnostics,
        Path outputDir
) {

    /** Default device backend */
    public static final String DEFAULT_TARGET = "cuda";

    /** Default host backend */
    public static final String DEFAULT_HOST_TARGET = "c";

    /** Environment variable overriding the device backend */
    public static final String ENV_TARGET = "SPLITFORGE_TARGET";

    /** Environment variable toggling launch-extent comments ("true"/"false") */
    public static final String ENV_LAUNCH_DIAGNOSTICS = "SPLITFORGE_LAUNCH_DIAGNOSTICS";

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "splitforge"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "compiler.json";

    public CompilerConfig {
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(hostTarget, "hostTarget cannot be null");
        if (target.isBlank()) {
            throw new IllegalArgumentException("target cannot be blank");
        }
        if (hostTarget.isBlank()) {
            throw new IllegalArgumentException("hostTarget cannot be blank");
        }
    }

    public static CompilerConfig defaults() {
        return new CompilerConfig(DEFAULT_TARGET, DEFAULT_HOST_TARGET, true, null);
    }

    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public CompilerConfig withTarget(String newTarget) {
        return new CompilerConfig(newTarget, hostTarget, emitLaunchDiagnostics, outputDir);
    }

    public CompilerConfig withHostTarget(String newHostTarget) {
        return new CompilerConfig(target, newHostTarget, emitLaunchDiagnostics, outputDir);
    }

    public CompilerConfig withLaunchDiagnostics(boolean enabled) {
        return new CompilerConfig(target, hostTarget, enabled, outputDir);
    }

    public CompilerConfig withOutputDir(Path dir) {
        return new CompilerConfig(target, hostTarget, emitLaunchDiagnostics, dir);
    }
}
