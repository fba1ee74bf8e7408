package org.energysaving.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.security.CodeSource;

/**
 * Loads the HOCON configuration of the command line tool.
 * <p>
 * Layers, highest priority first: JVM system properties, environment variables, the selected
 * configuration file, {@code reference.conf}. Substitutions are resolved after all layers are
 * stacked, so {@code ${...}} references in {@code reference.conf} see user overrides.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "energysaving.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives messages about which configuration file was picked.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Picks the configuration file and loads it.
     * <p>
     * The first existing candidate wins:
     * <ol>
     *   <li>the {@code --config} option</li>
     *   <li>{@code -Dconfig.file}</li>
     *   <li>{@code config/energysaving.conf} in the working directory</li>
     *   <li>{@code config/energysaving.conf} next to the {@code lib} directory of the running jar</li>
     * </ol>
     * Without a candidate only the classpath defaults are used.
     *
     * @param explicitConfigFile File from {@code --config}, or null
     * @param handler            Receives resolution messages
     * @return Resolved configuration
     * @throws IllegalArgumentException if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException if parsing or resolution fails
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExists(explicitConfigFile, "--config");
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            requireExists(systemConfigFile, "-Dconfig.file");
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: "
                + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        final File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + workingDirFile.getAbsolutePath());
            return loadFromFile(workingDirFile);
        }

        final File installationFile = installationConfigFile();
        if (installationFile != null) {
            handler.log(MessageLevel.INFO, "Using installation configuration file " + installationFile.getAbsolutePath());
            return loadFromFile(installationFile);
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
            + " found, using classpath defaults");
        return loadDefaults();
    }

    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    private static void requireExists(final File file, final String source) {
        if (!file.exists()) {
            throw new IllegalArgumentException(
                "Configuration file given by " + source + " not found: " + file.getAbsolutePath());
        }
    }

    /**
     * Looks for {@code APP_HOME/config/energysaving.conf} where the jar lives in {@code APP_HOME/lib}.
     *
     * @return The file, or null when not running from a jar or the file does not exist
     */
    private static File installationConfigFile() {
        final CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return null;
        }
        final File location;
        try {
            location = new File(codeSource.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        if (!location.isFile() || location.getParentFile() == null || location.getParentFile().getParentFile() == null) {
            return null;
        }
        final File candidate = new File(new File(location.getParentFile().getParentFile(), CONFIG_DIR), CONFIG_FILE_NAME);
        return candidate.exists() ? candidate : null;
    }
}
