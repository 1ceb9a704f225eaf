package com.ensemblesentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link EnsembleConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * <li>{@link EnsembleConfig#defaults()} when no {@value #DEFAULT_RESOURCE}
 * is on the classpath</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link EnsembleConfig#validate()} after
 * parsing so that the application <strong>fails fast</strong> on an invalid
 * ensemble.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnsembleConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ENSEMBLE_CONFIG_PATH";

    /** Classpath resource consulted when no path is given. */
    public static final String DEFAULT_RESOURCE = "ensemble.yml";

    private EnsembleConfigLoader() {
        // not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the ensemble configuration using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws ConfigurationException if validation fails
     */
    public static EnsembleConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.isRegularFile(Path.of(envPath))) {
            LOG.info("Loading ensemble configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (EnsembleConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading ensemble configuration from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("No ensemble configuration found, using built-in defaults");
        EnsembleConfig config = EnsembleConfig.defaults();
        config.validate();
        return config;
    }

    /**
     * Load the configuration from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails
     * @throws ConfigurationException   if validation fails
     */
    public static EnsembleConfig fromFile(String path) {
        Objects.requireNonNull(path, "Ensemble configuration path must not be null");
        Path file = Path.of(path);
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Ensemble configuration file not found: " + path);
        }
        return read("file " + path, () -> Files.newInputStream(file));
    }

    /**
     * Load the configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails
     * @throws ConfigurationException   if validation fails
     */
    public static EnsembleConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        URL url = EnsembleConfigLoader.class.getClassLoader().getResource(resource);
        if (url == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        return read("classpath resource " + resource, url::openStream);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface YamlSource {
        InputStream open() throws IOException;
    }

    private static EnsembleConfig read(String origin, YamlSource source) {
        try (InputStream is = source.open()) {
            return parseAndValidate(is, origin);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read ensemble configuration from " + origin, e);
        }
    }

    private static EnsembleConfig parseAndValidate(InputStream is, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(EnsembleConfig.class, options));

        EnsembleConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException(
                    "Malformed ensemble configuration in " + origin + ": " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Ensemble configuration in {} is empty, using built-in defaults", origin);
            config = EnsembleConfig.defaults();
        } else if (config.getDetectors().isEmpty()) {
            LOG.warn("No detectors defined in {}, using the default detector set", origin);
            EnsembleConfig defaults = EnsembleConfig.defaults();
            config.setDetectors(defaults.getDetectors());
        }

        // Fail fast if anything is misconfigured
        config.validate();

        LOG.info("Loaded ensemble of {} detector(s) with quorum {} from {}",
                config.getDetectors().size(), config.effectiveQuorum(), origin);
        return config;
    }
}
