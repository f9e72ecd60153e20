package com.scoutengine.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads the detection rule catalog ({@link RulesConfig}) from YAML.
 *
 * <h3>Where the catalog comes from</h3>
 * <ol>
 * <li>the file named by {@value #ENV_RULES_PATH}, when that file exists</li>
 * <li>a path given to {@link #fromFile(String)}</li>
 * <li>a classpath resource given to {@link #fromClasspath(String)};
 * {@link #load()} falls back to {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * A catalog is checked with {@link RulesConfig#validate()} as soon as it is
 * parsed. Every entry point therefore either returns rules the factory can
 * compile or throws {@link IllegalStateException} listing each broken rule.
 * An empty document yields an empty catalog.
 * </p>
 *
 * @since 1.0.0
 */
public final class RulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RulesLoader.class);

    /** Names a rule catalog file that replaces the bundled one. */
    public static final String ENV_RULES_PATH = "RULES_CONFIG_PATH";

    /** Catalog bundled with the engine. */
    public static final String DEFAULT_RESOURCE = "rules.yml";

    private RulesLoader() {
        // utility class - not instantiable
    }

    // ---------------------------------------------------------------
    // Entry points
    // ---------------------------------------------------------------

    /**
     * Read the catalog named by the process environment, or the bundled one.
     *
     * @throws IllegalStateException if the catalog cannot be read or is invalid
     */
    public static RulesConfig load() {
        return load(System::getenv);
    }

    /**
     * Read the catalog named by {@value #ENV_RULES_PATH} in {@code env}. An
     * unset, blank or dangling path selects {@value #DEFAULT_RESOURCE}.
     *
     * @param env returns the value of a variable, or {@code null} if unset
     */
    public static RulesConfig load(Function<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        Optional<Path> override = overridePath(env.apply(ENV_RULES_PATH));
        if (override.isPresent()) {
            LOG.info("Rule catalog overridden by {}: {}", ENV_RULES_PATH, override.get());
            return fromFile(override.get().toString());
        }
        LOG.info("Using bundled rule catalog {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path YAML file; must not be {@code null}
     * @throws IllegalArgumentException if no file exists at {@code path}
     * @throws IllegalStateException    if the file cannot be read or is invalid
     */
    public static RulesConfig fromFile(String path) {
        Objects.requireNonNull(path, "Rules file path must not be null");
        try (InputStream in = Files.newInputStream(Path.of(path))) {
            return read(in, path);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Rules file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read rules file " + path, new UncheckedIOException(e));
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @throws IllegalArgumentException if the resource is not on the classpath
     * @throws IllegalStateException    if the resource cannot be read or is invalid
     */
    public static RulesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream in = RulesLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Rules resource not found on classpath: " + resource);
        }
        try (in) {
            return read(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read rules resource " + resource, new UncheckedIOException(e));
        }
    }

    /**
     * Parse a catalog from an open stream, which the caller still owns.
     */
    public static RulesConfig fromStream(InputStream in) {
        Objects.requireNonNull(in, "Input stream must not be null");
        return read(in, "<stream>");
    }

    // ---------------------------------------------------------------
    // Parsing
    // ---------------------------------------------------------------

    private static Optional<Path> overridePath(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        Path path = Path.of(value.trim());
        if (!Files.isRegularFile(path)) {
            LOG.warn("{} points at {}, which is not a file; ignoring it", ENV_RULES_PATH, path);
            return Optional.empty();
        }
        return Optional.of(path);
    }

    private static RulesConfig read(InputStream in, String origin) {
        RulesConfig config = parse(in, origin);
        if (config == null || config.getRules().isEmpty()) {
            LOG.warn("Rule catalog {} defines no rules", origin);
            return new RulesConfig();
        }
        config.validate();
        LOG.info("Read {} rule(s) from {}", config.getRules().size(), origin);
        return config;
    }

    private static RulesConfig parse(InputStream in, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        try {
            return new Yaml(new Constructor(RulesConfig.class, options)).load(in);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed rules YAML in " + origin + ": " + e.getMessage(), e);
        }
    }
}
