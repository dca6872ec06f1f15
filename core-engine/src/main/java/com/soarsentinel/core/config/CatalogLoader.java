package com.soarsentinel.core.config;

import com.soarsentinel.core.binding.BindingRegistry;
import com.soarsentinel.core.model.Playbook;
import com.soarsentinel.core.model.PlaybookBinding;
import com.soarsentinel.core.playbook.PlaybookRepository;
import com.soarsentinel.core.predicate.PredicateEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads and validates a {@link CatalogConfig} from YAML and seeds it into the
 * runtime repositories.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CATALOG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String, PredicateEvaluator)}</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every {@code load*} method validates after parsing, compiling each binding
 * predicate, so the service fails fast on a broken catalog instead of
 * silently never triggering.
 * </p>
 *
 * @since 1.0.0
 */
public final class CatalogLoader {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogLoader.class);

    /** Environment variable that can override the default catalog location. */
    public static final String ENV_CATALOG_PATH = "SOAR_CATALOG_PATH";

    public static final String DEFAULT_RESOURCE = "catalog.yml";

    private CatalogLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Loading
    // ---------------------------------------------------------------

    /**
     * Load the catalog using automatic resolution.
     *
     * @param explicitPath path to use when the environment variable is unset;
     *                     may be {@code null}
     * @throws IllegalStateException if validation fails
     */
    public static CatalogConfig load(String explicitPath, PredicateEvaluator predicates) {
        String envPath = System.getenv(ENV_CATALOG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading catalog from environment path: {}", envPath);
            return fromFile(envPath, predicates);
        }
        if (explicitPath != null && !explicitPath.isBlank()) {
            LOG.info("Loading catalog from path: {}", explicitPath);
            return fromFile(explicitPath, predicates);
        }
        LOG.info("Loading catalog from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE, predicates);
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static CatalogConfig fromFile(String path, PredicateEvaluator predicates) {
        Objects.requireNonNull(path, "Catalog file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, predicates);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Catalog file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read catalog file: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static CatalogConfig fromClasspath(String resource, PredicateEvaluator predicates) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = CatalogLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, predicates);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Seeding
    // ---------------------------------------------------------------

    /**
     * Save every playbook, then create every binding through the registry so
     * that the same rules apply as for operator-authored bindings.
     *
     * @return the stored bindings, with their assigned ids
     */
    public static List<PlaybookBinding> install(CatalogConfig catalog, PlaybookRepository playbooks,
            BindingRegistry bindings) {
        Objects.requireNonNull(catalog, "catalog must not be null");
        for (PlaybookDefinition definition : catalog.getPlaybooks()) {
            Playbook playbook = definition.toPlaybook();
            playbooks.save(playbook);
            LOG.debug("Seeded playbook {} '{}' v{}", playbook.getId(), playbook.getName(), playbook.getVersion());
        }
        List<PlaybookBinding> created = new ArrayList<>();
        for (BindingDefinition definition : catalog.getBindings()) {
            created.add(bindings.create(definition.toBinding()));
        }
        LOG.info("Installed catalog: {} playbook(s), {} binding(s)", catalog.getPlaybooks().size(), created.size());
        return created;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static CatalogConfig parseAndValidate(InputStream is, PredicateEvaluator predicates) {
        Objects.requireNonNull(predicates, "predicates must not be null");
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(CatalogConfig.class, options));
        CatalogConfig config = yaml.load(is);

        if (config == null) {
            LOG.warn("Catalog is empty");
            config = new CatalogConfig();
        } else {
            config.validate(predicates);
        }

        LOG.info("Loaded catalog with {} playbook(s) and {} binding(s)",
                config.getPlaybooks().size(), config.getBindings().size());
        return config;
    }
}
