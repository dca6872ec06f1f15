package com.soarsentinel.core.config;

import com.soarsentinel.core.binding.BindingRegistry;
import com.soarsentinel.core.binding.InMemoryBindingStore;
import com.soarsentinel.core.model.Playbook;
import com.soarsentinel.core.model.PlaybookBinding;
import com.soarsentinel.core.model.PlaybookStep;
import com.soarsentinel.core.model.StepErrorPolicy;
import com.soarsentinel.core.playbook.InMemoryPlaybookRepository;
import com.soarsentinel.core.predicate.PredicateEvaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CatalogLoader}.
 */
class CatalogLoaderTest {

    private final PredicateEvaluator predicates = new PredicateEvaluator();

    @Test
    @DisplayName("Should load playbooks and bindings from the classpath")
    void shouldLoadFromClasspath() {
        CatalogConfig config = CatalogLoader.fromClasspath("test-catalog.yml", predicates);

        assertThat(config.getPlaybooks()).extracting(PlaybookDefinition::getId).containsExactly(10L, 11L);
        assertThat(config.getBindings()).hasSize(2);
        assertThat(config.getBindings().get(0).getPredicate()).isEqualTo("severity == 'high'");
        assertThat(config.getBindings().get(1).isActive()).isTrue();
    }

    @Test
    @DisplayName("Playbook definitions convert to ordered steps with their error policy")
    void shouldConvertPlaybooks() {
        Playbook playbook = CatalogLoader.fromClasspath("test-catalog.yml", predicates)
                .getPlaybooks().get(0).toPlaybook();

        assertThat(playbook.getName()).isEqualTo("Block and note");
        assertThat(playbook.getVersion()).isEqualTo(1);
        assertThat(playbook.isActive()).isTrue();
        assertThat(playbook.getSteps()).extracting(PlaybookStep::getStepKey).containsExactly("block", "note");
        PlaybookStep block = playbook.getSteps().get(0);
        assertThat(block.getOnError()).isEqualTo(StepErrorPolicy.CONTINUE);
        assertThat(block.getTimeoutMs()).isEqualTo(2000L);
        assertThat(block.getRetries()).isEqualTo(1);
        assertThat(block.getInputs()).containsEntry("ip", "{{ sourceIp }}");
    }

    @Test
    @DisplayName("Should report every problem of an invalid catalog at once")
    void shouldAggregateValidationErrors() {
        assertThatThrownBy(() -> CatalogLoader.fromClasspath("invalid-catalog.yml", predicates))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Catalog validation failed:")
                .hasMessageContaining("duplicate step key 'first'")
                .hasMessageContaining("Unknown onError policy: 'explode'")
                .hasMessageContaining("invalid predicate")
                .hasMessageContaining("unknown playbook 404");
    }

    @Test
    @DisplayName("An empty document yields an empty catalog")
    void shouldTreatEmptyDocumentAsEmptyCatalog() {
        CatalogConfig config = CatalogLoader.fromClasspath("empty-catalog.yml", predicates);

        assertThat(config.getPlaybooks()).isEmpty();
        assertThat(config.getBindings()).isEmpty();
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> CatalogLoader.fromClasspath("does-not-exist.yml", predicates))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load from a file and reject a missing file")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("catalog.yml");
        Files.writeString(file, String.join("\n",
                "playbooks:",
                "  - id: 1",
                "    organizationId: 1",
                "    name: Only",
                "    steps:",
                "      - sequence: 1",
                "        key: note",
                "        action: log_message",
                ""));

        assertThat(CatalogLoader.fromFile(file.toString(), predicates).getPlaybooks()).hasSize(1);
        assertThat(CatalogLoader.load(file.toString(), predicates).getPlaybooks()).hasSize(1);
        assertThatThrownBy(() -> CatalogLoader.fromFile(dir.resolve("missing.yml").toString(), predicates))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Catalog file not found");
    }

    @Test
    @DisplayName("Should reject duplicate YAML keys")
    void shouldRejectDuplicateKeys(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("dup.yml");
        Files.writeString(file, "playbooks: []\nplaybooks: []\n");

        assertThatThrownBy(() -> CatalogLoader.fromFile(file.toString(), predicates))
                .hasMessageContaining("duplicate key");
    }

    @Test
    @DisplayName("install seeds playbooks and creates bindings through the registry")
    void shouldInstallCatalog() {
        CatalogConfig config = CatalogLoader.fromClasspath("test-catalog.yml", predicates);
        InMemoryPlaybookRepository playbooks = new InMemoryPlaybookRepository();
        BindingRegistry registry = new BindingRegistry(new InMemoryBindingStore(), playbooks, predicates,
                Clock.systemUTC());

        List<PlaybookBinding> installed = CatalogLoader.install(config, playbooks, registry);

        assertThat(playbooks.findByOrganization(3)).hasSize(2);
        assertThat(installed).hasSize(2).allSatisfy(b -> assertThat(b.getId()).isPositive());
        assertThat(registry.findMatches("alert.created", 3)).extracting(PlaybookBinding::getPlaybookId)
                .containsExactly(10L, 11L);
    }
}
