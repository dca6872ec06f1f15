package com.soarsentinel.core.config;

import com.soarsentinel.core.predicate.PredicateEvaluator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Top-level POJO for the catalog YAML: seed playbooks and the bindings that
 * trigger them.
 *
 * <pre>
 * playbooks:
 *   - id: 1
 *     organizationId: 1
 *     name: Contain critical source
 *     steps:
 *       - sequence: 1
 *         key: block
 *         action: block_ip
 *         inputs:
 *           ip: "{{ sourceIp }}"
 * bindings:
 *   - eventType: alert.created
 *     organizationId: 1
 *     playbookId: 1
 *     predicate: "severity == 'critical'"
 * </pre>
 *
 * @since 1.0.0
 */
public class CatalogConfig {

    private List<PlaybookDefinition> playbooks = new ArrayList<>();
    private List<BindingDefinition> bindings = new ArrayList<>();

    public List<PlaybookDefinition> getPlaybooks() {
        return Collections.unmodifiableList(playbooks);
    }

    public void setPlaybooks(List<PlaybookDefinition> playbooks) {
        this.playbooks = playbooks != null ? new ArrayList<>(playbooks) : new ArrayList<>();
    }

    public List<BindingDefinition> getBindings() {
        return Collections.unmodifiableList(bindings);
    }

    public void setBindings(List<BindingDefinition> bindings) {
        this.bindings = bindings != null ? new ArrayList<>(bindings) : new ArrayList<>();
    }

    /**
     * Validate every playbook and binding, including cross references.
     * Collects all errors and throws a single exception if anything is
     * invalid.
     *
     * @throws IllegalStateException if one or more entries are invalid
     */
    public void validate(PredicateEvaluator predicates) {
        List<String> errors = new ArrayList<>();
        Map<Long, PlaybookDefinition> byId = new HashMap<>();

        for (int i = 0; i < playbooks.size(); i++) {
            PlaybookDefinition playbook = Objects.requireNonNull(playbooks.get(i),
                    "Playbook at index " + i + " is null");
            try {
                playbook.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (byId.putIfAbsent(playbook.getId(), playbook) != null) {
                errors.add("Duplicate playbook id " + playbook.getId());
            }
        }

        for (int i = 0; i < bindings.size(); i++) {
            BindingDefinition binding = Objects.requireNonNull(bindings.get(i),
                    "Binding at index " + i + " is null");
            try {
                binding.validate(predicates);
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
                continue;
            }
            PlaybookDefinition target = byId.get(binding.getPlaybookId());
            if (target == null) {
                errors.add("Binding for '" + binding.getEventType() + "' references unknown playbook "
                        + binding.getPlaybookId());
            } else if (target.getOrganizationId() != binding.getOrganizationId()) {
                errors.add("Binding for '" + binding.getEventType() + "' references playbook "
                        + binding.getPlaybookId() + " of another organization");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Catalog validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "CatalogConfig{playbooks=" + playbooks.size() + ", bindings=" + bindings.size() + '}';
    }
}
