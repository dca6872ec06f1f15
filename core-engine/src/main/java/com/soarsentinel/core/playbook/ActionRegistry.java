package com.soarsentinel.core.playbook;

import com.soarsentinel.core.playbook.actions.BlockIpAction;
import com.soarsentinel.core.playbook.actions.DelayAction;
import com.soarsentinel.core.playbook.actions.EndpointClient;
import com.soarsentinel.core.playbook.actions.FirewallClient;
import com.soarsentinel.core.playbook.actions.IsolateHostAction;
import com.soarsentinel.core.playbook.actions.LogMessageAction;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from action id to {@link Action}, assembled once at
 * startup from explicitly listed implementations.
 *
 * @since 1.0.0
 */
public final class ActionRegistry {

    private final Map<String, Action> actions;

    /**
     * @throws IllegalArgumentException if two actions share an id
     */
    public ActionRegistry(Collection<? extends Action> actions) {
        Objects.requireNonNull(actions, "actions must not be null");
        Map<String, Action> byId = new LinkedHashMap<>();
        for (Action action : actions) {
            String id = Objects.requireNonNull(action.id(), "action id must not be null");
            if (byId.putIfAbsent(id, action) != null) {
                throw new IllegalArgumentException("Duplicate action id: '" + id + "'");
            }
        }
        this.actions = Collections.unmodifiableMap(byId);
    }

    /**
     * Registry of the built-in actions: {@code log_message}, {@code delay},
     * {@code block_ip} and {@code isolate_host}.
     */
    public static ActionRegistry builtIns(FirewallClient firewall, EndpointClient endpoints) {
        return new ActionRegistry(List.of(
                new LogMessageAction(),
                new DelayAction(),
                new BlockIpAction(firewall),
                new IsolateHostAction(endpoints)));
    }

    public Optional<Action> find(String actionId) {
        return Optional.ofNullable(actions.get(actionId));
    }

    public boolean contains(String actionId) {
        return actions.containsKey(actionId);
    }

    public Set<String> ids() {
        return actions.keySet();
    }
}
