package com.soarsentinel.core.correlation;

import com.soarsentinel.core.model.Alert;

import java.util.List;
import java.util.Locale;

/**
 * Maps an alert to a coarse event-type label by keyword matching on its
 * title and description, falling back to the security product named in its
 * source.
 *
 * <p>
 * Rules are checked in order and the first hit wins, so an alert mentioning
 * both "login" and "malware" is {@code authentication}.
 * </p>
 */
public final class EventTypeClassifier {

    public static final String GENERIC = "generic_event";

    private static final List<Rule> RULES = List.of(
            new Rule("authentication", "login", "authentication"),
            new Rule("malware", "malware", "virus"),
            new Rule("exploit", "exploit", "vulnerability"),
            new Rule("access", "access", "permission"),
            new Rule("data_movement", "data", "exfiltration"),
            new Rule("reconnaissance", "scan", "reconnaissance"),
            new Rule("command_and_control", "command", "c2", "command and control"),
            new Rule("lateral_movement", "lateral", "movement"));

    private static final List<String> SECURITY_PRODUCTS =
            List.of("firewall", "waf", "ids", "ips", "edr", "xdr", "ndr", "dlp");

    public String classify(Alert alert) {
        String title = alert.getTitle().toLowerCase(Locale.ROOT);
        String description = alert.getDescription() != null
                ? alert.getDescription().toLowerCase(Locale.ROOT)
                : "";
        for (Rule rule : RULES) {
            if (rule.matches(title) || rule.matches(description)) {
                return rule.label;
            }
        }
        String source = alert.getSource().toLowerCase(Locale.ROOT).trim();
        for (String product : SECURITY_PRODUCTS) {
            if (source.contains(product)) {
                return source.split("\\s+")[0];
            }
        }
        return GENERIC;
    }

    private static final class Rule {
        private final String label;
        private final String[] keywords;

        private Rule(String label, String... keywords) {
            this.label = label;
            this.keywords = keywords;
        }

        private boolean matches(String text) {
            for (String keyword : keywords) {
                if (text.contains(keyword)) {
                    return true;
                }
            }
            return false;
        }
    }
}
