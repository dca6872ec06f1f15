package com.soarsentinel.core.correlation;

import com.soarsentinel.core.model.ThreatIntel;

import java.util.List;

/**
 * Threat-intelligence entries visible to an organization.
 */
@FunctionalInterface
public interface ThreatIntelSource {

    List<ThreatIntel> listThreatIntel(long organizationId);
}
