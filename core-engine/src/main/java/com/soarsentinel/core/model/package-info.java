/**
 * Domain model for SOAR Sentinel.
 *
 * <p>
 * Alerts and threat intelligence are read-only inputs. The trigger path owns
 * {@link com.soarsentinel.core.model.PlaybookExecution}; the correlation path
 * owns {@link com.soarsentinel.core.model.CorrelationPattern} and
 * {@link com.soarsentinel.core.model.IncidentSuggestion}. The wire
 * {@link com.soarsentinel.core.model.Event} is the only mutable bean, kept
 * that way for Jackson.
 * </p>
 *
 * @since 1.0.0
 */
package com.soarsentinel.core.model;
