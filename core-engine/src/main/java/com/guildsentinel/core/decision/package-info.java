/**
 * Signal aggregation, sensitivity bands and mute escalation.
 *
 * <p>
 * {@link com.guildsentinel.core.decision.DecisionEngine} owns the only
 * cross-message state of this stage, the
 * {@link com.guildsentinel.core.decision.OffenseStore}.
 * </p>
 */
package com.guildsentinel.core.decision;
