package com.alertsentinel.core.model;

/**
 * Lifecycle state of an {@link AlertRule}.
 *
 * <p>
 * Rules start {@link #PENDING} and move to {@link #ACTIVE} when they trigger.
 * {@link #RESOLVED} and {@link #SILENCED} are only reached through explicit
 * calls; the engine never infers them from conditions turning false.
 * </p>
 *
 * @since 1.0.0
 */
public enum AlertState {
    PENDING,
    ACTIVE,
    RESOLVED,
    SILENCED
}
