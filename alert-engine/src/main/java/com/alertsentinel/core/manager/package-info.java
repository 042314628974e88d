/**
 * Orchestration layer of the engine.
 *
 * <p>
 * {@link com.alertsentinel.core.manager.AlertManager} ties the rule
 * registry, the evaluator, the anomaly detector and the notification
 * channels together, and keeps cooldowns and a bounded alert history.
 * {@link com.alertsentinel.core.manager.EvaluationScheduler} drives
 * periodic evaluation with a single-flight guard.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.manager;
