/**
 * Alert rule model.
 *
 * <ul>
 * <li>{@link com.alertsentinel.core.model.AlertRule} — rule definition,
 * built and validated through its builder</li>
 * <li>{@link com.alertsentinel.core.model.AlertCondition} — a single
 * threshold test with duration and aggregation</li>
 * <li>{@link com.alertsentinel.core.model.ComparisonOperator},
 * {@link com.alertsentinel.core.model.Aggregation},
 * {@link com.alertsentinel.core.model.Severity},
 * {@link com.alertsentinel.core.model.AlertState} — closed value sets</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.model;
