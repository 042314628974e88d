/**
 * Threshold-rule evaluation.
 *
 * <p>
 * {@link com.alertsentinel.core.evaluation.RuleEvaluator} turns an
 * {@link com.alertsentinel.core.evaluation.EvaluationContext} and a rule into
 * an {@link com.alertsentinel.core.evaluation.EvaluationResult}, tracking how
 * long each condition has held across calls.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.evaluation;
