/**
 * Engine configuration.
 *
 * <p>
 * {@link com.alertsentinel.core.config.AlertConfig} and
 * {@link com.alertsentinel.core.config.AnomalyConfig} are immutable,
 * builder-validated settings with {@code fromEnvironment()} factories.
 * {@link com.alertsentinel.core.config.RulesLoader} reads channel and rule
 * definitions from YAML into a
 * {@link com.alertsentinel.core.config.RulesConfig}.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.config;
