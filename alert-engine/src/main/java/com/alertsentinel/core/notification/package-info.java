/**
 * Pluggable notification delivery.
 *
 * <p>
 * All channels implement
 * {@link com.alertsentinel.core.notification.NotificationChannel} and are
 * instantiated via
 * {@link com.alertsentinel.core.notification.ChannelFactory}. Built-in
 * variants: webhook, e-mail, Slack, Discord, PagerDuty and console.
 * </p>
 *
 * <h3>Failure model</h3>
 * <p>
 * Sending never throws. Missing configuration, non-2xx responses and
 * transport errors all come back as a failed
 * {@link com.alertsentinel.core.notification.NotificationResult}. The only
 * construction-time failure is
 * {@link com.alertsentinel.core.notification.UnsupportedChannelTypeException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.notification;
