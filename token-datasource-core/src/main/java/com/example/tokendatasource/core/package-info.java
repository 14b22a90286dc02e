/**
 * Root package for the token-datasource library.
 *
 * <p>Short-lived tokens replace static database passwords: a {@link
 * com.example.tokendatasource.core.credentials.CredentialCache} keeps the current token fresh in
 * the background, {@link com.example.tokendatasource.core.jdbc.TokenConnectionFactory} instances
 * present it each time a connection is opened, and {@link
 * com.example.tokendatasource.core.scheduling.RecurringJobScheduler} runs lock-protected recurring
 * jobs whose lock storage sits on the same token-backed connections.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.tokendatasource.core.CredentialBroker} – chooses static password or
 *       token refresh once and hands out per-consumer connection factories.
 *   <li>{@link com.example.tokendatasource.core.credentials} – credentials, token sources and the
 *       refreshing cache.
 *   <li>{@link com.example.tokendatasource.core.secrets} – lazily configured AWS Secrets Manager
 *       client.
 *   <li>{@link com.example.tokendatasource.core.jdbc} – connection settings, the token-backed
 *       connection factory and DataSource, auth error detection and caller-side retry.
 *   <li>{@link com.example.tokendatasource.core.scheduling} – cron schedules, lock storage, the
 *       bounded-wait distributed lock and the recurring job scheduler.
 *   <li>{@link com.example.tokendatasource.core.config} – system property and environment variable
 *       lookup.
 * </ul>
 */
package com.example.tokendatasource.core;
