/**
 * Provisions a least-privilege MySQL user for a Ghost install.
 *
 * <p>Given administrative ({@code root}) connection settings, the stage opens an administrative
 * connection, creates a randomly named user (retrying on name collisions), sets a generated
 * password, grants the user every privilege on the configured database and writes the new
 * credentials back into the configuration.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.ghostmysql.core.jdbc.MySqlSetupStage} – blocking pipeline over JDBC.
 *   <li>{@link com.example.ghostmysql.core.reactive.ReactiveMySqlSetupStage} – the same pipeline
 *       over R2DBC and Reactor.
 *   <li>{@link com.example.ghostmysql.core.config.ConfigStore} – configuration seam, with JSON
 *       file and AWS Secrets Manager implementations.
 *   <li>{@link com.example.ghostmysql.core.MySqlErrorCodes} – failure classification shared by
 *       both pipelines.
 *   <li>{@link com.example.ghostmysql.core.Retry} – the username collision loop.
 *   <li>{@link com.example.ghostmysql.core.MySqlExtension} – registers the stage with the host
 *       setup command.
 * </ul>
 *
 * <p>Accounts left behind by earlier installs are never removed; a name collision with one of them
 * is resolved by picking another name.
 */
package com.example.ghostmysql.core;
