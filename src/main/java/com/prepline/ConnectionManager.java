/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.prepline;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.sql.SQLException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * Owns the single {@link DriverConnection} behind an adapter: establishes, tears down, health-checks and resets it.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class ConnectionManager {
	@NonNull
	private static final String LIVENESS_QUERY = "SELECT 1";

	@NonNull
	private final DriverConnection driverConnection;
	@NonNull
	private final DatabaseConfig databaseConfig;
	@NonNull
	private final ConnectionParameters connectionParameters;
	@NonNull
	private final StatementCache statementCache;
	@NonNull
	private final Logger logger;

	// Null while disconnected
	@Nullable
	private Set<@NonNull Capability> capabilities;

	public ConnectionManager(@NonNull DriverConnection driverConnection,
													 @NonNull DatabaseConfig databaseConfig,
													 @NonNull StatementCache statementCache) {
		requireNonNull(driverConnection);
		requireNonNull(databaseConfig);
		requireNonNull(statementCache);

		this.driverConnection = driverConnection;
		this.databaseConfig = databaseConfig;
		this.connectionParameters = ConnectionParameters.fromConfig(databaseConfig);
		this.statementCache = statementCache;
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Applies pre-connect options, connects, then enables auto-reconnect (if configured and supported) and configures
	 * the session.
	 *
	 * @throws ConnectionFailureException if the session cannot be established or configured
	 */
	public void connect() {
		// Statements prepared on a previous session must not outlive it
		if (isConnected()) {
			disconnect();
			getStatementCache().clear();
		}

		applyOptions();

		try {
			getDriverConnection().connect(getConnectionParameters());
		} catch (SQLException e) {
			throw new ConnectionFailureException(format("Unable to connect with %s", getConnectionParameters()), e);
		}

		Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
		capabilities.addAll(getDriverConnection().getCapabilities());
		this.capabilities = Collections.unmodifiableSet(capabilities);

		try {
			// Must follow connect(), which turns the driver's reconnect flag off
			if (hasCapability(Capability.RECONNECT_FLAG)) {
				try {
					getDriverConnection().setReconnect(getDatabaseConfig().getReconnect());
				} catch (SQLException e) {
					throw new ConnectionFailureException("Unable to set reconnect flag", e);
				}
			}

			configureConnection();
		} catch (RuntimeException e) {
			abandonConnection(e);
			throw e;
		}

		getLogger().fine(format("Connected to %s database '%s' with capabilities %s",
				getDriverConnection().getDatabaseType().name(), getConnectionParameters().getDatabase(), capabilities));
	}

	/**
	 * Disconnects, closes every cached statement and connects again, so no statement prepared on the old session
	 * survives.
	 */
	public void reconnect() {
		disconnect();
		getStatementCache().clear();
		connect();
	}

	/**
	 * Closes the connection. Closing a connection that is already broken or closed is not an error.
	 */
	public void disconnect() {
		this.capabilities = null;

		try {
			getDriverConnection().close();
		} catch (SQLException e) {
			getLogger().log(FINE, "Ignoring failure to close connection", e);
		}
	}

	/**
	 * Re-authenticates as the configured user and database and re-runs session configuration, if the driver can do so
	 * without a full reconnect. Otherwise does nothing.
	 */
	public void reset() {
		requireConnected();

		if (!hasCapability(Capability.CHANGE_USER))
			return;

		try {
			getDriverConnection().changeUser(getDatabaseConfig().getUsername(), getDatabaseConfig().getPassword(),
					getDatabaseConfig().getDatabase());
		} catch (SQLException e) {
			throw new ConnectionFailureException("Unable to reset connection", e);
		}

		configureConnection();
	}

	/**
	 * Runs a lightweight liveness check.
	 *
	 * @return {@code true} only if the check succeeded and no driver error code is set; never throws for driver failures
	 */
	public boolean isActive() {
		if (!isConnected())
			return false;

		try {
			if (hasCapability(Capability.STAT)) {
				getDriverConnection().stat();
			} else {
				DriverResult driverResult = getDriverConnection().query(LIVENESS_QUERY);

				if (driverResult != null)
					driverResult.free();
			}

			// Some drivers report a failed status call through the error code rather than an exception
			return !hasCapability(Capability.ERRNO) || getDriverConnection().errno() == 0;
		} catch (SQLException e) {
			getLogger().log(FINE, "Liveness check failed", e);
			return false;
		}
	}

	@NonNull
	public Boolean isConnected() {
		return this.capabilities != null;
	}

	@NonNull
	public Boolean hasCapability(@NonNull Capability capability) {
		requireNonNull(capability);
		Set<Capability> capabilities = this.capabilities;
		return capabilities != null && capabilities.contains(capability);
	}

	/**
	 * @return the live connection
	 * @throws ConnectionFailureException if not connected
	 */
	@NonNull
	public DriverConnection getConnection() {
		requireConnected();
		return getDriverConnection();
	}

	/**
	 * @return the server's version string, if the driver reports one
	 */
	@NonNull
	public Optional<String> getServerInfo() {
		requireConnected();

		if (!hasCapability(Capability.SERVER_INFO))
			return Optional.empty();

		try {
			return Optional.of(getDriverConnection().serverInfo());
		} catch (SQLException e) {
			throw new DatabaseException("Unable to read server info", e);
		}
	}

	protected void applyOptions() {
		DatabaseConfig databaseConfig = getDatabaseConfig();
		String encoding = databaseConfig.getEncoding().orElse(null);

		if (encoding != null) {
			try {
				getDriverConnection().setOption(DriverOption.CHARSET_NAME, encoding);
			} catch (SQLException e) {
				// SET NAMES after connecting still applies the encoding
				getLogger().log(WARNING, format("Driver rejected character set '%s'", encoding), e);
			}
		}

		if (databaseConfig.isSslConfigured()) {
			applyOption(DriverOption.SSL_KEY, databaseConfig.getSslKey().orElse(null));
			applyOption(DriverOption.SSL_CERT, databaseConfig.getSslCert().orElse(null));
			applyOption(DriverOption.SSL_CA, databaseConfig.getSslCa().orElse(null));
			applyOption(DriverOption.SSL_CAPATH, databaseConfig.getSslCaPath().orElse(null));
			applyOption(DriverOption.SSL_CIPHER, databaseConfig.getSslCipher().orElse(null));
		}

		applyOption(DriverOption.CONNECT_TIMEOUT, databaseConfig.getConnectTimeout().orElse(null));
		applyOption(DriverOption.READ_TIMEOUT, databaseConfig.getReadTimeout().orElse(null));
		applyOption(DriverOption.WRITE_TIMEOUT, databaseConfig.getWriteTimeout().orElse(null));
	}

	protected void applyOption(@NonNull DriverOption driverOption,
														 @Nullable Object value) {
		requireNonNull(driverOption);

		if (value == null)
			return;

		try {
			getDriverConnection().setOption(driverOption, value);
		} catch (SQLException e) {
			throw new ConnectionFailureException(format("Unable to set driver option %s", driverOption.name()), e);
		}
	}

	/**
	 * Runs the session statements the connected database type calls for.
	 */
	protected void configureConnection() {
		String encoding = getDatabaseConfig().getEncoding().orElse(null);

		for (String sql : getDriverConnection().getDatabaseType().sessionStatements(encoding)) {
			try {
				DriverResult driverResult = getDriverConnection().query(sql);

				if (driverResult != null)
					driverResult.free();
			} catch (SQLException e) {
				throw new ConnectionFailureException(format("Unable to configure session with '%s'", sql), e);
			}
		}
	}

	/**
	 * Closes a session that connected but could not be set up, attaching any close failure to {@code failure}.
	 */
	protected void abandonConnection(@NonNull RuntimeException failure) {
		requireNonNull(failure);

		this.capabilities = null;

		try {
			getDriverConnection().close();
		} catch (SQLException closeFailure) {
			failure.addSuppressed(closeFailure);
		}
	}

	protected void requireConnected() {
		if (!isConnected())
			throw new ConnectionFailureException("Not connected");
	}

	@NonNull
	protected DriverConnection getDriverConnection() {
		return this.driverConnection;
	}

	@NonNull
	protected DatabaseConfig getDatabaseConfig() {
		return this.databaseConfig;
	}

	@NonNull
	protected ConnectionParameters getConnectionParameters() {
		return this.connectionParameters;
	}

	@NonNull
	protected StatementCache getStatementCache() {
		return this.statementCache;
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}
}
