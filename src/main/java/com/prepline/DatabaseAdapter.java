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
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Main class for executing statements over a single database connection.
 * <p>
 * An adapter owns one {@link DriverConnection} and must be driven by one thread at a time; callers that need a pool
 * build it above this class, with one adapter per physical connection.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class DatabaseAdapter implements AutoCloseable {
	@NonNull
	private static final Pattern SERVER_VERSION_PATTERN = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)");

	@NonNull
	private final DatabaseConfig databaseConfig;
	@NonNull
	private final StatementCache statementCache;
	@NonNull
	private final ConnectionManager connectionManager;
	@NonNull
	private final ExecutionEngine executionEngine;
	@NonNull
	private final TransactionGuard transactionGuard;

	@Nullable
	private List<@NonNull Integer> serverVersion;

	protected DatabaseAdapter(@NonNull Builder builder) {
		requireNonNull(builder);

		DriverConnection driverConnection = builder.driverConnection == null ? new JdbcDriverConnection() : builder.driverConnection;
		ProcessIdentity processIdentity = builder.processIdentity == null ? ProcessIdentity.operatingSystemProcess() : builder.processIdentity;
		ResultAdapter resultAdapter = builder.resultAdapter == null ? new ResultAdapter() : builder.resultAdapter;
		StatementLogger statementLogger = builder.statementLogger == null ? new DefaultStatementLogger() : builder.statementLogger;

		this.databaseConfig = builder.databaseConfig;
		this.statementCache = new StatementCache(this.databaseConfig.getStatementCacheLimit(), processIdentity);
		this.connectionManager = new ConnectionManager(driverConnection, this.databaseConfig, this.statementCache);
		this.executionEngine = new ExecutionEngine(this.connectionManager, this.statementCache, resultAdapter, statementLogger);
		this.transactionGuard = new TransactionGuard(this.executionEngine);
	}

	/**
	 * Provides a {@link DatabaseAdapter} builder for the given configuration.
	 * <p>
	 * Unless another driver is supplied, the adapter talks JDBC via {@link JdbcDriverConnection}.
	 *
	 * @param databaseConfig configuration used to connect
	 * @return a {@link DatabaseAdapter} builder
	 */
	@NonNull
	public static Builder withConfig(@NonNull DatabaseConfig databaseConfig) {
		requireNonNull(databaseConfig);
		return new Builder(databaseConfig);
	}

	/**
	 * Establishes the connection.
	 *
	 * @throws ConnectionFailureException if the connection cannot be established
	 */
	public void connect() {
		this.serverVersion = null;
		getConnectionManager().connect();
	}

	/**
	 * Disconnects, drops every cached statement and connects again.
	 *
	 * @throws ConnectionFailureException if the connection cannot be re-established
	 */
	public void reconnect() {
		this.serverVersion = null;
		getConnectionManager().reconnect();
	}

	/**
	 * Closes the connection if it is open. Never throws on an already-broken connection.
	 */
	public void disconnect() {
		this.serverVersion = null;
		getConnectionManager().disconnect();
	}

	/**
	 * Resets session state by re-authenticating as the configured user, if the driver supports it.
	 */
	public void reset() {
		getConnectionManager().reset();
	}

	/**
	 * @return {@code true} if the connection answered a liveness check; never throws for driver failures
	 */
	public boolean isActive() {
		return getConnectionManager().isActive();
	}

	/**
	 * This adapter caches prepared statements.
	 */
	public boolean supportsStatementCache() {
		return true;
	}

	@NonNull
	public Result execute(@NonNull String sql,
												@NonNull List<@NonNull Bind> binds) {
		return execute(sql, null, binds);
	}

	/**
	 * Executes {@code sql} as a prepared statement. Statements with binds are cached for reuse.
	 *
	 * @param sql   the SQL to execute
	 * @param name  the name to log the statement under, or {@code null} for {@value Statement#DEFAULT_NAME}
	 * @param binds values for the statement's placeholders
	 * @return the statement's columns and rows
	 */
	@NonNull
	public Result execute(@NonNull String sql,
												@Nullable String name,
												@NonNull List<@NonNull Bind> binds) {
		return getExecutionEngine().execute(sql, name, binds);
	}

	@NonNull
	public Result executeDirect(@NonNull String sql) {
		return executeDirect(sql, null);
	}

	/**
	 * Executes {@code sql} without the prepared-statement API, e.g. for {@code SHOW CREATE TABLE}.
	 */
	@NonNull
	public Result executeDirect(@NonNull String sql,
															@Nullable String name) {
		return getExecutionEngine().executeDirect(sql, name);
	}

	public long executeMutation(@NonNull String sql,
															@NonNull List<@NonNull Bind> binds) {
		return executeMutation(sql, null, binds);
	}

	/**
	 * Executes {@code sql} as a prepared statement.
	 *
	 * @return the driver-reported affected-row count
	 */
	public long executeMutation(@NonNull String sql,
															@Nullable String name,
															@NonNull List<@NonNull Bind> binds) {
		return getExecutionEngine().executeMutation(sql, name, binds);
	}

	/**
	 * Executes an insert.
	 *
	 * @param idValue the identifier the caller already assigned, if any
	 * @return {@code idValue} if given, otherwise the identifier the database generated
	 */
	@NonNull
	public Object insert(@NonNull String sql,
											 @Nullable String name,
											 @NonNull List<@NonNull Bind> binds,
											 @Nullable Object idValue) {
		return getExecutionEngine().insert(sql, name, binds, idValue);
	}

	/**
	 * Shorthand for the rows of {@link #executeDirect(String, String)}.
	 */
	@NonNull
	public List<@NonNull List<@Nullable Object>> selectRows(@NonNull String sql,
																													@Nullable String name) {
		return executeDirect(sql, name).getRows();
	}

	/**
	 * Begins a transaction, tolerating backends that do not support them.
	 */
	@NonNull
	public BeginOutcome beginTransaction() {
		return getTransactionGuard().begin();
	}

	/**
	 * Closes and forgets every cached prepared statement of the current process.
	 */
	public void clearStatementCache() {
		getExecutionEngine().clearStatementCache();
	}

	/**
	 * @return major, minor and patch version of the connected server, or empty if the driver does not report it
	 */
	@NonNull
	public List<@NonNull Integer> getServerVersion() {
		if (this.serverVersion == null) {
			String serverInfo = getConnectionManager().getServerInfo().orElse(null);

			if (serverInfo == null)
				return List.of();

			Matcher matcher = SERVER_VERSION_PATTERN.matcher(serverInfo.trim());

			if (!matcher.find())
				throw new DatabaseException(format("Unable to parse server version from '%s'", serverInfo));

			this.serverVersion = List.of(Integer.valueOf(matcher.group(1)), Integer.valueOf(matcher.group(2)),
					Integer.valueOf(matcher.group(3)));
		}

		return this.serverVersion;
	}

	/**
	 * Closes cached statements, then the connection.
	 */
	@Override
	public void close() {
		if (getConnectionManager().isConnected())
			clearStatementCache();

		disconnect();
	}

	@NonNull
	public DatabaseConfig getDatabaseConfig() {
		return this.databaseConfig;
	}

	@NonNull
	public StatementCache getStatementCache() {
		return this.statementCache;
	}

	@NonNull
	protected ConnectionManager getConnectionManager() {
		return this.connectionManager;
	}

	@NonNull
	protected ExecutionEngine getExecutionEngine() {
		return this.executionEngine;
	}

	@NonNull
	protected TransactionGuard getTransactionGuard() {
		return this.transactionGuard;
	}

	/**
	 * @return the last identifier generated on this connection
	 */
	public long getLastInsertId() {
		return getExecutionEngine().getLastInsertId();
	}

	@NonNull
	public Optional<String> getServerInfo() {
		return getConnectionManager().getServerInfo();
	}

	/**
	 * Builder used to construct instances of {@link DatabaseAdapter}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final DatabaseConfig databaseConfig;
		@Nullable
		private DriverConnection driverConnection;
		@Nullable
		private ProcessIdentity processIdentity;
		@Nullable
		private ResultAdapter resultAdapter;
		@Nullable
		private StatementLogger statementLogger;

		private Builder(@NonNull DatabaseConfig databaseConfig) {
			this.databaseConfig = requireNonNull(databaseConfig);
		}

		@NonNull
		public Builder driverConnection(@Nullable DriverConnection driverConnection) {
			this.driverConnection = driverConnection;
			return this;
		}

		/**
		 * Overrides how the statement cache identifies the current process. Defaults to the operating system process id.
		 */
		@NonNull
		public Builder processIdentity(@Nullable ProcessIdentity processIdentity) {
			this.processIdentity = processIdentity;
			return this;
		}

		@NonNull
		public Builder resultAdapter(@Nullable ResultAdapter resultAdapter) {
			this.resultAdapter = resultAdapter;
			return this;
		}

		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		@NonNull
		public DatabaseAdapter build() {
			return new DatabaseAdapter(this);
		}
	}
}
