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
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ParameterMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Types;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;

/**
 * {@link DriverConnection} backed by a {@link java.sql.Connection} obtained from {@link DriverManager}.
 * <p>
 * Unless {@link ConnectionParameters#getJdbcUrl()} is set, connects to {@code jdbc:mysql://host:port/database}.
 * Driver options become connection properties. The reconnect flag is emulated: when enabled, a connection found closed
 * is reopened before the next statement.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class JdbcDriverConnection implements DriverConnection {
	@NonNull
	private static final String DEFAULT_HOST = "localhost";
	@NonNull
	private static final Integer DEFAULT_PORT = 3306;
	@NonNull
	private static final Duration DEFAULT_VALIDATION_TIMEOUT = Duration.ofSeconds(5);

	@NonNull
	private final Map<@NonNull DriverOption, @NonNull Object> options;
	@NonNull
	private final Logger logger;

	@Nullable
	private Connection connection;
	@Nullable
	private ConnectionParameters connectionParameters;
	@NonNull
	private DatabaseType databaseType;
	private boolean reconnect;
	private int errno;
	@Nullable
	private String lastError;

	public JdbcDriverConnection() {
		this.options = new EnumMap<>(DriverOption.class);
		this.logger = Logger.getLogger(getClass().getName());
		this.databaseType = DatabaseType.GENERIC;
	}

	@Override
	public void setOption(@NonNull DriverOption option,
												@NonNull Object value) {
		requireNonNull(option);
		requireNonNull(value);

		this.options.put(option, value);
	}

	@Override
	public void connect(@NonNull ConnectionParameters connectionParameters) throws SQLException {
		requireNonNull(connectionParameters);

		this.connectionParameters = connectionParameters;
		// A fresh session starts with the reconnect flag off
		this.reconnect = false;

		open();
	}

	@Override
	public void close() throws SQLException {
		Connection connection = this.connection;
		this.connection = null;

		if (connection != null)
			connection.close();
	}

	@NonNull
	@Override
	public Set<@NonNull Capability> getCapabilities() {
		Set<Capability> capabilities = EnumSet.of(Capability.STAT, Capability.ERRNO, Capability.RECONNECT_FLAG,
				Capability.SERVER_INFO);

		if (getDatabaseType().lastInsertIdQuery().isPresent())
			capabilities.add(Capability.INSERT_ID);

		return Collections.unmodifiableSet(capabilities);
	}

	@NonNull
	@Override
	public DatabaseType getDatabaseType() {
		return this.databaseType;
	}

	@Override
	public void setReconnect(boolean reconnect) {
		this.reconnect = reconnect;
	}

	@NonNull
	@Override
	public DriverStatement prepare(@NonNull String sql) throws SQLException {
		requireNonNull(sql);

		return track(() -> new JdbcDriverStatement(liveConnection().prepareStatement(sql)));
	}

	@Nullable
	@Override
	public DriverResult query(@NonNull String sql) throws SQLException {
		requireNonNull(sql);

		return track(() -> {
			java.sql.Statement statement = liveConnection().createStatement();

			try {
				if (!statement.execute(sql)) {
					statement.close();
					return null;
				}

				return new JdbcDriverResult(statement, statement.getResultSet());
			} catch (SQLException e) {
				try {
					statement.close();
				} catch (SQLException closeFailure) {
					e.addSuppressed(closeFailure);
				}

				throw e;
			}
		});
	}

	/**
	 * Validates the connection within the configured read timeout.
	 *
	 * @return a short status line
	 * @throws SQLException if the connection is closed or fails validation
	 */
	@NonNull
	@Override
	public String stat() throws SQLException {
		return track(() -> {
			Connection connection = liveConnection();
			Duration timeout = optionValue(DriverOption.READ_TIMEOUT, Duration.class).orElse(DEFAULT_VALIDATION_TIMEOUT);

			if (!connection.isValid((int) Math.max(1, timeout.getSeconds())))
				throw new SQLException("Connection failed validation");

			return format("%s connection valid", getDatabaseType().name());
		});
	}

	@Override
	public int errno() {
		return this.errno;
	}

	@NonNull
	@Override
	public Optional<String> lastError() {
		return Optional.ofNullable(this.lastError);
	}

	@Override
	public long insertId() throws SQLException {
		String identityQuery = getDatabaseType().lastInsertIdQuery().orElse(null);

		if (identityQuery == null)
			throw new SQLFeatureNotSupportedException(format("No identity query for %s", getDatabaseType().name()));

		return track(() -> {
			try (java.sql.Statement statement = liveConnection().createStatement();
					 ResultSet resultSet = statement.executeQuery(identityQuery)) {
				if (!resultSet.next())
					throw new SQLException(format("'%s' returned no rows", identityQuery));

				return resultSet.getLong(1);
			}
		});
	}

	@NonNull
	@Override
	public String serverInfo() throws SQLException {
		return track(() -> liveConnection().getMetaData().getDatabaseProductVersion());
	}

	@NonNull
	protected String determineJdbcUrl(@NonNull ConnectionParameters connectionParameters) {
		requireNonNull(connectionParameters);

		String jdbcUrl = connectionParameters.getJdbcUrl().orElse(null);

		if (jdbcUrl != null)
			return jdbcUrl;

		if (connectionParameters.getSocket().isPresent())
			getLogger().fine("Ignoring socket path, JDBC connections use TCP");

		return format("jdbc:mysql://%s:%d/%s", connectionParameters.getHost().orElse(DEFAULT_HOST),
				connectionParameters.getPort().orElse(DEFAULT_PORT), connectionParameters.getDatabase());
	}

	@NonNull
	protected Properties determineProperties(@NonNull ConnectionParameters connectionParameters) {
		requireNonNull(connectionParameters);

		Properties properties = basicProperties(connectionParameters);

		for (Map.Entry<DriverOption, Object> entry : this.options.entrySet()) {
			Object value = entry.getValue();

			// JDBC drivers take timeouts in milliseconds
			if (value instanceof Duration)
				value = ((Duration) value).toMillis();

			properties.setProperty(entry.getKey().getJdbcPropertyName(), String.valueOf(value));
		}

		if (connectionParameters.getClientFlags().contains(ClientFlag.MULTI_RESULTS))
			properties.setProperty("allowMultiQueries", "true");

		if (connectionParameters.getClientFlags().contains(ClientFlag.FOUND_ROWS))
			properties.setProperty("useAffectedRows", "false");

		return properties;
	}

	protected void open() throws SQLException {
		ConnectionParameters connectionParameters = this.connectionParameters;

		if (connectionParameters == null)
			throw new SQLException("Connection was never established");

		String jdbcUrl = determineJdbcUrl(connectionParameters);

		// Only MySQL-family URLs understand the driver option properties
		Properties properties = isMySqlUrl(jdbcUrl) ? determineProperties(connectionParameters) : basicProperties(connectionParameters);

		closeQuietly();

		Connection connection = DriverManager.getConnection(jdbcUrl, properties);

		try {
			this.databaseType = DatabaseType.fromConnection(connection);
		} catch (SQLException e) {
			try {
				connection.close();
			} catch (SQLException closeFailure) {
				e.addSuppressed(closeFailure);
			}

			throw e;
		}

		this.connection = connection;
		this.errno = 0;
		this.lastError = null;
	}

	/**
	 * Closes the current connection, if any. A failure here only means the old session is already gone.
	 */
	protected void closeQuietly() {
		Connection connection = this.connection;
		this.connection = null;

		if (connection == null)
			return;

		try {
			connection.close();
		} catch (SQLException e) {
			getLogger().log(FINE, "Ignoring failure to close previous connection", e);
		}
	}

	/**
	 * @return the underlying JDBC connection, if one is open
	 */
	@NonNull
	protected Optional<Connection> getJdbcConnection() {
		return Optional.ofNullable(this.connection);
	}

	/**
	 * Reads column labels in driver order.
	 */
	@NonNull
	protected List<@NonNull String> readColumnLabels(@NonNull ResultSet resultSet) throws SQLException {
		requireNonNull(resultSet);
		return columnLabels(resultSet.getMetaData());
	}

	@NonNull
	protected Connection liveConnection() throws SQLException {
		Connection connection = this.connection;

		if (connection != null && !connection.isClosed())
			return connection;

		if (!this.reconnect || this.connectionParameters == null)
			throw new SQLException("Connection is closed", "08003");

		getLogger().log(FINE, "Connection closed, reopening");
		open();

		return requireNonNull(this.connection);
	}

	@FunctionalInterface
	protected interface JdbcOperation<R> {
		R perform() throws SQLException;
	}

	/**
	 * Runs {@code operation}, recording its outcome for {@link #errno()} and {@link #lastError()}.
	 */
	protected <R> R track(@NonNull JdbcOperation<R> operation) throws SQLException {
		requireNonNull(operation);

		try {
			R result = operation.perform();
			this.errno = 0;
			this.lastError = null;
			return result;
		} catch (SQLException e) {
			this.errno = e.getErrorCode() == 0 ? -1 : e.getErrorCode();
			this.lastError = e.getMessage();
			throw e;
		}
	}

	@NonNull
	protected <T> Optional<T> optionValue(@NonNull DriverOption option,
																				@NonNull Class<T> type) {
		requireNonNull(option);
		requireNonNull(type);

		Object value = this.options.get(option);
		return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@NonNull
	private static Properties basicProperties(@NonNull ConnectionParameters connectionParameters) {
		Properties properties = new Properties();
		properties.setProperty("user", connectionParameters.getUsername());
		properties.setProperty("password", connectionParameters.getPassword());
		return properties;
	}

	private static boolean isMySqlUrl(@NonNull String jdbcUrl) {
		return jdbcUrl.startsWith("jdbc:mysql:") || jdbcUrl.startsWith("jdbc:mariadb:");
	}

	@NonNull
	private static List<@NonNull String> columnLabels(@NonNull ResultSetMetaData resultSetMetaData) throws SQLException {
		int columnCount = resultSetMetaData.getColumnCount();
		List<String> columnLabels = new ArrayList<>(columnCount);

		for (int i = 1; i <= columnCount; ++i)
			columnLabels.add(resultSetMetaData.getColumnLabel(i));

		return columnLabels;
	}

	/**
	 * Prepared statement that holds on to the result set of its latest execution until freed.
	 */
	@NotThreadSafe
	protected class JdbcDriverStatement implements DriverStatement {
		@NonNull
		private final PreparedStatement preparedStatement;
		@Nullable
		private ResultSet resultSet;
		private long affectedRows;

		protected JdbcDriverStatement(@NonNull PreparedStatement preparedStatement) {
			this.preparedStatement = requireNonNull(preparedStatement);
			this.affectedRows = -1;
		}

		@Override
		public void execute(@NonNull List<@Nullable Object> values) throws SQLException {
			requireNonNull(values);

			freeResult();

			track(() -> {
				for (int i = 0; i < values.size(); ++i)
					bind(i + 1, values.get(i));

				if (this.preparedStatement.execute()) {
					this.resultSet = this.preparedStatement.getResultSet();
					this.affectedRows = -1;
				} else {
					this.affectedRows = determineAffectedRows();
				}

				return null;
			});
		}

		@Nullable
		@Override
		public DriverResultMetadata getResultMetadata() throws SQLException {
			ResultSet resultSet = this.resultSet;

			if (resultSet == null)
				return null;

			// Labels are read lazily
			return new DriverResultMetadata() {
				@NonNull
				@Override
				public List<@NonNull String> getColumnNames() throws SQLException {
					return readColumnLabels(resultSet);
				}

				@Override
				public void free() {
					// Nothing held beyond the result set
				}
			};
		}

		@NonNull
		@Override
		public RowSource getRowSource() throws SQLException {
			ResultSet resultSet = this.resultSet;

			if (resultSet == null)
				throw new SQLException("Statement produced no result set");

			return new ResultSetRowSource(resultSet);
		}

		@Override
		public long getAffectedRows() {
			return this.affectedRows;
		}

		@Override
		public void freeResult() throws SQLException {
			ResultSet resultSet = this.resultSet;
			this.resultSet = null;

			if (resultSet != null)
				resultSet.close();
		}

		@Override
		public void close() throws SQLException {
			try {
				freeResult();
			} finally {
				this.preparedStatement.close();
			}
		}

		protected void bind(int parameterIndex,
												@Nullable Object value) throws SQLException {
			if (value != null) {
				this.preparedStatement.setObject(parameterIndex, value);
				return;
			}

			Integer sqlType = determineParameterSqlType(parameterIndex).orElse(null);
			this.preparedStatement.setNull(parameterIndex, sqlType == null ? Types.NULL : sqlType);
		}

		@NonNull
		protected Optional<Integer> determineParameterSqlType(int parameterIndex) throws SQLException {
			try {
				ParameterMetaData parameterMetaData = this.preparedStatement.getParameterMetaData();

				if (parameterMetaData == null)
					return Optional.empty();

				return Optional.of(parameterMetaData.getParameterType(parameterIndex));
			} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
				return Optional.empty();
			}
		}

		protected long determineAffectedRows() throws SQLException {
			try {
				return this.preparedStatement.getLargeUpdateCount();
			} catch (SQLFeatureNotSupportedException | UnsupportedOperationException | AbstractMethodError e) {
				return this.preparedStatement.getUpdateCount();
			}
		}
	}

	/**
	 * Rows of a direct query. Freeing closes both the result set and its statement.
	 */
	@NotThreadSafe
	protected static class JdbcDriverResult extends ResultSetRowSource implements DriverResult {
		private final java.sql.@NonNull Statement statement;

		protected JdbcDriverResult(java.sql.@NonNull Statement statement,
															 @NonNull ResultSet resultSet) {
			super(resultSet);
			this.statement = requireNonNull(statement);
		}

		@NonNull
		@Override
		public List<@NonNull String> getColumnNames() throws SQLException {
			return columnLabels(getResultSet().getMetaData());
		}

		@Override
		public void free() throws SQLException {
			try {
				getResultSet().close();
			} finally {
				this.statement.close();
			}
		}
	}

	@NotThreadSafe
	protected static class ResultSetRowSource implements RowSource {
		@NonNull
		private final ResultSet resultSet;
		@Nullable
		private Integer columnCount;

		protected ResultSetRowSource(@NonNull ResultSet resultSet) {
			this.resultSet = requireNonNull(resultSet);
		}

		@Override
		public int getColumnCount() throws SQLException {
			if (this.columnCount == null)
				this.columnCount = this.resultSet.getMetaData().getColumnCount();

			return this.columnCount;
		}

		@Override
		public boolean next() throws SQLException {
			return this.resultSet.next();
		}

		@Nullable
		@Override
		public Object getValue(int columnIndex) throws SQLException {
			return this.resultSet.getObject(columnIndex);
		}

		@NonNull
		protected ResultSet getResultSet() {
			return this.resultSet;
		}
	}
}
