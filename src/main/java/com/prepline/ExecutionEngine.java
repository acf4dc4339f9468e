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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * Runs statements against the live connection: prepare-or-reuse, bind, execute, read column metadata, produce a
 * result and release everything that was opened along the way.
 * <p>
 * Statements with bind values are cached by SQL text in the {@link StatementCache}; bind-less statements are prepared
 * for a single use and closed immediately. A statement whose execution fails is closed and evicted, and the driver
 * error is rethrown as a {@link StatementExecutionException}. No retry happens at this layer.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class ExecutionEngine {
	@NonNull
	private final ConnectionManager connectionManager;
	@NonNull
	private final StatementCache statementCache;
	@NonNull
	private final ResultAdapter resultAdapter;
	@NonNull
	private final StatementLogger statementLogger;

	public ExecutionEngine(@NonNull ConnectionManager connectionManager,
												 @NonNull StatementCache statementCache,
												 @NonNull ResultAdapter resultAdapter,
												 @NonNull StatementLogger statementLogger) {
		requireNonNull(connectionManager);
		requireNonNull(statementCache);
		requireNonNull(resultAdapter);
		requireNonNull(statementLogger);

		this.connectionManager = connectionManager;
		this.statementCache = statementCache;
		this.resultAdapter = resultAdapter;
		this.statementLogger = statementLogger;
	}

	/**
	 * Executes {@code sql} as a prepared statement and returns its rows.
	 *
	 * @param sql   the SQL to execute
	 * @param name  the name to log the statement under, or {@code null} for {@value Statement#DEFAULT_NAME}
	 * @param binds values for the statement's placeholders, in order
	 * @return the statement's columns and rows, or {@link Result#empty()} if it produced no result metadata
	 * @throws StatementExecutionException if the driver rejects the statement
	 */
	@NonNull
	public Result execute(@NonNull String sql,
												@Nullable String name,
												@NonNull List<@NonNull Bind> binds) {
		requireNonNull(sql);
		requireNonNull(binds);

		return performStatementOperation(Statement.of(name, sql), binds, (columns, driverStatement) ->
				columns == null ? Result.empty() : getResultAdapter().normalize(columns, driverStatement.getRowSource()));
	}

	/**
	 * Executes {@code sql} as a prepared statement and returns the driver-reported affected-row count.
	 *
	 * @throws StatementExecutionException if the driver rejects the statement
	 */
	public long executeMutation(@NonNull String sql,
															@Nullable String name,
															@NonNull List<@NonNull Bind> binds) {
		requireNonNull(sql);
		requireNonNull(binds);

		return performStatementOperation(Statement.of(name, sql), binds,
				(columns, driverStatement) -> driverStatement.getAffectedRows());
	}

	/**
	 * Executes an insert, then returns {@code idValue} if the caller supplied one, otherwise the connection's last
	 * generated identifier.
	 *
	 * @throws StatementExecutionException if the driver rejects the statement
	 * @throws DatabaseException           if no {@code idValue} was given and the driver cannot report one
	 */
	@NonNull
	public Object insert(@NonNull String sql,
											 @Nullable String name,
											 @NonNull List<@NonNull Bind> binds,
											 @Nullable Object idValue) {
		requireNonNull(sql);
		requireNonNull(binds);

		executeMutation(sql, name, binds);

		if (idValue != null)
			return idValue;

		return getLastInsertId();
	}

	/**
	 * @return the identifier most recently generated on this connection
	 * @throws DatabaseException if the driver cannot report it
	 */
	public long getLastInsertId() {
		if (!getConnectionManager().hasCapability(Capability.INSERT_ID))
			throw new DatabaseException("Driver cannot report the last generated identifier");

		try {
			return getConnectionManager().getConnection().insertId();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to read the last generated identifier", e);
		}
	}

	/**
	 * Runs {@code sql} without the prepared-statement API, for statements that API cannot handle (some administrative
	 * and introspective statements). Rows are read eagerly and nothing is cached.
	 *
	 * @return the statement's columns and rows, or {@link Result#empty()} if it produced no result
	 * @throws StatementExecutionException if the driver rejects the statement
	 */
	@NonNull
	public Result executeDirect(@NonNull String sql,
															@Nullable String name) {
		requireNonNull(sql);

		Statement statement = Statement.of(name, sql);
		DriverConnection connection = getConnectionManager().getConnection();
		StatementContext statementContext = StatementContext.with(statement).prepared(false).build();
		long startTime = nanoTime();
		Duration executionDuration = null;
		Duration resultProcessingDuration = null;
		Exception exception = null;
		Throwable thrown = null;
		DriverResult driverResult = null;

		try {
			driverResult = connection.query(sql);
			executionDuration = Duration.ofNanos(nanoTime() - startTime);
			startTime = nanoTime();

			Result result = driverResult == null ? Result.empty() : getResultAdapter().normalize(driverResult);
			resultProcessingDuration = Duration.ofNanos(nanoTime() - startTime);

			return result;
		} catch (SQLException e) {
			StatementExecutionException wrapped = new StatementExecutionException(statement, e);
			exception = wrapped;
			thrown = wrapped;
			throw wrapped;
		} catch (RuntimeException e) {
			exception = e;
			thrown = e;
			throw e;
		} catch (Error e) {
			thrown = e;
			throw e;
		} finally {
			Throwable cleanupFailure = null;

			if (driverResult != null) {
				try {
					driverResult.free();
				} catch (Throwable cleanupException) {
					cleanupFailure = cleanupException;
				}
			}

			completeOperation(StatementLog.withStatementContext(statementContext)
					.executionDuration(executionDuration)
					.resultProcessingDuration(resultProcessingDuration)
					.exception(exception)
					.build(), thrown, cleanupFailure);
		}
	}

	/**
	 * Clears the statement cache, closing every statement in it.
	 */
	public void clearStatementCache() {
		getStatementCache().clear();
	}

	@FunctionalInterface
	protected interface StatementOperation<R> {
		/**
		 * Reads whatever the caller needs from a successfully executed statement.
		 *
		 * @param columns         column names, or {@code null} if the execution produced no result metadata
		 * @param driverStatement the executed statement
		 */
		@NonNull
		R perform(@Nullable List<@NonNull String> columns,
							@NonNull DriverStatement driverStatement) throws SQLException;
	}

	@NonNull
	protected <R> R performStatementOperation(@NonNull Statement statement,
																						@NonNull List<@NonNull Bind> binds,
																						@NonNull StatementOperation<R> statementOperation) {
		requireNonNull(statement);
		requireNonNull(binds);
		requireNonNull(statementOperation);

		DriverConnection connection = getConnectionManager().getConnection();
		List<@Nullable Object> values = toDriverValues(binds);
		StatementContext statementContext = StatementContext.with(statement).parameters(values).build();
		String sql = statement.getSql();
		boolean cacheable = values.size() > 0;
		boolean statementCacheHit = false;
		long startTime = nanoTime();
		Duration preparationDuration = null;
		Duration executionDuration = null;
		Duration resultProcessingDuration = null;
		Exception exception = null;
		Throwable thrown = null;
		CacheEntry cacheEntry = null;
		DriverStatement driverStatement = null;
		DriverResultMetadata resultMetadata = null;

		try {
			if (cacheable) {
				cacheEntry = getStatementCache().get(sql).orElse(null);
				statementCacheHit = cacheEntry != null;

				if (cacheEntry == null) {
					cacheEntry = new CacheEntry(sql, connection.prepare(sql));
					getStatementCache().put(sql, cacheEntry);
				}

				driverStatement = cacheEntry.getStatement();
			} else {
				driverStatement = connection.prepare(sql);
			}

			preparationDuration = Duration.ofNanos(nanoTime() - startTime);
			startTime = nanoTime();

			try {
				driverStatement.execute(values);
			} catch (SQLException e) {
				evictFailedStatement(cacheEntry, driverStatement, e);
				// Already closed, nothing left to release
				driverStatement = null;
				throw e;
			}

			executionDuration = Duration.ofNanos(nanoTime() - startTime);
			startTime = nanoTime();

			resultMetadata = driverStatement.getResultMetadata();
			List<String> columns = resultMetadata == null ? null : resolveColumns(cacheEntry, resultMetadata);
			R result = statementOperation.perform(columns, driverStatement);

			resultProcessingDuration = Duration.ofNanos(nanoTime() - startTime);

			return result;
		} catch (SQLException e) {
			StatementExecutionException wrapped = new StatementExecutionException(statement, e);
			exception = wrapped;
			thrown = wrapped;
			throw wrapped;
		} catch (RuntimeException e) {
			exception = e;
			thrown = e;
			throw e;
		} catch (Error e) {
			thrown = e;
			throw e;
		} finally {
			Throwable cleanupFailure = releaseStatementResources(driverStatement, resultMetadata, !cacheable);

			completeOperation(StatementLog.withStatementContext(statementContext)
					.preparationDuration(preparationDuration)
					.executionDuration(executionDuration)
					.resultProcessingDuration(resultProcessingDuration)
					.statementCacheHit(statementCacheHit)
					.exception(exception)
					.build(), thrown, cleanupFailure);
		}
	}

	/**
	 * Column names are read from driver metadata at most once per cached statement; later executions reuse them.
	 */
	@NonNull
	protected List<@NonNull String> resolveColumns(@Nullable CacheEntry cacheEntry,
																								 @NonNull DriverResultMetadata resultMetadata) throws SQLException {
		requireNonNull(resultMetadata);

		if (cacheEntry == null)
			return resultMetadata.getColumnNames();

		Optional<List<String>> cachedColumns = cacheEntry.getColumns();

		if (cachedColumns.isPresent())
			return cachedColumns.get();

		cacheEntry.setColumns(resultMetadata.getColumnNames());
		return cacheEntry.getColumns().get();
	}

	/**
	 * Some drivers leave a statement unusable after a failed execution, so it is closed and dropped from the cache.
	 * A failure to close is attached to {@code failure}.
	 */
	protected void evictFailedStatement(@Nullable CacheEntry cacheEntry,
																			@NonNull DriverStatement driverStatement,
																			@NonNull SQLException failure) {
		requireNonNull(driverStatement);
		requireNonNull(failure);

		try {
			driverStatement.close();
		} catch (SQLException closeFailure) {
			failure.addSuppressed(closeFailure);
		}

		if (cacheEntry != null)
			getStatementCache().delete(cacheEntry.getSql());
	}

	/**
	 * Frees result metadata and the statement's result, then closes the statement if it is not cached.
	 *
	 * @return the first failure encountered, with any later ones suppressed onto it, or {@code null}
	 */
	@Nullable
	protected Throwable releaseStatementResources(@Nullable DriverStatement driverStatement,
																								@Nullable DriverResultMetadata resultMetadata,
																								boolean closeStatement) {
		Throwable cleanupFailure = null;

		if (resultMetadata != null) {
			try {
				resultMetadata.free();
			} catch (Throwable cleanupException) {
				cleanupFailure = cleanupException;
			}
		}

		if (driverStatement != null) {
			try {
				driverStatement.freeResult();
			} catch (Throwable cleanupException) {
				cleanupFailure = addSuppressed(cleanupFailure, cleanupException);
			}

			if (closeStatement) {
				try {
					driverStatement.close();
				} catch (Throwable cleanupException) {
					cleanupFailure = addSuppressed(cleanupFailure, cleanupException);
				}
			}
		}

		return cleanupFailure;
	}

	/**
	 * Hands {@code statementLog} to the statement logger, then surfaces cleanup failures: suppressed onto
	 * {@code thrown} if the operation already failed, rethrown otherwise.
	 */
	protected void completeOperation(@NonNull StatementLog statementLog,
																	 @Nullable Throwable thrown,
																	 @Nullable Throwable cleanupFailure) {
		requireNonNull(statementLog);

		try {
			getStatementLogger().log(statementLog);
		} catch (Throwable loggerFailure) {
			cleanupFailure = addSuppressed(cleanupFailure, loggerFailure);
		}

		if (cleanupFailure == null)
			return;

		if (thrown != null)
			thrown.addSuppressed(cleanupFailure);
		else if (cleanupFailure instanceof RuntimeException)
			throw (RuntimeException) cleanupFailure;
		else if (cleanupFailure instanceof Error)
			throw (Error) cleanupFailure;
		else
			throw new DatabaseException("Unable to release statement resources", cleanupFailure);
	}

	@NonNull
	protected List<@Nullable Object> toDriverValues(@NonNull List<@NonNull Bind> binds) {
		requireNonNull(binds);

		List<@Nullable Object> values = new ArrayList<>(binds.size());

		for (Bind bind : binds)
			values.add(bind.toDriverValue());

		return values;
	}

	@NonNull
	private static Throwable addSuppressed(@Nullable Throwable existing,
																				 @NonNull Throwable additional) {
		if (existing == null)
			return additional;

		existing.addSuppressed(additional);
		return existing;
	}

	@NonNull
	protected ConnectionManager getConnectionManager() {
		return this.connectionManager;
	}

	@NonNull
	protected StatementCache getStatementCache() {
		return this.statementCache;
	}

	@NonNull
	protected ResultAdapter getResultAdapter() {
		return this.resultAdapter;
	}

	@NonNull
	protected StatementLogger getStatementLogger() {
		return this.statementLogger;
	}
}
