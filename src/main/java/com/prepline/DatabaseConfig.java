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
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Immutable adapter configuration.
 * <p>
 * Build one fluently:
 * <pre>
 * DatabaseConfig config = DatabaseConfig.withDatabase("app")
 *   .host("db.internal")
 *   .username("app")
 *   .encoding("utf8mb4")
 *   .readTimeout(Duration.ofSeconds(30))
 *   .build();</pre>
 * or from a loosely-typed option map via {@link #fromMap(Map)}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class DatabaseConfig {
	@NonNull
	public static final String DEFAULT_USERNAME = "root";
	@NonNull
	public static final String DEFAULT_PASSWORD = "";
	public static final int DEFAULT_STATEMENT_CACHE_LIMIT = 1000;

	@NonNull
	private static final Set<@NonNull String> RECOGNIZED_OPTIONS = Set.of("host", "port", "socket", "username",
			"password", "database", "encoding", "reconnect", "sslca", "sslkey", "sslcert", "sslcapath", "sslcipher",
			"connectTimeout", "readTimeout", "writeTimeout", "statementCacheLimit", "jdbcUrl");

	@Nullable
	private final String host;
	@Nullable
	private final Integer port;
	@Nullable
	private final String socket;
	@NonNull
	private final String username;
	@NonNull
	private final String password;
	@NonNull
	private final String database;
	@Nullable
	private final String encoding;
	@NonNull
	private final Boolean reconnect;
	@Nullable
	private final String sslCa;
	@Nullable
	private final String sslKey;
	@Nullable
	private final String sslCert;
	@Nullable
	private final String sslCaPath;
	@Nullable
	private final String sslCipher;
	@Nullable
	private final Duration connectTimeout;
	@Nullable
	private final Duration readTimeout;
	@Nullable
	private final Duration writeTimeout;
	@NonNull
	private final Integer statementCacheLimit;
	@Nullable
	private final String jdbcUrl;

	private DatabaseConfig(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.statementCacheLimit != null && builder.statementCacheLimit < 1)
			throw new IllegalArgumentException(format("Statement cache limit must be at least 1, was %d", builder.statementCacheLimit));

		this.host = builder.host;
		this.port = builder.port;
		this.socket = builder.socket;
		this.username = builder.username == null ? DEFAULT_USERNAME : builder.username;
		this.password = builder.password == null ? DEFAULT_PASSWORD : builder.password;
		this.database = requireNonNull(builder.database);
		this.encoding = builder.encoding;
		this.reconnect = builder.reconnect == null ? false : builder.reconnect;
		this.sslCa = builder.sslCa;
		this.sslKey = builder.sslKey;
		this.sslCert = builder.sslCert;
		this.sslCaPath = builder.sslCaPath;
		this.sslCipher = builder.sslCipher;
		this.connectTimeout = builder.connectTimeout;
		this.readTimeout = builder.readTimeout;
		this.writeTimeout = builder.writeTimeout;
		this.statementCacheLimit = builder.statementCacheLimit == null ? DEFAULT_STATEMENT_CACHE_LIMIT : builder.statementCacheLimit;
		this.jdbcUrl = builder.jdbcUrl;
	}

	/**
	 * Provides a {@link DatabaseConfig} builder for the given database name.
	 *
	 * @param database the database to connect to
	 * @return a {@link DatabaseConfig} builder
	 */
	@NonNull
	public static Builder withDatabase(@NonNull String database) {
		requireNonNull(database);
		return new Builder(database);
	}

	/**
	 * Builds configuration from an option map, e.g. one parsed from a YAML or properties file.
	 * <p>
	 * Timeouts are given in seconds. {@code database} is required; unrecognized keys are rejected.
	 *
	 * @param options the option map
	 * @return the corresponding configuration
	 * @throws IllegalArgumentException if {@code database} is missing, a key is unrecognized, or a value has the wrong shape
	 */
	@NonNull
	public static DatabaseConfig fromMap(@NonNull Map<@NonNull String, ? extends @Nullable Object> options) {
		requireNonNull(options);

		for (String key : options.keySet())
			if (!RECOGNIZED_OPTIONS.contains(key))
				throw new IllegalArgumentException(format("Unrecognized database option '%s'", key));

		String database = stringValue(options, "database");

		if (database == null)
			throw new IllegalArgumentException("The 'database' option is required");

		return withDatabase(database)
				.host(stringValue(options, "host"))
				.port(integerValue(options, "port"))
				.socket(stringValue(options, "socket"))
				.username(stringValue(options, "username"))
				.password(stringValue(options, "password"))
				.encoding(stringValue(options, "encoding"))
				.reconnect(booleanValue(options, "reconnect"))
				.sslCa(stringValue(options, "sslca"))
				.sslKey(stringValue(options, "sslkey"))
				.sslCert(stringValue(options, "sslcert"))
				.sslCaPath(stringValue(options, "sslcapath"))
				.sslCipher(stringValue(options, "sslcipher"))
				.connectTimeout(secondsValue(options, "connectTimeout"))
				.readTimeout(secondsValue(options, "readTimeout"))
				.writeTimeout(secondsValue(options, "writeTimeout"))
				.statementCacheLimit(integerValue(options, "statementCacheLimit"))
				.jdbcUrl(stringValue(options, "jdbcUrl"))
				.build();
	}

	@Nullable
	private static String stringValue(@NonNull Map<@NonNull String, ? extends @Nullable Object> options,
																		@NonNull String key) {
		Object value = options.get(key);
		return value == null ? null : value.toString();
	}

	@Nullable
	private static Integer integerValue(@NonNull Map<@NonNull String, ? extends @Nullable Object> options,
																			@NonNull String key) {
		Object value = options.get(key);

		if (value == null)
			return null;

		if (value instanceof Number)
			return ((Number) value).intValue();

		try {
			return Integer.valueOf(value.toString().trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(format("Option '%s' must be an integer, was '%s'", key, value), e);
		}
	}

	@Nullable
	private static Boolean booleanValue(@NonNull Map<@NonNull String, ? extends @Nullable Object> options,
																			@NonNull String key) {
		Object value = options.get(key);

		if (value == null)
			return null;

		if (value instanceof Boolean)
			return (Boolean) value;

		String string = value.toString().trim();

		if ("true".equalsIgnoreCase(string))
			return true;
		if ("false".equalsIgnoreCase(string))
			return false;

		throw new IllegalArgumentException(format("Option '%s' must be true or false, was '%s'", key, value));
	}

	@Nullable
	private static Duration secondsValue(@NonNull Map<@NonNull String, ? extends @Nullable Object> options,
																			 @NonNull String key) {
		Integer seconds = integerValue(options, key);
		return seconds == null ? null : Duration.ofSeconds(seconds);
	}

	@Override
	@NonNull
	public String toString() {
		// Password intentionally omitted
		return format("%s{host=%s, port=%s, socket=%s, username=%s, database=%s, encoding=%s, reconnect=%s, " +
						"ssl=%s, statementCacheLimit=%s, jdbcUrl=%s}", getClass().getSimpleName(), this.host, this.port,
				this.socket, this.username, this.database, this.encoding, this.reconnect, isSslConfigured(),
				this.statementCacheLimit, this.jdbcUrl);
	}

	/**
	 * SSL material is only handed to the driver when a CA or a client key is present.
	 */
	@NonNull
	public Boolean isSslConfigured() {
		return this.sslCa != null || this.sslKey != null;
	}

	@NonNull
	public Optional<String> getHost() {
		return Optional.ofNullable(this.host);
	}

	@NonNull
	public Optional<Integer> getPort() {
		return Optional.ofNullable(this.port);
	}

	@NonNull
	public Optional<String> getSocket() {
		return Optional.ofNullable(this.socket);
	}

	@NonNull
	public String getUsername() {
		return this.username;
	}

	@NonNull
	public String getPassword() {
		return this.password;
	}

	@NonNull
	public String getDatabase() {
		return this.database;
	}

	@NonNull
	public Optional<String> getEncoding() {
		return Optional.ofNullable(this.encoding);
	}

	@NonNull
	public Boolean getReconnect() {
		return this.reconnect;
	}

	@NonNull
	public Optional<String> getSslCa() {
		return Optional.ofNullable(this.sslCa);
	}

	@NonNull
	public Optional<String> getSslKey() {
		return Optional.ofNullable(this.sslKey);
	}

	@NonNull
	public Optional<String> getSslCert() {
		return Optional.ofNullable(this.sslCert);
	}

	@NonNull
	public Optional<String> getSslCaPath() {
		return Optional.ofNullable(this.sslCaPath);
	}

	@NonNull
	public Optional<String> getSslCipher() {
		return Optional.ofNullable(this.sslCipher);
	}

	@NonNull
	public Optional<Duration> getConnectTimeout() {
		return Optional.ofNullable(this.connectTimeout);
	}

	@NonNull
	public Optional<Duration> getReadTimeout() {
		return Optional.ofNullable(this.readTimeout);
	}

	@NonNull
	public Optional<Duration> getWriteTimeout() {
		return Optional.ofNullable(this.writeTimeout);
	}

	@NonNull
	public Integer getStatementCacheLimit() {
		return this.statementCacheLimit;
	}

	@NonNull
	public Optional<String> getJdbcUrl() {
		return Optional.ofNullable(this.jdbcUrl);
	}

	/**
	 * Builder used to construct instances of {@link DatabaseConfig}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String database;
		@Nullable
		private String host;
		@Nullable
		private Integer port;
		@Nullable
		private String socket;
		@Nullable
		private String username;
		@Nullable
		private String password;
		@Nullable
		private String encoding;
		@Nullable
		private Boolean reconnect;
		@Nullable
		private String sslCa;
		@Nullable
		private String sslKey;
		@Nullable
		private String sslCert;
		@Nullable
		private String sslCaPath;
		@Nullable
		private String sslCipher;
		@Nullable
		private Duration connectTimeout;
		@Nullable
		private Duration readTimeout;
		@Nullable
		private Duration writeTimeout;
		@Nullable
		private Integer statementCacheLimit;
		@Nullable
		private String jdbcUrl;

		private Builder(@NonNull String database) {
			requireNonNull(database);
			this.database = database;
		}

		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		@NonNull
		public Builder port(@Nullable Integer port) {
			this.port = port;
			return this;
		}

		@NonNull
		public Builder socket(@Nullable String socket) {
			this.socket = socket;
			return this;
		}

		@NonNull
		public Builder username(@Nullable String username) {
			this.username = username;
			return this;
		}

		@NonNull
		public Builder password(@Nullable String password) {
			this.password = password;
			return this;
		}

		/**
		 * Client encoding; when set, the session runs {@code SET NAMES} with it after connecting.
		 */
		@NonNull
		public Builder encoding(@Nullable String encoding) {
			this.encoding = encoding;
			return this;
		}

		@NonNull
		public Builder reconnect(@Nullable Boolean reconnect) {
			this.reconnect = reconnect;
			return this;
		}

		@NonNull
		public Builder sslCa(@Nullable String sslCa) {
			this.sslCa = sslCa;
			return this;
		}

		@NonNull
		public Builder sslKey(@Nullable String sslKey) {
			this.sslKey = sslKey;
			return this;
		}

		@NonNull
		public Builder sslCert(@Nullable String sslCert) {
			this.sslCert = sslCert;
			return this;
		}

		@NonNull
		public Builder sslCaPath(@Nullable String sslCaPath) {
			this.sslCaPath = sslCaPath;
			return this;
		}

		@NonNull
		public Builder sslCipher(@Nullable String sslCipher) {
			this.sslCipher = sslCipher;
			return this;
		}

		@NonNull
		public Builder connectTimeout(@Nullable Duration connectTimeout) {
			this.connectTimeout = connectTimeout;
			return this;
		}

		@NonNull
		public Builder readTimeout(@Nullable Duration readTimeout) {
			this.readTimeout = readTimeout;
			return this;
		}

		@NonNull
		public Builder writeTimeout(@Nullable Duration writeTimeout) {
			this.writeTimeout = writeTimeout;
			return this;
		}

		@NonNull
		public Builder statementCacheLimit(@Nullable Integer statementCacheLimit) {
			this.statementCacheLimit = statementCacheLimit;
			return this;
		}

		/**
		 * Overrides the JDBC URL that {@link JdbcDriverConnection} would otherwise derive from host, port and database.
		 */
		@NonNull
		public Builder jdbcUrl(@Nullable String jdbcUrl) {
			this.jdbcUrl = jdbcUrl;
			return this;
		}

		@NonNull
		public DatabaseConfig build() {
			return new DatabaseConfig(this);
		}
	}
}
