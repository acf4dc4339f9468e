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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Everything a {@link DriverConnection} needs to perform its physical connect.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ConnectionParameters {
	@Nullable
	private final String host;
	@NonNull
	private final String username;
	@NonNull
	private final String password;
	@NonNull
	private final String database;
	@Nullable
	private final Integer port;
	@Nullable
	private final String socket;
	@NonNull
	private final Set<@NonNull ClientFlag> clientFlags;
	@Nullable
	private final String jdbcUrl;

	/**
	 * Derives connection parameters from the given configuration, always requesting multiple results and found-rows
	 * affected counts.
	 */
	@NonNull
	public static ConnectionParameters fromConfig(@NonNull DatabaseConfig databaseConfig) {
		requireNonNull(databaseConfig);

		return new ConnectionParameters(databaseConfig.getHost().orElse(null), databaseConfig.getUsername(),
				databaseConfig.getPassword(), databaseConfig.getDatabase(), databaseConfig.getPort().orElse(null),
				databaseConfig.getSocket().orElse(null), EnumSet.of(ClientFlag.MULTI_RESULTS, ClientFlag.FOUND_ROWS),
				databaseConfig.getJdbcUrl().orElse(null));
	}

	private ConnectionParameters(@Nullable String host,
															 @NonNull String username,
															 @NonNull String password,
															 @NonNull String database,
															 @Nullable Integer port,
															 @Nullable String socket,
															 @NonNull Set<@NonNull ClientFlag> clientFlags,
															 @Nullable String jdbcUrl) {
		this.host = host;
		this.username = requireNonNull(username);
		this.password = requireNonNull(password);
		this.database = requireNonNull(database);
		this.port = port;
		this.socket = socket;
		this.clientFlags = Collections.unmodifiableSet(EnumSet.copyOf(requireNonNull(clientFlags)));
		this.jdbcUrl = jdbcUrl;
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.host, this.username, this.password, this.database, this.port, this.socket,
				this.clientFlags, this.jdbcUrl);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ConnectionParameters))
			return false;

		ConnectionParameters other = (ConnectionParameters) object;

		return Objects.equals(other.host, this.host)
				&& Objects.equals(other.username, this.username)
				&& Objects.equals(other.password, this.password)
				&& Objects.equals(other.database, this.database)
				&& Objects.equals(other.port, this.port)
				&& Objects.equals(other.socket, this.socket)
				&& Objects.equals(other.clientFlags, this.clientFlags)
				&& Objects.equals(other.jdbcUrl, this.jdbcUrl);
	}

	@Override
	@NonNull
	public String toString() {
		// Password intentionally omitted
		return format("%s{host=%s, username=%s, database=%s, port=%s, socket=%s, clientFlags=%s, jdbcUrl=%s}",
				getClass().getSimpleName(), this.host, this.username, this.database, this.port, this.socket,
				this.clientFlags, this.jdbcUrl);
	}

	@NonNull
	public Optional<String> getHost() {
		return Optional.ofNullable(this.host);
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
	public Optional<Integer> getPort() {
		return Optional.ofNullable(this.port);
	}

	@NonNull
	public Optional<String> getSocket() {
		return Optional.ofNullable(this.socket);
	}

	@NonNull
	public Set<@NonNull ClientFlag> getClientFlags() {
		return this.clientFlags;
	}

	@NonNull
	public Optional<String> getJdbcUrl() {
		return Optional.ofNullable(this.jdbcUrl);
	}
}
