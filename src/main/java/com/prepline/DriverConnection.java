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

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Optional;
import java.util.Set;

/**
 * An opaque handle to one database session, as provided by a driver.
 * <p>
 * Every driver failure surfaces as a {@link SQLException}. Operations marked optional are only called when
 * {@link #getCapabilities()} reports the matching {@link Capability}; their default implementations throw
 * {@link SQLFeatureNotSupportedException}.
 * <p>
 * Handles are not safe for concurrent use.
 *
 * @since 1.0.0
 */
public interface DriverConnection {
	/**
	 * Sets an option that takes effect on the next {@link #connect(ConnectionParameters)}.
	 */
	void setOption(@NonNull DriverOption option,
								 @NonNull Object value) throws SQLException;

	/**
	 * Performs the physical connect. A successful connect turns driver-level auto-reconnect off.
	 */
	void connect(@NonNull ConnectionParameters connectionParameters) throws SQLException;

	void close() throws SQLException;

	/**
	 * @return optional operations this handle supports; only meaningful after a successful connect
	 */
	@NonNull
	Set<@NonNull Capability> getCapabilities();

	/**
	 * @return the kind of database on the other end of this session; only meaningful after a successful connect
	 */
	@NonNull
	DatabaseType getDatabaseType();

	@NonNull
	DriverStatement prepare(@NonNull String sql) throws SQLException;

	/**
	 * Runs {@code sql} without the prepared-statement API.
	 *
	 * @return the raw result, or {@code null} if the statement produced none
	 */
	@Nullable
	DriverResult query(@NonNull String sql) throws SQLException;

	/**
	 * Optional, see {@link Capability#RECONNECT_FLAG}.
	 */
	default void setReconnect(boolean reconnect) throws SQLException {
		throw new SQLFeatureNotSupportedException("Driver has no reconnect flag");
	}

	/**
	 * Optional, see {@link Capability#CHANGE_USER}.
	 */
	default void changeUser(@NonNull String username,
													@NonNull String password,
													@NonNull String database) throws SQLException {
		throw new SQLFeatureNotSupportedException("Driver cannot change user");
	}

	/**
	 * Optional, see {@link Capability#STAT}.
	 *
	 * @return a server status line
	 */
	@NonNull
	default String stat() throws SQLException {
		throw new SQLFeatureNotSupportedException("Driver has no status call");
	}

	/**
	 * Optional, see {@link Capability#ERRNO}.
	 *
	 * @return the error code of the last call, {@code 0} if it succeeded
	 */
	default int errno() {
		return 0;
	}

	/**
	 * @return the message of the last failed call, if the driver tracks one
	 */
	@NonNull
	default Optional<String> lastError() {
		return Optional.empty();
	}

	/**
	 * Optional, see {@link Capability#INSERT_ID}.
	 */
	default long insertId() throws SQLException {
		throw new SQLFeatureNotSupportedException("Driver cannot report the last insert id");
	}

	/**
	 * Optional, see {@link Capability#SERVER_INFO}.
	 */
	@NonNull
	default String serverInfo() throws SQLException {
		throw new SQLFeatureNotSupportedException("Driver cannot report server info");
	}
}
