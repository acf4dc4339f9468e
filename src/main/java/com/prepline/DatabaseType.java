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

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Identifies different types of databases, which allows for special platform-specific handling.
 *
 * @since 1.0.0
 */
public enum DatabaseType {
	/**
	 * A database which requires no special handling.
	 */
	GENERIC,
	/**
	 * A MySQL or MariaDB database.
	 */
	MYSQL,
	/**
	 * An HSQLDB database.
	 */
	HSQLDB;

	/**
	 * Determines the type of database to which the given {@code connection} is connected.
	 *
	 * @param connection an open connection
	 * @return the type of database
	 * @throws SQLException if database metadata cannot be read
	 */
	@NonNull
	public static DatabaseType fromConnection(@NonNull Connection connection) throws SQLException {
		requireNonNull(connection);

		DatabaseMetaData databaseMetaData = connection.getMetaData();
		String databaseProductName = databaseMetaData.getDatabaseProductName();
		String url = databaseMetaData.getURL();

		// All of our checks are against databases with English names
		String databaseProductNameLowercase = databaseProductName == null ? "" : databaseProductName.toLowerCase(Locale.ENGLISH);
		String urlLowercase = url == null ? "" : url.toLowerCase(Locale.ENGLISH);

		// Prefer product name
		if (databaseProductNameLowercase.contains("mysql") || databaseProductNameLowercase.contains("mariadb"))
			return DatabaseType.MYSQL;

		if (databaseProductNameLowercase.contains("hsql"))
			return DatabaseType.HSQLDB;

		if (urlLowercase.startsWith("jdbc:mysql:") || urlLowercase.startsWith("jdbc:mariadb:"))
			return DatabaseType.MYSQL;

		if (urlLowercase.startsWith("jdbc:hsqldb:"))
			return DatabaseType.HSQLDB;

		return DatabaseType.GENERIC;
	}

	/**
	 * Session setup to run after every successful connect or re-authentication.
	 * <p>
	 * For MySQL this sets the client encoding (if requested) and turns off {@code sql_auto_is_null}, which otherwise
	 * makes {@code WHERE id IS NULL} select the last inserted row.
	 *
	 * @param encoding the configured client encoding, if any
	 * @return statements to run, in order
	 */
	@NonNull
	public List<@NonNull String> sessionStatements(@Nullable String encoding) {
		if (this != MYSQL)
			return List.of();

		List<String> statements = new ArrayList<>(2);

		if (encoding != null)
			statements.add(format("SET NAMES '%s'", encoding));

		statements.add("SET SQL_AUTO_IS_NULL=0");

		return statements;
	}

	/**
	 * @return a query whose single value is the session's last generated identifier, if this database has one
	 */
	@NonNull
	public Optional<String> lastInsertIdQuery() {
		switch (this) {
			case MYSQL:
				return Optional.of("SELECT LAST_INSERT_ID()");
			case HSQLDB:
				return Optional.of("CALL IDENTITY()");
			default:
				return Optional.empty();
		}
	}
}
