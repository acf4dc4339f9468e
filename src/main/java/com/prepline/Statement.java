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
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Represents a SQL statement and the name it is logged under (e.g. {@code "SQL"} or {@code "SCHEMA"}).
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Statement {
	/**
	 * Name used when the caller does not supply one.
	 */
	@NonNull
	public static final String DEFAULT_NAME = "SQL";

	@NonNull
	private final String name;
	@NonNull
	private final String sql;

	private Statement(@NonNull String name,
										@NonNull String sql) {
		requireNonNull(name);
		requireNonNull(sql);

		this.name = name;
		this.sql = sql;
	}

	/**
	 * Factory method for providing {@link Statement} instances.
	 *
	 * @param name the statement's log name, or {@code null} for {@value #DEFAULT_NAME}
	 * @param sql  the SQL being identified
	 * @return a statement instance
	 */
	@NonNull
	public static Statement of(@Nullable String name,
														 @NonNull String sql) {
		requireNonNull(sql);
		return new Statement(name == null ? DEFAULT_NAME : name, sql);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getSql());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Statement))
			return false;

		Statement statement = (Statement) object;

		return Objects.equals(statement.getName(), getName())
				&& Objects.equals(statement.getSql(), getSql());
	}

	@Override
	@NonNull
	public String toString() {
		// Strip out newlines for more compact SQL representation
		return format("%s{name=%s, sql=%s}", getClass().getSimpleName(),
				getName(), getSql().replaceAll("\n+", " ").trim());
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}
}
