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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A prepared statement held by {@link StatementCache}, plus the column names of its result once they are known.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class CacheEntry {
	@NonNull
	private final String sql;
	@NonNull
	private final DriverStatement statement;
	@Nullable
	private List<@NonNull String> columns;

	public CacheEntry(@NonNull String sql,
										@NonNull DriverStatement statement) {
		this.sql = requireNonNull(sql);
		this.statement = requireNonNull(statement);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{sql=%s, columns=%s}", getClass().getSimpleName(), this.sql, this.columns);
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	@NonNull
	public DriverStatement getStatement() {
		return this.statement;
	}

	/**
	 * @return column names recorded after the first execution that produced result metadata
	 */
	@NonNull
	public Optional<List<@NonNull String>> getColumns() {
		return Optional.ofNullable(this.columns);
	}

	/**
	 * Records column names. Once set they are kept for the lifetime of the entry.
	 *
	 * @throws IllegalStateException if columns were already recorded
	 */
	public void setColumns(@NonNull List<@NonNull String> columns) {
		requireNonNull(columns);

		if (this.columns != null)
			throw new IllegalStateException(format("Columns already recorded for %s", this.sql));

		this.columns = List.copyOf(columns);
	}
}
