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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Column names plus row tuples, as produced by a query.
 * <p>
 * Columns are in driver-reported order and rows in fetch order. Values are whatever the driver produced, and may be
 * {@code null}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Result {
	@NonNull
	private static final Result EMPTY = new Result(List.of(), List.of());

	@NonNull
	private final List<@NonNull String> columns;
	@NonNull
	private final List<@NonNull List<@Nullable Object>> rows;

	private Result(@NonNull List<@NonNull String> columns,
								 @NonNull List<@NonNull List<@Nullable Object>> rows) {
		this.columns = columns;
		this.rows = rows;
	}

	/**
	 * @throws IllegalArgumentException if a row's width differs from the number of columns
	 */
	@NonNull
	public static Result of(@NonNull List<@NonNull String> columns,
													@NonNull List<@NonNull List<@Nullable Object>> rows) {
		requireNonNull(columns);
		requireNonNull(rows);

		List<List<Object>> copiedRows = new ArrayList<>(rows.size());

		for (List<Object> row : rows) {
			if (row.size() != columns.size())
				throw new IllegalArgumentException(format("Row has %d values but there are %d columns", row.size(), columns.size()));

			// List.copyOf rejects nulls, and null is a legitimate column value
			copiedRows.add(Collections.unmodifiableList(new ArrayList<>(row)));
		}

		return new Result(List.copyOf(columns), Collections.unmodifiableList(copiedRows));
	}

	/**
	 * @return a result with no columns and no rows, for statements that produce neither
	 */
	@NonNull
	public static Result empty() {
		return EMPTY;
	}

	@NonNull
	public List<@NonNull String> getColumns() {
		return this.columns;
	}

	@NonNull
	public List<@NonNull List<@Nullable Object>> getRows() {
		return this.rows;
	}

	public int size() {
		return this.rows.size();
	}

	public boolean isEmpty() {
		return this.rows.isEmpty();
	}

	/**
	 * @return one column-name-to-value map per row, each preserving column order
	 */
	@NonNull
	public List<@NonNull Map<@NonNull String, @Nullable Object>> toMaps() {
		List<Map<String, Object>> maps = new ArrayList<>(this.rows.size());

		for (List<Object> row : this.rows) {
			Map<String, Object> map = new LinkedHashMap<>(this.columns.size());

			for (int i = 0; i < this.columns.size(); ++i)
				map.put(this.columns.get(i), row.get(i));

			maps.add(Collections.unmodifiableMap(map));
		}

		return Collections.unmodifiableList(maps);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.columns, this.rows);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Result))
			return false;

		Result result = (Result) object;

		return Objects.equals(result.columns, this.columns)
				&& Objects.equals(result.rows, this.rows);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{columns=%s, rows=%s}", getClass().getSimpleName(), this.columns, this.rows);
	}
}
