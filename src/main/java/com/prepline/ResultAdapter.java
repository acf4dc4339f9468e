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
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Turns driver rows into a {@link Result}.
 * <p>
 * Pure transformation: no type coercion, no resource management. Callers own and release whatever the rows came from.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class ResultAdapter {
	/**
	 * Drains {@code rowSource}, pairing each row with the given column names.
	 *
	 * @param columns   column names in driver-reported order
	 * @param rowSource the rows to read
	 * @return the normalized result
	 * @throws SQLException if the driver fails while reading rows
	 */
	@NonNull
	public Result normalize(@NonNull List<@NonNull String> columns,
													@NonNull RowSource rowSource) throws SQLException {
		requireNonNull(columns);
		requireNonNull(rowSource);

		int columnCount = rowSource.getColumnCount();
		List<List<@Nullable Object>> rows = new ArrayList<>();

		while (rowSource.next()) {
			List<@Nullable Object> row = new ArrayList<>(columnCount);

			for (int i = 1; i <= columnCount; ++i)
				row.add(rowSource.getValue(i));

			rows.add(row);
		}

		return Result.of(columns, rows);
	}

	/**
	 * Normalizes a raw, non-prepared query result, taking column names from the result itself.
	 */
	@NonNull
	public Result normalize(@NonNull DriverResult driverResult) throws SQLException {
		requireNonNull(driverResult);
		return normalize(driverResult.getColumnNames(), driverResult);
	}
}
