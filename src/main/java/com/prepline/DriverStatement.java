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
import java.util.List;

/**
 * A driver-compiled statement bound to one SQL string and one {@link DriverConnection}.
 * <p>
 * Instances are owned by exactly one party at a time (a statement cache entry or the call that prepared them) and
 * must be closed exactly once.
 *
 * @since 1.0.0
 */
public interface DriverStatement {
	/**
	 * Executes with the given values bound to the statement's placeholders, in order.
	 */
	void execute(@NonNull List<@Nullable Object> values) throws SQLException;

	/**
	 * @return metadata describing the current result's columns, or {@code null} if the last execution produced no rows
	 */
	@Nullable
	DriverResultMetadata getResultMetadata() throws SQLException;

	/**
	 * @return the rows produced by the last execution
	 */
	@NonNull
	RowSource getRowSource() throws SQLException;

	/**
	 * @return rows affected by the last execution, as reported by the driver
	 */
	long getAffectedRows() throws SQLException;

	/**
	 * Releases the result of the last execution while keeping the statement usable.
	 */
	void freeResult() throws SQLException;

	void close() throws SQLException;
}
