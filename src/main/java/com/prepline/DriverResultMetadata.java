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

import java.sql.SQLException;
import java.util.List;

/**
 * Column metadata for the result of a prepared statement execution.
 *
 * @since 1.0.0
 */
public interface DriverResultMetadata {
	/**
	 * @return column names in driver-reported order
	 */
	@NonNull
	List<@NonNull String> getColumnNames() throws SQLException;

	/**
	 * Releases the metadata handle. Safe to call more than once.
	 */
	void free() throws SQLException;
}
