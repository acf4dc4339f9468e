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
import java.sql.SQLException;

import static java.util.Objects.requireNonNull;

/**
 * Thrown when the driver rejects preparation, execution or fetching of a statement.
 * <p>
 * The driver's message is carried over as-is and its {@link SQLException} is the cause, so error code and SQL state
 * remain available via {@link #getErrorCode()} and {@link #getSqlState()}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class StatementExecutionException extends DatabaseException {
	@NonNull
	private final Statement statement;

	public StatementExecutionException(@NonNull Statement statement,
																		 @Nullable Throwable cause) {
		super(cause);
		this.statement = requireNonNull(statement);
	}

	/**
	 * @return the statement whose execution failed
	 */
	@NonNull
	public Statement getStatement() {
		return this.statement;
	}
}
