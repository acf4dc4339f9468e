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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;

/**
 * Issues {@code BEGIN}, tolerating backends and storage engines that reject it.
 * <p>
 * Commit and rollback are left to the caller's transaction orchestration.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class TransactionGuard {
	@NonNull
	private static final String BEGIN_SQL = "BEGIN";

	@NonNull
	private final ExecutionEngine executionEngine;
	@NonNull
	private final Logger logger;

	public TransactionGuard(@NonNull ExecutionEngine executionEngine) {
		requireNonNull(executionEngine);

		this.executionEngine = executionEngine;
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Sends {@code BEGIN} through the non-prepared path.
	 * <p>
	 * Any driver error is taken to mean the backend does not do transactions. Other failures, such as not being
	 * connected, propagate.
	 *
	 * @return {@link BeginOutcome#STARTED}, or {@link BeginOutcome#UNSUPPORTED_BY_BACKEND} if the driver rejected it
	 */
	@NonNull
	public BeginOutcome begin() {
		try {
			getExecutionEngine().executeDirect(BEGIN_SQL, Statement.DEFAULT_NAME);
			return BeginOutcome.STARTED;
		} catch (StatementExecutionException e) {
			getLogger().log(FINE, format("Backend rejected %s (error code %s), continuing without a transaction", BEGIN_SQL,
					e.getErrorCode().map(String::valueOf).orElse("unknown")), e);
			return BeginOutcome.UNSUPPORTED_BY_BACKEND;
		}
	}

	@NonNull
	protected ExecutionEngine getExecutionEngine() {
		return this.executionEngine;
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}
}
