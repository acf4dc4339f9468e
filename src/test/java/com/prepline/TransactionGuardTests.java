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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * @since 1.0.0
 */
public class TransactionGuardTests {
	private FakeDriverConnection connection;
	private ConnectionManager connectionManager;

	@BeforeEach
	public void setUp() {
		this.connection = new FakeDriverConnection();
		this.connectionManager = new ConnectionManager(this.connection, DatabaseConfig.withDatabase("app").build(),
				new StatementCache(10, () -> 1L));
	}

	@Test
	public void testBeginStartsTransaction() {
		this.connectionManager.connect();

		Assertions.assertEquals(BeginOutcome.STARTED, transactionGuard().begin());
		Assertions.assertTrue(this.connection.events.contains("query BEGIN"));
		Assertions.assertTrue(this.connection.preparedStatementsFor("BEGIN").isEmpty(), "BEGIN must not be prepared");
	}

	@Test
	public void testRejectedBeginIsTolerated() {
		this.connection.failOn("BEGIN");
		this.connectionManager.connect();

		Assertions.assertEquals(BeginOutcome.UNSUPPORTED_BY_BACKEND, transactionGuard().begin());
	}

	@Test
	public void testBeginWhileDisconnectedPropagates() {
		Assertions.assertThrows(ConnectionFailureException.class, () -> transactionGuard().begin());
	}

	@NonNull
	private TransactionGuard transactionGuard() {
		return new TransactionGuard(new ExecutionEngine(this.connectionManager,
				new StatementCache(10, () -> 1L), new ResultAdapter(), statementLog -> {}));
	}
}
