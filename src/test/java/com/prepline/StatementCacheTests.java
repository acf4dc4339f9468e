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

import com.prepline.FakeDriverConnection.FakeDriverStatement;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
public class StatementCacheTests {
	private FakeDriverConnection connection;
	private AtomicLong processId;

	@BeforeEach
	public void setUp() {
		this.connection = new FakeDriverConnection();
		this.connection.connected = true;
		this.processId = new AtomicLong(100L);
	}

	@Test
	public void testOldestEntryEvictedAndClosedAtCapacity() throws Exception {
		StatementCache statementCache = new StatementCache(2, this.processId::get);

		FakeDriverStatement a = put(statementCache, "A");
		FakeDriverStatement b = put(statementCache, "B");
		FakeDriverStatement c = put(statementCache, "C");

		Assertions.assertEquals(2, statementCache.size(), "Cache exceeded its capacity");
		Assertions.assertFalse(statementCache.contains("A"), "Oldest entry should have been evicted");
		Assertions.assertTrue(statementCache.contains("B"));
		Assertions.assertTrue(statementCache.contains("C"));
		Assertions.assertEquals(1, a.closeCount, "Evicted statement should be closed exactly once");
		Assertions.assertEquals(0, b.closeCount);
		Assertions.assertEquals(0, c.closeCount);
	}

	@Test
	public void testCapacityOfOneKeepsOnlyNewestEntry() throws Exception {
		StatementCache statementCache = new StatementCache(1, this.processId::get);

		FakeDriverStatement a = put(statementCache, "A");
		put(statementCache, "B");

		Assertions.assertEquals(1, statementCache.size());
		Assertions.assertTrue(statementCache.contains("B"));
		Assertions.assertEquals(1, a.closeCount);
	}

	@Test
	public void testCapacityBelowOneRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> new StatementCache(0, this.processId::get));
	}

	@Test
	public void testReplacingEntryClosesPreviousStatement() throws Exception {
		StatementCache statementCache = new StatementCache(2, this.processId::get);

		FakeDriverStatement first = put(statementCache, "A");
		FakeDriverStatement second = put(statementCache, "A");

		Assertions.assertEquals(1, statementCache.size());
		Assertions.assertEquals(1, first.closeCount);
		Assertions.assertEquals(0, second.closeCount);
		Assertions.assertSame(second, statementCache.get("A").get().getStatement());
	}

	@Test
	public void testDeleteRemovesWithoutClosing() throws Exception {
		StatementCache statementCache = new StatementCache(2, this.processId::get);
		FakeDriverStatement a = put(statementCache, "A");

		Assertions.assertTrue(statementCache.delete("A").isPresent());
		Assertions.assertFalse(statementCache.delete("A").isPresent(), "Second delete should find nothing");
		Assertions.assertFalse(statementCache.contains("A"));
		Assertions.assertEquals(0, a.closeCount, "Delete leaves closing to the caller");
	}

	@Test
	public void testClearClosesEveryStatementOnce() throws Exception {
		StatementCache statementCache = new StatementCache(3, this.processId::get);

		FakeDriverStatement a = put(statementCache, "A");
		FakeDriverStatement b = put(statementCache, "B");

		statementCache.clear();
		statementCache.clear();

		Assertions.assertEquals(0, statementCache.size());
		Assertions.assertEquals(1, a.closeCount);
		Assertions.assertEquals(1, b.closeCount);
	}

	@Test
	public void testChildProcessStartsWithEmptyPartition() throws Exception {
		StatementCache statementCache = new StatementCache(2, this.processId::get);
		FakeDriverStatement parentStatement = put(statementCache, "A");

		this.processId.set(200L);

		Assertions.assertEquals(0, statementCache.size(), "Child process should not see the parent's statements");
		Assertions.assertFalse(statementCache.get("A").isPresent());

		FakeDriverStatement childStatement = put(statementCache, "A");
		statementCache.clear();

		Assertions.assertEquals(1, childStatement.closeCount);
		Assertions.assertEquals(0, parentStatement.closeCount, "Child must never close the parent's statements");

		this.processId.set(100L);

		Assertions.assertEquals(1, statementCache.size());
		Assertions.assertSame(parentStatement, statementCache.get("A").get().getStatement());
	}

	@Test
	public void testCloseFailureOnEvictionIsNotRaised() throws Exception {
		StatementCache statementCache = new StatementCache(1, this.processId::get);
		FakeDriverStatement a = put(statementCache, "A");
		a.failClose = true;

		put(statementCache, "B");

		Assertions.assertEquals(1, a.closeCount);
		Assertions.assertFalse(statementCache.contains("A"), "Entry should be evicted even if closing it failed");
		Assertions.assertTrue(statementCache.contains("B"));
	}

	@NonNull
	private FakeDriverStatement put(@NonNull StatementCache statementCache,
																	@NonNull String sql) throws Exception {
		requireNonNull(statementCache);
		requireNonNull(sql);

		FakeDriverStatement statement = (FakeDriverStatement) this.connection.prepare(sql);
		statementCache.put(sql, new CacheEntry(sql, statement));
		return statement;
	}
}
