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
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;

/**
 * Bounded mapping from SQL text to prepared statements, partitioned by {@link ProcessIdentity}.
 * <p>
 * Every operation acts on the active partition only, i.e. the one belonging to {@link ProcessIdentity#current()}.
 * A partition is created empty the first time an identity touches the cache and is never removed.
 * <p>
 * Eviction is by insertion order: when a partition holds {@code max} entries, the oldest is closed and dropped before
 * a new one is added.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class StatementCache {
	@NonNull
	private final Integer max;
	@NonNull
	private final ProcessIdentity processIdentity;
	@NonNull
	private final Map<@NonNull Long, @NonNull LinkedHashMap<@NonNull String, @NonNull CacheEntry>> partitions;
	@NonNull
	private final Logger logger;

	public StatementCache(@NonNull Integer max,
												@NonNull ProcessIdentity processIdentity) {
		requireNonNull(max);
		requireNonNull(processIdentity);

		if (max < 1)
			throw new IllegalArgumentException(format("Statement cache capacity must be at least 1, was %d", max));

		this.max = max;
		this.processIdentity = processIdentity;
		this.partitions = new HashMap<>();
		this.logger = Logger.getLogger(getClass().getName());
	}

	@NonNull
	public Optional<CacheEntry> get(@NonNull String sql) {
		requireNonNull(sql);
		return Optional.ofNullable(activePartition().get(sql));
	}

	@NonNull
	public Boolean contains(@NonNull String sql) {
		requireNonNull(sql);
		return activePartition().containsKey(sql);
	}

	/**
	 * Inserts {@code entry}, first closing and evicting the oldest entries until there is room.
	 * <p>
	 * If {@code sql} is already cached, the previous entry is replaced and its statement closed, unless it is the
	 * same statement.
	 */
	public void put(@NonNull String sql,
									@NonNull CacheEntry entry) {
		requireNonNull(sql);
		requireNonNull(entry);

		LinkedHashMap<String, CacheEntry> partition = activePartition();
		CacheEntry replaced = partition.remove(sql);

		if (replaced != null && replaced.getStatement() != entry.getStatement())
			closeStatement(replaced);

		while (partition.size() >= getMax()) {
			Iterator<CacheEntry> iterator = partition.values().iterator();
			CacheEntry oldest = iterator.next();

			// Evicted statements are closed before they leave the mapping
			closeStatement(oldest);
			iterator.remove();
		}

		partition.put(sql, entry);
	}

	/**
	 * Removes the entry for {@code sql} without closing its statement.
	 * <p>
	 * Callers evicting after an execution failure close the statement themselves first.
	 *
	 * @return the removed entry, if there was one
	 */
	@NonNull
	public Optional<CacheEntry> delete(@NonNull String sql) {
		requireNonNull(sql);
		return Optional.ofNullable(activePartition().remove(sql));
	}

	/**
	 * Closes every statement in the active partition and empties it.
	 */
	public void clear() {
		LinkedHashMap<String, CacheEntry> partition = activePartition();
		List<CacheEntry> entries = new ArrayList<>(partition.values());

		partition.clear();

		for (CacheEntry entry : entries)
			closeStatement(entry);
	}

	public int size() {
		return activePartition().size();
	}

	@NonNull
	public Integer getMax() {
		return this.max;
	}

	/**
	 * Explicit get-or-create: an identity seen for the first time gets a new, empty partition.
	 */
	@NonNull
	protected LinkedHashMap<@NonNull String, @NonNull CacheEntry> activePartition() {
		Long identity = getProcessIdentity().current();
		LinkedHashMap<String, CacheEntry> partition = this.partitions.get(identity);

		if (partition == null) {
			partition = new LinkedHashMap<>();
			this.partitions.put(identity, partition);
		}

		return partition;
	}

	/**
	 * Closing a statement whose connection is already gone must not fail eviction or clearing, so errors are logged.
	 */
	protected void closeStatement(@NonNull CacheEntry entry) {
		requireNonNull(entry);

		try {
			entry.getStatement().close();
		} catch (SQLException e) {
			getLogger().log(FINE, format("Unable to close cached statement for %s", entry.getSql()), e);
		}
	}

	@NonNull
	protected ProcessIdentity getProcessIdentity() {
		return this.processIdentity;
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}
}
