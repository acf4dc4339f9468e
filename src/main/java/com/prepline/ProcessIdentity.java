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

/**
 * Supplies the identity of the process currently driving the adapter.
 * <p>
 * {@link StatementCache} partitions its entries by this identity, so a process that inherits the cache's memory from
 * its parent (a fork) starts with an empty partition and never closes statement handles the parent still owns.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProcessIdentity {
	long current();

	/**
	 * @return an identity backed by the operating system process id
	 */
	static ProcessIdentity operatingSystemProcess() {
		return () -> ProcessHandle.current().pid();
	}
}
