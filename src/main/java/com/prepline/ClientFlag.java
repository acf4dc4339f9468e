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
 * Client flags passed to the driver at connect time.
 *
 * @since 1.0.0
 */
public enum ClientFlag {
	/**
	 * Allow statements (stored procedures, mostly) to return multiple results.
	 */
	MULTI_RESULTS,
	/**
	 * Report rows matched rather than rows changed as the affected-row count.
	 */
	FOUND_ROWS
}
