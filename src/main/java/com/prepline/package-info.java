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

/**
 * Prepline is a statement-caching adapter over a single relational database connection.
 * <p>
 * Statements with bind values are prepared once per SQL text and reused from a bounded, per-process cache; bind-less
 * statements are prepared for one use. Connection lifecycle, liveness probing and transaction start are handled by the
 * adapter.
 *
 * <pre>
 * DatabaseConfig databaseConfig = DatabaseConfig.withDatabase("app")
 *   .host("db.internal")
 *   .username("app")
 *   .password("secret")
 *   .encoding("utf8mb4")
 *   .build();
 *
 * DatabaseAdapter databaseAdapter = DatabaseAdapter.withConfig(databaseConfig).build();
 * databaseAdapter.connect();
 *
 * // Prepared and cached
 * Result cars = databaseAdapter.execute("SELECT * FROM car WHERE color = ?", Bind.values("BLUE"));
 * long updateCount = databaseAdapter.executeMutation("UPDATE car SET color = ?", Bind.values("RED"));
 * Object id = databaseAdapter.insert("INSERT INTO car (color) VALUES (?)", "Car Create", Bind.values("GREEN"), null);
 *
 * // Direct, for statements the prepared API cannot run
 * List&lt;List&lt;Object&gt;&gt; rows = databaseAdapter.selectRows("SHOW CREATE TABLE car", null);
 *
 * // Transactions
 * if (databaseAdapter.beginTransaction() == BeginOutcome.STARTED) {
 *   ...
 * }
 *
 * databaseAdapter.close();
 * </pre>
 *
 * @since 1.0.0
 */
package com.prepline;
