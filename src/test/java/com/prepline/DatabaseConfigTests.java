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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * @since 1.0.0
 */
public class DatabaseConfigTests {
	@Test
	public void testDefaults() {
		DatabaseConfig databaseConfig = DatabaseConfig.withDatabase("app").build();

		Assertions.assertEquals("root", databaseConfig.getUsername());
		Assertions.assertEquals("", databaseConfig.getPassword());
		Assertions.assertFalse(databaseConfig.getReconnect());
		Assertions.assertEquals(1000, databaseConfig.getStatementCacheLimit());
		Assertions.assertFalse(databaseConfig.isSslConfigured());
		Assertions.assertEquals(Optional.empty(), databaseConfig.getHost());
	}

	@Test
	public void testFromMap() {
		Map<String, Object> options = new HashMap<>();
		options.put("host", "db.internal");
		options.put("port", "3307");
		options.put("username", "app");
		options.put("password", "secret");
		options.put("database", "inventory");
		options.put("encoding", "utf8mb4");
		options.put("reconnect", "true");
		options.put("sslca", "/etc/ssl/ca.pem");
		options.put("connectTimeout", 5);
		options.put("readTimeout", "30");
		options.put("statementCacheLimit", 50);

		DatabaseConfig databaseConfig = DatabaseConfig.fromMap(options);

		Assertions.assertEquals(Optional.of("db.internal"), databaseConfig.getHost());
		Assertions.assertEquals(Optional.of(3307), databaseConfig.getPort());
		Assertions.assertEquals("app", databaseConfig.getUsername());
		Assertions.assertEquals("inventory", databaseConfig.getDatabase());
		Assertions.assertEquals(Optional.of("utf8mb4"), databaseConfig.getEncoding());
		Assertions.assertTrue(databaseConfig.getReconnect());
		Assertions.assertTrue(databaseConfig.isSslConfigured());
		Assertions.assertEquals(Optional.of(Duration.ofSeconds(5)), databaseConfig.getConnectTimeout());
		Assertions.assertEquals(Optional.of(Duration.ofSeconds(30)), databaseConfig.getReadTimeout());
		Assertions.assertEquals(Optional.empty(), databaseConfig.getWriteTimeout());
		Assertions.assertEquals(50, databaseConfig.getStatementCacheLimit());
		Assertions.assertFalse(databaseConfig.toString().contains("secret"), "Password must not appear in toString()");
	}

	@Test
	public void testFromMapRejectsBadInput() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> DatabaseConfig.fromMap(Map.of("host", "localhost")),
				"database is required");
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> DatabaseConfig.fromMap(Map.of("database", "app", "flags", "COMPRESS")));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> DatabaseConfig.fromMap(Map.of("database", "app", "port", "not-a-port")));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> DatabaseConfig.fromMap(Map.of("database", "app", "reconnect", "sometimes")));
	}

	@Test
	public void testStatementCacheLimitMustBePositive() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> DatabaseConfig.withDatabase("app").statementCacheLimit(0).build());
	}

	@Test
	public void testConnectionParametersAlwaysRequestMultiResultsAndFoundRows() {
		ConnectionParameters connectionParameters = ConnectionParameters.fromConfig(DatabaseConfig.withDatabase("app")
				.password("secret")
				.build());

		Assertions.assertTrue(connectionParameters.getClientFlags().contains(ClientFlag.MULTI_RESULTS));
		Assertions.assertTrue(connectionParameters.getClientFlags().contains(ClientFlag.FOUND_ROWS));
		Assertions.assertFalse(connectionParameters.toString().contains("secret"));
	}
}
