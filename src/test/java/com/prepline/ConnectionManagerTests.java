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

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
public class ConnectionManagerTests {
	private FakeDriverConnection connection;
	private StatementCache statementCache;

	@BeforeEach
	public void setUp() {
		this.connection = new FakeDriverConnection();
		this.statementCache = new StatementCache(10, () -> 1L);
	}

	@Test
	public void testConnectAppliesOptionsThenConfiguresSession() {
		ConnectionManager connectionManager = managerFor(DatabaseConfig.withDatabase("app")
				.encoding("utf8mb4")
				.sslCa("/etc/ssl/ca.pem")
				.connectTimeout(Duration.ofSeconds(5))
				.reconnect(true)
				.build());

		connectionManager.connect();

		Assertions.assertEquals(List.of(
				"setOption CHARSET_NAME=utf8mb4",
				"setOption SSL_CA=/etc/ssl/ca.pem",
				"setOption CONNECT_TIMEOUT=PT5S",
				"connect app",
				"setReconnect true",
				"query SET NAMES 'utf8mb4'",
				"query SET SQL_AUTO_IS_NULL=0"), this.connection.events);
		Assertions.assertTrue(connectionManager.isConnected());
		Assertions.assertTrue(this.connection.reconnect);
	}

	@Test
	public void testReconnectFlagAppliedAfterConnectResetsIt() {
		ConnectionManager connectionManager = managerFor(DatabaseConfig.withDatabase("app").build());

		connectionManager.connect();

		int connectIndex = this.connection.events.indexOf("connect app");
		int reconnectIndex = this.connection.events.indexOf("setReconnect false");

		Assertions.assertTrue(connectIndex >= 0 && reconnectIndex > connectIndex,
				"Reconnect flag must be set after connecting");
	}

	@Test
	public void testReconnectFlagSkippedWithoutCapability() {
		this.connection.capabilities.remove(Capability.RECONNECT_FLAG);
		ConnectionManager connectionManager = managerFor(DatabaseConfig.withDatabase("app").reconnect(true).build());

		connectionManager.connect();

		Assertions.assertTrue(this.connection.events.stream().noneMatch(event -> event.startsWith("setReconnect")));
	}

	@Test
	public void testRejectedCharsetDoesNotPreventConnecting() {
		this.connection.rejectedOptions.add(DriverOption.CHARSET_NAME);
		ConnectionManager connectionManager = managerFor(DatabaseConfig.withDatabase("app").encoding("latin1").build());

		connectionManager.connect();

		Assertions.assertTrue(connectionManager.isConnected());
		Assertions.assertTrue(this.connection.events.contains("query SET NAMES 'latin1'"));
	}

	@Test
	public void testSslOptionsRequireCaOrKey() {
		ConnectionManager connectionManager = managerFor(DatabaseConfig.withDatabase("app")
				.sslCert("/etc/ssl/client.pem")
				.build());

		connectionManager.connect();

		Assertions.assertTrue(this.connection.events.stream().noneMatch(event -> event.startsWith("setOption SSL_")),
				"SSL options apply only when a CA or key is configured");
	}

	@Test
	public void testNonMySqlDatabaseSkipsSessionStatements() {
		this.connection.databaseType = DatabaseType.HSQLDB;
		ConnectionManager connectionManager = managerFor(DatabaseConfig.withDatabase("app").encoding("utf8").build());

		connectionManager.connect();

		Assertions.assertTrue(this.connection.events.stream().noneMatch(event -> event.startsWith("query ")));
	}

	@Test
	public void testConnectFailureRaisesConnectionFailure() {
		this.connection.failConnect = true;
		ConnectionManager connectionManager = managerFor(DatabaseConfig.withDatabase("app").password("secret").build());

		ConnectionFailureException e = Assertions.assertThrows(ConnectionFailureException.class, connectionManager::connect);

		Assertions.assertEquals(2003, e.getErrorCode().get());
		Assertions.assertFalse(e.getMessage().contains("secret"), "Password must not leak into error messages");
		Assertions.assertFalse(connectionManager.isConnected());
	}

	@Test
	public void testFailedSessionSetupClosesConnection() {
		this.connection.failOn("SET SQL_AUTO_IS_NULL=0");
		ConnectionManager connectionManager = managerFor(DatabaseConfig.withDatabase("app").build());

		Assertions.assertThrows(ConnectionFailureException.class, connectionManager::connect);

		Assertions.assertFalse(connectionManager.isConnected(), "A session that was never configured must not be used");
		Assertions.assertFalse(this.connection.connected, "Driver connection should be closed");
		Assertions.assertEquals("close", this.connection.events.get(this.connection.events.size() - 1));
		Assertions.assertThrows(ConnectionFailureException.class, connectionManager::getConnection);
	}

	@Test
	public void testCloseFailureAfterFailedSessionSetupIsSuppressed() {
		this.connection.failOn("SET SQL_AUTO_IS_NULL=0");
		this.connection.failClose = true;
		ConnectionManager connectionManager = managerFor(DatabaseConfig.withDatabase("app").build());

		ConnectionFailureException e = Assertions.assertThrows(ConnectionFailureException.class, connectionManager::connect);

		Assertions.assertEquals(1, e.getSuppressed().length);
		Assertions.assertFalse(connectionManager.isConnected());
	}

	@Test
	public void testConnectWhileConnectedStartsFreshSession() throws Exception {
		ConnectionManager connectionManager = connectedManager();
		FakeDriverStatement statement = (FakeDriverStatement) this.connection.prepare("SELECT ?");
		this.statementCache.put("SELECT ?", new CacheEntry("SELECT ?", statement));
		this.connection.events.clear();

		connectionManager.connect();

		Assertions.assertEquals("close", this.connection.events.get(0), "Previous session should be closed first");
		Assertions.assertTrue(this.connection.events.contains("connect app"));
		Assertions.assertEquals(0, this.statementCache.size(), "Statements from the previous session must be dropped");
		Assertions.assertEquals(1, statement.closeCount);
		Assertions.assertTrue(connectionManager.isConnected());
	}

	@Test
	public void testIsActiveUsesStatusCall() {
		ConnectionManager connectionManager = connectedManager();

		Assertions.assertTrue(connectionManager.isActive());
		Assertions.assertTrue(this.connection.events.contains("stat"));
	}

	@Test
	public void testIsActiveFalseWhenStatusCallFails() {
		ConnectionManager connectionManager = connectedManager();
		this.connection.failStat = true;

		Assertions.assertFalse(connectionManager.isActive());
	}

	@Test
	public void testIsActiveFalseWhenErrorCodeSet() {
		ConnectionManager connectionManager = connectedManager();
		this.connection.errno = 2013;

		Assertions.assertFalse(connectionManager.isActive());
	}

	@Test
	public void testIsActiveFallsBackToQueryWithoutStatusCall() {
		this.connection.capabilities.remove(Capability.STAT);
		ConnectionManager connectionManager = connectedManager();

		Assertions.assertTrue(connectionManager.isActive());
		Assertions.assertTrue(this.connection.events.contains("query SELECT 1"));

		this.connection.failOn("SELECT 1");

		Assertions.assertFalse(connectionManager.isActive());
	}

	@Test
	public void testIsActiveFalseWhenDisconnected() {
		ConnectionManager connectionManager = managerFor(DatabaseConfig.withDatabase("app").build());

		Assertions.assertFalse(connectionManager.isActive());

		connectionManager.connect();
		connectionManager.disconnect();

		Assertions.assertFalse(connectionManager.isActive());
	}

	@Test
	public void testResetChangesUserAndReconfiguresSession() {
		ConnectionManager connectionManager = connectedManager();
		this.connection.events.clear();

		connectionManager.reset();

		Assertions.assertEquals(List.of("changeUser root app", "query SET SQL_AUTO_IS_NULL=0"), this.connection.events);
	}

	@Test
	public void testResetWithoutChangeUserDoesNothing() {
		this.connection.capabilities.remove(Capability.CHANGE_USER);
		ConnectionManager connectionManager = connectedManager();
		this.connection.events.clear();

		connectionManager.reset();

		Assertions.assertTrue(this.connection.events.isEmpty());
	}

	@Test
	public void testResetFailures() {
		ConnectionManager connectionManager = managerFor(DatabaseConfig.withDatabase("app").build());

		Assertions.assertThrows(ConnectionFailureException.class, connectionManager::reset, "Reset requires a connection");

		connectionManager.connect();
		this.connection.failChangeUser = true;

		ConnectionFailureException e = Assertions.assertThrows(ConnectionFailureException.class, connectionManager::reset);
		Assertions.assertEquals(1045, e.getErrorCode().get());
	}

	@Test
	public void testReconnectClearsStatementCache() throws Exception {
		ConnectionManager connectionManager = connectedManager();
		FakeDriverStatement statement = (FakeDriverStatement) this.connection.prepare("SELECT ?");
		this.statementCache.put("SELECT ?", new CacheEntry("SELECT ?", statement));
		this.connection.events.clear();

		connectionManager.reconnect();

		Assertions.assertEquals(0, this.statementCache.size());
		Assertions.assertEquals(1, statement.closeCount);
		Assertions.assertEquals("close", this.connection.events.get(0));
		Assertions.assertTrue(this.connection.events.contains("connect app"));
		Assertions.assertTrue(connectionManager.isConnected());
	}

	@Test
	public void testDisconnectIgnoresCloseFailure() {
		ConnectionManager connectionManager = connectedManager();
		this.connection.failClose = true;

		connectionManager.disconnect();

		Assertions.assertFalse(connectionManager.isConnected());
		Assertions.assertThrows(ConnectionFailureException.class, connectionManager::getConnection);
	}

	@Test
	public void testServerInfoRequiresCapability() {
		ConnectionManager connectionManager = connectedManager();

		Assertions.assertEquals(Optional.of("8.0.36-log"), connectionManager.getServerInfo());

		this.connection.capabilities.remove(Capability.SERVER_INFO);
		connectionManager.reconnect();

		Assertions.assertEquals(Optional.empty(), connectionManager.getServerInfo());
	}

	@NonNull
	private ConnectionManager connectedManager() {
		ConnectionManager connectionManager = managerFor(DatabaseConfig.withDatabase("app").build());
		connectionManager.connect();
		return connectionManager;
	}

	@NonNull
	private ConnectionManager managerFor(@NonNull DatabaseConfig databaseConfig) {
		requireNonNull(databaseConfig);
		return new ConnectionManager(this.connection, databaseConfig, this.statementCache);
	}
}
