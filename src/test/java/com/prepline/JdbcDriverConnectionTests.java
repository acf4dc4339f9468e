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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
public class JdbcDriverConnectionTests {
	private static final String DUMMY_QUERY = "SELECT 1 FROM INFORMATION_SCHEMA.SYSTEM_USERS";

	private JdbcDriverConnection connection;

	@AfterEach
	public void tearDown() throws SQLException {
		if (this.connection != null)
			this.connection.close();
	}

	@Test
	public void testConnectDetectsDatabaseTypeAndCapabilities() throws SQLException {
		this.connection = connectedTo("jdbc_capabilities");

		Assertions.assertEquals(DatabaseType.HSQLDB, this.connection.getDatabaseType());
		Assertions.assertTrue(this.connection.getCapabilities().contains(Capability.STAT));
		Assertions.assertTrue(this.connection.getCapabilities().contains(Capability.INSERT_ID));
		Assertions.assertFalse(this.connection.getCapabilities().contains(Capability.CHANGE_USER));
		Assertions.assertFalse(this.connection.serverInfo().isBlank());
		Assertions.assertFalse(this.connection.stat().isBlank());
	}

	@Test
	public void testPreparedStatementLifecycle() throws SQLException {
		this.connection = connectedTo("jdbc_prepared");
		runDirect("CREATE TABLE widget (id INTEGER PRIMARY KEY, name VARCHAR(50))");

		DriverStatement insert = this.connection.prepare("INSERT INTO widget (id, name) VALUES (?, ?)");
		insert.execute(Arrays.asList(1, "sprocket"));
		Assertions.assertNull(insert.getResultMetadata(), "Inserts produce no result metadata");
		Assertions.assertEquals(1L, insert.getAffectedRows());

		insert.execute(Arrays.asList(2, null));
		Assertions.assertEquals(1L, insert.getAffectedRows());
		insert.close();

		DriverStatement select = this.connection.prepare("SELECT id, name FROM widget WHERE id >= ? ORDER BY id");
		select.execute(List.of(1));

		DriverResultMetadata resultMetadata = select.getResultMetadata();
		Assertions.assertNotNull(resultMetadata);
		Assertions.assertEquals(List.of("ID", "NAME"), resultMetadata.getColumnNames());

		Result result = new ResultAdapter().normalize(resultMetadata.getColumnNames(), select.getRowSource());
		Assertions.assertEquals(List.of(Arrays.asList(1, "sprocket"), Arrays.asList(2, null)), result.getRows());

		select.freeResult();
		select.execute(List.of(2));
		Assertions.assertEquals(1, new ResultAdapter().normalize(List.of("ID", "NAME"), select.getRowSource()).size(),
				"A prepared statement can be re-executed after its result is freed");
		select.close();
	}

	@Test
	public void testQueryWithoutResultReturnsNull() throws SQLException {
		this.connection = connectedTo("jdbc_query");

		Assertions.assertNull(this.connection.query("CREATE TABLE gadget (id INTEGER)"));

		DriverResult driverResult = this.connection.query(DUMMY_QUERY);
		Assertions.assertNotNull(driverResult);
		Assertions.assertEquals(1, driverResult.getColumnNames().size());
		driverResult.free();
	}

	@Test
	public void testErrorStateTracksLastOperation() throws SQLException {
		this.connection = connectedTo("jdbc_errors");

		Assertions.assertThrows(SQLException.class, () -> this.connection.query("SELEC nonsense"));
		Assertions.assertNotEquals(0, this.connection.errno());
		Assertions.assertTrue(this.connection.lastError().isPresent());

		DriverResult driverResult = this.connection.query(DUMMY_QUERY);
		requireNonNull(driverResult).free();

		Assertions.assertEquals(0, this.connection.errno());
		Assertions.assertFalse(this.connection.lastError().isPresent());
	}

	@Test
	public void testClosedConnectionReopensOnlyWithReconnectFlag() throws SQLException {
		this.connection = connectedTo("jdbc_reconnect");
		this.connection.close();

		SQLException e = Assertions.assertThrows(SQLException.class, () -> this.connection.prepare(DUMMY_QUERY));
		Assertions.assertEquals("08003", e.getSQLState());

		this.connection.setReconnect(true);
		this.connection.prepare(DUMMY_QUERY).close();
	}

	@Test
	public void testConnectClosesPreviousConnection() throws SQLException {
		this.connection = connectedTo("jdbc_connect_twice");
		Connection first = this.connection.getJdbcConnection().orElseThrow();

		this.connection.connect(parametersFor("jdbc_connect_twice"));

		Assertions.assertTrue(first.isClosed(), "Previous JDBC connection should be closed");
		Assertions.assertNotSame(first, this.connection.getJdbcConnection().orElseThrow());
	}

	@Test
	public void testColumnLabelsReadOnlyWhenRequested() throws SQLException {
		AtomicInteger columnLabelReads = new AtomicInteger();
		this.connection = new JdbcDriverConnection() {
			@NonNull
			@Override
			protected List<@NonNull String> readColumnLabels(@NonNull ResultSet resultSet) throws SQLException {
				columnLabelReads.incrementAndGet();
				return super.readColumnLabels(resultSet);
			}
		};
		this.connection.connect(parametersFor("jdbc_lazy_labels"));

		DriverStatement select = this.connection.prepare(DUMMY_QUERY);
		select.execute(List.of());

		DriverResultMetadata resultMetadata = select.getResultMetadata();
		Assertions.assertNotNull(resultMetadata);
		Assertions.assertEquals(0, columnLabelReads.get(), "Obtaining metadata should not read column labels");

		Assertions.assertEquals(1, resultMetadata.getColumnNames().size());
		Assertions.assertEquals(1, columnLabelReads.get());
		select.close();
	}

	@Test
	public void testConnectTurnsReconnectFlagOff() throws SQLException {
		this.connection = new JdbcDriverConnection();
		this.connection.setReconnect(true);
		this.connection.connect(parametersFor("jdbc_reconnect_reset"));
		this.connection.close();

		Assertions.assertThrows(SQLException.class, () -> this.connection.prepare(DUMMY_QUERY));
	}

	@Test
	public void testDefaultUrlAndProperties() {
		JdbcDriverConnection jdbcDriverConnection = new JdbcDriverConnection();
		jdbcDriverConnection.setOption(DriverOption.CHARSET_NAME, "utf8mb4");
		jdbcDriverConnection.setOption(DriverOption.CONNECT_TIMEOUT, Duration.ofSeconds(5));

		ConnectionParameters connectionParameters = ConnectionParameters.fromConfig(DatabaseConfig.withDatabase("app")
				.host("db.internal")
				.port(3307)
				.username("app")
				.password("secret")
				.build());

		Assertions.assertEquals("jdbc:mysql://db.internal:3307/app", jdbcDriverConnection.determineJdbcUrl(connectionParameters));
		Assertions.assertEquals("jdbc:mysql://localhost:3306/app",
				jdbcDriverConnection.determineJdbcUrl(ConnectionParameters.fromConfig(DatabaseConfig.withDatabase("app").build())));

		Properties properties = jdbcDriverConnection.determineProperties(connectionParameters);

		Assertions.assertEquals("app", properties.getProperty("user"));
		Assertions.assertEquals("secret", properties.getProperty("password"));
		Assertions.assertEquals("utf8mb4", properties.getProperty("characterEncoding"));
		Assertions.assertEquals("5000", properties.getProperty("connectTimeout"));
		Assertions.assertEquals("false", properties.getProperty("useAffectedRows"));
		Assertions.assertEquals("true", properties.getProperty("allowMultiQueries"));
	}

	@Test
	public void testUnknownUrlFailsToConnect() {
		JdbcDriverConnection jdbcDriverConnection = new JdbcDriverConnection();

		Assertions.assertThrows(SQLException.class, () -> jdbcDriverConnection.connect(ConnectionParameters.fromConfig(
				DatabaseConfig.withDatabase("app").jdbcUrl("jdbc:prepline-missing:app").build())));
	}

	private void runDirect(@NonNull String sql) throws SQLException {
		requireNonNull(sql);

		DriverResult driverResult = this.connection.query(sql);

		if (driverResult != null)
			driverResult.free();
	}

	@NonNull
	private JdbcDriverConnection connectedTo(@NonNull String databaseName) throws SQLException {
		requireNonNull(databaseName);

		JdbcDriverConnection jdbcDriverConnection = new JdbcDriverConnection();
		jdbcDriverConnection.connect(parametersFor(databaseName));
		return jdbcDriverConnection;
	}

	@NonNull
	private ConnectionParameters parametersFor(@NonNull String databaseName) {
		requireNonNull(databaseName);

		return ConnectionParameters.fromConfig(DatabaseConfig.withDatabase(databaseName)
				.jdbcUrl(format("jdbc:hsqldb:mem:%s", databaseName))
				.username("sa")
				.password("")
				.build());
	}
}
