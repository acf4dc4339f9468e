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

import static java.util.Objects.requireNonNull;

/**
 * Options applied to a {@link DriverConnection} before it connects.
 *
 * @since 1.0.0
 */
public enum DriverOption {
	/**
	 * Client character set, a {@link String}.
	 */
	CHARSET_NAME("characterEncoding"),
	/**
	 * Path to the client private key, a {@link String}.
	 */
	SSL_KEY("sslKey"),
	/**
	 * Path to the client certificate, a {@link String}.
	 */
	SSL_CERT("sslCert"),
	/**
	 * Path to the certificate authority file, a {@link String}.
	 */
	SSL_CA("sslCa"),
	/**
	 * Directory of trusted CA certificates, a {@link String}.
	 */
	SSL_CAPATH("sslCaPath"),
	/**
	 * Permitted cipher list, a {@link String}.
	 */
	SSL_CIPHER("enabledSSLCipherSuites"),
	/**
	 * A {@link java.time.Duration}.
	 */
	CONNECT_TIMEOUT("connectTimeout"),
	/**
	 * A {@link java.time.Duration}.
	 */
	READ_TIMEOUT("socketTimeout"),
	/**
	 * A {@link java.time.Duration}.
	 */
	WRITE_TIMEOUT("writeTimeout");

	@NonNull
	private final String jdbcPropertyName;

	DriverOption(@NonNull String jdbcPropertyName) {
		requireNonNull(jdbcPropertyName);
		this.jdbcPropertyName = jdbcPropertyName;
	}

	/**
	 * @return the connection property this option maps to when the driver is JDBC-backed
	 */
	@NonNull
	public String getJdbcPropertyName() {
		return this.jdbcPropertyName;
	}
}
