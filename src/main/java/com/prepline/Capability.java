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
 * Optional operations a {@link DriverConnection} may support.
 * <p>
 * Captured once per successful connect; call sites branch on the captured set rather than probing the driver.
 *
 * @since 1.0.0
 */
public enum Capability {
	/**
	 * {@link DriverConnection#stat()} is a usable liveness check.
	 */
	STAT,
	/**
	 * {@link DriverConnection#errno()} reports the error code of the last call.
	 */
	ERRNO,
	/**
	 * {@link DriverConnection#changeUser(String, String, String)} re-authenticates without reconnecting.
	 */
	CHANGE_USER,
	/**
	 * {@link DriverConnection#setReconnect(boolean)} controls driver-level auto-reconnect.
	 */
	RECONNECT_FLAG,
	/**
	 * {@link DriverConnection#insertId()} reports the last generated identifier.
	 */
	INSERT_ID,
	/**
	 * {@link DriverConnection#serverInfo()} reports the server version string.
	 */
	SERVER_INFO
}
