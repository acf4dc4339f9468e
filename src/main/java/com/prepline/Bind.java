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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;

/**
 * A value bound to a {@code ?} placeholder, optionally tagged with the name of the column it targets.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Bind {
	@Nullable
	private final String column;
	@Nullable
	private final Object value;

	private Bind(@Nullable String column,
							 @Nullable Object value) {
		this.column = column;
		this.value = value;
	}

	@NonNull
	public static Bind of(@Nullable Object value) {
		return new Bind(null, value);
	}

	@NonNull
	public static Bind of(@Nullable String column,
												@Nullable Object value) {
		return new Bind(column, value);
	}

	/**
	 * Wraps each of the given {@code values} in a column-less {@link Bind}, preserving order.
	 */
	@NonNull
	public static List<@NonNull Bind> values(@Nullable Object... values) {
		if (values == null)
			return List.of();

		List<Bind> binds = new ArrayList<>(values.length);

		for (Object value : values)
			binds.add(of(value));

		return binds;
	}

	/**
	 * Applies the only coercion this layer performs on outgoing values: {@code true → 1}, {@code false → 0}.
	 * Everything else is left for the driver's native binding.
	 *
	 * @return the value to hand to the driver
	 */
	@Nullable
	public Object toDriverValue() {
		if (this.value instanceof Boolean)
			return ((Boolean) this.value) ? 1 : 0;

		return this.value;
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.column, this.value);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Bind))
			return false;

		Bind bind = (Bind) object;

		return Objects.equals(bind.column, this.column)
				&& Objects.equals(bind.value, this.value);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{column=%s, value=%s}", getClass().getSimpleName(), this.column, this.value);
	}

	@NonNull
	public Optional<String> getColumn() {
		return Optional.ofNullable(this.column);
	}

	@Nullable
	public Object getValue() {
		return this.value;
	}
}
