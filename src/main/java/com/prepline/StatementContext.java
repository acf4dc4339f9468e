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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Data that represents one invocation of a SQL statement: the statement itself and the driver values bound to it.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class StatementContext {
	@NonNull
	private final Statement statement;
	@NonNull
	private final List<@Nullable Object> parameters;
	@NonNull
	private final Boolean prepared;

	protected StatementContext(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statement = builder.statement;
		this.parameters = builder.parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(builder.parameters));
		this.prepared = builder.prepared;
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStatement(), getParameters(), isPrepared());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementContext))
			return false;

		StatementContext statementContext = (StatementContext) object;

		return Objects.equals(statementContext.getStatement(), getStatement())
				&& Objects.equals(statementContext.getParameters(), getParameters())
				&& Objects.equals(statementContext.isPrepared(), isPrepared());
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(3);

		components.add(format("statement=%s", getStatement()));

		if (getParameters().size() > 0)
			components.add(format("parameters=%s", getParameters()));

		components.add(format("prepared=%s", isPrepared()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@NonNull
	public Statement getStatement() {
		return this.statement;
	}

	@NonNull
	public List<@Nullable Object> getParameters() {
		return this.parameters;
	}

	/**
	 * @return {@code true} if the statement runs through the prepared-statement API, {@code false} for direct execution
	 */
	@NonNull
	public Boolean isPrepared() {
		return this.prepared;
	}

	@NonNull
	public static Builder with(@NonNull Statement statement) {
		requireNonNull(statement);
		return new Builder(statement);
	}

	/**
	 * Builder used to construct instances of {@link StatementContext}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Statement statement;
		@Nullable
		private List<@Nullable Object> parameters;
		@NonNull
		private Boolean prepared;

		private Builder(@NonNull Statement statement) {
			requireNonNull(statement);

			this.statement = statement;
			this.prepared = true;
		}

		@NonNull
		public Builder parameters(@Nullable List<@Nullable Object> parameters) {
			this.parameters = parameters;
			return this;
		}

		@NonNull
		public Builder prepared(@NonNull Boolean prepared) {
			requireNonNull(prepared);
			this.prepared = prepared;
			return this;
		}

		@NonNull
		public StatementContext build() {
			return new StatementContext(this);
		}
	}
}
