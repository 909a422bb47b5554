/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
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

package com.pgarray;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Base class for {@link TypeMapping} implementations.
 * <p>
 * Subclasses supply {@link #generateNonNullSqlLiteral(Object)} and {@link #withFacets(TypeMappingFacets)}.
 *
 * @param <T> the Java type of mapped values
 * @since 1.0.0
 */
@ThreadSafe
public abstract class AbstractTypeMapping<T> implements TypeMapping<T> {
	@NonNull
	static final String NULL_LITERAL = "NULL";

	@NonNull
	private final String storeType;
	@NonNull
	private final Class<?> javaType;
	@NonNull
	private final TypeMappingFacets facets;
	@Nullable
	private final ValueComparer<T> comparer;

	protected AbstractTypeMapping(@NonNull String storeType,
																@NonNull Class<?> javaType,
																@NonNull TypeMappingFacets facets,
																@Nullable ValueComparer<T> comparer) {
		requireNonNull(storeType);
		requireNonNull(javaType);
		requireNonNull(facets);

		if (storeType.isBlank())
			throw new IllegalArgumentException("Store type must not be blank");

		this.storeType = storeType;
		this.javaType = javaType;
		this.facets = facets;
		this.comparer = comparer;
	}

	@NonNull
	@Override
	public String generateSqlLiteral(@Nullable Object value) {
		return value == null ? NULL_LITERAL : generateNonNullSqlLiteral(value);
	}

	/**
	 * Generates a SQL literal for a non-{@code null} value.
	 *
	 * @param value the value to render
	 * @return the SQL literal
	 */
	@NonNull
	protected abstract String generateNonNullSqlLiteral(@NonNull Object value);

	/**
	 * Verifies that {@code value} is an instance of this mapping's Java type.
	 *
	 * @param value the value to check
	 * @return {@code value}, typed
	 * @throws IllegalArgumentException if {@code value} is of some other type
	 */
	@NonNull
	@SuppressWarnings("unchecked")
	protected T requireMappedValue(@NonNull Object value) {
		requireNonNull(value);

		if (!getJavaType().isInstance(value))
			throw new IllegalArgumentException(format("Value of type %s cannot be rendered by the %s mapping for %s",
					value.getClass().getName(), getStoreType(), getJavaType().getName()));

		return (T) value;
	}

	@NonNull
	@Override
	public String getStoreType() {
		return this.storeType;
	}

	@NonNull
	@Override
	public Class<?> getJavaType() {
		return this.javaType;
	}

	@NonNull
	@Override
	public TypeMappingFacets getFacets() {
		return this.facets;
	}

	@NonNull
	@Override
	public Optional<ValueComparer<T>> getComparer() {
		return Optional.ofNullable(this.comparer);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{storeType=%s, javaType=%s}", getClass().getSimpleName(), getStoreType(), getJavaType().getTypeName());
	}
}
