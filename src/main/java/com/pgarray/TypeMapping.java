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

/**
 * Describes how a Java type maps to a database column type: the store type name, SQL literal generation and value comparison.
 * <p>
 * Mappings are immutable. Variants with different column facets are obtained via {@link #withFacets(TypeMappingFacets)}.
 * <p>
 * Standard scalar mappings are available via {@link StandardTypeMappings}, array mappings via {@link ArrayTypeMapping}
 * and {@link ListTypeMapping}.
 * <p>
 * Implementations must be threadsafe.
 *
 * @param <T> the Java type of mapped values
 * @since 1.0.0
 */
@ThreadSafe
public interface TypeMapping<T> {
	/**
	 * Gets the database type name, e.g. {@code "integer"} or {@code "text[]"}.
	 *
	 * @return the store type name
	 */
	@NonNull
	String getStoreType();

	/**
	 * Gets the Java type of values handled by this mapping.
	 * <p>
	 * Scalar mappings always report a reference type, e.g. {@link Integer} rather than {@code int}.
	 *
	 * @return the mapped Java type
	 */
	@NonNull
	Class<?> getJavaType();

	/**
	 * Gets the column facets of this mapping.
	 *
	 * @return the column facets
	 */
	@NonNull
	TypeMappingFacets getFacets();

	/**
	 * Gets the comparer used to detect changes in values of this mapping, if the mapping supplies one.
	 *
	 * @return the comparer, or {@link Optional#empty()} if this mapping does not supply one
	 */
	@NonNull
	Optional<ValueComparer<T>> getComparer();

	/**
	 * Generates a SQL literal for {@code value}; {@code null} renders as {@code NULL}.
	 *
	 * @param value the value to render
	 * @return the SQL literal
	 * @throws IllegalArgumentException if {@code value} is not of this mapping's Java type
	 */
	@NonNull
	String generateSqlLiteral(@Nullable Object value);

	/**
	 * Creates a copy of this mapping with different column facets.
	 * <p>
	 * The copy keeps this mapping's store type and comparer.
	 *
	 * @param facets the facets of the copy
	 * @return a copy of this mapping with the given facets
	 */
	@NonNull
	TypeMapping<T> withFacets(@NonNull TypeMappingFacets facets);
}
