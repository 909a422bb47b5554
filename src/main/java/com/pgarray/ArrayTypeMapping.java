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
import java.lang.reflect.Array;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Maps a PostgreSQL array column type to a Java array type. Only single-dimensional arrays are supported.
 * <p>
 * Reference and primitive arrays are both accepted, so an {@code integer} element mapping may be used for {@code Integer[]} or {@code int[]}.
 * <p>
 * A mapping over a multi-dimensional array type can be created, but has no comparer and cannot render literals;
 * see {@link #getRequiredComparer()}.
 * <p>
 * To map a PostgreSQL array to a {@link java.util.List}, use {@link ListTypeMapping}.
 *
 * <pre>
 * ArrayTypeMapping&lt;Integer[]&gt; mapping = ArrayTypeMapping.create(StandardTypeMappings.integer(), Integer[].class);
 * mapping.getStoreType(); // "integer[]"
 * mapping.generateSqlLiteral(new Integer[] { 1, 2, 3 }); // "ARRAY[1,2,3]::integer[]"
 * mapping.getRequiredComparer().areEqual(new Integer[] { 1, 2 }, new Integer[] { 1, 2 }); // true</pre>
 *
 * @param <A> the Java array type
 * @since 1.0.0
 */
@ThreadSafe
public class ArrayTypeMapping<A> extends AbstractSequenceTypeMapping<A> {
	ArrayTypeMapping(@NonNull String storeType,
									 @NonNull TypeMappingFacets facets,
									 @NonNull TypeMapping<?> elementMapping,
									 @NonNull SequenceType sequenceType,
									 @NonNull SequenceAccessor<A> sequenceAccessor,
									 @Nullable SequenceComparer<A> sequenceComparer) {
		super(storeType, facets, elementMapping, sequenceType, sequenceAccessor, sequenceComparer);
	}

	/**
	 * Creates the default array mapping for {@code elementMapping}, i.e. for a single-dimensional array of its Java type,
	 * with store type {@code elementMapping.getStoreType() + "[]"}.
	 *
	 * @param elementMapping the mapping of a single element
	 * @return the array mapping
	 */
	@NonNull
	public static ArrayTypeMapping<?> forElementMapping(@NonNull TypeMapping<?> elementMapping) {
		requireNonNull(elementMapping);
		return create(elementMapping, defaultArrayClass(elementMapping), null);
	}

	/**
	 * Creates the default array mapping for {@code elementMapping} with an explicit store type.
	 *
	 * @param storeType      the array store type, e.g. {@code "_int4"}
	 * @param elementMapping the mapping of a single element
	 * @return the array mapping
	 */
	@NonNull
	public static ArrayTypeMapping<?> forElementMapping(@NonNull String storeType,
																											@NonNull TypeMapping<?> elementMapping) {
		requireNonNull(storeType);
		requireNonNull(elementMapping);

		return create(elementMapping, defaultArrayClass(elementMapping), storeType);
	}

	/**
	 * Creates an array mapping for {@code arrayType} with store type {@code elementMapping.getStoreType() + "[]"}.
	 *
	 * @param elementMapping the mapping of a single element
	 * @param arrayType      the Java array type, e.g. {@code Integer[].class} or {@code int[].class}
	 * @param <A>            the Java array type
	 * @return the array mapping
	 * @throws UnsupportedShapeException if {@code arrayType} is not an array of {@code elementMapping}'s Java type
	 */
	@NonNull
	public static <A> ArrayTypeMapping<A> create(@NonNull TypeMapping<?> elementMapping,
																							 @NonNull Class<A> arrayType) {
		return create(elementMapping, arrayType, null);
	}

	/**
	 * Creates an array mapping for {@code arrayType}.
	 *
	 * @param elementMapping the mapping of a single element
	 * @param arrayType      the Java array type, e.g. {@code Integer[].class} or {@code int[].class}
	 * @param storeType      the array store type, or {@code null} to use {@code elementMapping.getStoreType() + "[]"}
	 * @param <A>            the Java array type
	 * @return the array mapping
	 * @throws UnsupportedShapeException if {@code arrayType} is not an array of {@code elementMapping}'s Java type
	 */
	@NonNull
	public static <A> ArrayTypeMapping<A> create(@NonNull TypeMapping<?> elementMapping,
																							 @NonNull Class<A> arrayType,
																							 @Nullable String storeType) {
		requireNonNull(elementMapping);
		requireNonNull(arrayType);

		SequenceType sequenceType = SequenceType.of(arrayType);

		if (!sequenceType.isArray())
			throw new UnsupportedShapeException(arrayType, elementMapping.getJavaType());

		validateShape(elementMapping, sequenceType);

		SequenceAccessor<A> sequenceAccessor = SequenceAccessor.forArray(arrayType);
		SequenceComparer<A> sequenceComparer = SequenceComparerSelector.select(elementMapping, sequenceType, sequenceAccessor).orElse(null);

		return new ArrayTypeMapping<>(storeType == null ? deriveStoreType(elementMapping) : storeType,
				TypeMappingFacets.none(), elementMapping, sequenceType, sequenceAccessor, sequenceComparer);
	}

	@NonNull
	@Override
	protected String generateNonNullSqlLiteral(@NonNull Object value) {
		requireNonNull(value);

		if (!value.getClass().isArray())
			throw new IllegalArgumentException(format("Value of type %s is not an array and cannot be rendered by the %s mapping",
					value.getClass().getName(), getStoreType()));

		SequenceType valueType = SequenceType.of(value.getClass());
		Integer rank = valueType.getRankRelativeTo(getElementMapping().getJavaType()).orElse(valueType.getRank());

		if (rank != 1)
			throw UnsupportedRankException.forLiteral(rank);

		return super.generateNonNullSqlLiteral(value);
	}

	/**
	 * Creates a copy of this mapping with different facets, sharing this mapping's element mapping and comparer.
	 *
	 * @param facets the facets of the copy
	 * @return the copy
	 */
	@NonNull
	@Override
	public ArrayTypeMapping<A> withFacets(@NonNull TypeMappingFacets facets) {
		requireNonNull(facets);
		return new ArrayTypeMapping<>(getStoreType(), facets, getElementMapping(), getSequenceType(), getSequenceAccessor(),
				getSequenceComparer().orElse(null));
	}

	@NonNull
	private static Class<?> defaultArrayClass(@NonNull TypeMapping<?> elementMapping) {
		requireNonNull(elementMapping);
		return Array.newInstance(elementMapping.getJavaType(), 0).getClass();
	}
}
