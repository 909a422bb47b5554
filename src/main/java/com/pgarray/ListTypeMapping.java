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
import java.lang.reflect.Type;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Maps a PostgreSQL array column type to a {@link List}.
 * <p>
 * Behaves like {@link ArrayTypeMapping}: the same store type derivation, literal format and comparer selection.
 * Lists are always single-dimensional, so list mappings always have a comparer.
 * Snapshots are new {@link java.util.ArrayList} instances.
 *
 * @param <E> the Java element type
 * @since 1.0.0
 */
@ThreadSafe
public class ListTypeMapping<E> extends AbstractSequenceTypeMapping<List<E>> {
	ListTypeMapping(@NonNull String storeType,
									@NonNull TypeMappingFacets facets,
									@NonNull TypeMapping<E> elementMapping,
									@NonNull SequenceType sequenceType,
									@NonNull SequenceAccessor<List<E>> sequenceAccessor,
									@Nullable SequenceComparer<List<E>> sequenceComparer) {
		super(storeType, facets, elementMapping, sequenceType, sequenceAccessor, sequenceComparer);
	}

	/**
	 * Creates a list mapping with store type {@code elementMapping.getStoreType() + "[]"}.
	 *
	 * @param elementMapping the mapping of a single element
	 * @param <E>            the Java element type
	 * @return the list mapping
	 */
	@NonNull
	public static <E> ListTypeMapping<E> create(@NonNull TypeMapping<E> elementMapping) {
		return create(elementMapping, null);
	}

	/**
	 * Creates a list mapping.
	 *
	 * @param elementMapping the mapping of a single element
	 * @param storeType      the array store type, or {@code null} to use {@code elementMapping.getStoreType() + "[]"}
	 * @param <E>            the Java element type
	 * @return the list mapping
	 * @throws UnsupportedShapeException if {@code elementMapping} is itself a sequence mapping
	 */
	@NonNull
	public static <E> ListTypeMapping<E> create(@NonNull TypeMapping<E> elementMapping,
																							@Nullable String storeType) {
		requireNonNull(elementMapping);
		return create(elementMapping, SequenceType.of(new DefaultParameterizedType(List.class, elementMapping.getJavaType())), storeType);
	}

	/**
	 * Creates a list mapping for a reflective {@code List<E>} type, e.g. one obtained from a field's generic type.
	 *
	 * @param elementMapping the mapping of a single element
	 * @param listType       the list type, e.g. {@code List<UUID>}; a raw {@code List} is taken to hold the element mapping's type
	 * @param storeType      the array store type, or {@code null} to use {@code elementMapping.getStoreType() + "[]"}
	 * @param <E>            the Java element type
	 * @return the list mapping
	 * @throws UnsupportedShapeException if {@code listType} is not a list of {@code elementMapping}'s Java type
	 */
	@NonNull
	public static <E> ListTypeMapping<E> create(@NonNull TypeMapping<E> elementMapping,
																							@NonNull Type listType,
																							@Nullable String storeType) {
		requireNonNull(elementMapping);
		requireNonNull(listType);

		return create(elementMapping, SequenceType.of(listType), storeType);
	}

	@NonNull
	private static <E> ListTypeMapping<E> create(@NonNull TypeMapping<E> elementMapping,
																							 @NonNull SequenceType sequenceType,
																							 @Nullable String storeType) {
		requireNonNull(elementMapping);
		requireNonNull(sequenceType);

		if (!sequenceType.isList())
			throw new UnsupportedShapeException(sequenceType.getType(), elementMapping.getJavaType());

		validateShape(elementMapping, sequenceType);

		SequenceAccessor<List<E>> sequenceAccessor = SequenceAccessor.forList();
		SequenceComparer<List<E>> sequenceComparer = SequenceComparerSelector.select(elementMapping, sequenceType, sequenceAccessor).orElse(null);

		return new ListTypeMapping<>(storeType == null ? deriveStoreType(elementMapping) : storeType,
				TypeMappingFacets.none(), elementMapping, sequenceType, sequenceAccessor, sequenceComparer);
	}

	@NonNull
	@Override
	@SuppressWarnings("unchecked")
	public TypeMapping<E> getElementMapping() {
		return (TypeMapping<E>) super.getElementMapping();
	}

	@NonNull
	@Override
	public ListTypeMapping<E> withFacets(@NonNull TypeMappingFacets facets) {
		requireNonNull(facets);
		return new ListTypeMapping<>(getStoreType(), facets, getElementMapping(), getSequenceType(), getSequenceAccessor(),
				getSequenceComparer().orElse(null));
	}
}
