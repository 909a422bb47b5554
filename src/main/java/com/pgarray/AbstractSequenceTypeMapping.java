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

import static java.util.Objects.requireNonNull;

/**
 * Base class for mappings of a database array column type to a single-dimensional Java sequence type.
 * <p>
 * The store type is the element mapping's store type followed by {@code []}. SQL literals use the PostgreSQL array constructor,
 * rendering each element with the element mapping, e.g. {@code ARRAY[1,2,3]::integer[]}.
 *
 * @param <S> the Java sequence type
 * @since 1.0.0
 */
@ThreadSafe
public abstract class AbstractSequenceTypeMapping<S> extends AbstractTypeMapping<S> {
	@NonNull
	static final String ARRAY_STORE_TYPE_SUFFIX = "[]";

	@NonNull
	private final TypeMapping<?> elementMapping;
	@NonNull
	private final SequenceType sequenceType;
	@NonNull
	private final SequenceAccessor<S> sequenceAccessor;
	@NonNull
	private final Integer rank;
	@Nullable
	private final SequenceComparer<S> sequenceComparer;

	AbstractSequenceTypeMapping(@NonNull String storeType,
															@NonNull TypeMappingFacets facets,
															@NonNull TypeMapping<?> elementMapping,
															@NonNull SequenceType sequenceType,
															@NonNull SequenceAccessor<S> sequenceAccessor,
															@Nullable SequenceComparer<S> sequenceComparer) {
		super(storeType, sequenceType.getRawClass(), facets, sequenceComparer);

		requireNonNull(elementMapping);
		requireNonNull(sequenceAccessor);

		this.elementMapping = elementMapping;
		this.sequenceType = sequenceType;
		this.sequenceAccessor = sequenceAccessor;
		this.rank = sequenceType.getRankRelativeTo(elementMapping.getJavaType())
				.orElseThrow(() -> new UnsupportedShapeException(sequenceType.getType(), elementMapping.getJavaType()));
		this.sequenceComparer = sequenceComparer;
	}

	/**
	 * Verifies that {@code sequenceType} is a sequence of {@code elementMapping}'s Java type and that {@code elementMapping} is not itself a sequence mapping.
	 */
	static void validateShape(@NonNull TypeMapping<?> elementMapping,
														@NonNull SequenceType sequenceType) {
		requireNonNull(elementMapping);
		requireNonNull(sequenceType);

		Class<?> elementJavaType = elementMapping.getJavaType();

		if (elementMapping instanceof AbstractSequenceTypeMapping<?> || !sequenceType.matchesElementClass(elementJavaType))
			throw new UnsupportedShapeException(sequenceType.getType(), elementJavaType);
	}

	@NonNull
	static String deriveStoreType(@NonNull TypeMapping<?> elementMapping) {
		requireNonNull(elementMapping);
		return elementMapping.getStoreType() + ARRAY_STORE_TYPE_SUFFIX;
	}

	@NonNull
	@Override
	protected String generateNonNullSqlLiteral(@NonNull Object value) {
		requireNonNull(value);

		S sequence = requireMappedValue(value);
		SequenceAccessor<S> sequenceAccessor = getSequenceAccessor();
		TypeMapping<?> elementMapping = getElementMapping();
		int length = sequenceAccessor.length(sequence);

		StringBuilder literal = new StringBuilder();
		literal.append("ARRAY[");

		for (int i = 0; i < length; i++) {
			if (i > 0)
				literal.append(',');

			literal.append(elementMapping.generateSqlLiteral(sequenceAccessor.elementAt(sequence, i)));
		}

		literal.append("]::");
		literal.append(elementMapping.getStoreType());
		literal.append(ARRAY_STORE_TYPE_SUFFIX);

		return literal.toString();
	}

	/**
	 * Gets the comparer, failing if this mapping has none because its rank is not 1.
	 *
	 * @return the comparer
	 * @throws UnsupportedRankException if this mapping has no comparer
	 */
	@NonNull
	public SequenceComparer<S> getRequiredComparer() {
		if (this.sequenceComparer == null)
			throw UnsupportedRankException.forComparer(getStoreType(), getRank());

		return this.sequenceComparer;
	}

	/**
	 * Gets the structural comparer bound when this mapping was created.
	 *
	 * @return the comparer, or {@link Optional#empty()} if the mapped type's rank is not 1
	 */
	@NonNull
	public Optional<SequenceComparer<S>> getSequenceComparer() {
		return Optional.ofNullable(this.sequenceComparer);
	}

	/**
	 * Gets the mapping of a single element.
	 *
	 * @return the element mapping
	 */
	@NonNull
	public TypeMapping<?> getElementMapping() {
		return this.elementMapping;
	}

	@NonNull
	public SequenceType getSequenceType() {
		return this.sequenceType;
	}

	/**
	 * Gets the number of dimensions of the mapped type, counted relative to the element mapping's Java type.
	 *
	 * @return the rank
	 */
	@NonNull
	public Integer getRank() {
		return this.rank;
	}

	@NonNull
	SequenceAccessor<S> getSequenceAccessor() {
		return this.sequenceAccessor;
	}
}
