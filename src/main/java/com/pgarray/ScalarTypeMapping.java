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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * A {@link TypeMapping} for a single-valued column type, e.g. {@code integer}, {@code text} or {@code uuid}.
 * <p>
 * Scalar mappings are the usual element mappings of {@link ArrayTypeMapping} and {@link ListTypeMapping}.
 * <p>
 * Whether a scalar mapping supplies a {@link ValueComparer} determines how arrays of it are compared:
 * a mapping with a comparer has every element compared and snapshotted through that comparer.
 * Leave the comparer unset for immutable types with meaningful {@link Object#equals(Object)}.
 *
 * <pre>
 * TypeMapping&lt;BigDecimal&gt; money = ScalarTypeMapping.withStoreType("numeric", BigDecimal.class)
 *   .literalRenderer(BigDecimal::toPlainString)
 *   .comparer(ValueComparer.of(BigDecimal.class, (a, b) -&gt; a.compareTo(b) == 0,
 *     value -&gt; value.stripTrailingZeros().hashCode(), value -&gt; value))
 *   .build();</pre>
 *
 * @param <T> the Java type of mapped values
 * @since 1.0.0
 */
@ThreadSafe
public class ScalarTypeMapping<T> extends AbstractTypeMapping<T> {
	@NonNull
	private final SqlLiteralRenderer<T> literalRenderer;

	protected ScalarTypeMapping(@NonNull String storeType,
															@NonNull Class<?> javaType,
															@NonNull TypeMappingFacets facets,
															@Nullable ValueComparer<T> comparer,
															@NonNull SqlLiteralRenderer<T> literalRenderer) {
		super(storeType, DefaultSequenceType.boxedClass(javaType), facets, comparer);
		this.literalRenderer = requireNonNull(literalRenderer);
	}

	/**
	 * Acquires a builder for a scalar mapping.
	 * <p>
	 * Primitive Java types are mapped as their wrapper types.
	 *
	 * @param storeType the database type name, e.g. {@code "integer"}
	 * @param javaType  the Java type of mapped values
	 * @param <T>       the Java type of mapped values
	 * @return a builder for the mapping
	 */
	@NonNull
	public static <T> Builder<T> withStoreType(@NonNull String storeType,
																						 @NonNull Class<T> javaType) {
		requireNonNull(storeType);
		requireNonNull(javaType);

		return new Builder<>(storeType, javaType);
	}

	@NonNull
	@Override
	protected String generateNonNullSqlLiteral(@NonNull Object value) {
		return getLiteralRenderer().render(requireMappedValue(value));
	}

	@NonNull
	@Override
	public ScalarTypeMapping<T> withFacets(@NonNull TypeMappingFacets facets) {
		requireNonNull(facets);
		return new ScalarTypeMapping<>(getStoreType(), getJavaType(), facets, getComparer().orElse(null), getLiteralRenderer());
	}

	@NonNull
	protected SqlLiteralRenderer<T> getLiteralRenderer() {
		return this.literalRenderer;
	}

	/**
	 * Builder used to construct instances of {@link ScalarTypeMapping}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @param <T> the Java type of mapped values
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder<T> {
		@NonNull
		private final String storeType;
		@NonNull
		private final Class<T> javaType;
		@Nullable
		private SqlLiteralRenderer<T> literalRenderer;
		@Nullable
		private ValueComparer<T> comparer;
		@Nullable
		private TypeMappingFacets facets;

		private Builder(@NonNull String storeType,
										@NonNull Class<T> javaType) {
			this.storeType = requireNonNull(storeType);
			this.javaType = requireNonNull(javaType);
		}

		/**
		 * Specifies how non-{@code null} values are rendered as SQL literals.
		 * <p>
		 * If unset, values are rendered as single-quoted strings via {@link Object#toString()}.
		 *
		 * @param literalRenderer the literal renderer to use (null for the default)
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder<T> literalRenderer(@Nullable SqlLiteralRenderer<T> literalRenderer) {
			this.literalRenderer = literalRenderer;
			return this;
		}

		@NonNull
		public Builder<T> comparer(@Nullable ValueComparer<T> comparer) {
			this.comparer = comparer;
			return this;
		}

		@NonNull
		public Builder<T> facets(@Nullable TypeMappingFacets facets) {
			this.facets = facets;
			return this;
		}

		@NonNull
		public ScalarTypeMapping<T> build() {
			SqlLiteralRenderer<T> literalRenderer = this.literalRenderer == null
					? value -> StandardTypeMappings.quote(value.toString())
					: this.literalRenderer;
			TypeMappingFacets facets = this.facets == null ? TypeMappingFacets.none() : this.facets;

			return new ScalarTypeMapping<>(this.storeType, this.javaType, facets, this.comparer, literalRenderer);
		}
	}
}
