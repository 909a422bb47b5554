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
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;

/**
 * Column facets that may vary between otherwise-identical {@link TypeMapping} instances: nullability, size, precision, scale and fixed-length-ness.
 * <p>
 * Facets never influence how values are compared; see {@link TypeMapping#withFacets(TypeMappingFacets)}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class TypeMappingFacets {
	@NonNull
	private static final TypeMappingFacets NONE = new TypeMappingFacets(new Builder());

	@Nullable
	private final Boolean nullable;
	@Nullable
	private final Integer size;
	@Nullable
	private final Integer precision;
	@Nullable
	private final Integer scale;
	@Nullable
	private final Boolean fixedLength;

	private TypeMappingFacets(@NonNull Builder builder) {
		this.nullable = builder.nullable;
		this.size = builder.size;
		this.precision = builder.precision;
		this.scale = builder.scale;
		this.fixedLength = builder.fixedLength;
	}

	/**
	 * Facets with nothing specified.
	 *
	 * @return the empty facet set
	 */
	@NonNull
	public static TypeMappingFacets none() {
		return NONE;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Creates a builder pre-populated with this instance's facets.
	 *
	 * @return a builder for a modified copy
	 */
	@NonNull
	public Builder copy() {
		return new Builder()
				.nullable(this.nullable)
				.size(this.size)
				.precision(this.precision)
				.scale(this.scale)
				.fixedLength(this.fixedLength);
	}

	@NonNull
	public Optional<Boolean> getNullable() {
		return Optional.ofNullable(this.nullable);
	}

	@NonNull
	public Optional<Integer> getSize() {
		return Optional.ofNullable(this.size);
	}

	@NonNull
	public Optional<Integer> getPrecision() {
		return Optional.ofNullable(this.precision);
	}

	@NonNull
	public Optional<Integer> getScale() {
		return Optional.ofNullable(this.scale);
	}

	@NonNull
	public Optional<Boolean> getFixedLength() {
		return Optional.ofNullable(this.fixedLength);
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof TypeMappingFacets facets))
			return false;

		return Objects.equals(this.nullable, facets.nullable)
				&& Objects.equals(this.size, facets.size)
				&& Objects.equals(this.precision, facets.precision)
				&& Objects.equals(this.scale, facets.scale)
				&& Objects.equals(this.fixedLength, facets.fixedLength);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.nullable, this.size, this.precision, this.scale, this.fixedLength);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{nullable=%s, size=%s, precision=%s, scale=%s, fixedLength=%s}", getClass().getSimpleName(),
				this.nullable, this.size, this.precision, this.scale, this.fixedLength);
	}

	/**
	 * Builder used to construct instances of {@link TypeMappingFacets}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private Boolean nullable;
		@Nullable
		private Integer size;
		@Nullable
		private Integer precision;
		@Nullable
		private Integer scale;
		@Nullable
		private Boolean fixedLength;

		private Builder() {
			// Only constructible via TypeMappingFacets
		}

		@NonNull
		public Builder nullable(@Nullable Boolean nullable) {
			this.nullable = nullable;
			return this;
		}

		@NonNull
		public Builder size(@Nullable Integer size) {
			this.size = size;
			return this;
		}

		@NonNull
		public Builder precision(@Nullable Integer precision) {
			this.precision = precision;
			return this;
		}

		@NonNull
		public Builder scale(@Nullable Integer scale) {
			this.scale = scale;
			return this;
		}

		@NonNull
		public Builder fixedLength(@Nullable Boolean fixedLength) {
			this.fixedLength = fixedLength;
			return this;
		}

		@NonNull
		public TypeMappingFacets build() {
			return new TypeMappingFacets(this);
		}
	}
}
