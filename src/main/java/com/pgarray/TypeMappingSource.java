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
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Resolves {@link TypeMapping} instances by store type name or by Java type.
 * <p>
 * Scalar mappings are registered up front. Array and list mappings are created on demand from the scalar mapping of their element
 * and memoized, so repeated lookups return the same instance (and therefore the same comparer).
 *
 * <pre>
 * TypeMappingSource typeMappingSource = TypeMappingSource.withDefaults().build();
 *
 * TypeMapping&lt;?&gt; byStoreType = typeMappingSource.findMapping("uuid[]").get();  // UUID[]
 * TypeMapping&lt;?&gt; byJavaType = typeMappingSource.findMapping(int[].class).get(); // integer[]
 * ListTypeMapping&lt;String&gt; list = typeMappingSource.findListMapping(String.class).get(); // text[]</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public class TypeMappingSource {
	@NonNull
	private final Map<String, TypeMapping<?>> scalarMappingsByStoreType;
	@NonNull
	private final Map<Class<?>, TypeMapping<?>> scalarMappingsByJavaType;
	@NonNull
	private final ConcurrentHashMap<String, TypeMapping<?>> sequenceMappingsByStoreType;
	@NonNull
	private final ConcurrentHashMap<Type, TypeMapping<?>> sequenceMappingsByJavaType;
	@NonNull
	private final Logger logger;

	protected TypeMappingSource(@NonNull Builder builder) {
		requireNonNull(builder);

		Map<String, TypeMapping<?>> scalarMappingsByStoreType = new LinkedHashMap<>();
		Map<Class<?>, TypeMapping<?>> scalarMappingsByJavaType = new LinkedHashMap<>();

		// Later registrations replace earlier ones
		for (TypeMapping<?> scalarMapping : builder.scalarMappings) {
			scalarMappingsByStoreType.put(normalizeStoreType(scalarMapping.getStoreType()), scalarMapping);
			scalarMappingsByJavaType.put(scalarMapping.getJavaType(), scalarMapping);
		}

		this.scalarMappingsByStoreType = Map.copyOf(scalarMappingsByStoreType);
		this.scalarMappingsByJavaType = Map.copyOf(scalarMappingsByJavaType);
		this.sequenceMappingsByStoreType = new ConcurrentHashMap<>();
		this.sequenceMappingsByJavaType = new ConcurrentHashMap<>();
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Acquires a builder pre-populated with {@link StandardTypeMappings#all()}.
	 *
	 * @return the builder
	 */
	@NonNull
	public static Builder withDefaults() {
		return withScalarMappings(StandardTypeMappings.all());
	}

	/**
	 * Acquires a builder pre-populated with the given scalar mappings.
	 *
	 * @param scalarMappings the scalar mappings to register
	 * @return the builder
	 */
	@NonNull
	public static Builder withScalarMappings(@NonNull Collection<? extends TypeMapping<?>> scalarMappings) {
		requireNonNull(scalarMappings);
		return new Builder(scalarMappings);
	}

	/**
	 * Finds the mapping for a store type, e.g. {@code "integer"} or {@code "integer[]"}.
	 * <p>
	 * Array store types resolve to an array of the element mapping's Java type. Multi-dimensional store types such as {@code "integer[][]"} are not supported.
	 *
	 * @param storeType the store type name (case-insensitive)
	 * @return the mapping, or {@link Optional#empty()} if none is available
	 */
	@NonNull
	public Optional<TypeMapping<?>> findMapping(@NonNull String storeType) {
		requireNonNull(storeType);

		String normalizedStoreType = normalizeStoreType(storeType);

		if (!normalizedStoreType.endsWith(AbstractSequenceTypeMapping.ARRAY_STORE_TYPE_SUFFIX))
			return Optional.ofNullable(getScalarMappingsByStoreType().get(normalizedStoreType));

		String elementStoreType = normalizedStoreType.substring(0, normalizedStoreType.length() - AbstractSequenceTypeMapping.ARRAY_STORE_TYPE_SUFFIX.length()).trim();

		if (elementStoreType.endsWith(AbstractSequenceTypeMapping.ARRAY_STORE_TYPE_SUFFIX))
			return Optional.empty();

		TypeMapping<?> elementMapping = getScalarMappingsByStoreType().get(elementStoreType);

		if (elementMapping == null)
			return Optional.empty();

		return Optional.of(getSequenceMappingsByStoreType().computeIfAbsent(normalizedStoreType, key -> {
			ArrayTypeMapping<?> arrayTypeMapping = ArrayTypeMapping.forElementMapping(elementMapping);
			getLogger().log(Level.FINER, () -> format("Created %s for store type '%s'", arrayTypeMapping, key));
			return arrayTypeMapping;
		}));
	}

	/**
	 * Finds the mapping for a Java type: a scalar type, an array of one (reference or primitive) or a parameterized {@code List} of one.
	 * <p>
	 * Multi-dimensional array types resolve to mappings without a comparer.
	 *
	 * @param javaType the Java type
	 * @return the mapping, or {@link Optional#empty()} if none is available
	 */
	@NonNull
	public Optional<TypeMapping<?>> findMapping(@NonNull Type javaType) {
		requireNonNull(javaType);

		SequenceType sequenceType = SequenceType.of(javaType);
		TypeMapping<?> scalarMapping = getScalarMappingsByJavaType().get(DefaultSequenceType.boxedClass(sequenceType.getRawClass()));

		// Scalar types may themselves be arrays, e.g. bytea is byte[]
		if (scalarMapping != null || sequenceType.getRank() == 0)
			return Optional.ofNullable(scalarMapping);

		TypeMapping<?> elementMapping = findElementMapping(sequenceType).orElse(null);

		if (elementMapping == null)
			return Optional.empty();

		return Optional.of(getSequenceMappingsByJavaType().computeIfAbsent(javaType, key -> {
			TypeMapping<?> sequenceMapping = sequenceType.isArray()
					? ArrayTypeMapping.create(elementMapping, sequenceType.getRawClass())
					: ListTypeMapping.create(elementMapping, key, null);

			getLogger().log(Level.FINER, () -> format("Created %s for Java type %s", sequenceMapping, key.getTypeName()));
			return sequenceMapping;
		}));
	}

	/**
	 * Finds the mapping for {@code List<E>}.
	 *
	 * @param elementType the list's element type
	 * @param <E>         the list's element type
	 * @return the mapping, or {@link Optional#empty()} if no scalar mapping exists for {@code elementType}
	 */
	@NonNull
	@SuppressWarnings("unchecked")
	public <E> Optional<ListTypeMapping<E>> findListMapping(@NonNull Class<E> elementType) {
		requireNonNull(elementType);
		return findMapping(new DefaultParameterizedType(List.class, elementType)).map(mapping -> (ListTypeMapping<E>) mapping);
	}

	/**
	 * The scalar mapping for the outermost element type of {@code sequenceType} which has one: {@code byte[]} for {@code byte[][]}, {@link Integer} for {@code int[][]}.
	 */
	@NonNull
	protected Optional<TypeMapping<?>> findElementMapping(@NonNull SequenceType sequenceType) {
		requireNonNull(sequenceType);

		if (sequenceType.isList())
			return sequenceType.getElementClass().map(elementClass -> getScalarMappingsByJavaType().get(DefaultSequenceType.boxedClass(elementClass)));

		for (Class<?> componentClass = sequenceType.getRawClass().getComponentType(); componentClass != null; componentClass = componentClass.getComponentType()) {
			TypeMapping<?> elementMapping = getScalarMappingsByJavaType().get(DefaultSequenceType.boxedClass(componentClass));

			if (elementMapping != null)
				return Optional.of(elementMapping);
		}

		return Optional.empty();
	}

	@NonNull
	private static String normalizeStoreType(@NonNull String storeType) {
		requireNonNull(storeType);
		return storeType.trim().toLowerCase(Locale.ROOT);
	}

	@NonNull
	protected Map<String, TypeMapping<?>> getScalarMappingsByStoreType() {
		return this.scalarMappingsByStoreType;
	}

	@NonNull
	protected Map<Class<?>, TypeMapping<?>> getScalarMappingsByJavaType() {
		return this.scalarMappingsByJavaType;
	}

	@NonNull
	protected ConcurrentHashMap<String, TypeMapping<?>> getSequenceMappingsByStoreType() {
		return this.sequenceMappingsByStoreType;
	}

	@NonNull
	protected ConcurrentHashMap<Type, TypeMapping<?>> getSequenceMappingsByJavaType() {
		return this.sequenceMappingsByJavaType;
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	/**
	 * Builder used to construct instances of {@link TypeMappingSource}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final List<TypeMapping<?>> scalarMappings;

		private Builder(@NonNull Collection<? extends TypeMapping<?>> scalarMappings) {
			requireNonNull(scalarMappings);
			this.scalarMappings = new ArrayList<>(scalarMappings);
		}

		/**
		 * Registers an additional scalar mapping, replacing any registered mapping with the same store type or Java type.
		 *
		 * @param scalarMapping the scalar mapping to register
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder scalarMapping(@NonNull TypeMapping<?> scalarMapping) {
			requireNonNull(scalarMapping);

			if (scalarMapping instanceof AbstractSequenceTypeMapping<?>)
				throw new IllegalArgumentException(format("%s is a sequence mapping; only scalar mappings may be registered", scalarMapping));

			this.scalarMappings.add(scalarMapping);
			return this;
		}

		@NonNull
		public TypeMappingSource build() {
			return new TypeMappingSource(this);
		}
	}
}
