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
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Package-private default implementation of {@link SequenceType}.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultSequenceType implements SequenceType {
	@NonNull
	private static final Map<Class<?>, Class<?>> WRAPPER_CLASSES_BY_PRIMITIVE_CLASS = Map.of(
			boolean.class, Boolean.class,
			byte.class, Byte.class,
			short.class, Short.class,
			int.class, Integer.class,
			long.class, Long.class,
			float.class, Float.class,
			double.class, Double.class,
			char.class, Character.class
	);

	@NonNull
	private final Type type;
	@NonNull
	private final Class<?> rawClass;
	@NonNull
	private final Integer rank;
	@Nullable
	private final Class<?> elementClass;

	DefaultSequenceType(@NonNull Type type) {
		requireNonNull(type);

		this.type = type;
		this.rawClass = rawClassFor(type);

		if (type instanceof ParameterizedType parameterizedType && this.rawClass.equals(List.class)) {
			Type elementType = parameterizedType.getActualTypeArguments()[0];
			this.rank = 1;
			this.elementClass = elementType instanceof Class<?> || elementType instanceof ParameterizedType ? rawClassFor(elementType) : null;
		} else if (this.rawClass.equals(List.class)) {
			this.rank = 1;
			this.elementClass = null;
		} else if (this.rawClass.isArray()) {
			int rank = 0;
			Class<?> componentClass = this.rawClass;

			while (componentClass.isArray()) {
				componentClass = componentClass.getComponentType();
				++rank;
			}

			this.rank = rank;
			this.elementClass = componentClass;
		} else {
			this.rank = 0;
			this.elementClass = null;
		}
	}

	/**
	 * The wrapper class for a primitive class, or the class itself if it is not primitive.
	 */
	@NonNull
	static Class<?> boxedClass(@NonNull Class<?> type) {
		requireNonNull(type);
		return type.isPrimitive() ? WRAPPER_CLASSES_BY_PRIMITIVE_CLASS.get(type) : type;
	}

	@NonNull
	private static Class<?> rawClassFor(@NonNull Type type) {
		requireNonNull(type);

		if (type instanceof Class<?> rawClass)
			return rawClass;

		if (type instanceof ParameterizedType parameterizedType)
			return (Class<?>) parameterizedType.getRawType();

		if (type instanceof GenericArrayType genericArrayType) {
			Class<?> componentClass = rawClassFor(genericArrayType.getGenericComponentType());
			return Array.newInstance(componentClass, 0).getClass();
		}

		if (type instanceof TypeVariable<?> typeVariable) {
			Type[] bounds = typeVariable.getBounds();
			return bounds.length == 0 ? Object.class : rawClassFor(bounds[0]);
		}

		if (type instanceof WildcardType wildcardType) {
			Type[] uppers = wildcardType.getUpperBounds();
			return uppers.length == 0 ? Object.class : rawClassFor(uppers[0]);
		}

		return Object.class;
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (object == null || getClass() != object.getClass())
			return false;

		DefaultSequenceType that = (DefaultSequenceType) object;
		return Objects.equals(getType(), that.getType());
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(getType());
	}

	@Override
	@NonNull
	public Type getType() {
		return this.type;
	}

	@Override
	@NonNull
	public Class<?> getRawClass() {
		return this.rawClass;
	}

	@Override
	@NonNull
	public Integer getRank() {
		return this.rank;
	}

	@Override
	@NonNull
	public Optional<Class<?>> getElementClass() {
		return Optional.ofNullable(this.elementClass);
	}

	@Override
	@NonNull
	public Optional<Integer> getRankRelativeTo(@NonNull Class<?> elementClass) {
		requireNonNull(elementClass);

		Class<?> boxedElementClass = boxedClass(elementClass);

		if (isList())
			return this.elementClass == null || boxedClass(this.elementClass).equals(boxedElementClass) ? Optional.of(1) : Optional.empty();

		int rank = 0;

		for (Class<?> componentClass = getRawClass(); componentClass.isArray(); ) {
			componentClass = componentClass.getComponentType();
			++rank;

			if (boxedClass(componentClass).equals(boxedElementClass))
				return Optional.of(rank);
		}

		return Optional.empty();
	}

	@Override
	public String toString() {
		return format("%s{type=%s, rank=%d}", getClass().getSimpleName(), getType().getTypeName(), getRank());
	}
}
