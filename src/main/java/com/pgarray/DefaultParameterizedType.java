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
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Package-private implementation of {@link ParameterizedType}, used to describe {@code List<E>} when only {@code E} is known at runtime.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultParameterizedType implements ParameterizedType {
	@NonNull
	private final Class<?> rawType;
	@NonNull
	private final Type @NonNull [] typeArguments;

	DefaultParameterizedType(@NonNull Class<?> rawType,
													 Type @NonNull ... typeArguments) {
		requireNonNull(rawType);
		requireNonNull(typeArguments);

		if (rawType.getTypeParameters().length != typeArguments.length)
			throw new IllegalArgumentException(format("%s takes %d type arguments but %d were supplied",
					rawType.getName(), rawType.getTypeParameters().length, typeArguments.length));

		this.rawType = rawType;
		this.typeArguments = typeArguments.clone();
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ParameterizedType other))
			return false;

		return Objects.equals(getRawType(), other.getRawType())
				&& Objects.equals(getOwnerType(), other.getOwnerType())
				&& Arrays.equals(getActualTypeArguments(), other.getActualTypeArguments());
	}

	// Matches the JDK's ParameterizedType hash so instances are interchangeable as map keys
	@Override
	public int hashCode() {
		return Arrays.hashCode(this.typeArguments) ^ Objects.hashCode(getOwnerType()) ^ Objects.hashCode(getRawType());
	}

	@Override
	@NonNull
	public Type[] getActualTypeArguments() {
		return this.typeArguments.clone();
	}

	@Override
	@NonNull
	public Type getRawType() {
		return this.rawType;
	}

	@Override
	@Nullable
	public Type getOwnerType() {
		return this.rawType.getDeclaringClass();
	}

	@Override
	@NonNull
	public String getTypeName() {
		return toString();
	}

	@Override
	@NonNull
	public String toString() {
		return this.rawType.getName() + Arrays.stream(this.typeArguments).map(Type::getTypeName).collect(joining(", ", "<", ">"));
	}
}
