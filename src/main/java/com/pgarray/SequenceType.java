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

import javax.annotation.concurrent.ThreadSafe;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A view over a reflective {@link java.lang.reflect.Type} which describes it as a homogeneous sequence: a Java array or a {@link List}.
 * <p>
 * Used by {@link ArrayTypeMapping} and {@link ListTypeMapping} to validate requested types and by {@link SequenceComparerSelector}
 * to pick a comparer.
 *
 * @see java.lang.reflect.Type
 * @since 1.0.0
 */
@ThreadSafe
public interface SequenceType {
	/**
	 * The underlying reflective type ({@code Class}, {@code ParameterizedType}, {@code GenericArrayType}, etc.)
	 */
	@NonNull
	Type getType();

	/**
	 * Raw class, with erasure ({@code List.class} for {@code List<UUID>}, {@code Integer[][].class} for {@code Integer[][]}, etc.)
	 */
	@NonNull
	Class<?> getRawClass();

	@NonNull
	default Boolean isArray() {
		return getRawClass().isArray();
	}

	@NonNull
	default Boolean isList() {
		return getRawClass().equals(List.class);
	}

	/**
	 * The number of dimensions: {@code 1} for {@code int[]} and {@code List<Integer>}, {@code 2} for {@code int[][]},
	 * {@code 0} for anything which is not a sequence.
	 */
	@NonNull
	Integer getRank();

	/**
	 * The innermost element class: {@code int.class} for {@code int[][]}, {@code UUID.class} for {@code List<UUID>}.
	 * <p>
	 * Empty for non-sequences and for raw or wildcard-parameterized lists.
	 */
	@NonNull
	Optional<Class<?>> getElementClass();

	/**
	 * How many sequence levels wrap {@code elementClass}: {@code 1} for {@code Integer[]} relative to {@link Integer},
	 * {@code 1} for {@code byte[][]} relative to {@code byte[]}, {@code 2} for {@code int[][]} relative to {@link Integer}.
	 * <p>
	 * Primitive and wrapper classes are considered interchangeable. A raw {@link List} is taken to hold {@code elementClass}.
	 *
	 * @param elementClass the element class
	 * @return the rank relative to {@code elementClass}, or {@link Optional#empty()} if this is not a sequence of {@code elementClass}
	 */
	@NonNull
	Optional<Integer> getRankRelativeTo(@NonNull Class<?> elementClass);

	/**
	 * Is this a sequence (of any rank) of {@code elementClass}?
	 *
	 * @param elementClass the element class to match
	 * @return {@code true} if this is a sequence of {@code elementClass}, {@code false} otherwise
	 */
	@NonNull
	default Boolean matchesElementClass(@NonNull Class<?> elementClass) {
		requireNonNull(elementClass);
		return getRankRelativeTo(elementClass).isPresent();
	}

	@NonNull
	static SequenceType of(@NonNull Type type) {
		requireNonNull(type);
		return new DefaultSequenceType(type);
	}
}
