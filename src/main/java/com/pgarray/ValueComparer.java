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
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.ToIntFunction;
import java.util.function.UnaryOperator;

import static java.util.Objects.requireNonNull;

/**
 * Structural equality, hashing and snapshotting for values of a mapped type.
 * <p>
 * Change-tracking code takes a {@link #snapshot(Object)} of a tracked value and later asks {@link #areEqual(Object, Object)}
 * whether the live value still matches it.
 * <p>
 * All operations must accept {@code null}. Two {@code null} values are equal; a {@code null} and a non-{@code null} value are not.
 * <p>
 * Implementations must be threadsafe.
 *
 * @param <T> the type of value compared
 * @since 1.0.0
 */
@ThreadSafe
public interface ValueComparer<T> {
	/**
	 * Gets the type of value this comparer handles.
	 *
	 * @return the compared type
	 */
	@NonNull
	Class<?> getType();

	/**
	 * Are the two values equal?
	 *
	 * @param left  the first value
	 * @param right the second value
	 * @return {@code true} if the values are equal, {@code false} otherwise
	 */
	boolean areEqual(@Nullable T left,
									 @Nullable T right);

	/**
	 * Computes a hash code consistent with {@link #areEqual(Object, Object)}.
	 *
	 * @param value the value to hash
	 * @return the hash code
	 */
	int hash(@Nullable T value);

	/**
	 * Takes an independent copy of {@code value}; later mutation of {@code value} must not be visible through the snapshot.
	 *
	 * @param value the value to snapshot
	 * @return the snapshot, or {@code null} if {@code value} is {@code null}
	 */
	@Nullable
	T snapshot(@Nullable T value);

	/**
	 * Builds a comparer from functions that only ever see non-{@code null} values.
	 *
	 * @param type     the compared type
	 * @param equals   equality over two non-null values
	 * @param hash     hash over a non-null value
	 * @param snapshot snapshot of a non-null value
	 * @param <T>      the compared type
	 * @return a null-safe comparer
	 */
	@NonNull
	static <T> ValueComparer<T> of(@NonNull Class<?> type,
																 @NonNull BiPredicate<@NonNull T, @NonNull T> equals,
																 @NonNull ToIntFunction<@NonNull T> hash,
																 @NonNull UnaryOperator<@NonNull T> snapshot) {
		return new DefaultValueComparer<>(type, equals, hash, snapshot);
	}

	/**
	 * Builds a comparer which uses {@link Object#equals(Object)} and {@link Object#hashCode()}, and snapshots by reference.
	 * <p>
	 * Appropriate for immutable value types.
	 *
	 * @param type the compared type
	 * @param <T>  the compared type
	 * @return a null-safe comparer
	 */
	@NonNull
	static <T> ValueComparer<T> byEquality(@NonNull Class<T> type) {
		requireNonNull(type);
		return new DefaultValueComparer<T>(type, Objects::equals, Objects::hashCode, value -> value);
	}
}
