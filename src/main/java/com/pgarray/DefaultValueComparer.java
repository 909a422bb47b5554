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
import java.util.function.BiPredicate;
import java.util.function.ToIntFunction;
import java.util.function.UnaryOperator;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Package-private implementation of {@link ValueComparer} which handles {@code null} before delegating to functions.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultValueComparer<T> implements ValueComparer<T> {
	@NonNull
	private final Class<?> type;
	@NonNull
	private final BiPredicate<T, T> equals;
	@NonNull
	private final ToIntFunction<T> hash;
	@NonNull
	private final UnaryOperator<T> snapshot;

	DefaultValueComparer(@NonNull Class<?> type,
											 @NonNull BiPredicate<T, T> equals,
											 @NonNull ToIntFunction<T> hash,
											 @NonNull UnaryOperator<T> snapshot) {
		requireNonNull(type);
		requireNonNull(equals);
		requireNonNull(hash);
		requireNonNull(snapshot);

		this.type = type;
		this.equals = equals;
		this.hash = hash;
		this.snapshot = snapshot;
	}

	@NonNull
	@Override
	public Class<?> getType() {
		return this.type;
	}

	@Override
	public boolean areEqual(@Nullable T left,
													@Nullable T right) {
		if (left == null)
			return right == null;

		if (right == null)
			return false;

		return this.equals.test(left, right);
	}

	@Override
	public int hash(@Nullable T value) {
		return value == null ? 0 : this.hash.applyAsInt(value);
	}

	@Nullable
	@Override
	public T snapshot(@Nullable T value) {
		return value == null ? null : this.snapshot.apply(value);
	}

	@Override
	public String toString() {
		return format("%s{type=%s}", getClass().getSimpleName(), getType().getName());
	}
}
