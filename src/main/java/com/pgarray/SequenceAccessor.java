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
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Package-private uniform element access over the Java sequence types we map: arrays (reference or primitive) and {@link List}s.
 *
 * @param <S> the sequence type
 * @since 1.0.0
 */
@ThreadSafe
interface SequenceAccessor<S> {
	int length(@NonNull S sequence);

	@Nullable
	Object elementAt(@NonNull S sequence,
									 int index);

	/**
	 * Creates a new, independent sequence of the accessor's type.
	 */
	@NonNull
	S newSequence(int length,
								@NonNull IntFunction<@Nullable Object> elementAt);

	@NonNull
	static <S> SequenceAccessor<S> forArray(@NonNull Class<?> arrayClass) {
		requireNonNull(arrayClass);
		return new ArrayAccessor<>(arrayClass);
	}

	@NonNull
	static <E> SequenceAccessor<List<E>> forList() {
		return new ListAccessor<>();
	}

	/**
	 * Reflective access so {@code int[]} and {@code Integer[]} are handled alike.
	 */
	@ThreadSafe
	final class ArrayAccessor<S> implements SequenceAccessor<S> {
		@NonNull
		private final Class<?> arrayClass;
		@NonNull
		private final Class<?> componentClass;

		private ArrayAccessor(@NonNull Class<?> arrayClass) {
			requireNonNull(arrayClass);

			if (!arrayClass.isArray())
				throw new IllegalArgumentException(format("%s is not an array type", arrayClass.getName()));

			this.arrayClass = arrayClass;
			this.componentClass = arrayClass.getComponentType();
		}

		@Override
		public int length(@NonNull S sequence) {
			requireNonNull(sequence);
			return Array.getLength(sequence);
		}

		@Nullable
		@Override
		public Object elementAt(@NonNull S sequence,
														int index) {
			requireNonNull(sequence);
			return Array.get(sequence, index);
		}

		@NonNull
		@Override
		@SuppressWarnings("unchecked")
		public S newSequence(int length,
												 @NonNull IntFunction<@Nullable Object> elementAt) {
			requireNonNull(elementAt);

			Object array = Array.newInstance(this.componentClass, length);

			for (int i = 0; i < length; i++)
				Array.set(array, i, elementAt.apply(i));

			return (S) array;
		}

		@Override
		public String toString() {
			return format("%s{arrayClass=%s}", getClass().getSimpleName(), this.arrayClass.getTypeName());
		}
	}

	@ThreadSafe
	final class ListAccessor<E> implements SequenceAccessor<List<E>> {
		private ListAccessor() {}

		@Override
		public int length(@NonNull List<E> sequence) {
			requireNonNull(sequence);
			return sequence.size();
		}

		@Nullable
		@Override
		public Object elementAt(@NonNull List<E> sequence,
														int index) {
			requireNonNull(sequence);
			return sequence.get(index);
		}

		@NonNull
		@Override
		@SuppressWarnings("unchecked")
		public List<E> newSequence(int length,
															 @NonNull IntFunction<@Nullable Object> elementAt) {
			requireNonNull(elementAt);

			List<E> list = new ArrayList<>(length);

			for (int i = 0; i < length; i++)
				list.add((E) elementAt.apply(i));

			return list;
		}

		@Override
		public String toString() {
			return getClass().getSimpleName();
		}
	}
}
