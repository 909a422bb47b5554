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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Structural {@link ValueComparer} for single-dimensional sequences (arrays and lists).
 * <p>
 * There are exactly three variants, chosen once per mapping by {@link SequenceComparerSelector}:
 * <ul>
 *   <li>{@link Delegating} - the element mapping supplies its own comparer, which is used for each element</li>
 *   <li>{@link SelfEquatable} - the element type declares value equality, which is used directly</li>
 *   <li>{@link FallbackEquals} - neither of the above; elements are compared with {@link Objects#equals(Object, Object)}</li>
 * </ul>
 * Sequences of different lengths are never equal. Otherwise, elements are compared in index order and comparison stops at the first mismatch.
 * Hash codes fold element hashes in index order, so equal sequences hash identically.
 * <p>
 * A {@code null} sequence equals only another {@code null} sequence and is never equal to an empty one.
 *
 * @param <S> the sequence type, e.g. {@code Integer[]}, {@code int[]} or {@code List<UUID>}
 * @since 1.0.0
 */
@ThreadSafe
public abstract sealed class SequenceComparer<S> implements ValueComparer<S>
		permits SequenceComparer.Delegating, SequenceComparer.SelfEquatable, SequenceComparer.FallbackEquals {
	/**
	 * Names the variant a {@link SequenceComparer} uses for its elements.
	 */
	public enum Strategy {
		/**
		 * Elements are compared, hashed and snapshotted by the element mapping's comparer.
		 */
		DELEGATING,
		/**
		 * Elements are compared with their own {@code equals} override.
		 */
		SELF_EQUATABLE,
		/**
		 * Elements are compared with {@link Objects#equals(Object, Object)}.
		 */
		FALLBACK_EQUALS
	}

	@NonNull
	private final Class<?> type;
	@NonNull
	private final Class<?> elementType;
	@NonNull
	private final SequenceAccessor<S> sequenceAccessor;

	private SequenceComparer(@NonNull Class<?> type,
													 @NonNull Class<?> elementType,
													 @NonNull SequenceAccessor<S> sequenceAccessor) {
		requireNonNull(type);
		requireNonNull(elementType);
		requireNonNull(sequenceAccessor);

		this.type = type;
		this.elementType = elementType;
		this.sequenceAccessor = sequenceAccessor;
	}

	@Override
	public boolean areEqual(@Nullable S left,
													@Nullable S right) {
		if (left == null)
			return right == null;

		if (right == null)
			return false;

		SequenceAccessor<S> sequenceAccessor = getSequenceAccessor();
		int length = sequenceAccessor.length(left);

		if (length != sequenceAccessor.length(right))
			return false;

		for (int i = 0; i < length; i++)
			if (!elementsEqual(sequenceAccessor.elementAt(left, i), sequenceAccessor.elementAt(right, i)))
				return false;

		return true;
	}

	@Override
	public int hash(@Nullable S value) {
		if (value == null)
			return 0;

		SequenceAccessor<S> sequenceAccessor = getSequenceAccessor();
		int length = sequenceAccessor.length(value);
		int hash = 1;

		for (int i = 0; i < length; i++)
			hash = 31 * hash + elementHash(sequenceAccessor.elementAt(value, i));

		return hash;
	}

	@Nullable
	@Override
	public S snapshot(@Nullable S value) {
		if (value == null)
			return null;

		SequenceAccessor<S> sequenceAccessor = getSequenceAccessor();
		return sequenceAccessor.newSequence(sequenceAccessor.length(value), i -> elementSnapshot(sequenceAccessor.elementAt(value, i)));
	}

	protected abstract boolean elementsEqual(@Nullable Object left,
																					 @Nullable Object right);

	protected abstract int elementHash(@Nullable Object element);

	@Nullable
	protected abstract Object elementSnapshot(@Nullable Object element);

	/**
	 * Gets which variant this comparer is.
	 *
	 * @return the variant
	 */
	@NonNull
	public abstract Strategy getStrategy();

	@NonNull
	@Override
	public Class<?> getType() {
		return this.type;
	}

	/**
	 * Gets the element type of compared sequences.
	 *
	 * @return the element type
	 */
	@NonNull
	public Class<?> getElementType() {
		return this.elementType;
	}

	@NonNull
	SequenceAccessor<S> getSequenceAccessor() {
		return this.sequenceAccessor;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{type=%s, strategy=%s}", getClass().getSimpleName(), getType().getTypeName(), getStrategy().name());
	}

	/**
	 * Compares, hashes and snapshots each element with the element mapping's comparer.
	 * <p>
	 * Element-level {@code null} handling is up to that comparer.
	 *
	 * @param <S> the sequence type
	 * @param <E> the element type
	 */
	@ThreadSafe
	public static final class Delegating<S, E> extends SequenceComparer<S> {
		@NonNull
		private final ValueComparer<E> elementComparer;

		Delegating(@NonNull Class<?> type,
							 @NonNull Class<?> elementType,
							 @NonNull SequenceAccessor<S> sequenceAccessor,
							 @NonNull ValueComparer<E> elementComparer) {
			super(type, elementType, sequenceAccessor);
			this.elementComparer = requireNonNull(elementComparer);
		}

		@Override
		@SuppressWarnings("unchecked")
		protected boolean elementsEqual(@Nullable Object left,
																		@Nullable Object right) {
			return getElementComparer().areEqual((E) left, (E) right);
		}

		@Override
		@SuppressWarnings("unchecked")
		protected int elementHash(@Nullable Object element) {
			return getElementComparer().hash((E) element);
		}

		@Nullable
		@Override
		@SuppressWarnings("unchecked")
		protected Object elementSnapshot(@Nullable Object element) {
			return getElementComparer().snapshot((E) element);
		}

		@NonNull
		@Override
		public Strategy getStrategy() {
			return Strategy.DELEGATING;
		}

		/**
		 * Gets the element mapping's comparer this comparer delegates to.
		 *
		 * @return the element comparer
		 */
		@NonNull
		public ValueComparer<E> getElementComparer() {
			return this.elementComparer;
		}
	}

	/**
	 * Compares elements with the {@code equals} override their type declares. Elements are treated as immutable, so snapshots copy references.
	 *
	 * @param <S> the sequence type
	 */
	@ThreadSafe
	public static final class SelfEquatable<S> extends SequenceComparer<S> {
		SelfEquatable(@NonNull Class<?> type,
									@NonNull Class<?> elementType,
									@NonNull SequenceAccessor<S> sequenceAccessor) {
			super(type, elementType, sequenceAccessor);
		}

		@Override
		protected boolean elementsEqual(@Nullable Object left,
																		@Nullable Object right) {
			if (left == null)
				return right == null;

			return right != null && left.equals(right);
		}

		@Override
		protected int elementHash(@Nullable Object element) {
			return element == null ? 0 : element.hashCode();
		}

		@Nullable
		@Override
		protected Object elementSnapshot(@Nullable Object element) {
			return element;
		}

		@NonNull
		@Override
		public Strategy getStrategy() {
			return Strategy.SELF_EQUATABLE;
		}
	}

	/**
	 * Compares elements with {@link Objects#equals(Object, Object)}. Elements are treated as immutable, so snapshots copy references.
	 *
	 * @param <S> the sequence type
	 */
	@ThreadSafe
	public static final class FallbackEquals<S> extends SequenceComparer<S> {
		FallbackEquals(@NonNull Class<?> type,
									 @NonNull Class<?> elementType,
									 @NonNull SequenceAccessor<S> sequenceAccessor) {
			super(type, elementType, sequenceAccessor);
		}

		@Override
		protected boolean elementsEqual(@Nullable Object left,
																		@Nullable Object right) {
			return Objects.equals(left, right);
		}

		@Override
		protected int elementHash(@Nullable Object element) {
			return Objects.hashCode(element);
		}

		@Nullable
		@Override
		protected Object elementSnapshot(@Nullable Object element) {
			return element;
		}

		@NonNull
		@Override
		public Strategy getStrategy() {
			return Strategy.FALLBACK_EQUALS;
		}
	}
}
