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
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Picks the {@link SequenceComparer} variant for a sequence of an element mapping's values.
 * <p>
 * Rank is counted relative to the element mapping's Java type, so {@code byte[][]} over a {@code bytea} mapping of {@code byte[]} has rank 1.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>rank other than 1: no comparer</li>
 *   <li>the element mapping supplies a comparer: {@link SequenceComparer.Delegating}</li>
 *   <li>the element type is primitive or declares its own {@code equals(Object)}: {@link SequenceComparer.SelfEquatable}</li>
 *   <li>otherwise: {@link SequenceComparer.FallbackEquals}</li>
 * </ol>
 * Selection inspects the element type once; the resulting comparer does no type inspection per call.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class SequenceComparerSelector {
	@NonNull
	private static final Logger LOGGER = Logger.getLogger(SequenceComparerSelector.class.getName());

	private SequenceComparerSelector() {
		// Prevents instantiation
	}

	/**
	 * Selects a comparer for sequences of type {@code sequenceType} whose elements are described by {@code elementMapping}.
	 * <p>
	 * {@code sequenceType} must be an array or {@link List} type; its element type should agree with {@code elementMapping}.
	 *
	 * @param elementMapping the mapping of a single element
	 * @param sequenceType   the Java sequence type, e.g. {@code Integer[].class}
	 * @return the comparer, or {@link Optional#empty()} if sequences of this rank cannot be compared
	 */
	@NonNull
	public static Optional<SequenceComparer<?>> select(@NonNull TypeMapping<?> elementMapping,
																										 @NonNull Type sequenceType) {
		requireNonNull(elementMapping);
		requireNonNull(sequenceType);

		SequenceType sequence = SequenceType.of(sequenceType);
		SequenceAccessor<Object> sequenceAccessor = sequence.isArray()
				? SequenceAccessor.forArray(sequence.getRawClass())
				: castAccessor(SequenceAccessor.forList());

		return select(elementMapping, sequence, sequenceAccessor).map(comparer -> comparer);
	}

	@NonNull
	static <S, E> Optional<SequenceComparer<S>> select(@NonNull TypeMapping<E> elementMapping,
																										 @NonNull SequenceType sequenceType,
																										 @NonNull SequenceAccessor<S> sequenceAccessor) {
		requireNonNull(elementMapping);
		requireNonNull(sequenceType);
		requireNonNull(sequenceAccessor);

		Integer rank = sequenceType.getRankRelativeTo(elementMapping.getJavaType()).orElse(sequenceType.getRank());

		if (rank != 1) {
			LOGGER.log(Level.FINE, () -> format("No comparer for %s: rank %d is not supported", sequenceType.getType().getTypeName(), rank));
			return Optional.empty();
		}

		Class<?> type = sequenceType.getRawClass();
		Class<?> elementType = sequenceType.isArray()
				? type.getComponentType()
				: sequenceType.getElementClass().orElse(elementMapping.getJavaType());
		SequenceComparer<S> comparer;

		Optional<ValueComparer<E>> elementComparer = elementMapping.getComparer();

		if (elementComparer.isPresent())
			comparer = new SequenceComparer.Delegating<>(type, elementType, sequenceAccessor, elementComparer.get());
		else if (declaresValueEquality(elementType))
			comparer = new SequenceComparer.SelfEquatable<>(type, elementType, sequenceAccessor);
		else
			comparer = new SequenceComparer.FallbackEquals<>(type, elementType, sequenceAccessor);

		LOGGER.log(Level.FINE, () -> format("Selected %s comparer for %s (element mapping %s)", comparer.getStrategy().name(),
				sequenceType.getType().getTypeName(), elementMapping.getStoreType()));

		return Optional.of(comparer);
	}

	/**
	 * Does {@code type} have value equality of its own, i.e. is it primitive or does it (or a superclass other than {@link Object}) declare {@code equals(Object)}?
	 * <p>
	 * Interfaces never qualify, since the runtime class of their elements is unknown.
	 */
	@NonNull
	static Boolean declaresValueEquality(@NonNull Class<?> type) {
		requireNonNull(type);

		if (type.isPrimitive())
			return true;

		if (type.isInterface())
			return false;

		for (Class<?> currentClass = type; currentClass != null && currentClass != Object.class; currentClass = currentClass.getSuperclass())
			for (Method method : currentClass.getDeclaredMethods())
				if (isEqualsOverride(method))
					return true;

		return false;
	}

	@NonNull
	private static Boolean isEqualsOverride(@NonNull Method method) {
		requireNonNull(method);

		return method.getName().equals("equals")
				&& method.getParameterCount() == 1
				&& method.getParameterTypes()[0] == Object.class
				&& method.getReturnType() == boolean.class
				&& !Modifier.isStatic(method.getModifiers());
	}

	@NonNull
	@SuppressWarnings({"unchecked", "rawtypes"})
	private static SequenceAccessor<Object> castAccessor(@NonNull SequenceAccessor<?> sequenceAccessor) {
		return (SequenceAccessor) sequenceAccessor;
	}
}
