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

import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when an operation requires a single-dimensional sequence but was given (or was configured for) a sequence of another rank.
 * <p>
 * Multi-dimensional arrays are not supported for literal generation or value comparison.
 * A mapping constructed over such a type has no comparer; see {@link ArrayTypeMapping#getComparer()}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class UnsupportedRankException extends TypeMappingException {
	@NonNull
	private final Integer rank;

	/**
	 * Creates an {@code UnsupportedRankException} for the given {@code rank}.
	 *
	 * @param message a message describing this exception
	 * @param rank    the unsupported rank
	 */
	public UnsupportedRankException(@NonNull String message,
																	@NonNull Integer rank) {
		super(requireNonNull(message));
		this.rank = requireNonNull(rank);
	}

	@NonNull
	static UnsupportedRankException forLiteral(@NonNull Integer rank) {
		requireNonNull(rank);
		return new UnsupportedRankException(format("array literals for rank > 1 are not supported (rank was %d)", rank), rank);
	}

	@NonNull
	static UnsupportedRankException forComparer(@NonNull String storeType,
																							@NonNull Integer rank) {
		requireNonNull(storeType);
		requireNonNull(rank);
		return new UnsupportedRankException(format("Value comparison is not supported for %s with rank %d; only single-dimensional arrays have a comparer",
				storeType, rank), rank);
	}

	/**
	 * Gets the rank which caused this exception.
	 *
	 * @return the unsupported rank
	 */
	@NonNull
	public Integer getRank() {
		return this.rank;
	}
}
