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

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown when a {@link TypeMapping} cannot be constructed for, or cannot operate on, a requested Java type.
 * <p>
 * Subclasses describe the specific failure:
 * <ul>
 *   <li>{@link UnsupportedRankException} for multi-dimensional arrays</li>
 *   <li>{@link UnsupportedShapeException} for Java types whose element type disagrees with the element mapping</li>
 * </ul>
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class TypeMappingException extends RuntimeException {
	/**
	 * Creates a {@code TypeMappingException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public TypeMappingException(@Nullable String message) {
		this(message, null);
	}

	/**
	 * Creates a {@code TypeMappingException} which wraps the given {@code cause}.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public TypeMappingException(@Nullable String message,
															@Nullable Throwable cause) {
		super(message, cause);
	}
}
