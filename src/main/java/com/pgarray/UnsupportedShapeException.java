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
import java.lang.reflect.Type;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown at mapping-construction time when the requested Java sequence type is not a sequence of the element mapping's Java type.
 * <p>
 * For example, asking for a {@code Long[]} mapping over an {@code integer} element mapping whose Java type is {@link Integer}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class UnsupportedShapeException extends TypeMappingException {
	@NonNull
	private final Type requestedType;
	@NonNull
	private final Class<?> elementType;

	/**
	 * Creates an {@code UnsupportedShapeException}.
	 *
	 * @param requestedType the sequence type that was requested
	 * @param elementType   the Java type of the element mapping
	 */
	public UnsupportedShapeException(@NonNull Type requestedType,
																	 @NonNull Class<?> elementType) {
		super(format("Cannot map %s as a sequence of %s", requireNonNull(requestedType).getTypeName(),
				requireNonNull(elementType).getName()));

		this.requestedType = requestedType;
		this.elementType = elementType;
	}

	/**
	 * Gets the sequence type that was requested.
	 *
	 * @return the requested sequence type
	 */
	@NonNull
	public Type getRequestedType() {
		return this.requestedType;
	}

	/**
	 * Gets the Java type of the element mapping the request disagreed with.
	 *
	 * @return the element mapping's Java type
	 */
	@NonNull
	public Class<?> getElementType() {
		return this.elementType;
	}
}
