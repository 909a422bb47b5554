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

/**
 * Renders a single non-{@code null} value as a SQL literal, e.g. {@code 42}, {@code 'O''Brien'} or {@code '5f0c…'::uuid}.
 * <p>
 * {@code null} is handled by the owning {@link TypeMapping}, which renders {@code NULL} without consulting the renderer.
 * <p>
 * Implementations should be threadsafe.
 *
 * @param <T> the type of value rendered
 * @since 1.0.0
 */
@FunctionalInterface
public interface SqlLiteralRenderer<T> {
	/**
	 * Renders {@code value} as a SQL literal.
	 *
	 * @param value the value to render
	 * @return the SQL literal
	 */
	@NonNull
	String render(@NonNull T value);
}
