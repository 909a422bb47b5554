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

/**
 * <strong>pgarray</strong> maps PostgreSQL array column types to Java arrays and {@link java.util.List}s, and supplies the structural
 * equality, hashing and snapshotting that change-tracking code needs to notice when an array-valued property has been modified.
 * <p>
 * An {@link com.pgarray.ArrayTypeMapping} is built from an element mapping. When it is created, a
 * {@link com.pgarray.SequenceComparerSelector} binds one of three comparer variants based on what the element offers:
 * its own {@link com.pgarray.ValueComparer}, a value-based {@code equals}, or neither.
 *
 * <pre>
 * // Arrays of a stock element type
 * ArrayTypeMapping&lt;Integer[]&gt; integers = ArrayTypeMapping.create(StandardTypeMappings.integer(), Integer[].class);
 * integers.getStoreType(); // "integer[]"
 * integers.generateSqlLiteral(new Integer[] { 1, 2, 3 }); // "ARRAY[1,2,3]::integer[]"
 *
 * // Change tracking
 * ValueComparer&lt;Integer[]&gt; comparer = integers.getRequiredComparer();
 * Integer[] snapshot = comparer.snapshot(liveValue);
 * ...
 * boolean modified = !comparer.areEqual(snapshot, liveValue);
 *
 * // Lookup by store type or Java type
 * TypeMappingSource typeMappingSource = TypeMappingSource.withDefaults().build();
 * TypeMapping&lt;?&gt; uuids = typeMappingSource.findMapping("uuid[]").orElseThrow();
 * ListTypeMapping&lt;String&gt; strings = typeMappingSource.findListMapping(String.class).orElseThrow();</pre>
 *
 * @since 1.0.0
 */
package com.pgarray;
