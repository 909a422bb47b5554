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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * @since 1.0.0
 */
public class ListTypeMappingTests {
	@Test
	public void testStoreTypeAndJavaType() {
		ListTypeMapping<String> mapping = ListTypeMapping.create(StandardTypeMappings.text());

		Assertions.assertEquals("text[]", mapping.getStoreType());
		Assertions.assertEquals(List.class, mapping.getJavaType());
		Assertions.assertSame(StandardTypeMappings.text(), mapping.getElementMapping());
		Assertions.assertEquals(1, mapping.getRank());
		Assertions.assertEquals("int4[]", ListTypeMapping.create(StandardTypeMappings.integer(), "int4[]").getStoreType());
	}

	@Test
	public void testLiterals() {
		ListTypeMapping<String> mapping = ListTypeMapping.create(StandardTypeMappings.text());

		Assertions.assertEquals("ARRAY['a','b']::text[]", mapping.generateSqlLiteral(List.of("a", "b")));
		Assertions.assertEquals("ARRAY['a',NULL]::text[]", mapping.generateSqlLiteral(Arrays.asList("a", null)));
		Assertions.assertEquals("ARRAY[]::text[]", mapping.generateSqlLiteral(List.of()));
		Assertions.assertThrows(IllegalArgumentException.class, () -> mapping.generateSqlLiteral(new String[]{"a"}));
	}

	@Test
	public void testReflectiveListTypes() throws Exception {
		Type uuids = Holder.class.getDeclaredField("uuids").getGenericType();
		ListTypeMapping<UUID> mapping = ListTypeMapping.create(StandardTypeMappings.uuid(), uuids, null);
		UUID uuid = UUID.fromString("5f0c7e52-8f53-4b7c-9d0e-2b1d8c2f6a11");

		Assertions.assertEquals("uuid[]", mapping.getStoreType());
		Assertions.assertEquals("ARRAY['5f0c7e52-8f53-4b7c-9d0e-2b1d8c2f6a11'::uuid]::uuid[]", mapping.generateSqlLiteral(List.of(uuid)));

		ListTypeMapping<UUID> raw = ListTypeMapping.create(StandardTypeMappings.uuid(), List.class, null);
		Assertions.assertTrue(raw.getComparer().isPresent(), "A raw List is taken to hold the element mapping's type");
	}

	@Test
	public void testMismatchedShapesAreRejected() throws Exception {
		Type strings = Holder.class.getDeclaredField("strings").getGenericType();
		Type integerSet = Holder.class.getDeclaredField("integerSet").getGenericType();

		Assertions.assertThrows(UnsupportedShapeException.class, () -> ListTypeMapping.create(StandardTypeMappings.integer(), strings, null));
		Assertions.assertThrows(UnsupportedShapeException.class, () -> ListTypeMapping.create(StandardTypeMappings.integer(), integerSet, null));
		Assertions.assertThrows(UnsupportedShapeException.class, () -> ListTypeMapping.create(StandardTypeMappings.integer(), Integer[].class, null));
	}

	@Test
	public void testComparerSelection() {
		Assertions.assertEquals(SequenceComparer.Strategy.SELF_EQUATABLE,
				ListTypeMapping.create(StandardTypeMappings.integer()).getRequiredComparer().getStrategy());
		Assertions.assertEquals(SequenceComparer.Strategy.DELEGATING,
				ListTypeMapping.create(StandardTypeMappings.numeric()).getRequiredComparer().getStrategy());
	}

	@Test
	public void testSnapshotIsIndependentArrayList() {
		SequenceComparer<List<Integer>> comparer = ListTypeMapping.create(StandardTypeMappings.integer()).getRequiredComparer();
		List<Integer> source = List.of(1, 2, 3);
		List<Integer> snapshot = comparer.snapshot(source);

		Assertions.assertEquals(ArrayList.class, snapshot.getClass());
		Assertions.assertEquals(source, snapshot);
		Assertions.assertNotSame(source, snapshot);
	}

	@Test
	public void testWithFacetsSharesComparer() {
		ListTypeMapping<Integer> mapping = ListTypeMapping.create(StandardTypeMappings.integer());
		ListTypeMapping<Integer> clone = mapping.withFacets(TypeMappingFacets.builder().nullable(false).build());

		Assertions.assertEquals(Boolean.FALSE, clone.getFacets().getNullable().orElseThrow());
		Assertions.assertSame(mapping.getRequiredComparer(), clone.getRequiredComparer());
		Assertions.assertSame(mapping.getElementMapping(), clone.getElementMapping());
	}

	static class Holder {
		List<UUID> uuids;
		List<String> strings;
		Set<Integer> integerSet;
	}
}
