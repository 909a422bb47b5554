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
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * @since 1.0.0
 */
public class TypeMappingSourceTests {
	@Test
	public void testScalarLookups() {
		TypeMappingSource typeMappingSource = TypeMappingSource.withDefaults().build();

		Assertions.assertSame(StandardTypeMappings.integer(), typeMappingSource.findMapping("integer").orElseThrow());
		Assertions.assertSame(StandardTypeMappings.integer(), typeMappingSource.findMapping(" INTEGER ").orElseThrow());
		Assertions.assertSame(StandardTypeMappings.integer(), typeMappingSource.findMapping(int.class).orElseThrow());
		Assertions.assertSame(StandardTypeMappings.bytea(), typeMappingSource.findMapping(byte[].class).orElseThrow());
		Assertions.assertTrue(typeMappingSource.findMapping("money").isEmpty());
		Assertions.assertTrue(typeMappingSource.findMapping(Thread.class).isEmpty());
	}

	@Test
	public void testArrayLookupByStoreType() {
		TypeMappingSource typeMappingSource = TypeMappingSource.withDefaults().build();
		TypeMapping<?> mapping = typeMappingSource.findMapping("uuid[]").orElseThrow();

		Assertions.assertTrue(mapping instanceof ArrayTypeMapping<?>);
		Assertions.assertEquals(UUID[].class, mapping.getJavaType());
		Assertions.assertEquals("uuid[]", mapping.getStoreType());
		Assertions.assertSame(mapping, typeMappingSource.findMapping("UUID[]").orElseThrow(), "Array mappings are memoized");

		Assertions.assertTrue(typeMappingSource.findMapping("integer[][]").isEmpty(), "Multi-dimensional store types are unsupported");
		Assertions.assertTrue(typeMappingSource.findMapping("money[]").isEmpty());
	}

	@Test
	public void testArrayLookupByJavaType() {
		TypeMappingSource typeMappingSource = TypeMappingSource.withDefaults().build();

		TypeMapping<?> primitive = typeMappingSource.findMapping(int[].class).orElseThrow();
		Assertions.assertEquals("integer[]", primitive.getStoreType());
		Assertions.assertEquals(int[].class, primitive.getJavaType());
		Assertions.assertSame(primitive, typeMappingSource.findMapping(int[].class).orElseThrow());

		ArrayTypeMapping<?> bytea = (ArrayTypeMapping<?>) typeMappingSource.findMapping(byte[][].class).orElseThrow();
		Assertions.assertEquals("bytea[]", bytea.getStoreType());
		Assertions.assertEquals(1, bytea.getRank());
		Assertions.assertEquals(SequenceComparer.Strategy.DELEGATING, bytea.getRequiredComparer().getStrategy());

		ArrayTypeMapping<?> multiDimensional = (ArrayTypeMapping<?>) typeMappingSource.findMapping(Integer[][].class).orElseThrow();
		Assertions.assertEquals(2, multiDimensional.getRank());
		Assertions.assertTrue(multiDimensional.getComparer().isEmpty());

		Assertions.assertTrue(typeMappingSource.findMapping(Thread[].class).isEmpty());
	}

	@Test
	public void testListLookups() throws Exception {
		TypeMappingSource typeMappingSource = TypeMappingSource.withDefaults().build();
		ListTypeMapping<String> strings = typeMappingSource.findListMapping(String.class).orElseThrow();

		Assertions.assertEquals("text[]", strings.getStoreType());
		Assertions.assertSame(strings, typeMappingSource.findListMapping(String.class).orElseThrow());

		Type reflectiveType = Holder.class.getDeclaredField("strings").getGenericType();
		Assertions.assertSame(strings, typeMappingSource.findMapping(reflectiveType).orElseThrow(),
				"Reflective and synthesized List<String> types share a cache entry");

		Assertions.assertTrue(typeMappingSource.findMapping(List.class).isEmpty(), "A raw List has no known element type");
		Assertions.assertTrue(typeMappingSource.findMapping(Holder.class.getDeclaredField("integerSet").getGenericType()).isEmpty());
		Assertions.assertTrue(typeMappingSource.findListMapping(Thread.class).isEmpty());
	}

	@Test
	public void testCustomScalarMappingReplacesDefault() {
		ScalarTypeMapping<Integer> strictInteger = ScalarTypeMapping.withStoreType("integer", Integer.class)
				.literalRenderer(value -> value + "::integer")
				.comparer(ValueComparer.byEquality(Integer.class))
				.build();

		TypeMappingSource typeMappingSource = TypeMappingSource.withDefaults()
				.scalarMapping(strictInteger)
				.build();

		ArrayTypeMapping<?> mapping = (ArrayTypeMapping<?>) typeMappingSource.findMapping("integer[]").orElseThrow();

		Assertions.assertSame(strictInteger, mapping.getElementMapping());
		Assertions.assertEquals(SequenceComparer.Strategy.DELEGATING, mapping.getRequiredComparer().getStrategy());
		Assertions.assertEquals("ARRAY[1::integer]::integer[]", mapping.generateSqlLiteral(new Integer[]{1}));
	}

	@Test
	public void testOnlyScalarMappingsMayBeRegistered() {
		ArrayTypeMapping<Integer[]> arrayTypeMapping = ArrayTypeMapping.create(StandardTypeMappings.integer(), Integer[].class);
		Assertions.assertThrows(IllegalArgumentException.class, () -> TypeMappingSource.withDefaults().scalarMapping(arrayTypeMapping));
	}

	@Test
	public void testSourceWithoutDefaults() {
		TypeMappingSource typeMappingSource = TypeMappingSource.withScalarMappings(List.of(StandardTypeMappings.text())).build();

		Assertions.assertTrue(typeMappingSource.findMapping("text[]").isPresent());
		Assertions.assertTrue(typeMappingSource.findMapping("integer[]").isEmpty());
	}

	@Test
	public void testConcurrentLookupsShareOneMapping() throws Exception {
		TypeMappingSource typeMappingSource = TypeMappingSource.withDefaults().build();
		int threadCount = 16;
		ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
		CountDownLatch startLatch = new CountDownLatch(1);

		try {
			List<Future<TypeMapping<?>>> futures = new ArrayList<>(threadCount);

			for (int i = 0; i < threadCount; i++) {
				futures.add(executorService.submit(() -> {
					startLatch.await();
					return typeMappingSource.findMapping(long[].class).orElseThrow();
				}));
			}

			startLatch.countDown();

			TypeMapping<?> first = futures.get(0).get(10, TimeUnit.SECONDS);

			for (Future<TypeMapping<?>> future : futures)
				Assertions.assertSame(first, future.get(10, TimeUnit.SECONDS), "Every thread should see the same mapping");

			long[] values = {1L, 2L};
			ArrayTypeMapping<?> mapping = (ArrayTypeMapping<?>) first;
			Assertions.assertEquals("ARRAY[1,2]::bigint[]", mapping.generateSqlLiteral(values));
		} finally {
			executorService.shutdownNow();
		}
	}

	static class Holder {
		List<String> strings;
		Set<Integer> integerSet;
	}
}
