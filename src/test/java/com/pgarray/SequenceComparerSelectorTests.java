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

import com.pgarray.SequenceComparer.Strategy;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * @since 1.0.0
 */
public class SequenceComparerSelectorTests {
	@Test
	public void testIntegerElementsSelectSelfEquatable() {
		ArrayTypeMapping<Integer[]> mapping = ArrayTypeMapping.create(StandardTypeMappings.integer(), Integer[].class);
		SequenceComparer<Integer[]> comparer = mapping.getRequiredComparer();

		Assertions.assertEquals(Strategy.SELF_EQUATABLE, comparer.getStrategy(), "Integer has its own equals");
		Assertions.assertTrue(comparer.areEqual(new Integer[]{1, 2, 3}, new Integer[]{1, 2, 3}));
		Assertions.assertFalse(comparer.areEqual(new Integer[]{1, 2}, new Integer[]{1, 2, 3}));
	}

	@Test
	public void testPrimitiveElementsSelectSelfEquatable() {
		ArrayTypeMapping<int[]> mapping = ArrayTypeMapping.create(StandardTypeMappings.integer(), int[].class);
		SequenceComparer<int[]> comparer = mapping.getRequiredComparer();

		Assertions.assertEquals(Strategy.SELF_EQUATABLE, comparer.getStrategy());
		Assertions.assertEquals(int.class, comparer.getElementType());
		Assertions.assertEquals(int[].class, comparer.getType());
		Assertions.assertTrue(comparer.areEqual(new int[]{1, 2, 3}, new int[]{1, 2, 3}));
		Assertions.assertFalse(comparer.areEqual(new int[]{1, 2, 3}, new int[]{1, 2, 4}));
	}

	@Test
	public void testElementComparerSelectsDelegating() {
		ArrayTypeMapping<BigDecimal[]> mapping = ArrayTypeMapping.create(StandardTypeMappings.numeric(), BigDecimal[].class);
		SequenceComparer<BigDecimal[]> comparer = mapping.getRequiredComparer();

		Assertions.assertEquals(Strategy.DELEGATING, comparer.getStrategy(), "numeric supplies its own comparer");
		Assertions.assertSame(StandardTypeMappings.numeric().getComparer().orElseThrow(),
				((SequenceComparer.Delegating<?, ?>) comparer).getElementComparer());

		// BigDecimal.equals would say these differ; the element comparer ignores trailing zeros
		Assertions.assertTrue(comparer.areEqual(new BigDecimal[]{new BigDecimal("1.00")}, new BigDecimal[]{new BigDecimal("1.0")}));
		Assertions.assertFalse(comparer.areEqual(new BigDecimal[]{new BigDecimal("1.00")}, new BigDecimal[]{new BigDecimal("1.01")}));
	}

	@Test
	public void testElementComparerTakesPrecedenceOverOwnEquals() {
		ScalarTypeMapping<String> caseInsensitiveText = ScalarTypeMapping.withStoreType("citext", String.class)
				.comparer(ValueComparer.of(String.class, String::equalsIgnoreCase, value -> value.toLowerCase(Locale.ROOT).hashCode(), value -> value))
				.build();

		SequenceComparer<String[]> comparer = ArrayTypeMapping.create(caseInsensitiveText, String[].class).getRequiredComparer();

		Assertions.assertEquals(Strategy.DELEGATING, comparer.getStrategy());
		Assertions.assertTrue(comparer.areEqual(new String[]{"Hello"}, new String[]{"HELLO"}));
		Assertions.assertEquals(comparer.hash(new String[]{"Hello"}), comparer.hash(new String[]{"HELLO"}));
	}

	@Test
	public void testPlainReferenceElementsSelectFallbackEquals() {
		ScalarTypeMapping<Widget> widgetMapping = ScalarTypeMapping.withStoreType("widget", Widget.class).build();
		SequenceComparer<Widget[]> comparer = ArrayTypeMapping.create(widgetMapping, Widget[].class).getRequiredComparer();
		Widget widget = new Widget("x");

		Assertions.assertEquals(Strategy.FALLBACK_EQUALS, comparer.getStrategy(), "Widget inherits identity equality");
		Assertions.assertTrue(comparer.areEqual(new Widget[]{null, widget}, new Widget[]{null, widget}));
		Assertions.assertFalse(comparer.areEqual(new Widget[]{widget, null}, new Widget[]{null, widget}));
		Assertions.assertFalse(comparer.areEqual(new Widget[]{widget}, new Widget[]{new Widget("x")}), "Distinct widgets are unequal under identity equality");
	}

	@Test
	public void testInterfaceElementsSelectFallbackEquals() {
		ScalarTypeMapping<CharSequence> mapping = ScalarTypeMapping.withStoreType("text", CharSequence.class).build();
		SequenceComparer<CharSequence[]> comparer = ArrayTypeMapping.create(mapping, CharSequence[].class).getRequiredComparer();

		Assertions.assertEquals(Strategy.FALLBACK_EQUALS, comparer.getStrategy());
		Assertions.assertTrue(comparer.areEqual(new CharSequence[]{"a", null}, new CharSequence[]{"a", null}));
	}

	@Test
	public void testRecordElementsSelectSelfEquatable() {
		ScalarTypeMapping<Point> pointMapping = ScalarTypeMapping.withStoreType("point", Point.class).build();
		SequenceComparer<Point[]> comparer = ArrayTypeMapping.create(pointMapping, Point[].class).getRequiredComparer();

		Assertions.assertEquals(Strategy.SELF_EQUATABLE, comparer.getStrategy());
		Assertions.assertTrue(comparer.areEqual(new Point[]{new Point(1, 2), null}, new Point[]{new Point(1, 2), null}));
		Assertions.assertFalse(comparer.areEqual(new Point[]{new Point(1, 2)}, new Point[]{null}));
	}

	@Test
	public void testMultiDimensionalArrayHasNoComparer() {
		Optional<SequenceComparer<?>> comparer = SequenceComparerSelector.select(StandardTypeMappings.integer(), Integer[][].class);
		Assertions.assertTrue(comparer.isEmpty(), "Rank 2 must not produce a comparer");
	}

	@Test
	public void testSelectForReflectiveListType() throws Exception {
		Type listType = Holder.class.getDeclaredField("names").getGenericType();
		SequenceComparer<?> comparer = SequenceComparerSelector.select(StandardTypeMappings.text(), listType).orElseThrow();

		Assertions.assertEquals(Strategy.SELF_EQUATABLE, comparer.getStrategy());
		Assertions.assertEquals(List.class, comparer.getType());
		Assertions.assertEquals(String.class, comparer.getElementType());
	}

	@Test
	public void testComparerIsBoundOnce() {
		ArrayTypeMapping<Integer[]> mapping = ArrayTypeMapping.create(StandardTypeMappings.integer(), Integer[].class);

		Assertions.assertSame(mapping.getComparer().orElseThrow(), mapping.getComparer().orElseThrow());
		Assertions.assertSame(mapping.getRequiredComparer(), mapping.getComparer().orElseThrow());
	}

	@Test
	public void testDeclaresValueEquality() {
		Assertions.assertTrue(SequenceComparerSelector.declaresValueEquality(int.class));
		Assertions.assertTrue(SequenceComparerSelector.declaresValueEquality(Integer.class));
		Assertions.assertTrue(SequenceComparerSelector.declaresValueEquality(String.class));
		Assertions.assertTrue(SequenceComparerSelector.declaresValueEquality(Point.class));
		Assertions.assertTrue(SequenceComparerSelector.declaresValueEquality(Color.class), "Enum declares equals");
		Assertions.assertTrue(SequenceComparerSelector.declaresValueEquality(NamedThing.class), "Inherited from a superclass other than Object");
		Assertions.assertFalse(SequenceComparerSelector.declaresValueEquality(Object.class));
		Assertions.assertFalse(SequenceComparerSelector.declaresValueEquality(Widget.class));
		Assertions.assertFalse(SequenceComparerSelector.declaresValueEquality(CharSequence.class));
		Assertions.assertFalse(SequenceComparerSelector.declaresValueEquality(byte[].class));
	}

	static class Widget {
		private final String name;

		Widget(String name) {
			this.name = name;
		}

		String getName() {
			return name;
		}
	}

	record Point(int x, int y) {}

	enum Color {
		RED,
		GREEN
	}

	static class Named {
		private final String name;

		Named(String name) {
			this.name = name;
		}

		@Override
		public boolean equals(Object object) {
			return object instanceof Named named && named.name.equals(name);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}
	}

	static class NamedThing extends Named {
		NamedThing(String name) {
			super(name);
		}
	}

	static class Holder {
		List<String> names;
	}
}
