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
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Stock PostgreSQL scalar mappings, suitable as element mappings for {@link ArrayTypeMapping} and {@link ListTypeMapping}.
 * <p>
 * Only {@code numeric} and {@code bytea} supply comparers: {@code numeric} so that {@code 1.0} and {@code 1.00} compare equal,
 * {@code bytea} so that {@code byte[]} values are compared by content and snapshotted by copy.
 * The other types rely on their Java type's own {@code equals}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class StandardTypeMappings {
	@NonNull
	private static final ScalarTypeMapping<Short> SMALLINT = ScalarTypeMapping.withStoreType("smallint", Short.class)
			.literalRenderer(Object::toString)
			.build();
	@NonNull
	private static final ScalarTypeMapping<Integer> INTEGER = ScalarTypeMapping.withStoreType("integer", Integer.class)
			.literalRenderer(Object::toString)
			.build();
	@NonNull
	private static final ScalarTypeMapping<Long> BIGINT = ScalarTypeMapping.withStoreType("bigint", Long.class)
			.literalRenderer(Object::toString)
			.build();
	@NonNull
	private static final ScalarTypeMapping<Float> REAL = ScalarTypeMapping.withStoreType("real", Float.class)
			.literalRenderer(value -> floatingPointLiteral(value.doubleValue(), Float.toString(value), "real"))
			.build();
	@NonNull
	private static final ScalarTypeMapping<Double> DOUBLE_PRECISION = ScalarTypeMapping.withStoreType("double precision", Double.class)
			.literalRenderer(value -> floatingPointLiteral(value, Double.toString(value), "double precision"))
			.build();
	@NonNull
	private static final ScalarTypeMapping<BigDecimal> NUMERIC = ScalarTypeMapping.withStoreType("numeric", BigDecimal.class)
			.literalRenderer(BigDecimal::toPlainString)
			.comparer(ValueComparer.of(BigDecimal.class,
					(left, right) -> left.compareTo(right) == 0,
					value -> value.stripTrailingZeros().hashCode(),
					value -> value))
			.build();
	@NonNull
	private static final ScalarTypeMapping<Boolean> BOOLEAN = ScalarTypeMapping.withStoreType("boolean", Boolean.class)
			.literalRenderer(value -> value ? "TRUE" : "FALSE")
			.build();
	@NonNull
	private static final ScalarTypeMapping<String> TEXT = ScalarTypeMapping.withStoreType("text", String.class)
			.literalRenderer(StandardTypeMappings::quote)
			.build();
	@NonNull
	private static final ScalarTypeMapping<UUID> UUID_MAPPING = ScalarTypeMapping.withStoreType("uuid", UUID.class)
			.literalRenderer(value -> format("%s::uuid", quote(value.toString())))
			.build();
	@NonNull
	private static final ScalarTypeMapping<byte[]> BYTEA = ScalarTypeMapping.withStoreType("bytea", byte[].class)
			.literalRenderer(value -> format("'\\x%s'::bytea", HexFormat.of().formatHex(value)))
			.comparer(ValueComparer.of(byte[].class, Arrays::equals, Arrays::hashCode, byte[]::clone))
			.build();
	@NonNull
	private static final ScalarTypeMapping<LocalDate> DATE = ScalarTypeMapping.withStoreType("date", LocalDate.class)
			.literalRenderer(value -> format("DATE %s", quote(value.toString())))
			.build();

	@NonNull
	private static final List<TypeMapping<?>> ALL = List.of(SMALLINT, INTEGER, BIGINT, REAL, DOUBLE_PRECISION, NUMERIC, BOOLEAN, TEXT,
			UUID_MAPPING, BYTEA, DATE);

	private StandardTypeMappings() {
		// Prevents instantiation
	}

	@NonNull
	public static ScalarTypeMapping<Short> smallint() {
		return SMALLINT;
	}

	@NonNull
	public static ScalarTypeMapping<Integer> integer() {
		return INTEGER;
	}

	@NonNull
	public static ScalarTypeMapping<Long> bigint() {
		return BIGINT;
	}

	@NonNull
	public static ScalarTypeMapping<Float> real() {
		return REAL;
	}

	@NonNull
	public static ScalarTypeMapping<Double> doublePrecision() {
		return DOUBLE_PRECISION;
	}

	/**
	 * The {@code numeric} mapping, whose comparer ignores trailing zeros ({@code 1.0} equals {@code 1.00}).
	 */
	@NonNull
	public static ScalarTypeMapping<BigDecimal> numeric() {
		return NUMERIC;
	}

	@NonNull
	public static ScalarTypeMapping<Boolean> bool() {
		return BOOLEAN;
	}

	@NonNull
	public static ScalarTypeMapping<String> text() {
		return TEXT;
	}

	@NonNull
	public static ScalarTypeMapping<UUID> uuid() {
		return UUID_MAPPING;
	}

	/**
	 * The {@code bytea} mapping, whose comparer compares {@code byte[]} contents and snapshots by copying.
	 */
	@NonNull
	public static ScalarTypeMapping<byte[]> bytea() {
		return BYTEA;
	}

	@NonNull
	public static ScalarTypeMapping<LocalDate> date() {
		return DATE;
	}

	/**
	 * Every stock mapping, in declaration order.
	 *
	 * @return the stock mappings
	 */
	@NonNull
	public static List<TypeMapping<?>> all() {
		return ALL;
	}

	/**
	 * Renders {@code string} as a single-quoted SQL string literal, doubling embedded quotes.
	 *
	 * @param string the string to quote
	 * @return the quoted literal
	 */
	@NonNull
	public static String quote(@NonNull String string) {
		requireNonNull(string);
		return format("'%s'", string.replace("'", "''"));
	}

	@NonNull
	private static String floatingPointLiteral(double value,
																						 @NonNull String finiteLiteral,
																						 @NonNull String storeType) {
		requireNonNull(finiteLiteral);
		requireNonNull(storeType);

		if (Double.isNaN(value))
			return format("'NaN'::%s", storeType);

		if (Double.isInfinite(value))
			return format("'%s'::%s", value > 0 ? "Infinity" : "-Infinity", storeType);

		return finiteLiteral;
	}
}
