package org.metricshub.jvcl.jrt;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jvcl
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 - 2026 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.time.Instant;

/**
 * Conversions between the Java objects used as VCL values.
 * <p>
 * A VCL value is one of {@link String}, {@link Long}, {@link Boolean},
 * {@link Instant}, or <code>null</code> for a value that is not set.
 */
public final class VclValues {

	private VclValues() {}

	/**
	 * Returns the VCL type name of the specified value, as used in
	 * error messages.
	 *
	 * @param value a VCL value
	 * @return STRING, INTEGER, BOOL, TIME or NULL
	 */
	public static String typeName(Object value) {
		if (value == null) {
			return "NULL";
		} else if (value instanceof String) {
			return "STRING";
		} else if (value instanceof Long) {
			return "INTEGER";
		} else if (value instanceof Boolean) {
			return "BOOL";
		} else if (value instanceof Instant) {
			return "TIME";
		}
		throw new VclSystemException("Unexpected value class " + value.getClass().getName());
	}

	/**
	 * Truthiness of a value in a condition: a BOOL is itself, a
	 * STRING is true when set and not empty, an INTEGER when it
	 * is not 0. Any other value is false.
	 *
	 * @param value a VCL value
	 * @return the boolean interpretation of the value
	 */
	public static boolean toBoolean(Object value) {
		if (value instanceof Boolean) {
			return ((Boolean) value).booleanValue();
		}
		if (value instanceof String) {
			return !((String) value).isEmpty();
		}
		if (value instanceof Long) {
			return ((Long) value).longValue() != 0L;
		}
		return false;
	}

	/**
	 * String form of a value: a value that is not set is the empty
	 * string, a TIME is rendered in ISO-8601.
	 *
	 * @param value a VCL value
	 * @return the string representation of the value
	 */
	public static String toStr(Object value) {
		if (value == null) {
			return "";
		}
		return value.toString();
	}

	/**
	 * @param value a VCL value
	 * @return whether the value is an INTEGER
	 */
	public static boolean isInteger(Object value) {
		return value instanceof Long;
	}
}
