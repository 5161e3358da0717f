package org.metricshub.jvcl.ext;

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
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import org.metricshub.jvcl.jrt.TestingException;
import org.metricshub.jvcl.jrt.VclContext;
import org.metricshub.jvcl.jrt.VclValues;

/**
 * <code>testing.fixed_time(value)</code>: freezes the clock of the
 * request, for tests whose result depends on the current time.
 * <p>
 * The value is an INTEGER (Unix time in seconds), a TIME, or a STRING
 * formatted as <code>yyyy-MM-dd HH:mm:ss</code> (UTC).
 */
public final class TestingFixedTimeFunction extends BuiltinFunction {

	public static final String NAME = "testing.fixed_time";

	static final DateTimeFormatter EXPECTED_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	public TestingFixedTimeFunction() {
		super(NAME, 1);
	}

	@Override
	public void validate(Object[] args) {
		int argCount = args == null ? 0 : args.length;
		if (argCount != getArity()) {
			throw new TestingException(
					NAME + " function requires " + getArity() + " argument(s) but " + argCount + " provided");
		}
	}

	@Override
	protected Object invoke(VclContext context, Object[] args) {
		Object value = args[0];
		if (value instanceof Long) {
			context.setFixedTime(Instant.ofEpochSecond(((Long) value).longValue()));
		} else if (value instanceof Instant) {
			context.setFixedTime((Instant) value);
		} else if (value instanceof String) {
			try {
				LocalDateTime fixed = LocalDateTime.parse((String) value, EXPECTED_TIME_FORMAT);
				context.setFixedTime(fixed.toInstant(ZoneOffset.UTC));
			} catch (DateTimeParseException e) {
				throw new TestingException("Invalid time format: " + e.getMessage(), e);
			}
		} else {
			throw new TestingException(
					"First argument of " + NAME + " must be INTEGER or TIME or STRING type, "
							+ VclValues.typeName(value) + " provided");
		}
		return null;
	}
}
