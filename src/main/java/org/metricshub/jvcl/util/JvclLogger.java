package org.metricshub.jvcl.util;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gives the SLF4J loggers of the instrumenter and the interpreter.
 * <p>
 * Instrumentation counts go to DEBUG, the rewritten program to TRACE, and
 * the <code>log</code> statements of the interpreted VCL to INFO. The
 * internal notices of SLF4J are kept at WARN.
 */
public final class JvclLogger {
	static {
		System.setProperty("slf4j.internal.verbosity", "WARN");
	}

	private JvclLogger() {
	}

	/**
	 * @param type class of the component that logs
	 * @return the logger named after that class
	 */
	public static Logger getLogger(Class<?> type) {
		return LoggerFactory.getLogger(type);
	}
}
