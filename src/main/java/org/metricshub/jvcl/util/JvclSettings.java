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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;

/**
 * A simple container for the parameters of a single Jvcl run.
 * These values have defaults, which may be changed when invoking
 * Jvcl programmatically, from within Java code.
 */
public class JvclSettings {

	/**
	 * Whether subroutines are instrumented with coverage markers
	 * before they are processed;
	 * <code>true</code> by default.
	 */
	private boolean coverageEnabled = true;

	/**
	 * Maximum depth of nested <code>call</code> statements
	 * before the interpreter gives up.
	 */
	private int maxCallStackDepth = 100;

	/**
	 * Where the coverage report is printed;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("coverageEnabled = ").append(isCoverageEnabled()).append(newLine);
		desc.append("maxCallStackDepth = ").append(getMaxCallStackDepth()).append(newLine);

		return desc.toString();
	}

	/**
	 * @return whether coverage instrumentation is enabled
	 */
	public boolean isCoverageEnabled() {
		return coverageEnabled;
	}

	/**
	 * @param coverageEnabled whether coverage instrumentation is enabled
	 */
	public void setCoverageEnabled(boolean coverageEnabled) {
		this.coverageEnabled = coverageEnabled;
	}

	/**
	 * @return the maximum number of nested subroutine calls
	 */
	public int getMaxCallStackDepth() {
		return maxCallStackDepth;
	}

	/**
	 * @param maxCallStackDepth the maximum number of nested subroutine calls,
	 *        must be positive
	 */
	public void setMaxCallStackDepth(int maxCallStackDepth) {
		if (maxCallStackDepth <= 0) {
			throw new IllegalArgumentException("maxCallStackDepth must be positive: " + maxCallStackDepth);
		}
		this.maxCallStackDepth = maxCallStackDepth;
	}

	/**
	 * Where the coverage report is printed.
	 *
	 * @return the output stream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "the stream is shared on purpose")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * @param outputStream where the coverage report is printed
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "the stream is shared on purpose")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}
}
