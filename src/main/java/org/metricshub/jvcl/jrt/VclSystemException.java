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

import org.metricshub.jvcl.frontend.ast.SourcePosition;

/**
 * A problem in Jvcl itself, typically a broken invariant of the
 * instrumentation pass. It never results from a mistake in the VCL
 * program, and it is always fatal.
 */
public class VclSystemException extends VclException {

	private static final long serialVersionUID = 1L;

	public VclSystemException(String msg) {
		super(ExceptionType.SYSTEM, null, msg);
	}

	public VclSystemException(SourcePosition position, String msg) {
		super(ExceptionType.SYSTEM, position, msg);
	}

	@Override
	public String getMessage() {
		return super.getMessage()
				+ "\n\nThis exception is caused by jvcl interpreter."
				+ "\nIt maybe a bug, please report it.";
	}
}
