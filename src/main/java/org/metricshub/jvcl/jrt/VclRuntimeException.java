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

import java.util.List;
import java.util.stream.Collectors;
import org.metricshub.jvcl.frontend.ast.SourcePosition;
import org.metricshub.jvcl.frontend.ast.Statement.SubroutineDeclaration;

/**
 * A problem caused by the VCL program itself: a misplaced declaration,
 * an unknown subroutine, a bad argument passed to a function, etc.
 */
public class VclRuntimeException extends VclException {

	private static final long serialVersionUID = 1L;

	public VclRuntimeException(String msg) {
		super(ExceptionType.RUNTIME, null, msg);
	}

	public VclRuntimeException(SourcePosition position, String msg) {
		super(ExceptionType.RUNTIME, position, msg);
	}

	public VclRuntimeException(SourcePosition position, String msg, Throwable cause) {
		super(ExceptionType.RUNTIME, position, msg, cause);
	}

	/**
	 * Builds the exception raised when nested <code>call</code> statements
	 * go deeper than allowed.
	 *
	 * @param position location of the <code>call</code> statement that overflowed
	 * @param stack subroutines currently on the call stack, outermost first
	 * @return the exception to throw
	 */
	public static VclRuntimeException maxCallStackExceeded(SourcePosition position, List<SubroutineDeclaration> stack) {
		String frames = stack
				.stream()
				.map(sub -> sub.getName() + " in " + sub.getPosition().getFile() + ":" + sub.getPosition().getLine())
				.collect(Collectors.joining("\n"));
		return new VclRuntimeException(position, "max call stack exceeded. Call stack:\n" + frames);
	}
}
