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
 * Base class of the exceptions raised while instrumenting or
 * interpreting a VCL program. The message carries the category
 * and, when known, the location of the offending node.
 */
public abstract class VclException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final ExceptionType type;
	private final transient SourcePosition position;
	private final String reason;

	protected VclException(ExceptionType type, SourcePosition position, String reason) {
		super(reason);
		this.type = type;
		this.position = position;
		this.reason = reason;
	}

	protected VclException(ExceptionType type, SourcePosition position, String reason, Throwable cause) {
		super(reason, cause);
		this.type = type;
		this.position = position;
		this.reason = reason;
	}

	/**
	 * @return the category of this exception
	 */
	public ExceptionType getType() {
		return type;
	}

	/**
	 * @return the position of the offending node, or {@code null} if unavailable
	 */
	public SourcePosition getPosition() {
		return position;
	}

	/**
	 * @return the bare message, without category and location
	 */
	public String getReason() {
		return reason;
	}

	@Override
	public String getMessage() {
		StringBuilder out = new StringBuilder();
		out.append('[').append(type.getLabel()).append("] ").append(reason);
		if (position != null) {
			if (!position.getFile().isEmpty()) {
				out.append(" in ").append(position.getFile());
			}
			out.append(" at line: ").append(position.getLine());
			out.append(", position: ").append(position.getColumn());
		}
		return out.toString();
	}
}
