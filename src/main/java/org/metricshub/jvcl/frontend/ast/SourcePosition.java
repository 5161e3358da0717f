package org.metricshub.jvcl.frontend.ast;

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

import java.util.Objects;

/**
 * Location of a node in the VCL source: file, line and column, all
 * as reported by the parser. Lines and columns start at 1.
 */
public final class SourcePosition {

	/**
	 * Position of the nodes that do not come from the source,
	 * like coverage markers.
	 */
	public static final SourcePosition SYNTHETIC = new SourcePosition("", 0, 0);

	private final String file;
	private final int line;
	private final int column;

	public SourcePosition(String file, int line, int column) {
		this.file = file == null ? "" : file;
		this.line = line;
		this.column = column;
	}

	public String getFile() {
		return file;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public boolean isSynthetic() {
		return line == 0 && column == 0;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SourcePosition)) {
			return false;
		}
		SourcePosition other = (SourcePosition) o;
		return line == other.line && column == other.column && file.equals(other.file);
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, line, column);
	}

	@Override
	public String toString() {
		return (file.isEmpty() ? "" : file + ":") + line + ":" + column;
	}
}
