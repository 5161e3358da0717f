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

import java.io.PrintStream;

/**
 * A node of the syntax tree produced by the parser. Every node knows
 * where it comes from in the source.
 * <p>
 * Nodes are mutable: the coverage instrumentation rewrites the tree in
 * place before it is handed to the interpreter.
 */
public abstract class AstNode {

	private final SourcePosition position;

	protected AstNode(SourcePosition position) {
		this.position = position;
	}

	/**
	 * @return where this node starts in the source, may be <code>null</code>
	 *         for nodes built without position
	 */
	public SourcePosition getPosition() {
		return position;
	}

	/**
	 * Dump a VCL text representation of this node
	 * to the output (print) stream.
	 *
	 * @param ps The print stream to dump the text representation.
	 */
	public void dump(PrintStream ps) {
		ps.print(VclFormatter.format(this));
	}

	@Override
	public String toString() {
		return getClass().getName().replaceFirst(".*[$.]", "") + "@" + position;
	}
}
