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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.jvcl.coverage.CoverageRegistry;

/**
 * Root of a parsed VCL file: the list of its root declarations.
 */
public final class VclProgram {

	private final List<Statement> declarations;
	private CoverageRegistry coverage;

	public VclProgram(List<Statement> declarations) {
		this.declarations = new ArrayList<>(declarations);
	}

	/**
	 * @return the root declarations, in source order
	 */
	public List<Statement> getDeclarations() {
		return declarations;
	}

	/**
	 * @param name name of a subroutine, like <code>vcl_recv</code>
	 * @return the declaration of that subroutine, or <code>null</code>
	 */
	public Statement.SubroutineDeclaration getSubroutine(String name) {
		for (Statement declaration : declarations) {
			if (declaration instanceof Statement.SubroutineDeclaration) {
				Statement.SubroutineDeclaration sub = (Statement.SubroutineDeclaration) declaration;
				if (sub.getName().equals(name)) {
					return sub;
				}
			}
		}
		return null;
	}

	/**
	 * @return the registry of the coverage markers added to this program,
	 *         or <code>null</code> when it has not been instrumented
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "the registry is shared on purpose")
	public synchronized CoverageRegistry getCoverage() {
		return coverage;
	}

	/**
	 * Records that coverage markers were added to this program. A program
	 * is instrumented once.
	 *
	 * @param coverage registry of the markers
	 * @throws IllegalStateException when the program is already instrumented
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "the registry is shared on purpose")
	public synchronized void setCoverage(CoverageRegistry coverage) {
		if (this.coverage != null) {
			throw new IllegalStateException("Program is already instrumented");
		}
		this.coverage = coverage;
	}
}
