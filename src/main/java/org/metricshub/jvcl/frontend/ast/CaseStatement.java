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

import java.util.ArrayList;
import java.util.List;

/**
 * A <code>case</code> (or <code>default</code>) clause of a switch statement.
 */
public final class CaseStatement extends AstNode {

	private final Expression test;
	private final boolean regex;
	private List<Statement> statements;

	/**
	 * @param position where the clause starts
	 * @param test value matched against the switch control, <code>null</code> for <code>default</code>
	 * @param regex whether the test is a regular expression (<code>case ~ "..."</code>)
	 * @param statements body of the clause
	 */
	public CaseStatement(SourcePosition position, Expression test, boolean regex, List<Statement> statements) {
		super(position);
		this.test = test;
		this.regex = regex;
		this.statements = new ArrayList<>(statements);
	}

	public Expression getTest() {
		return test;
	}

	public boolean isRegex() {
		return regex;
	}

	public boolean isDefault() {
		return test == null;
	}

	public List<Statement> getStatements() {
		return statements;
	}

	public void setStatements(List<Statement> statements) {
		this.statements = statements;
	}
}
