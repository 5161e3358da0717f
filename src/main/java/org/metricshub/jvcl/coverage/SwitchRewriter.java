package org.metricshub.jvcl.coverage;

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
import org.metricshub.jvcl.frontend.ast.CaseStatement;
import org.metricshub.jvcl.frontend.ast.Statement;
import org.metricshub.jvcl.frontend.ast.Statement.SwitchStatement;

/**
 * Puts branch markers at the top of each clause of a switch statement,
 * <code>default</code> included:
 *
 * <pre>
 * switch (test) {
 * case "1":
 *   coverage.branch("branch_L_C_1");
 *   coverage.branch("branch_L1_C1");
 *   case01_statements...
 * default:
 *   coverage.branch("branch_L_C_2");
 *   coverage.branch("branch_L2_C2");
 *   default_statements...
 * }
 * </pre>
 *
 * The first marker is numbered on the switch, the second one is keyed
 * on the clause itself.
 */
final class SwitchRewriter {

	private final Instrumenter instrumenter;
	private final MarkerFactory markers;

	SwitchRewriter(Instrumenter instrumenter, MarkerFactory markers) {
		this.instrumenter = instrumenter;
		this.markers = markers;
	}

	/**
	 * Rewrites the clauses of the specified switch statement in place.
	 *
	 * @param stmt the switch statement
	 */
	void rewrite(SwitchStatement stmt) {
		int branch = 1;
		for (CaseStatement clause : stmt.getCases()) {
			List<Statement> statements = new ArrayList<>();
			statements.add(markers.createMarker(CoverageType.BRANCH, stmt, String.valueOf(branch)));
			statements.add(markers.createMarker(CoverageType.BRANCH, clause));
			statements.addAll(instrumenter.instrumentStatements(clause.getStatements()));
			clause.setStatements(statements);
			branch++;
		}
	}
}
