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
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.metricshub.jvcl.frontend.ast.ElseStatement;
import org.metricshub.jvcl.frontend.ast.SourcePosition;
import org.metricshub.jvcl.frontend.ast.Statement;
import org.metricshub.jvcl.frontend.ast.Statement.IfStatement;
import org.metricshub.jvcl.jrt.VclSystemException;

/**
 * Puts branch markers into an if statement, turning its else-if clauses
 * into nested if statements so that each clause can be covered.
 * <p>
 * Before:
 *
 * <pre>
 * if (condition01) {
 *   consequence01...
 * } else if (condition02) {
 *   consequence02...
 * } else {
 *   alternative...
 * }
 * </pre>
 *
 * After:
 *
 * <pre>
 * if (condition01) {
 *   coverage.branch("branch_L1_C1_1");
 *   consequence01...
 * } else {
 *   coverage.branch("branch_L1_C1_2");
 *   if (condition02) {
 *     coverage.branch("branch_L2_C2_1");
 *     consequence02...
 *   } else {
 *     coverage.branch("branch_L1_C1_3");
 *     alternative...
 *   }
 * }
 * </pre>
 *
 * Branches are numbered from 1 in source order, on the position of the
 * first <code>if</code>. Each else-if clause also gets its own branch 1.
 * Conditions are evaluated in the same order as before.
 */
final class IfChainRewriter {

	private final Instrumenter instrumenter;
	private final MarkerFactory markers;

	IfChainRewriter(Instrumenter instrumenter, MarkerFactory markers) {
		this.instrumenter = instrumenter;
		this.markers = markers;
	}

	/**
	 * Rewrites the specified if statement in place.
	 *
	 * @param stmt the first if of the chain
	 */
	void rewrite(IfStatement stmt) {
		Set<IfStatement> transferred = Collections.newSetFromMap(new IdentityHashMap<>());
		transferred.add(stmt);
		rewrite(stmt, transferred);
	}

	private void rewrite(IfStatement stmt, Set<IfStatement> transferred) {
		int branch = 1;

		prepend(stmt.getConsequence(), branchMarker(stmt, branch));

		// the trailing else belongs to the whole chain, it moves to the last clause
		ElseStatement alternative = stmt.getAlternative();

		IfStatement tail = stmt;
		for (IfStatement another : stmt.getAnother()) {
			if (!transferred.add(another)) {
				throw new VclSystemException(
						another.getPosition(),
						"else-if clause is referenced more than once in the tree");
			}
			if (another.getAlternative() != null || !another.getAnother().isEmpty()) {
				throw new VclSystemException(
						another.getPosition(),
						"else-if clause must not have its own else-if or else clauses");
			}
			branch++;
			another.setKeyword("if");
			rewrite(another, transferred);
			Statement.BlockStatement nest = new Statement.BlockStatement(
					SourcePosition.SYNTHETIC,
					Arrays.asList(branchMarker(stmt, branch), another));
			tail.setAlternative(new ElseStatement(SourcePosition.SYNTHETIC, nest));
			tail = another;
		}
		stmt.setAnother(new ArrayList<>());

		if (alternative != null) {
			branch++;
			prepend(alternative.getConsequence(), branchMarker(stmt, branch));
			tail.setAlternative(alternative);
		}
	}

	private Statement branchMarker(IfStatement stmt, int branch) {
		return markers.createMarker(CoverageType.BRANCH, stmt, String.valueOf(branch));
	}

	private void prepend(Statement.BlockStatement block, Statement marker) {
		List<Statement> statements = new ArrayList<>();
		statements.add(marker);
		statements.addAll(instrumenter.instrumentStatements(block.getStatements()));
		block.setStatements(statements);
	}
}
