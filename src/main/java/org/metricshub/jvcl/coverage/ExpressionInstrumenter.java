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
import java.util.Collections;
import java.util.List;
import org.metricshub.jvcl.frontend.ast.ElseStatement;
import org.metricshub.jvcl.frontend.ast.Expression;
import org.metricshub.jvcl.frontend.ast.SourcePosition;
import org.metricshub.jvcl.frontend.ast.Statement;

/**
 * Looks for inline <code>if(cond, a, b)</code> expressions and produces
 * the statements that record which way they went.
 * <p>
 * The expression itself is left untouched. For each inline conditional
 * found, a synthetic if statement testing the same condition is returned,
 * to be inserted before the statement holding the expression:
 *
 * <pre>
 * if (cond) {
 *   coverage.branch("branch_L_C_true");
 * } else {
 *   coverage.branch("branch_L_C_false");
 * }
 * </pre>
 *
 * The condition is therefore evaluated twice at runtime.
 * <p>
 * The synthetic if statement does not own its condition: it holds the very
 * node of the inline conditional. Nothing modifies expression nodes once
 * parsed (the instrumentation only rewrites statement lists), so sharing
 * the node is safe, and the condition stays at its source position in the
 * original expression.
 */
final class ExpressionInstrumenter implements Expression.Visitor<List<Statement>> {

	private final MarkerFactory markers;

	ExpressionInstrumenter(MarkerFactory markers) {
		this.markers = markers;
	}

	/**
	 * @param expr expression to inspect, may be <code>null</code>
	 * @return the statements to insert before the statement holding the expression
	 */
	List<Statement> instrument(Expression expr) {
		if (expr == null) {
			return Collections.emptyList();
		}
		return expr.accept(this);
	}

	@Override
	public List<Statement> visitFunctionCallExpression(Expression.FunctionCallExpression expr) {
		List<Statement> statements = new ArrayList<>();
		for (Expression argument : expr.getArguments()) {
			statements.addAll(instrument(argument));
		}
		return statements;
	}

	@Override
	public List<Statement> visitGroupedExpression(Expression.GroupedExpression expr) {
		return instrument(expr.getRight());
	}

	@Override
	public List<Statement> visitInfixExpression(Expression.InfixExpression expr) {
		List<Statement> statements = new ArrayList<>(instrument(expr.getLeft()));
		statements.addAll(instrument(expr.getRight()));
		return statements;
	}

	@Override
	public List<Statement> visitPostfixExpression(Expression.PostfixExpression expr) {
		return instrument(expr.getLeft());
	}

	@Override
	public List<Statement> visitPrefixExpression(Expression.PrefixExpression expr) {
		return instrument(expr.getRight());
	}

	@Override
	public List<Statement> visitIfExpression(Expression.IfExpression expr) {
		// The condition is always evaluated, the arms are not: only the
		// condition can be checked ahead of the statement.
		List<Statement> statements = new ArrayList<>(instrument(expr.getCondition()));

		Statement.BlockStatement whenTrue = new Statement.BlockStatement(
				SourcePosition.SYNTHETIC,
				Collections.singletonList(markers.createMarker(CoverageType.BRANCH, expr, "true")));
		Statement.BlockStatement whenFalse = new Statement.BlockStatement(
				SourcePosition.SYNTHETIC,
				Collections.singletonList(markers.createMarker(CoverageType.BRANCH, expr, "false")));

		// shared with the inline conditional, read-only
		statements
				.add(
						new Statement.IfStatement(
								SourcePosition.SYNTHETIC,
								"if",
								expr.getCondition(),
								whenTrue,
								Collections.emptyList(),
								new ElseStatement(SourcePosition.SYNTHETIC, whenFalse)));
		return statements;
	}

	@Override
	public List<Statement> visitIdent(Expression.Ident expr) {
		return Collections.emptyList();
	}

	@Override
	public List<Statement> visitStringLiteral(Expression.StringLiteral expr) {
		return Collections.emptyList();
	}

	@Override
	public List<Statement> visitIntegerLiteral(Expression.IntegerLiteral expr) {
		return Collections.emptyList();
	}

	@Override
	public List<Statement> visitBooleanLiteral(Expression.BooleanLiteral expr) {
		return Collections.emptyList();
	}
}
