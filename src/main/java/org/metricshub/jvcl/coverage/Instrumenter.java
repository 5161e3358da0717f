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
import java.util.Objects;
import org.metricshub.jvcl.frontend.ast.Expression;
import org.metricshub.jvcl.frontend.ast.Statement;
import org.metricshub.jvcl.frontend.ast.VclFormatter;
import org.metricshub.jvcl.frontend.ast.VclProgram;
import org.metricshub.jvcl.jrt.VclRuntimeException;
import org.metricshub.jvcl.jrt.VclSystemException;
import org.metricshub.jvcl.util.JvclLogger;
import org.slf4j.Logger;

/**
 * Adds coverage markers to a VCL program.
 * <p>
 * The tree is rewritten in place, once, before it is interpreted. Every
 * subroutine starts with a subroutine marker, statements are preceded by
 * a statement marker, and each clause of if and switch statements starts
 * with branch markers. Every marker is registered in the
 * {@link CoverageRegistry} given at construction time, which the
 * interpreter then updates as markers are executed.
 * <p>
 * Root declarations other than subroutines (tables, backends, ...) are
 * left untouched.
 */
public final class Instrumenter {

	private static final Logger LOGGER = JvclLogger.getLogger(Instrumenter.class);

	private final CoverageRegistry registry;
	private final MarkerFactory markers;
	private final ExpressionInstrumenter expressions;
	private final IfChainRewriter ifChains;
	private final SwitchRewriter switches;
	private final StatementDispatcher dispatcher = new StatementDispatcher();

	/**
	 * @param registry where the coverage points are registered
	 */
	public Instrumenter(CoverageRegistry registry) {
		this.registry = Objects.requireNonNull(registry, "registry");
		this.markers = new MarkerFactory(registry);
		this.expressions = new ExpressionInstrumenter(markers);
		this.ifChains = new IfChainRewriter(this, markers);
		this.switches = new SwitchRewriter(this, markers);
	}

	/**
	 * Instruments all the subroutines of the program, and records the
	 * registry on the program.
	 *
	 * @param program the program to rewrite in place
	 * @throws VclSystemException when the program was already instrumented
	 */
	public void instrument(VclProgram program) {
		if (program.getCoverage() != null) {
			throw new VclSystemException("Program is already instrumented, its markers must not be instrumented again");
		}
		int subroutines = 0;
		for (Statement declaration : program.getDeclarations()) {
			if (declaration instanceof Statement.SubroutineDeclaration) {
				instrumentSubroutine((Statement.SubroutineDeclaration) declaration);
				subroutines++;
			}
		}
		LOGGER
				.debug(
						"Instrumented {} subroutine(s) with {} subroutine, {} statement and {} branch marker(s)",
						subroutines,
						markers.getCount(CoverageType.SUBROUTINE),
						markers.getCount(CoverageType.STATEMENT),
						markers.getCount(CoverageType.BRANCH));
		program.setCoverage(registry);
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Instrumented program:\n{}", VclFormatter.format(program));
		}
	}

	/**
	 * Puts the subroutine marker at the top of the subroutine, followed by
	 * its instrumented statements.
	 *
	 * @param sub the subroutine to rewrite in place
	 */
	public void instrumentSubroutine(Statement.SubroutineDeclaration sub) {
		List<Statement> statements = new ArrayList<>();
		statements.add(markers.createMarker(CoverageType.SUBROUTINE, sub));
		statements.addAll(instrumentStatements(sub.getBlock().getStatements()));
		sub.getBlock().setStatements(statements);
	}

	/**
	 * Returns the statements, each one preceded by the statements that
	 * record its coverage. The order of the original statements is kept.
	 *
	 * @param stmts the statements to instrument
	 * @return a new list with the original statements and the markers
	 */
	public List<Statement> instrumentStatements(List<Statement> stmts) {
		List<Statement> statements = new ArrayList<>();
		for (Statement stmt : stmts) {
			statements.addAll(instrumentStatement(stmt));
			statements.add(stmt);
		}
		return statements;
	}

	/**
	 * @param stmt a statement, rewritten in place when it has nested statements
	 * @return the statements to insert before it
	 */
	List<Statement> instrumentStatement(Statement stmt) {
		if (stmt == null) {
			throw new VclSystemException("Cannot instrument a null statement");
		}
		return stmt.accept(dispatcher);
	}

	private List<Statement> marker(Statement stmt) {
		List<Statement> statements = new ArrayList<>();
		statements.add(markers.createMarker(CoverageType.STATEMENT, stmt));
		return statements;
	}

	/**
	 * Decides, for each kind of statement, which markers go before it.
	 */
	private final class StatementDispatcher implements Statement.Visitor<List<Statement>> {

		@Override
		public List<Statement> visitSubroutineDeclaration(Statement.SubroutineDeclaration stmt) {
			throw new VclRuntimeException(stmt.getPosition(), "Subroutine " + stmt.getName() + " must be declared at the root");
		}

		@Override
		public List<Statement> visitTableDeclaration(Statement.TableDeclaration stmt) {
			throw new VclRuntimeException(stmt.getPosition(), "Table " + stmt.getName() + " must be declared at the root");
		}

		@Override
		public List<Statement> visitBlockStatement(Statement.BlockStatement stmt) {
			stmt.setStatements(instrumentStatements(stmt.getStatements()));
			return Collections.emptyList();
		}

		@Override
		public List<Statement> visitIfStatement(Statement.IfStatement stmt) {
			List<Statement> statements = marker(stmt);
			ifChains.rewrite(stmt);
			return statements;
		}

		@Override
		public List<Statement> visitSwitchStatement(Statement.SwitchStatement stmt) {
			List<Statement> statements = marker(stmt);
			switches.rewrite(stmt);
			return statements;
		}

		// A call statement gets no marker of its own, only its arguments are inspected.
		@Override
		public List<Statement> visitFunctionCallStatement(Statement.FunctionCallStatement stmt) {
			List<Statement> statements = new ArrayList<>();
			for (Expression argument : stmt.getArguments()) {
				statements.addAll(expressions.instrument(argument));
			}
			return statements;
		}

		@Override
		public List<Statement> visitErrorStatement(Statement.ErrorStatement stmt) {
			List<Statement> statements = marker(stmt);
			statements.addAll(expressions.instrument(stmt.getCode()));
			statements.addAll(expressions.instrument(stmt.getArgument()));
			return statements;
		}

		@Override
		public List<Statement> visitReturnStatement(Statement.ReturnStatement stmt) {
			List<Statement> statements = marker(stmt);
			statements.addAll(expressions.instrument(stmt.getReturnExpression()));
			return statements;
		}

		@Override
		public List<Statement> visitSetStatement(Statement.SetStatement stmt) {
			List<Statement> statements = marker(stmt);
			statements.addAll(expressions.instrument(stmt.getValue()));
			return statements;
		}

		@Override
		public List<Statement> visitAddStatement(Statement.AddStatement stmt) {
			List<Statement> statements = marker(stmt);
			statements.addAll(expressions.instrument(stmt.getValue()));
			return statements;
		}

		@Override
		public List<Statement> visitLogStatement(Statement.LogStatement stmt) {
			List<Statement> statements = marker(stmt);
			statements.addAll(expressions.instrument(stmt.getValue()));
			return statements;
		}

		@Override
		public List<Statement> visitSyntheticStatement(Statement.SyntheticStatement stmt) {
			List<Statement> statements = marker(stmt);
			statements.addAll(expressions.instrument(stmt.getValue()));
			return statements;
		}

		@Override
		public List<Statement> visitSyntheticBase64Statement(Statement.SyntheticBase64Statement stmt) {
			List<Statement> statements = marker(stmt);
			statements.addAll(expressions.instrument(stmt.getValue()));
			return statements;
		}

		// statements without expression

		@Override
		public List<Statement> visitEsiStatement(Statement.EsiStatement stmt) {
			return marker(stmt);
		}

		@Override
		public List<Statement> visitRestartStatement(Statement.RestartStatement stmt) {
			return marker(stmt);
		}

		@Override
		public List<Statement> visitDeclareStatement(Statement.DeclareStatement stmt) {
			return marker(stmt);
		}

		@Override
		public List<Statement> visitUnsetStatement(Statement.UnsetStatement stmt) {
			return marker(stmt);
		}

		@Override
		public List<Statement> visitRemoveStatement(Statement.RemoveStatement stmt) {
			return marker(stmt);
		}

		@Override
		public List<Statement> visitBreakStatement(Statement.BreakStatement stmt) {
			return marker(stmt);
		}

		@Override
		public List<Statement> visitFallthroughStatement(Statement.FallthroughStatement stmt) {
			return marker(stmt);
		}

		@Override
		public List<Statement> visitGotoStatement(Statement.GotoStatement stmt) {
			return marker(stmt);
		}

		@Override
		public List<Statement> visitGotoDestinationStatement(Statement.GotoDestinationStatement stmt) {
			return marker(stmt);
		}

		@Override
		public List<Statement> visitIncludeStatement(Statement.IncludeStatement stmt) {
			return marker(stmt);
		}

		@Override
		public List<Statement> visitCallStatement(Statement.CallStatement stmt) {
			return marker(stmt);
		}
	}
}
