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

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a syntax tree as VCL text, two spaces per indentation level.
 * Used to dump trees, in particular the trees rewritten by the coverage
 * instrumentation.
 */
public final class VclFormatter implements Statement.Visitor<Void>, Expression.Visitor<String> {

	private static final String INDENT = "  ";

	private final StringBuilder out = new StringBuilder();
	private int level;

	private VclFormatter() {}

	/**
	 * @param program the program to render
	 * @return its text, root declarations separated by an empty line
	 */
	public static String format(VclProgram program) {
		VclFormatter formatter = new VclFormatter();
		boolean first = true;
		for (Statement declaration : program.getDeclarations()) {
			if (!first) {
				formatter.out.append('\n');
			}
			declaration.accept(formatter);
			first = false;
		}
		return formatter.out.toString();
	}

	/**
	 * @param statements the statements to render, one per line
	 * @return their text
	 */
	public static String format(List<Statement> statements) {
		VclFormatter formatter = new VclFormatter();
		formatter.statements(statements);
		return formatter.out.toString();
	}

	/**
	 * @param node any node of the tree
	 * @return its text; an expression is rendered without a trailing new line
	 */
	public static String format(AstNode node) {
		VclFormatter formatter = new VclFormatter();
		if (node instanceof Statement) {
			((Statement) node).accept(formatter);
		} else if (node instanceof Expression) {
			return ((Expression) node).accept(formatter);
		} else if (node instanceof CaseStatement) {
			formatter.caseClause((CaseStatement) node);
		} else if (node instanceof ElseStatement) {
			formatter.line("else {");
			formatter.block(((ElseStatement) node).getConsequence());
			formatter.line("}");
		} else {
			throw new IllegalArgumentException("Unsupported node " + node);
		}
		return formatter.out.toString();
	}

	private void line(String text) {
		for (int i = 0; i < level; i++) {
			out.append(INDENT);
		}
		out.append(text).append('\n');
	}

	private void statements(List<Statement> statements) {
		for (Statement statement : statements) {
			statement.accept(this);
		}
	}

	private void block(Statement.BlockStatement block) {
		level++;
		statements(block.getStatements());
		level--;
	}

	private String expr(Expression expression) {
		return expression.accept(this);
	}

	private void caseClause(CaseStatement clause) {
		if (clause.isDefault()) {
			line("default:");
		} else {
			line("case " + (clause.isRegex() ? "~ " : "") + expr(clause.getTest()) + ":");
		}
		level++;
		statements(clause.getStatements());
		level--;
	}

	@Override
	public Void visitSubroutineDeclaration(Statement.SubroutineDeclaration stmt) {
		line("sub " + stmt.getName() + " {");
		block(stmt.getBlock());
		line("}");
		return null;
	}

	@Override
	public Void visitTableDeclaration(Statement.TableDeclaration stmt) {
		line("table " + stmt.getName() + " {");
		level++;
		for (Map.Entry<String, String> entry : stmt.getEntries().entrySet()) {
			line(quote(entry.getKey()) + ": " + quote(entry.getValue()) + ",");
		}
		level--;
		line("}");
		return null;
	}

	@Override
	public Void visitBlockStatement(Statement.BlockStatement stmt) {
		line("{");
		block(stmt);
		line("}");
		return null;
	}

	@Override
	public Void visitIfStatement(Statement.IfStatement stmt) {
		line(stmt.getKeyword() + " (" + expr(stmt.getCondition()) + ") {");
		block(stmt.getConsequence());
		for (Statement.IfStatement another : stmt.getAnother()) {
			line("} " + another.getKeyword() + " (" + expr(another.getCondition()) + ") {");
			block(another.getConsequence());
		}
		if (stmt.getAlternative() != null) {
			line("} else {");
			block(stmt.getAlternative().getConsequence());
		}
		line("}");
		return null;
	}

	@Override
	public Void visitSwitchStatement(Statement.SwitchStatement stmt) {
		line("switch (" + expr(stmt.getControl()) + ") {");
		for (CaseStatement clause : stmt.getCases()) {
			caseClause(clause);
		}
		line("}");
		return null;
	}

	@Override
	public Void visitFunctionCallStatement(Statement.FunctionCallStatement stmt) {
		line(stmt.getFunction().getValue() + "(" + arguments(stmt.getArguments()) + ");");
		return null;
	}

	@Override
	public Void visitErrorStatement(Statement.ErrorStatement stmt) {
		StringBuilder text = new StringBuilder("error");
		if (stmt.getCode() != null) {
			text.append(' ').append(expr(stmt.getCode()));
		}
		if (stmt.getArgument() != null) {
			text.append(' ').append(expr(stmt.getArgument()));
		}
		line(text.append(';').toString());
		return null;
	}

	@Override
	public Void visitReturnStatement(Statement.ReturnStatement stmt) {
		if (stmt.getReturnExpression() == null) {
			line("return;");
		} else {
			line("return(" + expr(stmt.getReturnExpression()) + ");");
		}
		return null;
	}

	@Override
	public Void visitSetStatement(Statement.SetStatement stmt) {
		line("set " + stmt.getIdent().getValue() + " " + stmt.getOperator() + " " + expr(stmt.getValue()) + ";");
		return null;
	}

	@Override
	public Void visitAddStatement(Statement.AddStatement stmt) {
		line("add " + stmt.getIdent().getValue() + " = " + expr(stmt.getValue()) + ";");
		return null;
	}

	@Override
	public Void visitLogStatement(Statement.LogStatement stmt) {
		line("log " + expr(stmt.getValue()) + ";");
		return null;
	}

	@Override
	public Void visitSyntheticStatement(Statement.SyntheticStatement stmt) {
		line("synthetic " + expr(stmt.getValue()) + ";");
		return null;
	}

	@Override
	public Void visitSyntheticBase64Statement(Statement.SyntheticBase64Statement stmt) {
		line("synthetic.base64 " + expr(stmt.getValue()) + ";");
		return null;
	}

	@Override
	public Void visitEsiStatement(Statement.EsiStatement stmt) {
		line("esi;");
		return null;
	}

	@Override
	public Void visitRestartStatement(Statement.RestartStatement stmt) {
		line("restart;");
		return null;
	}

	@Override
	public Void visitDeclareStatement(Statement.DeclareStatement stmt) {
		line("declare local " + stmt.getName().getValue() + " " + stmt.getValueType() + ";");
		return null;
	}

	@Override
	public Void visitUnsetStatement(Statement.UnsetStatement stmt) {
		line("unset " + stmt.getIdent().getValue() + ";");
		return null;
	}

	@Override
	public Void visitRemoveStatement(Statement.RemoveStatement stmt) {
		line("remove " + stmt.getIdent().getValue() + ";");
		return null;
	}

	@Override
	public Void visitBreakStatement(Statement.BreakStatement stmt) {
		line("break;");
		return null;
	}

	@Override
	public Void visitFallthroughStatement(Statement.FallthroughStatement stmt) {
		line("fallthrough;");
		return null;
	}

	@Override
	public Void visitGotoStatement(Statement.GotoStatement stmt) {
		line("goto " + stmt.getDestination().getValue() + ";");
		return null;
	}

	@Override
	public Void visitGotoDestinationStatement(Statement.GotoDestinationStatement stmt) {
		line(stmt.getName() + ":");
		return null;
	}

	@Override
	public Void visitIncludeStatement(Statement.IncludeStatement stmt) {
		line("include " + quote(stmt.getModule()) + ";");
		return null;
	}

	@Override
	public Void visitCallStatement(Statement.CallStatement stmt) {
		line("call " + stmt.getSubroutine().getValue() + ";");
		return null;
	}

	private String arguments(List<Expression> arguments) {
		return arguments.stream().map(this::expr).collect(Collectors.joining(", "));
	}

	private static String quote(String value) {
		return "\"" + value + "\"";
	}

	@Override
	public String visitFunctionCallExpression(Expression.FunctionCallExpression expr) {
		return expr.getFunction().getValue() + "(" + arguments(expr.getArguments()) + ")";
	}

	@Override
	public String visitGroupedExpression(Expression.GroupedExpression expr) {
		return "(" + expr(expr.getRight()) + ")";
	}

	@Override
	public String visitInfixExpression(Expression.InfixExpression expr) {
		return expr(expr.getLeft()) + " " + expr.getOperator() + " " + expr(expr.getRight());
	}

	@Override
	public String visitPostfixExpression(Expression.PostfixExpression expr) {
		return expr(expr.getLeft()) + expr.getOperator();
	}

	@Override
	public String visitPrefixExpression(Expression.PrefixExpression expr) {
		return expr.getOperator() + expr(expr.getRight());
	}

	@Override
	public String visitIfExpression(Expression.IfExpression expr) {
		return "if(" + expr(expr.getCondition()) + ", " + expr(expr.getConsequence()) + ", "
				+ expr(expr.getAlternative()) + ")";
	}

	@Override
	public String visitIdent(Expression.Ident expr) {
		return expr.getValue();
	}

	@Override
	public String visitStringLiteral(Expression.StringLiteral expr) {
		return quote(expr.getValue());
	}

	@Override
	public String visitIntegerLiteral(Expression.IntegerLiteral expr) {
		return Long.toString(expr.getValue());
	}

	@Override
	public String visitBooleanLiteral(Expression.BooleanLiteral expr) {
		return Boolean.toString(expr.getValue());
	}
}
