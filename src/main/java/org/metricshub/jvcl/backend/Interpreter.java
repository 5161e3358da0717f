package org.metricshub.jvcl.backend;

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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.metricshub.jvcl.ext.BuiltinFunction;
import org.metricshub.jvcl.ext.BuiltinRegistry;
import org.metricshub.jvcl.frontend.ast.CaseStatement;
import org.metricshub.jvcl.frontend.ast.Expression;
import org.metricshub.jvcl.frontend.ast.SourcePosition;
import org.metricshub.jvcl.frontend.ast.Statement;
import org.metricshub.jvcl.frontend.ast.VclProgram;
import org.metricshub.jvcl.jrt.VclContext;
import org.metricshub.jvcl.jrt.VclRuntimeException;
import org.metricshub.jvcl.jrt.VclValues;
import org.metricshub.jvcl.util.JvclLogger;
import org.metricshub.jvcl.util.JvclSettings;
import org.slf4j.Logger;

/**
 * Walks the syntax tree of a VCL program to process a request.
 * <p>
 * This interpreter only covers the statements and operators needed to
 * run instrumented programs in tests. Function calls, coverage markers
 * included, all go through the {@link BuiltinRegistry}.
 * <p>
 * The tree is only read, so several requests may be processed at the
 * same time, each with its own {@link VclContext}.
 */
public class Interpreter {

	private static final Logger LOGGER = JvclLogger.getLogger(Interpreter.class);

	private final VclProgram program;
	private final BuiltinRegistry builtins;
	private final int maxCallStackDepth;

	public Interpreter(VclProgram program, BuiltinRegistry builtins, JvclSettings settings) {
		this.program = Objects.requireNonNull(program, "program");
		this.builtins = Objects.requireNonNull(builtins, "builtins");
		this.maxCallStackDepth = settings.getMaxCallStackDepth();
	}

	/**
	 * Runs the specified subroutine.
	 *
	 * @param subroutine name of the subroutine, like <code>vcl_recv</code>
	 * @param context the request to process
	 * @return the action returned by the subroutine (<code>lookup</code>,
	 *         <code>pass</code>, ...), <code>error</code> or <code>restart</code>
	 *         when such a statement ended it, <code>null</code> when it
	 *         reached its end
	 * @throws VclRuntimeException when the program fails
	 */
	public String process(String subroutine, VclContext context) {
		Statement.SubroutineDeclaration sub = program.getSubroutine(subroutine);
		if (sub == null) {
			throw new VclRuntimeException("Subroutine " + subroutine + " is not declared");
		}
		for (Statement declaration : program.getDeclarations()) {
			if (declaration instanceof Statement.TableDeclaration) {
				Statement.TableDeclaration table = (Statement.TableDeclaration) declaration;
				context.putTable(table.getName(), table.getEntries());
			}
		}
		Execution execution = new Execution(context);
		try {
			State state = execution.call(sub, sub.getPosition());
			switch (state) {
			case RETURN:
				return execution.returnAction;
			case ERROR:
				return "error";
			case RESTART:
				return "restart";
			default:
				return null;
			}
		} finally {
			context.clearLocals();
		}
	}

	/**
	 * State of one call to {@link Interpreter#process(String, VclContext)}.
	 */
	private final class Execution implements Statement.Visitor<State>, Expression.Visitor<Object> {

		private final VclContext context;
		private final List<Statement.SubroutineDeclaration> stack = new ArrayList<>();
		private String returnAction;
		private String gotoTarget;

		private Execution(VclContext context) {
			this.context = context;
		}

		private State call(Statement.SubroutineDeclaration sub, SourcePosition position) {
			if (stack.size() >= maxCallStackDepth) {
				throw VclRuntimeException.maxCallStackExceeded(position, stack);
			}
			stack.add(sub);
			try {
				State state = execute(sub.getBlock().getStatements());
				switch (state) {
				case GOTO:
					throw new VclRuntimeException(position, "Goto destination " + gotoTarget + " is not found in " + sub.getName());
				case BREAK:
				case FALLTHROUGH:
					throw new VclRuntimeException(position, "break and fallthrough must be used in a switch");
				default:
					return state;
				}
			} finally {
				stack.remove(stack.size() - 1);
			}
		}

		private State execute(List<Statement> statements) {
			for (int i = 0; i < statements.size(); i++) {
				State state = statements.get(i).accept(this);
				if (state == State.GOTO) {
					int target = findDestination(statements, gotoTarget);
					if (target < 0) {
						return state;
					}
					gotoTarget = null;
					i = target;
					continue;
				}
				if (state != State.NONE) {
					return state;
				}
			}
			return State.NONE;
		}

		private int findDestination(List<Statement> statements, String name) {
			for (int i = 0; i < statements.size(); i++) {
				Statement statement = statements.get(i);
				if (statement instanceof Statement.GotoDestinationStatement
						&& ((Statement.GotoDestinationStatement) statement).getName().equals(name)) {
					return i;
				}
			}
			return -1;
		}

		private Object evaluate(Expression expression) {
			return expression.accept(this);
		}

		private Object callFunction(Expression.Ident name, List<Expression> arguments, SourcePosition position) {
			BuiltinFunction function = builtins.lookup(name.getValue());
			if (function == null) {
				throw new VclRuntimeException(position, "Function " + name.getValue() + " is not defined");
			}
			Object[] args = new Object[arguments.size()];
			for (int i = 0; i < args.length; i++) {
				args[i] = evaluate(arguments.get(i));
			}
			return function.call(context, args);
		}

		@Override
		public State visitSubroutineDeclaration(Statement.SubroutineDeclaration stmt) {
			throw new VclRuntimeException(stmt.getPosition(), "Subroutine " + stmt.getName() + " must be declared at the root");
		}

		@Override
		public State visitTableDeclaration(Statement.TableDeclaration stmt) {
			throw new VclRuntimeException(stmt.getPosition(), "Table " + stmt.getName() + " must be declared at the root");
		}

		@Override
		public State visitBlockStatement(Statement.BlockStatement stmt) {
			return execute(stmt.getStatements());
		}

		@Override
		public State visitIfStatement(Statement.IfStatement stmt) {
			if (VclValues.toBoolean(evaluate(stmt.getCondition()))) {
				return execute(stmt.getConsequence().getStatements());
			}
			for (Statement.IfStatement another : stmt.getAnother()) {
				if (VclValues.toBoolean(evaluate(another.getCondition()))) {
					return execute(another.getConsequence().getStatements());
				}
			}
			if (stmt.getAlternative() != null) {
				return execute(stmt.getAlternative().getConsequence().getStatements());
			}
			return State.NONE;
		}

		@Override
		public State visitSwitchStatement(Statement.SwitchStatement stmt) {
			String control = VclValues.toStr(evaluate(stmt.getControl()));
			List<CaseStatement> cases = stmt.getCases();

			int index = -1;
			int defaultIndex = -1;
			for (int i = 0; i < cases.size() && index < 0; i++) {
				CaseStatement clause = cases.get(i);
				if (clause.isDefault()) {
					defaultIndex = i;
				} else if (matches(clause, control)) {
					index = i;
				}
			}
			if (index < 0) {
				index = defaultIndex;
			}
			while (index >= 0 && index < cases.size()) {
				State state = execute(cases.get(index).getStatements());
				if (state == State.FALLTHROUGH) {
					index++;
					continue;
				}
				return state == State.BREAK ? State.NONE : state;
			}
			return State.NONE;
		}

		private boolean matches(CaseStatement clause, String control) {
			String test = VclValues.toStr(evaluate(clause.getTest()));
			if (!clause.isRegex()) {
				return test.equals(control);
			}
			try {
				return Pattern.compile(test).matcher(control).find();
			} catch (PatternSyntaxException e) {
				throw new VclRuntimeException(clause.getPosition(), "Invalid regular expression " + test, e);
			}
		}

		@Override
		public State visitFunctionCallStatement(Statement.FunctionCallStatement stmt) {
			callFunction(stmt.getFunction(), stmt.getArguments(), stmt.getPosition());
			return State.NONE;
		}

		@Override
		public State visitErrorStatement(Statement.ErrorStatement stmt) {
			long status = 503L;
			String message = null;
			if (stmt.getCode() != null) {
				Object code = evaluate(stmt.getCode());
				if (!VclValues.isInteger(code)) {
					throw new VclRuntimeException(
							stmt.getPosition(),
							"Error code must be INTEGER, " + VclValues.typeName(code) + " provided");
				}
				status = ((Long) code).longValue();
			}
			if (stmt.getArgument() != null) {
				message = VclValues.toStr(evaluate(stmt.getArgument()));
			}
			context.setError(status, message);
			return State.ERROR;
		}

		@Override
		public State visitReturnStatement(Statement.ReturnStatement stmt) {
			Expression expression = stmt.getReturnExpression();
			if (expression == null) {
				returnAction = null;
			} else if (expression instanceof Expression.Ident) {
				// return(lookup): the identifier is the action itself
				returnAction = ((Expression.Ident) expression).getValue();
			} else {
				returnAction = VclValues.toStr(evaluate(expression));
			}
			return State.RETURN;
		}

		@Override
		public State visitSetStatement(Statement.SetStatement stmt) {
			String name = stmt.getIdent().getValue();
			Object value = evaluate(stmt.getValue());
			switch (stmt.getOperator()) {
			case "=":
				context.set(name, value);
				break;
			case "+=":
				context.set(name, add(context.get(name), value));
				break;
			default:
				throw new VclRuntimeException(stmt.getPosition(), "Unsupported assignment operator " + stmt.getOperator());
			}
			return State.NONE;
		}

		@Override
		public State visitAddStatement(Statement.AddStatement stmt) {
			String name = stmt.getIdent().getValue();
			Object current = context.get(name);
			String value = VclValues.toStr(evaluate(stmt.getValue()));
			context.set(name, current == null ? value : VclValues.toStr(current) + ", " + value);
			return State.NONE;
		}

		@Override
		public State visitLogStatement(Statement.LogStatement stmt) {
			String line = VclValues.toStr(evaluate(stmt.getValue()));
			LOGGER.info("{}", line);
			context.addLog(line);
			return State.NONE;
		}

		@Override
		public State visitSyntheticStatement(Statement.SyntheticStatement stmt) {
			context.setResponseBody(VclValues.toStr(evaluate(stmt.getValue())));
			return State.NONE;
		}

		@Override
		public State visitSyntheticBase64Statement(Statement.SyntheticBase64Statement stmt) {
			String encoded = VclValues.toStr(evaluate(stmt.getValue()));
			try {
				context.setResponseBody(new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8));
			} catch (IllegalArgumentException e) {
				throw new VclRuntimeException(stmt.getPosition(), "Invalid base64 string " + encoded, e);
			}
			return State.NONE;
		}

		@Override
		public State visitEsiStatement(Statement.EsiStatement stmt) {
			context.setEsi(true);
			return State.NONE;
		}

		@Override
		public State visitRestartStatement(Statement.RestartStatement stmt) {
			context.setRestarted(true);
			return State.RESTART;
		}

		@Override
		public State visitDeclareStatement(Statement.DeclareStatement stmt) {
			context.declareLocal(stmt.getName().getValue());
			return State.NONE;
		}

		@Override
		public State visitUnsetStatement(Statement.UnsetStatement stmt) {
			context.unset(stmt.getIdent().getValue());
			return State.NONE;
		}

		@Override
		public State visitRemoveStatement(Statement.RemoveStatement stmt) {
			context.unset(stmt.getIdent().getValue());
			return State.NONE;
		}

		@Override
		public State visitBreakStatement(Statement.BreakStatement stmt) {
			return State.BREAK;
		}

		@Override
		public State visitFallthroughStatement(Statement.FallthroughStatement stmt) {
			return State.FALLTHROUGH;
		}

		@Override
		public State visitGotoStatement(Statement.GotoStatement stmt) {
			gotoTarget = stmt.getDestination().getValue();
			return State.GOTO;
		}

		@Override
		public State visitGotoDestinationStatement(Statement.GotoDestinationStatement stmt) {
			return State.NONE;
		}

		// includes are expanded by the loader, nothing left to do here
		@Override
		public State visitIncludeStatement(Statement.IncludeStatement stmt) {
			return State.NONE;
		}

		@Override
		public State visitCallStatement(Statement.CallStatement stmt) {
			String name = stmt.getSubroutine().getValue();
			Statement.SubroutineDeclaration sub = program.getSubroutine(name);
			if (sub == null) {
				throw new VclRuntimeException(stmt.getPosition(), "Subroutine " + name + " is not declared");
			}
			State state = call(sub, stmt.getPosition());
			return state == State.RETURN ? State.NONE : state;
		}

		// expressions

		@Override
		public Object visitFunctionCallExpression(Expression.FunctionCallExpression expr) {
			return callFunction(expr.getFunction(), expr.getArguments(), expr.getPosition());
		}

		@Override
		public Object visitGroupedExpression(Expression.GroupedExpression expr) {
			return evaluate(expr.getRight());
		}

		@Override
		public Object visitInfixExpression(Expression.InfixExpression expr) {
			String operator = expr.getOperator();
			Object left = evaluate(expr.getLeft());
			// short-circuit
			if ("&&".equals(operator)) {
				return VclValues.toBoolean(left) && VclValues.toBoolean(evaluate(expr.getRight()));
			}
			if ("||".equals(operator)) {
				return VclValues.toBoolean(left) || VclValues.toBoolean(evaluate(expr.getRight()));
			}
			Object right = evaluate(expr.getRight());
			switch (operator) {
			case "==":
				return equal(left, right);
			case "!=":
				return !equal(left, right);
			case "+":
				return add(left, right);
			case "~":
				return regexMatch(expr, left, right);
			case "!~":
				return !regexMatch(expr, left, right);
			case ">":
				return compare(expr, left, right) > 0;
			case ">=":
				return compare(expr, left, right) >= 0;
			case "<":
				return compare(expr, left, right) < 0;
			case "<=":
				return compare(expr, left, right) <= 0;
			default:
				throw new VclRuntimeException(expr.getPosition(), "Unsupported infix operator " + operator);
			}
		}

		private boolean regexMatch(Expression.InfixExpression expr, Object left, Object right) {
			String pattern = VclValues.toStr(right);
			try {
				return Pattern.compile(pattern).matcher(VclValues.toStr(left)).find();
			} catch (PatternSyntaxException e) {
				throw new VclRuntimeException(expr.getPosition(), "Invalid regular expression " + pattern, e);
			}
		}

		private int compare(Expression.InfixExpression expr, Object left, Object right) {
			if (!VclValues.isInteger(left) || !VclValues.isInteger(right)) {
				throw new VclRuntimeException(
						expr.getPosition(),
						"Cannot compare " + VclValues.typeName(left) + " and " + VclValues.typeName(right));
			}
			return Long.compare((Long) left, (Long) right);
		}

		@Override
		public Object visitPostfixExpression(Expression.PostfixExpression expr) {
			throw new VclRuntimeException(expr.getPosition(), "Unsupported postfix operator " + expr.getOperator());
		}

		@Override
		public Object visitPrefixExpression(Expression.PrefixExpression expr) {
			Object right = evaluate(expr.getRight());
			switch (expr.getOperator()) {
			case "!":
				return !VclValues.toBoolean(right);
			case "-":
				if (!VclValues.isInteger(right)) {
					throw new VclRuntimeException(
							expr.getPosition(),
							"Cannot negate " + VclValues.typeName(right) + " value");
				}
				return -((Long) right).longValue();
			default:
				throw new VclRuntimeException(expr.getPosition(), "Unsupported prefix operator " + expr.getOperator());
			}
		}

		@Override
		public Object visitIfExpression(Expression.IfExpression expr) {
			if (VclValues.toBoolean(evaluate(expr.getCondition()))) {
				return evaluate(expr.getConsequence());
			}
			return evaluate(expr.getAlternative());
		}

		@Override
		public Object visitIdent(Expression.Ident expr) {
			return context.get(expr.getValue());
		}

		@Override
		public Object visitStringLiteral(Expression.StringLiteral expr) {
			return expr.getValue();
		}

		@Override
		public Object visitIntegerLiteral(Expression.IntegerLiteral expr) {
			return expr.getValue();
		}

		@Override
		public Object visitBooleanLiteral(Expression.BooleanLiteral expr) {
			return expr.getValue();
		}
	}

	private static boolean equal(Object left, Object right) {
		if (VclValues.isInteger(left) && VclValues.isInteger(right)) {
			return left.equals(right);
		}
		if (left instanceof Boolean && right instanceof Boolean) {
			return left.equals(right);
		}
		return VclValues.toStr(left).equals(VclValues.toStr(right));
	}

	private static Object add(Object left, Object right) {
		if (VclValues.isInteger(left) && VclValues.isInteger(right)) {
			return ((Long) left).longValue() + ((Long) right).longValue();
		}
		return VclValues.toStr(left) + VclValues.toStr(right);
	}
}
