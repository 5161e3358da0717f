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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Statements of the VCL language, including root declarations.
 * <p>
 * The set of statements is closed: every kind has a method in
 * {@link Visitor}, so that any code walking the tree has to decide
 * explicitly what to do with each kind.
 */
public abstract class Statement extends AstNode {

	public interface Visitor<R> {
		R visitSubroutineDeclaration(SubroutineDeclaration stmt);

		R visitTableDeclaration(TableDeclaration stmt);

		R visitBlockStatement(BlockStatement stmt);

		R visitIfStatement(IfStatement stmt);

		R visitSwitchStatement(SwitchStatement stmt);

		R visitFunctionCallStatement(FunctionCallStatement stmt);

		R visitErrorStatement(ErrorStatement stmt);

		R visitReturnStatement(ReturnStatement stmt);

		R visitSetStatement(SetStatement stmt);

		R visitAddStatement(AddStatement stmt);

		R visitLogStatement(LogStatement stmt);

		R visitSyntheticStatement(SyntheticStatement stmt);

		R visitSyntheticBase64Statement(SyntheticBase64Statement stmt);

		R visitEsiStatement(EsiStatement stmt);

		R visitRestartStatement(RestartStatement stmt);

		R visitDeclareStatement(DeclareStatement stmt);

		R visitUnsetStatement(UnsetStatement stmt);

		R visitRemoveStatement(RemoveStatement stmt);

		R visitBreakStatement(BreakStatement stmt);

		R visitFallthroughStatement(FallthroughStatement stmt);

		R visitGotoStatement(GotoStatement stmt);

		R visitGotoDestinationStatement(GotoDestinationStatement stmt);

		R visitIncludeStatement(IncludeStatement stmt);

		R visitCallStatement(CallStatement stmt);
	}

	protected Statement(SourcePosition position) {
		super(position);
	}

	public abstract <R> R accept(Visitor<R> visitor);

	// root declarations

	public static final class SubroutineDeclaration extends Statement {
		private final String name;
		private final BlockStatement block;

		public SubroutineDeclaration(SourcePosition position, String name, BlockStatement block) {
			super(position);
			this.name = name;
			this.block = block;
		}

		public String getName() {
			return name;
		}

		public BlockStatement getBlock() {
			return block;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitSubroutineDeclaration(this);
		}
	}

	public static final class TableDeclaration extends Statement {
		private final String name;
		private final Map<String, String> entries;

		public TableDeclaration(SourcePosition position, String name, Map<String, String> entries) {
			super(position);
			this.name = name;
			this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
		}

		public String getName() {
			return name;
		}

		public Map<String, String> getEntries() {
			return entries;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitTableDeclaration(this);
		}
	}

	// statements with nested statements

	public static final class BlockStatement extends Statement {
		private List<Statement> statements;

		public BlockStatement(SourcePosition position, List<Statement> statements) {
			super(position);
			this.statements = new ArrayList<>(statements);
		}

		public List<Statement> getStatements() {
			return statements;
		}

		public void setStatements(List<Statement> statements) {
			this.statements = statements;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitBlockStatement(this);
		}
	}

	/**
	 * <code>if (cond) { ... } else if (cond) { ... } else { ... }</code>.
	 * <p>
	 * The else-if clauses are kept as a flat list of if statements
	 * (see {@link #getAnother()}), and the trailing else belongs to the
	 * whole chain.
	 */
	public static final class IfStatement extends Statement {
		private String keyword;
		private final Expression condition;
		private final BlockStatement consequence;
		private List<IfStatement> another;
		private ElseStatement alternative;

		public IfStatement(
				SourcePosition position,
				String keyword,
				Expression condition,
				BlockStatement consequence,
				List<IfStatement> another,
				ElseStatement alternative) {
			super(position);
			this.keyword = keyword;
			this.condition = condition;
			this.consequence = consequence;
			this.another = new ArrayList<>(another);
			this.alternative = alternative;
		}

		/**
		 * @return <code>if</code>, or the keyword used for an else-if clause
		 *         (<code>else if</code>, <code>elseif</code>, <code>elsif</code>)
		 */
		public String getKeyword() {
			return keyword;
		}

		public void setKeyword(String keyword) {
			this.keyword = keyword;
		}

		public Expression getCondition() {
			return condition;
		}

		public BlockStatement getConsequence() {
			return consequence;
		}

		public List<IfStatement> getAnother() {
			return another;
		}

		public void setAnother(List<IfStatement> another) {
			this.another = another;
		}

		public ElseStatement getAlternative() {
			return alternative;
		}

		public void setAlternative(ElseStatement alternative) {
			this.alternative = alternative;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIfStatement(this);
		}
	}

	public static final class SwitchStatement extends Statement {
		private final Expression control;
		private final List<CaseStatement> cases;

		public SwitchStatement(SourcePosition position, Expression control, List<CaseStatement> cases) {
			super(position);
			this.control = control;
			this.cases = new ArrayList<>(cases);
		}

		public Expression getControl() {
			return control;
		}

		public List<CaseStatement> getCases() {
			return cases;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitSwitchStatement(this);
		}
	}

	// statements with expressions

	public static final class FunctionCallStatement extends Statement {
		private final Expression.Ident function;
		private final List<Expression> arguments;

		public FunctionCallStatement(SourcePosition position, Expression.Ident function, List<Expression> arguments) {
			super(position);
			this.function = function;
			this.arguments = new ArrayList<>(arguments);
		}

		public Expression.Ident getFunction() {
			return function;
		}

		public List<Expression> getArguments() {
			return arguments;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitFunctionCallStatement(this);
		}
	}

	public static final class ErrorStatement extends Statement {
		private final Expression code;
		private final Expression argument;

		/**
		 * @param position where the statement starts
		 * @param code status code, may be <code>null</code>
		 * @param argument response message, may be <code>null</code>
		 */
		public ErrorStatement(SourcePosition position, Expression code, Expression argument) {
			super(position);
			this.code = code;
			this.argument = argument;
		}

		public Expression getCode() {
			return code;
		}

		public Expression getArgument() {
			return argument;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitErrorStatement(this);
		}
	}

	public static final class ReturnStatement extends Statement {
		private final Expression returnExpression;

		/**
		 * @param position where the statement starts
		 * @param returnExpression the action or value returned, may be <code>null</code>
		 */
		public ReturnStatement(SourcePosition position, Expression returnExpression) {
			super(position);
			this.returnExpression = returnExpression;
		}

		public Expression getReturnExpression() {
			return returnExpression;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitReturnStatement(this);
		}
	}

	public static final class SetStatement extends Statement {
		private final Expression.Ident ident;
		private final String operator;
		private final Expression value;

		public SetStatement(SourcePosition position, Expression.Ident ident, String operator, Expression value) {
			super(position);
			this.ident = ident;
			this.operator = operator;
			this.value = value;
		}

		public Expression.Ident getIdent() {
			return ident;
		}

		/**
		 * @return <code>=</code>, <code>+=</code>, ...
		 */
		public String getOperator() {
			return operator;
		}

		public Expression getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitSetStatement(this);
		}
	}

	public static final class AddStatement extends Statement {
		private final Expression.Ident ident;
		private final Expression value;

		public AddStatement(SourcePosition position, Expression.Ident ident, Expression value) {
			super(position);
			this.ident = ident;
			this.value = value;
		}

		public Expression.Ident getIdent() {
			return ident;
		}

		public Expression getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitAddStatement(this);
		}
	}

	public static final class LogStatement extends Statement {
		private final Expression value;

		public LogStatement(SourcePosition position, Expression value) {
			super(position);
			this.value = value;
		}

		public Expression getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitLogStatement(this);
		}
	}

	public static final class SyntheticStatement extends Statement {
		private final Expression value;

		public SyntheticStatement(SourcePosition position, Expression value) {
			super(position);
			this.value = value;
		}

		public Expression getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitSyntheticStatement(this);
		}
	}

	public static final class SyntheticBase64Statement extends Statement {
		private final Expression value;

		public SyntheticBase64Statement(SourcePosition position, Expression value) {
			super(position);
			this.value = value;
		}

		public Expression getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitSyntheticBase64Statement(this);
		}
	}

	// statements without expression

	public static final class EsiStatement extends Statement {
		public EsiStatement(SourcePosition position) {
			super(position);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitEsiStatement(this);
		}
	}

	public static final class RestartStatement extends Statement {
		public RestartStatement(SourcePosition position) {
			super(position);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitRestartStatement(this);
		}
	}

	public static final class DeclareStatement extends Statement {
		private final Expression.Ident name;
		private final String valueType;

		public DeclareStatement(SourcePosition position, Expression.Ident name, String valueType) {
			super(position);
			this.name = name;
			this.valueType = valueType;
		}

		public Expression.Ident getName() {
			return name;
		}

		public String getValueType() {
			return valueType;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitDeclareStatement(this);
		}
	}

	public static final class UnsetStatement extends Statement {
		private final Expression.Ident ident;

		public UnsetStatement(SourcePosition position, Expression.Ident ident) {
			super(position);
			this.ident = ident;
		}

		public Expression.Ident getIdent() {
			return ident;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitUnsetStatement(this);
		}
	}

	public static final class RemoveStatement extends Statement {
		private final Expression.Ident ident;

		public RemoveStatement(SourcePosition position, Expression.Ident ident) {
			super(position);
			this.ident = ident;
		}

		public Expression.Ident getIdent() {
			return ident;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitRemoveStatement(this);
		}
	}

	public static final class BreakStatement extends Statement {
		public BreakStatement(SourcePosition position) {
			super(position);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitBreakStatement(this);
		}
	}

	public static final class FallthroughStatement extends Statement {
		public FallthroughStatement(SourcePosition position) {
			super(position);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitFallthroughStatement(this);
		}
	}

	public static final class GotoStatement extends Statement {
		private final Expression.Ident destination;

		public GotoStatement(SourcePosition position, Expression.Ident destination) {
			super(position);
			this.destination = destination;
		}

		public Expression.Ident getDestination() {
			return destination;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitGotoStatement(this);
		}
	}

	public static final class GotoDestinationStatement extends Statement {
		private final String name;

		/**
		 * @param position where the label starts
		 * @param name the label, without the trailing colon
		 */
		public GotoDestinationStatement(SourcePosition position, String name) {
			super(position);
			this.name = name;
		}

		public String getName() {
			return name;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitGotoDestinationStatement(this);
		}
	}

	public static final class IncludeStatement extends Statement {
		private final String module;

		public IncludeStatement(SourcePosition position, String module) {
			super(position);
			this.module = module;
		}

		public String getModule() {
			return module;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIncludeStatement(this);
		}
	}

	public static final class CallStatement extends Statement {
		private final Expression.Ident subroutine;

		public CallStatement(SourcePosition position, Expression.Ident subroutine) {
			super(position);
			this.subroutine = subroutine;
		}

		public Expression.Ident getSubroutine() {
			return subroutine;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitCallStatement(this);
		}
	}
}
