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
 * Expressions of the VCL language. Like {@link Statement}, the set of
 * expression kinds is closed and exposed through {@link Visitor}.
 */
public abstract class Expression extends AstNode {

	public interface Visitor<R> {
		R visitFunctionCallExpression(FunctionCallExpression expr);

		R visitGroupedExpression(GroupedExpression expr);

		R visitInfixExpression(InfixExpression expr);

		R visitPostfixExpression(PostfixExpression expr);

		R visitPrefixExpression(PrefixExpression expr);

		R visitIfExpression(IfExpression expr);

		R visitIdent(Ident expr);

		R visitStringLiteral(StringLiteral expr);

		R visitIntegerLiteral(IntegerLiteral expr);

		R visitBooleanLiteral(BooleanLiteral expr);
	}

	protected Expression(SourcePosition position) {
		super(position);
	}

	public abstract <R> R accept(Visitor<R> visitor);

	public static final class FunctionCallExpression extends Expression {
		private final Ident function;
		private final List<Expression> arguments;

		public FunctionCallExpression(SourcePosition position, Ident function, List<Expression> arguments) {
			super(position);
			this.function = function;
			this.arguments = new ArrayList<>(arguments);
		}

		public Ident getFunction() {
			return function;
		}

		public List<Expression> getArguments() {
			return arguments;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitFunctionCallExpression(this);
		}
	}

	/**
	 * <code>( right )</code>
	 */
	public static final class GroupedExpression extends Expression {
		private final Expression right;

		public GroupedExpression(SourcePosition position, Expression right) {
			super(position);
			this.right = right;
		}

		public Expression getRight() {
			return right;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitGroupedExpression(this);
		}
	}

	public static final class InfixExpression extends Expression {
		private final Expression left;
		private final String operator;
		private final Expression right;

		public InfixExpression(SourcePosition position, Expression left, String operator, Expression right) {
			super(position);
			this.left = left;
			this.operator = operator;
			this.right = right;
		}

		public Expression getLeft() {
			return left;
		}

		public String getOperator() {
			return operator;
		}

		public Expression getRight() {
			return right;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitInfixExpression(this);
		}
	}

	public static final class PostfixExpression extends Expression {
		private final Expression left;
		private final String operator;

		public PostfixExpression(SourcePosition position, Expression left, String operator) {
			super(position);
			this.left = left;
			this.operator = operator;
		}

		public Expression getLeft() {
			return left;
		}

		public String getOperator() {
			return operator;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitPostfixExpression(this);
		}
	}

	public static final class PrefixExpression extends Expression {
		private final String operator;
		private final Expression right;

		public PrefixExpression(SourcePosition position, String operator, Expression right) {
			super(position);
			this.operator = operator;
			this.right = right;
		}

		public String getOperator() {
			return operator;
		}

		public Expression getRight() {
			return right;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitPrefixExpression(this);
		}
	}

	/**
	 * <code>if(condition, consequence, alternative)</code>
	 */
	public static final class IfExpression extends Expression {
		private final Expression condition;
		private final Expression consequence;
		private final Expression alternative;

		public IfExpression(SourcePosition position, Expression condition, Expression consequence, Expression alternative) {
			super(position);
			this.condition = condition;
			this.consequence = consequence;
			this.alternative = alternative;
		}

		public Expression getCondition() {
			return condition;
		}

		public Expression getConsequence() {
			return consequence;
		}

		public Expression getAlternative() {
			return alternative;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIfExpression(this);
		}
	}

	// terminals

	public static final class Ident extends Expression {
		private final String value;

		public Ident(SourcePosition position, String value) {
			super(position);
			this.value = value;
		}

		public String getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIdent(this);
		}
	}

	public static final class StringLiteral extends Expression {
		private final String value;

		public StringLiteral(SourcePosition position, String value) {
			super(position);
			this.value = value;
		}

		public String getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitStringLiteral(this);
		}
	}

	public static final class IntegerLiteral extends Expression {
		private final long value;

		public IntegerLiteral(SourcePosition position, long value) {
			super(position);
			this.value = value;
		}

		public long getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIntegerLiteral(this);
		}
	}

	public static final class BooleanLiteral extends Expression {
		private final boolean value;

		public BooleanLiteral(SourcePosition position, boolean value) {
			super(position);
			this.value = value;
		}

		public boolean getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitBooleanLiteral(this);
		}
	}
}
