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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.metricshub.jvcl.frontend.ast.AstNode;
import org.metricshub.jvcl.frontend.ast.Expression;
import org.metricshub.jvcl.frontend.ast.SourcePosition;
import org.metricshub.jvcl.frontend.ast.Statement;
import org.metricshub.jvcl.jrt.VclSystemException;

/**
 * Creates the coverage marker statements and registers the matching
 * coverage points.
 * <p>
 * A marker is a call statement like
 * <code>coverage.branch("branch_12_3_2");</code>. Its identifier only
 * depends on the coverage type, the position of the node it stands for
 * and the optional suffix, so instrumenting the same source twice
 * yields the same identifiers.
 */
final class MarkerFactory {

	private final CoverageRegistry registry;
	private final Map<CoverageType, Integer> counts = new EnumMap<>(CoverageType.class);

	MarkerFactory(CoverageRegistry registry) {
		this.registry = registry;
	}

	/**
	 * Builds the identifier of a marker: <code>&lt;prefix&gt;_&lt;line&gt;_&lt;column&gt;[_&lt;suffix&gt;...]</code>.
	 *
	 * @param type coverage type, which gives the prefix
	 * @param node node the marker stands for
	 * @param suffix optional parts appended to the identifier, separated by <code>_</code>
	 * @return the identifier
	 */
	static String markerId(CoverageType type, AstNode node, String... suffix) {
		if (node == null) {
			throw new VclSystemException("Cannot create a " + type + " coverage marker without node");
		}
		SourcePosition position = node.getPosition();
		if (position == null) {
			throw new VclSystemException("Cannot create a " + type + " coverage marker for " + node + " which has no position");
		}
		StringBuilder id = new StringBuilder(type.getIdPrefix())
				.append('_')
				.append(position.getLine())
				.append('_')
				.append(position.getColumn());
		if (suffix != null && suffix.length > 0) {
			id.append('_').append(String.join("_", suffix));
		}
		return id.toString();
	}

	/**
	 * Creates a marker statement and registers its coverage point.
	 *
	 * @param type coverage type of the marker
	 * @param node node the marker stands for
	 * @param suffix optional parts that tell apart several markers for the same node
	 * @return the marker statement, to be inserted in the tree
	 */
	Statement createMarker(CoverageType type, AstNode node, String... suffix) {
		String id = markerId(type, node, suffix);
		switch (type) {
		case SUBROUTINE:
			registry.setupSubroutine(id, node);
			break;
		case STATEMENT:
			registry.setupStatement(id, node);
			break;
		case BRANCH:
			registry.setupBranch(id, node);
			break;
		default:
			throw new VclSystemException(node.getPosition(), "Unknown coverage type " + type);
		}
		counts.merge(type, 1, Integer::sum);

		return new Statement.FunctionCallStatement(
				SourcePosition.SYNTHETIC,
				new Expression.Ident(SourcePosition.SYNTHETIC, type.getFunctionName()),
				Collections.singletonList(new Expression.StringLiteral(SourcePosition.SYNTHETIC, id)));
	}

	/**
	 * @param type coverage type
	 * @return how many markers of that type this factory created
	 */
	int getCount(CoverageType type) {
		return counts.getOrDefault(type, 0);
	}
}
