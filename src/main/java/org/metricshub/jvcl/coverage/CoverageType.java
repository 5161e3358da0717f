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

/**
 * Granularity of a coverage marker.
 */
public enum CoverageType {
	SUBROUTINE("subroutine", "sub"),
	STATEMENT("statement", "stmt"),
	BRANCH("branch", "branch");

	private final String name;
	private final String idPrefix;

	CoverageType(String name, String idPrefix) {
		this.name = name;
		this.idPrefix = idPrefix;
	}

	/**
	 * @return the name of the built-in function called by markers of this type,
	 *         like <code>coverage.branch</code>
	 */
	public String getFunctionName() {
		return "coverage." + name;
	}

	/**
	 * @return the first part of the marker identifiers of this type
	 */
	public String getIdPrefix() {
		return idPrefix;
	}

	@Override
	public String toString() {
		return name;
	}
}
