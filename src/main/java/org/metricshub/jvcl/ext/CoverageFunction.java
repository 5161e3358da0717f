package org.metricshub.jvcl.ext;

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

import org.metricshub.jvcl.coverage.CoverageType;
import org.metricshub.jvcl.jrt.VclContext;
import org.metricshub.jvcl.jrt.VclSystemException;

/**
 * <code>coverage.subroutine(id)</code>, <code>coverage.statement(id)</code>
 * and <code>coverage.branch(id)</code>: the functions called by the
 * coverage markers. Each call counts one hit on the coverage point.
 */
public final class CoverageFunction extends BuiltinFunction {

	private final CoverageType type;

	public CoverageFunction(CoverageType type) {
		super(type.getFunctionName(), 1);
		this.type = type;
	}

	public CoverageType getType() {
		return type;
	}

	@Override
	protected Object invoke(VclContext context, Object[] args) {
		if (!(args[0] instanceof String)) {
			throw new VclSystemException(getName() + " expects a marker identifier, got " + args[0]);
		}
		String id = (String) args[0];
		if (context.getCoverage().hit(id) == null) {
			throw new VclSystemException("Coverage marker " + id + " was never registered");
		}
		return null;
	}
}
