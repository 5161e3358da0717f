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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.metricshub.jvcl.coverage.CoverageType;

/**
 * The functions available to a VCL program, by name.
 */
public final class BuiltinRegistry {

	private final Map<String, BuiltinFunction> functions;

	private BuiltinRegistry(Map<String, BuiltinFunction> functions) {
		this.functions = Collections.unmodifiableMap(functions);
	}

	/**
	 * @return a registry with the coverage functions and <code>testing.fixed_time</code>
	 */
	public static BuiltinRegistry defaults() {
		return of(
				new CoverageFunction(CoverageType.SUBROUTINE),
				new CoverageFunction(CoverageType.STATEMENT),
				new CoverageFunction(CoverageType.BRANCH),
				new TestingFixedTimeFunction());
	}

	/**
	 * @param functions the functions to expose
	 * @return a registry with exactly these functions
	 * @throws IllegalArgumentException when two functions share a name
	 */
	public static BuiltinRegistry of(BuiltinFunction... functions) {
		return of(Arrays.asList(functions));
	}

	public static BuiltinRegistry of(Collection<? extends BuiltinFunction> functions) {
		Map<String, BuiltinFunction> map = new LinkedHashMap<>();
		for (BuiltinFunction function : functions) {
			Objects.requireNonNull(function, "Function must not be null");
			BuiltinFunction previous = map.putIfAbsent(function.getName(), function);
			if (previous != null) {
				throw new IllegalArgumentException("Function '" + function.getName() + "' is defined twice");
			}
		}
		return new BuiltinRegistry(map);
	}

	/**
	 * @param name function name, like <code>coverage.branch</code>
	 * @return the function, or <code>null</code> if not available
	 */
	public BuiltinFunction lookup(String name) {
		return functions.get(name);
	}

	public boolean contains(String name) {
		return functions.containsKey(name);
	}

	/**
	 * @return the available functions, by name, in registration order
	 */
	public Map<String, BuiltinFunction> getFunctions() {
		return functions;
	}
}
