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

import java.util.Objects;
import org.metricshub.jvcl.jrt.VclContext;
import org.metricshub.jvcl.jrt.VclRuntimeException;

/**
 * A function implemented in Java and callable from VCL, like
 * <code>testing.fixed_time(...)</code>.
 * <p>
 * Functions have a fixed arity. The arguments are checked with
 * {@link #validate(Object[])} before the function is invoked.
 */
public abstract class BuiltinFunction {

	private final String name;
	private final int arity;

	protected BuiltinFunction(String name, int arity) {
		if (name == null || name.trim().isEmpty()) {
			throw new IllegalArgumentException("Function name must not be empty");
		}
		this.name = name;
		this.arity = arity;
	}

	/**
	 * @return the name under which VCL code calls this function
	 */
	public String getName() {
		return name;
	}

	/**
	 * @return the number of arguments the function expects
	 */
	public int getArity() {
		return arity;
	}

	/**
	 * Verifies the arguments before the function is invoked. The default
	 * implementation only checks their count.
	 *
	 * @param args arguments evaluated by the interpreter
	 * @throws VclRuntimeException when the arguments violate the signature
	 */
	public void validate(Object[] args) {
		int argCount = args == null ? 0 : args.length;
		if (argCount != arity) {
			throw new VclRuntimeException(
					"Function '" + name + "' expects " + arity + " argument(s), not " + argCount);
		}
	}

	/**
	 * Validates the arguments and invokes the function.
	 *
	 * @param context the request being processed
	 * @param args arguments evaluated by the interpreter
	 * @return the value returned to VCL, <code>null</code> for none
	 */
	public final Object call(VclContext context, Object[] args) {
		Objects.requireNonNull(context, "context");
		validate(args);
		return invoke(context, args);
	}

	/**
	 * Performs the function, with arguments already validated.
	 *
	 * @param context the request being processed
	 * @param args validated arguments
	 * @return the value returned to VCL, <code>null</code> for none
	 */
	protected abstract Object invoke(VclContext context, Object[] args);

	@Override
	public String toString() {
		return name + "/" + arity;
	}
}
