package org.metricshub.jvcl;

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
import org.metricshub.jvcl.backend.Interpreter;
import org.metricshub.jvcl.coverage.CoverageRegistry;
import org.metricshub.jvcl.coverage.CoverageReport;
import org.metricshub.jvcl.coverage.Instrumenter;
import org.metricshub.jvcl.ext.BuiltinRegistry;
import org.metricshub.jvcl.frontend.ast.VclProgram;
import org.metricshub.jvcl.jrt.VclContext;
import org.metricshub.jvcl.util.JvclLogger;
import org.metricshub.jvcl.util.JvclSettings;
import org.slf4j.Logger;

/**
 * Entry point into the instrumentation and execution of a parsed VCL
 * program.
 * <p>
 * The overall process is as follows:
 * <ul>
 * <li>Instrument the syntax tree with coverage markers, which registers
 * every coverage point in a {@link CoverageRegistry}.
 * <li>Process requests with the {@link Interpreter}, each one with its own
 * {@link VclContext}. Coverage markers count hits in the registry.
 * <li>Print the {@link CoverageReport}.
 * </ul>
 * A program must be instrumented at most once.
 */
public class Jvcl {

	private static final Logger LOGGER = JvclLogger.getLogger(Jvcl.class);

	private final JvclSettings settings;
	private final BuiltinRegistry builtins;

	/**
	 * Create a new instance of Jvcl with default settings
	 */
	public Jvcl() {
		this(new JvclSettings());
	}

	public Jvcl(JvclSettings settings) {
		this(settings, BuiltinRegistry.defaults());
	}

	/**
	 * @param settings parameters of the runs
	 * @param builtins functions available to the programs, which must include
	 *        the coverage functions when coverage is enabled
	 */
	public Jvcl(JvclSettings settings, BuiltinRegistry builtins) {
		this.settings = Objects.requireNonNull(settings, "settings");
		this.builtins = Objects.requireNonNull(builtins, "builtins");
	}

	public JvclSettings getSettings() {
		return settings;
	}

	/**
	 * Adds coverage markers to the program, in place, and registers the
	 * coverage points in a new registry.
	 *
	 * @param program the parsed program
	 * @return the registry holding the coverage points of the program
	 */
	public CoverageRegistry instrument(VclProgram program) {
		CoverageRegistry registry = new CoverageRegistry();
		instrument(program, registry);
		return registry;
	}

	/**
	 * Adds coverage markers to the program, in place, and registers the
	 * coverage points in the specified registry.
	 *
	 * @param program the parsed program
	 * @param registry where coverage points are registered
	 */
	public void instrument(VclProgram program, CoverageRegistry registry) {
		new Instrumenter(registry).instrument(program);
		LOGGER.debug("{} coverage point(s) registered", registry.size());
	}

	/**
	 * Runs a subroutine of the program with a new context. When coverage is
	 * enabled in the settings, the program is instrumented on its first run,
	 * and later runs keep counting hits in the same registry.
	 *
	 * @param program the parsed program
	 * @param subroutine name of the subroutine to run
	 * @return the context of the request once processed
	 */
	public VclContext run(VclProgram program, String subroutine) {
		CoverageRegistry registry;
		synchronized (program) {
			registry = program.getCoverage();
			if (registry == null) {
				registry = settings.isCoverageEnabled() ? instrument(program) : new CoverageRegistry();
			}
		}
		VclContext context = new VclContext(registry);
		execute(program, subroutine, context);
		return context;
	}

	/**
	 * Runs a subroutine of an already instrumented program.
	 *
	 * @param program the program
	 * @param subroutine name of the subroutine to run
	 * @param context the request to process
	 * @return the action that ended the subroutine, or <code>null</code>
	 */
	public String execute(VclProgram program, String subroutine, VclContext context) {
		return new Interpreter(program, builtins, settings).process(subroutine, context);
	}

	/**
	 * Prints the coverage summary to the output stream of the settings.
	 *
	 * @param registry the registry to report on
	 * @return the report that was printed
	 */
	public CoverageReport printCoverage(CoverageRegistry registry) {
		CoverageReport report = registry.report();
		settings.getOutputStream().print(report.format());
		settings.getOutputStream().flush();
		return report;
	}
}
