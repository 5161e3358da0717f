package org.metricshub.jvcl.jrt;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.metricshub.jvcl.coverage.CoverageRegistry;

/**
 * State of a single request processed by the interpreter: variables,
 * response, log lines, clock, and the coverage registry that the
 * coverage markers report to.
 * <p>
 * One context is used by one thread at a time. The coverage registry
 * may be shared between contexts.
 */
public class VclContext {

	private final CoverageRegistry coverage;
	private final Map<String, Object> variables = new LinkedHashMap<>();
	private final Map<String, Object> locals = new HashMap<>();
	private final Map<String, Map<String, String>> tables = new HashMap<>();
	private final List<String> logs = new ArrayList<>();

	private Instant fixedTime;
	private String responseBody;
	private long errorStatus;
	private String errorMessage;
	private boolean restarted;
	private boolean esi;

	/**
	 * Creates a context that reports coverage hits to the specified registry.
	 *
	 * @param coverage the registry, shared with the instrumentation pass
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "the registry is shared on purpose")
	public VclContext(CoverageRegistry coverage) {
		this.coverage = Objects.requireNonNull(coverage, "coverage");
	}

	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "the registry is shared on purpose")
	public CoverageRegistry getCoverage() {
		return coverage;
	}

	/**
	 * Reads a variable such as <code>req.http.Host</code>. Local variables
	 * (<code>var.*</code>) take precedence.
	 *
	 * @param name name of the variable
	 * @return its value, or <code>null</code> if not set
	 */
	public Object get(String name) {
		if (locals.containsKey(name)) {
			return locals.get(name);
		}
		return variables.get(name);
	}

	public void set(String name, Object value) {
		if (locals.containsKey(name)) {
			locals.put(name, value);
		} else {
			variables.put(name, value);
		}
	}

	public void unset(String name) {
		if (locals.containsKey(name)) {
			locals.put(name, null);
		} else {
			variables.remove(name);
		}
	}

	/**
	 * Declares a local variable, initially not set.
	 *
	 * @param name name of the local variable
	 */
	public void declareLocal(String name) {
		locals.put(name, null);
	}

	/**
	 * Drops the local variables, when a subroutine returns.
	 */
	public void clearLocals() {
		locals.clear();
	}

	/**
	 * @return a read-only view of the global variables
	 */
	public Map<String, Object> getVariables() {
		return Collections.unmodifiableMap(variables);
	}

	public void putTable(String name, Map<String, String> entries) {
		tables.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
	}

	/**
	 * @param name name of a table declared in the program
	 * @return the table entries, or <code>null</code> if no such table
	 */
	public Map<String, String> getTable(String name) {
		return tables.get(name);
	}

	public void addLog(String line) {
		logs.add(line);
	}

	/**
	 * @return the lines written by <code>log</code> statements, in order
	 */
	public List<String> getLogs() {
		return Collections.unmodifiableList(logs);
	}

	/**
	 * Installs a fixed clock, as done by <code>testing.fixed_time</code>.
	 *
	 * @param fixedTime the instant returned by {@link #now()} from now on
	 */
	public void setFixedTime(Instant fixedTime) {
		this.fixedTime = fixedTime;
	}

	public Instant getFixedTime() {
		return fixedTime;
	}

	/**
	 * @return the fixed time when installed, the system time otherwise
	 */
	public Instant now() {
		return fixedTime != null ? fixedTime : Instant.now();
	}

	public String getResponseBody() {
		return responseBody;
	}

	public void setResponseBody(String responseBody) {
		this.responseBody = responseBody;
	}

	public long getErrorStatus() {
		return errorStatus;
	}

	public String getErrorMessage() {
		return errorMessage;
	}

	public void setError(long status, String message) {
		this.errorStatus = status;
		this.errorMessage = message;
	}

	public boolean isRestarted() {
		return restarted;
	}

	public void setRestarted(boolean restarted) {
		this.restarted = restarted;
	}

	public boolean isEsi() {
		return esi;
	}

	public void setEsi(boolean esi) {
		this.esi = esi;
	}
}
