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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.metricshub.jvcl.frontend.ast.AstNode;
import org.metricshub.jvcl.util.JvclLogger;
import org.slf4j.Logger;

/**
 * Table of the coverage points of a program.
 * <p>
 * Entries are created by the instrumentation pass, one per marker, and
 * are never removed. The interpreter then counts hits on them. Hits may
 * come from several threads at once, when the same instrumented tree
 * processes several requests concurrently.
 */
public final class CoverageRegistry {

	private static final Logger LOGGER = JvclLogger.getLogger(CoverageRegistry.class);

	private final ConcurrentMap<String, CoverageEntry> index = new ConcurrentHashMap<>();
	private final Map<CoverageType, Map<String, CoverageEntry>> buckets = new EnumMap<>(CoverageType.class);

	public CoverageRegistry() {
		for (CoverageType type : CoverageType.values()) {
			buckets.put(type, new LinkedHashMap<>());
		}
	}

	public CoverageEntry setupSubroutine(String id, AstNode node) {
		return setup(CoverageType.SUBROUTINE, id, node);
	}

	public CoverageEntry setupStatement(String id, AstNode node) {
		return setup(CoverageType.STATEMENT, id, node);
	}

	public CoverageEntry setupBranch(String id, AstNode node) {
		return setup(CoverageType.BRANCH, id, node);
	}

	/**
	 * Registers a coverage point. Registering the same identifier twice
	 * keeps the first entry, with its hits, so that instrumenting the same
	 * source again does not reset or duplicate anything.
	 *
	 * @param type granularity of the coverage point
	 * @param id marker identifier
	 * @param node node the marker stands for
	 * @return the registered entry
	 */
	public synchronized CoverageEntry setup(CoverageType type, String id, AstNode node) {
		Objects.requireNonNull(type, "type");
		Objects.requireNonNull(id, "id");
		CoverageEntry existing = index.get(id);
		if (existing != null) {
			if (existing.getType() != type) {
				throw new IllegalStateException(
						"Coverage identifier '" + id + "' already registered as " + existing.getType());
			}
			LOGGER.debug("Coverage identifier {} is already registered", id);
			return existing;
		}
		CoverageEntry entry = new CoverageEntry(id, type, node);
		buckets.get(type).put(id, entry);
		index.put(id, entry);
		return entry;
	}

	/**
	 * Records one execution of the marker with the specified identifier.
	 *
	 * @param id marker identifier
	 * @return the updated entry, or <code>null</code> when the identifier was never registered
	 */
	public CoverageEntry hit(String id) {
		CoverageEntry entry = index.get(id);
		if (entry != null) {
			entry.hit();
		}
		return entry;
	}

	/**
	 * @param id marker identifier
	 * @return the entry, or <code>null</code>
	 */
	public CoverageEntry getEntry(String id) {
		return index.get(id);
	}

	public boolean contains(String id) {
		return index.containsKey(id);
	}

	/**
	 * @param type granularity of the coverage points
	 * @return the entries of that type, in registration order
	 */
	public synchronized List<CoverageEntry> getEntries(CoverageType type) {
		return Collections.unmodifiableList(new ArrayList<>(buckets.get(type).values()));
	}

	/**
	 * @return all entries: subroutines, then statements, then branches,
	 *         each in registration order
	 */
	public synchronized List<CoverageEntry> getEntries() {
		List<CoverageEntry> all = new ArrayList<>(index.size());
		for (Map<String, CoverageEntry> bucket : buckets.values()) {
			all.addAll(bucket.values());
		}
		return Collections.unmodifiableList(all);
	}

	public int size() {
		return index.size();
	}

	/**
	 * @return a snapshot of the current hits
	 */
	public CoverageReport report() {
		return new CoverageReport(getEntries());
	}
}
