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
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Snapshot of a {@link CoverageRegistry}: for each coverage type, how
 * many points exist and how many were reached.
 */
public final class CoverageReport {

	private final List<Line> lines;
	private final Map<CoverageType, List<Line>> byType = new EnumMap<>(CoverageType.class);

	/**
	 * One coverage point in the report.
	 */
	public static final class Line {
		private final CoverageEntry entry;
		private final long hits;

		private Line(CoverageEntry entry) {
			this.entry = entry;
			this.hits = entry.getHits();
		}

		public String getId() {
			return entry.getId();
		}

		public CoverageType getType() {
			return entry.getType();
		}

		public CoverageEntry getEntry() {
			return entry;
		}

		public long getHits() {
			return hits;
		}

		public boolean isCovered() {
			return hits > 0;
		}
	}

	CoverageReport(List<CoverageEntry> entries) {
		List<Line> all = new ArrayList<>(entries.size());
		for (CoverageType type : CoverageType.values()) {
			byType.put(type, new ArrayList<>());
		}
		for (CoverageEntry entry : entries) {
			Line line = new Line(entry);
			all.add(line);
			byType.get(entry.getType()).add(line);
		}
		this.lines = Collections.unmodifiableList(all);
	}

	/**
	 * @return every coverage point, each exactly once
	 */
	public List<Line> getLines() {
		return lines;
	}

	public List<Line> getLines(CoverageType type) {
		return Collections.unmodifiableList(byType.get(type));
	}

	public int getTotal(CoverageType type) {
		return byType.get(type).size();
	}

	public int getCovered(CoverageType type) {
		int covered = 0;
		for (Line line : byType.get(type)) {
			if (line.isCovered()) {
				covered++;
			}
		}
		return covered;
	}

	/**
	 * @param type granularity of the coverage points
	 * @return the covered percentage, 100 when there is nothing to cover
	 */
	public double getPercentage(CoverageType type) {
		int total = getTotal(type);
		if (total == 0) {
			return 100.0;
		}
		return getCovered(type) * 100.0 / total;
	}

	/**
	 * Renders the summary, one line per coverage type, like
	 * <code>Statements: 3/4 (75.0%)</code>.
	 *
	 * @return the summary text
	 */
	public String format() {
		StringBuilder out = new StringBuilder();
		summary(out, "Subroutines", CoverageType.SUBROUTINE);
		summary(out, "Statements", CoverageType.STATEMENT);
		summary(out, "Branches", CoverageType.BRANCH);
		return out.toString();
	}

	private void summary(StringBuilder out, String label, CoverageType type) {
		out
				.append(
						String
								.format(
										Locale.US,
										"%s: %d/%d (%.1f%%)%n",
										label,
										getCovered(type),
										getTotal(type),
										getPercentage(type)));
	}
}
