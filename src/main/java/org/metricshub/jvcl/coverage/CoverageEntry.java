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

import java.util.concurrent.atomic.AtomicLong;
import org.metricshub.jvcl.frontend.ast.AstNode;

/**
 * A coverage point: the marker identifier, the node it was created for,
 * and how many times the marker was executed.
 */
public final class CoverageEntry {

	private final String id;
	private final CoverageType type;
	private final AstNode node;
	private final AtomicLong hits = new AtomicLong();

	CoverageEntry(String id, CoverageType type, AstNode node) {
		this.id = id;
		this.type = type;
		this.node = node;
	}

	public String getId() {
		return id;
	}

	public CoverageType getType() {
		return type;
	}

	/**
	 * @return the node of the original tree this coverage point stands for
	 */
	public AstNode getNode() {
		return node;
	}

	public long getHits() {
		return hits.get();
	}

	public boolean isCovered() {
		return hits.get() > 0;
	}

	long hit() {
		return hits.incrementAndGet();
	}

	@Override
	public String toString() {
		return id + "=" + hits.get();
	}
}
