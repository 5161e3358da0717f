package org.metricshub.jvcl.backend;

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
 * How the execution of a statement ended, which tells the enclosing
 * statements whether to go on.
 */
enum State {
	/** Go on with the next statement. */
	NONE,
	/** Leave the enclosing switch. */
	BREAK,
	/** Go on with the body of the next case. */
	FALLTHROUGH,
	/** Jump to a goto destination. */
	GOTO,
	/** Leave the subroutine. */
	RETURN,
	/** An error statement was executed. */
	ERROR,
	/** A restart statement was executed. */
	RESTART
}
