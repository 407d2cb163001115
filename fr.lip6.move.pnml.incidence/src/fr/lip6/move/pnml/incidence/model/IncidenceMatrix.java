/**
 *  Copyright 2014 Universite Paris Ouest and Sorbonne Universites, Univ. Paris 06 - CNRS UMR 7606 (LIP6)
 *
 *  All rights reserved.   This program and the accompanying materials
 *  are made available under the terms of the Eclipse Public License v1.0
 *  which accompanies this distribution, and is available at
 *  http://www.eclipse.org/legal/epl-v10.html
 *
 *  Project leader / Initial Contributor:
 *    Lom Messan Hillah - <lom-messan.hillah@lip6.fr>
 *
 *  Contributors:
 *    ${ocontributors} - <$oemails}>
 *
 *  Mailing list:
 *    lom-messan.hillah@lip6.fr
 */
package fr.lip6.move.pnml.incidence.model;

import java.util.Arrays;

/**
 * Signed place x transition matrix of a net. Rows follow
 * {@link IdentifierRegistry#getPlaceIds()}, columns follow
 * {@link IdentifierRegistry#getTransitionIds()}.
 * <p>
 * Instances are immutable: accessors hand out copies.
 */
public final class IncidenceMatrix {

	public static final IncidenceMatrix EMPTY = new IncidenceMatrix(
			IdentifierRegistry.EMPTY, new int[0][0]);

	private final IdentifierRegistry registry;
	private final int[][] cells;

	IncidenceMatrix(IdentifierRegistry registry, int[][] cells) {
		if (cells.length != registry.placeCount()) {
			throw new IllegalArgumentException("Expected "
					+ registry.placeCount() + " rows, got " + cells.length);
		}
		for (int[] row : cells) {
			if (row.length != registry.transitionCount()) {
				throw new IllegalArgumentException("Expected "
						+ registry.transitionCount() + " columns, got "
						+ row.length);
			}
		}
		this.registry = registry;
		this.cells = cells;
	}

	public int rows() {
		return registry.placeCount();
	}

	public int columns() {
		return registry.transitionCount();
	}

	public int get(int row, int column) {
		return cells[row][column];
	}

	/**
	 * @param placeId
	 * @param transitionId
	 * @return the entry for this place and transition.
	 * @throws IllegalArgumentException
	 *             if either id is not part of the matrix.
	 */
	public int get(String placeId, String transitionId) {
		int row = registry.placeIndex(placeId);
		int column = registry.transitionIndex(transitionId);
		if (row < 0 || column < 0) {
			throw new IllegalArgumentException("No entry for place " + placeId
					+ " and transition " + transitionId);
		}
		return cells[row][column];
	}

	public int[] row(int row) {
		return Arrays.copyOf(cells[row], cells[row].length);
	}

	public int columnSum(int column) {
		int sum = 0;
		for (int[] row : cells) {
			sum += row[column];
		}
		return sum;
	}

	public int[][] toArray() {
		int[][] copy = new int[cells.length][];
		for (int i = 0; i < cells.length; i++) {
			copy[i] = row(i);
		}
		return copy;
	}

	public IdentifierRegistry getRegistry() {
		return registry;
	}

	@Override
	public String toString() {
		return Arrays.deepToString(cells);
	}
}
