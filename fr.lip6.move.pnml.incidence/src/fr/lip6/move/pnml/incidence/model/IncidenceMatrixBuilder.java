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

import java.util.List;

/**
 * Computes A[p][t] = (occurrences of p in postset(t)) - (occurrences of p in
 * preset(t)). Entries are not clamped.
 */
public final class IncidenceMatrixBuilder {

	private IncidenceMatrixBuilder() {
		super();
	}

	/**
	 * @param net
	 *            whose presets and postsets are up to date.
	 * @param registry
	 *            built from the current places and transitions of the net.
	 * @return the incidence matrix.
	 * @throws IllegalStateException
	 *             if a preset or postset refers to a place or transition the
	 *             registry does not know.
	 */
	public static IncidenceMatrix build(PetriNet net, IdentifierRegistry registry) {
		List<String> transitionIds = registry.getTransitionIds();
		int[][] cells = new int[registry.placeCount()][transitionIds.size()];
		for (int col = 0; col < transitionIds.size(); col++) {
			Transition tr = net.getTransition(transitionIds.get(col));
			if (tr == null) {
				throw new IllegalStateException("Stale registry: unknown transition "
						+ transitionIds.get(col));
			}
			for (String placeId : tr.getPreset()) {
				cells[rowOf(registry, placeId)][col] -= 1;
			}
			for (String placeId : tr.getPostset()) {
				cells[rowOf(registry, placeId)][col] += 1;
			}
		}
		return new IncidenceMatrix(registry, cells);
	}

	private static int rowOf(IdentifierRegistry registry, String placeId) {
		int row = registry.placeIndex(placeId);
		if (row < 0) {
			throw new IllegalStateException("Stale registry: unknown place "
					+ placeId);
		}
		return row;
	}
}
