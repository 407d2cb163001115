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
package fr.lip6.move.pnml.incidence.report;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import fr.lip6.move.pnml.incidence.model.IdentifierRegistry;
import fr.lip6.move.pnml.incidence.model.PetriNet;

/**
 * Figures of a committed net, ready to be rendered. Holds copies: later
 * changes to the net do not show through.
 */
public final class NetSummary {

	private final int placeCount;
	private final int transitionCount;
	private final int arcCount;
	private final List<String> placeIds;
	private final List<String> transitionIds;
	private final int[] initialMarking;
	/**
	 * key: place id; value: tokens. Only places holding tokens, in place id
	 * order.
	 */
	private final Map<String, Integer> markedPlaces;
	private final int[][] matrix;

	private NetSummary(PetriNet net) {
		IdentifierRegistry registry = net.getRegistry();
		this.placeCount = net.getPlaces().size();
		this.transitionCount = net.getTransitions().size();
		this.arcCount = net.getArcs().size();
		this.placeIds = registry.getPlaceIds();
		this.transitionIds = registry.getTransitionIds();
		this.initialMarking = net.getInitialMarking();
		Map<String, Integer> marked = new LinkedHashMap<>();
		for (int i = 0; i < initialMarking.length; i++) {
			if (initialMarking[i] > 0) {
				marked.put(placeIds.get(i), initialMarking[i]);
			}
		}
		this.markedPlaces = Collections.unmodifiableMap(marked);
		this.matrix = net.getIncidenceMatrix().toArray();
	}

	public static NetSummary of(PetriNet net) {
		return new NetSummary(net);
	}

	public int getPlaceCount() {
		return placeCount;
	}

	public int getTransitionCount() {
		return transitionCount;
	}

	public int getArcCount() {
		return arcCount;
	}

	public List<String> getPlaceIds() {
		return placeIds;
	}

	public List<String> getTransitionIds() {
		return transitionIds;
	}

	public int[] getInitialMarking() {
		return Arrays.copyOf(initialMarking, initialMarking.length);
	}

	public Map<String, Integer> getMarkedPlaces() {
		return markedPlaces;
	}

	public int[] getMatrixRow(int row) {
		return Arrays.copyOf(matrix[row], matrix[row].length);
	}
}
