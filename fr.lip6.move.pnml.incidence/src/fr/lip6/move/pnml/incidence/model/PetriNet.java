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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.LoggerFactory;

/**
 * In-memory P/T net: places, transitions and raw arcs, plus the views derived
 * from them (identifier registry and incidence matrix).
 * <p>
 * Places and transitions are keyed by id. Adding a node whose id was already
 * used by a node of the same kind replaces the previous one: the last
 * declaration wins. Such ids are remembered in {@link #getDuplicateIds()}.
 * <p>
 * Derived views only change on {@link #commit()}. Until the first commit they
 * are empty.
 */
public final class PetriNet {

	private final org.slf4j.Logger journal = LoggerFactory
			.getLogger(PetriNet.class.getCanonicalName());

	/**
	 * key: place id; value: place
	 */
	private final Map<String, Place> places = new LinkedHashMap<>();
	/**
	 * key: transition id; value: transition
	 */
	private final Map<String, Transition> transitions = new LinkedHashMap<>();
	/**
	 * Arcs, in document order.
	 */
	private final List<Arc> arcs = new ArrayList<>();
	private final Set<String> duplicateIds = new LinkedHashSet<>();

	private IdentifierRegistry registry = IdentifierRegistry.EMPTY;
	private IncidenceMatrix incidenceMatrix = IncidenceMatrix.EMPTY;

	public void addPlace(String id, int tokens) {
		Place previous = places.put(id, new Place(id, tokens));
		if (previous != null) {
			journal.warn("Place {} declared more than once. Keeping the last declaration.", id);
			duplicateIds.add(id);
		}
	}

	public void addTransition(String id) {
		Transition previous = transitions.put(id, new Transition(id));
		if (previous != null) {
			journal.warn("Transition {} declared more than once. Keeping the last declaration.", id);
			duplicateIds.add(id);
		}
	}

	/**
	 * @param id
	 *            may be null.
	 * @param source
	 * @param target
	 */
	public void addArc(String id, String source, String target) {
		arcs.add(new Arc(id, source, target));
	}

	/**
	 * Recomputes presets, postsets, identifier registry and incidence matrix
	 * from the current places, transitions and arcs.
	 */
	public void commit() {
		RelationshipBuilder.build(this);
	}

	void install(IdentifierRegistry registry, IncidenceMatrix incidenceMatrix) {
		this.registry = registry;
		this.incidenceMatrix = incidenceMatrix;
	}

	public Map<String, Place> getPlaces() {
		return Collections.unmodifiableMap(places);
	}

	public Map<String, Transition> getTransitions() {
		return Collections.unmodifiableMap(transitions);
	}

	public Place getPlace(String id) {
		return places.get(id);
	}

	public Transition getTransition(String id) {
		return transitions.get(id);
	}

	public List<Arc> getArcs() {
		return Collections.unmodifiableList(arcs);
	}

	/**
	 * @return ids of places or transitions that were declared more than once,
	 *         in order of first redeclaration.
	 */
	public Set<String> getDuplicateIds() {
		return Collections.unmodifiableSet(duplicateIds);
	}

	public boolean isPlace(String id) {
		return id != null && places.containsKey(id);
	}

	public boolean isTransition(String id) {
		return id != null && transitions.containsKey(id);
	}

	public boolean isNode(String id) {
		return isPlace(id) || isTransition(id);
	}

	/**
	 * @param arc
	 * @return true if the arc goes from a known place to a known transition.
	 */
	public boolean isInputArc(Arc arc) {
		return isPlace(arc.getSource()) && isTransition(arc.getTarget());
	}

	/**
	 * @param arc
	 * @return true if the arc goes from a known transition to a known place.
	 */
	public boolean isOutputArc(Arc arc) {
		return isTransition(arc.getSource()) && isPlace(arc.getTarget());
	}

	public IdentifierRegistry getRegistry() {
		return registry;
	}

	public IncidenceMatrix getIncidenceMatrix() {
		return incidenceMatrix;
	}

	/**
	 * @return initial token counts, aligned with the place ids of the registry.
	 */
	public int[] getInitialMarking() {
		List<String> placeIds = registry.getPlaceIds();
		int[] marking = new int[placeIds.size()];
		for (int i = 0; i < marking.length; i++) {
			marking[i] = places.get(placeIds.get(i)).getTokens();
		}
		return marking;
	}
}
