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
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Canonical ordering of place and transition ids. Row and column indices of
 * the incidence matrix, as well as marking vectors, follow this ordering.
 * <p>
 * Ids are sorted in natural {@link String} order and deduplicated.
 */
public final class IdentifierRegistry {

	public static final IdentifierRegistry EMPTY = new IdentifierRegistry(
			Collections.<String> emptyList(), Collections.<String> emptyList());

	private final List<String> placeIds;
	private final List<String> transitionIds;
	/**
	 * key: place id; value: row index
	 */
	private final Map<String, Integer> placeIndex;
	/**
	 * key: transition id; value: column index
	 */
	private final Map<String, Integer> transitionIndex;

	private IdentifierRegistry(List<String> placeIds, List<String> transitionIds) {
		this.placeIds = Collections.unmodifiableList(placeIds);
		this.transitionIds = Collections.unmodifiableList(transitionIds);
		this.placeIndex = indexOf(placeIds);
		this.transitionIndex = indexOf(transitionIds);
	}

	public static IdentifierRegistry of(Collection<String> placeIds,
			Collection<String> transitionIds) {
		return new IdentifierRegistry(sorted(placeIds), sorted(transitionIds));
	}

	private static List<String> sorted(Collection<String> ids) {
		return new ArrayList<>(new TreeSet<>(ids));
	}

	private static Map<String, Integer> indexOf(List<String> ids) {
		Map<String, Integer> index = new HashMap<>();
		for (int i = 0; i < ids.size(); i++) {
			index.put(ids.get(i), i);
		}
		return index;
	}

	public List<String> getPlaceIds() {
		return placeIds;
	}

	public List<String> getTransitionIds() {
		return transitionIds;
	}

	/**
	 * @param placeId
	 * @return the row of this place, -1 if unknown.
	 */
	public int placeIndex(String placeId) {
		Integer i = placeIndex.get(placeId);
		return i == null ? -1 : i;
	}

	/**
	 * @param transitionId
	 * @return the column of this transition, -1 if unknown.
	 */
	public int transitionIndex(String transitionId) {
		Integer i = transitionIndex.get(transitionId);
		return i == null ? -1 : i;
	}

	public int placeCount() {
		return placeIds.size();
	}

	public int transitionCount() {
		return transitionIds.size();
	}
}
