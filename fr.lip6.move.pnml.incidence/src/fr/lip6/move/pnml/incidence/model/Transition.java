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
import java.util.List;

/**
 * A transition and the places connected to it.
 * <p>
 * Preset and postset keep arc encounter order. A place appears as many times
 * as there are parallel arcs linking it to this transition. Both lists are
 * filled by {@link RelationshipBuilder} only.
 */
public final class Transition {

	private final String id;
	/**
	 * Sources of input arcs (place -> this transition).
	 */
	private final List<String> preset;
	/**
	 * Targets of output arcs (this transition -> place).
	 */
	private final List<String> postset;

	public Transition(String id) {
		if (id == null) {
			throw new IllegalArgumentException("A transition must have an id.");
		}
		this.id = id;
		this.preset = new ArrayList<>();
		this.postset = new ArrayList<>();
	}

	public String getId() {
		return id;
	}

	public List<String> getPreset() {
		return Collections.unmodifiableList(preset);
	}

	public List<String> getPostset() {
		return Collections.unmodifiableList(postset);
	}

	void clearRelations() {
		preset.clear();
		postset.clear();
	}

	void addToPreset(String placeId) {
		preset.add(placeId);
	}

	void addToPostset(String placeId) {
		postset.add(placeId);
	}

	@Override
	public String toString() {
		return id + " " + preset + " -> " + postset;
	}
}
