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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills presets and postsets from raw arcs, then refreshes the identifier
 * registry and the incidence matrix of the net, in that order.
 * <p>
 * Every call starts from empty presets and postsets, so calling it again on
 * an unchanged net gives the same result. Arcs that are neither place ->
 * transition nor transition -> place are left out; they stay in the arc list.
 */
public final class RelationshipBuilder {

	private static final Logger journal = LoggerFactory
			.getLogger(RelationshipBuilder.class.getCanonicalName());

	private RelationshipBuilder() {
		super();
	}

	public static void build(PetriNet net) {
		for (Transition tr : net.getTransitions().values()) {
			tr.clearRelations();
		}
		int skipped = 0;
		for (Arc arc : net.getArcs()) {
			if (net.isInputArc(arc)) {
				net.getTransition(arc.getTarget()).addToPreset(arc.getSource());
			} else if (net.isOutputArc(arc)) {
				net.getTransition(arc.getSource()).addToPostset(arc.getTarget());
			} else {
				journal.debug("Arc {} is neither an input nor an output arc. Left out of presets and postsets.", arc);
				skipped++;
			}
		}
		if (skipped > 0) {
			journal.info("{} arc(s) left out of presets and postsets.", skipped);
		}
		IdentifierRegistry registry = IdentifierRegistry.of(net.getPlaces()
				.keySet(), net.getTransitions().keySet());
		IncidenceMatrix matrix = IncidenceMatrixBuilder.build(net, registry);
		net.install(registry, matrix);
	}
}
