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
package fr.lip6.move.pnml.incidence.consistency;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.LoggerFactory;

import fr.lip6.move.pnml.incidence.consistency.StructuralDefect.Kind;
import fr.lip6.move.pnml.incidence.model.Arc;
import fr.lip6.move.pnml.incidence.model.PetriNet;

/**
 * Structural validation of a {@link PetriNet}. Collects every defect instead
 * of stopping at the first one and never modifies the net. Does not look at
 * the incidence matrix.
 */
public final class ConsistencyChecker {

	public static final String NO_PLACES_MSG = "net has no places.";
	public static final String NO_TRANSITIONS_MSG = "net has no transitions.";
	static final String NO_ID = "<no id>";
	static final String NO_ENDPOINT = "<none>";

	private final org.slf4j.Logger journal = LoggerFactory
			.getLogger(ConsistencyChecker.class.getCanonicalName());

	public ConsistencyReport check(PetriNet net) {
		List<StructuralDefect> defects = new ArrayList<>();
		List<StructuralDefect> warnings = new ArrayList<>();

		if (net.getPlaces().isEmpty()) {
			defects.add(new StructuralDefect(Kind.NO_PLACES, null, null,
					NO_PLACES_MSG));
		}
		if (net.getTransitions().isEmpty()) {
			defects.add(new StructuralDefect(Kind.NO_TRANSITIONS, null, null,
					NO_TRANSITIONS_MSG));
		}
		for (String id : net.getDuplicateIds()) {
			warnings.add(new StructuralDefect(Kind.DUPLICATE_ID, id, id,
					"Node id '" + id
							+ "' is declared more than once; the last declaration was kept."));
		}

		boolean knownSrc, knownTrg;
		for (Arc arc : net.getArcs()) {
			knownSrc = net.isNode(arc.getSource());
			knownTrg = net.isNode(arc.getTarget());
			if (!knownSrc) {
				defects.add(unknownEndpoint(Kind.UNKNOWN_SOURCE, arc,
						arc.getSource()));
			}
			if (!knownTrg) {
				defects.add(unknownEndpoint(Kind.UNKNOWN_TARGET, arc,
						arc.getTarget()));
			}
			if (knownSrc && knownTrg && !net.isInputArc(arc)
					&& !net.isOutputArc(arc)) {
				String kind = net.isPlace(arc.getSource()) ? "place" : "transition";
				warnings.add(new StructuralDefect(Kind.MALFORMED_ARC, arc
						.getId(), arc.getTarget(), "Arc " + arcName(arc)
						+ " links " + kind + " '" + arc.getSource() + "' to "
						+ kind + " '" + arc.getTarget()
						+ "'; it is ignored in presets and postsets."));
			}
		}

		ConsistencyReport report = new ConsistencyReport(defects, warnings);
		journal.info("Consistency check {}: {} defect(s), {} warning(s).",
				report.isConsistent() ? "passed" : "failed", defects.size(),
				warnings.size());
		return report;
	}

	private static StructuralDefect unknownEndpoint(Kind kind, Arc arc,
			String endpoint) {
		String role = kind == Kind.UNKNOWN_SOURCE ? "source" : "target";
		String shown = endpoint == null ? NO_ENDPOINT : "'" + endpoint + "'";
		return new StructuralDefect(kind, arc.getId(), endpoint, "Arc "
				+ arcName(arc) + " has " + role + " " + shown
				+ " which does not exist.");
	}

	private static String arcName(Arc arc) {
		return arc.getId() == null ? NO_ID : arc.getId();
	}
}
