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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import fr.lip6.move.pnml.incidence.model.PetriNet;

final class NetSummaryTest {

	@Test
	void collectsCountsMarkingAndMatrix() {
		PetriNet net = new PetriNet();
		net.addPlace("p3", 4);
		net.addPlace("p1", 1);
		net.addPlace("p2", 0);
		net.addTransition("t1");
		net.addArc("a1", "p1", "t1");
		net.addArc("a2", "t1", "p2");
		net.addArc("a3", "p9", "t1");
		net.commit();

		NetSummary summary = NetSummary.of(net);

		assertEquals(3, summary.getPlaceCount());
		assertEquals(1, summary.getTransitionCount());
		assertEquals(3, summary.getArcCount());
		assertEquals(Arrays.asList("p1", "p2", "p3"), summary.getPlaceIds());
		assertArrayEquals(new int[] { 1, 0, 4 }, summary.getInitialMarking());
		Map<String, Integer> marked = new LinkedHashMap<>();
		marked.put("p1", 1);
		marked.put("p3", 4);
		assertEquals(marked, summary.getMarkedPlaces());
		assertArrayEquals(new int[] { -1 }, summary.getMatrixRow(0));
		assertArrayEquals(new int[] { 1 }, summary.getMatrixRow(1));
		assertArrayEquals(new int[] { 0 }, summary.getMatrixRow(2));
	}

	@Test
	void emptyNet() {
		PetriNet net = new PetriNet();
		net.commit();

		NetSummary summary = NetSummary.of(net);

		assertEquals(0, summary.getPlaceCount());
		assertEquals(0, summary.getInitialMarking().length);
		assertTrue(summary.getMarkedPlaces().isEmpty());
		assertEquals(Collections.emptyList(), summary.getTransitionIds());
	}
}
