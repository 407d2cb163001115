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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import fr.lip6.move.pnml.incidence.consistency.StructuralDefect.Kind;
import fr.lip6.move.pnml.incidence.model.PetriNet;

final class ConsistencyCheckerTest {

	private final ConsistencyChecker checker = new ConsistencyChecker();

	@Test
	void validNetPasses() {
		PetriNet net = new PetriNet();
		net.addPlace("p1", 1);
		net.addPlace("p2", 0);
		net.addTransition("t1");
		net.addArc("a1", "p1", "t1");
		net.addArc("a2", "t1", "p2");
		net.commit();

		ConsistencyReport report = checker.check(net);

		assertTrue(report.isConsistent());
		assertTrue(report.getDefects().isEmpty());
		assertTrue(report.getWarnings().isEmpty());
	}

	@Test
	void emptyNetHasTwoDefects() {
		PetriNet net = new PetriNet();
		net.commit();

		ConsistencyReport report = checker.check(net);

		assertFalse(report.isConsistent());
		assertEquals(Arrays.asList(ConsistencyChecker.NO_PLACES_MSG,
				ConsistencyChecker.NO_TRANSITIONS_MSG), report.getMessages());
		assertEquals(Kind.NO_PLACES, report.getDefects().get(0).getKind());
		assertEquals(Kind.NO_TRANSITIONS, report.getDefects().get(1).getKind());
	}

	@Test
	void unknownSourceIsReportedOnce() {
		PetriNet net = new PetriNet();
		net.addPlace("p1", 1);
		net.addTransition("t1");
		net.addArc("a1", "p1", "t1");
		net.addArc("a9", "p9", "t1");
		net.commit();

		ConsistencyReport report = checker.check(net);

		assertFalse(report.isConsistent());
		assertEquals(1, report.getDefects().size());
		StructuralDefect d = report.getDefects().get(0);
		assertEquals(Kind.UNKNOWN_SOURCE, d.getKind());
		assertEquals("a9", d.getSubject());
		assertEquals("p9", d.getValue());
		assertTrue(d.getMessage().contains("'p9'"));
		assertTrue(d.getMessage().contains("a9"));
	}

	@Test
	void reportsEachMissingEndpoint() {
		PetriNet net = new PetriNet();
		net.addPlace("p1", 0);
		net.addTransition("t1");
		net.addArc(null, "x", "y");
		net.addArc("a2", "t1", null);
		net.commit();

		List<StructuralDefect> defects = checker.check(net).getDefects();

		assertEquals(3, defects.size());
		assertEquals(Kind.UNKNOWN_SOURCE, defects.get(0).getKind());
		assertEquals(Kind.UNKNOWN_TARGET, defects.get(1).getKind());
		assertEquals(Kind.UNKNOWN_TARGET, defects.get(2).getKind());
		assertEquals("Arc <no id> has source 'x' which does not exist.",
				defects.get(0).getMessage());
		assertEquals("Arc <no id> has target 'y' which does not exist.",
				defects.get(1).getMessage());
		assertEquals("Arc a2 has target <none> which does not exist.",
				defects.get(2).getMessage());
	}

	@Test
	void globalChecksComeFirst() {
		PetriNet net = new PetriNet();
		net.addPlace("p1", 0);
		net.addArc("a1", "p1", "t1");
		net.commit();

		assertEquals(Arrays.asList(ConsistencyChecker.NO_TRANSITIONS_MSG,
				"Arc a1 has target 't1' which does not exist."),
				checker.check(net).getMessages());
	}

	@Test
	void detectionDoesNotDependOnArcOrder() {
		PetriNet forward = new PetriNet();
		PetriNet backward = new PetriNet();
		for (PetriNet net : Arrays.asList(forward, backward)) {
			net.addPlace("p1", 0);
			net.addTransition("t1");
		}
		forward.addArc("a", "p1", "tX");
		forward.addArc("b", "pY", "t1");
		forward.addArc("c", "p1", "t1");
		backward.addArc("c", "p1", "t1");
		backward.addArc("b", "pY", "t1");
		backward.addArc("a", "p1", "tX");

		assertEquals(new HashSet<>(checker.check(forward).getDefects()),
				new HashSet<>(checker.check(backward).getDefects()));
	}

	@Test
	void sameKindArcsAndDuplicatesAreWarningsOnly() {
		PetriNet net = new PetriNet();
		net.addPlace("p1", 0);
		net.addPlace("p2", 0);
		net.addPlace("p2", 1);
		net.addTransition("t1");
		net.addTransition("t2");
		net.addArc("pp", "p1", "p2");
		net.addArc("tt", "t1", "t2");
		net.commit();

		ConsistencyReport report = checker.check(net);

		assertTrue(report.isConsistent());
		assertEquals(3, report.getWarnings().size());
		assertEquals(Kind.DUPLICATE_ID, report.getWarnings().get(0).getKind());
		assertEquals("p2", report.getWarnings().get(0).getSubject());
		assertEquals(Kind.MALFORMED_ARC, report.getWarnings().get(1).getKind());
		assertEquals("pp", report.getWarnings().get(1).getSubject());
		assertTrue(report.getWarnings().get(2).getMessage()
				.contains("transition 't1' to transition 't2'"));
	}

	@Test
	void checkingLeavesNetUntouched() {
		PetriNet net = new PetriNet();
		net.addPlace("p1", 0);
		net.addTransition("t1");
		net.addArc("a1", "p1", "t1");
		net.addArc("a9", "p9", "t1");
		net.commit();
		int[][] before = net.getIncidenceMatrix().toArray();

		checker.check(net);

		assertEquals(2, net.getArcs().size());
		assertEquals(1, net.getTransition("t1").getPreset().size());
		assertEquals(before[0][0], net.getIncidenceMatrix().get(0, 0));
	}
}
