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
import java.util.List;
import java.util.Map;

/**
 * Plain text rendering of a {@link NetSummary}.
 */
public final class SummaryRenderer {

	private static final String NL = "\n";
	private static final String SEP = " | ";
	private static final String CELL_SEP = "  ";
	private static final int ROW_HEADER_WIDTH = 10;
	private static final int CELL_WIDTH = 4;

	public String render(NetSummary summary) {
		StringBuilder out = new StringBuilder();
		out.append("=== PETRI NET SUMMARY ===").append(NL);
		out.append("Places: ").append(summary.getPlaceCount()).append(NL);
		out.append("Transitions: ").append(summary.getTransitionCount())
				.append(NL);
		out.append("Arcs: ").append(summary.getArcCount()).append(NL);

		out.append(NL).append("--- Initial Marking (M0) ---").append(NL);
		out.append("M0 (Vector): ")
				.append(Arrays.toString(summary.getInitialMarking())).append(NL);
		for (Map.Entry<String, Integer> e : summary.getMarkedPlaces().entrySet()) {
			out.append("  ").append(e.getKey()).append(": ")
					.append(e.getValue()).append(NL);
		}

		out.append(NL).append("--- Incidence Matrix (A) ---").append(NL);
		List<String> transitionIds = summary.getTransitionIds();
		out.append(pad("", ROW_HEADER_WIDTH)).append(SEP);
		for (int i = 0; i < transitionIds.size(); i++) {
			if (i > 0) {
				out.append(CELL_SEP);
			}
			out.append(pad(transitionIds.get(i), CELL_WIDTH));
		}
		out.append(NL);
		int ruleLength = ROW_HEADER_WIDTH + (CELL_WIDTH + CELL_SEP.length())
				* transitionIds.size();
		for (int i = 0; i < ruleLength; i++) {
			out.append('-');
		}
		out.append(NL);

		List<String> placeIds = summary.getPlaceIds();
		int[] row;
		for (int r = 0; r < placeIds.size(); r++) {
			out.append(pad(placeIds.get(r), ROW_HEADER_WIDTH)).append(SEP);
			row = summary.getMatrixRow(r);
			for (int c = 0; c < row.length; c++) {
				if (c > 0) {
					out.append(CELL_SEP);
				}
				out.append(pad(Integer.toString(row[c]), CELL_WIDTH));
			}
			out.append(NL);
		}
		return out.toString();
	}

	/**
	 * Right-aligns a value in a field of the given width. Longer values are
	 * kept whole.
	 */
	private static String pad(String value, int width) {
		return String.format("%" + width + "s", value);
	}
}
