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
package fr.lip6.move.pnml.incidence.impl;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

import org.slf4j.LoggerFactory;

import com.ximpleware.AutoPilot;
import com.ximpleware.NavException;
import com.ximpleware.ParseException;
import com.ximpleware.PilotException;
import com.ximpleware.VTDGen;
import com.ximpleware.VTDNav;
import com.ximpleware.XPathEvalException;
import com.ximpleware.XPathParseException;

import fr.lip6.move.pnml.incidence.exceptions.PNMLIncidenceException;
import fr.lip6.move.pnml.incidence.model.PetriNet;
import fr.lip6.move.pnml.incidence.utils.PNMLIncidenceUtils;

/**
 * PNML loader built on VTD-XML. Places, transitions and arcs are searched
 * anywhere in the document (pages included), in document order.
 */
public final class BasicPNMLLoader implements PNMLLoader {

	private static final String INTEGER_LITERAL = "[+-]?\\d+";

	private final org.slf4j.Logger journal = LoggerFactory
			.getLogger(BasicPNMLLoader.class.getCanonicalName());

	@Override
	public PetriNet load(File inFile) throws PNMLIncidenceException {
		String path = inFile.getAbsolutePath();
		journal.info("Checking preconditions on input file: {}", path);
		PNMLIncidenceUtils.checkIsReadableFile(inFile);
		if (!PNMLIncidenceUtils.hasPnmlExtension(inFile)) {
			journal.warn("File {} does not have the {} extension. Trying anyway.",
					path, PNMLIncidenceUtils.PNML_EXT);
		}
		byte[] content;
		try {
			content = Files.readAllBytes(inFile.toPath());
		} catch (IOException e) {
			throw new PNMLIncidenceException(readFailure(path, e), e);
		}
		return load(content, path);
	}

	@Override
	public PetriNet load(byte[] document, String origin)
			throws PNMLIncidenceException {
		if (document == null || document.length == 0) {
			throw new PNMLIncidenceException("Could not read PNML document "
					+ origin + ": the document is empty.");
		}
		VTDGen vg = new VTDGen();
		try {
			vg.setDoc(document);
			vg.parse(true);
		} catch (ParseException e) {
			throw new PNMLIncidenceException(readFailure(origin, e), e);
		}
		VTDNav vn = vg.getNav();
		PetriNet net = new PetriNet();
		try {
			checkNetType(vn);
			parseNodes(vn, net, NodeType.PLACE);
			parseNodes(vn, net, NodeType.TRANSITION);
			parseArcs(vn, net);
		} catch (NavException | XPathParseException
				| XPathEvalException e) {
			throw new PNMLIncidenceException(readFailure(origin, e), e);
		}
		net.commit();
		journal.info("Loaded {}: {} place(s), {} transition(s), {} arc(s).",
				origin, net.getPlaces().size(), net.getTransitions().size(),
				net.getArcs().size());
		return net;
	}

	private static String readFailure(String origin, Exception cause) {
		return "Could not read PNML document " + origin + ": "
				+ cause.getClass().getSimpleName() + ": " + cause.getMessage();
	}

	private void checkNetType(VTDNav vn) throws XPathParseException,
			XPathEvalException, NavException {
		AutoPilot ap = new AutoPilot(vn);
		ap.selectXPath(PNMLPaths.NETS_PATH);
		while (ap.evalXPath() != -1) {
			String netType = attribute(vn, PNMLPaths.TYPE_ATTR);
			journal.info("Discovered net type: {}", netType);
			if (netType == null || !netType.endsWith(PNMLPaths.PTNET_TYPE)) {
				journal.warn("Only P/T nets are supported. Reading places, transitions and arcs of this net anyway.");
			}
		}
		ap.resetXPath();
		vn.toElement(VTDNav.ROOT);
	}

	private void parseNodes(VTDNav vn, PetriNet net, NodeType nt)
			throws XPathParseException, XPathEvalException, PilotException,
			NavException {
		AutoPilot ap = new AutoPilot(vn);
		AutoPilot markingPilot = new AutoPilot(vn);
		ap.selectElement(PNMLPaths.ANY_ELEMENT);
		markingPilot.selectXPath(PNMLPaths.MARKING_TEXT_PATH);
		String id;
		while (nextElement(ap, vn, nt.getElementName())) {
			id = attribute(vn, PNMLPaths.ID_ATTR);
			if (id == null) {
				journal.warn("Found a {} without id. Skipping it.",
						nt.getElementName());
				continue;
			}
			switch (nt) {
			case PLACE:
				net.addPlace(id, findInitialMarking(vn, markingPilot, id));
				break;
			case TRANSITION:
				net.addTransition(id);
				break;
			default:
				throw new IllegalStateException("This node type is not supported: "
						+ nt.name());
			}
		}
		vn.toElement(VTDNav.ROOT);
	}

	private void parseArcs(VTDNav vn, PetriNet net) throws PilotException,
			NavException {
		AutoPilot ap = new AutoPilot(vn);
		ap.selectElement(PNMLPaths.ANY_ELEMENT);
		String id, src, trg;
		while (nextElement(ap, vn, PNMLPaths.ARC)) {
			id = attribute(vn, PNMLPaths.ID_ATTR);
			src = attribute(vn, PNMLPaths.SRC_ATTR);
			trg = attribute(vn, PNMLPaths.TRG_ATTR);
			net.addArc(id, src, trg);
		}
		vn.toElement(VTDNav.ROOT);
	}

	/**
	 * Moves to the next element, in document order, whose local name is the
	 * given one. Prefixed and unprefixed tags both match.
	 * 
	 * @param ap
	 *            iterating over all elements.
	 * @param vn
	 * @param localName
	 * @return false when the document has no more such element.
	 */
	private static boolean nextElement(AutoPilot ap, VTDNav vn,
			String localName) throws PilotException, NavException {
		String qName;
		int colon;
		while (ap.iterate()) {
			qName = vn.toString(vn.getCurrentIndex());
			colon = qName.indexOf(':');
			if (localName.equals(colon < 0 ? qName : qName.substring(colon + 1))) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Reads initialMarking/text under the current place. Missing, empty,
	 * non-numeric, negative or out of range values give 0.
	 * 
	 * @param vn
	 *            positioned on a place element.
	 * @param markingPilot
	 *            with {@link PNMLPaths#MARKING_TEXT_PATH} selected.
	 * @param placeId
	 * @return the initial marking of the place.
	 */
	private int findInitialMarking(VTDNav vn, AutoPilot markingPilot,
			String placeId) throws XPathEvalException, NavException {
		String mkg = null;
		vn.push();
		if (markingPilot.evalXPath() != -1) {
			int t = vn.getText();
			if (t != -1) {
				mkg = vn.toString(t).trim();
			}
		}
		markingPilot.resetXPath();
		vn.pop();

		if (mkg == null || mkg.isEmpty()) {
			return 0;
		}
		try {
			int tokens = Integer.parseInt(mkg);
			if (tokens < 0) {
				journal.warn("Initial marking of place {} is negative ({}). Using 0.",
						placeId, mkg);
				return 0;
			}
			return tokens;
		} catch (NumberFormatException e) {
			if (mkg.matches(INTEGER_LITERAL)) {
				journal.warn("Initial marking of place {} is out of range ({}). Using 0.",
						placeId, mkg);
			} else {
				journal.warn("Initial marking of place {} is not an integer ({}). Using 0.",
						placeId, mkg);
			}
			return 0;
		}
	}

	private static String attribute(VTDNav vn, String name)
			throws NavException {
		int i = vn.getAttrVal(name);
		return i == -1 ? null : vn.toString(i);
	}
}
