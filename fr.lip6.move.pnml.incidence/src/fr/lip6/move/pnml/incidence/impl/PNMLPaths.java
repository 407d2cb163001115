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

/**
 * XPath expressions and names used to read PNML documents. Elements are
 * matched on their local name so that the same lookups work whether the
 * document declares the PNML namespace as default, with a prefix, or not at
 * all.
 */
public final class PNMLPaths {

	public static final String NETS_PATH = "//*[local-name()='net']";
	public static final String ANY_ELEMENT = "*";
	public static final String PLACE = "place";
	public static final String TRANSITION = "transition";
	public static final String ARC = "arc";
	/**
	 * Relative to a place element.
	 */
	public static final String MARKING_TEXT_PATH = "*[local-name()='initialMarking']/*[local-name()='text']";

	public static final String ID_ATTR = "id";
	public static final String SRC_ATTR = "source";
	public static final String TRG_ATTR = "target";
	public static final String TYPE_ATTR = "type";

	public static final String PTNET_TYPE = "ptnet";

	private PNMLPaths() {
		super();
	}
}
