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

import fr.lip6.move.pnml.incidence.exceptions.PNMLIncidenceException;
import fr.lip6.move.pnml.incidence.model.PetriNet;

/**
 * Reads a PNML document into a committed {@link PetriNet}.
 */
public interface PNMLLoader {

	/**
	 * @param inFile
	 *            the PNML document.
	 * @return the net, with presets, postsets, registry and matrix computed.
	 * @throws PNMLIncidenceException
	 *             if the file cannot be read or is not well-formed XML. The
	 *             message names the file and the cause.
	 */
	PetriNet load(File inFile) throws PNMLIncidenceException;

	/**
	 * @param document
	 *            content of a PNML document.
	 * @param origin
	 *            where the content comes from, used in messages.
	 * @return the net, with presets, postsets, registry and matrix computed.
	 * @throws PNMLIncidenceException
	 *             if the content is not well-formed XML.
	 */
	PetriNet load(byte[] document, String origin) throws PNMLIncidenceException;
}
