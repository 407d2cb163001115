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
package fr.lip6.move.pnml.incidence.exceptions;

/**
 * Raised when a PNML document cannot be turned into a Petri net model.
 */
public class PNMLIncidenceException extends Exception {

	static final long serialVersionUID = -2817306470561185793L;

	public PNMLIncidenceException(String message) {
		super(message);
	}

	public PNMLIncidenceException(String message, Throwable cause) {
		super(message, cause);
	}

}
