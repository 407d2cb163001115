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

public final class PNMLIncidenceFactory {

	private static PNMLIncidenceFactory instance;

	private PNMLIncidenceFactory() {
		super();
	}

	public static synchronized PNMLIncidenceFactory instance() {
		if (instance == null) {
			instance = new PNMLIncidenceFactory();
		}
		return instance;
	}

	public PNMLLoader createBasicPNMLLoader() {
		return new BasicPNMLLoader();
	}
}
