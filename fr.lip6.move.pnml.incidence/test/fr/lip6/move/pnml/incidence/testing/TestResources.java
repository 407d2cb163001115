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
package fr.lip6.move.pnml.incidence.testing;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;

public final class TestResources {

	private TestResources() {
		super();
	}

	/**
	 * @param name
	 *            file name under the nets fixture directory.
	 * @return the fixture file.
	 */
	public static File net(String name) {
		URL url = TestResources.class.getResource("/nets/" + name);
		if (url == null) {
			throw new IllegalArgumentException("Missing test resource: nets/" + name);
		}
		try {
			return new File(url.toURI());
		} catch (URISyntaxException e) {
			throw new IllegalStateException(e);
		}
	}
}
