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
package fr.lip6.move.pnml.incidence.model;

/**
 * A raw arc, as read from the document. Endpoints are not resolved: they may
 * name unknown nodes, or be null when the document omits them.
 */
public final class Arc {

	private final String id;
	private final String source;
	private final String target;

	public Arc(String id, String source, String target) {
		this.id = id;
		this.source = source;
		this.target = target;
	}

	/**
	 * @return the arc id, or null if the arc has none.
	 */
	public String getId() {
		return id;
	}

	public String getSource() {
		return source;
	}

	public String getTarget() {
		return target;
	}

	@Override
	public String toString() {
		return (id == null ? "" : id + ": ") + source + " -> " + target;
	}
}
