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
 * A place of a P/T net with its initial number of tokens.
 */
public final class Place {

	private final String id;
	private final int tokens;

	public Place(String id, int tokens) {
		if (id == null) {
			throw new IllegalArgumentException("A place must have an id.");
		}
		if (tokens < 0) {
			throw new IllegalArgumentException("Initial marking of place "
					+ id + " is negative: " + tokens);
		}
		this.id = id;
		this.tokens = tokens;
	}

	public String getId() {
		return id;
	}

	/**
	 * @return the initial marking of this place, 0 if the document gave none.
	 */
	public int getTokens() {
		return tokens;
	}

	@Override
	public String toString() {
		return id + "(" + tokens + ")";
	}
}
