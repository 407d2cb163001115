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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a consistency check. Defects make the check fail, warnings do not.
 */
public final class ConsistencyReport {

	private final List<StructuralDefect> defects;
	private final List<StructuralDefect> warnings;

	ConsistencyReport(List<StructuralDefect> defects,
			List<StructuralDefect> warnings) {
		this.defects = Collections.unmodifiableList(new ArrayList<>(defects));
		this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
	}

	public boolean isConsistent() {
		return defects.isEmpty();
	}

	/**
	 * @return defects in discovery order: global checks, then arcs in arc
	 *         order.
	 */
	public List<StructuralDefect> getDefects() {
		return defects;
	}

	public List<StructuralDefect> getWarnings() {
		return warnings;
	}

	public List<String> getMessages() {
		List<String> messages = new ArrayList<>(defects.size());
		for (StructuralDefect d : defects) {
			messages.add(d.getMessage());
		}
		return messages;
	}
}
