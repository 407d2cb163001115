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

import java.util.Objects;

/**
 * One finding of the {@link ConsistencyChecker}.
 */
public final class StructuralDefect {

	public enum Kind {
		NO_PLACES, NO_TRANSITIONS, UNKNOWN_SOURCE, UNKNOWN_TARGET,
		/**
		 * Warning only.
		 */
		DUPLICATE_ID,
		/**
		 * Warning only: place -> place or transition -> transition.
		 */
		MALFORMED_ARC
	}

	private final Kind kind;
	/**
	 * Arc id or node id the finding is about, null for global findings and
	 * arcs without id.
	 */
	private final String subject;
	/**
	 * Offending endpoint, if any.
	 */
	private final String value;
	private final String message;

	StructuralDefect(Kind kind, String subject, String value, String message) {
		this.kind = kind;
		this.subject = subject;
		this.value = value;
		this.message = message;
	}

	public Kind getKind() {
		return kind;
	}

	public String getSubject() {
		return subject;
	}

	public String getValue() {
		return value;
	}

	public String getMessage() {
		return message;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof StructuralDefect)) {
			return false;
		}
		StructuralDefect other = (StructuralDefect) obj;
		return kind == other.kind && Objects.equals(subject, other.subject)
				&& Objects.equals(value, other.value)
				&& message.equals(other.message);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, subject, value, message);
	}

	@Override
	public String toString() {
		return message;
	}
}
