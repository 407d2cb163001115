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
package fr.lip6.move.pnml.incidence.utils;

import java.io.File;

import fr.lip6.move.pnml.incidence.exceptions.InvalidFileException;

public final class PNMLIncidenceUtils {

	public static final String PNML_EXT = ".pnml";

	private PNMLIncidenceUtils() {
		super();
	}

	/**
	 * Checks that the file exists, is a regular file and can be read.
	 * 
	 * @param inFile
	 * @throws InvalidFileException
	 */
	public static void checkIsReadableFile(File inFile)
			throws InvalidFileException {
		if (inFile == null) {
			throw new InvalidFileException("No input file given.");
		}
		String path = inFile.getAbsolutePath();
		if (!inFile.exists()) {
			throw new InvalidFileException("Could not read PNML document "
					+ path + ": file not found.");
		}
		if (!inFile.isFile()) {
			throw new InvalidFileException("Could not read PNML document "
					+ path + ": not a regular file.");
		}
		if (!inFile.canRead()) {
			throw new InvalidFileException("Could not read PNML document "
					+ path + ": permission denied.");
		}
	}

	public static boolean hasPnmlExtension(File inFile) {
		return inFile.getName().endsWith(PNML_EXT);
	}
}
