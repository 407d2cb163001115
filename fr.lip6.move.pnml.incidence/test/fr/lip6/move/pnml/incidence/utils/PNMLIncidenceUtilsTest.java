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

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import fr.lip6.move.pnml.incidence.exceptions.InvalidFileException;

final class PNMLIncidenceUtilsTest {

	@Test
	void acceptsRegularFile(@TempDir Path dir) throws IOException {
		File f = Files.createFile(dir.resolve("net.pnml")).toFile();

		assertDoesNotThrow(() -> PNMLIncidenceUtils.checkIsReadableFile(f));
		assertTrue(PNMLIncidenceUtils.hasPnmlExtension(f));
	}

	@Test
	void rejectsMissingFileAndDirectory(@TempDir Path dir) {
		assertThrows(InvalidFileException.class,
				() -> PNMLIncidenceUtils.checkIsReadableFile(dir.resolve("x.pnml").toFile()));
		assertThrows(InvalidFileException.class,
				() -> PNMLIncidenceUtils.checkIsReadableFile(dir.toFile()));
		assertThrows(InvalidFileException.class,
				() -> PNMLIncidenceUtils.checkIsReadableFile(null));
	}

	@Test
	void detectsExtension() {
		assertFalse(PNMLIncidenceUtils.hasPnmlExtension(new File("net.xml")));
	}
}
