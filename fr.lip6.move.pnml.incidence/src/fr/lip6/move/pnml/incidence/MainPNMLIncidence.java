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
package fr.lip6.move.pnml.incidence;

import java.io.File;
import java.io.FileFilter;
import java.io.FilenameFilter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.LoggerContext;
import fr.lip6.move.pnml.incidence.consistency.ConsistencyChecker;
import fr.lip6.move.pnml.incidence.consistency.ConsistencyReport;
import fr.lip6.move.pnml.incidence.consistency.StructuralDefect;
import fr.lip6.move.pnml.incidence.exceptions.PNMLIncidenceException;
import fr.lip6.move.pnml.incidence.impl.PNMLIncidenceFactory;
import fr.lip6.move.pnml.incidence.impl.PNMLLoader;
import fr.lip6.move.pnml.incidence.model.PetriNet;
import fr.lip6.move.pnml.incidence.report.NetSummary;
import fr.lip6.move.pnml.incidence.report.SummaryRenderer;
import fr.lip6.move.pnml.incidence.utils.PNMLIncidenceUtils;

/**
 * Loads PNML files, checks them and prints their initial marking and
 * incidence matrix.
 */
public class MainPNMLIncidence {
	public static final String VERSION = "0.0.1";
	public static final String PNMLINCIDENCE_DEBUG = "PNMLINCIDENCE_DEBUG";

	public static final String GATE_ON_CHECK = "gate.on.check";
	public static final String OUTPUT_SUMMARY = "output.summary";

	private static boolean isDebug;
	private static boolean isGateOnCheck = true, isOutputSummary = true;
	private static org.slf4j.Logger myLog = LoggerFactory
			.getLogger(MainPNMLIncidence.class.getCanonicalName());

	public static void main(String[] args) {
		long startTime = System.nanoTime();

		StringBuilder msg = new StringBuilder();
		if (args.length < 1) {
			myLog.error("At least the path to one PNML file is expected.");
			return;
		}
		checkDebugMode(msg);
		checkPropertyMode(msg, GATE_ON_CHECK, true);
		checkPropertyMode(msg, OUTPUT_SUMMARY, true);

		List<File> sources = extractSrcFiles(args);
		if (sources.isEmpty()) {
			myLog.error("No PNML file found in {}.", Arrays.toString(args));
		}
		boolean error = sources.isEmpty();
		PNMLLoader loader = PNMLIncidenceFactory.instance().createBasicPNMLLoader();
		for (File f : sources) {
			error |= !process(loader, f);
		}

		if (!error) {
			msg.append("Finished successfully.");
			myLog.info(msg.toString());
		} else {
			msg.append("Finished in error.");
			if (!MainPNMLIncidence.isDebug) {
				msg.append(
						" Activate debug mode to print stacktraces, like so: export ")
						.append(PNMLINCIDENCE_DEBUG).append("=true");
			}
			myLog.error(msg.toString());
		}
		long endTime = System.nanoTime();
		myLog.info("Processing PNML took {} seconds.",
				(endTime - startTime) / 1.0e9);
		LoggerContext loggerContext = (LoggerContext) LoggerFactory
				.getILoggerFactory();
		loggerContext.stop();
		if (error) {
			System.exit(-1);
		}
	}

	/**
	 * Loads, checks and reports one file.
	 * 
	 * @param loader
	 * @param f
	 * @return false if the file could not be loaded, or failed the check
	 *         while gating is on.
	 */
	static boolean process(PNMLLoader loader, File f) {
		PetriNet net;
		try {
			net = loader.load(f);
		} catch (PNMLIncidenceException e) {
			myLog.error(e.getMessage());
			MainPNMLIncidence.printStackTrace(e);
			return false;
		}

		ConsistencyReport report = new ConsistencyChecker().check(net);
		for (StructuralDefect w : report.getWarnings()) {
			myLog.warn("{}: {}", f.getName(), w.getMessage());
		}
		if (!report.isConsistent()) {
			myLog.error("{} is not consistent:", f.getAbsolutePath());
			for (StructuralDefect d : report.getDefects()) {
				myLog.error(" - {}", d.getMessage());
			}
			if (isGateOnCheck) {
				return false;
			}
		}
		if (isOutputSummary) {
			System.out.println(new SummaryRenderer().render(NetSummary.of(net)));
		}
		return true;
	}

	/**
	 * Checks debug mode.
	 * 
	 * @param msg
	 */
	private static void checkDebugMode(StringBuilder msg) {
		String debug = System.getenv(PNMLINCIDENCE_DEBUG);
		if ("true".equalsIgnoreCase(debug)) {
			setDebug(true);
		} else {
			setDebug(false);
			msg.append(
					"Debug mode not set. If you want to activate the debug mode (print stackstaces in case of errors), then set the ")
					.append(PNMLINCIDENCE_DEBUG)
					.append(" environnement variable like so: export ")
					.append(PNMLINCIDENCE_DEBUG).append("=true.");
			myLog.warn(msg.toString());
			msg.delete(0, msg.length());
		}
	}

	/**
	 * 
	 * @param msg
	 * @param propertyName
	 * @param propDefault
	 */
	private static void checkPropertyMode(StringBuilder msg,
			String propertyName, boolean propDefault) {
		String prop = System.getProperty(propertyName);
		if (prop != null) {
			setProperty(propertyName, Boolean.valueOf(prop));
			myLog.warn("Option {} set to {}.", propertyName, Boolean.valueOf(prop));
		} else {
			setProperty(propertyName, propDefault);
			msg.append("Property ")
					.append(propertyName)
					.append(" is not set. Default is ")
					.append(propDefault)
					.append(". If you want to set it, then invoke this program with ")
					.append(propertyName).append(" property like so: java -D")
					.append(propertyName).append("=").append(!propDefault)
					.append(" [JVM OPTIONS] -jar ...");
			myLog.warn(msg.toString());
			msg.delete(0, msg.length());
		}
	}

	static void setProperty(String propertyName, boolean value) {
		if (GATE_ON_CHECK.equalsIgnoreCase(propertyName)) {
			isGateOnCheck = value;
		} else if (OUTPUT_SUMMARY.equalsIgnoreCase(propertyName)) {
			isOutputSummary = value;
		}
	}

	/**
	 * Extracts PNML files (scans directories recursively) from command-line
	 * arguments.
	 * 
	 * @param args
	 * @return the files to process, in argument order.
	 */
	static List<File> extractSrcFiles(String[] args) {
		List<File> res = new ArrayList<File>();
		PNMLFilenameFilter pff = new PNMLFilenameFilter();
		DirFileFilter dff = new DirFileFilter();
		File srcf;
		for (String s : args) {
			srcf = new File(s);
			if (srcf.isDirectory()) {
				res.addAll(extractSrcFiles(srcf, pff, dff));
			} else {
				// missing files are reported by the loader
				res.add(srcf);
			}
		}
		return res;
	}

	private static List<File> extractSrcFiles(File srcf,
			PNMLFilenameFilter pff, DirFileFilter dff) {
		List<File> res = new ArrayList<File>();

		// filter PNML files
		File[] pfiles = srcf.listFiles(pff);
		if (pfiles != null) {
			Arrays.sort(pfiles);
			res.addAll(Arrays.asList(pfiles));
		}

		// filter directories
		pfiles = srcf.listFiles(dff);
		if (pfiles != null) {
			Arrays.sort(pfiles);
			for (File f : pfiles) {
				res.addAll(extractSrcFiles(f, pff, dff));
			}
		}
		return res;
	}

	private static final class PNMLFilenameFilter implements FilenameFilter {
		@Override
		public boolean accept(File dir, String name) {
			return name.endsWith(PNMLIncidenceUtils.PNML_EXT);
		}
	}

	private static final class DirFileFilter implements FileFilter {
		@Override
		public boolean accept(File pathname) {
			return pathname.isDirectory();
		}
	}

	public static boolean isDebug() {
		return isDebug;
	}

	public static synchronized void setDebug(boolean b) {
		MainPNMLIncidence.isDebug = b;
	}

	/**
	 * Prints the stack trace of the exception passed as parameter, in debug
	 * mode only.
	 * 
	 * @param e
	 */
	public static synchronized void printStackTrace(Exception e) {
		if (MainPNMLIncidence.isDebug) {
			e.printStackTrace();
		}
	}

	public static boolean isGateOnCheck() {
		return isGateOnCheck;
	}

	public static boolean isOutputSummary() {
		return isOutputSummary;
	}
}
