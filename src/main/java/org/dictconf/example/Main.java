/*
 * Copyright 2017-18 White Label Dev Ltd, and contributors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.dictconf.example;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.dictconf.DictConf;
import org.dictconf.DictConfToml;

/**
 * DictConf for Java, converts a DictConf source file to TOML on stdout
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class Main {
	/** Converted successfully */
	public static final int EXIT_OK = 0;
	/** The source has a syntax, structure or evaluation error */
	public static final int EXIT_SOURCE_ERROR = 1;
	/** Called with wrong arguments, or for help/version */
	public static final int EXIT_USAGE = 2;
	/** The source file does not exist */
	public static final int EXIT_NOT_FOUND = 3;
	/** Anything else went wrong */
	public static final int EXIT_UNEXPECTED = 4;
	/** The source file cannot be read */
	public static final int EXIT_PERMISSION = 13;

	/**
	 * @param args The command line options when invoked
	 */
	public static void main (String[] args) {
		System.exit (run (args, System.out));
	}

	/**
	 * Runs the converter with output going to the given stream
	 *
	 * @param args The command line options
	 * @param out Where the TOML or error message is written
	 * @return The return code for the invoking shell
	 */
	public static int run (String[] args, PrintStream out) {
		// Process command line flags, everything else is a positional argument
		List<String> positional = new ArrayList<String> ();
		boolean paramVersion = false, paramHelp = false, paramExample = false, paramStrict = false, paramDebug = false;
		for (String arg : args) {
			if (arg.equals ("--v")) {
				paramVersion = true;
			} else if (arg.equals ("--help")) {
				paramHelp = true;
			} else if (arg.equals ("--example")) {
				paramExample = true;
			} else if (arg.equals ("--strict")) {
				paramStrict = true;
			} else if (arg.equals ("--debug")) {
				paramDebug = true;
			} else {
				positional.add (arg);
			}
		}

		if (paramVersion || paramHelp || (!paramExample && positional.size () != 1) || (paramExample && !positional.isEmpty ())) {
			// Show version
			out.println ("DictConf for Java (v " + DictConf.VERSION_MAJOR + "." + DictConf.VERSION_MINOR + ")\n");

			// Show usage information
			if (!paramVersion || paramHelp) {
				out.println ("Usage:  java -jar dictconf.jar [--strict] [--debug] input_file");
				out.println ("        (to convert a DictConf file to TOML)");
				out.println ("");
				out.println ("Options:");
				out.println ("    --help     Show this help");
				out.println ("       --v     Show version information");
				out.println ("  --strict     Fail on a block left open at the end of the file");
				out.println ("   --debug     Log parsing steps to stderr");
				out.println (" --example     Convert the internal example");
			}

			return EXIT_USAGE;
		}

		/** The DictConf source to convert (loaded from disk or internal example) */
		String sourceData;

		if (paramExample) {
			sourceData = "# Internal example\n"
				+ "def answer := #(* 6 7)\n"
				+ "def half := #(/ 1 2)\n"
				+ "@{\n"
				+ "name = [[Deep Thought]];\n"
				+ "result = answer;\n"
				+ "ratio = half;\n"
				+ "}\n";
		} else {
			File sourceFile = new File (positional.get (0));

			if (!sourceFile.isFile ()) {
				out.println ("Error: Input file not found.");
				return EXIT_NOT_FOUND;
			}

			if (!sourceFile.canRead ()) {
				out.println ("Unexpected error: File read permission denied: " + positional.get (0));
				return EXIT_PERMISSION;
			}

			try {
				sourceData = readFile (sourceFile);
			} catch (IOException e) {
				out.println ("Unexpected error: " + e.getMessage ());
				return EXIT_UNEXPECTED;
			}
		}

		DictConf dictConf = new DictConf ();
		dictConf.strictSet (paramStrict);
		dictConf.debugSet (paramDebug);

		DictConf.Result result = dictConf.parse (sourceData);
		if (!result.isSuccess ()) {
			// Evaluation failures are not grammar mistakes, report them the way other failures are
			out.println ((result.errorTypeGet () == DictConf.ErrorType.EVALUATION ? "Unexpected error: " : "Syntax Error: ") + result.errorGet ());
			return EXIT_SOURCE_ERROR;
		}

		try {
			out.println ("\n" + DictConfToml.write (result.documentGet ()));
		} catch (IOException e) {
			out.println ("Unexpected error: " + e.getMessage ());
			return EXIT_UNEXPECTED;
		}

		return EXIT_OK;
	}

	/**
	 * Reads a file from disk and returns it as a UTF-8 string
	 *
	 * @param file The file object to read
	 * @return String containing the file contents
	 * @throws IOException If the file cannot be read
	 */
	private static String readFile (File file) throws IOException {
		ByteArrayOutputStream outputStream = new ByteArrayOutputStream ();
		InputStream inputStream = new FileInputStream (file);

		try {
			byte buf[] = new byte[1024];
			int len;

			while ((len = inputStream.read (buf)) != -1)
				outputStream.write (buf, 0, len);
		} finally {
			inputStream.close ();
		}

		return new String (outputStream.toByteArray (), StandardCharsets.UTF_8);
	}
}
