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

package org.dictconf;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DictConf for Java
 * <p>Parses the DictConf configuration language into a document of named blocks. A source is read line by line:</p>
 * <pre>
 * # comment
 * def answer := #(* 6 7)
 * &#64;{
 * name = [[Deep Thought]];
 * result = answer;
 * }
 * </pre>
 * <p>Every closed block is stored under the next free name of dict1, dict2, etc. Blocks cannot be nested.</p>
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class DictConf {
	// Public information
	public static final int VERSION_MAJOR = 1;
	public static final int VERSION_MINOR = 0;

	// Internal settings
	private static final String LOG_TAG = DictConf.class.getSimpleName ();
	private static final String BLOCK_NAME_PREFIX = "dict";

	private boolean debug = false;
	private boolean strict = false;

	// Parser internals
	private HashMap<String, DictConfValue> constants = null;
	private LinkedHashMap<String, Map<String, DictConfValue>> document = null;
	private DictConfExpression expression = null;
	private int lineNumber = 0;
	private ErrorType errorType = null;
	private String errorMessage = null;

	/** Line shapes the parser understands, decided by prefix alone */
	public static enum LineType {
		SKIP,
		DECLARATION,
		BLOCK_OPEN,
		BLOCK_CLOSE,
		PAIR
	}

	/** Categories of parse failure */
	public static enum ErrorType {
		/** A line in a position the block state does not allow */
		STRUCTURE,
		/** A line or expression that does not match the grammar */
		SYNTAX,
		/** Well-formed input whose arithmetic cannot be carried out */
		EVALUATION
	}

	/**
	 * The outcome of one {@link DictConf#parse(String)} call, either a document or an error
	 */
	public static final class Result {
		private final Map<String, Map<String, DictConfValue>> document;
		private final ErrorType errorType;
		private final String errorMessage;
		private final int errorLine;

		Result (Map<String, Map<String, DictConfValue>> document, ErrorType errorType, String errorMessage, int errorLine) {
			this.document = document;
			this.errorType = errorType;
			this.errorMessage = errorMessage;
			this.errorLine = errorLine;
		}

		public boolean isSuccess () {
			return errorType == null;
		}

		/**
		 * @return Block name to block body, in the order blocks were closed, or null on failure
		 */
		public Map<String, Map<String, DictConfValue>> documentGet () {
			return document;
		}

		public ErrorType errorTypeGet () {
			return errorType;
		}

		/**
		 * @return The error message without any line information, or null on success
		 */
		public String errorMessageGet () {
			return errorMessage;
		}

		/**
		 * @return The line the error was found on (1 based), or 0 when unknown
		 */
		public int errorLineGet () {
			return errorLine;
		}

		/**
		 * @return The error with the line number (if available), or an empty string on success
		 */
		public String errorGet () {
			if (isSuccess ())
				return "";

			return (errorLine > 0 ? "Line " + errorLine + ": " : "") + errorMessage;
		}

		@Override
		public String toString () {
			return isSuccess () ? "Result{document=" + document + "}" : "Result{" + errorType + ", " + errorGet () + "}";
		}
	}

	/**
	 * Constructor, prepare empty storage
	 */
	public DictConf () {
		reset ();
	}

	public boolean debugGet () {
		return debug;
	}

	/**
	 * Turns verbose/debug logging to stderr on or off
	 *
	 * @param debug True to log
	 */
	public void debugSet (boolean debug) {
		this.debug = debug;
		expression.debugSet (debug);
	}

	public boolean strictGet () {
		return strict;
	}

	/**
	 * Sets what happens to a block still open at the end of the input
	 *
	 * @param strict True to fail with a STRUCTURE error, false to discard the block silently
	 */
	public void strictSet (boolean strict) {
		this.strict = strict;

		if (debug)
			logD (LOG_TAG, "Set strict=" + strict);
	}

	/**
	 * Returns whether a constant was declared by the last parse
	 *
	 * @param name Name of the constant
	 * @return True if the constant is set
	 */
	public boolean constantHas (String name) {
		return constants.containsKey (name);
	}

	/**
	 * Gets a constant declared by the last parse
	 *
	 * @param name Name of the constant
	 * @return The value, or null if not declared
	 */
	public DictConfValue constantGet (String name) {
		return constants.get (name);
	}

	/**
	 * Retrieves the complete constant table of the last parse
	 */
	public Map<String, DictConfValue> constantStoreGet () {
		return Collections.unmodifiableMap (constants);
	}

	/**
	 * Resets the instance; called at the start of every parse so nothing carries over between inputs
	 */
	public void reset () {
		lineNumber = 0;
		errorType = null;
		errorMessage = null;

		// Fresh maps rather than clear(), results already handed out keep their document
		constants = new HashMap<String, DictConfValue> ();
		document = new LinkedHashMap<String, Map<String, DictConfValue>> ();

		expression = new DictConfExpression (constants);
		expression.debugSet (debug);

		if (debug)
			logD (LOG_TAG, "DictConf reset");
	}

	/**
	 * Parses a complete DictConf source
	 *
	 * @param source The source text, null is treated as empty
	 * @return The document on success, or the first error found
	 */
	public Result parse (String source) {
		reset ();

		if (source == null)
			source = "";

		// Remove any UTF BOM
		if (source.startsWith ("\uFEFF"))
			source = source.substring (1);

		// UNIX-ify any line endings
		source = source.replace ("\r\n", "\n").replace ('\r', '\n');

		if (debug)
			logV (LOG_TAG, "\n" + source);

		if (!parseLines (source.split ("\n", -1)))
			return new Result (null, errorType, errorMessage, lineNumber);

		if (debug)
			logD (LOG_TAG, "Parsed " + document.size () + " block(s) and " + constants.size () + " constant(s)");

		return new Result (Collections.unmodifiableMap (document), null, null, 0);
	}

	/**
	 * Classifies a trimmed line by its prefix
	 *
	 * @param line A line with surrounding whitespace removed
	 * @return The line type; PAIR for anything not otherwise recognised
	 */
	public static LineType lineClassify (String line) {
		if (line.isEmpty () || line.startsWith ("#"))
			return LineType.SKIP;

		if (line.startsWith ("def "))
			return LineType.DECLARATION;

		if (line.startsWith ("@{"))
			return LineType.BLOCK_OPEN;

		if (line.startsWith ("}"))
			return LineType.BLOCK_CLOSE;

		return LineType.PAIR;
	}

	/**
	 * Finds the first free block name of dict1, dict2, dict3, etc
	 *
	 * @param document The blocks named so far
	 * @return A name that is not yet a key of the document
	 */
	public static String blockNameNext (Map<String, ?> document) {
		int index = 1;
		while (document.containsKey (BLOCK_NAME_PREFIX + index))
			++index;

		return BLOCK_NAME_PREFIX + index;
	}

	/**
	 * The block state machine; Idle while block is null, InBlock otherwise
	 */
	private boolean parseLines (String[] lines) {
		Map<String, DictConfValue> block = null;
		int blockLineNumber = 0;

		for (int i = 0, j = lines.length; i < j; ++i) {
			lineNumber = i + 1;
			String line = lines[i].trim ();
			LineType lineType = lineClassify (line);

			if (debug && lineType != LineType.SKIP)
				logV (LOG_TAG, lineNumber + "	" + lineType + (block != null ? " (in block)" : "") + "	" + line);

			switch (lineType) {
				case SKIP:
					break;

				case DECLARATION:
					if (!constantParse (line))
						return false;
					break;

				case BLOCK_OPEN:
					if (block != null)
						return error (ErrorType.STRUCTURE, "Nested dictionaries are not allowed.");

					block = new LinkedHashMap<String, DictConfValue> ();
					blockLineNumber = lineNumber;
					break;

				case BLOCK_CLOSE:
					if (block == null)
						return error (ErrorType.STRUCTURE, "Unexpected line: " + line);

					String blockName = blockNameNext (document);
					document.put (blockName, Collections.unmodifiableMap (block));
					block = null;

					if (debug)
						logD (LOG_TAG, "Closed block " + blockName);
					break;

				case PAIR:
					if (block == null)
						return error (ErrorType.STRUCTURE, "Unexpected line: " + line);

					if (!pairParse (line, block))
						return false;
					break;
			}
		}

		if (block != null) {
			if (strict) {
				lineNumber = blockLineNumber;
				return error (ErrorType.STRUCTURE, "Unclosed block at end of input");
			}

			if (debug)
				logD (LOG_TAG, "Discarding unclosed block opened on line " + blockLineNumber);
		}

		return true;
	}

	/**
	 * Parses <code>def name := expression</code> and stores the result, overwriting any earlier value
	 */
	private boolean constantParse (String line) {
		int i = skipWhitespace (line, 3);
		int nameEnd = identifierEnd (line, i);
		if (nameEnd == i)
			return error (ErrorType.SYNTAX, "Invalid constant definition: " + line);

		String name = line.substring (i, nameEnd);

		i = skipWhitespace (line, nameEnd);
		if (!line.startsWith (":=", i))
			return error (ErrorType.SYNTAX, "Invalid constant definition: " + line);

		String expressionText = line.substring (i + 2).replace ("\n", " ").trim ();
		if (expressionText.isEmpty ())
			return error (ErrorType.SYNTAX, "Invalid constant definition: " + line);

		DictConfValue value = expression.evaluate (expressionText);
		if (value == null)
			return error (expression.errorTypeGet (), expression.errorGet ());

		if (debug)
			logV (LOG_TAG, "Setting constant: " + name + "=" + value);

		constants.put (name, value);
		return true;
	}

	/**
	 * Parses <code>key = value;</code> into the open block; spacing around = and the final ; are mandatory
	 */
	private boolean pairParse (String line, Map<String, DictConfValue> block) {
		int keyEnd = identifierEnd (line, 0);
		if (keyEnd == 0 || !line.startsWith (" = ", keyEnd) || !line.endsWith (";") || line.length () - 1 <= keyEnd + 3)
			return error (ErrorType.SYNTAX, "Invalid key-value pair: " + line);

		DictConfValue value = valueParse (line.substring (keyEnd + 3, line.length () - 1));
		if (value == null)
			return false;

		block.put (line.substring (0, keyEnd), value);
		return true;
	}

	/**
	 * Resolves the value of a key-value pair: integer, float, [[string]] or constant name
	 *
	 * @return The value, or null if error() was called
	 */
	private DictConfValue valueParse (String text) {
		if (DictConfExpression.isDigits (text)) {
			DictConfValue value = expression.integerParse (text);
			if (value == null)
				error (expression.errorTypeGet (), expression.errorGet ());

			return value;
		}

		int dot = text.indexOf ('.');
		if (dot > 0 && DictConfExpression.isDigits (text.substring (0, dot)) && DictConfExpression.isDigits (text.substring (dot + 1)))
			return DictConfValue.ofFloat (Double.parseDouble (text));

		if (text.length () >= 4 && text.startsWith ("[[") && text.endsWith ("]]"))
			return DictConfValue.ofString (text.substring (2, text.length () - 2));

		if (constants.containsKey (text))
			return constants.get (text);

		error (ErrorType.SYNTAX, "Invalid value: " + text);
		return null;
	}

	/**
	 * Finds where an identifier starting at a position ends
	 *
	 * @return Index after the identifier, or start if there is no identifier there
	 */
	private static int identifierEnd (String text, int start) {
		int i = start;
		for (int j = text.length (); i < j; ++i) {
			char c = text.charAt (i);
			boolean letter = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
			if (!letter && (i == start || c < '0' || c > '9'))
				break;
		}

		return i;
	}

	private static int skipWhitespace (String text, int start) {
		while (start < text.length () && Character.isWhitespace (text.charAt (start)))
			++start;

		return start;
	}

	/**
	 * Records an error against the current line
	 *
	 * @return False (used as a placeholder for returns in other methods)
	 */
	private boolean error (ErrorType type, String message) {
		errorType = type;
		errorMessage = (message != null ? message : "Unknown error");

		if (debug)
			logD (LOG_TAG, "Line " + lineNumber + ": " + type + ": " + errorMessage);

		return false;
	}

	/**
	 * Implementation specific logging for Verbose messages
	 *
	 * @param msg The message to log
	 */
	protected static void logV (String tag, String msg) {
		System.err.println ("V: " + (tag.isEmpty () ? "" : tag + ": ") + msg);
	}

	/**
	 * Implementation specific logging for Debug messages
	 *
	 * @param msg The message to log
	 */
	protected static void logD (String tag, String msg) {
		System.err.println ("D: " + (tag.isEmpty () ? "" : tag + ": ") + msg);
	}
}
