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

import static org.dictconf.DictConf.logD;
import static org.dictconf.DictConf.logV;

import java.util.Map;

import org.dictconf.DictConf.ErrorType;

/**
 * Evaluates the right-hand side of a constant declaration
 * <p>The grammar is deliberately small, tried in this order:</p>
 * <pre>
 * 1. 65               integer literal
 * 2. chr(65)          one character string of that code point
 * 3. #(op left right) binary form, each operand a literal or constant name (never a sub-expression)
 * 4. #(op inner)      unary form, inner is evaluated recursively
 * </pre>
 * <p>Unary operators are not the usual arithmetic ones: + and * pass the value through untouched, - negates and
 * / gives the reciprocal. In the binary form + also joins two strings and * repeats a string by an integer.</p>
 * <p>Like {@link DictConf} this class does not throw on bad input; {@link #evaluate(String)} returns null and the
 * reason is available from {@link #errorTypeGet()} and {@link #errorGet()}.</p>
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class DictConfExpression {
	private static final String LOG_TAG = DictConfExpression.class.getSimpleName ();

	/** Operators understood by both the binary and unary forms */
	private static final String OPERATORS = "+-*/";

	/** Highest value chr() accepts */
	private static final int CODE_POINT_MAX = 0x10FFFF;

	/** Longest string * may build */
	private static final int STRING_LENGTH_MAX = 1 << 24;

	private final Map<String, DictConfValue> constants;
	private boolean debug = false;
	private ErrorType errorType = null;
	private String errorMessage = null;

	/**
	 * Constructor
	 *
	 * @param constants The constant table used to resolve names, read but never written
	 */
	public DictConfExpression (Map<String, DictConfValue> constants) {
		this.constants = constants;
	}

	public void debugSet (boolean debug) {
		this.debug = debug;
	}

	/**
	 * @return The category of the last failure, or null if the last evaluation succeeded
	 */
	public ErrorType errorTypeGet () {
		return errorType;
	}

	/**
	 * @return The message of the last failure, or null if the last evaluation succeeded
	 */
	public String errorGet () {
		return errorMessage;
	}

	/**
	 * Evaluates an expression against the current constant table
	 *
	 * @param expression Expression text, surrounding whitespace is ignored
	 * @return The resulting value, or null on failure (see {@link #errorGet()})
	 */
	public DictConfValue evaluate (String expression) {
		errorType = null;
		errorMessage = null;

		DictConfValue value = evaluateInner (expression.trim ());

		if (debug)
			logV (LOG_TAG, "Evaluated " + expression + " -> " + (value == null ? errorType + ": " + errorMessage : value.typeGet () + " " + value));

		return value;
	}

	/**
	 * Converts a run of decimal digits to an integer value
	 *
	 * @param digits A string for which {@link #isDigits(String)} is true
	 * @return The value, or null if it does not fit in a long
	 */
	public DictConfValue integerParse (String digits) {
		try {
			return DictConfValue.ofInteger (Long.parseLong (digits));
		} catch (NumberFormatException e) {
			return error (ErrorType.EVALUATION, "Integer out of range: " + digits);
		}
	}

	/**
	 * Returns whether a string is a non-empty run of ASCII decimal digits
	 *
	 * @param text The string to check
	 * @return True if only 0-9 are present
	 */
	public static boolean isDigits (String text) {
		if (text.isEmpty ())
			return false;

		for (int i = 0, j = text.length (); i < j; ++i) {
			char c = text.charAt (i);
			if (c < '0' || c > '9')
				return false;
		}

		return true;
	}

	private DictConfValue evaluateInner (String expression) {
		// Rule 1, integer literal
		if (isDigits (expression))
			return integerParse (expression);

		// Rule 2, chr(n)
		if (expression.startsWith ("chr(") && expression.endsWith (")")) {
			String inner = expression.substring (4, expression.length () - 1);
			if (isDigits (inner))
				return characterOf (inner);
		}

		// Rules 3 and 4, #(op ...)
		if (expression.length () > 3 && expression.startsWith ("#(") && expression.endsWith (")")) {
			char operator = expression.charAt (2);
			if (Character.isWhitespace (operator))
				return error (ErrorType.SYNTAX, "Invalid expression: " + expression);

			if (OPERATORS.indexOf (operator) < 0)
				return error (ErrorType.SYNTAX, "Unsupported operation: " + operator);

			String body = expression.substring (3, expression.length () - 1).trim ();
			if (body.isEmpty ())
				return error (ErrorType.SYNTAX, "Invalid expression: " + expression);

			// Binary only when there are exactly two plain tokens; anything with parentheses is a unary operand
			String[] operands = body.split ("\\s+");
			if (operands.length == 2 && !hasParenthesis (operands[0]) && !hasParenthesis (operands[1])) {
				DictConfValue left = operandResolve (operands[0]);
				if (left == null)
					return null;

				DictConfValue right = operandResolve (operands[1]);
				if (right == null)
					return null;

				return binaryApply (operator, left, right);
			}

			DictConfValue inner = evaluateInner (body);
			if (inner == null)
				return null;

			return unaryApply (operator, inner);
		}

		return error (ErrorType.SYNTAX, "Invalid expression: " + expression);
	}

	/**
	 * Resolves an operand of the binary form; literals and constant names only
	 */
	private DictConfValue operandResolve (String operand) {
		if (isDigits (operand))
			return integerParse (operand);

		if (constants.containsKey (operand))
			return constants.get (operand);

		return error (ErrorType.SYNTAX, "Unknown variable or value: " + operand);
	}

	private DictConfValue binaryApply (char operator, DictConfValue left, DictConfValue right) {
		// Strings join with + and repeat with * by an integer count
		if (operator == '+' && left.typeGet () == DictConfValue.Type.STRING && right.typeGet () == DictConfValue.Type.STRING)
			return DictConfValue.ofString (left.stringGet () + right.stringGet ());

		if (operator == '*' && left.typeGet () == DictConfValue.Type.STRING && right.typeGet () == DictConfValue.Type.INTEGER)
			return stringRepeat (left.stringGet (), right.integerGet ());

		if (operator == '*' && left.typeGet () == DictConfValue.Type.INTEGER && right.typeGet () == DictConfValue.Type.STRING)
			return stringRepeat (right.stringGet (), left.integerGet ());

		if (!left.isNumeric ())
			return error (ErrorType.EVALUATION, "Unsupported operand type for " + operator + ": " + left.typeGet ());

		if (!right.isNumeric ())
			return error (ErrorType.EVALUATION, "Unsupported operand type for " + operator + ": " + right.typeGet ());

		// True division, never floor division
		if (operator == '/') {
			if (right.doubleGet () == 0)
				return error (ErrorType.EVALUATION, "Division by zero");

			return DictConfValue.ofFloat (left.doubleGet () / right.doubleGet ());
		}

		if (left.typeGet () == DictConfValue.Type.INTEGER && right.typeGet () == DictConfValue.Type.INTEGER) {
			long l = left.integerGet (), r = right.integerGet ();
			try {
				if (operator == '+')
					return DictConfValue.ofInteger (Math.addExact (l, r));
				else if (operator == '-')
					return DictConfValue.ofInteger (Math.subtractExact (l, r));
				else
					return DictConfValue.ofInteger (Math.multiplyExact (l, r));
			} catch (ArithmeticException e) {
				if (debug)
					logD (LOG_TAG, "Overflow on " + l + " " + operator + " " + r);

				return error (ErrorType.EVALUATION, "Integer overflow");
			}
		}

		double l = left.doubleGet (), r = right.doubleGet ();
		if (operator == '+')
			return DictConfValue.ofFloat (l + r);
		else if (operator == '-')
			return DictConfValue.ofFloat (l - r);
		else
			return DictConfValue.ofFloat (l * r);
	}

	private DictConfValue unaryApply (char operator, DictConfValue inner) {
		// Identity for + and *, whatever the type
		if (operator == '+' || operator == '*')
			return inner;

		if (!inner.isNumeric ())
			return error (ErrorType.EVALUATION, "Unsupported operand type for " + operator + ": " + inner.typeGet ());

		if (operator == '-') {
			if (inner.typeGet () == DictConfValue.Type.FLOAT)
				return DictConfValue.ofFloat (-inner.floatGet ());

			if (inner.integerGet () == Long.MIN_VALUE)
				return error (ErrorType.EVALUATION, "Integer overflow");

			return DictConfValue.ofInteger (-inner.integerGet ());
		}

		// Reciprocal
		if (inner.doubleGet () == 0)
			return error (ErrorType.EVALUATION, "Division by zero");

		return DictConfValue.ofFloat (1 / inner.doubleGet ());
	}

	/**
	 * Repeats a string count times; a count of zero or less gives the empty string
	 */
	private DictConfValue stringRepeat (String text, long count) {
		if (count <= 0 || text.isEmpty ())
			return DictConfValue.ofString ("");

		if (count > STRING_LENGTH_MAX / text.length ())
			return error (ErrorType.EVALUATION, "Repeated string too long");

		return DictConfValue.ofString (text.repeat ((int) count));
	}

	private DictConfValue characterOf (String digits) {
		long codePoint;
		try {
			codePoint = Long.parseLong (digits);
		} catch (NumberFormatException e) {
			codePoint = -1;
		}

		if (codePoint < 0 || codePoint > CODE_POINT_MAX)
			return error (ErrorType.EVALUATION, "chr() arg not in range(0x110000)");

		// A lone surrogate cannot be encoded as UTF-8 on output
		if (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE)
			return error (ErrorType.EVALUATION, "chr() arg is a surrogate code point: " + codePoint);

		return DictConfValue.ofString (new String (Character.toChars ((int) codePoint)));
	}

	private static boolean hasParenthesis (String token) {
		return token.indexOf ('(') > -1 || token.indexOf (')') > -1;
	}

	/**
	 * Records a failure
	 *
	 * @return Null (used as a placeholder for returns in other methods)
	 */
	private DictConfValue error (ErrorType type, String message) {
		errorType = type;
		errorMessage = message;
		return null;
	}
}
