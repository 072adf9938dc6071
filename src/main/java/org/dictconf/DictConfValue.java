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

/**
 * A scalar value held by a constant or a block key; exactly one of integer, float or string
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public final class DictConfValue {
	/** The kinds of value DictConf can represent */
	public static enum Type {
		INTEGER,
		FLOAT,
		STRING
	}

	private final Type type;
	private final long integerValue;
	private final double floatValue;
	private final String stringValue;

	private DictConfValue (Type type, long integerValue, double floatValue, String stringValue) {
		this.type = type;
		this.integerValue = integerValue;
		this.floatValue = floatValue;
		this.stringValue = stringValue;
	}

	public static DictConfValue ofInteger (long value) {
		return new DictConfValue (Type.INTEGER, value, 0, null);
	}

	public static DictConfValue ofFloat (double value) {
		return new DictConfValue (Type.FLOAT, 0, value, null);
	}

	public static DictConfValue ofString (String value) {
		return new DictConfValue (Type.STRING, 0, 0, value == null ? "" : value);
	}

	public Type typeGet () {
		return type;
	}

	/**
	 * @return True for INTEGER and FLOAT values
	 */
	public boolean isNumeric () {
		return type != Type.STRING;
	}

	/**
	 * @return The integer, only meaningful when {@link #typeGet()} is INTEGER
	 */
	public long integerGet () {
		return integerValue;
	}

	/**
	 * @return The float, only meaningful when {@link #typeGet()} is FLOAT
	 */
	public double floatGet () {
		return floatValue;
	}

	/**
	 * @return The string, or null unless {@link #typeGet()} is STRING
	 */
	public String stringGet () {
		return stringValue;
	}

	/**
	 * Widens a numeric value to a double for floating point arithmetic
	 *
	 * @return The value as a double (0 for strings)
	 */
	public double doubleGet () {
		return type == Type.INTEGER ? (double) integerValue : (type == Type.FLOAT ? floatValue : 0);
	}

	/**
	 * Boxes the value into the plain Java type serializers understand
	 *
	 * @return A Long, Double or String
	 */
	public Object toObject () {
		if (type == Type.INTEGER)
			return Long.valueOf (integerValue);

		if (type == Type.FLOAT)
			return Double.valueOf (floatValue);

		return stringValue;
	}

	@Override
	public boolean equals (Object other) {
		if (this == other)
			return true;

		if (!(other instanceof DictConfValue))
			return false;

		DictConfValue value = (DictConfValue) other;
		if (type != value.type)
			return false;

		if (type == Type.INTEGER)
			return integerValue == value.integerValue;

		if (type == Type.FLOAT)
			return Double.compare (floatValue, value.floatValue) == 0;

		return stringValue.equals (value.stringValue);
	}

	@Override
	public int hashCode () {
		return 31 * type.hashCode () + toObject ().hashCode ();
	}

	@Override
	public String toString () {
		return type == Type.STRING ? "[[" + stringValue + "]]" : String.valueOf (toObject ());
	}
}
