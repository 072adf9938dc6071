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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Checks the TOML written for parsed documents by reading it back
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class DictConfTomlTest {
	private static Map<String, Map<String, DictConfValue>> parse (String source) {
		DictConf.Result result = new DictConf ().parse (source);
		assertTrue (result.errorGet (), result.isSuccess ());
		return result.documentGet ();
	}

	@Test
	public void _01_ScalarTypes () throws Exception {
		String toml = DictConfToml.write (parse (
			"def ratio := #(/ 1 4)\n"
			+ "def letter := chr(90)\n"
			+ "@{\n"
			+ "count = 42;\n"
			+ "scale = 1.5;\n"
			+ "ratio = ratio;\n"
			+ "letter = letter;\n"
			+ "title = [[Hello, \"world\"]];\n"
			+ "}\n"));

		assertTrue (toml, toml.contains ("dict1"));

		JsonNode table = DictConfToml.read (toml).get ("dict1");
		assertTrue (table.get ("count").isIntegralNumber ());
		assertEquals (42, table.get ("count").asLong ());

		assertTrue (table.get ("scale").isFloatingPointNumber ());
		assertEquals (1.5, table.get ("scale").asDouble (), 0);
		assertTrue (table.get ("ratio").isFloatingPointNumber ());
		assertEquals (0.25, table.get ("ratio").asDouble (), 0);

		assertTrue (table.get ("letter").isTextual ());
		assertEquals ("Z", table.get ("letter").asText ());
		assertEquals ("Hello, \"world\"", table.get ("title").asText ());
	}

	@Test
	public void _02_BlockOrder () throws Exception {
		String toml = DictConfToml.write (parse ("@{\nb = 1;\na = 2;\n}\n@{\nz = [[]];\n}\n"));

		JsonNode root = DictConfToml.read (toml);
		ArrayList<String> blocks = new ArrayList<String> ();
		root.fieldNames ().forEachRemaining (blocks::add);
		assertEquals (Arrays.asList ("dict1", "dict2"), blocks);

		assertEquals (1, root.get ("dict1").get ("b").asLong ());
		assertEquals (2, root.get ("dict1").get ("a").asLong ());
		assertEquals ("", root.get ("dict2").get ("z").asText ());

		// Block one keys are written before block two starts
		assertTrue (toml, toml.indexOf ("dict1") < toml.indexOf ("dict2"));
	}

	@Test
	public void _03_EmptyBlock () throws Exception {
		Map<String, Map<String, DictConfValue>> document = parse ("@{\n}\n@{\nx = 1;\n}\n");
		assertEquals (2, document.size ());
		assertTrue (document.get ("dict1").isEmpty ());

		// Blocks may come out as dotted keys or an inline table, both read back as tables
		JsonNode root = DictConfToml.read (DictConfToml.write (document));
		assertTrue (root.get ("dict1").isObject ());
		assertEquals (0, root.get ("dict1").size ());
		assertTrue (root.get ("dict2").isObject ());
		assertEquals (1, root.get ("dict2").get ("x").asLong ());
	}

	@Test
	public void _04_ToObjects () {
		Map<String, DictConfValue> pairs = new LinkedHashMap<String, DictConfValue> ();
		pairs.put ("i", DictConfValue.ofInteger (3));
		pairs.put ("f", DictConfValue.ofFloat (0.5));
		pairs.put ("s", DictConfValue.ofString ("x"));

		Map<String, Map<String, DictConfValue>> document = new LinkedHashMap<String, Map<String, DictConfValue>> ();
		document.put ("dict1", pairs);

		Map<String, Object> objects = DictConfToml.toObjects (document);
		@SuppressWarnings("unchecked")
		Map<String, Object> table = (Map<String, Object>) objects.get ("dict1");

		assertEquals (Arrays.asList ("i", "f", "s"), new ArrayList<String> (table.keySet ()));
		assertEquals (Long.valueOf (3), table.get ("i"));
		assertEquals (Double.valueOf (0.5), table.get ("f"));
		assertEquals ("x", table.get ("s"));

		assertTrue (DictConfToml.toObjects (new LinkedHashMap<String, Map<String, DictConfValue>> ()).isEmpty ());
	}
}
