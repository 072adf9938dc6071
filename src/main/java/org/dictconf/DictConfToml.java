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

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

/**
 * Writes a parsed DictConf document as TOML, one table per block
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public final class DictConfToml {
	private static final TomlMapper MAPPER = new TomlMapper ();

	private DictConfToml () {
	}

	/**
	 * Renders a document as TOML text
	 *
	 * @param document The document from {@link DictConf.Result#documentGet()}
	 * @return The TOML text
	 * @throws JsonProcessingException If Jackson cannot write the document
	 */
	public static String write (Map<String, Map<String, DictConfValue>> document) throws JsonProcessingException {
		return MAPPER.writeValueAsString (toObjects (document));
	}

	/**
	 * Reads TOML text into a tree, used to check what {@link #write(Map)} produced
	 *
	 * @param toml TOML text
	 * @return The root table
	 * @throws JsonProcessingException If the text is not valid TOML
	 */
	public static JsonNode read (String toml) throws JsonProcessingException {
		return MAPPER.readTree (toml);
	}

	/**
	 * Unwraps values into the Long, Double and String objects Jackson serializes natively, keeping block and key order
	 *
	 * @param document The parsed document
	 * @return Block name to key to plain Java value
	 */
	public static Map<String, Object> toObjects (Map<String, Map<String, DictConfValue>> document) {
		Map<String, Object> tables = new LinkedHashMap<String, Object> ();

		for (Map.Entry<String, Map<String, DictConfValue>> block : document.entrySet ()) {
			Map<String, Object> table = new LinkedHashMap<String, Object> ();
			for (Map.Entry<String, DictConfValue> pair : block.getValue ().entrySet ())
				table.put (pair.getKey (), pair.getValue ().toObject ());

			tables.put (block.getKey (), table);
		}

		return tables;
	}
}
