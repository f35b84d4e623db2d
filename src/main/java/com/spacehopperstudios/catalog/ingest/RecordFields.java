//
//  RecordFields.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.ingest;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.spacehopperstudios.catalog.parse.ParsedTableDefinition;

/**
 * Named, case-insensitive access to the raw values of one incoming record, whether it came from a dump row or from the delta API.
 * 
 * @author billy1380
 */
abstract class RecordFields {

	/**
	 * Returns the raw value of the field, or null if it is missing or SQL/JSON null
	 */
	abstract String get(String name);

	static RecordFields of(final ParsedTableDefinition definition, final List<String> values) {
		return new RecordFields() {
			@Override
			String get(String name) {
				int index = definition.getColumnIndex(name);
				return index < 0 || index >= values.size() ? null : values.get(index);
			}
		};
	}

	static RecordFields of(JsonObject object) {
		final Map<String, String> values = new HashMap<String, String>();

		for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
			JsonElement value = entry.getValue();

			if (value != null && value.isJsonPrimitive()) {
				values.put(entry.getKey().toLowerCase(Locale.ENGLISH), value.getAsString());
			}
		}

		return new RecordFields() {
			@Override
			String get(String name) {
				return values.get(name.toLowerCase(Locale.ENGLISH));
			}
		};
	}
}
