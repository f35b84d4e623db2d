//
//  SchemaMatcher.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.schema;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import org.apache.log4j.Logger;

import com.spacehopperstudios.catalog.model.Family;
import com.spacehopperstudios.catalog.parse.ParsedColumnDefinition;
import com.spacehopperstudios.catalog.parse.ParsedTableDefinition;

/**
 * Works out which record family a dump segment holds.
 * 
 * A segment is only recognised when its table is in {@link TableDefinitions} and its columns are exactly the expected ones (names compared ignoring case,
 * types equal). Anything else is unknown; skipping a segment is better than importing it into the wrong family.
 * 
 * @author billy1380
 */
public class SchemaMatcher {

	private static final Logger LOGGER = Logger.getLogger(SchemaMatcher.class);

	/**
	 * Returns the family of the parsed table, or null if it is unknown
	 */
	public Family match(ParsedTableDefinition parsedTableDefinition) {
		TableDefinition tableDefinition = TableDefinitions.get(parsedTableDefinition.getTableName());

		if (tableDefinition == null) {
			if (LOGGER.isDebugEnabled()) {
				LOGGER.debug(String.format("Table %s is not a catalog table", parsedTableDefinition.getTableName()));
			}

			return null;
		}

		if (parsedTableDefinition.getColumns().size() != tableDefinition.getColumnCount()) {
			LOGGER.info(String.format("Table %s has %d columns, expected %d", parsedTableDefinition.getTableName(), parsedTableDefinition.getColumns().size(),
					tableDefinition.getColumnCount()));
			return null;
		}

		Set<String> seen = new HashSet<String>();

		for (ParsedColumnDefinition parsedColumn : parsedTableDefinition.getColumns()) {
			ColumnDefinition expected = tableDefinition.getColumn(parsedColumn.getColumnName());

			if (expected == null || expected.getColumnType() != parsedColumn.getColumnType()
					|| !seen.add(parsedColumn.getColumnName().toLowerCase(Locale.ROOT))) {
				LOGGER.info(String.format("Column %s of table %s does not match the expected schema", parsedColumn, parsedTableDefinition.getTableName()));
				return null;
			}
		}

		return tableDefinition.getFamily();
	}
}
