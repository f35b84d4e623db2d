//
//  ParsedTableDefinition.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Joiner;

/**
 * Table name and columns read from one CREATE TABLE statement of a dump.
 * 
 * @author billy1380
 */
public class ParsedTableDefinition {

	private final String tableName;
	private final List<ParsedColumnDefinition> columns;

	public ParsedTableDefinition(String tableName, List<ParsedColumnDefinition> columns) {
		this.tableName = tableName;
		this.columns = Collections.unmodifiableList(new ArrayList<ParsedColumnDefinition>(columns));
	}

	public String getTableName() {
		return tableName;
	}

	public List<ParsedColumnDefinition> getColumns() {
		return columns;
	}

	/**
	 * Position of the named column (any case) in the table's rows, or -1 if the table has no such column
	 */
	public int getColumnIndex(String columnName) {
		for (int i = 0; i < columns.size(); i++) {
			if (columns.get(i).getColumnName().equalsIgnoreCase(columnName)) {
				return i;
			}
		}

		return -1;
	}

	@Override
	public String toString() {
		return String.format("%s (%s)", tableName, Joiner.on(", ").join(columns));
	}
}
