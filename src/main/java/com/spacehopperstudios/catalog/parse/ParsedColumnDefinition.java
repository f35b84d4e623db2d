//
//  ParsedColumnDefinition.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.parse;

import com.spacehopperstudios.catalog.schema.ColumnType;

/**
 * @author billy1380
 * 
 */
public class ParsedColumnDefinition {

	private final String columnName;
	private final ColumnType columnType;

	public ParsedColumnDefinition(String columnName, ColumnType columnType) {
		this.columnName = columnName;
		this.columnType = columnType;
	}

	public String getColumnName() {
		return columnName;
	}

	public ColumnType getColumnType() {
		return columnType;
	}

	@Override
	public String toString() {
		return columnName + " " + columnType;
	}
}
