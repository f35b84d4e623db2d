//
//  ColumnDefinition.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.schema;

/**
 * @author billy1380
 * 
 */
public class ColumnDefinition {

	private final String columnName;
	private final ColumnType columnType;

	public ColumnDefinition(String columnName, ColumnType columnType) {
		if (columnName == null) throw new NullPointerException("columnName cannot be null");
		if (columnType == null) throw new NullPointerException("columnType cannot be null");

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
