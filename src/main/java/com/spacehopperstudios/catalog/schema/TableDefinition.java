//
//  TableDefinition.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.spacehopperstudios.catalog.model.Family;

/**
 * Expected shape of the upstream table holding one record family. Column lookups are case-insensitive.
 * 
 * @author billy1380
 */
public class TableDefinition {

	private final String tableName;
	private final Family family;
	private final Map<String, ColumnDefinition> columns;

	public TableDefinition(String tableName, Family family, ColumnDefinition... columns) {
		this.tableName = tableName;
		this.family = family;

		Map<String, ColumnDefinition> columnMap = new LinkedHashMap<String, ColumnDefinition>();
		for (ColumnDefinition column : columns) {
			if (columnMap.put(column.getColumnName().toLowerCase(Locale.ROOT), column) != null) {
				throw new IllegalArgumentException(String.format("Column %s is defined twice in %s", column.getColumnName(), tableName));
			}
		}

		this.columns = Collections.unmodifiableMap(columnMap);
	}

	public String getTableName() {
		return tableName;
	}

	public Family getFamily() {
		return family;
	}

	/**
	 * Returns the column with the given name (any case), or null
	 */
	public ColumnDefinition getColumn(String columnName) {
		return columnName == null ? null : columns.get(columnName.toLowerCase(Locale.ROOT));
	}

	public int getColumnCount() {
		return columns.size();
	}

	/**
	 * Columns in declaration order
	 */
	public List<ColumnDefinition> getColumns() {
		return new ArrayList<ColumnDefinition>(columns.values());
	}
}
