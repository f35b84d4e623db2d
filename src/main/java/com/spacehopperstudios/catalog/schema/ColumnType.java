//
//  ColumnType.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.schema;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * SQL column types as far as table detection cares about them. Widths, signedness and character sets are ignored.
 * 
 * @author billy1380
 */
public enum ColumnType {
	INT, BIGINT, CHAR_OR_VARCHAR, TEXT, DATE, DATETIME, TIMESTAMP, DOUBLE, OTHER;

	private static final List<String> INT_TYPES = Arrays.asList(new String[] { "TINYINT", "SMALLINT", "MEDIUMINT", "INT", "INTEGER" });
	private static final List<String> TEXT_TYPES = Arrays.asList(new String[] { "TINYTEXT", "TEXT", "MEDIUMTEXT", "LONGTEXT" });
	private static final List<String> DOUBLE_TYPES = Arrays.asList(new String[] { "FLOAT", "DOUBLE", "REAL", "DECIMAL", "NUMERIC" });

	/**
	 * Maps a declared type such as "int(15) unsigned" or "varchar(2000)" to its column type
	 */
	public static ColumnType fromSqlType(String sqlType) {
		if (sqlType == null) {
			return OTHER;
		}

		String name = sqlType.trim().toUpperCase(Locale.ROOT);
		int end = 0;
		while (end < name.length() && Character.isLetter(name.charAt(end))) {
			end++;
		}
		name = name.substring(0, end);

		ColumnType type;

		if (INT_TYPES.contains(name)) {
			type = INT;
		} else if ("BIGINT".equals(name)) {
			type = BIGINT;
		} else if ("CHAR".equals(name) || "VARCHAR".equals(name)) {
			type = CHAR_OR_VARCHAR;
		} else if (TEXT_TYPES.contains(name)) {
			type = TEXT;
		} else if ("DATE".equals(name)) {
			type = DATE;
		} else if ("DATETIME".equals(name)) {
			type = DATETIME;
		} else if ("TIMESTAMP".equals(name)) {
			type = TIMESTAMP;
		} else if (DOUBLE_TYPES.contains(name)) {
			type = DOUBLE;
		} else {
			type = OTHER;
		}

		return type;
	}
}
