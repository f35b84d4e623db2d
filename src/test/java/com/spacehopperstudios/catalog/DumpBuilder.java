//
//  DumpBuilder.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

import com.google.common.base.Charsets;
import com.google.common.base.Joiner;
import com.google.common.io.Files;
import com.spacehopperstudios.catalog.schema.ColumnDefinition;
import com.spacehopperstudios.catalog.schema.TableDefinition;

/**
 * Writes small mysqldump style files for tests.
 */
public class DumpBuilder {

	private final StringBuilder sql = new StringBuilder();

	public DumpBuilder() {
		line("-- MySQL dump 10.13  Distrib 5.7.22, for Linux (x86_64)");
		line("/*!40101 SET NAMES utf8 */;");
		line("");
	}

	/**
	 * Field name/value pairs of one row; unnamed columns are NULL
	 */
	public static Map<String, String> row(String... namesAndValues) {
		Map<String, String> row = new LinkedHashMap<String, String>();

		for (int i = 0; i + 1 < namesAndValues.length; i += 2) {
			row.put(namesAndValues[i].toLowerCase(), namesAndValues[i + 1]);
		}

		return row;
	}

	public DumpBuilder line(String text) {
		sql.append(text).append('\n');
		return this;
	}

	public DumpBuilder createTable(TableDefinition definition) {
		line(String.format("DROP TABLE IF EXISTS `%s`;", definition.getTableName()));
		line(String.format("CREATE TABLE `%s` (", definition.getTableName()));

		for (ColumnDefinition column : definition.getColumns()) {
			line(String.format("  `%s` %s DEFAULT NULL,", column.getColumnName(), sqlType(column)));
		}

		line("  PRIMARY KEY (`ID`),");
		line("  KEY `MD5` (`MD5`)");
		line(") ENGINE=MyISAM DEFAULT CHARSET=utf8;");
		line("");

		return this;
	}

	/**
	 * One INSERT statement holding all the rows
	 */
	public DumpBuilder insert(TableDefinition definition, List<Map<String, String>> rows) {
		List<String> tuples = new ArrayList<String>();

		for (Map<String, String> row : rows) {
			List<String> values = new ArrayList<String>();

			for (ColumnDefinition column : definition.getColumns()) {
				values.add(sqlValue(column, row.get(column.getColumnName().toLowerCase())));
			}

			tuples.add("(" + Joiner.on(",").join(values) + ")");
		}

		line(String.format("LOCK TABLES `%s` WRITE;", definition.getTableName()));
		line(String.format("INSERT INTO `%s` VALUES %s;", definition.getTableName(), Joiner.on(",").join(tuples)));
		line("UNLOCK TABLES;");

		return this;
	}

	public File writeTo(File file) throws IOException {
		Files.asCharSink(file, Charsets.UTF_8).write(sql);
		return file;
	}

	public File writeGzipTo(File file) throws IOException {
		OutputStream stream = new GZIPOutputStream(new FileOutputStream(file));

		try {
			stream.write(sql.toString().getBytes(Charsets.UTF_8));
		} finally {
			stream.close();
		}

		return file;
	}

	@Override
	public String toString() {
		return sql.toString();
	}

	private static String sqlType(ColumnDefinition column) {
		switch (column.getColumnType()) {
		case INT:
			return "int(11)";
		case BIGINT:
			return "bigint(20) unsigned";
		case TEXT:
			return "text";
		case DATE:
			return "date";
		case DATETIME:
			return "datetime";
		case TIMESTAMP:
			return "timestamp";
		case DOUBLE:
			return "double";
		case CHAR_OR_VARCHAR:
			return "varchar(200)";
		default:
			return "blob";
		}
	}

	private static String sqlValue(ColumnDefinition column, String value) {
		if (value == null) {
			return "NULL";
		}

		switch (column.getColumnType()) {
		case INT:
		case BIGINT:
		case DOUBLE:
			return value;
		default:
			return "'" + value.replace("\\", "\\\\").replace("'", "\\'").replace("\n", "\\n") + "'";
		}
	}
}
