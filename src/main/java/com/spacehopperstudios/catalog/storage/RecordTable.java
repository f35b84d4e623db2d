//
//  RecordTable.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.storage;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;

import com.google.common.base.Joiner;
import com.spacehopperstudios.catalog.model.CatalogRecord;
import com.spacehopperstudios.catalog.model.Family;

/**
 * Maps one record family to its local MySQL table.
 * 
 * Every table has the same leading columns (Id, LibgenId, FileId, Language, Format) followed by the family's own columns.
 */
abstract class RecordTable<T extends CatalogRecord> {

	static final String ID_COLUMN = "Id";
	static final String REMOTE_ID_COLUMN = "LibgenId";

	private static final List<String> COMMON_COLUMNS = Arrays.asList(new String[] { REMOTE_ID_COLUMN, "FileId", "Language", "Format" });

	abstract Family getFamily();

	abstract String getTableName();

	/**
	 * Column compared to decide whether a record changed, and used to find the last modified record
	 */
	abstract String getChangeColumn();

	abstract List<String> getOwnColumns();

	/**
	 * Column definitions of the family's own columns, in the order of {@link #getOwnColumns()}
	 */
	abstract List<String> getOwnColumnDefinitions();

	abstract T newRecord();

	/**
	 * Binds the family's own fields starting at parameter index, returning the next free index
	 */
	abstract int bindOwn(PreparedStatement statement, int index, T record) throws SQLException;

	abstract void readOwn(ResultSet resultSet, T record) throws SQLException;

	List<String> getDataColumns() {
		List<String> columns = new ArrayList<String>(COMMON_COLUMNS);
		columns.addAll(getOwnColumns());
		return columns;
	}

	String createTableSql() {
		List<String> definitions = new ArrayList<String>();
		definitions.add(ID_COLUMN + " BIGINT NOT NULL AUTO_INCREMENT");
		definitions.add(REMOTE_ID_COLUMN + " INT NOT NULL");
		definitions.add("FileId INT NULL");
		definitions.add("Language VARCHAR(150) NULL");
		definitions.add("Format VARCHAR(50) NULL");
		definitions.addAll(getOwnColumnDefinitions());
		definitions.add("PRIMARY KEY (" + ID_COLUMN + ")");

		return String.format("CREATE TABLE IF NOT EXISTS %s (%s) DEFAULT CHARSET=utf8mb4", getTableName(), Joiner.on(", ").join(definitions));
	}

	String insertSql() {
		List<String> columns = getDataColumns();
		List<String> parameters = new ArrayList<String>();
		for (int i = 0; i < columns.size(); i++) {
			parameters.add("?");
		}

		return String.format("INSERT INTO %s (%s) VALUES (%s)", getTableName(), Joiner.on(", ").join(columns), Joiner.on(", ").join(parameters));
	}

	String updateSql() {
		List<String> assignments = new ArrayList<String>();
		for (String column : getDataColumns()) {
			assignments.add(column + " = ?");
		}

		return String.format("UPDATE %s SET %s WHERE %s = ?", getTableName(), Joiner.on(", ").join(assignments), ID_COLUMN);
	}

	String indexName(String columnName) {
		return String.format("IX_%s_%s", getTableName(), columnName);
	}

	@SuppressWarnings("unchecked")
	T cast(CatalogRecord record) {
		if (record.getFamily() != getFamily()) {
			throw new IllegalArgumentException(String.format("%s cannot be stored in %s", record, getTableName()));
		}

		return (T) record;
	}

	/**
	 * Binds all data columns, returning the next free parameter index
	 */
	int bind(PreparedStatement statement, T record) throws SQLException {
		int index = 1;
		statement.setInt(index++, record.getRemoteId());

		if (record.getFileId() == null) {
			statement.setNull(index++, Types.INTEGER);
		} else {
			statement.setInt(index++, record.getFileId().intValue());
		}

		statement.setString(index++, record.getLanguage());
		statement.setString(index++, record.getFormat());

		return bindOwn(statement, index, record);
	}

	T read(ResultSet resultSet) throws SQLException {
		T record = newRecord();
		record.setId(resultSet.getLong(ID_COLUMN));
		record.setRemoteId(resultSet.getInt(REMOTE_ID_COLUMN));

		int fileId = resultSet.getInt("FileId");
		record.setFileId(resultSet.wasNull() ? null : Integer.valueOf(fileId));

		record.setLanguage(resultSet.getString("Language"));
		record.setFormat(resultSet.getString("Format"));

		readOwn(resultSet, record);

		return record;
	}

	static void setTimestamp(PreparedStatement statement, int index, Date value) throws SQLException {
		if (value == null) {
			statement.setNull(index, Types.TIMESTAMP);
		} else {
			statement.setTimestamp(index, new Timestamp(value.getTime()));
		}
	}

	static Date getDate(ResultSet resultSet, String column) throws SQLException {
		Timestamp timestamp = resultSet.getTimestamp(column);
		return timestamp == null ? null : new Date(timestamp.getTime());
	}
}
