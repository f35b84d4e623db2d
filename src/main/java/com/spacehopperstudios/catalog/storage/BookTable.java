//
//  BookTable.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.storage;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.spacehopperstudios.catalog.model.Book;
import com.spacehopperstudios.catalog.model.Family;
import com.spacehopperstudios.catalog.model.FictionBook;
import com.spacehopperstudios.catalog.model.NonFictionBook;

/**
 * Table mapping shared by both book families; each family adds its own trailing column.
 */
abstract class BookTable<T extends Book> extends RecordTable<T> {

	static final String LAST_MODIFIED_COLUMN = "LastModifiedDateTime";

	private static final List<String> BOOK_COLUMNS = Arrays.asList(new String[] { "Title", "Authors", "Series", "Publisher", "Year", "Identifier", "Md5Hash",
			"FileSize", "AddedDateTime", LAST_MODIFIED_COLUMN });

	private static final List<String> BOOK_COLUMN_DEFINITIONS = Arrays.asList(new String[] { "Title VARCHAR(2000) NULL", "Authors VARCHAR(1000) NULL",
			"Series VARCHAR(300) NULL", "Publisher VARCHAR(400) NULL", "Year VARCHAR(14) NULL", "Identifier VARCHAR(300) NULL", "Md5Hash CHAR(32) NULL",
			"FileSize BIGINT NOT NULL DEFAULT 0", "AddedDateTime DATETIME NULL", LAST_MODIFIED_COLUMN + " DATETIME NULL" });

	abstract List<String> getExtraColumns();

	abstract List<String> getExtraColumnDefinitions();

	abstract int bindExtra(PreparedStatement statement, int index, T book) throws SQLException;

	abstract void readExtra(ResultSet resultSet, T book) throws SQLException;

	@Override
	String getChangeColumn() {
		return LAST_MODIFIED_COLUMN;
	}

	@Override
	List<String> getOwnColumns() {
		List<String> columns = new ArrayList<String>(BOOK_COLUMNS);
		columns.addAll(getExtraColumns());
		return columns;
	}

	@Override
	List<String> getOwnColumnDefinitions() {
		List<String> definitions = new ArrayList<String>(BOOK_COLUMN_DEFINITIONS);
		definitions.addAll(getExtraColumnDefinitions());
		return definitions;
	}

	@Override
	int bindOwn(PreparedStatement statement, int index, T book) throws SQLException {
		statement.setString(index++, book.getTitle());
		statement.setString(index++, book.getAuthors());
		statement.setString(index++, book.getSeries());
		statement.setString(index++, book.getPublisher());
		statement.setString(index++, book.getYear());
		statement.setString(index++, book.getIdentifier());
		statement.setString(index++, book.getMd5Hash());
		statement.setLong(index++, book.getFileSize());
		setTimestamp(statement, index++, book.getAddedDateTime());
		setTimestamp(statement, index++, book.getLastModifiedDateTime());

		return bindExtra(statement, index, book);
	}

	@Override
	void readOwn(ResultSet resultSet, T book) throws SQLException {
		book.setTitle(resultSet.getString("Title"));
		book.setAuthors(resultSet.getString("Authors"));
		book.setSeries(resultSet.getString("Series"));
		book.setPublisher(resultSet.getString("Publisher"));
		book.setYear(resultSet.getString("Year"));
		book.setIdentifier(resultSet.getString("Identifier"));
		book.setMd5Hash(resultSet.getString("Md5Hash"));
		book.setFileSize(resultSet.getLong("FileSize"));
		book.setAddedDateTime(getDate(resultSet, "AddedDateTime"));
		book.setLastModifiedDateTime(getDate(resultSet, LAST_MODIFIED_COLUMN));
		readExtra(resultSet, book);
	}

	static class NonFiction extends BookTable<NonFictionBook> {

		@Override
		Family getFamily() {
			return Family.NON_FICTION;
		}

		@Override
		String getTableName() {
			return "non_fiction";
		}

		@Override
		NonFictionBook newRecord() {
			return new NonFictionBook();
		}

		@Override
		List<String> getExtraColumns() {
			return Arrays.asList(new String[] { "Pages", "Topic" });
		}

		@Override
		List<String> getExtraColumnDefinitions() {
			return Arrays.asList(new String[] { "Pages VARCHAR(100) NULL", "Topic VARCHAR(500) NULL" });
		}

		@Override
		int bindExtra(PreparedStatement statement, int index, NonFictionBook book) throws SQLException {
			statement.setString(index++, book.getPages());
			statement.setString(index++, book.getTopic());
			return index;
		}

		@Override
		void readExtra(ResultSet resultSet, NonFictionBook book) throws SQLException {
			book.setPages(resultSet.getString("Pages"));
			book.setTopic(resultSet.getString("Topic"));
		}
	}

	static class Fiction extends BookTable<FictionBook> {

		@Override
		Family getFamily() {
			return Family.FICTION;
		}

		@Override
		String getTableName() {
			return "fiction";
		}

		@Override
		FictionBook newRecord() {
			return new FictionBook();
		}

		@Override
		List<String> getExtraColumns() {
			return Arrays.asList(new String[] { "Edition" });
		}

		@Override
		List<String> getExtraColumnDefinitions() {
			return Arrays.asList(new String[] { "Edition VARCHAR(60) NULL" });
		}

		@Override
		int bindExtra(PreparedStatement statement, int index, FictionBook book) throws SQLException {
			statement.setString(index++, book.getEdition());
			return index;
		}

		@Override
		void readExtra(ResultSet resultSet, FictionBook book) throws SQLException {
			book.setEdition(resultSet.getString("Edition"));
		}
	}
}
