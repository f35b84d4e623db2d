//
//  SciMagTable.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.storage;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;

import com.spacehopperstudios.catalog.model.Family;
import com.spacehopperstudios.catalog.model.SciMagArticle;

class SciMagTable extends RecordTable<SciMagArticle> {

	static final String ADDED_COLUMN = "AddedDateTime";

	@Override
	Family getFamily() {
		return Family.SCI_MAG;
	}

	@Override
	String getTableName() {
		return "scimag";
	}

	@Override
	String getChangeColumn() {
		return ADDED_COLUMN;
	}

	@Override
	List<String> getOwnColumns() {
		return Arrays.asList(new String[] { "Doi", "Title", "Authors", "Journal", "Year", "Volume", "Issue", "FirstPage", "LastPage", "Md5Hash", "FileSize",
				ADDED_COLUMN });
	}

	@Override
	List<String> getOwnColumnDefinitions() {
		return Arrays.asList(new String[] { "Doi VARCHAR(200) NULL", "Title VARCHAR(2000) NULL", "Authors VARCHAR(2000) NULL", "Journal VARCHAR(500) NULL",
				"Year VARCHAR(10) NULL", "Volume VARCHAR(50) NULL", "Issue VARCHAR(50) NULL", "FirstPage VARCHAR(50) NULL", "LastPage VARCHAR(50) NULL",
				"Md5Hash CHAR(32) NULL", "FileSize BIGINT NOT NULL DEFAULT 0", ADDED_COLUMN + " DATETIME NULL" });
	}

	@Override
	SciMagArticle newRecord() {
		return new SciMagArticle();
	}

	@Override
	int bindOwn(PreparedStatement statement, int index, SciMagArticle article) throws SQLException {
		statement.setString(index++, article.getDoi());
		statement.setString(index++, article.getTitle());
		statement.setString(index++, article.getAuthors());
		statement.setString(index++, article.getJournal());
		statement.setString(index++, article.getYear());
		statement.setString(index++, article.getVolume());
		statement.setString(index++, article.getIssue());
		statement.setString(index++, article.getFirstPage());
		statement.setString(index++, article.getLastPage());
		statement.setString(index++, article.getMd5Hash());
		statement.setLong(index++, article.getFileSize());
		setTimestamp(statement, index++, article.getAddedDateTime());

		return index;
	}

	@Override
	void readOwn(ResultSet resultSet, SciMagArticle article) throws SQLException {
		article.setDoi(resultSet.getString("Doi"));
		article.setTitle(resultSet.getString("Title"));
		article.setAuthors(resultSet.getString("Authors"));
		article.setJournal(resultSet.getString("Journal"));
		article.setYear(resultSet.getString("Year"));
		article.setVolume(resultSet.getString("Volume"));
		article.setIssue(resultSet.getString("Issue"));
		article.setFirstPage(resultSet.getString("FirstPage"));
		article.setLastPage(resultSet.getString("LastPage"));
		article.setMd5Hash(resultSet.getString("Md5Hash"));
		article.setFileSize(resultSet.getLong("FileSize"));
		article.setAddedDateTime(getDate(resultSet, ADDED_COLUMN));
	}
}
