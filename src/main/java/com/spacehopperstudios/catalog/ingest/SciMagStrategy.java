//
//  SciMagStrategy.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.ingest;

import java.util.Date;

import com.spacehopperstudios.catalog.model.Family;
import com.spacehopperstudios.catalog.model.SciMagArticle;

/**
 * Articles are never modified upstream once added, so the added time is both the change-detection field and the watermark.
 * 
 * @author billy1380
 */
public class SciMagStrategy extends FamilyStrategy<SciMagArticle> {

	@Override
	public Family getFamily() {
		return Family.SCI_MAG;
	}

	@Override
	public Date getChangeTimestamp(SciMagArticle article) {
		return article.getAddedDateTime();
	}

	@Override
	public String getChangeColumn() {
		return "AddedDateTime";
	}

	@Override
	SciMagArticle newRecord() {
		return new SciMagArticle();
	}

	@Override
	void map(RecordFields fields, SciMagArticle article) {
		article.setDoi(text(fields.get("DOI")));
		article.setTitle(text(fields.get("Title")));
		article.setAuthors(text(fields.get("Author")));
		article.setJournal(text(fields.get("Journal")));
		article.setYear(text(fields.get("Year")));
		article.setVolume(text(fields.get("Volume")));
		article.setIssue(text(fields.get("Issue")));
		article.setFirstPage(text(fields.get("First_page")));
		article.setLastPage(text(fields.get("Last_page")));
		article.setMd5Hash(text(fields.get("MD5")));
		article.setFileSize(parseLong(fields.get("Filesize")));
		article.setAddedDateTime(parseTime(fields.get("TimeAdded")));
	}
}
