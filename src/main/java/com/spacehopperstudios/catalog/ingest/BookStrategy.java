//
//  BookStrategy.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.ingest;

import java.util.Date;

import com.spacehopperstudios.catalog.model.Book;

/**
 * Books are compared and synchronised on their last modification time.
 * 
 * @author billy1380
 */
abstract class BookStrategy<T extends Book> extends FamilyStrategy<T> {

	@Override
	public Date getChangeTimestamp(T book) {
		return book.getLastModifiedDateTime();
	}

	@Override
	public String getChangeColumn() {
		return "LastModifiedDateTime";
	}

	@Override
	void map(RecordFields fields, T book) {
		book.setTitle(text(fields.get("Title")));
		book.setAuthors(text(fields.get("Author")));
		book.setSeries(text(fields.get("Series")));
		book.setPublisher(text(fields.get("Publisher")));
		book.setYear(text(fields.get("Year")));
		book.setIdentifier(text(fields.get("Identifier")));
		book.setMd5Hash(text(fields.get("MD5")));
		book.setFileSize(parseLong(fields.get("Filesize")));
		book.setAddedDateTime(parseTime(fields.get("TimeAdded")));
		book.setLastModifiedDateTime(parseTime(fields.get("TimeLastModified")));
	}
}
