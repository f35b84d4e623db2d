//
//  NonFictionStrategy.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.ingest;

import com.spacehopperstudios.catalog.model.Family;
import com.spacehopperstudios.catalog.model.NonFictionBook;

public class NonFictionStrategy extends BookStrategy<NonFictionBook> {

	@Override
	public Family getFamily() {
		return Family.NON_FICTION;
	}

	@Override
	NonFictionBook newRecord() {
		return new NonFictionBook();
	}

	@Override
	void map(RecordFields fields, NonFictionBook book) {
		super.map(fields, book);

		book.setPages(text(fields.get("Pages")));
		book.setTopic(text(fields.get("Topic")));
	}
}
