//
//  FictionStrategy.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.ingest;

import com.spacehopperstudios.catalog.model.Family;
import com.spacehopperstudios.catalog.model.FictionBook;

public class FictionStrategy extends BookStrategy<FictionBook> {

	@Override
	public Family getFamily() {
		return Family.FICTION;
	}

	@Override
	FictionBook newRecord() {
		return new FictionBook();
	}

	@Override
	void map(RecordFields fields, FictionBook book) {
		super.map(fields, book);

		book.setEdition(text(fields.get("Edition")));
	}
}
