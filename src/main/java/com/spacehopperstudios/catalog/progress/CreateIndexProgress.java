//
//  CreateIndexProgress.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.progress;

import com.spacehopperstudios.catalog.model.Family;

public class CreateIndexProgress extends ProgressEvent {

	private final Family family;
	private final String columnName;

	public CreateIndexProgress(Family family, String columnName) {
		this.family = family;
		this.columnName = columnName;
	}

	public Family getFamily() {
		return family;
	}

	public String getColumnName() {
		return columnName;
	}

	@Override
	public String toString() {
		return String.format("Creating %s index on %s", family, columnName);
	}
}
