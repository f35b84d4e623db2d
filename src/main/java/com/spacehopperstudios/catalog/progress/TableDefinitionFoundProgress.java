//
//  TableDefinitionFoundProgress.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.progress;

import com.spacehopperstudios.catalog.model.Family;

public class TableDefinitionFoundProgress extends ProgressEvent {

	private final Family family;

	public TableDefinitionFoundProgress(Family family) {
		this.family = family;
	}

	public Family getFamily() {
		return family;
	}

	@Override
	public String toString() {
		return String.format("Found %s table definition", family);
	}
}
