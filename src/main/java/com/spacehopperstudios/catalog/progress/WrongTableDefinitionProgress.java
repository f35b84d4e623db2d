//
//  WrongTableDefinitionProgress.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.progress;

import com.spacehopperstudios.catalog.model.Family;

/**
 * The dump holds a known table, but not the one the caller asked for
 */
public class WrongTableDefinitionProgress extends ProgressEvent {

	private final Family expectedFamily;
	private final Family actualFamily;

	public WrongTableDefinitionProgress(Family expectedFamily, Family actualFamily) {
		this.expectedFamily = expectedFamily;
		this.actualFamily = actualFamily;
	}

	public Family getExpectedFamily() {
		return expectedFamily;
	}

	public Family getActualFamily() {
		return actualFamily;
	}

	@Override
	public String toString() {
		return String.format("Expected %s table but found %s", expectedFamily, actualFamily);
	}
}
