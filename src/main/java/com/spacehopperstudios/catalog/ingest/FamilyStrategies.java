//
//  FamilyStrategies.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.ingest;

import com.spacehopperstudios.catalog.model.CatalogRecord;
import com.spacehopperstudios.catalog.model.Family;

/**
 * @author billy1380
 *
 */
public class FamilyStrategies {

	public static FamilyStrategy<? extends CatalogRecord> forFamily(Family family) {
		if (family == null) throw new NullPointerException("family cannot be null");

		switch (family) {
		case NON_FICTION:
			return new NonFictionStrategy();
		case FICTION:
			return new FictionStrategy();
		case SCI_MAG:
			return new SciMagStrategy();
		default:
			throw new IllegalArgumentException(String.format("Unsupported family %s", family));
		}
	}

	private FamilyStrategies() {}
}
