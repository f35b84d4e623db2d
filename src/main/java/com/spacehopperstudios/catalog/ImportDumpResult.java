//
//  ImportDumpResult.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog;

/**
 * Outcome of {@link CatalogImporter#importDump}.
 * 
 * @author billy1380
 */
public enum ImportDumpResult {
	COMPLETED,
	CANCELLED,
	/**
	 * No recognised table definition, or a recognised one without data
	 */
	DATA_NOT_FOUND,
	LOW_DISK_SPACE,
	/**
	 * The dump is truncated or the database has no metadata
	 */
	CORRUPTED,
	ERROR
}
