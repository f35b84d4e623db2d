//
//  ImportProgressReporter.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.ingest;

/**
 * Receives the running totals of a merge at every checkpoint.
 * 
 * @author billy1380
 */
public interface ImportProgressReporter {

	/**
	 * @param freeSpace free bytes on the storage volume, null when unknown
	 */
	void report(int addedObjectCount, int updatedObjectCount, Long freeSpace);
}
