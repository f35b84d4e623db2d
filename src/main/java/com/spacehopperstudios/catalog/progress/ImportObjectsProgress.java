//
//  ImportObjectsProgress.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.progress;

/**
 * Running totals of the current dump segment
 */
public class ImportObjectsProgress extends ProgressEvent {

	private final int addedObjectCount;
	private final int updatedObjectCount;

	public ImportObjectsProgress(int addedObjectCount, int updatedObjectCount) {
		this.addedObjectCount = addedObjectCount;
		this.updatedObjectCount = updatedObjectCount;
	}

	public int getAddedObjectCount() {
		return addedObjectCount;
	}

	public int getUpdatedObjectCount() {
		return updatedObjectCount;
	}

	@Override
	public String toString() {
		return String.format("Imported: %d added, %d updated", addedObjectCount, updatedObjectCount);
	}
}
