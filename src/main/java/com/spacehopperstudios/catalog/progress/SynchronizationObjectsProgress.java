//
//  SynchronizationObjectsProgress.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.progress;

/**
 * Running totals of a synchronization, across all batches
 */
public class SynchronizationObjectsProgress extends ProgressEvent {

	private final int downloadedObjectCount;
	private final int addedObjectCount;
	private final int updatedObjectCount;

	public SynchronizationObjectsProgress(int downloadedObjectCount, int addedObjectCount, int updatedObjectCount) {
		this.downloadedObjectCount = downloadedObjectCount;
		this.addedObjectCount = addedObjectCount;
		this.updatedObjectCount = updatedObjectCount;
	}

	public int getDownloadedObjectCount() {
		return downloadedObjectCount;
	}

	public int getAddedObjectCount() {
		return addedObjectCount;
	}

	public int getUpdatedObjectCount() {
		return updatedObjectCount;
	}

	@Override
	public String toString() {
		return String.format("Synchronized: %d downloaded, %d added, %d updated", downloadedObjectCount, addedObjectCount, updatedObjectCount);
	}
}
