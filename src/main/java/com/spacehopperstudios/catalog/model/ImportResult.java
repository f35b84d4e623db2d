//  
//  ImportResult.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.model;

/**
 * Outcome of merging one table segment or one remote batch.
 * 
 * @author billy1380
 */
public class ImportResult {

	private final int addedObjectCount;
	private final int updatedObjectCount;
	private final boolean errorLowDiskSpace;
	private final boolean cancelled;

	private ImportResult(int addedObjectCount, int updatedObjectCount, boolean errorLowDiskSpace, boolean cancelled) {
		this.addedObjectCount = addedObjectCount;
		this.updatedObjectCount = updatedObjectCount;
		this.errorLowDiskSpace = errorLowDiskSpace;
		this.cancelled = cancelled;
	}

	public static ImportResult completed(int added, int updated) {
		return new ImportResult(added, updated, false, false);
	}

	public static ImportResult lowDiskSpace(int added, int updated) {
		return new ImportResult(added, updated, true, false);
	}

	public static ImportResult cancelled(int added, int updated) {
		return new ImportResult(added, updated, false, true);
	}

	public int getAddedObjectCount() {
		return addedObjectCount;
	}

	public int getUpdatedObjectCount() {
		return updatedObjectCount;
	}

	public boolean isErrorLowDiskSpace() {
		return errorLowDiskSpace;
	}

	public boolean isCancelled() {
		return cancelled;
	}

	public boolean isSuccessful() {
		return !errorLowDiskSpace && !cancelled;
	}

	@Override
	public String toString() {
		return String.format("{added:%d, updated:%d, lowDiskSpace:%s, cancelled:%s}", addedObjectCount, updatedObjectCount, errorLowDiskSpace, cancelled);
	}
}
