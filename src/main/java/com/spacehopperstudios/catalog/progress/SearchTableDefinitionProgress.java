//
//  SearchTableDefinitionProgress.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.progress;

/**
 * Position reached while scanning a dump for the next table definition
 */
public class SearchTableDefinitionProgress extends ProgressEvent {

	private final long currentPosition;
	private final long totalSize;

	public SearchTableDefinitionProgress(long currentPosition, long totalSize) {
		this.currentPosition = currentPosition;
		this.totalSize = totalSize;
	}

	public long getCurrentPosition() {
		return currentPosition;
	}

	public long getTotalSize() {
		return totalSize;
	}

	@Override
	public String toString() {
		return String.format("Searching for table definition: %d of %d bytes", currentPosition, totalSize);
	}
}
