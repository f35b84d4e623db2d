//
//  DiskSpaceProgress.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.progress;

public class DiskSpaceProgress extends ProgressEvent {

	private final Long freeSpace;

	public DiskSpaceProgress(Long freeSpace) {
		this.freeSpace = freeSpace;
	}

	/**
	 * Free bytes on the storage volume, null when unknown
	 */
	public Long getFreeSpace() {
		return freeSpace;
	}

	@Override
	public String toString() {
		return freeSpace == null ? "Free space unknown" : String.format("Free space: %d MB", freeSpace.longValue() / (1024 * 1024));
	}
}
