//
//  ImporterOptions.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog;

/**
 * Tuning of a {@link CatalogImporter}; defaults come from {@link Constants}.
 * 
 * @author billy1380
 */
public class ImporterOptions {

	private int importCheckpointInterval = Constants.IMPORT_PROGRESS_UPDATE_INTERVAL;
	private int synchronizationCheckpointInterval = Constants.SYNCHRONIZATION_PROGRESS_UPDATE_INTERVAL;
	private long lowDiskSpaceThreshold = Constants.LOW_DISK_SPACE_THRESHOLD_BYTES;

	public int getImportCheckpointInterval() {
		return importCheckpointInterval;
	}

	public ImporterOptions setImportCheckpointInterval(int importCheckpointInterval) {
		if (importCheckpointInterval <= 0) throw new IllegalArgumentException("importCheckpointInterval must be positive");

		this.importCheckpointInterval = importCheckpointInterval;
		return this;
	}

	public int getSynchronizationCheckpointInterval() {
		return synchronizationCheckpointInterval;
	}

	public ImporterOptions setSynchronizationCheckpointInterval(int synchronizationCheckpointInterval) {
		if (synchronizationCheckpointInterval <= 0) throw new IllegalArgumentException("synchronizationCheckpointInterval must be positive");

		this.synchronizationCheckpointInterval = synchronizationCheckpointInterval;
		return this;
	}

	public long getLowDiskSpaceThreshold() {
		return lowDiskSpaceThreshold;
	}

	public ImporterOptions setLowDiskSpaceThreshold(long lowDiskSpaceThreshold) {
		this.lowDiskSpaceThreshold = lowDiskSpaceThreshold;
		return this;
	}
}
