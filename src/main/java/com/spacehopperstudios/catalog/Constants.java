//
//  Constants.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog;

/**
 * @author billy1380
 * 
 */
public class Constants {

	public static final String DATABASE_METADATA_APP_NAME = "catalogimporter";
	public static final String CURRENT_DATABASE_VERSION = "1.0";

	/**
	 * Imports stop once the storage volume has less than this much free space
	 */
	public static final long LOW_DISK_SPACE_THRESHOLD_BYTES = 100L * 1024 * 1024;

	/**
	 * Number of records merged between two progress reports / disk space checks during a dump import
	 */
	public static final int IMPORT_PROGRESS_UPDATE_INTERVAL = 1000;

	/**
	 * Same as {@link #IMPORT_PROGRESS_UPDATE_INTERVAL} but for synchronization batches, which are much smaller
	 */
	public static final int SYNCHRONIZATION_PROGRESS_UPDATE_INTERVAL = 100;

	public static final int SYNCHRONIZATION_BATCH_SIZE = 1000;

	/**
	 * Minimum number of milliseconds between two search progress events
	 */
	public static final long SEARCH_PROGRESS_REPORT_INTERVAL = 200;

	private Constants() {}
}
