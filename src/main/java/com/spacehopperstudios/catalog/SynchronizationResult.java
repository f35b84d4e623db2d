//
//  SynchronizationResult.java
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
public enum SynchronizationResult {
	COMPLETED,
	CANCELLED,
	LOW_DISK_SPACE,
	ERROR
}
