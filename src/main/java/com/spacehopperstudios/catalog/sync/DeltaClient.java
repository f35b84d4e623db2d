//
//  DeltaClient.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.sync;

import java.util.List;

import com.spacehopperstudios.catalog.CancellationToken;
import com.spacehopperstudios.catalog.OperationCancelledException;
import com.spacehopperstudios.catalog.model.CatalogRecord;
import com.spacehopperstudios.catalog.model.WatermarkCursor;

/**
 * Pages through the remote changes of one family, oldest first, starting after a watermark.
 * 
 * @author billy1380
 */
public interface DeltaClient<T extends CatalogRecord> {

	/**
	 * Returns the next records strictly after the cursor, in watermark order, and advances the cursor past them. An empty list means there is
	 * nothing more to fetch.
	 */
	List<T> fetchNextBatch(CancellationToken cancellationToken) throws DeltaFetchException, OperationCancelledException;

	WatermarkCursor getCursor();
}
