//
//  DeltaClientFactory.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.sync;

import com.spacehopperstudios.catalog.ingest.FamilyStrategy;
import com.spacehopperstudios.catalog.model.CatalogRecord;
import com.spacehopperstudios.catalog.model.WatermarkCursor;

/**
 * @author billy1380
 *
 */
public interface DeltaClientFactory {

	<T extends CatalogRecord> DeltaClient<T> create(FamilyStrategy<T> strategy, WatermarkCursor start);
}
