//
//  DatabaseStats.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.model;

import java.util.Date;
import java.util.EnumMap;
import java.util.Map;

/**
 * Record count and latest change time of every family.
 * 
 * @author billy1380
 */
public class DatabaseStats {

	private final Map<Family, Integer> recordCounts = new EnumMap<Family, Integer>(Family.class);
	private final Map<Family, Date> lastUpdates = new EnumMap<Family, Date>(Family.class);

	public void put(Family family, int recordCount, Date lastUpdate) {
		recordCounts.put(family, Integer.valueOf(recordCount));

		if (lastUpdate == null) {
			lastUpdates.remove(family);
		} else {
			lastUpdates.put(family, lastUpdate);
		}
	}

	public int getRecordCount(Family family) {
		Integer count = recordCounts.get(family);
		return count == null ? 0 : count.intValue();
	}

	/**
	 * Change time of the most recently changed record, null for an empty family
	 */
	public Date getLastUpdate(Family family) {
		return lastUpdates.get(family);
	}

	@Override
	public String toString() {
		return String.format("counts %s, last updates %s", recordCounts, lastUpdates);
	}
}
