//
//  MergeEngine.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.ingest;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.log4j.Logger;

import com.spacehopperstudios.catalog.CancellationToken;
import com.spacehopperstudios.catalog.Constants;
import com.spacehopperstudios.catalog.model.CatalogRecord;
import com.spacehopperstudios.catalog.model.ImportResult;
import com.spacehopperstudios.catalog.model.PresenceIndex;
import com.spacehopperstudios.catalog.storage.Storage;

/**
 * Inserts records not seen before and updates those carrying newer data, for any family.
 * 
 * Writes are buffered and flushed (inserts first, then updates) every checkpoint interval. At each checkpoint the totals are reported and the free
 * space is checked. Flushed batches stay stored whatever happens afterwards.
 * 
 * @author billy1380
 */
public class MergeEngine<T extends CatalogRecord> {

	private static final Logger LOGGER = Logger.getLogger(MergeEngine.class);

	private final FamilyStrategy<T> strategy;
	private final long lowDiskSpaceThreshold;

	private final Map<Integer, T> pendingInserts = new LinkedHashMap<Integer, T>();
	private final Map<Integer, T> pendingUpdates = new LinkedHashMap<Integer, T>();
	private int addedObjectCount;
	private int updatedObjectCount;

	public MergeEngine(FamilyStrategy<T> strategy) {
		this(strategy, Constants.LOW_DISK_SPACE_THRESHOLD_BYTES);
	}

	public MergeEngine(FamilyStrategy<T> strategy, long lowDiskSpaceThreshold) {
		if (strategy == null) throw new NullPointerException("strategy cannot be null");

		this.strategy = strategy;
		this.lowDiskSpaceThreshold = lowDiskSpaceThreshold;
	}

	public ImportResult importRecords(Iterator<T> records, PresenceIndex presenceIndex, ImportProgressReporter progressReporter, int checkpointInterval,
			Storage storage, CancellationToken cancellationToken) {
		if (checkpointInterval <= 0) throw new IllegalArgumentException("checkpointInterval must be positive");

		pendingInserts.clear();
		pendingUpdates.clear();
		addedObjectCount = 0;
		updatedObjectCount = 0;

		int processed = 0;

		while (records.hasNext()) {
			if (cancellationToken.isCancellationRequested()) {
				flush(storage);

				if (LOGGER.isInfoEnabled()) {
					LOGGER.info(String.format("%s merge cancelled after %d records", strategy.getFamily(), processed));
				}

				return ImportResult.cancelled(addedObjectCount, updatedObjectCount);
			}

			merge(records.next(), presenceIndex, storage);
			processed++;

			if (processed % checkpointInterval == 0) {
				flush(storage);

				Long freeSpace = storage.getFreeSpace();
				progressReporter.report(addedObjectCount, updatedObjectCount, freeSpace);

				if (freeSpace != null && freeSpace.longValue() < lowDiskSpaceThreshold) {
					LOGGER.warn(String.format("Stopping %s merge, only %d bytes left", strategy.getFamily(), freeSpace));

					return ImportResult.lowDiskSpace(addedObjectCount, updatedObjectCount);
				}
			}
		}

		flush(storage);
		progressReporter.report(addedObjectCount, updatedObjectCount, storage.getFreeSpace());

		if (LOGGER.isInfoEnabled()) {
			LOGGER.info(String.format("%s merge done: %d records, %d added, %d updated", strategy.getFamily(), processed, addedObjectCount,
					updatedObjectCount));
		}

		return ImportResult.completed(addedObjectCount, updatedObjectCount);
	}

	private void merge(T record, PresenceIndex presenceIndex, Storage storage) {
		Integer remoteId = Integer.valueOf(strategy.getRemoteId(record));

		if (!presenceIndex.contains(remoteId.intValue())) {
			pendingInserts.put(remoteId, record);
			presenceIndex.add(remoteId.intValue());
			return;
		}

		T pendingInsert = pendingInserts.get(remoteId);
		if (pendingInsert != null) {
			// not stored yet, the newer copy simply replaces the queued one
			if (strategy.isNewer(record, pendingInsert)) {
				pendingInserts.put(remoteId, record);
			}
			return;
		}

		T existing = pendingUpdates.get(remoteId);
		if (existing == null) {
			existing = strategy.findExisting(storage, remoteId.intValue());
		}

		if (existing == null) {
			LOGGER.warn(String.format("%s %d is marked present but is not stored, inserting it", strategy.getFamily(), remoteId));
			pendingInserts.put(remoteId, record);
		} else if (strategy.isNewer(record, existing)) {
			record.setId(existing.getId());
			pendingUpdates.put(remoteId, record);
		}
	}

	private void flush(Storage storage) {
		if (!pendingInserts.isEmpty()) {
			storage.addRecords(new ArrayList<T>(pendingInserts.values()));
			addedObjectCount += pendingInserts.size();
			pendingInserts.clear();
		}

		if (!pendingUpdates.isEmpty()) {
			storage.updateRecords(new ArrayList<T>(pendingUpdates.values()));
			updatedObjectCount += pendingUpdates.size();
			pendingUpdates.clear();
		}
	}
}
