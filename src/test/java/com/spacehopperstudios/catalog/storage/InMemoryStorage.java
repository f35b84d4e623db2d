//
//  InMemoryStorage.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.storage;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.spacehopperstudios.catalog.Constants;
import com.spacehopperstudios.catalog.ingest.FamilyStrategies;
import com.spacehopperstudios.catalog.ingest.FamilyStrategy;
import com.spacehopperstudios.catalog.model.CatalogRecord;
import com.spacehopperstudios.catalog.model.DatabaseMetadata;
import com.spacehopperstudios.catalog.model.Family;
import com.spacehopperstudios.catalog.model.PresenceIndex;

/**
 * {@link Storage} kept in maps, for tests. Subclass it to simulate disk space or to hook into writes.
 */
public class InMemoryStorage implements Storage {

	private final Map<Family, TreeMap<Integer, CatalogRecord>> records = new EnumMap<Family, TreeMap<Integer, CatalogRecord>>(Family.class);
	private final Map<Family, List<String>> indexedColumns = new EnumMap<Family, List<String>>(Family.class);
	private final List<String> createdIndexes = new ArrayList<String>();
	private DatabaseMetadata metadata;
	private Long freeSpace;
	private long nextId = 1;
	private int addCallCount;
	private int updateCallCount;

	public InMemoryStorage() {
		for (Family family : Family.values()) {
			records.put(family, new TreeMap<Integer, CatalogRecord>());
			indexedColumns.put(family, new ArrayList<String>());
		}

		metadata = new DatabaseMetadata();
		metadata.setAppName(Constants.DATABASE_METADATA_APP_NAME);
		metadata.setVersion(Constants.CURRENT_DATABASE_VERSION);
	}

	public void setMetadata(DatabaseMetadata metadata) {
		this.metadata = metadata;
	}

	public void setFreeSpace(Long freeSpace) {
		this.freeSpace = freeSpace;
	}

	public List<CatalogRecord> getRecords(Family family) {
		return new ArrayList<CatalogRecord>(records.get(family).values());
	}

	public CatalogRecord getRecord(Family family, int remoteId) {
		return records.get(family).get(Integer.valueOf(remoteId));
	}

	/**
	 * "family.column" of every index created so far
	 */
	public List<String> getCreatedIndexes() {
		return createdIndexes;
	}

	public int getAddCallCount() {
		return addCallCount;
	}

	public int getUpdateCallCount() {
		return updateCallCount;
	}

	@Override
	public DatabaseMetadata getMetadata() {
		return metadata;
	}

	@Override
	public void updateMetadata(DatabaseMetadata metadata) {
		this.metadata = metadata;
	}

	@Override
	public int countRecords(Family family) {
		return records.get(family).size();
	}

	@Override
	public List<String> getIndexedColumns(Family family) {
		return new ArrayList<String>(indexedColumns.get(family));
	}

	@Override
	public void createIndex(Family family, String columnName) {
		indexedColumns.get(family).add(columnName);
		createdIndexes.add(family.getCode() + "." + columnName);
	}

	@Override
	public PresenceIndex loadPresenceIndex(Family family) {
		TreeMap<Integer, CatalogRecord> stored = records.get(family);
		return PresenceIndex.build(stored.isEmpty() ? 0 : stored.lastKey().intValue(), stored.keySet());
	}

	@Override
	public CatalogRecord getRecordByRemoteId(Family family, int remoteId) {
		return getRecord(family, remoteId);
	}

	@Override
	public CatalogRecord getLastModifiedRecord(Family family) {
		return lastModified(FamilyStrategies.forFamily(family));
	}

	@Override
	public void addRecords(List<? extends CatalogRecord> added) {
		addCallCount++;

		for (CatalogRecord record : added) {
			if (records.get(record.getFamily()).containsKey(Integer.valueOf(record.getRemoteId()))) {
				throw new StorageException(String.format("Duplicate remote id %d", record.getRemoteId()));
			}

			record.setId(nextId++);
			records.get(record.getFamily()).put(Integer.valueOf(record.getRemoteId()), record);
		}
	}

	@Override
	public void updateRecords(List<? extends CatalogRecord> updated) {
		updateCallCount++;

		for (CatalogRecord record : updated) {
			CatalogRecord stored = records.get(record.getFamily()).get(Integer.valueOf(record.getRemoteId()));

			if (stored == null || stored.getId() != record.getId()) {
				throw new StorageException(String.format("No stored record with id %d", record.getId()));
			}

			records.get(record.getFamily()).put(Integer.valueOf(record.getRemoteId()), record);
		}
	}

	@Override
	public Long getFreeSpace() {
		return freeSpace;
	}

	private <T extends CatalogRecord> CatalogRecord lastModified(FamilyStrategy<T> strategy) {
		T last = null;

		for (CatalogRecord record : records.get(strategy.getFamily()).values()) {
			T candidate = strategy.cast(record);

			if (last == null || strategy.getWatermark(candidate).compareTo(strategy.getWatermark(last)) > 0) {
				last = candidate;
			}
		}

		return last;
	}
}
