//
//  Storage.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.storage;

import java.util.List;

import com.spacehopperstudios.catalog.model.CatalogRecord;
import com.spacehopperstudios.catalog.model.DatabaseMetadata;
import com.spacehopperstudios.catalog.model.Family;
import com.spacehopperstudios.catalog.model.PresenceIndex;

/**
 * The local database as seen by the importer. Implementations report failures with {@link StorageException}.
 * 
 * @author billy1380
 */
public interface Storage {

	/**
	 * Returns the stored metadata, or null if there is none (the database is not one of ours or is damaged)
	 */
	DatabaseMetadata getMetadata();

	void updateMetadata(DatabaseMetadata metadata);

	int countRecords(Family family);

	/**
	 * Names of the columns of the family's table that have an index
	 */
	List<String> getIndexedColumns(Family family);

	void createIndex(Family family, String columnName);

	/**
	 * Scans the family's table and returns an index of the remote ids found, sized to the largest one
	 */
	PresenceIndex loadPresenceIndex(Family family);

	/**
	 * Returns the stored record with the given remote id, or null
	 */
	CatalogRecord getRecordByRemoteId(Family family, int remoteId);

	/**
	 * Returns the record with the latest change-detection timestamp (ties broken by the largest remote id), or null if the family is empty
	 */
	CatalogRecord getLastModifiedRecord(Family family);

	/**
	 * Inserts the records in one go, setting their local ids
	 */
	void addRecords(List<? extends CatalogRecord> records);

	/**
	 * Overwrites the stored records having the same local ids
	 */
	void updateRecords(List<? extends CatalogRecord> records);

	/**
	 * Free bytes on the volume holding the database, or null if that can't be told
	 */
	Long getFreeSpace();
}
