//
//  FamilyStrategy.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.ingest;

import java.util.Arrays;
import java.util.Date;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.base.Strings;
import com.google.gson.JsonObject;
import com.spacehopperstudios.catalog.TimeHelper;
import com.spacehopperstudios.catalog.model.CatalogRecord;
import com.spacehopperstudios.catalog.model.Family;
import com.spacehopperstudios.catalog.model.WatermarkCursor;
import com.spacehopperstudios.catalog.parse.ParsedTableDefinition;
import com.spacehopperstudios.catalog.storage.Storage;

/**
 * Everything the merge engine and the orchestrator need to know about one record family: how records are keyed, compared, mapped from dumps and from
 * the delta API, and which indexes keep lookups fast.
 * 
 * @author billy1380
 */
public abstract class FamilyStrategy<T extends CatalogRecord> {

	private static final Logger LOGGER = Logger.getLogger(FamilyStrategy.class);

	static final String REMOTE_ID_FIELD = "ID";
	static final String REMOTE_ID_COLUMN = "LibgenId";

	public abstract Family getFamily();

	/**
	 * The change-detection timestamp of the record, also the watermark timestamp; may be null
	 */
	public abstract Date getChangeTimestamp(T record);

	/**
	 * Local column holding the change-detection timestamp
	 */
	public abstract String getChangeColumn();

	abstract T newRecord();

	/**
	 * Copies the family's own fields, the common ones being already set
	 */
	abstract void map(RecordFields fields, T record);

	/**
	 * Local columns that must be indexed before merging into a non-empty table
	 */
	public List<String> getRequiredIndexes() {
		return Arrays.asList(new String[] { REMOTE_ID_COLUMN, getChangeColumn() });
	}

	public int getRemoteId(T record) {
		return record.getRemoteId();
	}

	/**
	 * True when the incoming record carries strictly newer change-detection data than the existing one. Equal timestamps are not newer.
	 */
	public boolean isNewer(T incoming, T existing) {
		Date incomingTimestamp = getChangeTimestamp(incoming);
		Date existingTimestamp = getChangeTimestamp(existing);

		return incomingTimestamp != null && (existingTimestamp == null || incomingTimestamp.after(existingTimestamp));
	}

	public WatermarkCursor getWatermark(T record) {
		return new WatermarkCursor(getChangeTimestamp(record), record.getRemoteId());
	}

	/**
	 * Maps one dump row, or returns null when the row has no usable remote id
	 */
	public T fromRow(ParsedTableDefinition definition, List<String> values) {
		return fromFields(RecordFields.of(definition, values));
	}

	/**
	 * Maps one object of the delta API, or returns null when it has no usable remote id
	 */
	public T fromJson(JsonObject object) {
		return fromFields(RecordFields.of(object));
	}

	public T findExisting(Storage storage, int remoteId) {
		return cast(storage.getRecordByRemoteId(getFamily(), remoteId));
	}

	@SuppressWarnings("unchecked")
	public T cast(CatalogRecord record) {
		if (record != null && record.getFamily() != getFamily()) {
			throw new IllegalArgumentException(String.format("Expected a %s record but got %s", getFamily(), record));
		}

		return (T) record;
	}

	private T fromFields(RecordFields fields) {
		Integer remoteId = parseInteger(fields.get(REMOTE_ID_FIELD));

		if (remoteId == null || remoteId.intValue() < 0) {
			LOGGER.warn(String.format("Skipping %s record with invalid id [%s]", getFamily(), fields.get(REMOTE_ID_FIELD)));
			return null;
		}

		T record = newRecord();
		record.setRemoteId(remoteId.intValue());
		record.setLanguage(text(fields.get("Language")));
		record.setFormat(text(fields.get("Extension")));

		map(fields, record);

		return record;
	}

	static String text(String value) {
		return Strings.emptyToNull(value == null ? null : value.trim());
	}

	static Integer parseInteger(String value) {
		Integer parsed = null;

		if (!Strings.isNullOrEmpty(value)) {
			try {
				parsed = Integer.valueOf(value.trim());
			} catch (NumberFormatException e) {
				if (LOGGER.isDebugEnabled()) {
					LOGGER.debug(String.format("[%s] is not an integer", value));
				}
			}
		}

		return parsed;
	}

	static long parseLong(String value) {
		long parsed = 0;

		if (!Strings.isNullOrEmpty(value)) {
			try {
				parsed = Long.parseLong(value.trim());
			} catch (NumberFormatException e) {
				if (LOGGER.isDebugEnabled()) {
					LOGGER.debug(String.format("[%s] is not a number, using 0", value));
				}
			}
		}

		return parsed;
	}

	static Date parseTime(String value) {
		return TimeHelper.parseCatalogTime(value);
	}
}
