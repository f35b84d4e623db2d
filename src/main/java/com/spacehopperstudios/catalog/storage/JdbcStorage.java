//
//  JdbcStorage.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.storage;

import java.io.File;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.spacehopperstudios.catalog.Constants;
import com.spacehopperstudios.catalog.model.CatalogRecord;
import com.spacehopperstudios.catalog.model.DatabaseMetadata;
import com.spacehopperstudios.catalog.model.Family;
import com.spacehopperstudios.catalog.model.PresenceIndex;

/**
 * MySQL backed {@link Storage}, one table per family plus a key/value metadata table.
 * 
 * Batches of inserts and updates are written in a single transaction each, so a checkpoint is either fully stored or not at all.
 * 
 * @author billy1380
 */
public class JdbcStorage implements Storage {

	private static final Logger LOGGER = Logger.getLogger(JdbcStorage.class);

	private static final String METADATA_TABLE = "metadata";
	private static final String METADATA_KEY_APP_NAME = "AppName";
	private static final String METADATA_KEY_VERSION = "Version";
	private static final String METADATA_KEY_FIRST_IMPORT_PREFIX = "FirstImportComplete.";

	private final Connection connection;
	private final File storagePath;
	private final Map<Family, RecordTable<? extends CatalogRecord>> tables = new EnumMap<Family, RecordTable<? extends CatalogRecord>>(Family.class);

	public JdbcStorage(Connection connection, File storagePath) {
		if (connection == null) throw new NullPointerException("connection cannot be null");

		this.connection = connection;
		this.storagePath = storagePath;

		tables.put(Family.NON_FICTION, new BookTable.NonFiction());
		tables.put(Family.FICTION, new BookTable.Fiction());
		tables.put(Family.SCI_MAG, new SciMagTable());
	}

	/**
	 * Creates any missing table. A database without a metadata table is taken as new and gets fresh metadata.
	 */
	public void initialize() {
		try {
			connection.executeQuery(String.format("SHOW TABLES LIKE '%s'", METADATA_TABLE));
			boolean isNew = !connection.fetchNextRow();

			connection.executeQuery(String.format("CREATE TABLE IF NOT EXISTS %s (MetadataKey VARCHAR(100) NOT NULL, MetadataValue VARCHAR(500) NULL, "
					+ "PRIMARY KEY (MetadataKey)) DEFAULT CHARSET=utf8mb4", METADATA_TABLE));

			for (RecordTable<? extends CatalogRecord> table : tables.values()) {
				connection.executeQuery(table.createTableSql());
			}

			if (isNew) {
				LOGGER.info(String.format("Database %s is new, writing metadata", connection.getDatabase()));

				DatabaseMetadata metadata = new DatabaseMetadata();
				metadata.setAppName(Constants.DATABASE_METADATA_APP_NAME);
				metadata.setVersion(Constants.CURRENT_DATABASE_VERSION);
				updateMetadata(metadata);
			}
		} catch (SQLException e) {
			throw new StorageException("Could not initialise the database", e);
		}
	}

	@Override
	public DatabaseMetadata getMetadata() {
		Map<String, String> values = new LinkedHashMap<String, String>();

		try {
			connection.executeQuery(String.format("SELECT MetadataKey, MetadataValue FROM %s", METADATA_TABLE));

			while (connection.fetchNextRow()) {
				values.put(connection.getCurrentRowString("MetadataKey"), connection.getCurrentRowString("MetadataValue"));
			}
		} catch (SQLException e) {
			throw new StorageException("Could not read database metadata", e);
		}

		DatabaseMetadata metadata = null;

		if (values.containsKey(METADATA_KEY_APP_NAME)) {
			metadata = new DatabaseMetadata();
			metadata.setAppName(values.get(METADATA_KEY_APP_NAME));
			metadata.setVersion(values.get(METADATA_KEY_VERSION));

			for (Family family : Family.values()) {
				metadata.setFirstImportComplete(family, Boolean.parseBoolean(values.get(METADATA_KEY_FIRST_IMPORT_PREFIX + family.getCode())));
			}
		}

		return metadata;
	}

	@Override
	public void updateMetadata(DatabaseMetadata metadata) {
		Map<String, String> values = new LinkedHashMap<String, String>();
		values.put(METADATA_KEY_APP_NAME, metadata.getAppName());
		values.put(METADATA_KEY_VERSION, metadata.getVersion());

		for (Family family : Family.values()) {
			values.put(METADATA_KEY_FIRST_IMPORT_PREFIX + family.getCode(), Boolean.toString(metadata.isFirstImportComplete(family)));
		}

		PreparedStatement statement = null;

		try {
			statement = connection.prepare(String.format("REPLACE INTO %s (MetadataKey, MetadataValue) VALUES (?, ?)", METADATA_TABLE), false);

			for (Map.Entry<String, String> entry : values.entrySet()) {
				statement.setString(1, entry.getKey());
				statement.setString(2, entry.getValue());
				statement.addBatch();
			}

			statement.executeBatch();
		} catch (SQLException e) {
			throw new StorageException("Could not write database metadata", e);
		} finally {
			close(statement);
		}
	}

	@Override
	public int countRecords(Family family) {
		RecordTable<? extends CatalogRecord> table = table(family);

		try {
			connection.executeQuery(String.format("SELECT COUNT(*) AS RecordCount FROM %s", table.getTableName()));

			return connection.fetchNextRow() ? connection.getCurrentRowInteger("RecordCount").intValue() : 0;
		} catch (SQLException e) {
			throw new StorageException(String.format("Could not count records in %s", table.getTableName()), e);
		}
	}

	@Override
	public List<String> getIndexedColumns(Family family) {
		RecordTable<? extends CatalogRecord> table = table(family);
		List<String> columns = new ArrayList<String>();

		try {
			connection.executeQuery(String.format("SHOW INDEX FROM %s", table.getTableName()));

			while (connection.fetchNextRow()) {
				String column = connection.getCurrentRowString("Column_name");

				if (!columns.contains(column)) {
					columns.add(column);
				}
			}
		} catch (SQLException e) {
			throw new StorageException(String.format("Could not list indexes of %s", table.getTableName()), e);
		}

		return columns;
	}

	@Override
	public void createIndex(Family family, String columnName) {
		RecordTable<? extends CatalogRecord> table = table(family);

		if (LOGGER.isInfoEnabled()) {
			LOGGER.info(String.format("Creating index on %s.%s", table.getTableName(), columnName));
		}

		try {
			connection.executeQuery(String.format("CREATE INDEX %s ON %s (%s)", table.indexName(columnName), table.getTableName(), columnName));
		} catch (SQLException e) {
			throw new StorageException(String.format("Could not create index on %s.%s", table.getTableName(), columnName), e);
		}
	}

	@Override
	public PresenceIndex loadPresenceIndex(Family family) {
		RecordTable<? extends CatalogRecord> table = table(family);

		try {
			connection.executeQuery(String.format("SELECT MAX(%s) AS MaxId FROM %s", RecordTable.REMOTE_ID_COLUMN, table.getTableName()));

			Integer maxId = connection.fetchNextRow() ? connection.getCurrentRowInteger("MaxId") : null;
			PresenceIndex index = new PresenceIndex(maxId == null ? 0 : maxId.longValue() + 1);

			if (maxId != null) {
				connection.executeQuery(String.format("SELECT %1$s FROM %2$s", RecordTable.REMOTE_ID_COLUMN, table.getTableName()));

				while (connection.fetchNextRow()) {
					index.add(connection.getCurrentRowInteger(RecordTable.REMOTE_ID_COLUMN).intValue());
				}
			}

			if (LOGGER.isDebugEnabled()) {
				LOGGER.debug(String.format("Loaded %d remote ids of %s, bound %d", index.cardinality(), table.getTableName(), index.size()));
			}

			return index;
		} catch (SQLException e) {
			throw new StorageException(String.format("Could not load remote ids of %s", table.getTableName()), e);
		}
	}

	@Override
	public CatalogRecord getRecordByRemoteId(Family family, int remoteId) {
		RecordTable<? extends CatalogRecord> table = table(family);

		return selectOne(table, String.format("SELECT * FROM %s WHERE %s = ? LIMIT 1", table.getTableName(), RecordTable.REMOTE_ID_COLUMN),
				Integer.valueOf(remoteId));
	}

	@Override
	public CatalogRecord getLastModifiedRecord(Family family) {
		RecordTable<? extends CatalogRecord> table = table(family);

		return selectOne(table, String.format("SELECT * FROM %s ORDER BY %s DESC, %s DESC LIMIT 1", table.getTableName(), table.getChangeColumn(),
				RecordTable.REMOTE_ID_COLUMN), null);
	}

	@Override
	public void addRecords(List<? extends CatalogRecord> records) {
		for (Map.Entry<Family, List<CatalogRecord>> entry : byFamily(records).entrySet()) {
			insert(table(entry.getKey()), entry.getValue());
		}
	}

	@Override
	public void updateRecords(List<? extends CatalogRecord> records) {
		for (Map.Entry<Family, List<CatalogRecord>> entry : byFamily(records).entrySet()) {
			update(table(entry.getKey()), entry.getValue());
		}
	}

	@Override
	public Long getFreeSpace() {
		Long freeSpace = null;

		if (storagePath != null && storagePath.exists()) {
			freeSpace = Long.valueOf(storagePath.getUsableSpace());
		}

		return freeSpace;
	}

	private <T extends CatalogRecord> void insert(RecordTable<T> table, List<CatalogRecord> records) {
		PreparedStatement statement = null;
		ResultSet keys = null;

		try {
			connection.setTransactionMode(true);
			statement = connection.prepare(table.insertSql(), true);

			for (CatalogRecord record : records) {
				table.bind(statement, table.cast(record));
				statement.addBatch();
			}

			statement.executeBatch();

			keys = statement.getGeneratedKeys();
			for (CatalogRecord record : records) {
				if (!keys.next()) {
					throw new SQLException(String.format("Missing generated key for %s", record));
				}

				record.setId(keys.getLong(1));
			}

			connection.commit();

			if (LOGGER.isDebugEnabled()) {
				LOGGER.debug(String.format("Inserted %d records into %s", records.size(), table.getTableName()));
			}
		} catch (SQLException e) {
			rollback();
			throw new StorageException(String.format("Could not insert %d records into %s", records.size(), table.getTableName()), e);
		} finally {
			close(keys);
			close(statement);
			leaveTransactionMode();
		}
	}

	private <T extends CatalogRecord> void update(RecordTable<T> table, List<CatalogRecord> records) {
		PreparedStatement statement = null;

		try {
			connection.setTransactionMode(true);
			statement = connection.prepare(table.updateSql(), false);

			for (CatalogRecord record : records) {
				int index = table.bind(statement, table.cast(record));
				statement.setLong(index, record.getId());
				statement.addBatch();
			}

			statement.executeBatch();
			connection.commit();

			if (LOGGER.isDebugEnabled()) {
				LOGGER.debug(String.format("Updated %d records in %s", records.size(), table.getTableName()));
			}
		} catch (SQLException e) {
			rollback();
			throw new StorageException(String.format("Could not update %d records in %s", records.size(), table.getTableName()), e);
		} finally {
			close(statement);
			leaveTransactionMode();
		}
	}

	private CatalogRecord selectOne(RecordTable<? extends CatalogRecord> table, String query, Integer parameter) {
		PreparedStatement statement = null;
		ResultSet resultSet = null;

		try {
			statement = connection.prepare(query, false);

			if (parameter != null) {
				statement.setInt(1, parameter.intValue());
			}

			resultSet = statement.executeQuery();

			return resultSet.next() ? table.read(resultSet) : null;
		} catch (SQLException e) {
			throw new StorageException(String.format("Could not read from %s", table.getTableName()), e);
		} finally {
			close(resultSet);
			close(statement);
		}
	}

	private RecordTable<? extends CatalogRecord> table(Family family) {
		RecordTable<? extends CatalogRecord> table = tables.get(family);

		if (table == null) throw new IllegalArgumentException(String.format("No table for family %s", family));

		return table;
	}

	private static Map<Family, List<CatalogRecord>> byFamily(List<? extends CatalogRecord> records) {
		Map<Family, List<CatalogRecord>> grouped = new EnumMap<Family, List<CatalogRecord>>(Family.class);

		for (CatalogRecord record : records) {
			List<CatalogRecord> familyRecords = grouped.get(record.getFamily());

			if (familyRecords == null) {
				grouped.put(record.getFamily(), familyRecords = new ArrayList<CatalogRecord>());
			}

			familyRecords.add(record);
		}

		return grouped;
	}

	private void rollback() {
		try {
			connection.rollback();
		} catch (SQLException e) {
			LOGGER.error("Rollback failed", e);
		}
	}

	private void leaveTransactionMode() {
		try {
			connection.setTransactionMode(false);
		} catch (SQLException e) {
			LOGGER.error("Could not leave transaction mode", e);
		}
	}

	private static void close(AutoCloseable closeable) {
		if (closeable != null) {
			try {
				closeable.close();
			} catch (Exception e) {
				LOGGER.warn("Could not close " + closeable, e);
			}
		}
	}
}
