//
//  CatalogImporter.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.Date;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;

import org.apache.log4j.Logger;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.spacehopperstudios.catalog.ingest.DumpReadException;
import com.spacehopperstudios.catalog.ingest.DumpRecordIterator;
import com.spacehopperstudios.catalog.ingest.FamilyStrategies;
import com.spacehopperstudios.catalog.ingest.FamilyStrategy;
import com.spacehopperstudios.catalog.ingest.ImportProgressReporter;
import com.spacehopperstudios.catalog.ingest.MergeEngine;
import com.spacehopperstudios.catalog.model.CatalogRecord;
import com.spacehopperstudios.catalog.model.DatabaseMetadata;
import com.spacehopperstudios.catalog.model.DatabaseStats;
import com.spacehopperstudios.catalog.model.Family;
import com.spacehopperstudios.catalog.model.ImportResult;
import com.spacehopperstudios.catalog.model.PresenceIndex;
import com.spacehopperstudios.catalog.model.WatermarkCursor;
import com.spacehopperstudios.catalog.parse.DumpCorruptedException;
import com.spacehopperstudios.catalog.parse.DumpParser;
import com.spacehopperstudios.catalog.parse.DumpParser.LineCommand;
import com.spacehopperstudios.catalog.parse.ParsedTableDefinition;
import com.spacehopperstudios.catalog.progress.CompletionProgress;
import com.spacehopperstudios.catalog.progress.CreateIndexProgress;
import com.spacehopperstudios.catalog.progress.DiskSpaceProgress;
import com.spacehopperstudios.catalog.progress.ImportObjectsProgress;
import com.spacehopperstudios.catalog.progress.LoadPresenceIndexProgress;
import com.spacehopperstudios.catalog.progress.ProgressSink;
import com.spacehopperstudios.catalog.progress.SearchTableDefinitionProgress;
import com.spacehopperstudios.catalog.progress.SynchronizationObjectsProgress;
import com.spacehopperstudios.catalog.progress.TableDefinitionFoundProgress;
import com.spacehopperstudios.catalog.progress.WrongTableDefinitionProgress;
import com.spacehopperstudios.catalog.schema.SchemaMatcher;
import com.spacehopperstudios.catalog.storage.Storage;
import com.spacehopperstudios.catalog.sync.DeltaClient;
import com.spacehopperstudios.catalog.sync.DeltaClientFactory;
import com.spacehopperstudios.catalog.sync.DeltaFetchException;

/**
 * Runs dump imports and delta synchronizations against a {@link Storage}.
 * 
 * Both operations report through a {@link ProgressSink}, poll a {@link CancellationToken} and always end with a result value: nothing they do
 * throws past them. The async variants queue operations on one worker thread so that at most one runs at a time.
 * 
 * @author billy1380
 */
public class CatalogImporter implements Closeable {

	private static final Logger LOGGER = Logger.getLogger(CatalogImporter.class);

	private final Storage storage;
	private final ImporterOptions options;
	private final SchemaMatcher schemaMatcher = new SchemaMatcher();
	private final Map<Family, Integer> recordCounts = new EnumMap<Family, Integer>(Family.class);

	private ListeningExecutorService executor;

	public CatalogImporter(Storage storage, ImporterOptions options) {
		if (storage == null) throw new NullPointerException("storage cannot be null");

		this.storage = storage;
		this.options = options == null ? new ImporterOptions() : options;
	}

	public ListenableFuture<ImportDumpResult> importDumpAsync(final File dumpFile, final Family expectedFamily, final ProgressSink progressSink,
			final CancellationToken cancellationToken) {
		return executor().submit(new Callable<ImportDumpResult>() {
			@Override
			public ImportDumpResult call() {
				return importDump(dumpFile, expectedFamily, progressSink, cancellationToken);
			}
		});
	}

	public ListenableFuture<SynchronizationResult> synchronizeAsync(final Family family, final DeltaClientFactory deltaClientFactory,
			final ProgressSink progressSink, final CancellationToken cancellationToken) {
		return executor().submit(new Callable<SynchronizationResult>() {
			@Override
			public SynchronizationResult call() {
				return synchronize(family, deltaClientFactory, progressSink, cancellationToken);
			}
		});
	}

	/**
	 * Imports every recognised table of the dump.
	 * 
	 * @param expectedFamily when not null, a recognised table of another family ends the import with {@link ImportDumpResult#ERROR}
	 */
	public ImportDumpResult importDump(File dumpFile, Family expectedFamily, ProgressSink progressSink, CancellationToken cancellationToken) {
		Date start = new Date();

		if (LOGGER.isInfoEnabled()) {
			LOGGER.info(String.format("Importing %s", dumpFile));
		}

		ImportDumpResult result;

		try {
			result = runImport(dumpFile, expectedFamily, progressSink, cancellationToken);
		} catch (OperationCancelledException e) {
			result = ImportDumpResult.CANCELLED;
		} catch (DumpCorruptedException e) {
			LOGGER.error(String.format("%s is corrupted", dumpFile), e);
			result = ImportDumpResult.CORRUPTED;
		} catch (DumpReadException e) {
			if (e.getCause() instanceof DumpCorruptedException) {
				LOGGER.error(String.format("%s is corrupted", dumpFile), e.getCause());
				result = ImportDumpResult.CORRUPTED;
			} else {
				LOGGER.error(String.format("Could not read %s", dumpFile), e.getCause());
				result = ImportDumpResult.ERROR;
			}
		} catch (IOException e) {
			LOGGER.error(String.format("Could not read %s", dumpFile), e);
			result = ImportDumpResult.ERROR;
		} catch (RuntimeException e) {
			LOGGER.error(String.format("Import of %s failed", dumpFile), e);
			result = ImportDumpResult.ERROR;
		}

		progressSink.report(new CompletionProgress(result));

		if (LOGGER.isInfoEnabled()) {
			LOGGER.info(String.format("Import of %s finished with %s in %s", dumpFile, result, TimeHelper.durationText(start, new Date())));
		}

		return result;
	}

	/**
	 * Fetches and merges the remote changes of the family made after its most recently changed local record. The family must not be empty.
	 */
	public SynchronizationResult synchronize(Family family, DeltaClientFactory deltaClientFactory, ProgressSink progressSink,
			CancellationToken cancellationToken) {
		Date start = new Date();

		if (LOGGER.isInfoEnabled()) {
			LOGGER.info(String.format("Synchronizing %s", family));
		}

		SynchronizationResult result;

		try {
			result = runSynchronization(FamilyStrategies.forFamily(family), deltaClientFactory, progressSink, cancellationToken);
		} catch (OperationCancelledException e) {
			result = SynchronizationResult.CANCELLED;
		} catch (DeltaFetchException e) {
			LOGGER.error(String.format("Could not fetch %s changes", family), e);
			result = SynchronizationResult.ERROR;
		} catch (RuntimeException e) {
			LOGGER.error(String.format("Synchronization of %s failed", family), e);
			result = SynchronizationResult.ERROR;
		}

		progressSink.report(new CompletionProgress(result));

		if (LOGGER.isInfoEnabled()) {
			LOGGER.info(String.format("Synchronization of %s finished with %s in %s", family, result, TimeHelper.durationText(start, new Date())));
		}

		return result;
	}

	/**
	 * Recounts every family
	 */
	public void refreshCounts() {
		for (Family family : Family.values()) {
			refreshCount(family);
		}
	}

	/**
	 * Cached record count of the family, counted on first use and after every operation touching it
	 */
	public int getRecordCount(Family family) {
		synchronized (recordCounts) {
			Integer count = recordCounts.get(family);
			return count == null ? refreshCount(family) : count.intValue();
		}
	}

	/**
	 * Counts and last change times of all families. The change-time indexes of non-empty families are created if missing.
	 */
	public DatabaseStats getDatabaseStats(ProgressSink progressSink) {
		DatabaseStats stats = new DatabaseStats();

		for (Family family : Family.values()) {
			stats.put(family, getRecordCount(family), lastUpdate(FamilyStrategies.forFamily(family), progressSink));
		}

		return stats;
	}

	/**
	 * Stops the worker once queued operations are done
	 */
	@Override
	public void close() {
		synchronized (this) {
			if (executor != null) {
				executor.shutdown();
				executor = null;
			}
		}
	}

	private ImportDumpResult runImport(File dumpFile, Family expectedFamily, ProgressSink progressSink, CancellationToken cancellationToken)
			throws IOException, DumpCorruptedException, OperationCancelledException {
		if (storage.getMetadata() == null) {
			LOGGER.error("Database has no metadata");
			return ImportDumpResult.CORRUPTED;
		}

		if (isLowOnDiskSpace(progressSink)) {
			return ImportDumpResult.LOW_DISK_SPACE;
		}

		DumpParser parser = new DumpParser(dumpFile);

		try {
			boolean segmentImported = false;
			long lastSearchReport = 0;

			while (true) {
				boolean tableFound = false;

				while (parser.readLine()) {
					checkCancellation(cancellationToken);

					if (parser.getCurrentLineCommand() == LineCommand.CREATE_TABLE) {
						tableFound = true;
						break;
					}

					long now = System.currentTimeMillis();
					if (now - lastSearchReport >= Constants.SEARCH_PROGRESS_REPORT_INTERVAL) {
						progressSink.report(new SearchTableDefinitionProgress(parser.getCurrentFilePosition(), parser.getFileSize()));
						lastSearchReport = now;
					}
				}

				if (!tableFound) {
					if (LOGGER.isDebugEnabled()) {
						LOGGER.debug(String.format("No more table definitions after line %d", parser.getLineNumber()));
					}

					return segmentImported ? ImportDumpResult.COMPLETED : ImportDumpResult.DATA_NOT_FOUND;
				}

				checkCancellation(cancellationToken);

				ParsedTableDefinition definition = parser.parseTableDefinition();
				Family family = schemaMatcher.match(definition);

				if (family == null) {
					if (LOGGER.isInfoEnabled()) {
						LOGGER.info(String.format("Skipping unknown table %s", definition.getTableName()));
					}
					continue;
				}

				if (expectedFamily != null && family != expectedFamily) {
					progressSink.report(new WrongTableDefinitionProgress(expectedFamily, family));
					return ImportDumpResult.ERROR;
				}

				progressSink.report(new TableDefinitionFoundProgress(family));

				if (!findDataSection(parser, definition, cancellationToken)) {
					LOGGER.warn(String.format("No data found for %s", definition.getTableName()));
					continue;
				}

				checkCancellation(cancellationToken);

				ImportResult result = importSegment(FamilyStrategies.forFamily(family), parser, definition, progressSink, cancellationToken);
				segmentImported = true;

				if (result.isCancelled()) {
					return ImportDumpResult.CANCELLED;
				}

				if (result.isErrorLowDiskSpace()) {
					return ImportDumpResult.LOW_DISK_SPACE;
				}
			}
		} finally {
			parser.close();
		}
	}

	/**
	 * Moves the parser onto the first insert into the defined table. The data section must come before the next table definition; an insert into any
	 * other table means the defined table has no rows. A table definition met on the way is left to be read again.
	 */
	private static boolean findDataSection(DumpParser parser, ParsedTableDefinition definition, CancellationToken cancellationToken) throws IOException,
			OperationCancelledException {
		while (parser.readLine()) {
			checkCancellation(cancellationToken);

			if (parser.getCurrentLineCommand() == LineCommand.CREATE_TABLE) {
				parser.pushBack();
				return false;
			}

			if (parser.getCurrentLineCommand() == LineCommand.INSERT) {
				String tableName = parser.getCurrentInsertTableName();

				if (tableName != null && tableName.equalsIgnoreCase(definition.getTableName())) {
					return true;
				}

				if (LOGGER.isInfoEnabled()) {
					LOGGER.info(String.format("Insert into %s follows the definition of %s", tableName, definition.getTableName()));
				}

				return false;
			}
		}

		return false;
	}

	private <T extends CatalogRecord> ImportResult importSegment(FamilyStrategy<T> strategy, DumpParser parser, ParsedTableDefinition definition,
			final ProgressSink progressSink, CancellationToken cancellationToken) throws OperationCancelledException {
		Family family = strategy.getFamily();
		PresenceIndex presenceIndex;

		if (getRecordCount(family) == 0) {
			presenceIndex = new PresenceIndex(0);
		} else {
			ensureIndexes(strategy, progressSink, cancellationToken);
			checkCancellation(cancellationToken);

			progressSink.report(new LoadPresenceIndexProgress(family));
			presenceIndex = storage.loadPresenceIndex(family);
		}

		checkCancellation(cancellationToken);

		ImportProgressReporter progressReporter = new ImportProgressReporter() {
			@Override
			public void report(int addedObjectCount, int updatedObjectCount, Long freeSpace) {
				progressSink.report(new ImportObjectsProgress(addedObjectCount, updatedObjectCount));
				progressSink.report(new DiskSpaceProgress(freeSpace));
			}
		};

		DumpRecordIterator<T> records = new DumpRecordIterator<T>(parser, definition, strategy);
		ImportResult result;

		try {
			result = new MergeEngine<T>(strategy, options.getLowDiskSpaceThreshold()).importRecords(records, presenceIndex, progressReporter,
					options.getImportCheckpointInterval(), storage, cancellationToken);
		} finally {
			refreshCount(family);
		}

		DatabaseMetadata metadata = storage.getMetadata();
		metadata.setFirstImportComplete(family, true);
		storage.updateMetadata(metadata);

		if (LOGGER.isInfoEnabled()) {
			LOGGER.info(String.format("%s segment: %s, %d rows skipped", family, result, records.getSkippedRowCount()));
		}

		return result;
	}

	private <T extends CatalogRecord> SynchronizationResult runSynchronization(FamilyStrategy<T> strategy, DeltaClientFactory deltaClientFactory,
			final ProgressSink progressSink, CancellationToken cancellationToken) throws OperationCancelledException, DeltaFetchException {
		final Family family = strategy.getFamily();

		if (getRecordCount(family) == 0) {
			LOGGER.error(String.format("Cannot synchronize %s, import a dump first", family));
			return SynchronizationResult.ERROR;
		}

		if (isLowOnDiskSpace(progressSink)) {
			return SynchronizationResult.LOW_DISK_SPACE;
		}

		ensureIndexes(strategy, progressSink, cancellationToken);
		checkCancellation(cancellationToken);

		T lastModified = strategy.cast(storage.getLastModifiedRecord(family));
		WatermarkCursor watermark = lastModified == null ? WatermarkCursor.START : strategy.getWatermark(lastModified);

		if (LOGGER.isInfoEnabled()) {
			LOGGER.info(String.format("Synchronizing %s after %s", family, watermark));
		}

		DeltaClient<T> deltaClient = deltaClientFactory.create(strategy, watermark);

		progressSink.report(new LoadPresenceIndexProgress(family));
		PresenceIndex presenceIndex = storage.loadPresenceIndex(family);

		final SynchronizationTotals totals = new SynchronizationTotals();
		progressSink.report(new SynchronizationObjectsProgress(0, 0, 0));

		ImportProgressReporter progressReporter = new ImportProgressReporter() {
			@Override
			public void report(int addedObjectCount, int updatedObjectCount, Long freeSpace) {
				progressSink.report(new SynchronizationObjectsProgress(totals.downloaded, totals.added + addedObjectCount, totals.updated
						+ updatedObjectCount));
				progressSink.report(new DiskSpaceProgress(freeSpace));
			}
		};

		MergeEngine<T> mergeEngine = new MergeEngine<T>(strategy, options.getLowDiskSpaceThreshold());
		ImportResult result = null;

		try {
			while (true) {
				checkCancellation(cancellationToken);

				List<T> batch = deltaClient.fetchNextBatch(cancellationToken);

				if (batch.isEmpty()) {
					break;
				}

				totals.downloaded += batch.size();
				progressSink.report(new SynchronizationObjectsProgress(totals.downloaded, totals.added, totals.updated));

				checkCancellation(cancellationToken);

				result = mergeEngine.importRecords(batch.iterator(), presenceIndex, progressReporter, options.getSynchronizationCheckpointInterval(), storage,
						cancellationToken);
				totals.added += result.getAddedObjectCount();
				totals.updated += result.getUpdatedObjectCount();
				watermark = WatermarkCursor.max(watermark, deltaClient.getCursor());

				if (LOGGER.isDebugEnabled()) {
					LOGGER.debug(String.format("Batch merged, %d downloaded, %d added, %d updated, watermark %s", totals.downloaded, totals.added,
							totals.updated, watermark));
				}

				if (result.isCancelled()) {
					return SynchronizationResult.CANCELLED;
				}

				if (!result.isSuccessful()) {
					break;
				}
			}
		} finally {
			refreshCount(family);
		}

		if (result != null && result.isErrorLowDiskSpace()) {
			return SynchronizationResult.LOW_DISK_SPACE;
		}

		return SynchronizationResult.COMPLETED;
	}

	/**
	 * Creates the indexes the strategy needs that the table lacks
	 */
	private void ensureIndexes(FamilyStrategy<? extends CatalogRecord> strategy, ProgressSink progressSink, CancellationToken cancellationToken)
			throws OperationCancelledException {
		checkCancellation(cancellationToken);

		List<String> indexedColumns = storage.getIndexedColumns(strategy.getFamily());

		for (String column : strategy.getRequiredIndexes()) {
			checkCancellation(cancellationToken);

			if (!containsIgnoreCase(indexedColumns, column)) {
				progressSink.report(new CreateIndexProgress(strategy.getFamily(), column));
				storage.createIndex(strategy.getFamily(), column);
			}
		}
	}

	private <T extends CatalogRecord> Date lastUpdate(FamilyStrategy<T> strategy, ProgressSink progressSink) {
		Family family = strategy.getFamily();
		Date lastUpdate = null;

		if (getRecordCount(family) > 0) {
			if (!containsIgnoreCase(storage.getIndexedColumns(family), strategy.getChangeColumn())) {
				progressSink.report(new CreateIndexProgress(family, strategy.getChangeColumn()));
				storage.createIndex(family, strategy.getChangeColumn());
			}

			T lastModified = strategy.cast(storage.getLastModifiedRecord(family));
			lastUpdate = lastModified == null ? null : strategy.getChangeTimestamp(lastModified);
		}

		return lastUpdate;
	}

	private boolean isLowOnDiskSpace(ProgressSink progressSink) {
		Long freeSpace = storage.getFreeSpace();
		progressSink.report(new DiskSpaceProgress(freeSpace));

		boolean low = freeSpace != null && freeSpace.longValue() < options.getLowDiskSpaceThreshold();

		if (low) {
			LOGGER.warn(String.format("Insufficient disk space: %d bytes", freeSpace));
		}

		return low;
	}

	private int refreshCount(Family family) {
		int count = storage.countRecords(family);

		synchronized (recordCounts) {
			recordCounts.put(family, Integer.valueOf(count));
		}

		return count;
	}

	private synchronized ListeningExecutorService executor() {
		if (executor == null) {
			executor = MoreExecutors.listeningDecorator(Executors.newSingleThreadExecutor(new ThreadFactoryBuilder().setNameFormat("catalog-importer-%d")
					.setDaemon(true).build()));
		}

		return executor;
	}

	private static void checkCancellation(CancellationToken cancellationToken) throws OperationCancelledException {
		if (cancellationToken.isCancellationRequested()) {
			LOGGER.info("Operation cancelled");
			throw new OperationCancelledException("Operation cancelled");
		}
	}

	private static boolean containsIgnoreCase(List<String> values, String value) {
		for (String candidate : values) {
			if (candidate.equalsIgnoreCase(value)) {
				return true;
			}
		}

		return false;
	}

	private static class SynchronizationTotals {
		int downloaded;
		int added;
		int updated;
	}
}
