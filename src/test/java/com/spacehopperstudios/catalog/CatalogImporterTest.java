//
//  CatalogImporterTest.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.spacehopperstudios.catalog.ingest.FamilyStrategy;
import com.spacehopperstudios.catalog.model.Book;
import com.spacehopperstudios.catalog.model.CatalogRecord;
import com.spacehopperstudios.catalog.model.DatabaseStats;
import com.spacehopperstudios.catalog.model.Family;
import com.spacehopperstudios.catalog.model.FictionBook;
import com.spacehopperstudios.catalog.model.SciMagArticle;
import com.spacehopperstudios.catalog.model.WatermarkCursor;
import com.spacehopperstudios.catalog.progress.CompletionProgress;
import com.spacehopperstudios.catalog.progress.CreateIndexProgress;
import com.spacehopperstudios.catalog.progress.DiskSpaceProgress;
import com.spacehopperstudios.catalog.progress.ImportObjectsProgress;
import com.spacehopperstudios.catalog.progress.LoadPresenceIndexProgress;
import com.spacehopperstudios.catalog.progress.ProgressEvent;
import com.spacehopperstudios.catalog.progress.ProgressSink;
import com.spacehopperstudios.catalog.progress.SynchronizationObjectsProgress;
import com.spacehopperstudios.catalog.progress.TableDefinitionFoundProgress;
import com.spacehopperstudios.catalog.progress.WrongTableDefinitionProgress;
import com.spacehopperstudios.catalog.schema.TableDefinitions;
import com.spacehopperstudios.catalog.storage.InMemoryStorage;
import com.spacehopperstudios.catalog.sync.DeltaClient;
import com.spacehopperstudios.catalog.sync.DeltaClientFactory;
import com.spacehopperstudios.catalog.sync.DeltaFetchException;

public class CatalogImporterTest {

	@TempDir
	File folder;

	private static class RecordingSink implements ProgressSink {
		final List<ProgressEvent> events = new ArrayList<ProgressEvent>();

		@Override
		public synchronized void report(ProgressEvent event) {
			events.add(event);
		}

		<E extends ProgressEvent> List<E> of(Class<E> type) {
			List<E> matching = new ArrayList<E>();

			for (ProgressEvent event : events) {
				if (type.isInstance(event)) {
					matching.add(type.cast(event));
				}
			}

			return matching;
		}

		<E extends ProgressEvent> E last(Class<E> type) {
			List<E> matching = of(type);
			return matching.isEmpty() ? null : matching.get(matching.size() - 1);
		}
	}

	/**
	 * Hands out the given fiction batches one per fetch, then empty batches
	 */
	private static class ScriptedDeltaClientFactory implements DeltaClientFactory {
		private final List<List<FictionBook>> batches;
		WatermarkCursor requestedStart;

		ScriptedDeltaClientFactory(List<List<FictionBook>> batches) {
			this.batches = batches;
		}

		@Override
		public <T extends CatalogRecord> DeltaClient<T> create(final FamilyStrategy<T> strategy, final WatermarkCursor start) {
			requestedStart = start;
			final Iterator<List<FictionBook>> remaining = batches.iterator();

			return new DeltaClient<T>() {
				private WatermarkCursor cursor = start;

				@Override
				public List<T> fetchNextBatch(CancellationToken cancellationToken) {
					List<T> batch = new ArrayList<T>();

					if (remaining.hasNext()) {
						for (FictionBook book : remaining.next()) {
							T record = strategy.cast(book);
							batch.add(record);
							cursor = WatermarkCursor.max(cursor, strategy.getWatermark(record));
						}
					}

					return batch;
				}

				@Override
				public WatermarkCursor getCursor() {
					return cursor;
				}
			};
		}
	}

	private static Map<String, String> fictionRow(int id, String title, String lastModified) {
		return DumpBuilder.row("ID", Integer.toString(id), "Title", title, "Language", "English", "Extension", "epub", "TimeAdded",
				"2019-01-01 00:00:00", "TimeLastModified", lastModified);
	}

	private File fictionDump(String name, int first, int last, String lastModified) throws Exception {
		List<Map<String, String>> rows = new ArrayList<Map<String, String>>();

		for (int id = first; id <= last; id++) {
			rows.add(fictionRow(id, "Book " + id, lastModified));
		}

		return new DumpBuilder().createTable(TableDefinitions.FICTION).insert(TableDefinitions.FICTION, rows).writeTo(new File(folder, name));
	}

	private static FictionBook fiction(int remoteId, String title, String lastModified) {
		FictionBook book = new FictionBook();
		book.setRemoteId(remoteId);
		book.setTitle(title);
		book.setLastModifiedDateTime(TimeHelper.parseCatalogTime(lastModified));
		return book;
	}

	private static Enum<?> completion(RecordingSink sink) {
		ProgressEvent last = sink.events.get(sink.events.size() - 1);
		assertTrue(last instanceof CompletionProgress, "last event is the completion");
		return ((CompletionProgress) last).getResult();
	}

	@Test
	public void importsAFreshDump() throws Exception {
		File dump = new DumpBuilder().createTable(TableDefinitions.FICTION)
				.insert(TableDefinitions.FICTION,
						Arrays.asList(fictionRow(1, "One", "2020-01-01 00:00:00"), fictionRow(2, "Two", "2020-01-02 00:00:00"),
								DumpBuilder.row("Title", "No id"), fictionRow(3, "Three", "2020-01-03 00:00:00"))).writeTo(new File(folder, "fiction.sql"));
		InMemoryStorage storage = new InMemoryStorage();
		RecordingSink sink = new RecordingSink();

		ImportDumpResult result = new CatalogImporter(storage, null).importDump(dump, null, sink, new CancellationToken());

		assertEquals(ImportDumpResult.COMPLETED, result);
		assertEquals(ImportDumpResult.COMPLETED, completion(sink));
		assertEquals(3, storage.countRecords(Family.FICTION));
		assertEquals("Two", ((FictionBook) storage.getRecord(Family.FICTION, 2)).getTitle());
		assertEquals("epub", storage.getRecord(Family.FICTION, 2).getFormat());
		assertEquals(3, sink.last(ImportObjectsProgress.class).getAddedObjectCount());
		assertEquals(0, sink.last(ImportObjectsProgress.class).getUpdatedObjectCount());
		assertEquals(Family.FICTION, sink.last(TableDefinitionFoundProgress.class).getFamily());
		assertTrue(sink.of(CreateIndexProgress.class).isEmpty());
		assertTrue(sink.of(LoadPresenceIndexProgress.class).isEmpty());
		assertTrue(storage.getMetadata().isFirstImportComplete(Family.FICTION));
		assertFalse(storage.getMetadata().isFirstImportComplete(Family.SCI_MAG));
	}

	@Test
	public void importsAFreshNonFictionDump() throws Exception {
		File dump = new DumpBuilder().createTable(TableDefinitions.NON_FICTION)
				.insert(TableDefinitions.NON_FICTION,
						Arrays.asList(DumpBuilder.row("ID", "1", "Title", "One", "Extension", "pdf", "TimeLastModified", "2020-01-01 00:00:00"),
								DumpBuilder.row("ID", "2", "Title", "Two", "Extension", "djvu", "TimeLastModified", "2020-01-02 00:00:00"),
								DumpBuilder.row("ID", "3", "Title", "Three", "Extension", "pdf", "TimeLastModified", "2020-01-03 00:00:00")))
				.writeTo(new File(folder, "updated.sql"));
		InMemoryStorage storage = new InMemoryStorage();
		RecordingSink sink = new RecordingSink();

		ImportDumpResult result = new CatalogImporter(storage, null).importDump(dump, Family.NON_FICTION, sink, new CancellationToken());

		assertEquals(ImportDumpResult.COMPLETED, result);
		assertEquals(ImportDumpResult.COMPLETED, completion(sink));
		assertEquals(3, storage.countRecords(Family.NON_FICTION));
		assertEquals("Two", ((Book) storage.getRecord(Family.NON_FICTION, 2)).getTitle());
		assertEquals("djvu", storage.getRecord(Family.NON_FICTION, 2).getFormat());
		assertEquals(3, sink.last(ImportObjectsProgress.class).getAddedObjectCount());
		assertEquals(0, sink.last(ImportObjectsProgress.class).getUpdatedObjectCount());
		assertEquals(Family.NON_FICTION, sink.last(TableDefinitionFoundProgress.class).getFamily());
		assertTrue(storage.getMetadata().isFirstImportComplete(Family.NON_FICTION));
	}

	@Test
	public void emptyTableDoesNotHideTheNextOne() throws Exception {
		File dump = new DumpBuilder().createTable(TableDefinitions.NON_FICTION) //
				.createTable(TableDefinitions.FICTION) //
				.insert(TableDefinitions.FICTION, Arrays.asList(fictionRow(1, "One", "2020-01-01 00:00:00"), fictionRow(2, "Two", "2020-01-02 00:00:00"))) //
				.writeTo(new File(folder, "empty-first.sql"));
		InMemoryStorage storage = new InMemoryStorage();
		RecordingSink sink = new RecordingSink();

		ImportDumpResult result = new CatalogImporter(storage, null).importDump(dump, null, sink, new CancellationToken());

		assertEquals(ImportDumpResult.COMPLETED, result);
		assertEquals(0, storage.countRecords(Family.NON_FICTION));
		assertEquals(2, storage.countRecords(Family.FICTION));
		assertEquals(2, sink.of(TableDefinitionFoundProgress.class).size());
		assertEquals(Family.FICTION, sink.last(TableDefinitionFoundProgress.class).getFamily());
	}

	@Test
	public void rowsOfAnotherTableAreNotImported() throws Exception {
		String otherTable = new DumpBuilder()
				.insert(TableDefinitions.FICTION, Arrays.asList(fictionRow(1, "One", "2020-01-01 00:00:00"), fictionRow(2, "Two", "2020-01-02 00:00:00")))
				.toString().replace("`fiction`", "`fiction_copy`");
		File dump = new DumpBuilder().createTable(TableDefinitions.FICTION).line(otherTable).writeTo(new File(folder, "copy.sql"));
		InMemoryStorage storage = new InMemoryStorage();

		ImportDumpResult result = new CatalogImporter(storage, null).importDump(dump, null, new RecordingSink(), new CancellationToken());

		assertEquals(ImportDumpResult.DATA_NOT_FOUND, result);
		assertEquals(0, storage.countRecords(Family.FICTION));
		assertEquals(0, storage.getAddCallCount());
	}

	@Test
	public void reimportIndexesTheTableAndChangesNothing() throws Exception {
		InMemoryStorage storage = new InMemoryStorage();
		CatalogImporter importer = new CatalogImporter(storage, null);
		importer.importDump(fictionDump("first.sql", 1, 3, "2020-01-01 00:00:00"), Family.FICTION, new RecordingSink(), new CancellationToken());

		RecordingSink sink = new RecordingSink();
		ImportDumpResult result = importer.importDump(fictionDump("again.sql", 1, 3, "2020-01-01 00:00:00"), Family.FICTION, sink, new CancellationToken());

		assertEquals(ImportDumpResult.COMPLETED, result);
		assertEquals(0, sink.last(ImportObjectsProgress.class).getAddedObjectCount());
		assertEquals(0, sink.last(ImportObjectsProgress.class).getUpdatedObjectCount());
		assertEquals(2, sink.of(CreateIndexProgress.class).size());
		assertEquals(Arrays.asList("fiction.LibgenId", "fiction.LastModifiedDateTime"), storage.getCreatedIndexes());
		assertEquals(1, sink.of(LoadPresenceIndexProgress.class).size());

		importer.importDump(fictionDump("third.sql", 1, 3, "2020-01-01 00:00:00"), Family.FICTION, sink, new CancellationToken());
		assertEquals(2, storage.getCreatedIndexes().size());
	}

	@Test
	public void laterDumpUpdatesChangedRecords() throws Exception {
		InMemoryStorage storage = new InMemoryStorage();
		CatalogImporter importer = new CatalogImporter(storage, null);
		importer.importDump(fictionDump("old.sql", 1, 3, "2020-01-01 00:00:00"), null, new RecordingSink(), new CancellationToken());

		RecordingSink sink = new RecordingSink();
		importer.importDump(fictionDump("new.sql", 2, 5, "2021-01-01 00:00:00"), null, sink, new CancellationToken());

		assertEquals(2, sink.last(ImportObjectsProgress.class).getAddedObjectCount());
		assertEquals(2, sink.last(ImportObjectsProgress.class).getUpdatedObjectCount());
		assertEquals(5, importer.getRecordCount(Family.FICTION));
	}

	@Test
	public void importsEveryRecognisedTable() throws Exception {
		File dump = new DumpBuilder() //
				.line("CREATE TABLE `description` (") //
				.line("  `md5` varchar(32) NOT NULL,") //
				.line("  `descr` text") //
				.line(") ENGINE=MyISAM;") //
				.line("INSERT INTO `description` VALUES ('abc','text');") //
				.createTable(TableDefinitions.FICTION) //
				.insert(TableDefinitions.FICTION, Arrays.asList(fictionRow(1, "One", "2020-01-01 00:00:00"))) //
				.createTable(TableDefinitions.SCI_MAG) //
				.insert(TableDefinitions.SCI_MAG,
						Arrays.asList(DumpBuilder.row("ID", "10", "DOI", "10.1/a", "TimeAdded", "2020-01-01 00:00:00"),
								DumpBuilder.row("ID", "11", "DOI", "10.1/b", "TimeAdded", "2020-01-02 00:00:00"))) //
				.writeTo(new File(folder, "mixed.sql"));
		InMemoryStorage storage = new InMemoryStorage();

		ImportDumpResult result = new CatalogImporter(storage, null).importDump(dump, null, new RecordingSink(), new CancellationToken());

		assertEquals(ImportDumpResult.COMPLETED, result);
		assertEquals(1, storage.countRecords(Family.FICTION));
		assertEquals(2, storage.countRecords(Family.SCI_MAG));
		assertEquals("10.1/b", ((SciMagArticle) storage.getRecord(Family.SCI_MAG, 11)).getDoi());
	}

	@Test
	public void readsGzippedDumps() throws Exception {
		File dump = new DumpBuilder().createTable(TableDefinitions.FICTION)
				.insert(TableDefinitions.FICTION, Arrays.asList(fictionRow(1, "One", "2020-01-01 00:00:00"))).writeGzipTo(new File(folder, "fiction.sql.gz"));
		InMemoryStorage storage = new InMemoryStorage();

		assertEquals(ImportDumpResult.COMPLETED, new CatalogImporter(storage, null).importDump(dump, null, new RecordingSink(), new CancellationToken()));
		assertEquals(1, storage.countRecords(Family.FICTION));
	}

	@Test
	public void dumpWithoutCatalogTablesHasNoData() throws Exception {
		File dump = new DumpBuilder().line("CREATE TABLE `other` (").line("  `a` int(11)").line(");").line("INSERT INTO `other` VALUES (1);")
				.writeTo(new File(folder, "other.sql"));
		File empty = new DumpBuilder().writeTo(new File(folder, "empty.sql"));
		CatalogImporter importer = new CatalogImporter(new InMemoryStorage(), null);

		assertEquals(ImportDumpResult.DATA_NOT_FOUND, importer.importDump(dump, null, new RecordingSink(), new CancellationToken()));
		assertEquals(ImportDumpResult.DATA_NOT_FOUND, importer.importDump(empty, null, new RecordingSink(), new CancellationToken()));
	}

	@Test
	public void tableWithoutInsertsHasNoData() throws Exception {
		File dump = new DumpBuilder().createTable(TableDefinitions.FICTION).writeTo(new File(folder, "schema-only.sql"));
		RecordingSink sink = new RecordingSink();

		assertEquals(ImportDumpResult.DATA_NOT_FOUND, new CatalogImporter(new InMemoryStorage(), null).importDump(dump, null, sink, new CancellationToken()));
		assertEquals(Family.FICTION, sink.last(TableDefinitionFoundProgress.class).getFamily());
	}

	@Test
	public void lowDiskSpaceStopsBeforeReading() throws Exception {
		InMemoryStorage storage = new InMemoryStorage();
		storage.setFreeSpace(Long.valueOf(10));
		RecordingSink sink = new RecordingSink();

		ImportDumpResult result = new CatalogImporter(storage, null).importDump(fictionDump("fiction.sql", 1, 3, "2020-01-01 00:00:00"), null, sink,
				new CancellationToken());

		assertEquals(ImportDumpResult.LOW_DISK_SPACE, result);
		assertEquals(Long.valueOf(10), sink.of(DiskSpaceProgress.class).get(0).getFreeSpace());
		assertEquals(0, storage.countRecords(Family.FICTION));
	}

	@Test
	public void unexpectedFamilyIsAnError() throws Exception {
		RecordingSink sink = new RecordingSink();
		InMemoryStorage storage = new InMemoryStorage();

		ImportDumpResult result = new CatalogImporter(storage, null).importDump(fictionDump("fiction.sql", 1, 3, "2020-01-01 00:00:00"), Family.SCI_MAG,
				sink, new CancellationToken());

		assertEquals(ImportDumpResult.ERROR, result);
		WrongTableDefinitionProgress wrong = sink.last(WrongTableDefinitionProgress.class);
		assertEquals(Family.SCI_MAG, wrong.getExpectedFamily());
		assertEquals(Family.FICTION, wrong.getActualFamily());
		assertEquals(0, storage.countRecords(Family.FICTION));
	}

	@Test
	public void databaseWithoutMetadataIsCorrupted() throws Exception {
		InMemoryStorage storage = new InMemoryStorage();
		storage.setMetadata(null);

		assertEquals(ImportDumpResult.CORRUPTED, new CatalogImporter(storage, null).importDump(fictionDump("fiction.sql", 1, 1, "2020-01-01 00:00:00"),
				null, new RecordingSink(), new CancellationToken()));
	}

	@Test
	public void truncatedDumpIsCorrupted() throws Exception {
		File truncated = new DumpBuilder().createTable(TableDefinitions.FICTION)
				.line("INSERT INTO `fiction` VALUES (1,NULL,'One',NULL,NULL,NULL,NULL,NULL,NULL,NULL,NULL,NULL,NULL,NULL,NULL,NULL,NULL,NULL,NULL,NULL,NULL,NULL,NULL,NULL),")
				.writeTo(new File(folder, "truncated.sql"));
		File unterminated = new DumpBuilder().line("CREATE TABLE `fiction` (").line("  `ID` int(11)").writeTo(new File(folder, "unterminated.sql"));
		CatalogImporter importer = new CatalogImporter(new InMemoryStorage(), null);

		assertEquals(ImportDumpResult.CORRUPTED, importer.importDump(truncated, null, new RecordingSink(), new CancellationToken()));
		assertEquals(ImportDumpResult.CORRUPTED, importer.importDump(unterminated, null, new RecordingSink(), new CancellationToken()));
	}

	@Test
	public void missingDumpIsAnError() {
		RecordingSink sink = new RecordingSink();

		assertEquals(ImportDumpResult.ERROR, new CatalogImporter(new InMemoryStorage(), null).importDump(new File(folder, "missing.sql"), null, sink,
				new CancellationToken()));
		assertEquals(ImportDumpResult.ERROR, completion(sink));
	}

	@Test
	public void cancellationKeepsWhatWasStored() throws Exception {
		final CancellationToken cancellationToken = new CancellationToken();
		InMemoryStorage storage = new InMemoryStorage() {
			@Override
			public void addRecords(List<? extends CatalogRecord> added) {
				super.addRecords(added);
				cancellationToken.cancel();
			}
		};
		RecordingSink sink = new RecordingSink();

		ImportDumpResult result = new CatalogImporter(storage, new ImporterOptions().setImportCheckpointInterval(2)).importDump(
				fictionDump("fiction.sql", 1, 5, "2020-01-01 00:00:00"), null, sink, cancellationToken);

		assertEquals(ImportDumpResult.CANCELLED, result);
		assertEquals(ImportDumpResult.CANCELLED, completion(sink));
		assertEquals(2, storage.countRecords(Family.FICTION));
	}

	@Test
	public void cancellationBetweenTablesStopsTheImport() throws Exception {
		final CancellationToken cancellationToken = new CancellationToken();
		InMemoryStorage storage = new InMemoryStorage() {
			@Override
			public void addRecords(List<? extends CatalogRecord> added) {
				super.addRecords(added);
				cancellationToken.cancel();
			}
		};
		File dump = new DumpBuilder() //
				.createTable(TableDefinitions.FICTION) //
				.insert(TableDefinitions.FICTION, Arrays.asList(fictionRow(1, "One", "2020-01-01 00:00:00"), fictionRow(2, "Two", "2020-01-01 00:00:00"))) //
				.createTable(TableDefinitions.SCI_MAG) //
				.insert(TableDefinitions.SCI_MAG, Arrays.asList(DumpBuilder.row("ID", "10"), DumpBuilder.row("ID", "11"))) //
				.createTable(TableDefinitions.NON_FICTION) //
				.insert(TableDefinitions.NON_FICTION, Arrays.asList(DumpBuilder.row("ID", "20"), DumpBuilder.row("ID", "21"))) //
				.writeTo(new File(folder, "three.sql"));

		ImportDumpResult result = new CatalogImporter(storage, new ImporterOptions().setImportCheckpointInterval(2)).importDump(dump, null,
				new RecordingSink(), cancellationToken);

		assertEquals(ImportDumpResult.CANCELLED, result);
		assertEquals(2, storage.countRecords(Family.FICTION));
		assertEquals(0, storage.countRecords(Family.SCI_MAG));
		assertEquals(0, storage.countRecords(Family.NON_FICTION));
	}

	@Test
	public void asyncImportRunsOnTheWorker() throws Exception {
		InMemoryStorage storage = new InMemoryStorage();
		CatalogImporter importer = new CatalogImporter(storage, null);

		try {
			ImportDumpResult result = importer.importDumpAsync(fictionDump("fiction.sql", 1, 2, "2020-01-01 00:00:00"), Family.FICTION, new RecordingSink(),
					new CancellationToken()).get();

			assertEquals(ImportDumpResult.COMPLETED, result);
			assertEquals(2, storage.countRecords(Family.FICTION));
		} finally {
			importer.close();
		}
	}

	@Test
	public void synchronizingAnEmptyFamilyIsAnError() {
		RecordingSink sink = new RecordingSink();

		SynchronizationResult result = new CatalogImporter(new InMemoryStorage(), null).synchronize(Family.FICTION,
				new ScriptedDeltaClientFactory(new ArrayList<List<FictionBook>>()), sink, new CancellationToken());

		assertEquals(SynchronizationResult.ERROR, result);
		assertEquals(SynchronizationResult.ERROR, completion(sink));
	}

	@Test
	public void synchronizationMergesEveryBatch() throws Exception {
		InMemoryStorage storage = new InMemoryStorage();
		CatalogImporter importer = new CatalogImporter(storage, null);
		importer.importDump(fictionDump("fiction.sql", 1, 3, "2020-01-01 00:00:00"), null, new RecordingSink(), new CancellationToken());

		List<List<FictionBook>> batches = new ArrayList<List<FictionBook>>();
		batches.add(Arrays.asList(fiction(2, "Revised", "2021-01-01 00:00:00"), fiction(4, "Four", "2021-01-02 00:00:00")));
		batches.add(Arrays.asList(fiction(5, "Five", "2021-01-03 00:00:00")));
		ScriptedDeltaClientFactory factory = new ScriptedDeltaClientFactory(batches);
		RecordingSink sink = new RecordingSink();

		SynchronizationResult result = importer.synchronize(Family.FICTION, factory, sink, new CancellationToken());

		assertEquals(SynchronizationResult.COMPLETED, result);
		assertEquals(new WatermarkCursor(TimeHelper.parseCatalogTime("2020-01-01 00:00:00"), 3), factory.requestedStart);
		assertEquals(5, storage.countRecords(Family.FICTION));
		assertEquals(5, importer.getRecordCount(Family.FICTION));
		assertEquals("Revised", ((FictionBook) storage.getRecord(Family.FICTION, 2)).getTitle());

		SynchronizationObjectsProgress last = sink.last(SynchronizationObjectsProgress.class);
		assertEquals(3, last.getDownloadedObjectCount());
		assertEquals(2, last.getAddedObjectCount());
		assertEquals(1, last.getUpdatedObjectCount());
		assertEquals(Arrays.asList("fiction.LibgenId", "fiction.LastModifiedDateTime"), storage.getCreatedIndexes());
	}

	@Test
	public void failedFetchIsAnError() throws Exception {
		InMemoryStorage storage = new InMemoryStorage();
		CatalogImporter importer = new CatalogImporter(storage, null);
		importer.importDump(fictionDump("fiction.sql", 1, 1, "2020-01-01 00:00:00"), null, new RecordingSink(), new CancellationToken());

		DeltaClientFactory failing = new DeltaClientFactory() {
			@Override
			public <T extends CatalogRecord> DeltaClient<T> create(FamilyStrategy<T> strategy, final WatermarkCursor start) {
				return new DeltaClient<T>() {
					@Override
					public List<T> fetchNextBatch(CancellationToken cancellationToken) throws DeltaFetchException {
						throw new DeltaFetchException("server down");
					}

					@Override
					public WatermarkCursor getCursor() {
						return start;
					}
				};
			}
		};

		assertEquals(SynchronizationResult.ERROR, importer.synchronize(Family.FICTION, failing, new RecordingSink(), new CancellationToken()));
	}

	@Test
	public void cancelledSynchronization() throws Exception {
		InMemoryStorage storage = new InMemoryStorage();
		CatalogImporter importer = new CatalogImporter(storage, null);
		importer.importDump(fictionDump("fiction.sql", 1, 1, "2020-01-01 00:00:00"), null, new RecordingSink(), new CancellationToken());
		CancellationToken cancellationToken = new CancellationToken();
		cancellationToken.cancel();

		List<List<FictionBook>> batches = new ArrayList<List<FictionBook>>();
		batches.add(Arrays.asList(fiction(2, "Two", "2021-01-01 00:00:00")));

		assertEquals(SynchronizationResult.CANCELLED,
				importer.synchronize(Family.FICTION, new ScriptedDeltaClientFactory(batches), new RecordingSink(), cancellationToken));
		assertEquals(1, storage.countRecords(Family.FICTION));
	}

	@Test
	public void synchronizationStopsOnLowDiskSpace() throws Exception {
		InMemoryStorage storage = new InMemoryStorage();
		CatalogImporter importer = new CatalogImporter(storage, null);
		importer.importDump(fictionDump("fiction.sql", 1, 1, "2020-01-01 00:00:00"), null, new RecordingSink(), new CancellationToken());
		storage.setFreeSpace(Long.valueOf(1));

		assertEquals(SynchronizationResult.LOW_DISK_SPACE, importer.synchronize(Family.FICTION,
				new ScriptedDeltaClientFactory(new ArrayList<List<FictionBook>>()), new RecordingSink(), new CancellationToken()));
	}

	@Test
	public void statisticsCoverEveryFamily() throws Exception {
		InMemoryStorage storage = new InMemoryStorage();
		CatalogImporter importer = new CatalogImporter(storage, null);
		importer.importDump(new DumpBuilder().createTable(TableDefinitions.FICTION)
				.insert(TableDefinitions.FICTION, Arrays.asList(fictionRow(1, "One", "2020-05-01 00:00:00"), fictionRow(2, "Two", "2020-03-01 00:00:00")))
				.writeTo(new File(folder, "fiction.sql")), null, new RecordingSink(), new CancellationToken());
		RecordingSink sink = new RecordingSink();

		DatabaseStats stats = importer.getDatabaseStats(sink);

		assertEquals(2, stats.getRecordCount(Family.FICTION));
		assertEquals(TimeHelper.parseCatalogTime("2020-05-01 00:00:00"), stats.getLastUpdate(Family.FICTION));
		assertEquals(0, stats.getRecordCount(Family.SCI_MAG));
		assertNull(stats.getLastUpdate(Family.SCI_MAG));
		assertEquals(Arrays.asList("fiction.LastModifiedDateTime"), storage.getCreatedIndexes());
		assertEquals(1, sink.of(CreateIndexProgress.class).size());
	}
}
