//
//  DumpRecordIterator.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.ingest;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.apache.log4j.Logger;

import com.spacehopperstudios.catalog.model.CatalogRecord;
import com.spacehopperstudios.catalog.parse.DumpCorruptedException;
import com.spacehopperstudios.catalog.parse.DumpParser;
import com.spacehopperstudios.catalog.parse.ParsedTableDefinition;

/**
 * Records of the current data section of a dump. Rows that don't fit the table definition or that can't be mapped are logged and skipped. Parser
 * failures surface as {@link DumpReadException}.
 * 
 * @author billy1380
 */
public class DumpRecordIterator<T extends CatalogRecord> implements Iterator<T> {

	private static final Logger LOGGER = Logger.getLogger(DumpRecordIterator.class);

	private final DumpParser parser;
	private final ParsedTableDefinition definition;
	private final FamilyStrategy<T> strategy;

	private T next;
	private boolean exhausted;
	private int skippedRowCount;

	public DumpRecordIterator(DumpParser parser, ParsedTableDefinition definition, FamilyStrategy<T> strategy) {
		this.parser = parser;
		this.definition = definition;
		this.strategy = strategy;
	}

	@Override
	public boolean hasNext() {
		while (next == null && !exhausted) {
			List<String> row;

			try {
				row = parser.nextRow();
			} catch (IOException e) {
				throw new DumpReadException(e);
			} catch (DumpCorruptedException e) {
				throw new DumpReadException(e);
			}

			if (row == null) {
				exhausted = true;

				if (skippedRowCount > 0) {
					LOGGER.warn(String.format("Skipped %d rows of %s", skippedRowCount, definition.getTableName()));
				}
			} else if (row.size() != definition.getColumns().size()) {
				skippedRowCount++;
				LOGGER.warn(String.format("Line %d: expected %d values but found %d, skipping row", parser.getLineNumber(), definition.getColumns().size(),
						row.size()));
			} else {
				next = strategy.fromRow(definition, row);

				if (next == null) {
					skippedRowCount++;
				}
			}
		}

		return next != null;
	}

	@Override
	public T next() {
		if (!hasNext()) throw new NoSuchElementException();

		T record = next;
		next = null;
		return record;
	}

	@Override
	public void remove() {
		throw new UnsupportedOperationException();
	}

	public int getSkippedRowCount() {
		return skippedRowCount;
	}
}
