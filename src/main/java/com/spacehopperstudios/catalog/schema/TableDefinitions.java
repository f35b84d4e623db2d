//
//  TableDefinitions.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.schema;

import static com.spacehopperstudios.catalog.schema.ColumnType.BIGINT;
import static com.spacehopperstudios.catalog.schema.ColumnType.CHAR_OR_VARCHAR;
import static com.spacehopperstudios.catalog.schema.ColumnType.INT;
import static com.spacehopperstudios.catalog.schema.ColumnType.TIMESTAMP;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import com.spacehopperstudios.catalog.model.Family;

/**
 * The upstream tables we know how to import, keyed by table name.
 * 
 * @author billy1380
 */
public class TableDefinitions {

	public static final TableDefinition NON_FICTION = new TableDefinition("updated", Family.NON_FICTION, //
			column("ID", INT), column("Title", CHAR_OR_VARCHAR), column("VolumeInfo", CHAR_OR_VARCHAR), column("Series", CHAR_OR_VARCHAR),
			column("Periodical", CHAR_OR_VARCHAR), column("Author", CHAR_OR_VARCHAR), column("Year", CHAR_OR_VARCHAR), column("Edition", CHAR_OR_VARCHAR),
			column("Publisher", CHAR_OR_VARCHAR), column("City", CHAR_OR_VARCHAR), column("Pages", CHAR_OR_VARCHAR), column("PagesInFile", INT),
			column("Language", CHAR_OR_VARCHAR), column("Topic", CHAR_OR_VARCHAR), column("Library", CHAR_OR_VARCHAR), column("Issue", CHAR_OR_VARCHAR),
			column("Identifier", CHAR_OR_VARCHAR), column("ISSN", CHAR_OR_VARCHAR), column("ASIN", CHAR_OR_VARCHAR), column("UDC", CHAR_OR_VARCHAR),
			column("LBC", CHAR_OR_VARCHAR), column("DDC", CHAR_OR_VARCHAR), column("LCC", CHAR_OR_VARCHAR), column("Doi", CHAR_OR_VARCHAR),
			column("Googlebookid", CHAR_OR_VARCHAR), column("OpenLibraryID", CHAR_OR_VARCHAR), column("Commentary", CHAR_OR_VARCHAR), column("DPI", INT),
			column("Color", CHAR_OR_VARCHAR), column("Cleaned", CHAR_OR_VARCHAR), column("Orientation", CHAR_OR_VARCHAR),
			column("Paginated", CHAR_OR_VARCHAR), column("Scanned", CHAR_OR_VARCHAR), column("Bookmarked", CHAR_OR_VARCHAR),
			column("Searchable", CHAR_OR_VARCHAR), column("Filesize", BIGINT), column("Extension", CHAR_OR_VARCHAR), column("MD5", CHAR_OR_VARCHAR),
			column("Generic", CHAR_OR_VARCHAR), column("Visible", CHAR_OR_VARCHAR), column("Locator", CHAR_OR_VARCHAR), column("Local", INT),
			column("TimeAdded", TIMESTAMP), column("TimeLastModified", TIMESTAMP), column("Coverurl", CHAR_OR_VARCHAR), column("Tags", CHAR_OR_VARCHAR),
			column("IdentifierWODash", CHAR_OR_VARCHAR));

	public static final TableDefinition FICTION = new TableDefinition("fiction", Family.FICTION, //
			column("ID", INT), column("MD5", CHAR_OR_VARCHAR), column("Title", CHAR_OR_VARCHAR), column("Author", CHAR_OR_VARCHAR),
			column("Series", CHAR_OR_VARCHAR), column("Edition", CHAR_OR_VARCHAR), column("Language", CHAR_OR_VARCHAR), column("Year", CHAR_OR_VARCHAR),
			column("Publisher", CHAR_OR_VARCHAR), column("Pages", CHAR_OR_VARCHAR), column("Identifier", CHAR_OR_VARCHAR),
			column("GooglebookID", CHAR_OR_VARCHAR), column("ASIN", CHAR_OR_VARCHAR), column("Coverurl", CHAR_OR_VARCHAR),
			column("Extension", CHAR_OR_VARCHAR), column("Filesize", INT), column("Library", CHAR_OR_VARCHAR), column("Issue", CHAR_OR_VARCHAR),
			column("Locator", CHAR_OR_VARCHAR), column("Commentary", CHAR_OR_VARCHAR), column("Generic", CHAR_OR_VARCHAR),
			column("Visible", CHAR_OR_VARCHAR), column("TimeAdded", TIMESTAMP), column("TimeLastModified", TIMESTAMP));

	public static final TableDefinition SCI_MAG = new TableDefinition("scimag", Family.SCI_MAG, //
			column("ID", INT), column("DOI", CHAR_OR_VARCHAR), column("DOI2", CHAR_OR_VARCHAR), column("Title", CHAR_OR_VARCHAR),
			column("Author", CHAR_OR_VARCHAR), column("Year", CHAR_OR_VARCHAR), column("Month", CHAR_OR_VARCHAR), column("Day", CHAR_OR_VARCHAR),
			column("Volume", CHAR_OR_VARCHAR), column("Issue", CHAR_OR_VARCHAR), column("First_page", CHAR_OR_VARCHAR),
			column("Last_page", CHAR_OR_VARCHAR), column("Journal", CHAR_OR_VARCHAR), column("ISBN", CHAR_OR_VARCHAR), column("ISSNP", CHAR_OR_VARCHAR),
			column("ISSNE", CHAR_OR_VARCHAR), column("MD5", CHAR_OR_VARCHAR), column("Filesize", INT), column("TimeAdded", TIMESTAMP),
			column("JOURNALID", CHAR_OR_VARCHAR), column("AbstractURL", CHAR_OR_VARCHAR), column("Attribute1", CHAR_OR_VARCHAR),
			column("Attribute2", CHAR_OR_VARCHAR), column("Attribute3", CHAR_OR_VARCHAR), column("Attribute4", CHAR_OR_VARCHAR),
			column("Attribute5", CHAR_OR_VARCHAR), column("Attribute6", CHAR_OR_VARCHAR), column("visible", CHAR_OR_VARCHAR),
			column("PubmedID", CHAR_OR_VARCHAR), column("PMC", CHAR_OR_VARCHAR), column("PII", CHAR_OR_VARCHAR));

	public static final Map<String, TableDefinition> ALL_TABLES;

	static {
		Map<String, TableDefinition> tables = new HashMap<String, TableDefinition>();
		tables.put(NON_FICTION.getTableName(), NON_FICTION);
		tables.put(FICTION.getTableName(), FICTION);
		tables.put(SCI_MAG.getTableName(), SCI_MAG);
		ALL_TABLES = Collections.unmodifiableMap(tables);
	}

	private TableDefinitions() {}

	/**
	 * Returns the definition of the named table (any case), or null if it is not a catalog table
	 */
	public static TableDefinition get(String tableName) {
		return tableName == null ? null : ALL_TABLES.get(tableName.toLowerCase(Locale.ROOT));
	}

	public static TableDefinition forFamily(Family family) {
		TableDefinition definition = null;

		for (TableDefinition table : ALL_TABLES.values()) {
			if (table.getFamily() == family) {
				definition = table;
				break;
			}
		}

		return definition;
	}

	private static ColumnDefinition column(String name, ColumnType type) {
		return new ColumnDefinition(name, type);
	}
}
