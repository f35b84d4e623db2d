//
//  DumpParser.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.parse;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import org.apache.log4j.Logger;

import com.google.common.base.Charsets;
import com.google.common.io.ByteStreams;
import com.google.common.io.CountingInputStream;
import com.spacehopperstudios.catalog.schema.ColumnType;

/**
 * Reads a mysqldump style SQL export one line at a time.
 *
 * Each line read with {@link #readLine()} is classified as a table definition, an insert statement or something we don't care about. When the current line
 * starts a table definition, {@link #parseTableDefinition()} reads the rest of it. When the current line is an insert statement, {@link #nextRow()} returns
 * its value tuples one at a time, carrying on into the following insert statements of the same table until the data section ends.
 *
 * Gzip and zip compressed dumps are decompressed on the fly; the reported position is then the position in the compressed file.
 */
public class DumpParser implements Closeable {

	private static final Logger LOGGER = Logger.getLogger(DumpParser.class);

	private static final String CREATE_TABLE_TAG = "CREATE TABLE";
	private static final String IF_NOT_EXISTS_TAG = "IF NOT EXISTS";
	private static final String VALUES_TAG = "VALUES";
	private static final List<String> INSERT_TAGS = Arrays.asList(new String[] { "INSERT INTO", "INSERT IGNORE INTO", "REPLACE INTO" });
	private static final List<String> NON_COLUMN_TAGS = Arrays.asList(new String[] { "PRIMARY KEY", "KEY ", "UNIQUE ", "INDEX ", "FULLTEXT ", "SPATIAL ",
			"CONSTRAINT ", "CHECK " });

	public enum LineCommand {
		CREATE_TABLE, INSERT, OTHER
	}

	private final boolean compressed;
	private final long fileSize;
	private final CountingInputStream countingStream;
	private final InputStream dataStream;

	private long bytesConsumed;
	private long lineNumber;
	private String currentLine;
	private LineCommand currentLineCommand;
	private boolean pushedBack;

	// state of the insert statement being read by nextRow
	private String dataTableName;
	private String statementText;
	private int statementPosition;
	private boolean inStatement;

	public DumpParser(File file) throws IOException {
		this(file, 0);
	}

	/**
	 * Opens the dump, skipping to startPosition first.
	 *
	 * This is useful for resuming an import that was interrupted; startPosition should be a value previously returned by {@link #getCurrentFilePosition()}
	 * right after a line was read. Compressed dumps can only be read from the start.
	 */
	public DumpParser(File file, long startPosition) throws IOException {
		String name = file.getName().toLowerCase(Locale.ROOT);

		this.fileSize = file.length();
		this.compressed = name.endsWith(".gz") || name.endsWith(".zip");

		if (compressed && startPosition > 0) {
			throw new IllegalArgumentException(String.format("Cannot resume compressed dump %s from position %d", file.getName(), startPosition));
		}

		this.countingStream = new CountingInputStream(new FileInputStream(file));

		InputStream stream;
		try {
			if (name.endsWith(".gz")) {
				stream = new GZIPInputStream(countingStream, 64 * 1024);
			} else if (name.endsWith(".zip")) {
				ZipInputStream zipStream = new ZipInputStream(countingStream);
				ZipEntry entry = zipStream.getNextEntry();

				if (entry == null) {
					throw new IOException(String.format("Archive %s is empty", file.getName()));
				}

				if (LOGGER.isDebugEnabled()) {
					LOGGER.debug(String.format("Reading archive entry %s", entry.getName()));
				}

				stream = zipStream;
			} else {
				if (startPosition > 0) {
					ByteStreams.skipFully(countingStream, startPosition);
					bytesConsumed = startPosition;
				}

				stream = countingStream;
			}
		} catch (IOException e) {
			countingStream.close();
			throw e;
		}

		this.dataStream = new BufferedInputStream(stream, 64 * 1024);
		this.currentLineCommand = LineCommand.OTHER;
	}

	public long getFileSize() {
		return fileSize;
	}

	/**
	 * Number of bytes of the dump file read so far
	 */
	public long getCurrentFilePosition() {
		return compressed ? countingStream.getCount() : bytesConsumed;
	}

	public long getLineNumber() {
		return lineNumber;
	}

	public String getCurrentLine() {
		return currentLine;
	}

	public LineCommand getCurrentLineCommand() {
		return currentLineCommand;
	}

	/**
	 * Moves on to the next line and classifies it. Returns false at the end of the dump.
	 */
	public boolean readLine() throws IOException {
		if (pushedBack) {
			pushedBack = false;
			return true;
		}

		String line = readRawLine();

		if (line == null) {
			currentLine = null;
			currentLineCommand = LineCommand.OTHER;
			return false;
		}

		currentLine = line;
		currentLineCommand = classify(line);

		return true;
	}

	/**
	 * Makes the next {@link #readLine()} return the current line again
	 */
	public void pushBack() {
		if (currentLine == null) throw new IllegalStateException("There is no current line to push back");

		pushedBack = true;
	}

	/**
	 * Name of the table the current insert line writes to, or null if the current line is not an insert
	 */
	public String getCurrentInsertTableName() {
		return currentLineCommand == LineCommand.INSERT ? parseInsertTableName(currentLine) : null;
	}

	/**
	 * Reads the table definition starting at the current line, consuming lines up to and including its closing line.
	 *
	 * Column lines that cannot be understood are logged and left out of the result.
	 */
	public ParsedTableDefinition parseTableDefinition() throws IOException, DumpCorruptedException {
		if (currentLineCommand != LineCommand.CREATE_TABLE) {
			throw new IllegalStateException("Current line is not a table definition");
		}

		String tableName = parseCreateTableName(currentLine);
		List<ParsedColumnDefinition> columns = new ArrayList<ParsedColumnDefinition>();

		while (true) {
			String line = readRawLine();

			if (line == null) {
				throw new DumpCorruptedException(String.format("Definition of table %s is not terminated", tableName));
			}

			String trimmed = line.trim();

			if (trimmed.startsWith(")")) {
				break;
			}

			if (trimmed.length() == 0 || isNonColumnLine(trimmed)) {
				continue;
			}

			try {
				columns.add(parseColumnDefinition(trimmed));
			} catch (DumpParseException e) {
				LOGGER.warn(String.format("Skipping column of table %s: %s", tableName, e.getMessage()));
			}
		}

		currentLine = null;
		currentLineCommand = LineCommand.OTHER;

		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug(String.format("Parsed table definition %s with %d columns", tableName, columns.size()));
		}

		return new ParsedTableDefinition(tableName, columns);
	}

	/**
	 * Returns the values of the next row of the current data section, or null once the section is over.
	 *
	 * NULL values are returned as null, strings are unescaped and numbers are returned as they were written.
	 */
	public List<String> nextRow() throws IOException, DumpCorruptedException {
		while (true) {
			if (!inStatement) {
				if (pushedBack || currentLineCommand != LineCommand.INSERT || !startStatement()) {
					return null;
				}

				if (!inStatement) {
					continue; // skipped an insert without values
				}
			}

			skipSeparators();

			if (statementPosition >= statementText.length()) {
				// the statement continues on the next line
				String line = readRawLine();
				if (line == null) {
					throw new DumpCorruptedException(String.format("Insert into %s is not terminated at line %d", dataTableName, lineNumber));
				}

				statementText = line;
				statementPosition = 0;
				continue;
			}

			char c = statementText.charAt(statementPosition);

			if (c == ';') {
				endStatement();
				continue;
			}

			if (c == '(') {
				statementPosition++;

				try {
					return parseTuple();
				} catch (DumpParseException e) {
					LOGGER.warn(String.format("Skipping the rest of an insert into %s: %s", dataTableName, e.getMessage()));
					endStatement();
					continue;
				}
			}

			LOGGER.warn(String.format("Skipping the rest of an insert into %s: line %d, unexpected '%c' at column %d", dataTableName, lineNumber, c,
					statementPosition + 1));
			endStatement();
		}
	}

	@Override
	public void close() throws IOException {
		dataStream.close();
	}

	static LineCommand classify(String line) {
		String upper = stripLeadingWhitespace(line).toUpperCase(Locale.ROOT);

		if (upper.startsWith(CREATE_TABLE_TAG)) {
			return LineCommand.CREATE_TABLE;
		}

		for (String tag : INSERT_TAGS) {
			if (upper.startsWith(tag)) {
				return LineCommand.INSERT;
			}
		}

		return LineCommand.OTHER;
	}

	/**
	 * Gets the table name out of "CREATE TABLE [IF NOT EXISTS] `schema`.`name` (" or of "INSERT INTO `name` VALUES ..."
	 */
	static String parseCreateTableName(String line) {
		String rest = stripLeadingWhitespace(line).substring(CREATE_TABLE_TAG.length()).trim();

		if (rest.toUpperCase(Locale.ROOT).startsWith(IF_NOT_EXISTS_TAG)) {
			rest = rest.substring(IF_NOT_EXISTS_TAG.length()).trim();
		}

		return readQualifiedName(rest);
	}

	static String parseInsertTableName(String line) {
		String rest = stripLeadingWhitespace(line);
		String upper = rest.toUpperCase(Locale.ROOT);

		for (String tag : INSERT_TAGS) {
			if (upper.startsWith(tag)) {
				rest = rest.substring(tag.length()).trim();
				break;
			}
		}

		return readQualifiedName(rest);
	}

	private static String readQualifiedName(String text) {
		String name = null;
		int i = 0;

		while (i < text.length()) {
			int start;
			int end;

			if (text.charAt(i) == '`') {
				start = i + 1;
				end = text.indexOf('`', start);
				if (end < 0) {
					end = text.length();
				}
				name = text.substring(start, end);
				i = end + 1;
			} else {
				start = i;
				end = i;
				while (end < text.length() && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_' || text.charAt(end) == '$')) {
					end++;
				}
				name = text.substring(start, end);
				i = end;
			}

			if (i < text.length() && text.charAt(i) == '.') {
				i++; // schema qualified; keep the last part
			} else {
				break;
			}
		}

		return name;
	}

	/**
	 * Position of the VALUES keyword of an insert line, skipping quoted names and words that merely contain it. Returns -1 if there is none.
	 */
	static int findValuesKeyword(String line) {
		String upper = line.toUpperCase(Locale.ROOT);
		int i = 0;

		while (i < upper.length()) {
			char c = upper.charAt(i);

			if (c == '`') {
				int end = upper.indexOf('`', i + 1);
				if (end < 0) {
					return -1;
				}
				i = end + 1;
			} else if (upper.startsWith(VALUES_TAG, i) && !isWordChar(upper, i - 1) && !isWordChar(upper, i + VALUES_TAG.length())) {
				return i;
			} else {
				i++;
			}
		}

		return -1;
	}

	private static boolean isWordChar(String text, int index) {
		if (index < 0 || index >= text.length()) {
			return false;
		}

		char c = text.charAt(index);
		return Character.isLetterOrDigit(c) || c == '_' || c == '$';
	}

	private static boolean isNonColumnLine(String trimmed) {
		String upper = trimmed.toUpperCase(Locale.ROOT);

		for (String tag : NON_COLUMN_TAGS) {
			if (upper.startsWith(tag)) {
				return true;
			}
		}

		return false;
	}

	private ParsedColumnDefinition parseColumnDefinition(String trimmed) throws DumpParseException {
		String name;
		int i;

		if (trimmed.charAt(0) == '`') {
			int end = trimmed.indexOf('`', 1);
			if (end < 0) {
				throw new DumpParseException(lineNumber, "unterminated column name");
			}
			name = trimmed.substring(1, end);
			i = end + 1;
		} else {
			int end = 0;
			while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end))) {
				end++;
			}
			name = trimmed.substring(0, end);
			i = end;
		}

		while (i < trimmed.length() && Character.isWhitespace(trimmed.charAt(i))) {
			i++;
		}

		int typeStart = i;
		int depth = 0;
		while (i < trimmed.length()) {
			char c = trimmed.charAt(i);
			if (c == '(') {
				depth++;
			} else if (c == ')') {
				depth--;
			} else if (depth == 0 && (Character.isWhitespace(c) || c == ',')) {
				break;
			}
			i++;
		}

		String type = trimmed.substring(typeStart, i);

		if (name.length() == 0 || type.length() == 0) {
			throw new DumpParseException(lineNumber, String.format("cannot read column definition '%s'", trimmed));
		}

		return new ParsedColumnDefinition(name, ColumnType.fromSqlType(type));
	}

	/**
	 * Positions the statement reader right after the VALUES keyword of the current line. Returns false if the current line is an insert into another table,
	 * which ends the data section.
	 */
	private boolean startStatement() throws IOException {
		String tableName = parseInsertTableName(currentLine);

		if (dataTableName != null && (tableName == null || !tableName.equalsIgnoreCase(dataTableName))) {
			pushedBack = true;
			dataTableName = null;
			return false;
		}

		dataTableName = tableName;

		int valuesIndex = findValuesKeyword(currentLine);

		if (valuesIndex < 0) {
			LOGGER.warn(String.format("Line %d: insert into %s has no values, skipping it", lineNumber, tableName));
			endStatement();
		} else {
			statementText = currentLine;
			statementPosition = valuesIndex + VALUES_TAG.length();
			inStatement = true;
		}

		return true;
	}

	/**
	 * Finishes the current statement and reads the next line; anything but another insert ends the data section.
	 */
	private void endStatement() throws IOException {
		inStatement = false;
		statementText = null;

		if (readLine()) {
			if (currentLineCommand != LineCommand.INSERT) {
				pushedBack = true;
				dataTableName = null;
			}
		} else {
			dataTableName = null;
		}
	}

	private void skipSeparators() {
		while (statementPosition < statementText.length()) {
			char c = statementText.charAt(statementPosition);
			if (c == ',' || Character.isWhitespace(c)) {
				statementPosition++;
			} else {
				break;
			}
		}
	}

	private List<String> parseTuple() throws DumpParseException {
		List<String> values = new ArrayList<String>();
		String text = statementText;
		int i = statementPosition;

		while (true) {
			while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
				i++;
			}

			if (i >= text.length()) {
				throw new DumpParseException(lineNumber, "row is not terminated");
			}

			char c = text.charAt(i);

			if (c == '\'') {
				StringBuilder sb = new StringBuilder();
				i++;
				boolean closed = false;

				while (i < text.length()) {
					char s = text.charAt(i);

					if (s == '\\' && i + 1 < text.length()) {
						sb.append(unescape(text.charAt(i + 1)));
						i += 2;
					} else if (s == '\'') {
						if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
							sb.append('\'');
							i += 2;
						} else {
							i++;
							closed = true;
							break;
						}
					} else {
						sb.append(s);
						i++;
					}
				}

				if (!closed) {
					throw new DumpParseException(lineNumber, "string value is not terminated");
				}

				values.add(sb.toString());
			} else if (c == ')' && values.isEmpty()) {
				i++;
				break; // empty tuple
			} else {
				int start = i;
				while (i < text.length() && text.charAt(i) != ',' && text.charAt(i) != ')') {
					i++;
				}

				String token = text.substring(start, i).trim();

				if (token.length() == 0) {
					throw new DumpParseException(lineNumber, String.format("missing value at column %d", start + 1));
				}

				values.add("NULL".equalsIgnoreCase(token) ? null : token);
			}

			while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
				i++;
			}

			if (i >= text.length()) {
				throw new DumpParseException(lineNumber, "row is not terminated");
			}

			char separator = text.charAt(i);
			i++;

			if (separator == ')') {
				break;
			} else if (separator != ',') {
				throw new DumpParseException(lineNumber, String.format("unexpected '%c' at column %d", separator, i));
			}
		}

		statementPosition = i;

		return values;
	}

	private static char unescape(char c) {
		char unescaped;

		switch (c) {
		case 'n':
			unescaped = '\n';
			break;
		case 'r':
			unescaped = '\r';
			break;
		case 't':
			unescaped = '\t';
			break;
		case '0':
			unescaped = '\0';
			break;
		case 'b':
			unescaped = '\b';
			break;
		case 'Z':
			unescaped = '\u001a';
			break;
		default:
			unescaped = c; // \\, \', \" and anything else stand for themselves
			break;
		}

		return unescaped;
	}

	/**
	 * Returns the next line without its line terminator, or null at the end of the stream
	 */
	private String readRawLine() throws IOException {
		ByteArrayOutputStream buffer = new ByteArrayOutputStream(256);
		int b;
		boolean any = false;

		while ((b = dataStream.read()) != -1) {
			any = true;
			bytesConsumed++;

			if (b == '\n') {
				break;
			}

			buffer.write(b);
		}

		if (!any) {
			return null;
		}

		lineNumber++;

		byte[] bytes = buffer.toByteArray();
		int length = bytes.length;
		if (length > 0 && bytes[length - 1] == '\r') {
			length--;
		}

		return new String(bytes, 0, length, Charsets.UTF_8);
	}

	private static String stripLeadingWhitespace(String line) {
		int i = 0;
		while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
			i++;
		}
		return line.substring(i);
	}
}
