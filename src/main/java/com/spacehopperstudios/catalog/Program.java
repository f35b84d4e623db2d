//
//  Program.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.net.URL;
import java.net.http.HttpClient;
import java.sql.SQLException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.concurrent.ExecutionException;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;
import org.apache.log4j.xml.DOMConfigurator;

import com.google.common.base.Charsets;
import com.google.common.base.Strings;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.spacehopperstudios.catalog.model.DatabaseStats;
import com.spacehopperstudios.catalog.model.Family;
import com.spacehopperstudios.catalog.progress.LoggingProgressSink;
import com.spacehopperstudios.catalog.progress.ProgressSink;
import com.spacehopperstudios.catalog.storage.Connection;
import com.spacehopperstudios.catalog.storage.JdbcStorage;
import com.spacehopperstudios.catalog.sync.JsonApiClient;

public class Program {

	private static final String USAGE_FORMAT = "usage: %s [-d db_host] [-u db_user] [-p db_password] [-n db_name] [-l storage_path]" + "\r\n"
			+ "[-c checkpoint_interval] [-b sync_batch_size] import [-e family] dump_file [dump_file2 ...]" + "\r\n"
			+ "| sync family [family2 ...] | stats";

	private static final String COMMAND_IMPORT = "import";
	private static final String COMMAND_SYNC = "sync";
	private static final String COMMAND_STATS = "stats";

	private static final String OPTION_SHORT_DBHOST = "d";
	private static final String OPTION_FULL_DBHOST = "dbhost";

	private static final String OPTION_SHORT_DBUSER = "u";
	private static final String OPTION_FULL_DBUSER = "dbuser";

	private static final String OPTION_SHORT_DBPASSWORD = "p";
	private static final String OPTION_FULL_DBPASSWORD = "dbpassword";

	private static final String OPTION_SHORT_DBNAME = "n";
	private static final String OPTION_FULL_DBNAME = "dbname";

	private static final String OPTION_SHORT_STORAGEPATH = "l";
	private static final String OPTION_FULL_STORAGEPATH = "storagepath";

	private static final String OPTION_SHORT_CHECKPOINTINTERVAL = "c";
	private static final String OPTION_FULL_CHECKPOINTINTERVAL = "checkpointinterval";

	private static final String OPTION_SHORT_SYNCBATCHSIZE = "b";
	private static final String OPTION_FULL_SYNCBATCHSIZE = "syncbatchsize";

	private static final String OPTION_SHORT_EXPECTEDFAMILY = "e";
	private static final String OPTION_FULL_EXPECTEDFAMILY = "expectedfamily";

	private static final String CONFIG_SYNC_URL_SUFFIX = "syncurl";

	private static final String VERSION = "1.0.0";
	private static final String DESCRIPTION = "CatalogImporter is a tool for importing catalog dumps and remote changes into a database.";

	private static final String CONFIG_PATH = "./CatalogConfig.json";

	private static final String LOGS_FOLDER = "CatalogLogs";
	private static final String LOGGER_CONFIG_PATH = "./CatalogLogger.xml";
	private static final String BUNDLED_LOGGER_CONFIG = "/log4j.xml";

	private static final int CONNECTION_RETRY_COUNT = 3;

	private static final Logger LOGGER;

	static {
		// Create a directory for rotating logs before the appenders open their files
		createLogFolder();

		configureLogger();

		LOGGER = Logger.getLogger(Program.class.getName());
	}

	private static void createDefaultConfigFile() {
		if (!(new File(CONFIG_PATH)).exists()) {

			JsonObject defaultOptions = new JsonObject();

			defaultOptions.add(OPTION_FULL_DBHOST, new JsonPrimitive("localhost"));
			defaultOptions.add(OPTION_FULL_DBUSER, new JsonPrimitive("catalogimporter"));
			defaultOptions.add(OPTION_FULL_DBPASSWORD, new JsonPrimitive("catalog123"));
			defaultOptions.add(OPTION_FULL_DBNAME, new JsonPrimitive("catalog"));
			defaultOptions.add(OPTION_FULL_STORAGEPATH, new JsonPrimitive("."));
			defaultOptions.add(OPTION_FULL_CHECKPOINTINTERVAL, new JsonPrimitive(Integer.valueOf(Constants.IMPORT_PROGRESS_UPDATE_INTERVAL)));
			defaultOptions.add(OPTION_FULL_SYNCBATCHSIZE, new JsonPrimitive(Integer.valueOf(Constants.SYNCHRONIZATION_BATCH_SIZE)));

			for (Family family : Family.values()) {
				defaultOptions.add(syncUrlKey(family), new JsonPrimitive(""));
			}

			dumpDict(defaultOptions, CONFIG_PATH);
		}
	}

	private static void overwriteDefaults(Map<String, String> defaults, CommandLine commandLine) {
		String[][] valueOptions = new String[][] { { OPTION_SHORT_DBHOST, OPTION_FULL_DBHOST }, { OPTION_SHORT_DBUSER, OPTION_FULL_DBUSER },
				{ OPTION_SHORT_DBPASSWORD, OPTION_FULL_DBPASSWORD }, { OPTION_SHORT_DBNAME, OPTION_FULL_DBNAME },
				{ OPTION_SHORT_STORAGEPATH, OPTION_FULL_STORAGEPATH }, { OPTION_SHORT_CHECKPOINTINTERVAL, OPTION_FULL_CHECKPOINTINTERVAL },
				{ OPTION_SHORT_SYNCBATCHSIZE, OPTION_FULL_SYNCBATCHSIZE }, { OPTION_SHORT_EXPECTEDFAMILY, OPTION_FULL_EXPECTEDFAMILY } };

		for (String[] option : valueOptions) {
			if (commandLine.hasOption(option[0])) {
				defaults.put(option[1], commandLine.getOptionValue(option[0]));
			}
		}
	}

	private static void createLogFolder() {
		File logFolder = new File(LOGS_FOLDER);

		if (!logFolder.exists() && !logFolder.mkdirs()) {
			System.err.println(String.format("Could not create log folder @ %s", LOGS_FOLDER));
		}
	}

	private static void configureLogger() {
		if (new File(LOGGER_CONFIG_PATH).exists()) {
			DOMConfigurator.configure(LOGGER_CONFIG_PATH);
		} else {
			URL bundled = Program.class.getResource(BUNDLED_LOGGER_CONFIG);

			if (bundled != null) {
				DOMConfigurator.configure(bundled);
			}
		}
	}

	private static JsonObject getConfig() {
		InputStream configStream = null;
		JsonElement config = null;

		try {
			configStream = new FileInputStream(CONFIG_PATH);
			config = JsonParser.parseReader(new InputStreamReader(configStream, Charsets.UTF_8));
		} catch (FileNotFoundException e) {
			LOGGER.error(String.format("Error; config file %s not found", CONFIG_PATH), e);
		} catch (JsonParseException e) {
			LOGGER.error(String.format("Error; config file %s is not valid json", CONFIG_PATH), e);
		} finally {
			if (configStream != null) {
				try {
					configStream.close();
				} catch (IOException e) {
					LOGGER.error("Error; config stream could not be closed", e);
				}
			}
		}

		return config == null || !config.isJsonObject() ? new JsonObject() : config.getAsJsonObject();
	}

	private static CommandLine parseArgs(String[] args) {
		Options options = new Options();
		try {
			CommandLineParser cliParser = new GnuParser();

			options.addOption(OPTION_SHORT_DBHOST, OPTION_FULL_DBHOST, true, "The hostname of the database (default is localhost)");

			options.addOption(OPTION_SHORT_DBUSER, OPTION_FULL_DBUSER, true, "The user which will execute the database commands; must have table create privileges");

			options.addOption(OPTION_SHORT_DBPASSWORD, OPTION_FULL_DBPASSWORD, true, "The user's password for the database");

			options.addOption(OPTION_SHORT_DBNAME, OPTION_FULL_DBNAME, true, "The name of the database to connect to");

			options.addOption(OPTION_SHORT_STORAGEPATH, OPTION_FULL_STORAGEPATH, true, "A path on the volume holding the database, used to check free space");

			options.addOption(OPTION_SHORT_CHECKPOINTINTERVAL, OPTION_FULL_CHECKPOINTINTERVAL, true,
					"Number of records written between two progress reports while importing a dump");

			options.addOption(OPTION_SHORT_SYNCBATCHSIZE, OPTION_FULL_SYNCBATCHSIZE, true, "Number of records asked for in each synchronization request");

			options.addOption(OPTION_SHORT_EXPECTEDFAMILY, OPTION_FULL_EXPECTEDFAMILY, true,
					"Fail the import if the dump holds another family than this one (nonfiction, fiction or scimag)");

			return cliParser.parse(options, args);

		} catch (ParseException e) {
			LOGGER.error("Error parsing command line", e);
		}

		return null;
	}

	/**
	 * Opens the file at filePath (creating it if it doesn't exist, overwriting if not), writes aDict to it in json format, then closes it
	 */
	private static void dumpDict(JsonObject aDict, String filePath) {
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug(String.format("Writing %s", filePath));
		}

		OutputStream configStream = null;
		OutputStreamWriter configWriter = null;
		try {
			configStream = new FileOutputStream(filePath);
			configWriter = new OutputStreamWriter(configStream, Charsets.UTF_8);
			configWriter.write(new GsonBuilder().setPrettyPrinting().create().toJson(aDict));
		} catch (FileNotFoundException e) {
			LOGGER.error(String.format("Error creating file %s", filePath), e);
		} catch (IOException e) {
			LOGGER.error(String.format("Error writing file %s", filePath), e);
		} finally {
			if (configWriter != null) {
				try {
					configWriter.close();
				} catch (IOException e) {
					LOGGER.error(String.format("Error closing file %s", filePath), e);
				}
			} else if (configStream != null) {
				try {
					configStream.close();
				} catch (IOException e) {
					LOGGER.error(String.format("Error closing file %s", filePath), e);
				}
			}
		}
	}

	private static String syncUrlKey(Family family) {
		return family.getCode() + CONFIG_SYNC_URL_SUFFIX;
	}

	private static void printUsage() {
		if (LOGGER.isInfoEnabled()) {
			LOGGER.info(DESCRIPTION);
			LOGGER.info(VERSION);
			LOGGER.info(String.format(USAGE_FORMAT, "catalogimporter"));
		}
	}

	private static int intOption(Map<String, String> optionsMap, String key, int defaultValue) {
		String value = optionsMap.get(key);
		int parsed = defaultValue;

		if (!Strings.isNullOrEmpty(value)) {
			try {
				parsed = Integer.parseInt(value.trim());
			} catch (NumberFormatException e) {
				LOGGER.warn(String.format("Ignoring %s [%s], using %d", key, value, defaultValue));
			}
		}

		return parsed;
	}

	private static Family familyArgument(String code) {
		Family family = Family.fromCode(code);

		if (family == null) {
			LOGGER.error(String.format("Unknown family [%s], expected nonfiction, fiction or scimag", code));
		}

		return family;
	}

	/**
	 * Waits for an operation, cancelling it if the process is asked to stop
	 */
	private static <T> T await(ListenableFuture<T> future, final CancellationToken cancellationToken) throws InterruptedException, ExecutionException {
		Thread cancelHook = new Thread() {
			@Override
			public void run() {
				LOGGER.info("Stopping, cancelling the running operation");
				cancellationToken.cancel();
			}
		};

		Runtime.getRuntime().addShutdownHook(cancelHook);

		try {
			return future.get();
		} finally {
			try {
				Runtime.getRuntime().removeShutdownHook(cancelHook);
			} catch (IllegalStateException e) {
				LOGGER.debug("Shutting down, cancel hook left in place");
			}
		}
	}

	private static boolean importDumps(CatalogImporter importer, List<String> dumpPaths, Family expectedFamily, ProgressSink progressSink)
			throws InterruptedException, ExecutionException {
		boolean allCompleted = true;

		for (String dumpPath : dumpPaths) {
			CancellationToken cancellationToken = new CancellationToken();
			ImportDumpResult result = await(importer.importDumpAsync(new File(dumpPath), expectedFamily, progressSink, cancellationToken),
					cancellationToken);

			if (result != ImportDumpResult.COMPLETED) {
				LOGGER.error(String.format("Import of %s ended with %s", dumpPath, result));
				allCompleted = false;

				if (result == ImportDumpResult.CANCELLED || result == ImportDumpResult.LOW_DISK_SPACE) {
					break;
				}
			}
		}

		return allCompleted;
	}

	private static boolean synchronize(CatalogImporter importer, List<String> familyCodes, JsonObject config, int batchSize, ProgressSink progressSink)
			throws InterruptedException, ExecutionException {
		boolean allCompleted = true;
		HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).followRedirects(HttpClient.Redirect.NORMAL).build();

		for (String familyCode : familyCodes) {
			Family family = familyArgument(familyCode);

			if (family == null) {
				allCompleted = false;
				continue;
			}

			JsonElement url = config.get(syncUrlKey(family));

			if (url == null || url.isJsonNull() || Strings.isNullOrEmpty(url.getAsString())) {
				LOGGER.error(String.format("No %s set in %s, cannot synchronize %s", syncUrlKey(family), CONFIG_PATH, family));
				allCompleted = false;
				continue;
			}

			CancellationToken cancellationToken = new CancellationToken();
			SynchronizationResult result = await(importer.synchronizeAsync(family, JsonApiClient.factory(httpClient, url.getAsString(), batchSize),
					progressSink, cancellationToken), cancellationToken);

			if (result != SynchronizationResult.COMPLETED) {
				LOGGER.error(String.format("Synchronization of %s ended with %s", family, result));
				allCompleted = false;
			}
		}

		return allCompleted;
	}

	/**
	 * Entry point for command-line execution
	 */
	public static void main(String[] args) {

		// If the default config file doesn't exist, create it using these values.
		createDefaultConfigFile();

		CommandLine parsed = parseArgs(args);

		if (parsed == null || parsed.getArgList().isEmpty()) {
			printUsage();
			return;
		}

		Map<String, String> optionsMap = new HashMap<String, String>();
		overwriteDefaults(optionsMap, parsed);

		JsonObject config = getConfig();

		for (Entry<String, JsonElement> entry : config.entrySet()) {
			if (optionsMap.get(entry.getKey()) == null && entry.getValue().isJsonPrimitive()) {
				optionsMap.put(entry.getKey(), entry.getValue().getAsString());
			}
		}

		List<String> arguments = parsed.getArgList();
		String command = arguments.get(0);
		List<String> commandArguments = arguments.subList(1, arguments.size());

		if (!COMMAND_STATS.equals(command) && commandArguments.isEmpty()) {
			printUsage();
			return;
		}

		Family expectedFamily = null;
		if (optionsMap.get(OPTION_FULL_EXPECTEDFAMILY) != null) {
			expectedFamily = familyArgument(optionsMap.get(OPTION_FULL_EXPECTEDFAMILY));

			if (expectedFamily == null) {
				System.exit(1);
			}
		}

		ImporterOptions importerOptions = new ImporterOptions().setImportCheckpointInterval(intOption(optionsMap, OPTION_FULL_CHECKPOINTINTERVAL,
				Constants.IMPORT_PROGRESS_UPDATE_INTERVAL));
		int batchSize = intOption(optionsMap, OPTION_FULL_SYNCBATCHSIZE, Constants.SYNCHRONIZATION_BATCH_SIZE);
		String storagePath = optionsMap.get(OPTION_FULL_STORAGEPATH);

		for (String key : new String[] { OPTION_FULL_DBHOST, OPTION_FULL_DBNAME, OPTION_FULL_DBUSER, OPTION_FULL_DBPASSWORD }) {
			if (optionsMap.get(key) == null) {
				LOGGER.error(String.format("Error; %s missing from %s and the command line", key, CONFIG_PATH));
				System.exit(1);
			}
		}

		boolean succeeded = false;
		Connection connection = null;
		CatalogImporter importer = null;

		try {
			connection = new Connection(optionsMap.get(OPTION_FULL_DBHOST), optionsMap.get(OPTION_FULL_DBNAME), optionsMap.get(OPTION_FULL_DBUSER),
					optionsMap.get(OPTION_FULL_DBPASSWORD), CONNECTION_RETRY_COUNT);

			JdbcStorage storage = new JdbcStorage(connection, new File(Strings.isNullOrEmpty(storagePath) ? "." : storagePath));
			storage.initialize();

			importer = new CatalogImporter(storage, importerOptions);
			ProgressSink progressSink = new LoggingProgressSink();

			if (COMMAND_IMPORT.equals(command)) {
				succeeded = importDumps(importer, commandArguments, expectedFamily, progressSink);
			} else if (COMMAND_SYNC.equals(command)) {
				succeeded = synchronize(importer, commandArguments, config, batchSize, progressSink);
			} else if (COMMAND_STATS.equals(command)) {
				importer.refreshCounts();
				DatabaseStats stats = importer.getDatabaseStats(progressSink);

				for (Family family : Family.values()) {
					Object lastUpdate = stats.getLastUpdate(family) == null ? "never" : TimeHelper.timeText(stats.getLastUpdate(family));
					LOGGER.info(String.format("%s: %d records, last updated %s", family, stats.getRecordCount(family), lastUpdate));
				}

				succeeded = true;
			} else {
				printUsage();
			}
		} catch (ClassNotFoundException e) {
			LOGGER.error("Error; the MySQL driver is not on the classpath", e);
		} catch (InterruptedException e) {
			LOGGER.error("Interrupted", e);
			Thread.currentThread().interrupt();
		} catch (ExecutionException e) {
			LOGGER.error("Operation failed", e.getCause());
		} catch (RuntimeException e) {
			LOGGER.error("Error", e);
		} finally {
			if (importer != null) {
				importer.close();
			}

			if (connection != null) {
				try {
					connection.disconnect();
				} catch (SQLException e) {
					LOGGER.error("Error closing the database connection", e);
				}
			}
		}

		if (!succeeded) {
			System.exit(1);
		}
	}
}
