//
//  Connection.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 7 Aug 2013.
//  Copyright © 2013 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.storage;

import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import org.apache.log4j.Logger;

/**
 * Thin wrapper around a MySQL JDBC connection that (re)connects lazily and retries statements that fail because the connection dropped.
 */
public class Connection {

	private static final Logger LOGGER = Logger.getLogger(Connection.class);

	private static final String DATABASE_DRIVER = "com.mysql.cj.jdbc.Driver";

	private final String server;
	private final String database;
	private final String username;
	private final String password;
	private final int retryCount;

	private java.sql.Connection connection;
	private ResultSet queryResult;
	private Statement statement;
	private boolean isTransactionMode;

	public Connection(String server, String database, String username, String password, int retryCount) throws ClassNotFoundException {
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Create connection with server " + server + ", database: " + database + ", username: " + username);
		}

		if (server == null) throw new NullPointerException("server cannot be null");
		if (database == null) throw new NullPointerException("database cannot be null");
		if (username == null) throw new NullPointerException("username cannot be null");
		if (password == null) throw new NullPointerException("password cannot be null");

		this.server = server;
		this.database = database;
		this.username = username;
		this.password = password;
		this.retryCount = retryCount;

		Class.forName(DATABASE_DRIVER);
	}

	public String getDatabase() {
		return database;
	}

	public void connect() throws SQLException {
		String url = "jdbc:mysql://" + server + "/" + database + "?useUnicode=true&characterEncoding=utf8&rewriteBatchedStatements=true";

		if (connection == null) {
			connection = DriverManager.getConnection(url, username, password);
			connection.setAutoCommit(!isTransactionMode);
		}
	}

	/**
	 * Runs a statement, reconnecting and retrying up to retryCount times if it fails. Any result set can then be read with {@link #fetchNextRow()}.
	 */
	public void executeQuery(String query) throws SQLException {
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("executing query: " + query);
		}

		if (query == null) throw new NullPointerException("query cannot be null");
		if (query.length() == 0) throw new IllegalArgumentException("query cannot be empty");

		int retriesLeft = retryCount;

		while (true) {
			try {
				closeStatement();
				connect();

				statement = connection.createStatement();
				if (statement.execute(query)) {
					queryResult = statement.getResultSet();
				} else {
					queryResult = null;
				}

				return;
			} catch (SQLException e) {
				retriesLeft--;

				// a statement inside a transaction can't be replayed on a new connection
				if (retriesLeft < 0 || isTransactionMode || isConnected()) {
					throw e;
				}

				LOGGER.error(String.format("Error occured executing: %s", query), e);
				disconnect();
			}
		}
	}

	/**
	 * Returns a new prepared statement on the connection; the caller closes it
	 */
	public PreparedStatement prepare(String query, boolean returnGeneratedKeys) throws SQLException {
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("preparing query: " + query);
		}

		connect();

		return returnGeneratedKeys ? connection.prepareStatement(query, Statement.RETURN_GENERATED_KEYS) : connection.prepareStatement(query);
	}

	public boolean fetchNextRow() throws SQLException {
		return queryResult != null && queryResult.next();
	}

	public Object getCurrentRowValue(String key) throws SQLException {
		Object value = null;

		if (queryResult != null) {
			value = queryResult.getObject(key);
		}

		return value;
	}

	public Integer getCurrentRowInteger(String key) throws SQLException {
		Integer value = null;

		if (queryResult != null) {
			value = queryResult.getInt(key);

			if (queryResult.wasNull()) {
				value = null;
			}
		}

		return value;
	}

	public String getCurrentRowString(String key) throws SQLException {
		String value = null;

		if (queryResult != null) {
			value = queryResult.getString(key);
		}

		return value;
	}

	public void disconnect() throws SQLException {
		closeStatement();

		if (connection != null) {
			if (!connection.isClosed()) {
				connection.close();
			}

			connection = null;
		}
	}

	public boolean isConnected() throws SQLException {
		return connection != null && !connection.isClosed();
	}

	public void commit() throws SQLException {
		if (isTransactionMode) {
			if (isConnected()) {
				connection.commit();
			}
		} else {
			LOGGER.info("Attemting to commit when not in transaction mode");
		}
	}

	public void rollback() throws SQLException {
		if (isTransactionMode && isConnected()) {
			connection.rollback();
		}
	}

	public void setTransactionMode(boolean transactional) throws SQLException {
		if (isTransactionMode != transactional) {
			isTransactionMode = transactional;

			if (connection != null) {
				connection.setAutoCommit(!transactional);
			}
		}
	}

	private void closeStatement() throws SQLException {
		queryResult = null;

		if (statement != null) {
			statement.close();
			statement = null;
		}
	}
}
