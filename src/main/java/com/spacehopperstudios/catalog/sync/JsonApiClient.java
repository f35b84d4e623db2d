//
//  JsonApiClient.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.sync;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.log4j.Logger;

import com.google.common.base.Charsets;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.spacehopperstudios.catalog.CancellationToken;
import com.spacehopperstudios.catalog.OperationCancelledException;
import com.spacehopperstudios.catalog.TimeHelper;
import com.spacehopperstudios.catalog.ingest.FamilyStrategy;
import com.spacehopperstudios.catalog.model.CatalogRecord;
import com.spacehopperstudios.catalog.model.WatermarkCursor;

/**
 * {@link DeltaClient} for the upstream JSON API.
 * 
 * Each batch is a single GET asking for records newer than the cursor. The server's ordering is not trusted: the batch is filtered against the
 * cursor and sorted before it is returned.
 * 
 * @author billy1380
 */
public class JsonApiClient<T extends CatalogRecord> implements DeltaClient<T> {

	private static final Logger LOGGER = Logger.getLogger(JsonApiClient.class);

	private static final long POLL_INTERVAL_MILLIS = 100;

	/**
	 * How many times the batch size a page may widen to when every record on it is at or before the cursor
	 */
	static final int MAX_WIDENING = 64;

	private final HttpClient httpClient;
	private final String url;
	private final int batchSize;
	private final FamilyStrategy<T> strategy;

	private WatermarkCursor cursor;

	public JsonApiClient(HttpClient httpClient, String url, WatermarkCursor start, int batchSize, FamilyStrategy<T> strategy) {
		if (httpClient == null) throw new NullPointerException("httpClient cannot be null");
		if (url == null) throw new NullPointerException("url cannot be null");
		if (strategy == null) throw new NullPointerException("strategy cannot be null");
		if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive");

		this.httpClient = httpClient;
		this.url = url;
		this.batchSize = batchSize;
		this.strategy = strategy;
		this.cursor = start == null ? WatermarkCursor.START : start;
	}

	/**
	 * Creates clients for one endpoint, all sharing the same http client
	 */
	public static DeltaClientFactory factory(final HttpClient httpClient, final String url, final int batchSize) {
		return new DeltaClientFactory() {
			@Override
			public <R extends CatalogRecord> DeltaClient<R> create(FamilyStrategy<R> strategy, WatermarkCursor start) {
				return new JsonApiClient<R>(httpClient, url, start, batchSize, strategy);
			}
		};
	}

	@Override
	public WatermarkCursor getCursor() {
		return cursor;
	}

	@Override
	public List<T> fetchNextBatch(CancellationToken cancellationToken) throws DeltaFetchException, OperationCancelledException {
		int limit = batchSize;
		List<T> batch = new ArrayList<T>();

		while (true) {
			int pageSize = fetchPage(limit, batch, cancellationToken);

			if (!batch.isEmpty() || pageSize < limit) {
				break;
			}

			// a full page with nothing after the cursor, the server is repeating records it already sent
			if (limit >= batchSize * MAX_WIDENING) {
				LOGGER.warn(String.format("Gave up on %s after %d records at or before cursor %s", strategy.getFamily(), pageSize, cursor));
				break;
			}

			limit = limit * 2;

			if (LOGGER.isInfoEnabled()) {
				LOGGER.info(String.format("Page of %d %s records had nothing after cursor %s, asking for %d", pageSize, strategy.getFamily(), cursor, limit));
			}
		}

		if (!batch.isEmpty()) {
			cursor = WatermarkCursor.max(cursor, strategy.getWatermark(batch.get(batch.size() - 1)));
		}

		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug(String.format("Fetched %d %s records, cursor now %s", batch.size(), strategy.getFamily(), cursor));
		}

		return batch;
	}

	/**
	 * Requests one page of at most limit records and adds the ones after the cursor to batch, sorted.
	 * 
	 * @return the number of entries the server sent
	 */
	private int fetchPage(int limit, List<T> batch, CancellationToken cancellationToken) throws DeltaFetchException, OperationCancelledException {
		URI uri = buildUri(limit);

		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug(String.format("Fetching %s", uri));
		}

		HttpRequest request = HttpRequest.newBuilder(uri).header("Accept", "application/json").GET().build();
		HttpResponse<String> response = await(httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(Charsets.UTF_8)), cancellationToken);

		if (response.statusCode() < 200 || response.statusCode() >= 300) {
			throw new DeltaFetchException(String.format("%s answered with status %d", uri, response.statusCode()));
		}

		return parse(response.body(), batch);
	}

	URI buildUri(int limit) throws DeltaFetchException {
		StringBuilder builder = new StringBuilder(url);
		builder.append(url.indexOf('?') < 0 ? '?' : '&');
		builder.append("fields=*&mode=newer");
		builder.append("&timenewer=").append(URLEncoder.encode(TimeHelper.formatCatalogTime(cursor.getTimestamp()), Charsets.UTF_8));
		builder.append("&idnewer=").append(cursor.getRemoteId());
		builder.append("&limit1=").append(limit);

		try {
			return URI.create(builder.toString());
		} catch (IllegalArgumentException e) {
			throw new DeltaFetchException(String.format("Invalid delta url [%s]", url), e);
		}
	}

	private HttpResponse<String> await(Future<HttpResponse<String>> future, CancellationToken cancellationToken) throws DeltaFetchException,
			OperationCancelledException {
		while (true) {
			if (cancellationToken.isCancellationRequested()) {
				future.cancel(true);
				throw new OperationCancelledException("Fetch cancelled");
			}

			try {
				return future.get(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
			} catch (TimeoutException e) {
				if (LOGGER.isTraceEnabled()) {
					LOGGER.trace(String.format("Still waiting for %s", url));
				}
			} catch (InterruptedException e) {
				future.cancel(true);
				Thread.currentThread().interrupt();
				throw new OperationCancelledException("Fetch interrupted");
			} catch (ExecutionException e) {
				throw new DeltaFetchException(String.format("Request to %s failed", url), e.getCause());
			}
		}
	}

	private int parse(String body, List<T> batch) throws DeltaFetchException {
		JsonElement root;

		try {
			root = JsonParser.parseString(body);
		} catch (JsonParseException e) {
			throw new DeltaFetchException("Delta response is not valid JSON", e);
		}

		if (!root.isJsonArray()) {
			throw new DeltaFetchException(String.format("Expected a JSON array but got %s", root.isJsonObject() ? "an object" : root.toString()));
		}

		JsonArray entries = root.getAsJsonArray();

		for (JsonElement element : entries) {
			if (!element.isJsonObject()) {
				LOGGER.warn(String.format("Skipping non object entry %s", element));
				continue;
			}

			T record = strategy.fromJson(element.getAsJsonObject());

			if (record != null && strategy.getWatermark(record).isAfter(cursor)) {
				batch.add(record);
			}
		}

		Collections.sort(batch, new Comparator<T>() {
			@Override
			public int compare(T a, T b) {
				return strategy.getWatermark(a).compareTo(strategy.getWatermark(b));
			}
		});

		return entries.size();
	}
}
