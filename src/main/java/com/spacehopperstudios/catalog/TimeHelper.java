//
//  TimeHelper.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Sep 2013.
//  Copyright © 2013 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog;

import java.text.ParseException;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.TimeZone;

import org.apache.log4j.helpers.ISO8601DateFormat;

/**
 * @author billy1380
 * 
 */
public class TimeHelper {

	/**
	 * Format of timestamps in catalog dumps and in the delta API
	 */
	public static final String CATALOG_TIME_FORMAT = "yyyy-MM-dd HH:mm:ss";

	public static String durationText(Date start, Date end) {
		long duration = end.getTime() - start.getTime();

		long hours = duration / (1000 * 60 * 60);
		duration -= hours * 1000 * 60 * 60;

		long minutes = duration / (1000 * 60);
		duration -= minutes * 1000 * 60;

		long seconds = duration / 1000;
		duration -= seconds * 1000;

		return String.format("%dh %dm %ds,%d", hours, minutes, seconds, duration);
	}

	public static String timeText(Date time) {
		return (new ISO8601DateFormat()).format(time);
	}

	/**
	 * Parses a catalog timestamp (UTC). Returns null for null, empty and zero dates ("0000-00-00 00:00:00") and for anything unparsable.
	 */
	public static Date parseCatalogTime(String value) {
		if (value == null || value.length() == 0 || value.startsWith("0000-00-00")) {
			return null;
		}

		String trimmed = value.trim();
		if (trimmed.length() == 10) {
			trimmed += " 00:00:00"; // date only
		} else if (trimmed.length() > 19) {
			trimmed = trimmed.substring(0, 19);
		}

		try {
			return catalogTimeFormat().parse(trimmed);
		} catch (ParseException e) {
			return null;
		}
	}

	public static String formatCatalogTime(Date time) {
		return catalogTimeFormat().format(time);
	}

	private static SimpleDateFormat catalogTimeFormat() {
		SimpleDateFormat format = new SimpleDateFormat(CATALOG_TIME_FORMAT);
		format.setTimeZone(TimeZone.getTimeZone("UTC"));
		format.setLenient(false);
		return format;
	}
}
