//  
//  WatermarkCursor.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.model;

import java.util.Date;

import com.spacehopperstudios.catalog.TimeHelper;

/**
 * High-water mark of a synchronization: the timestamp and remote id of the most recently absorbed record. Cursors are ordered by timestamp first and remote
 * id second. Instances are immutable.
 * 
 * @author billy1380
 */
public final class WatermarkCursor implements Comparable<WatermarkCursor> {

	public static final WatermarkCursor START = new WatermarkCursor(new Date(0), 0);

	private final Date timestamp;
	private final int remoteId;

	public WatermarkCursor(Date timestamp, int remoteId) {
		this.timestamp = new Date(timestamp == null ? 0 : timestamp.getTime());
		this.remoteId = remoteId;
	}

	public Date getTimestamp() {
		return new Date(timestamp.getTime());
	}

	public int getRemoteId() {
		return remoteId;
	}

	@Override
	public int compareTo(WatermarkCursor other) {
		int result = timestamp.compareTo(other.timestamp);

		if (result == 0) {
			result = Integer.compare(remoteId, other.remoteId);
		}

		return result;
	}

	public boolean isAfter(WatermarkCursor other) {
		return compareTo(other) > 0;
	}

	/**
	 * Returns whichever of the two cursors is further along; used so that a cursor never moves backwards
	 */
	public static WatermarkCursor max(WatermarkCursor a, WatermarkCursor b) {
		if (a == null) {
			return b;
		}

		if (b == null) {
			return a;
		}

		return a.compareTo(b) >= 0 ? a : b;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}

		if (!(obj instanceof WatermarkCursor)) {
			return false;
		}

		WatermarkCursor other = (WatermarkCursor) obj;
		return remoteId == other.remoteId && timestamp.equals(other.timestamp);
	}

	@Override
	public int hashCode() {
		return 31 * timestamp.hashCode() + remoteId;
	}

	@Override
	public String toString() {
		return String.format("(%s, %d)", TimeHelper.timeText(timestamp), remoteId);
	}
}
