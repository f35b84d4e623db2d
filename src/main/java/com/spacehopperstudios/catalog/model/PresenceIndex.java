//  
//  PresenceIndex.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.model;

import java.util.BitSet;

import org.apache.log4j.Logger;

/**
 * Bit per remote id answering whether a record is already stored locally.
 * 
 * The index is sized from the largest remote id found in storage. Ids past that bound read as absent and, when added, grow the bound rather than fail.
 * 
 * @author billy1380
 */
public class PresenceIndex {

	private static final Logger LOGGER = Logger.getLogger(PresenceIndex.class);

	/**
	 * One past the largest id an int can hold
	 */
	static final long MAX_SIZE = (long) Integer.MAX_VALUE + 1;

	private final BitSet bits;
	private long size;

	public PresenceIndex(long size) {
		if (size < 0) throw new IllegalArgumentException("size cannot be negative");
		if (size > MAX_SIZE) throw new IllegalArgumentException(String.format("size cannot be more than %d", MAX_SIZE));

		this.bits = new BitSet((int) Math.min(size, Integer.MAX_VALUE));
		this.size = size;
	}

	/**
	 * Builds an index sized to hold maxRemoteId and containing all of remoteIds
	 */
	public static PresenceIndex build(int maxRemoteId, Iterable<Integer> remoteIds) {
		PresenceIndex index = new PresenceIndex((long) maxRemoteId + 1);

		for (Integer remoteId : remoteIds) {
			index.add(remoteId.intValue());
		}

		return index;
	}

	public boolean contains(int remoteId) {
		return remoteId >= 0 && remoteId < size && bits.get(remoteId);
	}

	public void add(int remoteId) {
		if (remoteId < 0) throw new IllegalArgumentException(String.format("Remote id %d cannot be negative", remoteId));

		if (remoteId >= size) {
			if (LOGGER.isDebugEnabled()) {
				LOGGER.debug(String.format("Remote id %d is past the index bound %d, growing", remoteId, size));
			}

			size = grownSize(size, remoteId);
		}

		bits.set(remoteId);
	}

	/**
	 * The current bound; every id below it has a definite answer
	 */
	public long size() {
		return size;
	}

	/**
	 * Bound after adding remoteId to an index bounded by size, clamped to {@link #MAX_SIZE}
	 */
	static long grownSize(long size, int remoteId) {
		return Math.min(MAX_SIZE, Math.max((long) remoteId + 1, size + size / 2));
	}

	public int cardinality() {
		return bits.cardinality();
	}
}
