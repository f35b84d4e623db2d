//
//  WatermarkCursorTest.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Date;

import org.junit.jupiter.api.Test;

public class WatermarkCursorTest {

	@Test
	public void ordersByTimestampThenRemoteId() {
		WatermarkCursor early = new WatermarkCursor(new Date(1000), 50);
		WatermarkCursor sameTimeHigherId = new WatermarkCursor(new Date(1000), 60);
		WatermarkCursor late = new WatermarkCursor(new Date(2000), 1);

		assertTrue(sameTimeHigherId.isAfter(early));
		assertTrue(late.isAfter(sameTimeHigherId));
		assertFalse(early.isAfter(early));
		assertEquals(early, new WatermarkCursor(new Date(1000), 50));
	}

	@Test
	public void maxNeverGoesBack() {
		WatermarkCursor early = new WatermarkCursor(new Date(1000), 50);
		WatermarkCursor late = new WatermarkCursor(new Date(2000), 1);

		assertSame(late, WatermarkCursor.max(early, late));
		assertSame(late, WatermarkCursor.max(late, early));
		assertSame(early, WatermarkCursor.max(null, early));
	}

	@Test
	public void missingTimestampIsTheStart() {
		assertEquals(WatermarkCursor.START, new WatermarkCursor(null, 0));
		assertTrue(new WatermarkCursor(null, 1).isAfter(WatermarkCursor.START));
	}
}
