//
//  TimeHelperTest.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.Date;

import org.junit.jupiter.api.Test;

public class TimeHelperTest {

	@Test
	public void parsesCatalogTimesAsUtc() {
		Date time = TimeHelper.parseCatalogTime("2018-01-02 03:04:05");

		assertEquals(1514862245000L, time.getTime());
		assertEquals("2018-01-02 03:04:05", TimeHelper.formatCatalogTime(time));
	}

	@Test
	public void acceptsDatesAndFractions() {
		assertEquals(TimeHelper.parseCatalogTime("2018-01-02 00:00:00"), TimeHelper.parseCatalogTime("2018-01-02"));
		assertEquals(TimeHelper.parseCatalogTime("2018-01-02 03:04:05"), TimeHelper.parseCatalogTime("2018-01-02 03:04:05.123"));
	}

	@Test
	public void zeroAndGarbageAreNull() {
		assertNull(TimeHelper.parseCatalogTime(null));
		assertNull(TimeHelper.parseCatalogTime(""));
		assertNull(TimeHelper.parseCatalogTime("0000-00-00 00:00:00"));
		assertNull(TimeHelper.parseCatalogTime("yesterday"));
		assertNull(TimeHelper.parseCatalogTime("2018-13-45 00:00:00"));
	}
}
