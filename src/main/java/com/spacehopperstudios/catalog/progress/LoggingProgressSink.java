//
//  LoggingProgressSink.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.progress;

import org.apache.log4j.Logger;

/**
 * Writes every event to the log, search progress only in debug.
 * 
 * @author billy1380
 */
public class LoggingProgressSink implements ProgressSink {

	private static final Logger LOGGER = Logger.getLogger(LoggingProgressSink.class);

	@Override
	public void report(ProgressEvent event) {
		if (event instanceof SearchTableDefinitionProgress) {
			if (LOGGER.isDebugEnabled()) {
				LOGGER.debug(event.toString());
			}
		} else if (event instanceof WrongTableDefinitionProgress) {
			LOGGER.warn(event.toString());
		} else if (LOGGER.isInfoEnabled()) {
			LOGGER.info(event.toString());
		}
	}
}
