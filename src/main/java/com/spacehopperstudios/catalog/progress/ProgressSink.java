//
//  ProgressSink.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.progress;

/**
 * Receives progress events on the worker thread running the operation; implementations must return quickly.
 * 
 * @author billy1380
 */
public interface ProgressSink {

	void report(ProgressEvent event);
}
