//
//  CancellationToken.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog;

/**
 * Cooperative cancellation flag shared between the caller and a running import. Long running loops poll it; nothing is interrupted.
 * 
 * @author billy1380
 */
public class CancellationToken {

	public static final CancellationToken NONE = new CancellationToken() {
		@Override
		public void cancel() {
			throw new UnsupportedOperationException("NONE cannot be cancelled");
		}
	};

	private volatile boolean cancellationRequested;

	public void cancel() {
		cancellationRequested = true;
	}

	public boolean isCancellationRequested() {
		return cancellationRequested;
	}
}
