//
//  CompletionProgress.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.progress;

/**
 * Last event of an operation, carrying its outcome
 */
public class CompletionProgress extends ProgressEvent {

	private final Enum<?> result;

	public CompletionProgress(Enum<?> result) {
		this.result = result;
	}

	public Enum<?> getResult() {
		return result;
	}

	@Override
	public String toString() {
		return String.format("Finished: %s", result);
	}
}
