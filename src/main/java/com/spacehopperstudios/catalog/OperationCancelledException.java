//
//  OperationCancelledException.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog;

/**
 * Thrown out of a blocking wait when the caller requested cancellation.
 * 
 * @author billy1380
 */
public class OperationCancelledException extends Exception {

	private static final long serialVersionUID = 4172693356271180934L;

	public OperationCancelledException(String message) {
		super(message);
	}
}
