//
//  DeltaFetchException.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.sync;

/**
 * A batch could not be fetched from the delta API (transport failure, bad status or a body that isn't the expected JSON).
 * 
 * @author billy1380
 */
public class DeltaFetchException extends Exception {

	private static final long serialVersionUID = -2203908174950187436L;

	public DeltaFetchException(String message) {
		super(message);
	}

	public DeltaFetchException(String message, Throwable cause) {
		super(message, cause);
	}
}
