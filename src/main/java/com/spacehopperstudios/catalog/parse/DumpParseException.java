//
//  DumpParseException.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.parse;

/**
 * A single dump line could not be understood. The parser logs these and moves on to the next line.
 * 
 * @author billy1380
 */
public class DumpParseException extends Exception {

	private static final long serialVersionUID = -2381934176460917711L;

	private final long lineNumber;

	public DumpParseException(long lineNumber, String message) {
		super(String.format("Line %d: %s", lineNumber, message));
		this.lineNumber = lineNumber;
	}

	public long getLineNumber() {
		return lineNumber;
	}
}
