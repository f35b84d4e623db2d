//
//  DumpCorruptedException.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.parse;

/**
 * The dump ended in the middle of a table definition or an insert statement.
 * 
 * @author billy1380
 */
public class DumpCorruptedException extends Exception {

	private static final long serialVersionUID = 6651384957206520364L;

	public DumpCorruptedException(String message) {
		super(message);
	}
}
