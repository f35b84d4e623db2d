//
//  DumpReadException.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.ingest;

/**
 * Carries a failure of the dump underneath a {@link DumpRecordIterator} out of the iterator.
 * 
 * @author billy1380
 */
public class DumpReadException extends RuntimeException {

	private static final long serialVersionUID = 3817472013491085513L;

	public DumpReadException(Throwable cause) {
		super(cause.getMessage(), cause);
	}
}
