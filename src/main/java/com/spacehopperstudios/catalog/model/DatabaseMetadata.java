//  
//  DatabaseMetadata.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Bookkeeping stored alongside the catalog tables.
 * 
 * @author billy1380
 */
public class DatabaseMetadata {

	private String appName;
	private String version;
	private final Set<Family> firstImportComplete = EnumSet.noneOf(Family.class);

	public String getAppName() {
		return appName;
	}

	public void setAppName(String appName) {
		this.appName = appName;
	}

	public String getVersion() {
		return version;
	}

	public void setVersion(String version) {
		this.version = version;
	}

	public boolean isFirstImportComplete(Family family) {
		return firstImportComplete.contains(family);
	}

	public void setFirstImportComplete(Family family, boolean complete) {
		if (complete) {
			firstImportComplete.add(family);
		} else {
			firstImportComplete.remove(family);
		}
	}
}
