//  
//  Family.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.model;

/**
 * The three record families held in the catalog.
 * 
 * @author billy1380
 */
public enum Family {
	NON_FICTION("nonfiction"), FICTION("fiction"), SCI_MAG("scimag");

	private final String code;

	private Family(String code) {
		this.code = code;
	}

	/**
	 * Short name used on the command line and in configuration keys
	 */
	public String getCode() {
		return code;
	}

	/**
	 * Returns the family with the given code (case-insensitive), or null if there is none
	 */
	public static Family fromCode(String code) {
		if (code != null) {
			for (Family family : values()) {
				if (family.code.equalsIgnoreCase(code) || family.name().equalsIgnoreCase(code)) {
					return family;
				}
			}
		}

		return null;
	}
}
