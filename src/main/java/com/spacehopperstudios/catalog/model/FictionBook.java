//  
//  FictionBook.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.model;

/**
 * @author billy1380
 * 
 */
public class FictionBook extends Book {

	private String edition;

	public FictionBook() {
		super(Family.FICTION);
	}

	public String getEdition() {
		return edition;
	}

	public void setEdition(String edition) {
		this.edition = edition;
	}
}
