//  
//  NonFictionBook.java
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
public class NonFictionBook extends Book {

	private String pages;
	private String topic;

	public NonFictionBook() {
		super(Family.NON_FICTION);
	}

	public String getPages() {
		return pages;
	}

	public void setPages(String pages) {
		this.pages = pages;
	}

	public String getTopic() {
		return topic;
	}

	public void setTopic(String topic) {
		this.topic = topic;
	}
}
