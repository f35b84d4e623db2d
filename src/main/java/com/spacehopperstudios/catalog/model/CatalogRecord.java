//  
//  CatalogRecord.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.model;

/**
 * Fields shared by every catalog record regardless of its family.
 * 
 * The local id is assigned by storage when the record is first written and stays 0 until then. The remote id is the upstream catalog's id and the key used
 * for deduplication.
 * 
 * @author billy1380
 */
public abstract class CatalogRecord {

	private final Family family;

	private long id;
	private int remoteId;
	private Integer fileId;
	private String language;
	private String format;

	protected CatalogRecord(Family family) {
		this.family = family;
	}

	public Family getFamily() {
		return family;
	}

	public long getId() {
		return id;
	}

	public void setId(long id) {
		this.id = id;
	}

	public int getRemoteId() {
		return remoteId;
	}

	public void setRemoteId(int remoteId) {
		this.remoteId = remoteId;
	}

	public Integer getFileId() {
		return fileId;
	}

	public void setFileId(Integer fileId) {
		this.fileId = fileId;
	}

	public String getLanguage() {
		return language;
	}

	public void setLanguage(String language) {
		this.language = language;
	}

	public String getFormat() {
		return format;
	}

	public void setFormat(String format) {
		this.format = format;
	}

	@Override
	public String toString() {
		return String.format("%s[id=%d, remoteId=%d]", getClass().getSimpleName(), id, remoteId);
	}
}
