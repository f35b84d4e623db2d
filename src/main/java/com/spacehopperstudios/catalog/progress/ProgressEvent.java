//
//  ProgressEvent.java
//  catalogimporter
//
//  Created by William Shakour (billy1380) on 19 Oct 2026.
//  Copyright © 2026 SPACEHOPPER STUDIOS LTD. All rights reserved.
//
package com.spacehopperstudios.catalog.progress;

/**
 * Base of everything an import or synchronization reports while it runs.
 * 
 * @author billy1380
 */
public abstract class ProgressEvent {
}
