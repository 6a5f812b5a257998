package com.nevis.xray.service;

import com.nevis.xray.model.ProgressEvent;
import com.nevis.xray.model.ProgressSignal;

/**
 * Called before each chunk is sent. Returning {@link ProgressSignal#ABORT} stops the
 * session at that chunk boundary.
 */
@FunctionalInterface
public interface AnalysisProgressListener {

    AnalysisProgressListener NONE = event -> ProgressSignal.CONTINUE;

    ProgressSignal onProgress(ProgressEvent event);
}
