package com.universalgps.receiver;

import com.universalgps.decoder.model.TelemetryRecord;

/**
 * Consumer of decoded GPS messages.
 * <p>
 * A handler that throws leaves the message unacknowledged, so it is delivered again.
 */
@FunctionalInterface
public interface TelemetryRecordHandler {

    void handle(TelemetryRecord record);
}
