package com.healthtech.glucose.source;

import com.healthtech.glucose.domain.DailyWindow;
import com.healthtech.glucose.domain.RawSample;

import java.util.List;

/**
 * Remote source of raw glucose readings.
 */
public interface ReadingSource {

    /**
     * Fetches all readings with timestamps in [window.start, window.end).
     *
     * @param window Day window to fetch
     * @return Readings in the window, empty if there are none
     * @throws ReadingSourceException on network failure, timeout or a non-success response
     */
    List<RawSample> fetch(DailyWindow window);
}
