package com.healthtech.glucose.source;

import com.healthtech.glucose.config.GlucoseProperties;
import com.healthtech.glucose.domain.DailyWindow;
import com.healthtech.glucose.domain.RawSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads glucose entries from a Nightscout server.
 *
 * Nightscout returns entries newest first and caps each response at {@code count}.
 * When a page comes back full, the next request is bounded above, inclusively, by the oldest
 * timestamp seen so far, so entries sharing that timestamp across the page boundary are not
 * lost; repeats are dropped by document id. Paging stops on a short page, a page that adds
 * nothing new, or the page limit. A full page made entirely of one timestamp can still hide
 * further entries with that same timestamp.
 *
 * Only sensor glucose entries inside the requested window are returned.
 */
@Component
public class NightscoutReadingSource implements ReadingSource {

    private static final Logger log = LoggerFactory.getLogger(NightscoutReadingSource.class);

    static final String ENTRIES_PATH = "/api/v1/entries.json";

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final int pageSize;
    private final int maxPages;

    public NightscoutReadingSource(RestTemplate nightscoutRestTemplate, GlucoseProperties properties) {
        this(nightscoutRestTemplate,
             properties.getSource().getBaseUrl(),
             properties.getSource().getPageSize(),
             properties.getSource().getMaxPages());
    }

    NightscoutReadingSource(RestTemplate restTemplate, String baseUrl, int pageSize, int maxPages) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be positive, got " + pageSize);
        }
        if (maxPages < 1) {
            throw new IllegalArgumentException("Max pages must be positive, got " + maxPages);
        }
        this.restTemplate = restTemplate;
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.pageSize = pageSize;
        this.maxPages = maxPages;
        log.info("Nightscout reading source: url={}, pageSize={}, maxPages={}", this.baseUrl, pageSize, maxPages);
    }

    @Override
    public List<RawSample> fetch(DailyWindow window) {
        long lowerBound = window.startMillis();
        URI uri = entriesUri(lowerBound, window.endMillis(), false);
        List<RawSample> samples = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int skipped = 0;

        for (int page = 1; page <= maxPages; page++) {
            NightscoutEntry[] entries = fetchPage(window, uri);
            if (entries == null || entries.length == 0) {
                break;
            }

            Long oldest = null;
            int added = 0;
            for (NightscoutEntry entry : entries) {
                if (entry == null) {
                    continue;
                }
                if (entry.date() != null && (oldest == null || entry.date() < oldest)) {
                    oldest = entry.date();
                }
                if (!seen.add(entry.pagingKey())) {
                    continue;
                }
                added++;
                if (!entry.isSensorReading() || (entry.date() != null && !window.contains(entry.date()))) {
                    skipped++;
                    continue;
                }
                samples.add(entry.toSample());
            }

            if (entries.length < pageSize || added == 0 || oldest == null || oldest <= lowerBound) {
                break;
            }
            if (page == maxPages) {
                log.warn("Reached page limit ({}) for {}; readings older than {} were not fetched",
                         maxPages, window.date(), oldest);
                break;
            }
            uri = entriesUri(lowerBound, oldest, true);
        }

        if (log.isDebugEnabled()) {
            log.debug("Fetched {} entries for {} [{}, {}), skipped {} non-sensor or out-of-window entries",
                      samples.size(), window.date(), window.startMillis(), window.endMillis(), skipped);
        }
        return samples;
    }

    private NightscoutEntry[] fetchPage(DailyWindow window, URI uri) {
        try {
            return restTemplate.getForObject(uri, NightscoutEntry[].class);
        } catch (RestClientException e) {
            throw new ReadingSourceException(
                String.format("Nightscout request for %s failed: %s", window.date(), e.getMessage()), e);
        }
    }

    /**
     * The first page excludes the window end; later pages include the oldest timestamp seen.
     */
    URI entriesUri(long lowerBound, long upperBound, boolean upperInclusive) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
            .path(ENTRIES_PATH)
            .queryParam("find[date][$gte]", lowerBound)
            .queryParam(upperInclusive ? "find[date][$lte]" : "find[date][$lt]", upperBound)
            .queryParam("count", pageSize)
            .encode()
            .build()
            .toUri();
    }

    /**
     * Accepts "host", "host:port" or a full http(s) URL. Plain hosts default to http.
     */
    static String normalizeBaseUrl(String urlOrHost) {
        Objects.requireNonNull(urlOrHost, "Nightscout base URL cannot be null");
        String trimmed = urlOrHost.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Nightscout base URL cannot be blank");
        }
        String url = (trimmed.startsWith("http://") || trimmed.startsWith("https://"))
            ? trimmed
            : "http://" + trimmed;
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }
}
