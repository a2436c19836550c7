package com.williamcallahan.steam_analytics.service.source;

import com.williamcallahan.steam_analytics.types.SourceName;

import java.util.List;

/**
 * Capability set shared by every external source: fetch the raw payload for one entity,
 * parse it, and normalize it into source-local records.
 *
 * @param <P> parsed payload type (JSON tree, HTML document, ...)
 * @param <T> normalized record type
 */
public interface SourceClient<P, T> {

    SourceName source();

    /**
     * Fetches the raw payload for one entity through the session's governor.
     *
     * @throws SourceFetchException on transport or status failures
     */
    String fetchRaw(SourceSession session, long appId);

    /**
     * @throws PermanentSourceException when the payload cannot be parsed
     * @throws TransientSourceException when the payload is the source's throttling signal
     */
    P parse(long appId, String raw);

    /**
     * @throws PermanentSourceException when the entity does not exist or required fields are missing
     */
    List<T> normalize(long appId, P parsed);

    /**
     * One complete attempt for one entity, as run under the retry executor.
     */
    default List<T> fetchAndNormalize(SourceSession session, long appId) {
        String raw = fetchRaw(session, appId);
        return normalize(appId, parse(appId, raw));
    }
}
