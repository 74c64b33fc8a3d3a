package com.titlesearch.pipeline.adapter;

import com.titlesearch.pipeline.model.CountyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Site key to adapter constructor. Unknown keys fall back to {@link GenericRecorderAdapter}.
 */
@Component
public class AdapterRegistry {
    private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);

    public static final String GENERIC = "generic";
    public static final String COURT_RECORDS = "court_records";

    private static final Map<String, Function<SiteConfig, RecorderAdapter>> CONSTRUCTORS = Map.of(
        GENERIC, GenericRecorderAdapter::new
    );

    public RecorderAdapter recorderFor(CountyConfig county) {
        if (county.recorderUrl() == null || county.recorderUrl().isBlank()) {
            throw new RecorderUnavailableException(
                "Recorder website unavailable: no recorder URL configured for " + county.countyName() + " County"
            );
        }
        SiteConfig site = new SiteConfig(
            county.scrapingAdapter(),
            county.countyName() + " County Recorder",
            county.recorderUrl(),
            county.delayBetweenRequestsMs()
        );
        return create(county.scrapingAdapter(), site);
    }

    public RecorderAdapter courtFor(CountyConfig county) {
        if (county.courtRecordsUrl() == null || county.courtRecordsUrl().isBlank()) {
            throw new RecorderUnavailableException(
                "Court records website unavailable: no court records URL configured for " + county.countyName() + " County"
            );
        }
        SiteConfig site = new SiteConfig(
            COURT_RECORDS,
            county.countyName() + " County Court Records",
            county.courtRecordsUrl(),
            county.delayBetweenRequestsMs()
        );
        return create(COURT_RECORDS, site);
    }

    public Set<String> registeredKeys() {
        return CONSTRUCTORS.keySet();
    }

    private RecorderAdapter create(String siteKey, SiteConfig site) {
        String key = siteKey == null ? GENERIC : siteKey.trim().toLowerCase(Locale.ROOT);
        Function<SiteConfig, RecorderAdapter> constructor = CONSTRUCTORS.get(key);
        if (constructor == null) {
            log.debug("No dedicated adapter for '{}', using generic adapter", key);
            constructor = CONSTRUCTORS.get(GENERIC);
        }
        return constructor.apply(site);
    }
}
