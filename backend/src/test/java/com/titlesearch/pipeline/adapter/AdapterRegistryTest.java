package com.titlesearch.pipeline.adapter;

import com.titlesearch.pipeline.model.CountyConfig;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdapterRegistryTest {
    private final AdapterRegistry registry = new AdapterRegistry();
    private MockWebServer server;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
    }

    @Test
    void unknownSiteKeyFallsBackToGenericAdapter() {
        RecorderAdapter adapter = registry.recorderFor(county("landmark_web", "https://recorder.example.gov", null));

        assertThat(registry.registeredKeys()).containsExactly(AdapterRegistry.GENERIC);
        assertThat(adapter).isInstanceOf(GenericRecorderAdapter.class);
        assertThat(adapter.siteKey()).isEqualTo("landmark_web");
    }

    @Test
    void missingUrlsMakeSitesUnavailable() {
        CountyConfig county = county("generic", " ", null);

        assertThatThrownBy(() -> registry.recorderFor(county))
            .isInstanceOf(RecorderUnavailableException.class)
            .hasMessageContaining("Recorder website unavailable");
        assertThatThrownBy(() -> registry.courtFor(county))
            .isInstanceOf(RecorderUnavailableException.class)
            .hasMessageContaining("Court records website unavailable");
    }

    @Test
    void courtAdapterUsesCourtRecordsUrl() {
        RecorderAdapter adapter = registry.courtFor(county("generic", "https://r.example.gov", "https://courts.example.gov"));

        assertThat(adapter.siteKey()).isEqualTo(AdapterRegistry.COURT_RECORDS);
    }

    @Test
    void healthCheckTreatsServerErrorsAsDown() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(200));
        server.enqueue(new MockResponse().setResponseCode(503));
        server.start();
        RecorderAdapter adapter = registry.recorderFor(county("generic", server.url("/recorder").toString(), null));

        assertThat(adapter.checkHealth()).isTrue();
        assertThat(adapter.checkHealth()).isFalse();
    }

    private static CountyConfig county(String adapter, String recorderUrl, String courtUrl) {
        return new CountyConfig(1L, "Arapahoe", "CO", recorderUrl, courtUrl, adapter, 10, 2000, true, true, 0, null, null);
    }
}
