package com.titlesearch.pipeline.persistence;

import com.titlesearch.pipeline.model.CountyConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CountyConfigRepositoryTest {

    @Autowired
    private CountyConfigRepository repository;

    @Test
    void insertIsIdempotentAndLookupIgnoresCase() {
        String name = "Test" + UUID.randomUUID().toString().substring(0, 6);

        assertThat(repository.insertIfMissing(name, null, "08999", "https://recorder.example", null, null, 10, 2000)).isTrue();
        assertThat(repository.insertIfMissing(name, "CO", "08999", "https://recorder.example", null, null, 10, 2000)).isFalse();

        CountyConfig county = repository.findByName(name.toUpperCase(), null);
        assertThat(county).isNotNull();
        assertThat(county.state()).isEqualTo("CO");
        assertThat(county.scrapingAdapter()).isEqualTo("generic");
        assertThat(county.healthy()).isTrue();
    }

    @Test
    void consecutiveFailuresMarkCountyUnhealthyAndSuccessResets() {
        String name = "Flaky" + UUID.randomUUID().toString().substring(0, 6);
        repository.insertIfMissing(name, "CO", null, "https://recorder.example", null, "generic", 10, 2000);
        long id = repository.findByName(name, "CO").id();

        for (int i = 0; i < 4; i++) {
            repository.recordScrapeFailure(id, 5);
        }
        assertThat(repository.findByName(name, "CO").healthy()).isTrue();
        repository.recordScrapeFailure(id, 5);
        CountyConfig failing = repository.findByName(name, "CO");
        assertThat(failing.healthy()).isFalse();
        assertThat(failing.consecutiveFailures()).isEqualTo(5);

        repository.recordScrapeSuccess(id);
        CountyConfig recovered = repository.findByName(name, "CO");
        assertThat(recovered.healthy()).isTrue();
        assertThat(recovered.consecutiveFailures()).isZero();
        assertThat(recovered.lastSuccessfulScrape()).isNotNull();
    }
}
