package com.trucksafe.elp.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trucksafe.elp.model.AggregateSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class SampleSnapshotLoaderTest {

    private final SampleSnapshotLoader loader = new SampleSnapshotLoader(
            new ObjectMapper(),
            Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));

    @Test
    @DisplayName("bundled sample is labelled as sample data with today's date")
    void labelled() {
        AggregateSnapshot sample = loader.load();

        assertThat(sample.getDataSource()).isEqualTo(AggregateSnapshot.SOURCE_SAMPLE);
        assertThat(sample.getLastUpdated()).isEqualTo("March 01, 2026 (Representative Sample Data)");
    }

    @Test
    @DisplayName("bundled sample is internally consistent")
    void consistent() {
        AggregateSnapshot sample = loader.load();

        assertThat(sample.getTotalOos()).isLessThanOrEqualTo(sample.getTotalAll());
        assertThat(sample.getMonthly().labels()).hasSameSizeAs(sample.getMonthly().oos());
        assertThat(sample.getMonthly().oos()).contains(sample.getPeakCount());
        assertThat(sample.getStates()).isNotEmpty();
        assertThat(sample.getStateMonthly()).isNull();
    }
}
