package com.trucksafe.elp.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trucksafe.elp.model.AggregateSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Representative figures shown while no real ELP data is available, shaped
 * after the enforcement trend seen since OOS criteria were restored in June
 * 2025. Only used when the output is configured to fall back to it.
 */
@Component
@RequiredArgsConstructor
public class SampleSnapshotLoader {

    static final String RESOURCE = "sample-snapshot.json";

    private static final DateTimeFormatter UPDATED_LABEL = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.US);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AggregateSnapshot load() {
        try (InputStream in = new ClassPathResource(RESOURCE).getInputStream()) {
            AggregateSnapshot sample = objectMapper.readValue(in, AggregateSnapshot.class);
            return sample.toBuilder()
                    .lastUpdated(LocalDate.now(clock).format(UPDATED_LABEL) + " (Representative Sample Data)")
                    .dataSource(AggregateSnapshot.SOURCE_SAMPLE)
                    .build();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read bundled " + RESOURCE, e);
        }
    }
}
