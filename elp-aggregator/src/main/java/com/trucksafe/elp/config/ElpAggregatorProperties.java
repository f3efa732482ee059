package com.trucksafe.elp.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "elp-aggregator")
@Data
public class ElpAggregatorProperties {

    private Source source = new Source();
    private Analysis analysis = new Analysis();
    private Classification classification = new Classification();
    private Statistics statistics = new Statistics();
    private Output output = new Output();

    /** Run the pipeline once when the application context is ready. */
    private boolean runOnStartup = true;

    @Data
    public static class Source {
        private SourceMode mode = SourceMode.CSV;
        private Csv csv = new Csv();
        private Api api = new Api();

        @Data
        public static class Csv {
            private String violationsFile = "violations.csv";
            private String inspectionsFile = "inspections.csv";
            /** Inspection rows handed to the join engine per batch. */
            private int batchSize = 50_000;
        }

        @Data
        public static class Api {
            private String baseUrl = "https://data.transportation.gov";
            private String violationsDataset = "876r-jsdb";
            private String inspectionsDataset = "fx4q-ay7w";
            private String violationsWhere = "part_no='391'";
            private String inspectionsWhere = "";
            private String appToken = "";
            private int pageSize = 50_000;
            private int maxViolationPages = 5;
            private int maxInspectionPages = 200;
            private long rateLimitDelayMs = 1000;
            private int connectTimeoutSeconds = 30;
            private int readTimeoutSeconds = 120;
        }

        public enum SourceMode {
            CSV, API
        }
    }

    @Data
    public static class Analysis {
        /** Records dated before 1 January of this year are left out. */
        private int startYear = 2025;
        private DuplicatePolicy duplicatePolicy = DuplicatePolicy.LAST_SEEN;
        private MonthSource monthSource = MonthSource.VIOLATION;

        public enum DuplicatePolicy {
            FIRST_SEEN, LAST_SEEN, KEEP_ALL
        }

        public enum MonthSource {
            VIOLATION, INSPECTION
        }
    }

    @Data
    public static class Classification {
        private String part = "391";
        private String section = "11B2";
        private boolean matchDescriptionKeywords = false;
    }

    @Data
    public static class Statistics {
        private int topRegions = 10;
        private int moverLimit = 3;
        private int moverMinPrevious = 5;
    }

    @Data
    public static class Output {
        private String path = "elp_data.json";
        /** Append one CSV line per run here; blank disables the run log. */
        private String runLogPath = "";
        private boolean fallbackToSample = false;
    }
}
