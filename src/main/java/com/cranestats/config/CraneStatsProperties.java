package com.cranestats.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application settings bound from the "crane" prefix.
 */
@Data
@ConfigurationProperties(prefix = "crane")
public class CraneStatsProperties {

    private Ingest ingest = new Ingest();
    private Tasks tasks = new Tasks();
    private Assignments assignments = new Assignments();
    private Prediction prediction = new Prediction();

    @Data
    public static class Ingest {
        /** Directory holding .log and .zip files. */
        private String logDirectory = "logs";
        /** One tag id per line, used to build the search patterns. */
        private String tagIdsFile = "TAG_SEARCH.txt";
        /** CSV with TAG and FV columns. */
        private String tagMappingFile = "TAG_CHANGE.csv";
        private String equipmentPrefix = "RMG";
        private int equipmentStart = 1;
        private int equipmentEnd = 12;
        private int equipmentDigits = 2;
        private String statisticPrefix = "CRANE.STATISTIC";
        private String statisticType = "Perma";
        /** Most recently modified files scanned per run. */
        private int maxFiles = 9999;
        /** Files parsed in parallel; 1 means sequential. */
        private int workers = 1;
        private boolean runOnStartup = false;
    }

    @Data
    public static class Tasks {
        private String configFile = "service_config.csv";
    }

    @Data
    public static class Assignments {
        /** Optional CSV of composite_entity_id,member_entity_id rows applied at startup. */
        private String seedFile;
    }

    @Data
    public static class Prediction {
        private DualThresholdPolicy dualThresholdPolicy = DualThresholdPolicy.EARLIEST;
    }

    /**
     * How a task carrying both a usage limit and a calendar interval is predicted.
     */
    public enum DualThresholdPolicy {
        /** Compute both and keep the earlier due date. */
        EARLIEST,
        /** Ignore the calendar interval. */
        USAGE_ONLY
    }
}
