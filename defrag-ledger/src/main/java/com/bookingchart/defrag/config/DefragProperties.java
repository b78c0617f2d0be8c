package com.bookingchart.defrag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "defrag")
@Data
public class DefragProperties {

    private Holidays holidays = new Holidays();
    private Ledger ledger = new Ledger();
    private Export export = new Export();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Holidays {
        private String baseUrl = "https://date.nager.at/api/v3";
        private String countryCode = "AU";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);
        /** Spring resource location of the school holiday calendar document. */
        private String schoolCalendar = "classpath:school_holidays.json";
        private int forwardWindowDays = 60;
        /** Largest window a holiday lookup may span; every year it touches is fetched and cached. */
        private int maxWindowDays = 730;
    }

    @Data
    public static class Ledger {
        /** Upper bound for a single unit of work, including time spent waiting on row locks. */
        private Duration unitTimeout = Duration.ofSeconds(10);
        private int defaultQueryLimit = 100;
    }

    @Data
    public static class Export {
        private String outputDir = "/data/output";
        private boolean includeHeader = true;
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 3 * * ?";
        private boolean warmOnStartup = false;
    }
}
