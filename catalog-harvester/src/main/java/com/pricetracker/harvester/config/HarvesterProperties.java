package com.pricetracker.harvester.config;

import com.pricetracker.harvester.model.CategorySource;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "harvester")
@Data
public class HarvesterProperties {

    /** Category landing pages to harvest, one worker pipeline each. */
    private List<String> categories = new ArrayList<>();

    private int workers = 16;

    /** Products requested per API page. The catalog API rejects anything above 100. */
    private int pageSize = 100;

    /** Hard deadline for the fetch phase of one run; pending categories are cancelled. */
    private Duration runTimeout = Duration.ofMinutes(30);

    private Api api = new Api();
    private Session session = new Session();
    private Pacing pacing = new Pacing();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();

    public List<CategorySource> categorySources() {
        return categories.stream()
                .map(CategorySource::fromUrl)
                .toList();
    }

    public int effectivePageSize() {
        return Math.max(1, Math.min(pageSize, 100));
    }

    @Data
    public static class Api {
        private String baseUrl = "https://api.nike.com";
        private String discoveryPath = "/discover/product_wall/v1";
        private String marketplace = "IN";
        private String language = "en-GB";
        private String consumerChannelId = "d9a5bc42-4b9c-4976-858a-f159cf99c647";
        private String callerId = "nike:dotcom:browse:wall.client:2.0";
        private String origin = "https://www.nike.com";
    }

    @Data
    public static class Session {
        private Duration connectTimeout = Duration.ofSeconds(15);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private String acceptLanguage = "en-US,en;q=0.9";
        private List<String> userAgents = new ArrayList<>(List.of(
                "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/132.0.0.0 Safari/537.36"
        ));
    }

    @Data
    public static class Pacing {
        private Duration minDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(3);
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.DATABASE;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "data/snapshots";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            DATABASE, CSV, BOTH
        }
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 3 * * ?";
        private boolean runOnStartup = false;
    }
}
