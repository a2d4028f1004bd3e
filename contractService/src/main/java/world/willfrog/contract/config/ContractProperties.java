package world.willfrog.contract.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "contract")
@Data
public class ContractProperties {

    /**
     * Optional contract JSON file loaded at startup.
     */
    private String specFile;
    private Enforcer enforcer = new Enforcer();
    private Temperature temperature = new Temperature();
    private Llm llm = new Llm();

    @Data
    public static class Enforcer {
        /**
         * Whether a response flagged as suspicious also counts as a health strike.
         */
        private boolean suspiciousCountsAsStrike = true;
        private boolean performanceWarningEnabled = true;
    }

    @Data
    public static class Temperature {
        private double step = 0.1D;
    }

    @Data
    public static class Llm {
        private String baseUrl;
        private String apiKey;
        private String modelName;
        private Integer maxTokens = 1024;
        private String systemPrompt = "You are a decision agent. Answer with a single JSON object only.";
    }
}
