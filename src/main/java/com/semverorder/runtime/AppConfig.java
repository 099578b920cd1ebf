package com.semverorder.runtime;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private OutputConfig output = new OutputConfig();
    private SelfCheckConfig selfCheck = new SelfCheckConfig();

    public OutputConfig getOutput() {
        return output;
    }

    public void setOutput(OutputConfig output) {
        this.output = output == null ? new OutputConfig() : output;
    }

    public SelfCheckConfig getSelfCheck() {
        return selfCheck;
    }

    public void setSelfCheck(SelfCheckConfig selfCheck) {
        this.selfCheck = selfCheck == null ? new SelfCheckConfig() : selfCheck;
    }

    public enum OutputFormat {
        text,
        json
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OutputConfig {
        private OutputFormat format = OutputFormat.text;

        public OutputFormat getFormat() {
            return format;
        }

        public void setFormat(OutputFormat format) {
            this.format = format == null ? OutputFormat.text : format;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SelfCheckConfig {
        static final List<List<String>> DEFAULT_PAIRS = List.of(
                List.of("1.0.0", "2.0.0"),
                List.of("1.0.0", "1.42.0"),
                List.of("1.2.0", "1.2.42"),
                List.of("1.1.0-alpha", "1.2.0-alpha.1"),
                List.of("1.0.1b", "1.0.10-alpha.beta"),
                List.of("1.0.0-rc.1", "1.0.0"));
        static final List<List<String>> DEFAULT_CHAINS = List.of(List.of(
                "1.0.0-alpha",
                "1.0.0-alpha.1",
                "1.0.0-alpha.beta",
                "1.0.0-beta",
                "1.0.0-beta.2",
                "1.0.0-beta.11",
                "1.0.0-rc.1",
                "1.0.0"));

        private List<List<String>> pairs = DEFAULT_PAIRS;
        private List<List<String>> chains = DEFAULT_CHAINS;

        public List<List<String>> getPairs() {
            return pairs;
        }

        public void setPairs(List<List<String>> pairs) {
            this.pairs = pairs == null ? DEFAULT_PAIRS : pairs;
        }

        public List<List<String>> getChains() {
            return chains;
        }

        public void setChains(List<List<String>> chains) {
            this.chains = chains == null ? DEFAULT_CHAINS : chains;
        }
    }
}
