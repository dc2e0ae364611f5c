package com.opstranslate.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.opstranslate.core.merge.FirstSeenPolicy;
import com.opstranslate.core.report.OutputFormat;

/**
 * Root configuration for ops-translate runs.
 *
 * <p>Loaded from {@code ops-translate.yaml} in the working directory. Any section may be
 * omitted; missing values fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * translation:
 *   rules: "./mappings/site-rules.yaml"
 *   profile: "./profile.yml"
 *   parallelism: 4
 *
 * merge:
 *   firstSeen: SOURCE_NAME
 *
 * output:
 *   directory: "./output"
 *   format: yaml
 * }</pre>
 *
 * @param translation rule table, profile and worker settings
 * @param merge merge settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranslatorConfig(
    @JsonProperty("translation") TranslationSettings translation,
    @JsonProperty("merge") MergeSettings merge,
    @JsonProperty("output") OutputSettings output
) {
    public static final int DEFAULT_PARALLELISM = 4;

    /**
     * Compact constructor filling omitted sections with defaults.
     */
    public TranslatorConfig {
        translation = translation != null ? translation : TranslationSettings.defaults();
        merge = merge != null ? merge : MergeSettings.defaults();
        output = output != null ? output : OutputSettings.defaults();
    }

    /**
     * Creates the default configuration: built-in rule table, {@code profile.yml},
     * four workers, source-name ordering, YAML output to {@code ./output}.
     *
     * @return default configuration
     */
    public static TranslatorConfig defaults() {
        return new TranslatorConfig(null, null, null);
    }

    /**
     * Translation settings.
     *
     * @param rules external rule table path, or null for the built-in table
     * @param profile profile path
     * @param parallelism number of worker threads
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TranslationSettings(
        @JsonProperty("rules") String rules,
        @JsonProperty("profile") String profile,
        @JsonProperty("parallelism") Integer parallelism
    ) {
        public TranslationSettings {
            profile = profile != null ? profile : "profile.yml";
            parallelism = parallelism != null && parallelism > 0 ? parallelism : DEFAULT_PARALLELISM;
        }

        public static TranslationSettings defaults() {
            return new TranslationSettings(null, null, null);
        }
    }

    /**
     * Merge settings.
     *
     * @param firstSeen which source counts as first for conflicting input definitions
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MergeSettings(
        @JsonProperty("firstSeen") FirstSeenPolicy firstSeen
    ) {
        public MergeSettings {
            firstSeen = firstSeen != null ? firstSeen : FirstSeenPolicy.SOURCE_NAME;
        }

        public static MergeSettings defaults() {
            return new MergeSettings(null);
        }
    }

    /**
     * Output settings.
     *
     * @param directory output directory
     * @param format intent and report format ("yaml" or "json")
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("directory") String directory,
        @JsonProperty("format") String format
    ) {
        public OutputSettings {
            directory = directory != null ? directory : "./output";
            format = format != null ? format : OutputFormat.YAML.extension();
        }

        public static OutputSettings defaults() {
            return new OutputSettings(null, null);
        }

        public OutputFormat outputFormat() {
            return OutputFormat.fromString(format);
        }
    }
}
