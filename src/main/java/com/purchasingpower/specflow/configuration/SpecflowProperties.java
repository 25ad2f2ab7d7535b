package com.purchasingpower.specflow.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the status rewriter and the MoAI SPEC helpers.
 *
 * <p>Loaded from the {@code specflow} namespace in application.yml:
 * <pre>
 * specflow:
 *   status:
 *     warn-legacy-ids: true
 *     scratch-change-id: temp
 *   moai:
 *     spec-id-pattern: "^SPEC-[A-Z]+-\\d+$"
 *     description-max-length: 150
 *     default-status: active
 * </pre>
 *
 * @since 1.0.0
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "specflow")
public class SpecflowProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private StatusProperties status = new StatusProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private MoaiProperties moai = new MoaiProperties();

    @Data
    public static class StatusProperties {

        /**
         * Log a deprecation warning when a phase-task or group-task id is used.
         */
        private boolean warnLegacyIds = true;

        /**
         * Change id used for the throwaway parse behind each status update.
         */
        @NotBlank
        private String scratchChangeId = "temp";
    }

    @Data
    public static class MoaiProperties {

        /**
         * Change ids matching this pattern are MoAI SPEC ids.
         */
        @NotBlank
        private String specIdPattern = "^SPEC-[A-Z]+-\\d+$";

        /**
         * Maximum length of the description extracted from spec.md.
         */
        @Min(1)
        private int descriptionMaxLength = 150;

        /**
         * Status reported when spec.md has no {@code status} frontmatter key.
         */
        @NotBlank
        private String defaultStatus = "active";
    }
}
