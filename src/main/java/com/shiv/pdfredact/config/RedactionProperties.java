package com.shiv.pdfredact.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "app.redact")
public class RedactionProperties {

    /**
     * Directory holding uploads and redacted output, one sub-directory per run.
     */
    @NotBlank
    private String workDir = System.getProperty("java.io.tmpdir") + "/pdf-redact";

    @Valid
    private Ocr ocr = new Ocr();

    @Valid
    private Rotation rotation = new Rotation();

    @Valid
    private Jobs jobs = new Jobs();

    @Data
    public static class Ocr {

        /**
         * When false the pipeline keeps the rotation-corrected document as is.
         */
        private boolean enabled = true;

        @NotBlank
        private String command = "ocrmypdf";

        /**
         * Tesseract language(s), e.g. "eng" or "chi_tra+eng".
         */
        @NotBlank
        private String language = "chi_tra+eng";

        @Min(0)
        private int optimize = 0;

        @Min(1)
        private long timeoutSeconds = 1800;

        /**
         * OCR output is kept only if it adds at least this many characters of text.
         */
        @Min(0)
        private int minCharGain = 80;

        /**
         * OCR output is kept only if it finds strictly more literal occurrences.
         */
        private boolean requireHitGain = true;
    }

    @Data
    public static class Rotation {

        private boolean enabled = true;

        @Min(36)
        private int dpi = 300;

        /**
         * Pages whose mean luminance ratio exceeds this are treated as blank.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double blankThreshold = 0.98;

        @NotBlank
        private String tesseractCommand = "tesseract";
    }

    @Data
    public static class Jobs {

        /**
         * Worker threads for redaction runs; 0 means one per available processor.
         */
        @Min(0)
        private int parallelism = 0;

        /**
         * How long a finished run, with its upload and output, is kept before it is evicted.
         */
        @NotNull
        private Duration retention = Duration.ofHours(1);

        @NotNull
        private Duration sweepInterval = Duration.ofMinutes(5);
    }
}
