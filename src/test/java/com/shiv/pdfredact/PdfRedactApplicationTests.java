package com.shiv.pdfredact;

import com.shiv.pdfredact.config.RedactionProperties;
import com.shiv.pdfredact.service.RedactionJobService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "app.redact.ocr.language=eng",
        "app.redact.ocr.min-char-gain=120",
        "app.redact.jobs.parallelism=2"
})
class PdfRedactApplicationTests {

    @Autowired
    private RedactionProperties properties;

    @Autowired
    private RedactionJobService jobService;

    @Test
    @DisplayName("context wires the job service and binds app.redact properties")
    void contextLoads() {
        assertThat(jobService).isNotNull();
        assertThat(properties.getOcr().getLanguage()).isEqualTo("eng");
        assertThat(properties.getOcr().getMinCharGain()).isEqualTo(120);
        assertThat(properties.getOcr().isRequireHitGain()).isTrue();
        assertThat(properties.getRotation().getDpi()).isEqualTo(300);
    }
}
