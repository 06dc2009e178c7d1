package com.shiv.pdfredact.service.ocr;

import com.shiv.pdfredact.config.RedactionProperties;
import com.shiv.pdfredact.exception.OcrEngineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class TesseractOrientationDetector implements OrientationDetector {

    private static final Pattern ROTATE = Pattern.compile("^\\s*Rotate:\\s*(\\d+)\\s*$");
    private static final long TIMEOUT_SECONDS = 120;

    private final RedactionProperties properties;

    @Override
    public int detectRotation(BufferedImage page) throws OcrEngineException {
        Path png = null;
        try {
            png = Files.createTempFile("osd-", ".png");
            if (!ImageIO.write(page, "png", png.toFile())) {
                throw new OcrEngineException("No PNG writer available for page image");
            }
            List<String> cmd = Arrays.asList(properties.getRotation().getTesseractCommand(),
                    png.toString(), "stdout", "--psm", "0");
            ProcessRunner.Result result = ProcessRunner.run(cmd, TIMEOUT_SECONDS, line -> { });
            if (result.getExitCode() != 0) {
                throw new OcrEngineException("tesseract OSD exited with " + result.getExitCode() + ": " + result.tail(3));
            }
            return parseRotation(result.getOutput());
        } catch (IOException e) {
            throw new OcrEngineException("Could not write page image for OSD: " + e.getMessage(), e);
        } finally {
            if (png != null) {
                try {
                    Files.deleteIfExists(png);
                } catch (IOException e) {
                    log.warn("Could not remove OSD temp file {}: {}", png, e.getMessage());
                }
            }
        }
    }

    static int parseRotation(List<String> output) throws OcrEngineException {
        for (String line : output) {
            Matcher m = ROTATE.matcher(line);
            if (m.matches()) {
                int angle = Integer.parseInt(m.group(1));
                if (angle % 90 != 0) {
                    throw new OcrEngineException("Unexpected OSD rotation: " + angle);
                }
                return angle % 360;
            }
        }
        throw new OcrEngineException("OSD output has no rotation line");
    }
}
