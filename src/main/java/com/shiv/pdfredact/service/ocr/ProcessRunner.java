package com.shiv.pdfredact.service.ocr;

import com.shiv.pdfredact.exception.OcrEngineException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs an external engine, handing each output line (stdout and stderr merged) to a listener on
 * the calling thread. If the listener throws, the process is killed and the exception propagates.
 */
@Slf4j
final class ProcessRunner {
    private ProcessRunner() {}

    @Value
    static class Result {
        int exitCode;
        List<String> output;

        String tail(int lines) {
            return String.join("\n", output.subList(Math.max(0, output.size() - lines), output.size()));
        }
    }

    static Result run(List<String> command, long timeoutSeconds, Consumer<String> lineListener) throws OcrEngineException {
        log.debug("Executing: {}", String.join(" ", command));
        Process process = start(command);

        AtomicBoolean timedOut = new AtomicBoolean();
        Thread watchdog = new Thread(() -> {
            try {
                if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                    timedOut.set(true);
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, command.get(0) + "-watchdog");
        watchdog.setDaemon(true);
        watchdog.start();

        List<String> output = new ArrayList<>();
        boolean finished = false;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.add(line);
                lineListener.accept(line);
            }
            process.waitFor();
            finished = true;
        } catch (IOException e) {
            throw new OcrEngineException("Failed reading output of " + command.get(0), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OcrEngineException("Interrupted while waiting for " + command.get(0), e);
        } finally {
            if (!finished) {
                process.destroyForcibly();
            }
            watchdog.interrupt();
        }
        if (timedOut.get()) {
            throw new OcrEngineException(command.get(0) + " did not finish within " + timeoutSeconds + "s");
        }
        return new Result(process.exitValue(), output);
    }

    private static Process start(List<String> command) throws OcrEngineException {
        try {
            return new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new OcrEngineException("Could not start " + command.get(0) + ": " + e.getMessage(), e);
        }
    }
}
