package com.universalgps.receiver;

import com.universalgps.decoder.EnvelopeClassifier;
import com.universalgps.decoder.TelemetryDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decodes a single GPS JSON message from a file instead of the broker.
 * Handy for checking what a captured message decodes to.
 * <p>
 * Exits 0 when the file was read and held valid JSON, whether or not it was a GPS v1
 * message, and 1 on a usage error, an unreadable file or a malformed message.
 */
public class SampleFileMain {

    private static final Logger LOG = LoggerFactory.getLogger(SampleFileMain.class);

    static final String UNABLE_TO_DECODE = "-> Unable to decode message";

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            LOG.error("Please specify the name of the json file to decode.");
            return 1;
        }

        Path file = Path.of(args[0]);
        byte[] payload;
        try {
            payload = Files.readAllBytes(file);
        } catch (IOException e) {
            LOG.error("Failed to read {}", file, e);
            return 1;
        }

        TelemetryMessageProcessor processor = new TelemetryMessageProcessor(
            new EnvelopeClassifier(),
            new TelemetryDecoder(),
            new ConsoleTelemetryPrinter(out));

        ProcessingOutcome outcome = processor.process(file.getFileName().toString(), payload);
        switch (outcome) {
            case PROCESSED:
                return 0;
            case IGNORED:
                // Valid JSON, just not a GPS v1 message
                out.println(UNABLE_TO_DECODE);
                return 0;
            default:
                LOG.error("Unable to decode message in {}: {}", file, outcome);
                out.println(UNABLE_TO_DECODE);
                return 1;
        }
    }
}
