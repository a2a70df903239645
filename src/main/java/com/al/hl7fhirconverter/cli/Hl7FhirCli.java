package com.al.hl7fhirconverter.cli;

import ch.qos.logback.classic.Level;
import ca.uhn.fhir.context.FhirContext;
import com.al.hl7fhirconverter.config.ParsingConfiguration;
import com.al.hl7fhirconverter.config.PerformanceConfig;
import com.al.hl7fhirconverter.dto.ConversionError;
import com.al.hl7fhirconverter.exception.Hl7ConversionException;
import com.al.hl7fhirconverter.model.ir.ParsedMessage;
import com.al.hl7fhirconverter.parser.Hl7MessageDecoder;
import com.al.hl7fhirconverter.parser.SegmentTokenizer;
import com.al.hl7fhirconverter.service.BundleAssembler;
import com.al.hl7fhirconverter.service.ClinicalSummaryService;
import com.al.hl7fhirconverter.service.Hl7ToFhirService;
import com.al.hl7fhirconverter.service.converter.Hl7ConverterRegistry;
import com.al.hl7fhirconverter.validation.Hl7StructureValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.hl7.fhir.r4.model.Bundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line front end for the conversion pipeline. Runs without a Spring
 * context; components are wired by hand.
 */
@Command(name = "hl7-fhir", mixinStandardHelpOptions = true, version = "hl7-fhir version 0.2.0",
        description = "Convert an HL7 v2 message file to a FHIR R4 Bundle.")
public class Hl7FhirCli implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_INPUT = 1;
    public static final int EXIT_PARSE = 2;
    public static final int EXIT_CONVERT = 3;
    public static final int EXIT_WRITE = 4;
    public static final int EXIT_INVALID = 5;

    @Spec
    CommandSpec spec;

    @Option(names = {"-i", "--input"}, required = true, description = "Path to the HL7 file")
    Path input;

    @Option(names = {"-o", "--output"}, description = "Write JSON output to this file instead of stdout")
    Path output;

    @Option(names = {"--pretty"}, description = "Pretty-print JSON output")
    boolean pretty;

    @Option(names = {"--raw"}, description = "Output the decoded HL7 message instead of FHIR")
    boolean raw;

    @Option(names = {"--validate"}, description = "Validate HL7 structure before converting")
    boolean validate;

    @Option(names = {"--validate-only"}, description = "Validate HL7 structure and exit without converting")
    boolean validateOnly;

    @Option(names = {"--summary"}, description = "Print a plain-text clinical summary after the output")
    boolean summary;

    @Option(names = {"--debug"}, description = "Enable debug logging")
    boolean debug;

    public static void main(String[] args) {
        int exit = new CommandLine(new Hl7FhirCli()).execute(args);
        System.exit(exit);
    }

    @Override
    public Integer call() {
        configureLogging();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String hl7;
        try {
            hl7 = Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println(error("Error loading HL7 file: " + input + " (" + e.getMessage() + ")"));
            return EXIT_INPUT;
        }

        ParsingConfiguration configuration = new ParsingConfiguration();
        configuration.setStrictness(ParsingConfiguration.StrictnessLevel.PERMISSIVE);
        configuration.setPrettyPrint(pretty);
        Hl7ToFhirService service = createService(configuration);

        if (validate || validateOnly) {
            List<ConversionError> violations = service.validate(hl7);
            boolean failed = ConversionError.containsErrors(violations);
            if (failed) {
                out.println(error("HL7 Validation Failed:"));
            }
            for (ConversionError violation : violations) {
                out.println(violation.isError()
                        ? error("  - " + violation.getMessage())
                        : warning("  - " + violation.getMessage()));
            }
            if (failed) {
                return EXIT_INVALID;
            }
            out.println(ok("HL7 validation passed."));
            if (validateOnly) {
                return EXIT_OK;
            }
        }

        ParsedMessage parsed;
        try {
            parsed = service.parse(hl7);
        } catch (Hl7ConversionException e) {
            err.println(error("Failed to parse HL7: " + e.getMessage()));
            return EXIT_PARSE;
        }

        Bundle bundle = null;
        if (!raw || summary) {
            try {
                bundle = service.toBundle(parsed);
            } catch (Hl7ConversionException e) {
                err.println(error("Failed to convert to FHIR: " + e.getMessage()));
                return EXIT_CONVERT;
            }
        }

        String json;
        if (raw) {
            try {
                json = rawJson(parsed);
            } catch (JsonProcessingException e) {
                err.println(error("Failed to encode decoded message: " + e.getOriginalMessage()));
                return EXIT_CONVERT;
            }
        } else {
            json = service.encode(bundle, pretty);
        }

        if (output != null) {
            try {
                Files.writeString(output, json, StandardCharsets.UTF_8);
            } catch (IOException e) {
                err.println(error("Failed to write output: " + e.getMessage()));
                return EXIT_WRITE;
            }
            out.println(ok("Wrote output to " + output));
        } else {
            out.println(json);
        }

        if (summary) {
            out.println();
            out.println("===== CLINICAL SUMMARY =====");
            out.println();
            out.println(new ClinicalSummaryService().summarize(bundle));
        }
        out.flush();
        return EXIT_OK;
    }

    static Hl7ToFhirService createService(ParsingConfiguration configuration) {
        SegmentTokenizer tokenizer = new SegmentTokenizer();
        FhirContext fhirContext = new PerformanceConfig().fhirContext();
        return new Hl7ToFhirService(
                tokenizer,
                new Hl7MessageDecoder(tokenizer, configuration),
                new Hl7StructureValidator(),
                Hl7ConverterRegistry.withDefaults(),
                new BundleAssembler(),
                new ClinicalSummaryService(),
                fhirContext,
                configuration,
                new SimpleMeterRegistry());
    }

    private String rawJson(ParsedMessage parsed) throws JsonProcessingException {
        ObjectMapper mapper = new ObjectMapper();
        if (pretty) {
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return mapper.writeValueAsString(parsed);
    }

    private void configureLogging() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(debug ? Level.DEBUG : Level.WARN);
        }
    }

    private static String ok(String message) {
        return CommandLine.Help.Ansi.AUTO.string("@|green ✔ " + message + "|@");
    }

    private static String warning(String message) {
        return CommandLine.Help.Ansi.AUTO.string("@|yellow " + message + "|@");
    }

    private static String error(String message) {
        return CommandLine.Help.Ansi.AUTO.string("@|red ❌ " + message + "|@");
    }
}
