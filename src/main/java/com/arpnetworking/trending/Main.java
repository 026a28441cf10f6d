/*
 * Copyright 2026 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.trending;

import ch.qos.logback.classic.LoggerContext;
import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.trending.configuration.TrendingConfiguration;
import com.arpnetworking.trending.model.MnemonicTable;
import com.arpnetworking.trending.telemetry.CsvMnemonicTableReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;

/**
 * Batch entry point: runs the trending routines of a configuration file over
 * a telemetry export and writes the report to standard output as JSON.
 *
 * @author Inscope Metrics
 */
public final class Main {
    /**
     * Entry point.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        Thread.setDefaultUncaughtExceptionHandler(Main::logUnhandledException);
        Thread.currentThread().setUncaughtExceptionHandler(Main::logUnhandledException);

        Runtime.getRuntime().addShutdownHook(new ShutdownThread());

        if (args.length != 2) {
            throw new RuntimeException("Usage: <configuration.json> <telemetry.csv>");
        }

        try {
            final TrendingReport report = run(new File(args[0]), new File(args[1]));
            System.out.println(createReportMapper().writeValueAsString(report));
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Report an exception that escaped a thread. Logging stays available
     * until the shutdown hook stops it.
     *
     * @param thread The thread that failed.
     * @param throwable The exception.
     */
    static void logUnhandledException(final Thread thread, final Throwable throwable) {
        LOGGER.error()
                .setMessage("Unhandled exception!")
                .addData("thread", thread.getName())
                .setThrowable(throwable)
                .log();
    }

    /**
     * Load the configuration and telemetry and run the pipeline.
     *
     * @param configurationFile The configuration file.
     * @param telemetryFile The telemetry CSV file.
     * @return The report.
     * @throws IOException if either file cannot be read or parsed.
     */
    static TrendingReport run(final File configurationFile, final File telemetryFile) throws IOException {
        LOGGER.debug()
                .setMessage("Loading configuration from file")
                .addData("file", configurationFile)
                .log();
        final TrendingConfiguration configuration = TrendingConfiguration.createObjectMapper()
                .readValue(configurationFile, TrendingConfiguration.class);

        LOGGER.debug()
                .setMessage("Loading telemetry from file")
                .addData("file", telemetryFile)
                .log();
        final Map<String, MnemonicTable> tables;
        try (Reader reader = Files.newBufferedReader(telemetryFile.toPath(), StandardCharsets.UTF_8)) {
            tables = new CsvMnemonicTableReader().read(reader);
        }

        LOGGER.info()
                .setMessage("Running trending routines")
                .addData("extractions", configuration.getExtractions().size())
                .addData("correlations", configuration.getCorrelations().size())
                .addData("mnemonics", tables.size())
                .log();
        return new TrendingPipeline(configuration).run(tables);
    }

    /**
     * Create the {@link ObjectMapper} used to write reports.
     *
     * @return New {@link ObjectMapper}.
     */
    static ObjectMapper createReportMapper() {
        final ObjectMapper mapper = ObjectMapperFactory.createInstance();
        mapper.registerModule(new GuavaModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    private Main() {}

    private static final class ShutdownThread extends Thread {

        private ShutdownThread() {
            super("TrendingShutdownHook");
        }

        @Override
        public void run() {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.stop();
        }
    }

    private static final Logger LOGGER = com.arpnetworking.steno.LoggerFactory.getLogger(Main.class);
}
