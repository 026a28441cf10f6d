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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.arpnetworking.trending.condition.IncomparableValueException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Tests for the {@link Main} class.
 *
 * @author Inscope Metrics
 */
public class MainTest {

    @Test
    public void testRun() throws IOException {
        final File configuration = _folder.newFile("trending.json");
        Files.write(configuration.toPath(), ("{"
                + "\"extractions\":[{\"name\":\"ice_powered\","
                + "\"conditions\":[{\"mnemonic\":\"VOLT1\",\"comparator\":\"GREATER_THAN\",\"value\":25.0}],"
                + "\"mnemonics\":[\"TEMP\"]}],"
                + "\"correlations\":[{\"name\":\"wheel_position\","
                + "\"conditions\":[{\"mnemonic\":\"SUPPLY\",\"comparator\":\"GREATER_THAN\",\"value\":250}],"
                + "\"positionMnemonic\":\"POS\",\"ratioMnemonic\":\"RATIO\","
                + "\"nominals\":{\"A\":100,\"B\":200}}]"
                + "}").getBytes(StandardCharsets.UTF_8));

        final File telemetry = _folder.newFile("telemetry.csv");
        Files.write(telemetry.toPath(), ("mnemonic,time,value\n"
                + "VOLT1,0,30\nVOLT1,1,30\nVOLT1,2,5\n"
                + "TEMP,0,10\nTEMP,1,11\nTEMP,1.5,12\nTEMP,2,13\nTEMP,3,14\n"
                + "SUPPLY,0,300\nSUPPLY,20,0\n"
                + "POS,0,A\nPOS,10,B\n"
                + "RATIO,1,99\nRATIO,5,101\nRATIO,11,199\n").getBytes(StandardCharsets.UTF_8));

        final TrendingReport report = Main.run(configuration, telemetry);
        final ObjectMapper mapper = Main.createReportMapper();
        final JsonNode json = mapper.readTree(mapper.writeValueAsString(report));

        final JsonNode summary = json.get("summaries").get("ice_powered").get("TEMP");
        Assert.assertEquals(3, summary.get("count").asLong());
        Assert.assertEquals(11, summary.get("mean").asDouble(), 0.0001);

        final JsonNode matches = json.get("correlations").get("wheel_position").get("matches");
        Assert.assertEquals(1, matches.get("A").get(0).get("time").asDouble(), 0.0);
        Assert.assertEquals(99, matches.get("A").get(0).get("value").asDouble(), 0.0);
        Assert.assertEquals(199, matches.get("B").get(0).get("value").asDouble(), 0.0);
    }

    @Test(expected = IOException.class)
    public void testMissingTelemetry() throws IOException {
        final File configuration = _folder.newFile("trending.json");
        Files.write(configuration.toPath(), "{}".getBytes(StandardCharsets.UTF_8));
        Main.run(configuration, new File(_folder.getRoot(), "absent.csv"));
    }

    @Test
    public void testIncomparableConditionIsReported() throws IOException {
        final File configuration = _folder.newFile("trending.json");
        Files.write(configuration.toPath(), ("{"
                + "\"extractions\":[{\"name\":\"labelled\","
                + "\"conditions\":[{\"mnemonic\":\"A\",\"comparator\":\"GREATER_THAN\",\"value\":\"OFF\"}],"
                + "\"mnemonics\":[\"B\"]}]"
                + "}").getBytes(StandardCharsets.UTF_8));
        final File telemetry = _folder.newFile("telemetry.csv");
        Files.write(telemetry.toPath(), "mnemonic,time,value\nA,0,1\nB,0,2\n".getBytes(StandardCharsets.UTF_8));

        final Logger logger = (Logger) LoggerFactory.getLogger(Main.class);
        final ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            try {
                Main.run(configuration, telemetry);
                Assert.fail("Expected the run to fail");
            } catch (final IncomparableValueException e) {
                Main.logUnhandledException(Thread.currentThread(), e);
            }
        } finally {
            logger.detachAppender(appender);
            appender.stop();
        }

        Assert.assertTrue(((LoggerContext) LoggerFactory.getILoggerFactory()).isStarted());
        Assert.assertEquals(1, appender.list.size());
        final ILoggingEvent event = appender.list.get(0);
        Assert.assertEquals(Level.ERROR, event.getLevel());
        Assert.assertNotNull(event.getThrowableProxy());
        Assert.assertEquals(IncomparableValueException.class.getName(), event.getThrowableProxy().getClassName());
    }

    @Rule
    public final TemporaryFolder _folder = new TemporaryFolder();
}
