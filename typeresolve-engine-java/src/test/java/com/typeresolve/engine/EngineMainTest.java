package com.typeresolve.engine;

import com.google.gson.Gson;
import com.typeresolve.engine.ingest.GraphReadException;
import com.typeresolve.engine.report.ReportModel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class EngineMainTest {

    private static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/swift-scenarios");

    @Test
    void noArgsThrowsUsageException() {
        assertThrows(EngineMain.UsageException.class, () -> EngineMain.run(new String[]{}));
    }

    @Test
    void unknownSubcommandThrowsUsageException() {
        assertThrows(EngineMain.UsageException.class,
                () -> EngineMain.run(new String[]{"classify"}));
    }

    @Test
    void missingGraphFlagThrowsUsageException() {
        assertThrows(EngineMain.UsageException.class,
                () -> EngineMain.run(new String[]{"report", "--output", "/tmp/out"}));
    }

    @Test
    void missingOutputFlagThrowsUsageException() {
        assertThrows(EngineMain.UsageException.class,
                () -> EngineMain.run(new String[]{"report", "--graph", "/tmp/graph.json"}));
    }

    @Test
    void flagWithoutValueThrowsUsageException() {
        assertThrows(EngineMain.UsageException.class,
                () -> EngineMain.run(new String[]{"report", "--graph"}));
    }

    @Test
    void unknownFlagThrowsUsageException() {
        assertThrows(EngineMain.UsageException.class,
                () -> EngineMain.run(new String[]{"report", "--foo", "bar"}));
    }

    @Test
    void missingGraphFileIsNotAUsageError(@TempDir Path tmp) {
        assertThrows(GraphReadException.class, () -> EngineMain.run(new String[]{
                "report", "--graph", tmp.resolve("absent.json").toString(), "--output", tmp.toString()}));
    }

    @Test
    void reportWrittenForFixture(@TempDir Path tmp) throws Exception {
        EngineMain.run(new String[]{
                "report",
                "--graph", FIXTURE_ROOT.resolve("graph.json").toString(),
                "--bindings", FIXTURE_ROOT.resolve("bindings.json").toString(),
                "--config", FIXTURE_ROOT.resolve("engine.json").toString(),
                "--output", tmp.toString()
        });

        Path reportPath = tmp.resolve("classification_report.json");
        assertTrue(Files.exists(reportPath));
        assertTrue(Files.exists(tmp.resolve("metadata.json")));

        ReportModel.ReportRoot report = new Gson().fromJson(
                new FileReader(reportPath.toFile()), ReportModel.ReportRoot.class);
        assertEquals("type_alias_test", report.graphName);
        assertEquals(4, report.types.size());
        assertEquals(1, report.dynamicReferences.size());
        assertEquals("resolved", report.dynamicReferences.get(0).status);
    }

    @Test
    void localModuleFlagOverridesConfig(@TempDir Path tmp) throws Exception {
        EngineMain.run(new String[]{
                "report",
                "--graph", FIXTURE_ROOT.resolve("graph.json").toString(),
                "--config", FIXTURE_ROOT.resolve("engine.json").toString(),
                "--local-module", "MyApp",
                "--output", tmp.toString()
        });

        ReportModel.ReportRoot report = new Gson().fromJson(
                new FileReader(tmp.resolve("classification_report.json").toFile()), ReportModel.ReportRoot.class);
        assertEquals("MyApp", report.localModule);
        assertTrue(report.types.stream().anyMatch(t -> t.id.equals("MyApp::ProfileScreen")));
    }
}
