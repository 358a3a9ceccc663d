package com.alphamind.core.engine;

import com.alphamind.core.model.BacktestRequest;
import com.alphamind.core.model.MiningRequest;
import com.alphamind.core.scheduler.Branch;
import com.alphamind.trial.TrialCommand;
import com.alphamind.trial.TrialProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultTrialCommandFactoryTest {

    @TempDir
    Path projectRoot;

    private TrialProperties properties;
    private DefaultTrialCommandFactory factory;

    @BeforeEach
    void setUp() {
        properties = new TrialProperties();
        properties.setProjectRoot(projectRoot.toString());
        properties.setPython("/opt/conda/bin/python");
        properties.setExtraEnv(Map.of("QLIB_DATA", "/data/qlib"));
        factory = new DefaultTrialCommandFactory(properties);
    }

    @Nested
    @DisplayName("mining")
    class MiningTests {

        @Test
        @DisplayName("passes the direction and config path on the command line")
        void argv() {
            var request = new MiningRequest("momentum", null, null, null, null, null, null, null);

            TrialCommand command = factory.mining("exp_1", request, new Branch(1, "momentum", null));

            assertEquals(List.of("/opt/conda/bin/python", "-m", "quantaalpha.cli", "mine",
                    "--direction", "momentum", "--config_path", "configs/experiment.yaml"), command.argv());
            assertEquals(projectRoot.toAbsolutePath().normalize(), command.workingDir());
        }

        @Test
        @DisplayName("omits the direction flag for an unnamed branch")
        void noDirection() {
            var request = new MiningRequest(null, null, null, null, null, null, null, null);

            TrialCommand command = factory.mining("exp_1", request, new Branch(1, null, null));

            assertFalse(command.argv().contains("--direction"));
        }

        @Test
        @DisplayName("exposes request parameters and the branch layout as environment")
        void environment() {
            var request = new MiningRequest(null, List.of("a", "b"), 4, 5, 2, 3, "v2", true);
            Path logDir = projectRoot.resolve("log/branch_02");

            Map<String, String> env = factory.mining("exp_20250101_120000_abcd1234", request,
                    new Branch(2, "b", logDir)).env();

            assertEquals("exp_20250101_120000_abcd1234", env.get("EXPERIMENT_ID"));
            assertEquals("2", env.get("BRANCH_INDEX"));
            assertEquals(logDir.toAbsolutePath().toString(), env.get("BRANCH_LOG_DIR"));
            assertEquals("v2", env.get("FACTOR_LIBRARY_SUFFIX"));
            assertEquals("4", env.get("NUM_DIRECTIONS"));
            assertEquals("5", env.get("MAX_ROUNDS"));
            assertEquals("2", env.get("MAX_LOOPS"));
            assertEquals("3", env.get("FACTORS_PER_HYPOTHESIS"));
            assertEquals("/data/qlib", env.get("QLIB_DATA"));
        }

        @Test
        @DisplayName("unset parameters are left out, rounds fall back to the default")
        void defaults() {
            var request = new MiningRequest(null, null, null, null, null, null, null, null);

            Map<String, String> env = factory.mining("exp_1", request, new Branch(1, null, null)).env();

            assertEquals("3", env.get("MAX_ROUNDS"));
            assertFalse(env.containsKey("NUM_DIRECTIONS"));
            assertFalse(env.containsKey("MAX_LOOPS"));
            assertFalse(env.containsKey("BRANCH_LOG_DIR"));
            assertFalse(env.containsKey("FACTOR_LIBRARY_SUFFIX"));
        }

        @Test
        @DisplayName("creates per-experiment workspace and cache directories")
        void workspaceDirectories() {
            var request = new MiningRequest(null, null, null, null, null, null, null, null);

            Map<String, String> env = factory.mining("exp_9", request, new Branch(1, null, null)).env();

            Path results = projectRoot.toAbsolutePath().normalize().resolve("data/results");
            assertEquals(results.resolve("workspace_exp_9").toString(), env.get("WORKSPACE_PATH"));
            assertEquals(results.resolve("pickle_cache_exp_9").toString(), env.get("PICKLE_CACHE_FOLDER_PATH_STR"));
            assertTrue(Files.isDirectory(results.resolve("workspace_exp_9")));
            assertTrue(Files.isDirectory(results.resolve("pickle_cache_exp_9")));
        }
    }

    @Nested
    @DisplayName("backtest")
    class BacktestTests {

        @Test
        @DisplayName("uses the configured config path and custom factor source by default")
        void defaults() {
            TrialCommand command = factory.backtest(new BacktestRequest("lib.json", null, null));

            assertEquals(List.of("/opt/conda/bin/python", "-m", "quantaalpha.backtest.run_backtest",
                    "-c", "configs/backtest.yaml", "--factor-source", "custom", "--factor-json", "lib.json"),
                    command.argv());
            assertEquals(Map.of("QLIB_DATA", "/data/qlib"), command.env());
        }

        @Test
        @DisplayName("request values override the defaults")
        void overrides() {
            TrialCommand command = factory.backtest(new BacktestRequest("lib.json", "combined", "my.yaml"));

            assertEquals("my.yaml", command.argv().get(4));
            assertEquals("combined", command.argv().get(6));
        }
    }
}
