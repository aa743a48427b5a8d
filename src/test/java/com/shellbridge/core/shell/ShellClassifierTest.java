package com.shellbridge.core.shell;

import com.shellbridge.core.model.BackendKind;
import com.shellbridge.core.model.Command;
import com.shellbridge.core.model.DetectionRule;
import com.shellbridge.core.model.ShellPlan;
import com.shellbridge.core.model.TrailingArgument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ShellClassifierTest {

    private ShellClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ShellClassifier(ShellCatalog.windows());
    }

    private ShellPlan classify(String text) {
        return classifier.classify(new Command(text));
    }

    @Nested
    @DisplayName("POSIX subsystem detection")
    class SubsystemTests {

        @Test
        @DisplayName("wsl prefix routes to the subsystem and strips the prefix from the trailing argument")
        void wslPrefix() {
            var plan = classify("wsl ls -la /home");

            assertEquals(BackendKind.POSIX_SUBSYSTEM, plan.backend());
            assertEquals(DetectionRule.SUBSYSTEM_PREFIX, plan.rule());
            assertEquals(TrailingArgument.AFTER_SUBSYSTEM_PREFIX, plan.trailing());
            assertEquals(List.of("wsl.exe", "--", "bash", "-c", "ls -la /home"),
                    plan.argv(new Command("wsl ls -la /home")));
        }

        @Test
        @DisplayName("prefix match is case-insensitive and accepts the .exe suffix")
        void wslExeUpperCase() {
            var plan = classify("WSL.exe uname -a");
            assertEquals(BackendKind.POSIX_SUBSYSTEM, plan.backend());
            assertEquals(List.of("wsl.exe", "--", "bash", "-c", "uname -a"),
                    plan.argv(new Command("WSL.exe uname -a")));
        }

        @Test
        @DisplayName("mount path routes to the subsystem with the full command")
        void mountPath() {
            var plan = classify("cat /mnt/c/Users/dev/notes.txt");

            assertEquals(BackendKind.POSIX_SUBSYSTEM, plan.backend());
            assertEquals(DetectionRule.SUBSYSTEM_MOUNT_PATH, plan.rule());
            assertEquals(TrailingArgument.FULL_COMMAND, plan.trailing());
        }

        @Test
        @DisplayName("wsl inside a word is not a prefix")
        void wslInsideWord() {
            assertEquals(BackendKind.CONSOLE, classify("echo wslconfig").backend());
        }
    }

    @Nested
    @DisplayName("PowerShell detection")
    class PowerShellTests {

        @Test
        @DisplayName("verb-noun cmdlet routes to PowerShell with -NoProfile -Command")
        void verbNoun() {
            String text = "Get-Process | Select-Object -First 5";
            var plan = classify(text);

            assertEquals(BackendKind.POWERSHELL, plan.backend());
            assertEquals(DetectionRule.POWERSHELL_SYNTAX, plan.rule());
            assertEquals(List.of("powershell.exe", "-NoProfile", "-Command", text), plan.argv(new Command(text)));
        }

        @Test
        @DisplayName("$PSVersionTable and Import-Module are PowerShell indicators")
        void sessionVariableAndModuleImport() {
            assertEquals(BackendKind.POWERSHELL, classify("$PSVersionTable.PSVersion").backend());
            assertEquals(BackendKind.POWERSHELL, classify("Import-Module PSReadLine").backend());
        }

        @Test
        @DisplayName("lower-case noun after a verb is not a cmdlet")
        void lowerCaseNoun() {
            assertEquals(BackendKind.CONSOLE, classify("echo get-rich").backend());
        }

        @Test
        @DisplayName("PowerShell syntax wins over an ecosystem prefix (first match, not most specific)")
        void orderBeatsSpecificity() {
            var plan = classify("git commit -m 'Get-Item fix'");
            assertEquals(BackendKind.POWERSHELL, plan.backend());
        }
    }

    @Nested
    @DisplayName("Console routing")
    class ConsoleTests {

        @Test
        @DisplayName("ecosystem tools go to the console backend")
        void ecosystemTools() {
            for (String text : List.of("git status", "npm install", "npx vitest", "node app.js",
                    "yarn build", "pnpm test", "docker ps -a", "python script.py", "py -3 x.py", "uv run task")) {
                var plan = classify(text);
                assertEquals(BackendKind.CONSOLE, plan.backend(), text);
                assertEquals(DetectionRule.ECOSYSTEM_TOOL, plan.rule(), text);
            }
        }

        @Test
        @DisplayName("uv runs on the console backend, not the subsystem")
        void uvStaysOnConsole() {
            assertEquals(BackendKind.CONSOLE, classify("uv pip install requests").backend());
        }

        @Test
        @DisplayName("anything else falls through to the console default")
        void defaultConsole() {
            var plan = classify("echo hello");

            assertEquals(BackendKind.CONSOLE, plan.backend());
            assertEquals(DetectionRule.DEFAULT, plan.rule());
            assertEquals(List.of("cmd.exe", "/c", "echo hello"), plan.argv(new Command("echo hello")));
        }

        @Test
        @DisplayName("posix catalog maps the console backend to sh -c")
        void posixCatalog() {
            var posix = new ShellClassifier(ShellCatalog.posix());
            var plan = posix.classify(new Command("echo hi"));
            assertEquals(List.of("sh", "-c", "echo hi"), plan.argv(new Command("echo hi")));
        }
    }

    @Nested
    @DisplayName("Override and caching")
    class CacheTests {

        @Test
        @DisplayName("override wins unconditionally and does not touch the cache")
        void overrideWins() {
            var plan = classifier.classify(new Command("wsl ls"), BackendKind.POWERSHELL);

            assertEquals(BackendKind.POWERSHELL, plan.backend());
            assertEquals(DetectionRule.OVERRIDE, plan.rule());
            assertEquals(0, classifier.cacheSize());
        }

        @Test
        @DisplayName("repeated classification returns the same plan from the cache")
        void deterministicAndCached() {
            var first = classify("Get-ChildItem");
            var second = classify("Get-ChildItem");

            assertSame(first, second);
            assertEquals(1, classifier.cacheSize());
        }

        @Test
        @DisplayName("exceeding capacity evicts the oldest fifth in one pass")
        void evictsOldestFifth() {
            var small = new ShellClassifier(ShellCatalog.posix(), 10);
            for (int i = 0; i < 11; i++) {
                small.classify(new Command("echo " + i));
            }
            assertEquals(9, small.cacheSize());
            assertEquals(10, small.cacheCapacity());
        }

        @Test
        @DisplayName("clearCache empties the cache")
        void clearCache() {
            classify("echo a");
            classifier.clearCache();
            assertEquals(0, classifier.cacheSize());
        }
    }
}
