package com.squadron.dispatch.cli;

import com.squadron.core.events.EventBus;
import com.squadron.workspace.multirepo.MultiRepoCoordinator;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CliRunnerTest {

    private final MultiRepoCoordinator coordinator = mock(MultiRepoCoordinator.class);

    private final CommandLine.IFactory factory = new CommandLine.IFactory() {
        @Override
        @SuppressWarnings("unchecked")
        public <K> K create(Class<K> cls) throws Exception {
            if (cls == ValidateCommand.class) {
                return (K) new ValidateCommand(coordinator);
            }
            if (cls == StartCommand.class) {
                return (K) new StartCommand(coordinator, null, new EventBus());
            }
            return CommandLine.defaultFactory().create(cls);
        }
    };

    @Test
    void exitCodeOfCommandIsExposed() {
        var runner = new CliRunner(new SquadronCommand(), factory);

        runner.run("validate", "--primary", "/srv/api", "-d", "broken");

        assertEquals(2, runner.getExitCode());
    }

    @Test
    void unexpectedExceptionBecomesExitCodeOne() {
        doThrow(new IllegalStateException("disk full")).when(coordinator).initializeWorkspace(any());
        var runner = new CliRunner(new SquadronCommand(), factory);

        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        try {
            System.setOut(new PrintStream(capture, true));
            runner.run("validate", "--primary", "/srv/api");
        } finally {
            System.setOut(originalOut);
        }

        assertEquals(CliRunner.EXIT_FAILURE, runner.getExitCode());
        assertTrue(capture.toString().contains("validate failed: disk full"));
    }
}
