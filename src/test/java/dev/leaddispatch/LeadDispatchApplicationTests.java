package dev.leaddispatch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LeadDispatchApplicationTests {

    @Mock
    private CommandRunner commandRunner;

    @Mock
    private ExitManager exitManager;

    @Test
    void shouldExitWithCommandStatus() {
        LeadDispatchApplication app = new LeadDispatchApplication(commandRunner, exitManager);

        when(commandRunner.execute("stats")).thenReturn(0);

        app.run("stats");

        verify(commandRunner).execute("stats");
        verify(exitManager).exit(0);
    }

    @Test
    void shouldPassFailureStatusThrough() {
        LeadDispatchApplication app = new LeadDispatchApplication(commandRunner, exitManager);

        when(commandRunner.execute("bogus")).thenReturn(1);

        app.run("bogus");

        verify(exitManager).exit(1);
    }

    @Test
    void shouldHandleExceptionAndExitWithError() {
        LeadDispatchApplication app = new LeadDispatchApplication(commandRunner, exitManager);

        when(commandRunner.execute("match")).thenThrow(new RuntimeException("Fatal"));

        app.run("match");

        verify(exitManager).exit(1);
    }
}
