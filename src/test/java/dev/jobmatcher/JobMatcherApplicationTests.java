package dev.jobmatcher;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobMatcherApplicationTests {

  @Mock
  private PipelineRunner pipelineRunner;

  @Mock
  private ExitManager exitManager;

  @Test
  void shouldRunSearchAndExitSuccessfully() {
    JobMatcherApplication app = new JobMatcherApplication(pipelineRunner, exitManager);

    when(pipelineRunner.execute()).thenReturn(3);

    app.run();

    verify(pipelineRunner).execute();
    verify(exitManager).exit(0);
  }

  @Test
  void shouldExitWithErrorWhenSearchFails() {
    JobMatcherApplication app = new JobMatcherApplication(pipelineRunner, exitManager);

    when(pipelineRunner.execute()).thenThrow(new IllegalStateException("Pipeline execution failed"));

    app.run();

    verify(exitManager).exit(1);
    verify(exitManager, never()).exit(0);
  }
}
