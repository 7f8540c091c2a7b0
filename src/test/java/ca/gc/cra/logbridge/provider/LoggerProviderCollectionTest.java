package ca.gc.cra.logbridge.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.logbridge.pipeline.LoggerConfiguration;
import ca.gc.cra.logbridge.pipeline.PipelineLogger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import java.util.List;
import org.junit.jupiter.api.Test;

class LoggerProviderCollectionTest {

  @Test
  void pipelineForwardsToProvidersAddedAfterBuild() {
    LoggerProviderCollection providers = new LoggerProviderCollection();
    PipelineLogger logger = new LoggerConfiguration().writeToProviders(providers).createLogger();
    RecordingLoggerProvider early = new RecordingLoggerProvider();
    RecordingLoggerProvider late = new RecordingLoggerProvider();

    providers.addProvider(early);
    logger.info("one");
    providers.addProvider(late);
    logger.info("two");
    logger.close();

    assertEquals(List.of("one", "two"), early.messages());
    assertEquals(List.of("two"), late.messages());
  }

  @Test
  void closingPipelineClosesProviders() {
    LoggerProviderCollection providers = new LoggerProviderCollection();
    RecordingLoggerProvider provider = new RecordingLoggerProvider();
    providers.addProvider(provider);
    PipelineLogger logger = new LoggerConfiguration().writeToProviders(providers).createLogger();

    logger.close();
    logger.close();

    assertEquals(1, provider.closeCount());
  }

  @Test
  void failingProviderDoesNotBlockOthersOnClose() {
    LoggerProviderCollection providers = new LoggerProviderCollection();
    RecordingLoggerProvider second = new RecordingLoggerProvider();
    providers.addProvider(new LoggerProvider() {
      @Override
      public void log(ILoggingEvent event) {}

      @Override
      public void close() {
        throw new IllegalStateException("close failed");
      }
    });
    providers.addProvider(second);

    providers.close();

    assertEquals(1, second.closeCount());
  }

  @Test
  void providersSnapshotIsImmutable() {
    LoggerProviderCollection providers = new LoggerProviderCollection();
    providers.addProvider(new RecordingLoggerProvider());

    assertThrows(UnsupportedOperationException.class,
        () -> providers.providers().add(new RecordingLoggerProvider()));
    assertThrows(NullPointerException.class, () -> providers.addProvider(null));
  }
}
