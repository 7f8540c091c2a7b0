package ca.gc.cra.logbridge.slf4j;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logbridge.pipeline.Log;
import ca.gc.cra.logbridge.pipeline.LoggerConfiguration;
import ca.gc.cra.logbridge.pipeline.PipelineLogger;
import ca.gc.cra.logbridge.provider.LoggerProviderCollection;
import ca.gc.cra.logbridge.provider.RecordingLoggerProvider;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

class PipelineLoggerFactoryTest {

  @AfterEach
  void resetGlobalLogger() {
    Log.closeAndFlush();
  }

  @Test
  void loggersAreCachedPerNameAndCarryCategory() {
    ListAppender<ILoggingEvent> sink = new ListAppender<>();
    PipelineLogger pipeline = new LoggerConfiguration().writeTo(sink).createLogger();
    PipelineLoggerFactory factory = new PipelineLoggerFactory(pipeline, true);

    Logger first = factory.getLogger("orders.Service");
    Logger second = factory.getLogger("orders.Service");
    first.info("Accepted order {}", 42);
    factory.close();

    assertSame(first, second);
    assertEquals("orders.Service", first.getName());
    assertEquals(1, sink.list.size());
    assertEquals("orders.Service", sink.list.get(0).getLoggerName());
    assertEquals("Accepted order 42", sink.list.get(0).getFormattedMessage());
  }

  @Test
  void disposeClosesSuppliedLogger() {
    PipelineLogger pipeline = new LoggerConfiguration().createLogger();
    PipelineLoggerFactory factory = new PipelineLoggerFactory(pipeline, true);

    factory.close();

    assertTrue(pipeline.isClosed());
  }

  @Test
  void withoutDisposeSuppliedLoggerStaysOpen() {
    PipelineLogger pipeline = new LoggerConfiguration().createLogger();
    PipelineLoggerFactory factory = new PipelineLoggerFactory(pipeline, false);

    factory.close();

    assertFalse(pipeline.isClosed());
    pipeline.close();
  }

  @Test
  void nullLoggerFollowsGlobalSlot() {
    ListAppender<ILoggingEvent> firstSink = new ListAppender<>();
    ListAppender<ILoggingEvent> secondSink = new ListAppender<>();
    PipelineLogger first = new LoggerConfiguration().writeTo(firstSink).createLogger();
    PipelineLogger second = new LoggerConfiguration().writeTo(secondSink).createLogger();
    PipelineLoggerFactory factory = new PipelineLoggerFactory();
    Logger logger = factory.getLogger("app");

    Log.setLogger(first);
    logger.info("to first");
    Log.setLogger(second);
    logger.info("to second");

    assertEquals(1, firstSink.list.size());
    assertEquals(1, secondSink.list.size());
    first.close();
    second.close();
  }

  @Test
  void globalCategoryLoggerIsReusedUntilSlotChanges() {
    PipelineLogger first = new LoggerConfiguration().createLogger();
    PipelineLogger second = new LoggerConfiguration().createLogger();
    PipelineLoggerFactory.GlobalCategorySource source = new PipelineLoggerFactory.GlobalCategorySource("app");

    Log.setLogger(first);
    PipelineLogger resolved = source.get();
    assertSame(resolved, source.get());
    assertEquals("app", resolved.getName());
    assertTrue(resolved.sharesPipelineWith(first));

    Log.setLogger(second);
    PipelineLogger switched = source.get();
    assertNotSame(resolved, switched);
    assertTrue(switched.sharesPipelineWith(second));
    assertSame(switched, source.get());
    first.close();
    second.close();
  }

  @Test
  void disposeWithoutLoggerClosesAndResetsGlobalSlot() {
    PipelineLogger global = new LoggerConfiguration().createLogger();
    Log.setLogger(global);
    PipelineLoggerFactory factory = new PipelineLoggerFactory(null, true);

    factory.close();

    assertTrue(global.isClosed());
    assertSame(PipelineLogger.none(), Log.getLogger());
  }

  @Test
  void withoutDisposeGlobalSlotIsUntouched() {
    PipelineLogger global = new LoggerConfiguration().createLogger();
    Log.setLogger(global);
    PipelineLoggerFactory factory = new PipelineLoggerFactory();

    factory.close();

    assertFalse(global.isClosed());
    assertSame(global, Log.getLogger());
  }

  @Test
  void closeIsIdempotent() {
    PipelineLogger global = new LoggerConfiguration().createLogger();
    PipelineLogger replacement = new LoggerConfiguration().createLogger();
    Log.setLogger(global);
    PipelineLoggerFactory factory = new PipelineLoggerFactory(null, true);

    factory.close();
    Log.setLogger(replacement);
    factory.close();

    assertFalse(replacement.isClosed());
    replacement.close();
  }

  @Test
  void addProviderForwardsThroughCollection() {
    LoggerProviderCollection providers = new LoggerProviderCollection();
    PipelineLogger pipeline = new LoggerConfiguration().writeToProviders(providers).createLogger();
    PipelineLoggerFactory factory = new PipelineLoggerFactory(pipeline, true, providers);
    RecordingLoggerProvider provider = new RecordingLoggerProvider();

    factory.addProvider(provider);
    factory.getLogger("app").warn("forwarded");
    factory.close();

    assertEquals(List.of("forwarded"), provider.messages());
  }

  @Test
  void addProviderWithoutCollectionIsIgnored() {
    PipelineLogger pipeline = new LoggerConfiguration().createLogger();
    PipelineLoggerFactory factory = new PipelineLoggerFactory(pipeline, true);
    RecordingLoggerProvider provider = new RecordingLoggerProvider();

    factory.addProvider(provider);
    factory.getLogger("app").warn("not forwarded");
    factory.close();

    assertTrue(provider.events().isEmpty());
    assertThrows(NullPointerException.class, () -> factory.addProvider(null));
  }

  @Test
  void fluentKeyValuePairsSurviveTheFactory() {
    ListAppender<ILoggingEvent> sink = new ListAppender<>();
    PipelineLogger pipeline = new LoggerConfiguration().writeTo(sink).createLogger();
    PipelineLoggerFactory factory = new PipelineLoggerFactory(pipeline, true);

    factory.getLogger("checkout").atInfo().setMessage("Paid").addKeyValue("amount", 12.5).log();
    factory.close();

    ILoggingEvent event = sink.list.get(0);
    assertEquals("amount", event.getKeyValuePairs().get(0).key);
    assertEquals(12.5, event.getKeyValuePairs().get(0).value);
  }
}
