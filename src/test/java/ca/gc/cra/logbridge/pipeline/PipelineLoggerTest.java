package ca.gc.cra.logbridge.pipeline;

import static ca.gc.cra.logbridge.pipeline.LoggerConfigurationTest.pairs;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class PipelineLoggerTest {
  private ListAppender<ILoggingEvent> sink;
  private PipelineLogger root;

  @BeforeEach
  void setUp() {
    sink = new ListAppender<>();
    root = new LoggerConfiguration().writeTo(sink).createLogger();
  }

  @AfterEach
  void tearDown() {
    root.close();
  }

  @Test
  void forContextSharesPipelineButIsDistinct() {
    PipelineLogger derived = root.forContext(event -> { });

    assertNotSame(root, derived);
    assertTrue(derived.sharesPipelineWith(root));
    assertFalse(derived.ownsPipeline());

    root.info("from root");
    derived.info("from derived");

    assertEquals(2, sink.list.size());
  }

  @Test
  void closingDerivedLoggerLeavesPipelineOpen() {
    PipelineLogger derived = root.forContext("requestId", "r-1");

    derived.close();
    derived.info("still flowing");

    assertFalse(root.isClosed());
    assertEquals(1, sink.list.size());
    assertEquals(List.of("requestId=r-1"), pairs(sink.list.get(0)));
  }

  @Test
  void enrichersAccumulateInOrder() {
    PipelineLogger derived = root.forContext("a", 1).forContext("b", 2);

    derived.info("tagged");

    assertEquals(List.of("a=1", "b=2"), pairs(sink.list.get(0)));
  }

  @Test
  void emittingAfterCloseIsDroppedSilently() {
    PipelineLogger derived = root.forContext("k", "v");
    root.close();

    assertDoesNotThrow(() -> root.info("dropped"));
    assertDoesNotThrow(() -> derived.error("dropped", new IllegalStateException("boom")));
    assertTrue(derived.isClosed());
    assertFalse(derived.isErrorEnabled());
    assertTrue(sink.list.isEmpty());
  }

  @Test
  void mdcValuesReachPipelineEvents() {
    Map<String, String> captured;
    MDC.put("requestId", "r-1");
    try {
      root.forCategory("orders").info("inside request");
      // ListAppender keeps the live event, so read the MDC map before the scope ends.
      captured = sink.list.get(0).getMDCPropertyMap();
    } finally {
      MDC.remove("requestId");
    }

    assertEquals(Map.of("requestId", "r-1"), captured);
  }

  @Test
  void closeIsIdempotent() {
    root.close();

    assertDoesNotThrow(root::close);
  }

  @Test
  void fluentApiKeepsArgumentsAndThrowable() {
    IllegalArgumentException failure = new IllegalArgumentException("bad input");

    root.atWarn()
        .setMessage("Rejected {} of {}")
        .addArgument(3)
        .addArgument(10)
        .addKeyValue("batch", "b-7")
        .setCause(failure)
        .log();

    ILoggingEvent event = sink.list.get(0);
    assertEquals("Rejected 3 of 10", event.getFormattedMessage());
    assertEquals(List.of("batch=b-7"), pairs(event));
    assertEquals("bad input", event.getThrowableProxy().getMessage());
  }

  @Test
  void noneIsSilentAndNeverCloses() {
    PipelineLogger none = PipelineLogger.none();

    assertSame(none, PipelineLogger.none());
    assertFalse(none.isInfoEnabled());
    assertFalse(none.ownsPipeline());
    assertDoesNotThrow(() -> none.error("ignored"));
    assertDoesNotThrow(none::close);
  }

  @Test
  void forContextRejectsNullEnricher() {
    assertThrows(NullPointerException.class, () -> root.forContext((LogEnricher) null));
    assertThrows(NullPointerException.class, () -> root.forCategory(null));
  }
}
