package ca.gc.cra.linelog.application;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import org.junit.jupiter.api.Test;

class SinksTest {

  @Test
  void discardIsASingleton() {
    assertSame(Sinks.discard(), Sinks.discard());
    assertTrue(Sinks.isDiscard(Sinks.discard()));
  }

  @Test
  void otherStreamsAreNotDiscard() {
    assertFalse(Sinks.isDiscard(new ByteArrayOutputStream()));
    assertFalse(Sinks.isDiscard(OutputStream.nullOutputStream()));
    assertFalse(Sinks.isDiscard(null));
  }

  @Test
  void discardAcceptsWrites() {
    OutputStream discard = Sinks.discard();
    assertDoesNotThrow(() -> {
      discard.write(1);
      discard.write(new byte[] {1, 2, 3}, 0, 3);
      discard.flush();
    });
  }
}
