package io.gridsync.desktop.model;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class GatewayTest {

  @Test
  void quotaIsExhaustedOnlyWhenAuthorizationIsRequired() {
    assertFalse(StubGateway.open("free").quotaExhausted());
    assertFalse(StubGateway.open("free").withZkaps(false, 0).quotaExhausted());
    assertTrue(StubGateway.exhausted("paid").quotaExhausted());
    assertFalse(StubGateway.open("paid").withZkaps(true, 50).quotaExhausted());
  }

  @Test
  void defaultNewscapStreamNeverEmits() {
    Gateway gateway =
        new Gateway() {
          @Override
          public String name() {
            return "plain";
          }

          @Override
          public boolean zkapAuthRequired() {
            return false;
          }

          @Override
          public int zkapsRemaining() {
            return 0;
          }

          @Override
          public List<MagicFolder> magicFolders() {
            return List.of();
          }
        };

    var subscriber = gateway.newscapEvents().test();
    subscriber.assertNoValues();
    subscriber.assertNotComplete();
    subscriber.cancel();
  }
}
