package net.jodah.tether.internal;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import net.jodah.tether.internal.RestorationLedger.Entry;
import net.jodah.tether.internal.RestorationLedger.Phase;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

@Test
public class RestorationLedgerTest {
  RestorationLedger<List<String>> ledger;

  static class TestEntry implements Entry<List<String>> {
    final String name;
    final Phase phase;
    final Object dependency;

    TestEntry(String name, Phase phase, Object dependency) {
      this.name = name;
      this.phase = phase;
      this.dependency = dependency;
    }

    @Override
    public Phase getPhase() {
      return phase;
    }

    @Override
    public void restore(List<String> channel) {
      channel.add(name);
    }

    @Override
    public boolean dependsOn(Object entity) {
      return entity.equals(dependency);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  @BeforeMethod
  protected void beforeMethod() {
    ledger = new RestorationLedger<List<String>>();
  }

  public void shouldReplayByPhaseThenRecordedOrder() throws Exception {
    ledger.record("consumer", new TestEntry("consumer", Phase.CONSUMER, "q"));
    ledger.record("binding", new TestEntry("binding", Phase.BINDING, "q"));
    ledger.record("q", new TestEntry("q", Phase.DECLARATION, null));
    ledger.record("qos", new TestEntry("qos", Phase.QOS, null));
    ledger.record("x", new TestEntry("x", Phase.DECLARATION, null));

    List<String> replayed = new ArrayList<String>();
    for (Entry<List<String>> entry : ledger.entries())
      entry.restore(replayed);

    assertEquals(replayed, Arrays.asList("q", "x", "binding", "qos", "consumer"));
  }

  public void shouldReplaceInPlaceWhenRecordedTwice() {
    ledger.record("a", new TestEntry("a1", Phase.DECLARATION, null));
    ledger.record("b", new TestEntry("b", Phase.DECLARATION, null));
    ledger.record("a", new TestEntry("a2", Phase.DECLARATION, null));

    assertEquals(ledger.size(), 2);
    assertEquals(ledger.keys(), Arrays.<Object>asList("a", "b"));
    assertEquals(ledger.get("a").toString(), "a2");
  }

  public void shouldRemoveDependents() {
    ledger.record("q", new TestEntry("q", Phase.DECLARATION, null));
    ledger.record("b1", new TestEntry("b1", Phase.BINDING, "q"));
    ledger.record("b2", new TestEntry("b2", Phase.BINDING, "other"));
    ledger.record("c", new TestEntry("c", Phase.CONSUMER, "q"));

    assertTrue(ledger.remove("q") != null);
    assertEquals(ledger.removeDependents("q"), 2);
    assertEquals(ledger.keys(), Arrays.<Object>asList("b2"));
    assertFalse(ledger.contains("c"));
  }

  public void shouldReturnNullWhenRemovingUnknownKey() {
    assertNull(ledger.remove("missing"));
  }
}
