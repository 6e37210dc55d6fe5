package org.waabox.concordia.member;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.waabox.concordia.FakeTargetRegistry;
import org.waabox.concordia.report.Outcome;
import org.waabox.concordia.report.SyncAction;
import org.waabox.concordia.target.TargetRegistry;

/**
 * Tests for {@link SpaceReconciler}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SpaceReconcilerTest {

  @Test
  void whenReconciling_givenDrift_shouldAddMissingAndRemoveExtra() {
    final TargetRegistry registry = createMock(TargetRegistry.class);
    registry.addMemberToSpace("a@x.com", "g1");
    registry.removeMemberFromSpace("a@x.com", "g3");
    replay(registry);

    final MembershipIndex index = new MembershipIndex(
        Map.of("a@x.com", Set.of("g2", "g3")));

    final ReconcileResult result = new SpaceReconciler(registry)
        .reconcile("a@x.com", List.of("g1", "g2"), index, false);

    assertEquals(1, result.adds());
    assertEquals(1, result.removes());
    assertEquals(0, result.errors());
    assertEquals(SyncAction.ADD_TO_SPACE, result.details().get(0).action());
    assertEquals(SyncAction.REMOVE_FROM_SPACE,
        result.details().get(1).action());
    verify(registry);
  }

  @Test
  void whenReconciling_givenDryRun_shouldNotWrite() {
    final TargetRegistry registry = createMock(TargetRegistry.class);
    replay(registry);

    final MembershipIndex index = new MembershipIndex(
        Map.of("a@x.com", Set.of("g2", "g3")));

    final ReconcileResult result = new SpaceReconciler(registry)
        .reconcile("a@x.com", List.of("g1", "g2"), index, true);

    assertEquals(1, result.adds());
    assertEquals(1, result.removes());
    assertTrue(result.details().stream()
        .allMatch(d -> d.outcome() == Outcome.DRY_RUN));
    verify(registry);
  }

  @Test
  void whenReconciling_givenFailingAdd_shouldCountErrorAndContinue() {
    final TargetRegistry registry = createMock(TargetRegistry.class);
    registry.addMemberToSpace("a@x.com", "g1");
    expectLastCall().andThrow(new IllegalStateException("boom"));
    registry.addMemberToSpace("a@x.com", "g2");
    replay(registry);

    final ReconcileResult result = new SpaceReconciler(registry)
        .reconcile("a@x.com", List.of("g1", "g2"),
            new MembershipIndex(Map.of()), false);

    assertEquals(1, result.adds());
    assertEquals(1, result.errors());
    assertEquals("boom", result.details().get(0).error());
    verify(registry);
  }

  @Test
  void whenReconcilingAgain_givenRebuiltIndex_shouldChangeNothing() {
    final FakeTargetRegistry registry = new FakeTargetRegistry()
        .space("g1")
        .space("g2", "a@x.com")
        .space("g3", "a@x.com");
    final MembershipIndexBuilder builder = new MembershipIndexBuilder(
        registry);
    final SpaceReconciler reconciler = new SpaceReconciler(registry);
    final List<String> desired = List.of("g1", "g2");

    final ReconcileResult first = reconciler.reconcile("a@x.com", desired,
        builder.build(registry.listSpaces()), false);
    final ReconcileResult second = reconciler.reconcile("a@x.com", desired,
        builder.build(registry.listSpaces()), false);

    assertEquals(2, first.adds() + first.removes());
    assertTrue(second.isUnchanged());
    assertEquals(2, registry.writes().size());
  }
}
