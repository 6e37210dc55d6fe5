package org.waabox.concordia.member;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.waabox.concordia.FakeTargetRegistry;
import org.waabox.concordia.state.InMemoryStateStore;
import org.waabox.concordia.state.StateCache;
import org.waabox.concordia.target.TargetRegistry;

/**
 * Tests for {@link CacheValidator}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CacheValidatorTest {

  @Test
  void whenValidating_givenDrift_shouldReportBothDirections() {
    final FakeTargetRegistry target = new FakeTargetRegistry()
        .member("m-1", "a@x.com")
        .member("m-2", "b@x.com");
    final StateCache state = new StateCache(new InMemoryStateStore());
    state.load();
    state.setMemberId("a@x.com", "m-1");
    state.setMemberId("gone@x.com", "m-9");

    final CacheValidationReport report = new CacheValidator(target, state)
        .validate(false);

    assertEquals(1, report.valid());
    assertEquals(1, report.missingInTarget());
    assertEquals(1, report.missingInCache());
    assertEquals(0, report.repaired());
    assertTrue(state.memberId("b@x.com").isEmpty());
  }

  @Test
  void whenValidating_givenRepair_shouldCacheMissingMembersAndSave() {
    final FakeTargetRegistry target = new FakeTargetRegistry()
        .member("m-2", "b@x.com");
    final InMemoryStateStore store = new InMemoryStateStore();
    final StateCache state = new StateCache(store);
    state.load();

    final CacheValidationReport report = new CacheValidator(target, state)
        .validate(true);

    assertEquals(1, report.repaired());
    assertEquals(Optional.of("m-2"), state.memberId("b@x.com"));
    assertTrue(store.read().isPresent());
  }

  @Test
  void whenValidating_givenTargetFailure_shouldReturnFailedReport() {
    final TargetRegistry target = createMock(TargetRegistry.class);
    expect(target.listAllMembers()).andThrow(
        new IllegalStateException("unauthorized"));
    replay(target);

    final CacheValidationReport report = new CacheValidator(target,
        new StateCache(new InMemoryStateStore())).validate(true);

    assertTrue(report.isFailed());
    assertEquals("unauthorized", report.error());
  }
}
