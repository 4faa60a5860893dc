package com.tazifor.popup.experiment;

import com.tazifor.popup.exception.TransientStoreException;
import com.tazifor.popup.model.Experiment;
import com.tazifor.popup.model.VisitorContext;
import com.tazifor.popup.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.tazifor.popup.experiment.ExperimentAssignerTest.experiment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
public class StickyAssignmentServiceTest {

    @Mock
    private ExperimentAssignmentStore mirror;

    private final Experiment experiment = experiment(Map.of("A", 50, "B", 50), "A", "B");

    @Test
    public void assignShouldPreferValidClientToken() {
        // given
        StickyAssignmentService service = new StickyAssignmentService(new ExperimentAssigner(), mirror,
            VariantFallbackPolicy.CONTROL_VARIANT);
        given(mirror.putIfAbsent("exp-1", "v1", "B")).willReturn("B");

        // when
        String variant = service.assign(experiment, visitor("v1", Map.of("exp-1", "B")));

        // then
        assertThat(variant).isEqualTo("B");
        verify(mirror, never()).find(anyString(), anyString());
    }

    @Test
    public void assignShouldIgnoreTokenForUnknownVariant() {
        // given
        StickyAssignmentService service = new StickyAssignmentService(new ExperimentAssigner(), mirror,
            VariantFallbackPolicy.CONTROL_VARIANT);
        given(mirror.find("exp-1", "v1")).willReturn(Optional.of("A"));

        // when
        String variant = service.assign(experiment, visitor("v1", Map.of("exp-1", "Z")));

        // then
        assertThat(variant).isEqualTo("A");
    }

    @Test
    public void assignShouldKeepRetiredVariantFromClientToken() {
        // given
        Experiment shrunk = experiment(Map.of("A", 0, "B", 100), "A", "B");
        StickyAssignmentService service = new StickyAssignmentService(new ExperimentAssigner(), mirror,
            VariantFallbackPolicy.CONTROL_VARIANT);
        given(mirror.find("exp-1", "v1")).willReturn(Optional.empty());

        // when
        String variant = service.assign(shrunk, visitor("v1", Map.of("exp-1", "C")));

        // then
        assertThat(variant).isEqualTo("C");
        assertThat(service.effectiveVariant(shrunk, variant, Set.of("A", "B"))).contains("A");
        verify(mirror, never()).putIfAbsent(anyString(), anyString(), anyString());
    }

    @Test
    public void assignShouldKeepRetiredVariantFromMirror() {
        // given
        Experiment shrunk = experiment(Map.of("A", 0, "B", 100), "A", "B");
        StickyAssignmentService service = new StickyAssignmentService(new ExperimentAssigner(), mirror,
            VariantFallbackPolicy.EXCLUDE);
        given(mirror.find("exp-1", "v1")).willReturn(Optional.of("C"));

        // when
        String variant = service.assign(shrunk, visitor("v1", null));

        // then
        assertThat(variant).isEqualTo("C");
        assertThat(service.effectiveVariant(shrunk, variant, Set.of("A", "B"))).isEmpty();
    }

    @Test
    public void assignShouldKeepFirstWrittenVariant() {
        // given
        StickyAssignmentService service = new StickyAssignmentService(new ExperimentAssigner(), mirror,
            VariantFallbackPolicy.CONTROL_VARIANT);
        given(mirror.find("exp-1", "v1")).willReturn(Optional.empty());
        given(mirror.putIfAbsent(eq("exp-1"), eq("v1"), anyString())).willReturn("B");

        // when
        String variant = service.assign(experiment, visitor("v1", null));

        // then
        assertThat(variant).isEqualTo("B");
    }

    @Test
    public void assignShouldFallBackToComputedVariantWhenMirrorFails() {
        // given
        StickyAssignmentService service = new StickyAssignmentService(new ExperimentAssigner(), mirror,
            VariantFallbackPolicy.CONTROL_VARIANT);
        given(mirror.find("exp-1", "v1")).willThrow(new TransientStoreException("down"));
        given(mirror.putIfAbsent(eq("exp-1"), eq("v1"), anyString())).willThrow(new TransientStoreException("down"));

        // when
        String variant = service.assign(experiment, visitor("v1", null));

        // then
        assertThat(variant).isEqualTo(new ExperimentAssigner().assign(experiment, "v1"));
    }

    @Test
    public void assignShouldComputeWithoutMirror() {
        // given
        StickyAssignmentService service = new StickyAssignmentService(new ExperimentAssigner(), null, null);

        // when
        String variant = service.assign(experiment, visitor("v1", Map.of()));

        // then
        assertThat(variant).isEqualTo(new ExperimentAssigner().assign(experiment, "v1"));
        assertThat(service.getFallbackPolicy()).isEqualTo(VariantFallbackPolicy.CONTROL_VARIANT);
    }

    @Test
    public void allocationChangeShouldNotMoveAssignedVisitor() {
        // given
        InMemoryExperimentAssignmentStore store = new InMemoryExperimentAssignmentStore(
            MutableClock.at("2026-03-10T12:00:00Z"), Duration.ofDays(90), 1000);
        StickyAssignmentService service = new StickyAssignmentService(new ExperimentAssigner(), store,
            VariantFallbackPolicy.CONTROL_VARIANT);
        String before = service.assign(experiment(Map.of("A", 100, "B", 0), "A", "B"), visitor("v1", null));

        // when
        String after = service.assign(experiment(Map.of("A", 0, "B", 100), "A", "B"), visitor("v1", null));

        // then
        assertThat(before).isEqualTo("A");
        assertThat(after).isEqualTo("A");
    }

    @Test
    public void effectiveVariantShouldKeepAssignedVariantWhileActive() {
        // given
        StickyAssignmentService service = new StickyAssignmentService(new ExperimentAssigner(), null,
            VariantFallbackPolicy.CONTROL_VARIANT);

        // when and then
        assertThat(service.effectiveVariant(experiment, "B", Set.of("A", "B"))).contains("B");
    }

    @Test
    public void effectiveVariantShouldFallBackToActiveControl() {
        // given
        StickyAssignmentService service = new StickyAssignmentService(new ExperimentAssigner(), null,
            VariantFallbackPolicy.CONTROL_VARIANT);

        // when and then
        assertThat(service.effectiveVariant(experiment, "B", Set.of("A"))).contains("A");
        assertThat(service.effectiveVariant(experiment, "B", Set.of())).isEmpty();
    }

    @Test
    public void effectiveVariantShouldExcludeVisitorUnderExcludePolicy() {
        // given
        StickyAssignmentService service = new StickyAssignmentService(new ExperimentAssigner(), null,
            VariantFallbackPolicy.EXCLUDE);

        // when and then
        assertThat(service.effectiveVariant(experiment, "B", Set.of("A"))).isEmpty();
    }

    @Test
    public void effectiveVariantShouldNeverSubstituteAnotherTreatment() {
        // given
        Experiment threeWay = experiment(Map.of("A", 34, "B", 33, "C", 33), "A", "B", "C");
        StickyAssignmentService service = new StickyAssignmentService(new ExperimentAssigner(), null,
            VariantFallbackPolicy.CONTROL_VARIANT);

        // when and then
        assertThat(service.effectiveVariant(threeWay, "B", Set.of("C"))).isEmpty();
    }

    private static VisitorContext visitor(String visitorId, Map<String, String> assignments) {
        return VisitorContext.builder()
            .visitorId(visitorId)
            .sessionId("s1")
            .assignments(assignments)
            .build();
    }
}
