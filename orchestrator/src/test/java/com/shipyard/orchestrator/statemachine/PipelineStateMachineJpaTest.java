package com.shipyard.orchestrator.statemachine;

import com.shipyard.orchestrator.error.VersionConflictException;
import com.shipyard.orchestrator.model.Pipeline;
import com.shipyard.orchestrator.model.PipelineState;
import com.shipyard.orchestrator.model.StateTransitionRecord;
import com.shipyard.orchestrator.repository.StateTransitionRepository;
import com.shipyard.orchestrator.support.PersistenceTestConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PipelineStateMachine against the Flyway schema on H2.
 *
 * Runs without a surrounding test transaction so every call commits on its
 * own, as in production. Each test uses a fresh project id.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({PipelineStateMachine.class, TransitionRetrier.class, PersistenceTestConfig.class})
class PipelineStateMachineJpaTest {

    @Autowired PipelineStateMachine      stateMachine;
    @Autowired TransitionRetrier         retrier;
    @Autowired StateTransitionRepository transitionRepo;

    // ------------------------------------------------------------------
    // Versions and the audit log
    // ------------------------------------------------------------------

    @Test
    void transitions_bumpVersionByOneAndRecordIt() {
        Pipeline pipeline = start();
        long v1 = pipeline.versionOrZero();

        Pipeline after = stateMachine.transition(pipeline.getWorkflowId(), PipelineState.IMPLEMENTING,
                TransitionRequest.by("user:42").withExpectedVersion(v1));

        assertThat(after.versionOrZero()).isEqualTo(v1 + 1);
        List<StateTransitionRecord> log = transitionRepo.findByWorkflowIdOrderByIdAsc(pipeline.getWorkflowId());
        assertThat(log).extracting(StateTransitionRecord::getVersion).containsExactly(v1, v1 + 1);
        assertThat(log.get(1).getPreviousState()).isEqualTo(PipelineState.PLANNING);
    }

    @Test
    void staleExpectedVersion_rejectedAndLogUnchanged() {
        Pipeline pipeline = start();
        long stale = pipeline.versionOrZero();
        stateMachine.transition(pipeline.getWorkflowId(), PipelineState.IMPLEMENTING, TransitionRequest.by("a"));

        assertThatThrownBy(() -> stateMachine.transition(pipeline.getWorkflowId(), PipelineState.PAUSED,
                TransitionRequest.by("b").withExpectedVersion(stale)))
                .isInstanceOf(VersionConflictException.class);

        assertThat(stateMachine.getCurrentState(pipeline.getWorkflowId()).getState())
                .isEqualTo(PipelineState.IMPLEMENTING);
        assertThat(transitionRepo.findByWorkflowIdOrderByIdAsc(pipeline.getWorkflowId())).hasSize(2);
    }

    @Test
    void requestId_appliedOnce() {
        Pipeline pipeline = start();
        TransitionRequest request = new TransitionRequest("user:42", null, null, Map.of(), null, null, "req-7");

        stateMachine.transition(pipeline.getWorkflowId(), PipelineState.IMPLEMENTING, request);
        Pipeline again = stateMachine.transition(pipeline.getWorkflowId(), PipelineState.IMPLEMENTING, request);

        assertThat(again.getState()).isEqualTo(PipelineState.IMPLEMENTING);
        assertThat(transitionRepo.findByWorkflowIdOrderByIdAsc(pipeline.getWorkflowId())).hasSize(2);
    }

    // ------------------------------------------------------------------
    // getHistory()
    // ------------------------------------------------------------------

    @Test
    void getHistory_pagesNewestFirstWithoutGapsOrDuplicates() {
        Pipeline pipeline = start();
        UUID id = pipeline.getWorkflowId();
        stateMachine.transition(id, PipelineState.IMPLEMENTING, TransitionRequest.by("a"));
        stateMachine.pause(id, "a", "lunch");
        stateMachine.resume(id, "a");
        stateMachine.transition(id, PipelineState.QA, TransitionRequest.by("a"));

        HistoryPage<StateTransitionRecord> first = stateMachine.getHistory(id, 2, null);
        HistoryPage<StateTransitionRecord> second = stateMachine.getHistory(id, 2, first.nextCursor());
        HistoryPage<StateTransitionRecord> third = stateMachine.getHistory(id, 2, second.nextCursor());

        assertThat(first.items()).extracting(StateTransitionRecord::getNewState)
                .containsExactly(PipelineState.QA, PipelineState.IMPLEMENTING);
        assertThat(second.items()).extracting(StateTransitionRecord::getNewState)
                .containsExactly(PipelineState.PAUSED, PipelineState.IMPLEMENTING);
        assertThat(third.items()).extracting(StateTransitionRecord::getNewState)
                .containsExactly(PipelineState.PLANNING);
        assertThat(third.nextCursor()).isNull();
    }

    @Test
    void getHistory_shortPage_hasNoCursor() {
        Pipeline pipeline = start();

        HistoryPage<StateTransitionRecord> page = stateMachine.getHistory(pipeline.getWorkflowId(), 1000, null);

        assertThat(page.items()).hasSize(1);
        assertThat(page.nextCursor()).isNull();
    }

    // ------------------------------------------------------------------
    // replay()
    // ------------------------------------------------------------------

    @Test
    void replay_matchesLivePipeline() {
        Pipeline pipeline = start();
        UUID id = pipeline.getWorkflowId();
        stateMachine.transition(id, PipelineState.IMPLEMENTING, TransitionRequest.by("a").withAgent("dev-agent", "story-1"));
        stateMachine.transition(id, PipelineState.QA, TransitionRequest.by("a").withAgent("qa-agent", null));
        stateMachine.pause(id, "a", null);

        PipelineView view = stateMachine.replay(id);
        Pipeline live = stateMachine.getCurrentState(id);

        assertThat(view.matches(live)).isTrue();
        assertThat(view.pausedFrom()).isEqualTo(PipelineState.QA);
        assertThat(view.currentStoryId()).isEqualTo("story-1");
        assertThat(view.currentAgentId()).isEqualTo("qa-agent");
    }

    @Test
    void countTransitions_countsEdgePerStory() {
        Pipeline pipeline = start();
        UUID id = pipeline.getWorkflowId();
        stateMachine.transition(id, PipelineState.IMPLEMENTING, TransitionRequest.by("a").withAgent("dev-agent", "story-1"));
        stateMachine.transition(id, PipelineState.QA, TransitionRequest.by("a"));
        stateMachine.transition(id, PipelineState.IMPLEMENTING, TransitionRequest.by("a"));
        stateMachine.transition(id, PipelineState.QA, TransitionRequest.by("a"));
        stateMachine.transition(id, PipelineState.IMPLEMENTING, TransitionRequest.by("a").withAgent("dev-agent", "story-2"));

        assertThat(stateMachine.countTransitions(id, "story-1", PipelineState.QA, PipelineState.IMPLEMENTING)).isEqualTo(1);
        assertThat(stateMachine.countTransitions(id, "story-2", PipelineState.QA, PipelineState.IMPLEMENTING)).isEqualTo(1);
        assertThat(stateMachine.countTransitions(id, "story-3", PipelineState.QA, PipelineState.IMPLEMENTING)).isZero();
    }

    // ------------------------------------------------------------------
    // Concurrent writers
    // ------------------------------------------------------------------

    @Test
    void concurrentTogglers_noLostUpdates() throws Exception {
        Pipeline pipeline = start();
        UUID id = pipeline.getWorkflowId();
        long startVersion = pipeline.versionOrZero();
        int threads = 4;
        int togglesEach = 5;

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger escapedConflicts = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(pool.submit(() -> {
                go.await();
                int done = 0;
                while (done < togglesEach) {
                    try {
                        retrier.transition(id,
                                p -> Optional.of(p.getState() == PipelineState.PAUSED
                                        ? PipelineState.PLANNING
                                        : PipelineState.PAUSED),
                                TransitionRequest.by("toggler"));
                        done++;
                    } catch (VersionConflictException e) {
                        escapedConflicts.incrementAndGet();
                    }
                }
                return null;
            }));
        }
        go.countDown();
        for (Future<?> f : futures) {
            f.get(60, TimeUnit.SECONDS);
        }
        pool.shutdown();

        int total = threads * togglesEach;
        Pipeline live = stateMachine.getCurrentState(id);
        List<StateTransitionRecord> log = transitionRepo.findByWorkflowIdOrderByIdAsc(id);

        assertThat(live.versionOrZero()).isEqualTo(startVersion + total);
        assertThat(log).hasSize(total + 1);
        assertThat(log).extracting(StateTransitionRecord::getVersion)
                .containsExactlyElementsOf(LongStream.rangeClosed(startVersion, startVersion + total).boxed().toList());
        assertThat(live.getState()).isEqualTo(total % 2 == 0 ? PipelineState.PLANNING : PipelineState.PAUSED);
        assertThat(stateMachine.replay(id).matches(live)).isTrue();
    }

    private Pipeline start() {
        return stateMachine.start("proj-" + UUID.randomUUID(), "ws-1", "user:42", null);
    }
}
