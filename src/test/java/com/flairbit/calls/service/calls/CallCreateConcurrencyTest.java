package com.flairbit.calls.service.calls;

import com.flairbit.calls.exceptions.InvalidParticipantsException;
import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.models.CallStatus;
import com.flairbit.calls.repo.CallSessionJDBCRepository;
import com.flairbit.calls.service.SessionLocks;
import com.flairbit.calls.support.CallsFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

/**
 * One open call per initiator, with creates running in transactions on several threads.
 */
class CallCreateConcurrencyTest {

    private CallsFixture f;
    private final ExecutorService callers = Executors.newFixedThreadPool(8);

    @BeforeEach
    void setUp() {
        f = CallsFixture.transactional();
    }

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
        f.close();
    }

    @Test
    void secondCreateWaitsForFirstToCommitAndIsRejected() throws Exception {
        CountDownLatch created = new CountDownLatch(1);
        CountDownLatch commit = new CountDownLatch(1);

        CompletableFuture<CallSession> first = CompletableFuture.supplyAsync(() -> f.transactionTemplate().execute(status -> {
            CallSession session = f.calls.create(f.alice, f.bob, null, null, "first");
            created.countDown();
            await(commit);
            return session;
        }), callers);
        assertThat(created.await(5, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<CallSession> second = CompletableFuture.supplyAsync(
                () -> f.calls.create(f.alice, UUID.randomUUID(), null, null, "second"), callers);
        Thread.sleep(200);
        assertThat(second).isNotDone();

        commit.countDown();
        CallSession session = first.get(5, TimeUnit.SECONDS);
        assertThatThrownBy(() -> second.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(InvalidParticipantsException.class);

        assertThat(openCallsOf(f.alice)).extracting(CallSession::getId).containsExactly(session.getId());
    }

    @Test
    void simultaneousCreatesLeaveOneOpenCall() throws Exception {
        int attempts = 8;
        CountDownLatch go = new CountDownLatch(1);
        List<CompletableFuture<CallSession>> results = new ArrayList<>();
        for (int i = 0; i < attempts; i++) {
            results.add(CompletableFuture.supplyAsync(() -> {
                await(go);
                return f.calls.create(f.alice, UUID.randomUUID(), null, null, null);
            }, callers));
        }
        go.countDown();

        int succeeded = 0;
        int rejected = 0;
        for (CompletableFuture<CallSession> result : results) {
            try {
                result.get(10, TimeUnit.SECONDS);
                succeeded++;
            } catch (ExecutionException e) {
                assertThat(e.getCause()).isInstanceOf(InvalidParticipantsException.class);
                rejected++;
            }
        }

        assertThat(succeeded).isEqualTo(1);
        assertThat(rejected).isEqualTo(attempts - 1);
        assertThat(openCallsOf(f.alice)).hasSize(1);
    }

    @Test
    void uniqueActiveInitiatorRejectsCreateThatMissedTheCheck() {
        CallSession open = f.newCall();
        CallSessionJDBCRepository blind = spy(f.sessionRepo);
        doReturn(false).when(blind).hasActiveSession(any(UUID.class));
        // a second node: its own locks, and an existence check that cannot see the open call
        CallSessionServiceImp otherNode = new CallSessionServiceImp(blind, f.relay, f.participantService,
                f.events, f.settings, f.properties, new SessionLocks(), List.of(), f.clock);

        assertThatThrownBy(() -> otherNode.create(f.alice, UUID.randomUUID(), null, null, null))
                .isInstanceOf(InvalidParticipantsException.class)
                .hasMessageContaining("already has an active call");
        assertThat(openCallsOf(f.alice)).hasSize(1);

        f.calls.end(open.getId(), "hangup");
        CallSession next = otherNode.create(f.alice, UUID.randomUUID(), null, null, null);

        assertThat(next.getStatus()).isEqualTo(CallStatus.INITIATED);
        assertThat(openCallsOf(f.alice)).extracting(CallSession::getId).containsExactly(next.getId());
    }

    private List<CallSession> openCallsOf(UUID initiator) {
        return f.sessionRepo.findActive().stream()
                .filter(s -> s.getInitiatorId().equals(initiator))
                .toList();
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new CompletionException(new IllegalStateException("latch timed out"));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        }
    }
}
