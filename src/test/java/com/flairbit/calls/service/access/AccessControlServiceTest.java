package com.flairbit.calls.service.access;

import com.flairbit.calls.exceptions.BadRequestException;
import com.flairbit.calls.exceptions.NotFoundException;
import com.flairbit.calls.exceptions.StorageUnavailableException;
import com.flairbit.calls.exceptions.UnauthorizedException;
import com.flairbit.calls.models.AccessAction;
import com.flairbit.calls.models.AccessGrant;
import com.flairbit.calls.models.AccessLogEntry;
import com.flairbit.calls.models.AccessPermission;
import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.models.MediaFormat;
import com.flairbit.calls.models.Recording;
import com.flairbit.calls.models.RecordingSegment;
import com.flairbit.calls.repo.AccessLogJDBCRepository;
import com.flairbit.calls.security.Actor;
import com.flairbit.calls.support.CallsFixture;
import com.flairbit.calls.support.FakeMediaCapture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AccessControlServiceTest {

    private static final String ADDR = "10.0.0.7";

    private CallsFixture f;
    private AccessControlService service;
    private Recording recording;
    private final Actor admin = Actor.admin(UUID.randomUUID());
    private final Actor outsider = Actor.user(UUID.randomUUID());

    @BeforeEach
    void setUp() {
        f = new CallsFixture();
        service = f.accessControl;
        CallSession session = f.recordableCall();
        Recording started = f.recordingService.start(session.getId(), f.alice, MediaFormat.AUDIO);
        f.clock.advanceSeconds(30);
        recording = f.recordingService.stop(started.getId(), Actor.user(f.alice));
    }

    @AfterEach
    void tearDown() {
        f.close();
    }

    private List<AccessLogEntry> log() {
        return f.accessLogRepo.findByRecording(recording.getId(), 100);
    }

    @Test
    void participantsAndAdminsAreAllowed() {
        AccessLogEntry participant = service.authorize(recording.getId(), Actor.user(f.bob), AccessAction.DOWNLOAD, ADDR);
        AccessLogEntry byAdmin = service.authorize(recording.getId(), admin, AccessAction.VIEW, ADDR);

        assertThat(participant.isAllowed()).isTrue();
        assertThat(participant.getReason()).isEqualTo(AccessControlService.REASON_PARTICIPANT);
        assertThat(byAdmin.getReason()).isEqualTo(AccessControlService.REASON_ADMIN);
        assertThat(log()).hasSize(2).allMatch(AccessLogEntry::isAllowed);
    }

    @Test
    void outsiderIsDeniedAndTheDenialIsAudited() {
        assertThatThrownBy(() -> service.authorize(recording.getId(), outsider, AccessAction.VIEW, ADDR))
                .isInstanceOf(UnauthorizedException.class);

        assertThat(log()).singleElement().satisfies(e -> {
            assertThat(e.isAllowed()).isFalse();
            assertThat(e.getAccessorId()).isEqualTo(outsider.getId());
            assertThat(e.getReason()).isEqualTo(AccessControlService.REASON_NO_GRANT);
            assertThat(e.getSourceAddress()).isEqualTo(ADDR);
        });
    }

    @Test
    void viewGrantDoesNotAllowDownload() {
        service.grant(recording.getId(), outsider.getId(), AccessPermission.VIEW, null, admin);

        assertThat(service.authorize(recording.getId(), outsider, AccessAction.VIEW, ADDR).getReason())
                .isEqualTo(AccessControlService.REASON_GRANT);
        assertThatThrownBy(() -> service.authorize(recording.getId(), outsider, AccessAction.DOWNLOAD, ADDR))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void downloadGrantImpliesView() {
        service.grant(recording.getId(), outsider.getId(), AccessPermission.DOWNLOAD, null, admin);

        assertThat(service.authorize(recording.getId(), outsider, AccessAction.VIEW, ADDR).isAllowed()).isTrue();
        assertThat(service.authorize(recording.getId(), outsider, AccessAction.DOWNLOAD, ADDR).isAllowed()).isTrue();
    }

    @Test
    void expiredAndRevokedGrantsAreIgnored() {
        service.grant(recording.getId(), outsider.getId(), AccessPermission.VIEW,
                f.clock.instant().plus(Duration.ofHours(1)), admin);
        Actor other = Actor.user(UUID.randomUUID());
        AccessGrant revocable = service.grant(recording.getId(), other.getId(), AccessPermission.VIEW, null, admin);

        f.clock.advance(Duration.ofHours(2));
        service.revoke(revocable.getId(), admin);

        assertThatThrownBy(() -> service.authorize(recording.getId(), outsider, AccessAction.VIEW, ADDR))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> service.authorize(recording.getId(), other, AccessAction.VIEW, ADDR))
                .isInstanceOf(UnauthorizedException.class);
        assertThat(service.listGrants(recording.getId(), admin)).hasSize(2);
    }

    @Test
    void unknownRecordingIsNotFoundButStillAudited() {
        UUID missing = UUID.randomUUID();

        assertThatThrownBy(() -> service.authorize(missing, outsider, AccessAction.VIEW, ADDR))
                .isInstanceOf(NotFoundException.class);

        assertThat(f.accessLogRepo.findByRecording(missing, 10)).singleElement()
                .satisfies(e -> assertThat(e.getReason()).isEqualTo(AccessControlService.REASON_NOT_FOUND));
    }

    @Test
    void auditFailureDeniesAccess() {
        AccessLogJDBCRepository failing = mock(AccessLogJDBCRepository.class);
        when(failing.append(any())).thenThrow(new DataAccessResourceFailureException("disk full"));
        AccessControlService guarded = new AccessControlService(f.recordingRepo, f.segmentRepo, f.sessionRepo,
                f.grantRepo, failing, f.storage, f.cipher, f.locks, f.clock);

        assertThatThrownBy(() -> guarded.authorize(recording.getId(), Actor.user(f.alice), AccessAction.VIEW, ADDR))
                .isInstanceOf(StorageUnavailableException.class);
    }

    @Test
    void openSegmentReturnsDecryptedMedia() {
        byte[] media = service.openSegment(recording.getId(), 0, Actor.user(f.alice), ADDR);

        assertThat(media).isEqualTo(FakeMediaCapture.mediaFor(recording.getId(), 0));
        assertThat(log()).singleElement().satisfies(e -> assertThat(e.getAction()).isEqualTo(AccessAction.DOWNLOAD));
    }

    @Test
    void corruptedSegmentFailsIntegrityCheck() {
        RecordingSegment segment = f.segmentRepo.find(recording.getId(), 0).orElseThrow();
        f.storage.corrupt(segment.getStoragePath());

        assertThatThrownBy(() -> service.openSegment(recording.getId(), 0, Actor.user(f.alice), ADDR))
                .isInstanceOf(StorageUnavailableException.class);
    }

    @Test
    void accessibleRecordingsIncludeGrants() {
        assertThat(service.listAccessibleRecordings(f.bob)).extracting(Recording::getId).containsExactly(recording.getId());
        assertThat(service.listAccessibleRecordings(outsider.getId())).isEmpty();

        service.grant(recording.getId(), outsider.getId(), AccessPermission.VIEW, null, admin);

        assertThat(service.listAccessibleRecordings(outsider.getId())).extracting(Recording::getId).containsExactly(recording.getId());
    }

    @Test
    void onlyAdminsManageGrants() {
        assertThatThrownBy(() -> service.grant(recording.getId(), outsider.getId(), AccessPermission.VIEW, null, Actor.user(f.alice)))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> service.accessLog(recording.getId(), Actor.user(f.alice), 10))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void legalHoldIsAdminOnlyAndAudited() {
        assertThatThrownBy(() -> service.setLegalHold(recording.getId(), Actor.user(f.alice), true, "litigation", ADDR))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> service.setLegalHold(recording.getId(), admin, true, " ", ADDR))
                .isInstanceOf(BadRequestException.class);

        Recording held = service.setLegalHold(recording.getId(), admin, true, "case 2024-117", ADDR);
        assertThat(held.isLegalHold()).isTrue();
        assertThat(held.getLegalHoldReason()).isEqualTo("case 2024-117");

        Recording released = service.setLegalHold(recording.getId(), admin, false, null, ADDR);
        assertThat(released.isLegalHold()).isFalse();
        assertThat(released.getLegalHoldReason()).isNull();

        assertThat(log()).extracting(AccessLogEntry::getAction, AccessLogEntry::getAccessorId)
                .containsExactlyInAnyOrder(
                        tuple(AccessAction.LEGAL_HOLD, admin.getId()),
                        tuple(AccessAction.LEGAL_HOLD_RELEASED, admin.getId()));
    }

    @Test
    void repeatedHoldIsAuditedAsUnchanged() {
        service.setLegalHold(recording.getId(), admin, true, "case 2024-117", ADDR);
        service.setLegalHold(recording.getId(), admin, true, "case 2024-118", ADDR);

        assertThat(f.recordingRepo.findById(recording.getId()).orElseThrow().getLegalHoldReason()).isEqualTo("case 2024-117");
        assertThat(log()).extracting(AccessLogEntry::getReason)
                .containsExactlyInAnyOrder(AccessControlService.REASON_ADMIN, AccessControlService.REASON_HOLD_UNCHANGED);
    }

    @Test
    void legalHoldOnUnknownRecordingIsNotFound() {
        assertThatThrownBy(() -> service.setLegalHold(UUID.randomUUID(), admin, true, "case", ADDR))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void holdActionsCannotBeAuthorizedAsReads() {
        assertThatThrownBy(() -> service.authorize(recording.getId(), admin, AccessAction.LEGAL_HOLD, ADDR))
                .isInstanceOf(UnauthorizedException.class);
    }
}
