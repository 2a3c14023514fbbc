package com.flairbit.calls.service.recording;

import com.flairbit.calls.models.MediaFormat;
import com.flairbit.calls.models.Recording;
import com.flairbit.calls.models.RecordingConsent;
import com.flairbit.calls.models.RecordingSegment;
import com.flairbit.calls.security.Actor;

import java.util.List;
import java.util.UUID;

public interface RecordingService {

    Recording start(UUID callId, UUID initiatorId, MediaFormat format);

    Recording pause(UUID recordingId, Actor actor);

    Recording resume(UUID recordingId, Actor actor);

    Recording stop(UUID recordingId, Actor actor);

    Recording getRecordingStatus(UUID recordingId);

    List<RecordingSegment> listSegments(UUID recordingId);

    Recording findByCall(UUID callId);

    /**
     * Appends the participant's answer to the call's consent trail. Withdrawing consent while
     * the call is being recorded stops the recording.
     */
    RecordingConsent recordConsent(UUID callId, Actor actor, boolean given, String sourceAddress);

    List<RecordingConsent> consentHistory(UUID callId, Actor actor);
}
