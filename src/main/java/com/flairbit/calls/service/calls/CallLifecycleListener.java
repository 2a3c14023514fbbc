package com.flairbit.calls.service.calls;

import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.models.CallStatus;

/**
 * In-process hook invoked after a session transition is persisted, while the per-call
 * lock is still held.
 */
public interface CallLifecycleListener {

    void onTransition(CallSession session, CallStatus from, CallStatus to);
}
