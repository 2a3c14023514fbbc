package com.flairbit.calls.listener;

import com.flairbit.calls.config.RabbitConfig;
import com.flairbit.calls.dto.CreateCallRequest;
import com.flairbit.calls.exceptions.InvalidParticipantsException;
import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.service.calls.CallSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Creates call sessions requested by the booking and emergency subsystems. Requests that can
 * never succeed are rejected without requeue.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CallRequestListener {

    private final CallSessionService callSessionService;

    @RabbitListener(queues = RabbitConfig.CALL_REQUEST_QUEUE)
    public void onCallRequest(CreateCallRequest request) {
        if (Objects.isNull(request.getInitiatorId())) {
            throw new AmqpRejectAndDontRequeueException("Call request without initiator");
        }
        try {
            CallSession session = callSessionService.create(request.getInitiatorId(), request.getCounterpartId(),
                    request.getCallType(), request.getMode(), request.getContext());
            log.info("Created {} call {} from queued request", session.getCallType().getValue(), session.getId());
        } catch (InvalidParticipantsException e) {
            log.warn("Rejected call request {} -> {}: {}", request.getInitiatorId(), request.getCounterpartId(), e.getMessage());
            throw new AmqpRejectAndDontRequeueException(e.getMessage(), e);
        }
    }
}
