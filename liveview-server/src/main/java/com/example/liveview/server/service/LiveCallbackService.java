package com.example.liveview.server.service;

import com.example.liveview.server.config.MonitoringConfig.LiveViewMetrics;
import com.example.liveview.shared.context.LiveContext;
import com.example.liveview.shared.exception.MalformedFrameException;
import com.example.liveview.shared.model.CallbackInvocation;
import com.example.liveview.shared.model.CallbackOutcome;
import com.example.liveview.shared.util.CallbackFrameCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class LiveCallbackService {

    private final CallbackFrameCodec callbackFrameCodec;
    private final LiveViewMetrics liveViewMetrics;

    /**
     * Handles a frame received over a persistent connection. A malformed frame is logged and
     * ignored, the connection stays open.
     */
    public Optional<CallbackOutcome> dispatchFrame(LiveContext context, String frame) {
        CallbackInvocation invocation;
        try {
            invocation = callbackFrameCodec.parseFrame(frame);
        } catch (MalformedFrameException e) {
            liveViewMetrics.malformedFrame();
            log.warn("Ignoring malformed callback frame '{}' for context {}: {}", e.getFrame(), context.getId(), e.getMessage());
            return Optional.empty();
        }
        return Optional.of(dispatch(context, invocation));
    }

    /**
     * Handles a one-shot POST body. Throws {@link MalformedFrameException} for undecodable bodies.
     */
    public CallbackOutcome dispatchBody(LiveContext context, String body) {
        try {
            return dispatch(context, callbackFrameCodec.parseBody(body));
        } catch (MalformedFrameException e) {
            liveViewMetrics.malformedFrame();
            throw e;
        }
    }

    private CallbackOutcome dispatch(LiveContext context, CallbackInvocation invocation) {
        log.debug("Invoking callback {} with {} args in context {}", invocation.callbackId(), invocation.args().size(), context.getId());
        CallbackOutcome outcome = context.dispatchCallback(invocation.callbackId(), invocation.args());
        liveViewMetrics.callbackDispatched(outcome);
        return outcome;
    }
}
