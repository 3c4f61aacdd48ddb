package com.narraflow.narraflow_backend.controller;

import com.narraflow.narraflow_backend.collab.CollaborationService;
import com.narraflow.narraflow_backend.controller.advice.GlobalExceptionHandler;
import com.narraflow.narraflow_backend.exception.FlowGraphException;
import com.narraflow.narraflow_backend.model.collab.FlowSnapshot;
import com.narraflow.narraflow_backend.model.collab.SessionUser;
import com.narraflow.narraflow_backend.model.dto.ApiError;
import com.narraflow.narraflow_backend.model.dto.CursorMessage;
import com.narraflow.narraflow_backend.model.dto.JoinRequest;
import com.narraflow.narraflow_backend.model.dto.LockMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.*;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

import java.util.Map;
import java.util.UUID;

/**
 * Realtime channel of the flow editor. The STOMP session id identifies the editing session.
 * Failures are reported to the sender only, on {@code /user/queue/errors}.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class FlowSessionSocketController {

    private final CollaborationService collaborationService;

    @MessageMapping("/flows/{flowId}/join")
    @SendToUser(value = "/queue/snapshot", broadcast = false)
    public FlowSnapshot join(@DestinationVariable UUID flowId,
                             @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId,
                             @Payload(required = false) JoinRequest request) {
        SessionUser user = request == null
                ? SessionUser.of(null, null, null)
                : SessionUser.of(request.userId(), request.displayName(), request.color());
        return collaborationService.join(flowId, sessionId, user);
    }

    @MessageMapping("/flows/{flowId}/leave")
    public void leave(@DestinationVariable UUID flowId,
                      @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        collaborationService.leave(flowId, sessionId);
    }

    @MessageMapping("/flows/{flowId}/cursor")
    public void cursor(@DestinationVariable UUID flowId,
                       @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId,
                       @Payload CursorMessage cursor) {
        collaborationService.moveCursor(flowId, sessionId, cursor.x(), cursor.y());
    }

    @MessageMapping("/flows/{flowId}/lock")
    public void lock(@DestinationVariable UUID flowId,
                     @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId,
                     @Payload LockMessage message) {
        collaborationService.acquireLock(flowId, message.nodeId(), sessionId);
    }

    @MessageMapping("/flows/{flowId}/heartbeat")
    public void heartbeat(@DestinationVariable UUID flowId,
                          @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId,
                          @Payload(required = false) LockMessage message) {
        if (message == null || message.nodeId() == null) {
            collaborationService.ping(flowId, sessionId);
        } else if (!collaborationService.heartbeat(flowId, message.nodeId(), sessionId)) {
            log.debug("Ignored heartbeat from {} for node {} it does not hold", sessionId, message.nodeId());
        }
    }

    @MessageMapping("/flows/{flowId}/unlock")
    public void unlock(@DestinationVariable UUID flowId,
                       @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId,
                       @Payload LockMessage message) {
        collaborationService.releaseLock(flowId, message.nodeId(), sessionId);
    }

    @MessageMapping("/flows/{flowId}/nodes/{nodeId}/payload")
    public void updatePayload(@DestinationVariable UUID flowId,
                              @DestinationVariable UUID nodeId,
                              @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId,
                              @Payload Map<String, Object> payload) {
        collaborationService.updateNodePayload(flowId, nodeId, sessionId, payload);
    }

    @MessageExceptionHandler(FlowGraphException.class)
    @SendToUser(value = "/queue/errors", broadcast = false)
    public ApiError handleFlowGraphException(FlowGraphException ex) {
        log.warn("Realtime request failed: {} [{}]", ex.getMessage(), ex.getErrorCode());
        return GlobalExceptionHandler.toApiError(ex);
    }

    @MessageExceptionHandler(IllegalArgumentException.class)
    @SendToUser(value = "/queue/errors", broadcast = false)
    public ApiError handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Realtime request rejected: {}", ex.getMessage());
        return ApiError.of(ex.getMessage(), "INVALID_ARGUMENT");
    }
}
